package io.github.hotbrkm.campaignengine.agent.email.send.engine;

import io.github.hotbrkm.campaignengine.agent.email.send.server.SmtpServer;
import lombok.Getter;

import java.util.Objects;

/**
 * Mutable progress of one recipient through {@link DeliveryState}. Confined to the dispatching thread.
 */
@Getter
public class RecipientDelivery {

    private final String trackingId;
    private DeliveryState state = DeliveryState.PENDING;
    private int attempts;
    private SmtpServer lastServer;
    private String lastError;

    public RecipientDelivery(String trackingId) {
        this.trackingId = Objects.requireNonNull(trackingId, "trackingId must not be null");
    }

    /**
     * @throws IllegalStateException when the transition is not allowed from the current state
     */
    public void transitionTo(DeliveryState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal delivery transition " + state + " -> " + next
                    + " for trackingId=" + trackingId);
        }
        state = next;
    }

    /**
     * Enters SENDING for a new attempt on the given server.
     */
    public void beginAttempt(SmtpServer server) {
        transitionTo(DeliveryState.SENDING);
        attempts++;
        lastServer = server;
    }

    public void recordError(String error) {
        this.lastError = error;
    }

    /**
     * Retries performed so far, i.e. attempts beyond the first.
     */
    public int retryCount() {
        return Math.max(0, attempts - 1);
    }

    public String lastServerName() {
        return lastServer == null ? null : lastServer.name();
    }
}
