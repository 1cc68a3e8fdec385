package io.github.hotbrkm.campaignengine.agent.email.send.engine;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-recipient delivery states. SENDING may repeat for each retry; SENT and FAILED are terminal.
 */
public enum DeliveryState {
    PENDING,
    COMPOSING,
    AUTHENTICATING,
    SENDING,
    SENT,
    FAILED;

    public boolean canTransitionTo(DeliveryState next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == SENT || this == FAILED;
    }

    private Set<DeliveryState> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(COMPOSING);
            case COMPOSING -> EnumSet.of(AUTHENTICATING, FAILED);
            case AUTHENTICATING -> EnumSet.of(SENDING, FAILED);
            case SENDING -> EnumSet.of(SENDING, SENT, FAILED);
            case SENT, FAILED -> EnumSet.noneOf(DeliveryState.class);
        };
    }
}
