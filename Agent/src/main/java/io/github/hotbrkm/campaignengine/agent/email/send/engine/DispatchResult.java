package io.github.hotbrkm.campaignengine.agent.email.send.engine;

import io.github.hotbrkm.campaignengine.agent.email.content.RecipientProfile;

/**
 * Outcome for one recipient. {@code trackingId} is null for rejected and skipped recipients.
 */
public record DispatchResult(Long recipientId, String email, DispatchStatus status, String trackingId, String error) {

    static DispatchResult sent(RecipientProfile recipient, String trackingId) {
        return new DispatchResult(recipient.subscriberId(), recipient.email(), DispatchStatus.SENT, trackingId, null);
    }

    static DispatchResult failed(RecipientProfile recipient, String trackingId, String error) {
        return new DispatchResult(recipient.subscriberId(), recipient.email(), DispatchStatus.FAILED, trackingId, error);
    }

    static DispatchResult rejected(RecipientProfile recipient, String error) {
        return new DispatchResult(recipient.subscriberId(), recipient.email(), DispatchStatus.REJECTED, null, error);
    }

    static DispatchResult skipped(RecipientProfile recipient) {
        return new DispatchResult(recipient.subscriberId(), recipient.email(), DispatchStatus.SKIPPED, null, null);
    }
}
