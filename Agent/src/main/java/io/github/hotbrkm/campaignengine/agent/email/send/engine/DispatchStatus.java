package io.github.hotbrkm.campaignengine.agent.email.send.engine;

public enum DispatchStatus {
    SENT,
    FAILED,
    /**
     * Recipient failed validation; nothing was persisted or sent.
     */
    REJECTED,
    /**
     * Not attempted because the run was interrupted.
     */
    SKIPPED
}
