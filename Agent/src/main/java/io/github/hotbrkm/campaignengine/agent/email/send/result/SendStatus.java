package io.github.hotbrkm.campaignengine.agent.email.send.result;

/**
 * Lifecycle of a persisted send record. DELIVERED and BOUNCED are set by feedback processing outside the engine.
 */
public enum SendStatus {
    PENDING,
    SENT,
    DELIVERED,
    BOUNCED,
    FAILED
}
