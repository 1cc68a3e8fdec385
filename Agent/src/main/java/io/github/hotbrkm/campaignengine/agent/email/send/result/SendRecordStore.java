package io.github.hotbrkm.campaignengine.agent.email.send.result;

import java.time.Instant;

/**
 * Persistence of send records. Implementations throw {@link ResultPersistenceException} when a write fails.
 */
public interface SendRecordStore {

    void createPending(PendingSend pendingSend);

    void markSent(String trackingId, String serverName, int retryCount, Instant sentAt);

    void markFailed(String trackingId, String serverName, int retryCount, String errorMessage);
}
