package io.github.hotbrkm.campaignengine.server.persistence;

import io.github.hotbrkm.campaignengine.agent.email.send.result.PendingSend;
import io.github.hotbrkm.campaignengine.agent.email.send.result.ResultPersistenceException;
import io.github.hotbrkm.campaignengine.agent.email.send.result.SendRecordStore;
import io.github.hotbrkm.campaignengine.agent.email.send.result.SendStatus;
import io.github.hotbrkm.campaignengine.server.persistence.entity.SendRecordEntity;
import io.github.hotbrkm.campaignengine.server.persistence.repository.SendRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Send records in {@code send_records}. Every failure, including finalizing an unknown or already final record,
 * surfaces as {@link ResultPersistenceException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSendRecordStore implements SendRecordStore {

    static final int MAX_ERROR_LENGTH = 1000;

    private final SendRecordRepository sendRecordRepository;

    @Override
    @Transactional
    public void createPending(PendingSend pendingSend) {
        SendRecordEntity entity = SendRecordEntity.builder()
                .trackingId(pendingSend.trackingId())
                .campaignId(pendingSend.campaignId())
                .subscriberId(pendingSend.subscriberId())
                .recipientEmail(pendingSend.recipientEmail())
                .messageId(pendingSend.messageId())
                .subject(pendingSend.subject())
                .htmlContent(pendingSend.html())
                .textContent(pendingSend.text())
                .status(SendStatus.PENDING)
                .createdAt(pendingSend.createdAt())
                .build();
        try {
            sendRecordRepository.saveAndFlush(entity);
        } catch (DataAccessException e) {
            throw new ResultPersistenceException("Failed to create send record: trackingId=" + pendingSend.trackingId(), e);
        }
    }

    @Override
    @Transactional
    public void markSent(String trackingId, String serverName, int retryCount, Instant sentAt) {
        finalizeRecord(trackingId, SendStatus.SENT, serverName, retryCount, sentAt, null);
    }

    @Override
    @Transactional
    public void markFailed(String trackingId, String serverName, int retryCount, String errorMessage) {
        finalizeRecord(trackingId, SendStatus.FAILED, serverName, retryCount, null, truncate(errorMessage));
    }

    private void finalizeRecord(String trackingId, SendStatus status, String serverName, int retryCount,
                                Instant sentAt, String errorMessage) {
        int updated;
        try {
            updated = sendRecordRepository.finalizePending(trackingId, status, serverName, retryCount, sentAt,
                    errorMessage, SendStatus.PENDING);
        } catch (DataAccessException e) {
            throw new ResultPersistenceException("Failed to mark send record " + status + ": trackingId=" + trackingId, e);
        }
        if (updated == 0) {
            throw new ResultPersistenceException("No pending send record: trackingId=" + trackingId);
        }
        log.debug("trackingId={}, status={}, server={}, event=send_record_finalized", trackingId, status, serverName);
    }

    static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
