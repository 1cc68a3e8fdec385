package io.github.hotbrkm.campaignengine.server.persistence.repository;

import io.github.hotbrkm.campaignengine.agent.email.send.result.SendStatus;
import io.github.hotbrkm.campaignengine.server.persistence.entity.SendRecordEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SendRecordRepository extends JpaRepository<SendRecordEntity, Long> {

    Optional<SendRecordEntity> findByTrackingId(String trackingId);

    boolean existsByTrackingId(String trackingId);

    /**
     * Serializes concurrent tracking hits on one send for the rest of the transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SendRecordEntity s WHERE s.trackingId = :trackingId")
    Optional<SendRecordEntity> findByTrackingIdWithLock(@Param("trackingId") String trackingId);

    /**
     * Finalizes a PENDING record. Returns 0 when the record is unknown or already final.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SendRecordEntity s SET s.status = :status, s.smtpServer = :smtpServer, " +
            "s.retryCount = :retryCount, s.sentAt = :sentAt, s.errorMessage = :errorMessage " +
            "WHERE s.trackingId = :trackingId AND s.status = :pending")
    int finalizePending(@Param("trackingId") String trackingId,
                        @Param("status") SendStatus status,
                        @Param("smtpServer") String smtpServer,
                        @Param("retryCount") int retryCount,
                        @Param("sentAt") Instant sentAt,
                        @Param("errorMessage") String errorMessage,
                        @Param("pending") SendStatus pending);

    long countByCampaignIdAndStatus(Long campaignId, SendStatus status);

    long countByStatus(SendStatus status);

    /**
     * Rows of {@code [smtpServer, status, count, averageRetries]} for records that reached a relay.
     */
    @Query("SELECT s.smtpServer, s.status, COUNT(s), AVG(s.retryCount) FROM SendRecordEntity s " +
            "WHERE s.smtpServer IS NOT NULL AND s.status IN :statuses GROUP BY s.smtpServer, s.status")
    List<Object[]> countByServerAndStatus(@Param("statuses") Collection<SendStatus> statuses);

    /**
     * Rows of {@code [recipientEmail, status, count]}.
     */
    @Query("SELECT s.recipientEmail, s.status, COUNT(s) FROM SendRecordEntity s " +
            "WHERE s.status IN :statuses GROUP BY s.recipientEmail, s.status")
    List<Object[]> countByRecipientAndStatus(@Param("statuses") Collection<SendStatus> statuses);
}
