package io.github.hotbrkm.campaignengine.server.persistence.repository;

import io.github.hotbrkm.campaignengine.server.persistence.entity.OpenEventEntity;
import org.jspecify.annotations.Nullable;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OpenEventRepository extends JpaRepository<OpenEventEntity, Long> {

    boolean existsBySendRecordIdAndIpAddress(Long sendRecordId, String ipAddress);

    long countByCampaignId(Long campaignId);

    long countBySendRecordId(Long sendRecordId);

    @Query("SELECT MIN(o.openedAt) FROM OpenEventEntity o WHERE o.sendRecordId = :sendRecordId")
    @Nullable Instant findFirstOpenedAt(@Param("sendRecordId") Long sendRecordId);

    @Query("SELECT COUNT(DISTINCT o.subscriberId) FROM OpenEventEntity o WHERE o.campaignId = :campaignId")
    long countDistinctSubscribers(@Param("campaignId") Long campaignId);

    @Query("SELECT o.openedAt FROM OpenEventEntity o WHERE o.campaignId = :campaignId")
    List<Instant> findOpenTimes(@Param("campaignId") Long campaignId);

    @Query("SELECT o.openedAt FROM OpenEventEntity o WHERE o.openedAt >= :since")
    List<Instant> findOpenTimesSince(@Param("since") Instant since);

    /**
     * Rows of {@code [openedAt, recipientEmail, country, deviceType]}, newest first.
     */
    @Query("SELECT o.openedAt, s.recipientEmail, o.country, o.deviceType " +
            "FROM OpenEventEntity o, SendRecordEntity s " +
            "WHERE s.id = o.sendRecordId AND o.campaignId = :campaignId AND o.openedAt >= :since " +
            "ORDER BY o.openedAt DESC, o.id DESC")
    List<Object[]> findRecent(@Param("campaignId") Long campaignId, @Param("since") Instant since, Pageable pageable);

    /**
     * Rows of {@code [deviceType, count]}, most frequent first.
     */
    @Query("SELECT o.deviceType, COUNT(o) FROM OpenEventEntity o WHERE o.campaignId = :campaignId " +
            "GROUP BY o.deviceType ORDER BY COUNT(o) DESC")
    List<Object[]> countByDeviceType(@Param("campaignId") Long campaignId);

    /**
     * Rows of {@code [country, countryCode, count]}, excluding unresolved locations.
     */
    @Query("SELECT o.country, o.countryCode, COUNT(o) FROM OpenEventEntity o " +
            "WHERE o.campaignId = :campaignId AND o.country <> 'unknown' " +
            "GROUP BY o.country, o.countryCode ORDER BY COUNT(o) DESC")
    List<Object[]> countByCountry(@Param("campaignId") Long campaignId, Pageable pageable);
}
