package io.github.hotbrkm.campaignengine.server.persistence.repository;

import io.github.hotbrkm.campaignengine.server.persistence.entity.ClickEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ClickEventRepository extends JpaRepository<ClickEventEntity, Long> {

    boolean existsBySendRecordIdAndIpAddress(Long sendRecordId, String ipAddress);

    long countByCampaignId(Long campaignId);

    long countBySendRecordId(Long sendRecordId);

    @Query("SELECT COUNT(DISTINCT c.linkUrl) FROM ClickEventEntity c WHERE c.campaignId = :campaignId")
    long countDistinctLinks(@Param("campaignId") Long campaignId);

    /**
     * Rows of {@code [clickedAt, recipientEmail, linkUrl, country]}, newest first.
     */
    @Query("SELECT c.clickedAt, s.recipientEmail, c.linkUrl, c.country " +
            "FROM ClickEventEntity c, SendRecordEntity s " +
            "WHERE s.id = c.sendRecordId AND c.campaignId = :campaignId AND c.clickedAt >= :since " +
            "ORDER BY c.clickedAt DESC, c.id DESC")
    List<Object[]> findRecent(@Param("campaignId") Long campaignId, @Param("since") Instant since, Pageable pageable);

    /**
     * Rows of {@code [linkUrl, clicks, uniqueClicks]}, most clicked first.
     */
    @Query("SELECT c.linkUrl, COUNT(c), SUM(CASE WHEN c.uniqueEvent = true THEN 1 ELSE 0 END) " +
            "FROM ClickEventEntity c WHERE c.campaignId = :campaignId " +
            "GROUP BY c.linkUrl ORDER BY COUNT(c) DESC")
    List<Object[]> findTopLinks(@Param("campaignId") Long campaignId, Pageable pageable);
}
