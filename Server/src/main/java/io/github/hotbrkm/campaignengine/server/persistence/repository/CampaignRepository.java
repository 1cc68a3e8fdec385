package io.github.hotbrkm.campaignengine.server.persistence.repository;

import io.github.hotbrkm.campaignengine.server.persistence.entity.CampaignEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Counter updates are single atomic statements. Callers run {@link #recomputeRates(Long)} after any increment,
 * in the same transaction.
 */
@Repository
public interface CampaignRepository extends JpaRepository<CampaignEntity, Long> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CampaignEntity c SET c.emailsSent = c.emailsSent + 1 WHERE c.id = :id")
    int incrementSent(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CampaignEntity c SET c.emailsFailed = c.emailsFailed + 1 WHERE c.id = :id")
    int incrementFailed(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CampaignEntity c SET c.emailsOpened = c.emailsOpened + 1, " +
            "c.uniqueOpens = c.uniqueOpens + :uniqueDelta WHERE c.id = :id")
    int incrementOpens(@Param("id") Long id, @Param("uniqueDelta") long uniqueDelta);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CampaignEntity c SET c.clicks = c.clicks + 1, " +
            "c.uniqueClicks = c.uniqueClicks + :uniqueDelta WHERE c.id = :id")
    int incrementClicks(@Param("id") Long id, @Param("uniqueDelta") long uniqueDelta);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CampaignEntity c SET c.conversions = c.conversions + 1 WHERE c.id = :id")
    int incrementConversions(@Param("id") Long id);

    /**
     * Percentages with 2 decimals; a zero denominator yields 0.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CampaignEntity c SET " +
            "c.openRate = CASE WHEN c.emailsSent > 0 THEN ROUND(c.emailsOpened * 100.0 / c.emailsSent, 2) ELSE 0.0 END, " +
            "c.clickRate = CASE WHEN c.emailsSent > 0 THEN ROUND(c.clicks * 100.0 / c.emailsSent, 2) ELSE 0.0 END, " +
            "c.clickToOpenRate = CASE WHEN c.uniqueOpens > 0 THEN ROUND(c.clicks * 100.0 / c.uniqueOpens, 2) ELSE 0.0 END, " +
            "c.conversionRate = CASE WHEN c.emailsSent > 0 THEN ROUND(c.conversions * 100.0 / c.emailsSent, 2) ELSE 0.0 END, " +
            "c.failureRate = CASE WHEN (c.emailsSent + c.emailsFailed) > 0 " +
            "THEN ROUND(c.emailsFailed * 100.0 / (c.emailsSent + c.emailsFailed), 2) ELSE 0.0 END " +
            "WHERE c.id = :id")
    int recomputeRates(@Param("id") Long id);
}
