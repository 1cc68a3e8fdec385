package io.github.hotbrkm.campaignengine.server.persistence.repository;

import io.github.hotbrkm.campaignengine.server.persistence.entity.SubscriberEngagementEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface SubscriberEngagementRepository extends JpaRepository<SubscriberEngagementEntity, Long> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SubscriberEngagementEntity s SET s.totalEmailsSent = s.totalEmailsSent + 1, " +
            "s.lastEmailSent = :at WHERE s.subscriberId = :subscriberId")
    int incrementSent(@Param("subscriberId") Long subscriberId, @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SubscriberEngagementEntity s SET s.totalEmailsOpened = s.totalEmailsOpened + 1, " +
            "s.lastEmailOpened = :at, " +
            "s.engagementScore = CASE WHEN s.engagementScore + :points > 100 THEN 100 " +
            "ELSE s.engagementScore + :points END " +
            "WHERE s.subscriberId = :subscriberId")
    int incrementOpens(@Param("subscriberId") Long subscriberId, @Param("at") Instant at,
                       @Param("points") int points);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SubscriberEngagementEntity s SET s.totalClicks = s.totalClicks + 1, " +
            "s.lastClickDate = :at, " +
            "s.engagementScore = CASE WHEN s.engagementScore + :points > 100 THEN 100 " +
            "ELSE s.engagementScore + :points END " +
            "WHERE s.subscriberId = :subscriberId")
    int incrementClicks(@Param("subscriberId") Long subscriberId, @Param("at") Instant at,
                        @Param("points") int points);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SubscriberEngagementEntity s SET " +
            "s.openRate = CASE WHEN s.totalEmailsSent > 0 " +
            "THEN ROUND(s.totalEmailsOpened * 100.0 / s.totalEmailsSent, 2) ELSE 0.0 END, " +
            "s.clickRate = CASE WHEN s.totalEmailsSent > 0 " +
            "THEN ROUND(s.totalClicks * 100.0 / s.totalEmailsSent, 2) ELSE 0.0 END " +
            "WHERE s.subscriberId = :subscriberId")
    int recomputeRates(@Param("subscriberId") Long subscriberId);
}
