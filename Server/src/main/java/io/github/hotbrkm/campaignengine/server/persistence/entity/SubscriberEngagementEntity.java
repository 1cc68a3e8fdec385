package io.github.hotbrkm.campaignengine.server.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "subscriber_engagement")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubscriberEngagementEntity {

    public static final int MAX_ENGAGEMENT_SCORE = 100;

    @Id
    @Column(name = "subscriber_id")
    private Long subscriberId;

    @Column(name = "total_emails_sent", nullable = false)
    private long totalEmailsSent;

    @Column(name = "total_emails_opened", nullable = false)
    private long totalEmailsOpened;

    @Column(name = "total_clicks", nullable = false)
    private long totalClicks;

    @Column(name = "last_email_sent")
    private Instant lastEmailSent;

    @Column(name = "last_email_opened")
    private Instant lastEmailOpened;

    @Column(name = "last_click_date")
    private Instant lastClickDate;

    @Column(name = "engagement_score", nullable = false)
    private int engagementScore;

    @Column(name = "open_rate", nullable = false)
    private double openRate;

    @Column(name = "click_rate", nullable = false)
    private double clickRate;
}
