package io.github.hotbrkm.campaignengine.server.persistence.entity;

import io.github.hotbrkm.campaignengine.agent.email.send.result.SendStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One message to one recipient. Created PENDING before the first transport attempt; the tracking id never changes.
 */
@Entity
@Table(name = "send_records", indexes = {
        @Index(name = "idx_send_tracking_id", columnList = "tracking_id", unique = true),
        @Index(name = "idx_send_campaign_id", columnList = "campaign_id"),
        @Index(name = "idx_send_subscriber_id", columnList = "subscriber_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SendRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tracking_id", nullable = false, updatable = false, length = 64)
    private String trackingId;

    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @Column(name = "subscriber_id")
    private Long subscriberId;

    @Column(name = "recipient_email", nullable = false)
    private String recipientEmail;

    @Column(name = "message_id")
    private String messageId;

    @Column(name = "subject", length = 1000)
    private String subject;

    @Column(name = "html_content", columnDefinition = "TEXT")
    private String htmlContent;

    @Column(name = "text_content", columnDefinition = "TEXT")
    private String textContent;

    @Column(name = "smtp_server", length = 100)
    private String smtpServer;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SendStatus status;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;
}
