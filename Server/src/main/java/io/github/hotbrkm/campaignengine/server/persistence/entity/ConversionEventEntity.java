package io.github.hotbrkm.campaignengine.server.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "conversion_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_conversion_send_type",
                columnNames = {"send_record_id", "conversion_type"}),
        indexes = @Index(name = "idx_conversion_campaign_id", columnList = "campaign_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversionEventEntity {

    public static final String DEFAULT_CURRENCY = "USD";
    public static final String LAST_CLICK = "last_click";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "send_record_id", nullable = false)
    private Long sendRecordId;

    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @Column(name = "subscriber_id")
    private Long subscriberId;

    @Column(name = "click_event_id")
    private Long clickEventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "conversion_type", nullable = false, length = 20)
    private ConversionType conversionType;

    @Column(name = "conversion_url", columnDefinition = "TEXT")
    private String conversionUrl;

    @Column(name = "conversion_value", precision = 12, scale = 2)
    private BigDecimal value;

    @Builder.Default
    @Column(name = "currency", length = 3)
    private String currency = DEFAULT_CURRENCY;

    @Builder.Default
    @Column(name = "attribution_model", length = 30)
    private String attributionModel = LAST_CLICK;

    @Column(name = "converted_at", nullable = false)
    private Instant convertedAt;
}
