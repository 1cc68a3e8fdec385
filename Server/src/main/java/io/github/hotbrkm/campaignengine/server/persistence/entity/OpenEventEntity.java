package io.github.hotbrkm.campaignengine.server.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * One row per pixel hit. {@code uniqueEvent} is true for the first hit of a send from a given IP.
 */
@Entity
@Table(name = "open_events", indexes = {
        @Index(name = "idx_open_send_ip", columnList = "send_record_id, ip_address"),
        @Index(name = "idx_open_campaign_id", columnList = "campaign_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OpenEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "send_record_id", nullable = false)
    private Long sendRecordId;

    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @Column(name = "subscriber_id")
    private Long subscriberId;

    @Column(name = "tracking_id", nullable = false, length = 64)
    private String trackingId;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT")
    private String userAgent;

    @Column(name = "referer", length = 500)
    private String referer;

    @Column(name = "device_type", length = 20)
    private String deviceType;

    @Column(name = "device_os", length = 50)
    private String deviceOs;

    @Column(name = "device_brand", length = 50)
    private String deviceBrand;

    @Column(name = "device_model", length = 100)
    private String deviceModel;

    @Column(name = "browser_name", length = 50)
    private String browserName;

    @Column(name = "browser_version", length = 30)
    private String browserVersion;

    @Column(name = "browser_engine", length = 50)
    private String browserEngine;

    @Column(name = "country", length = 100)
    private String country;

    @Column(name = "country_code", length = 10)
    private String countryCode;

    @Column(name = "region", length = 100)
    private String region;

    @Column(name = "city", length = 100)
    private String city;

    @Column(name = "timezone", length = 50)
    private String timezone;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "isp")
    private String isp;

    @Column(name = "is_unique", nullable = false)
    private boolean uniqueEvent;

    @Column(name = "is_mobile", nullable = false)
    private boolean mobile;

    @Column(name = "opened_at", nullable = false)
    private Instant openedAt;

    @Column(name = "time_to_open_seconds")
    private Long timeToOpenSeconds;
}
