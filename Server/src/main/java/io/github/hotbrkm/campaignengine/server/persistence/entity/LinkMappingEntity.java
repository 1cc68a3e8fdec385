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

@Entity
@Table(name = "link_mappings", indexes = {
        @Index(name = "idx_link_link_id", columnList = "link_id", unique = true),
        @Index(name = "idx_link_tracking_id", columnList = "tracking_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LinkMappingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "link_id", nullable = false, updatable = false, length = 64)
    private String linkId;

    @Column(name = "original_url", nullable = false, columnDefinition = "TEXT")
    private String originalUrl;

    @Column(name = "tracking_id", nullable = false, length = 64)
    private String trackingId;

    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @Column(name = "link_position", nullable = false)
    private int position;

    @Column(name = "variant", length = 8)
    private String variant;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;
}
