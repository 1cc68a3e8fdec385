package io.github.hotbrkm.campaignengine.server.persistence.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Campaign template and aggregate counters. The template is read-only here; counters and rates are only changed
 * through the atomic updates in {@code CampaignRepository}.
 */
@Entity
@Table(name = "campaigns")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CampaignEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "subject", nullable = false, length = 1000)
    private String subject;

    @Column(name = "html_content", columnDefinition = "TEXT")
    private String htmlContent;

    @Column(name = "text_content", columnDefinition = "TEXT")
    private String textContent;

    @Column(name = "from_name")
    private String fromName;

    @Column(name = "from_email")
    private String fromEmail;

    // options carry :weight suffixes
    @Column(name = "weighted_spintax", nullable = false, columnDefinition = "boolean default false")
    private boolean weightedSpintax;

    // sent with every message of the campaign, in this order
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_attachments", joinColumns = @JoinColumn(name = "campaign_id"))
    @OrderColumn(name = "attachment_order")
    @Builder.Default
    private List<CampaignAttachment> attachments = new ArrayList<>();

    @Column(name = "emails_sent", nullable = false)
    private long emailsSent;

    @Column(name = "emails_failed", nullable = false)
    private long emailsFailed;

    @Column(name = "emails_opened", nullable = false)
    private long emailsOpened;

    @Column(name = "unique_opens", nullable = false)
    private long uniqueOpens;

    @Column(name = "clicks", nullable = false)
    private long clicks;

    @Column(name = "unique_clicks", nullable = false)
    private long uniqueClicks;

    @Column(name = "conversions", nullable = false)
    private long conversions;

    @Column(name = "open_rate", nullable = false)
    private double openRate;

    @Column(name = "click_rate", nullable = false)
    private double clickRate;

    @Column(name = "click_to_open_rate", nullable = false)
    private double clickToOpenRate;

    @Column(name = "conversion_rate", nullable = false)
    private double conversionRate;

    @Column(name = "failure_rate", nullable = false)
    private double failureRate;
}
