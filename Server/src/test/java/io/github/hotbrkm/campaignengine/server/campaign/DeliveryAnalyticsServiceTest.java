package io.github.hotbrkm.campaignengine.server.campaign;

import io.github.hotbrkm.campaignengine.agent.email.send.result.SendStatus;
import io.github.hotbrkm.campaignengine.agent.email.send.server.ScoringServerSelector;
import io.github.hotbrkm.campaignengine.agent.email.send.server.ServerSelector;
import io.github.hotbrkm.campaignengine.agent.email.send.server.SmtpSecurity;
import io.github.hotbrkm.campaignengine.agent.email.send.server.SmtpServer;
import io.github.hotbrkm.campaignengine.server.persistence.entity.CampaignEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.ClickEventEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.OpenEventEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.SendRecordEntity;
import io.github.hotbrkm.campaignengine.server.persistence.repository.CampaignRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.ClickEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.OpenEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.SendRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({DeliveryAnalyticsService.class, CampaignAnalyticsService.class, DeliveryAnalyticsServiceTest.Config.class})
@DisplayName("Delivery analytics and realtime activity test")
class DeliveryAnalyticsServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-05T09:30:00Z");

    @Autowired
    private DeliveryAnalyticsService deliveryAnalyticsService;
    @Autowired
    private CampaignAnalyticsService campaignAnalyticsService;
    @Autowired
    private CampaignRepository campaignRepository;
    @Autowired
    private SendRecordRepository sendRecordRepository;
    @Autowired
    private OpenEventRepository openEventRepository;
    @Autowired
    private ClickEventRepository clickEventRepository;

    private long campaignId;
    private int sendSequence;

    @BeforeEach
    void setUp() {
        campaignId = campaignRepository.save(CampaignEntity.builder().name("Launch").subject("Hi").build()).getId();
    }

    @Test
    @DisplayName("Totals, per-server and per-domain figures count only final send records")
    void analyze_aggregatesFinalRecords() {
        saveSend("jane@Example.org", SendStatus.SENT, "primary", 0);
        saveSend("bob@example.org", SendStatus.SENT, "primary", 2);
        saveSend("carl@gmail.com", SendStatus.FAILED, "primary", 2);
        saveSend("dora@gmail.com", SendStatus.SENT, "legacy", 0);
        saveSend("eve@gmail.com", SendStatus.PENDING, null, 0);

        DeliveryAnalytics analytics = deliveryAnalyticsService.analyze();

        assertThat(analytics.totalSent()).isEqualTo(3);
        assertThat(analytics.totalFailed()).isEqualTo(1);
        assertThat(analytics.successRate()).isEqualTo(75.0);

        assertThat(analytics.serverPerformance())
                .extracting(DeliveryAnalytics.ServerPerformance::name)
                .containsExactly("primary", "secondary", "legacy");
        DeliveryAnalytics.ServerPerformance primary = analytics.serverPerformance().get(0);
        assertThat(primary.sent()).isEqualTo(2);
        assertThat(primary.failed()).isEqualTo(1);
        assertThat(primary.successRate()).isEqualTo(66.67);
        assertThat(primary.averageRetries()).isEqualTo(1.33);
        assertThat(primary.liveHealth().score()).isEqualTo(160.0);
        assertThat(primary.liveHealth().successRate()).isEqualTo(100.0);
        DeliveryAnalytics.ServerPerformance secondary = analytics.serverPerformance().get(1);
        assertThat(secondary.sent()).isZero();
        assertThat(secondary.successRate()).isZero();
        assertThat(secondary.liveHealth().enabled()).isTrue();
        assertThat(analytics.serverPerformance().get(2).liveHealth()).isNull();

        assertThat(analytics.domainAnalytics()).containsExactly(
                new DeliveryAnalytics.DomainDelivery("example.org", 2, 0, 100.0),
                new DeliveryAnalytics.DomainDelivery("gmail.com", 1, 1, 50.0));
    }

    @Test
    @DisplayName("Optimal send times rank the UTC hours of recent opens")
    void analyze_ranksOpenHours() {
        long sendId = saveSend("jane@example.org", SendStatus.SENT, "primary", 0);
        for (String time : List.of("09:05", "09:10", "09:20", "14:00", "14:30", "07:15", "07:45", "20:00")) {
            saveOpen(sendId, Instant.parse("2026-03-04T" + time + ":00Z"));
        }
        saveOpen(sendId, NOW.minus(Duration.ofDays(40)));

        assertThat(deliveryAnalyticsService.analyze().optimalSendTimes()).containsExactly(
                new DeliveryAnalytics.SendHour(9, 3),
                new DeliveryAnalytics.SendHour(7, 2),
                new DeliveryAnalytics.SendHour(14, 2));
    }

    @Test
    @DisplayName("Realtime activity lists the last hour's opens and clicks newest first")
    void realtime_listsLatestHour() {
        long sendId = saveSend("jane@example.org", SendStatus.SENT, "primary", 0);
        saveOpen(sendId, NOW.minus(Duration.ofMinutes(30)));
        saveOpen(sendId, NOW.minus(Duration.ofMinutes(5)));
        saveOpen(sendId, NOW.minus(Duration.ofHours(2)));
        for (int i = 0; i < 25; i++) {
            saveClick(sendId, NOW.minus(Duration.ofMinutes(i)), "https://shop.example.com/" + i);
        }

        RealtimeActivity activity = campaignAnalyticsService.realtime(campaignId);

        assertThat(activity.since()).isEqualTo(NOW.minus(Duration.ofHours(1)));
        assertThat(activity.opens()).extracting(RealtimeActivity.RecentOpen::openedAt)
                .containsExactly(NOW.minus(Duration.ofMinutes(5)), NOW.minus(Duration.ofMinutes(30)));
        assertThat(activity.opens().get(0).email()).isEqualTo("jane@example.org");
        assertThat(activity.opens().get(0).country()).isEqualTo("Germany");
        assertThat(activity.clicks()).hasSize(CampaignAnalyticsService.REALTIME_LIMIT);
        assertThat(activity.clicks().get(0).linkUrl()).isEqualTo("https://shop.example.com/0");
        assertThat(activity.clicks().get(19).linkUrl()).isEqualTo("https://shop.example.com/19");
    }

    @Test
    @DisplayName("Realtime activity of an unknown campaign is not found")
    void realtime_unknownCampaign() {
        assertThatThrownBy(() -> campaignAnalyticsService.realtime(campaignId + 1000))
                .isInstanceOf(CampaignNotFoundException.class);
    }

    private long saveSend(String email, SendStatus status, String server, int retries) {
        return sendRecordRepository.save(SendRecordEntity.builder()
                .trackingId(String.format("%064d", ++sendSequence))
                .campaignId(campaignId)
                .recipientEmail(email)
                .status(status)
                .smtpServer(server)
                .retryCount(retries)
                .createdAt(NOW)
                .build()).getId();
    }

    private void saveOpen(long sendId, Instant openedAt) {
        openEventRepository.save(OpenEventEntity.builder()
                .sendRecordId(sendId)
                .campaignId(campaignId)
                .trackingId("t")
                .country("Germany")
                .deviceType("desktop")
                .openedAt(openedAt)
                .build());
    }

    private void saveClick(long sendId, Instant clickedAt, String url) {
        clickEventRepository.save(ClickEventEntity.builder()
                .sendRecordId(sendId)
                .campaignId(campaignId)
                .trackingId("t")
                .linkId("l")
                .linkUrl(url)
                .country("Germany")
                .clickedAt(clickedAt)
                .build());
    }

    @TestConfiguration
    static class Config {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }

        @Bean
        ServerSelector serverSelector() {
            return new ScoringServerSelector(List.of(
                    new SmtpServer("primary", "primary.relay.test", 25, null, null, SmtpSecurity.NONE, 1, true),
                    new SmtpServer("secondary", "secondary.relay.test", 25, null, null, SmtpSecurity.NONE, 0, true)));
        }
    }
}
