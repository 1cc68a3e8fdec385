package io.github.hotbrkm.campaignengine.server.attribution;

import io.github.hotbrkm.campaignengine.agent.email.send.result.SendStatus;
import io.github.hotbrkm.campaignengine.server.persistence.entity.CampaignEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.SendRecordEntity;
import io.github.hotbrkm.campaignengine.server.persistence.repository.CampaignRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.OpenEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.SendRecordRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.SubscriberEngagementRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

// A small pool makes every test run more hits at once than there are connections
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "spring.datasource.hikari.maximum-pool-size=4",
        "spring.datasource.hikari.connection-timeout=5000"
})
@DisplayName("AttributionIngestor concurrency test")
class AttributionIngestorConcurrencyTest {

    private static final int HITS = 16;

    @Autowired
    private AttributionIngestor ingestor;
    @Autowired
    private CampaignRepository campaignRepository;
    @Autowired
    private SendRecordRepository sendRecordRepository;
    @Autowired
    private OpenEventRepository openEventRepository;
    @Autowired
    private SubscriberEngagementRepository subscriberEngagementRepository;

    private long campaignId;

    @BeforeEach
    void setUp() {
        campaignId = campaignRepository.save(CampaignEntity.builder()
                .name("Flash sale")
                .subject("Now")
                .emailsSent(HITS)
                .build()).getId();
    }

    @AfterEach
    void tearDown() {
        openEventRepository.deleteAll();
        sendRecordRepository.deleteAll();
        subscriberEngagementRepository.deleteAll();
        campaignRepository.deleteAll();
    }

    @Test
    @DisplayName("More concurrent opens than pooled connections all land with their counters")
    void handleOpen_moreHitsThanConnections() throws Exception {
        List<String> trackingIds = new ArrayList<>();
        for (int i = 0; i < HITS; i++) {
            trackingIds.add(saveSend(i, 1000L + i));
        }

        runConcurrently(trackingIds);

        assertThat(openEventRepository.count()).isEqualTo(HITS);
        CampaignEntity campaign = campaignRepository.findById(campaignId).orElseThrow();
        assertThat(campaign.getEmailsOpened()).isEqualTo(HITS);
        assertThat(campaign.getUniqueOpens()).isEqualTo(HITS);
        assertThat(campaign.getOpenRate()).isEqualTo(100.0);
        assertThat(subscriberEngagementRepository.findAll()).hasSize(HITS)
                .allSatisfy(engagement -> assertThat(engagement.getTotalEmailsOpened()).isEqualTo(1));
    }

    @Test
    @DisplayName("First opens of one subscriber on different sends create one engagement row and count every open")
    void handleOpen_firstHitsForOneSubscriber() throws Exception {
        long subscriberId = 77L;
        List<String> trackingIds = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            trackingIds.add(saveSend(i, subscriberId));
        }

        runConcurrently(trackingIds);

        assertThat(openEventRepository.count()).isEqualTo(8);
        assertThat(campaignRepository.findById(campaignId).orElseThrow().getEmailsOpened()).isEqualTo(8);
        assertThat(subscriberEngagementRepository.findAll()).singleElement().satisfies(engagement -> {
            assertThat(engagement.getSubscriberId()).isEqualTo(subscriberId);
            assertThat(engagement.getTotalEmailsOpened()).isEqualTo(8);
            assertThat(engagement.getEngagementScore()).isEqualTo(16);
        });
    }

    private void runConcurrently(List<String> trackingIds) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(trackingIds.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < trackingIds.size(); i++) {
                String trackingId = trackingIds.get(i);
                String ip = "203.0.113." + (i + 1);
                Callable<?> hit = () -> {
                    start.await();
                    return ingestor.handleOpen(trackingId, new RequestMeta(ip, null, null));
                };
                futures.add(executor.submit(hit));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private String saveSend(int index, long subscriberId) {
        String trackingId = HexFormat.of().toHexDigits(index) + "b".repeat(56);
        sendRecordRepository.save(SendRecordEntity.builder()
                .trackingId(trackingId)
                .campaignId(campaignId)
                .subscriberId(subscriberId)
                .recipientEmail("reader" + index + "@example.org")
                .status(SendStatus.SENT)
                .createdAt(Instant.now())
                .sentAt(Instant.now())
                .build());
        return trackingId;
    }
}
