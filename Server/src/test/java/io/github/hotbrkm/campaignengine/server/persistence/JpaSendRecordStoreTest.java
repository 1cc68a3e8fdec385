package io.github.hotbrkm.campaignengine.server.persistence;

import io.github.hotbrkm.campaignengine.agent.email.send.result.PendingSend;
import io.github.hotbrkm.campaignengine.agent.email.send.result.ResultPersistenceException;
import io.github.hotbrkm.campaignengine.agent.email.send.result.SendStatus;
import io.github.hotbrkm.campaignengine.server.persistence.entity.SendRecordEntity;
import io.github.hotbrkm.campaignengine.server.persistence.repository.SendRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaSendRecordStore.class)
@DisplayName("JpaSendRecordStore test")
class JpaSendRecordStoreTest {

    private static final String TRACKING_ID = "c".repeat(64);
    private static final Instant CREATED_AT = Instant.parse("2026-03-05T09:30:00Z");

    @Autowired
    private JpaSendRecordStore store;

    @Autowired
    private SendRecordRepository sendRecordRepository;

    @Test
    @DisplayName("Pending record keeps the content snapshot")
    void createPending_persistsSnapshot() {
        store.createPending(pending(TRACKING_ID));

        SendRecordEntity record = sendRecordRepository.findByTrackingId(TRACKING_ID).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(SendStatus.PENDING);
        assertThat(record.getCampaignId()).isEqualTo(3L);
        assertThat(record.getSubscriberId()).isEqualTo(7L);
        assertThat(record.getMessageId()).isEqualTo("<1.abc@example.com>");
        assertThat(record.getSubject()).isEqualTo("Hello Jane");
        assertThat(record.getHtmlContent()).isEqualTo("<p>Hi</p>");
        assertThat(record.getCreatedAt()).isEqualTo(CREATED_AT);
    }

    @Test
    @DisplayName("markSent finalizes server, retry count and send time")
    void markSent_finalizes() {
        store.createPending(pending(TRACKING_ID));
        Instant sentAt = CREATED_AT.plusSeconds(5);

        store.markSent(TRACKING_ID, "primary", 1, sentAt);

        SendRecordEntity record = sendRecordRepository.findByTrackingId(TRACKING_ID).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(SendStatus.SENT);
        assertThat(record.getSmtpServer()).isEqualTo("primary");
        assertThat(record.getRetryCount()).isEqualTo(1);
        assertThat(record.getSentAt()).isEqualTo(sentAt);
    }

    @Test
    @DisplayName("markFailed stores a truncated error message")
    void markFailed_truncatesError() {
        store.createPending(pending(TRACKING_ID));

        store.markFailed(TRACKING_ID, "secondary", 2, "x".repeat(5000));

        SendRecordEntity record = sendRecordRepository.findByTrackingId(TRACKING_ID).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(SendStatus.FAILED);
        assertThat(record.getErrorMessage()).hasSize(JpaSendRecordStore.MAX_ERROR_LENGTH);
        assertThat(record.getSentAt()).isNull();
    }

    @Test
    @DisplayName("A record is finalized once; unknown or final records fail")
    void finalize_onlyOnce() {
        store.createPending(pending(TRACKING_ID));
        store.markSent(TRACKING_ID, "primary", 0, CREATED_AT);

        assertThatThrownBy(() -> store.markFailed(TRACKING_ID, "primary", 0, "late"))
                .isInstanceOf(ResultPersistenceException.class);
        assertThatThrownBy(() -> store.markSent("d".repeat(64), "primary", 0, CREATED_AT))
                .isInstanceOf(ResultPersistenceException.class)
                .hasMessageContaining("No pending send record");
    }

    @Test
    @DisplayName("Duplicate tracking id surfaces as ResultPersistenceException")
    void createPending_duplicateTrackingId() {
        store.createPending(pending(TRACKING_ID));

        assertThatThrownBy(() -> store.createPending(pending(TRACKING_ID)))
                .isInstanceOf(ResultPersistenceException.class);
    }

    private static PendingSend pending(String trackingId) {
        return PendingSend.builder()
                .trackingId(trackingId)
                .campaignId(3L)
                .subscriberId(7L)
                .recipientEmail("jane@example.org")
                .messageId("<1.abc@example.com>")
                .subject("Hello Jane")
                .html("<p>Hi</p>")
                .text("Hi")
                .createdAt(CREATED_AT)
                .build();
    }
}
