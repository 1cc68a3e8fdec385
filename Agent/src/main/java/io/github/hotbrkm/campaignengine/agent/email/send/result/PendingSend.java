package io.github.hotbrkm.campaignengine.agent.email.send.result;

import lombok.Builder;

import java.time.Instant;

/**
 * Snapshot written as a PENDING send record before the first transport attempt.
 */
@Builder
public record PendingSend(String trackingId,
                          long campaignId,
                          Long subscriberId,
                          String recipientEmail,
                          String messageId,
                          String subject,
                          String html,
                          String text,
                          Instant createdAt) {
}
