package io.github.hotbrkm.campaignengine.agent.email.tracking;

import java.time.Instant;

/**
 * Redirect link id to its destination and owning send. Written once at injection, never updated.
 *
 * @param position 1-based order of the link in the message
 * @param variant  A/B tag, null when the link has no variations
 */
public record LinkMapping(String linkId,
                          String originalUrl,
                          String trackingId,
                          long campaignId,
                          int position,
                          String variant,
                          Instant createdAt,
                          Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
