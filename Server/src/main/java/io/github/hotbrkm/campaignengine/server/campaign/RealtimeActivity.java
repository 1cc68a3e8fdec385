package io.github.hotbrkm.campaignengine.server.campaign;

import java.time.Instant;
import java.util.List;

/**
 * The latest opens and clicks of one campaign since {@code since}, newest first.
 */
public record RealtimeActivity(long campaignId, Instant since, List<RecentOpen> opens, List<RecentClick> clicks) {

    public record RecentOpen(Instant openedAt, String email, String country, String deviceType) {
    }

    public record RecentClick(Instant clickedAt, String email, String linkUrl, String country) {
    }
}
