package io.github.hotbrkm.campaignengine.agent.email.send.server;

/**
 * Point-in-time view of one relay's rolling health. {@code successRate} is the smoothed rate in [0, 1];
 * the counts are totals since the pool was built.
 */
public record ServerHealthSnapshot(String name,
                                   String host,
                                   int priority,
                                   boolean enabled,
                                   double score,
                                   int inFlight,
                                   double successRate,
                                   double averageResponseSeconds,
                                   long successCount,
                                   long failureCount) {
}
