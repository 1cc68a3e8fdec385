package io.github.hotbrkm.campaignengine.server.campaign;

import java.util.List;

/**
 * Delivery read model across all campaigns. Persisted totals come from final send records; {@code liveHealth}
 * fields come from the running relay pool and reset on restart. Rates are percentages with 2 decimals.
 */
public record DeliveryAnalytics(long totalSent,
                                long totalFailed,
                                double successRate,
                                List<ServerPerformance> serverPerformance,
                                List<DomainDelivery> domainAnalytics,
                                List<SendHour> optimalSendTimes) {

    public record ServerPerformance(String name,
                                    long sent,
                                    long failed,
                                    double successRate,
                                    double averageRetries,
                                    LiveHealth liveHealth) {
    }

    public record LiveHealth(boolean enabled, int priority, double score, int inFlight, double successRate,
                             double averageResponseSeconds) {
    }

    public record DomainDelivery(String domain, long sent, long failed, double successRate) {
    }

    public record SendHour(int hour, long opens) {
    }
}
