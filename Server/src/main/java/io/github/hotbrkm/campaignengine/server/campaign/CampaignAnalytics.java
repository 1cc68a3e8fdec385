package io.github.hotbrkm.campaignengine.server.campaign;

import java.util.List;

/**
 * Read model for one campaign. Rates are percentages with 2 decimals.
 */
public record CampaignAnalytics(long campaignId,
                                String name,
                                Counters counters,
                                Rates rates,
                                OpenStats opens,
                                ClickStats clicks,
                                List<DeviceShare> devices,
                                List<CountryCount> topCountries,
                                List<HourCount> opensByHour,
                                List<LinkStats> topLinks) {

    public record Counters(long emailsSent, long emailsFailed, long emailsOpened, long uniqueOpens,
                           long clicks, long uniqueClicks, long conversions) {
    }

    public record Rates(double openRate, double clickRate, double clickToOpenRate, double conversionRate,
                        double failureRate) {
    }

    public record OpenStats(long total, long distinctSubscribers) {
    }

    public record ClickStats(long total, long uniqueLinks) {
    }

    public record DeviceShare(String deviceType, long count, double percentage) {
    }

    public record CountryCount(String country, String countryCode, long count) {
    }

    public record HourCount(int hour, long count) {
    }

    public record LinkStats(String url, long clicks, long uniqueClicks) {
    }
}
