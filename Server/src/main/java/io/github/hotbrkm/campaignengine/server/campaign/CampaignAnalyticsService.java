package io.github.hotbrkm.campaignengine.server.campaign;

import io.github.hotbrkm.campaignengine.server.persistence.entity.CampaignEntity;
import io.github.hotbrkm.campaignengine.server.persistence.repository.CampaignRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.ClickEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.OpenEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
@RequiredArgsConstructor
public class CampaignAnalyticsService {

    static final int TOP_LIMIT = 10;
    static final int REALTIME_LIMIT = 20;
    static final Duration REALTIME_WINDOW = Duration.ofHours(1);

    private final CampaignRepository campaignRepository;
    private final OpenEventRepository openEventRepository;
    private final ClickEventRepository clickEventRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public CampaignAnalytics analyze(long campaignId) {
        CampaignEntity campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
        Pageable top = PageRequest.of(0, TOP_LIMIT);

        long totalOpens = openEventRepository.countByCampaignId(campaignId);

        return new CampaignAnalytics(
                campaignId,
                campaign.getName(),
                new CampaignAnalytics.Counters(campaign.getEmailsSent(), campaign.getEmailsFailed(),
                        campaign.getEmailsOpened(), campaign.getUniqueOpens(), campaign.getClicks(),
                        campaign.getUniqueClicks(), campaign.getConversions()),
                new CampaignAnalytics.Rates(campaign.getOpenRate(), campaign.getClickRate(),
                        campaign.getClickToOpenRate(), campaign.getConversionRate(), campaign.getFailureRate()),
                new CampaignAnalytics.OpenStats(totalOpens, openEventRepository.countDistinctSubscribers(campaignId)),
                new CampaignAnalytics.ClickStats(clickEventRepository.countByCampaignId(campaignId),
                        clickEventRepository.countDistinctLinks(campaignId)),
                deviceShares(campaignId, totalOpens),
                openEventRepository.countByCountry(campaignId, top).stream()
                        .map(row -> new CampaignAnalytics.CountryCount((String) row[0], (String) row[1],
                                ((Number) row[2]).longValue()))
                        .toList(),
                opensByHour(campaignId),
                clickEventRepository.findTopLinks(campaignId, top).stream()
                        .map(row -> new CampaignAnalytics.LinkStats((String) row[0], ((Number) row[1]).longValue(),
                                row[2] == null ? 0L : ((Number) row[2]).longValue()))
                        .toList());
    }

    /**
     * Opens and clicks of the last hour, at most {@value #REALTIME_LIMIT} of each.
     */
    @Transactional(readOnly = true)
    public RealtimeActivity realtime(long campaignId) {
        if (!campaignRepository.existsById(campaignId)) {
            throw new CampaignNotFoundException(campaignId);
        }
        Instant since = clock.instant().minus(REALTIME_WINDOW);
        Pageable latest = PageRequest.of(0, REALTIME_LIMIT);

        return new RealtimeActivity(campaignId, since,
                openEventRepository.findRecent(campaignId, since, latest).stream()
                        .map(row -> new RealtimeActivity.RecentOpen((Instant) row[0], (String) row[1],
                                (String) row[2], (String) row[3]))
                        .toList(),
                clickEventRepository.findRecent(campaignId, since, latest).stream()
                        .map(row -> new RealtimeActivity.RecentClick((Instant) row[0], (String) row[1],
                                (String) row[2], (String) row[3]))
                        .toList());
    }

    private List<CampaignAnalytics.DeviceShare> deviceShares(long campaignId, long totalOpens) {
        return openEventRepository.countByDeviceType(campaignId).stream()
                .map(row -> {
                    long count = ((Number) row[1]).longValue();
                    return new CampaignAnalytics.DeviceShare((String) row[0], count, percentage(count, totalOpens));
                })
                .toList();
    }

    // Hour of day in UTC
    private List<CampaignAnalytics.HourCount> opensByHour(long campaignId) {
        Map<Integer, Long> byHour = new TreeMap<>();
        for (Instant openedAt : openEventRepository.findOpenTimes(campaignId)) {
            byHour.merge(openedAt.atZone(ZoneOffset.UTC).getHour(), 1L, Long::sum);
        }
        return byHour.entrySet().stream()
                .map(entry -> new CampaignAnalytics.HourCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    static double percentage(long part, long total) {
        if (total <= 0) {
            return 0.0d;
        }
        return BigDecimal.valueOf(part * 100.0d / total).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
