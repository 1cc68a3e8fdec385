package io.github.hotbrkm.campaignengine.server.campaign;

import io.github.hotbrkm.campaignengine.agent.email.domain.EmailAddressUtil;
import io.github.hotbrkm.campaignengine.agent.email.send.result.SendStatus;
import io.github.hotbrkm.campaignengine.agent.email.send.server.ServerHealthSnapshot;
import io.github.hotbrkm.campaignengine.agent.email.send.server.ServerSelector;
import io.github.hotbrkm.campaignengine.server.persistence.repository.OpenEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.SendRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static io.github.hotbrkm.campaignengine.server.campaign.CampaignAnalyticsService.percentage;

@Service
@RequiredArgsConstructor
public class DeliveryAnalyticsService {

    static final int TOP_DOMAINS = 10;
    static final int OPTIMAL_HOURS = 3;
    static final Duration SEND_TIME_WINDOW = Duration.ofDays(30);

    private static final Set<SendStatus> FINAL = EnumSet.of(SendStatus.SENT, SendStatus.FAILED);

    private final SendRecordRepository sendRecordRepository;
    private final OpenEventRepository openEventRepository;
    private final ServerSelector serverSelector;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DeliveryAnalytics analyze() {
        long sent = sendRecordRepository.countByStatus(SendStatus.SENT);
        long failed = sendRecordRepository.countByStatus(SendStatus.FAILED);

        return new DeliveryAnalytics(sent, failed, percentage(sent, sent + failed),
                serverPerformance(), domainAnalytics(), optimalSendTimes());
    }

    // Configured servers first in pool order, then servers only known from history
    private List<DeliveryAnalytics.ServerPerformance> serverPerformance() {
        Map<String, ServerHealthSnapshot> healthByName = new LinkedHashMap<>();
        Map<String, ServerTally> tallies = new LinkedHashMap<>();
        for (ServerHealthSnapshot health : serverSelector.healthSnapshot()) {
            healthByName.put(health.name(), health);
            tallies.put(health.name(), new ServerTally());
        }
        for (Object[] row : sendRecordRepository.countByServerAndStatus(FINAL)) {
            long count = ((Number) row[2]).longValue();
            double averageRetries = row[3] == null ? 0.0d : ((Number) row[3]).doubleValue();
            tallies.computeIfAbsent((String) row[0], key -> new ServerTally()).add((SendStatus) row[1], count, averageRetries);
        }

        List<DeliveryAnalytics.ServerPerformance> result = new ArrayList<>(tallies.size());
        tallies.forEach((server, tally) -> {
            ServerHealthSnapshot health = healthByName.get(server);
            result.add(new DeliveryAnalytics.ServerPerformance(server, tally.sent, tally.failed,
                    percentage(tally.sent, tally.sent + tally.failed), tally.averageRetries(),
                    health == null ? null : new DeliveryAnalytics.LiveHealth(health.enabled(), health.priority(),
                            round(health.score()), health.inFlight(), round(health.successRate() * 100.0d),
                            round(health.averageResponseSeconds()))));
        });
        return result;
    }

    // Busiest domains first
    private List<DeliveryAnalytics.DomainDelivery> domainAnalytics() {
        Map<String, long[]> counts = new LinkedHashMap<>();
        for (Object[] row : sendRecordRepository.countByRecipientAndStatus(FINAL)) {
            String domain = EmailAddressUtil.extractDomain((String) row[0]);
            counts.computeIfAbsent(domain, key -> new long[2])[row[1] == SendStatus.SENT ? 0 : 1]
                    += ((Number) row[2]).longValue();
        }
        return counts.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, long[]>>comparingLong(entry -> entry.getValue()[0] + entry.getValue()[1])
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(TOP_DOMAINS)
                .map(entry -> {
                    long sent = entry.getValue()[0];
                    long failed = entry.getValue()[1];
                    return new DeliveryAnalytics.DomainDelivery(entry.getKey(), sent, failed,
                            percentage(sent, sent + failed));
                })
                .toList();
    }

    // UTC hours with the most opens over the window; ties go to the earlier hour
    private List<DeliveryAnalytics.SendHour> optimalSendTimes() {
        Map<Integer, Long> byHour = new TreeMap<>();
        for (Instant openedAt : openEventRepository.findOpenTimesSince(clock.instant().minus(SEND_TIME_WINDOW))) {
            byHour.merge(openedAt.atZone(ZoneOffset.UTC).getHour(), 1L, Long::sum);
        }
        return byHour.entrySet().stream()
                .sorted(Map.Entry.<Integer, Long>comparingByValue().reversed())
                .limit(OPTIMAL_HOURS)
                .map(entry -> new DeliveryAnalytics.SendHour(entry.getKey(), entry.getValue()))
                .toList();
    }

    private static double round(double value) {
        return Math.round(value * 100.0d) / 100.0d;
    }

    private static final class ServerTally {
        private long sent;
        private long failed;
        private double retrySum;

        void add(SendStatus status, long count, double averageRetries) {
            if (status == SendStatus.SENT) {
                sent += count;
            } else {
                failed += count;
            }
            retrySum += averageRetries * count;
        }

        double averageRetries() {
            long total = sent + failed;
            return total == 0 ? 0.0d : round(retrySum / total);
        }
    }
}
