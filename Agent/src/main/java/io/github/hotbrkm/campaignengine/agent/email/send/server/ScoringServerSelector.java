package io.github.hotbrkm.campaignengine.agent.email.send.server;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Picks the enabled server with the highest score:
 * {@code 100 + priority*10 + successRate*50 - averageResponseSeconds}, floored at zero.
 * <p>
 * Equal scores go to the server with fewer attempts in flight, and remaining ties rotate round-robin.
 */
@Slf4j
public class ScoringServerSelector implements ServerSelector {

    private static final double SCORE_EPSILON = 1e-9;

    private final Map<String, SmtpServer> servers = new LinkedHashMap<>();
    private final Map<String, ServerHealth> healthByName = new LinkedHashMap<>();
    private int roundRobinCursor;

    public ScoringServerSelector(Collection<SmtpServer> pool) {
        Objects.requireNonNull(pool, "pool must not be null");
        for (SmtpServer server : pool) {
            if (servers.putIfAbsent(server.name(), server) != null) {
                throw new IllegalArgumentException("Duplicate server name: " + server.name());
            }
            healthByName.put(server.name(), new ServerHealth());
        }
    }

    @Override
    public synchronized SmtpServer next() {
        List<SmtpServer> best = new ArrayList<>();
        double bestScore = -1;
        int bestLoad = Integer.MAX_VALUE;

        for (SmtpServer server : servers.values()) {
            if (!server.enabled()) {
                continue;
            }
            ServerHealth health = healthByName.get(server.name());
            double score = health.score(server.priority());
            int load = health.inFlight();

            if (score > bestScore + SCORE_EPSILON || (Math.abs(score - bestScore) <= SCORE_EPSILON && load < bestLoad)) {
                best.clear();
                best.add(server);
                bestScore = score;
                bestLoad = load;
            } else if (Math.abs(score - bestScore) <= SCORE_EPSILON && load == bestLoad) {
                best.add(server);
            }
        }

        if (best.isEmpty()) {
            throw new NoServerAvailableException("No enabled SMTP server in pool of " + servers.size());
        }

        SmtpServer selected = best.get(Math.floorMod(roundRobinCursor++, best.size()));
        healthByName.get(selected.name()).acquire();
        log.debug("server={}, score={}, candidates={}, event=server_selected", selected.name(), bestScore, best.size());
        return selected;
    }

    @Override
    public void recordOutcome(SmtpServer server, boolean success, Duration responseTime) {
        ServerHealth health = healthOf(server);
        health.record(success, responseTime);
        if (!success) {
            log.info("server={}, successRate={}, event=server_failure_recorded", server.name(),
                    String.format("%.3f", health.successRate()));
        }
    }

    public double score(SmtpServer server) {
        return healthOf(server).score(server.priority());
    }

    public int inFlight(SmtpServer server) {
        return healthOf(server).inFlight();
    }

    // Each server's figures are consistent; the list as a whole is not one atomic view
    @Override
    public List<ServerHealthSnapshot> healthSnapshot() {
        List<ServerHealthSnapshot> snapshot = new ArrayList<>(servers.size());
        for (SmtpServer server : servers.values()) {
            ServerHealth health = healthByName.get(server.name());
            synchronized (health) {
                snapshot.add(new ServerHealthSnapshot(server.name(), server.host(), server.priority(),
                        server.enabled(), health.score(server.priority()), health.inFlight(), health.successRate(),
                        health.averageResponseSeconds(), health.successCount(), health.failureCount()));
            }
        }
        return snapshot;
    }

    private ServerHealth healthOf(SmtpServer server) {
        Objects.requireNonNull(server, "server must not be null");
        ServerHealth health = healthByName.get(server.name());
        if (health == null) {
            throw new IllegalArgumentException("Server is not part of this pool: " + server.name());
        }
        return health;
    }
}
