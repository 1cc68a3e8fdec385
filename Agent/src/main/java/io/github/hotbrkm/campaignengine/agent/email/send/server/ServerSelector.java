package io.github.hotbrkm.campaignengine.agent.email.send.server;

import java.time.Duration;
import java.util.List;

/**
 * Chooses the relay for the next transport attempt.
 * <p>
 * Every {@link #next()} is answered by exactly one {@code recordOutcome} call for the returned server, so load
 * accounting stays balanced. A failed attempt must be recorded before asking for the next server.
 */
public interface ServerSelector {

    /**
     * @throws NoServerAvailableException when no enabled server exists
     */
    SmtpServer next();

    void recordOutcome(SmtpServer server, boolean success, Duration responseTime);

    default void recordOutcome(SmtpServer server, boolean success) {
        recordOutcome(server, success, Duration.ZERO);
    }

    /**
     * Health of every server in the pool, in configuration order. Selectors that keep no health return none.
     */
    default List<ServerHealthSnapshot> healthSnapshot() {
        return List.of();
    }
}
