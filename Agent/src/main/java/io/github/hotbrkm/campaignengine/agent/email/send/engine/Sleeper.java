package io.github.hotbrkm.campaignengine.agent.email.send.engine;

/**
 * Blocking wait used for rate shaping and retry backoff. Interruption cancels the dispatch run.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleep() {
        return millis -> {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
