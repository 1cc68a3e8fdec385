package io.github.hotbrkm.campaignengine.agent.email.send.server;

import java.time.Duration;

/**
 * Rolling health of one server. Success rate and response time are exponentially weighted, so recent attempts
 * count most. All access goes through this object's monitor.
 */
final class ServerHealth {

    static final double SMOOTHING = 0.2d;

    private double successRate = 1.0d;
    private double averageResponseSeconds = 0.0d;
    private int inFlight;
    private long successCount;
    private long failureCount;

    synchronized void acquire() {
        inFlight++;
    }

    synchronized void record(boolean success, Duration responseTime) {
        if (inFlight > 0) {
            inFlight--;
        }
        if (success) {
            successCount++;
            successRate += SMOOTHING * (1.0d - successRate);
            double seconds = responseTime == null ? 0.0d : responseTime.toNanos() / 1_000_000_000.0d;
            averageResponseSeconds += SMOOTHING * (seconds - averageResponseSeconds);
        } else {
            failureCount++;
            successRate -= SMOOTHING * successRate;
        }
    }

    synchronized double score(int priority) {
        double score = 100 + priority * 10 + successRate * 50 - averageResponseSeconds;
        return Math.max(0.0d, score);
    }

    synchronized int inFlight() {
        return inFlight;
    }

    synchronized double successRate() {
        return successRate;
    }

    synchronized double averageResponseSeconds() {
        return averageResponseSeconds;
    }

    synchronized long successCount() {
        return successCount;
    }

    synchronized long failureCount() {
        return failureCount;
    }
}
