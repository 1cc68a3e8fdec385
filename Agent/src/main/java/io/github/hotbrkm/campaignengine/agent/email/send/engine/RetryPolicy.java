package io.github.hotbrkm.campaignengine.agent.email.send.engine;

import io.github.hotbrkm.campaignengine.agent.email.config.EmailConfig;

/**
 * Attempt ceiling and exponential backoff between transport attempts.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final double backoffMultiplier;

    public RetryPolicy(EmailConfig.Send send) {
        this(send.resolveMaxAttempts(), send.resolveRetryBaseDelayMs(), send.resolveMaxRetryDelayMs(),
                send.resolveRetryBackoffMultiplier());
    }

    public RetryPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis, double backoffMultiplier) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMillis = Math.max(0L, baseDelayMillis);
        this.maxDelayMillis = Math.max(0L, maxDelayMillis);
        this.backoffMultiplier = backoffMultiplier > 0 ? backoffMultiplier : 2.0d;
    }

    public boolean canRetry(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay after the given failed attempt: {@code base * multiplier^attempt}, capped. With the defaults the
     * waits are 2s after the first failure and 4s after the second.
     */
    long computeRetryDelayMillis(int attempt) {
        double factor = Math.pow(backoffMultiplier, Math.max(0, attempt));
        long candidate = (long) (baseDelayMillis * factor);
        if (candidate < 0L) {
            candidate = Long.MAX_VALUE;
        }
        return Math.min(candidate, maxDelayMillis);
    }
}
