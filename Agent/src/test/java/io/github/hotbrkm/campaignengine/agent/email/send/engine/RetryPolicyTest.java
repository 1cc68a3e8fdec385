package io.github.hotbrkm.campaignengine.agent.email.send.engine;

import io.github.hotbrkm.campaignengine.agent.email.config.EmailConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryPolicy test")
class RetryPolicyTest {

    @Test
    @DisplayName("Default backoff doubles from 2s and attempts stop at three")
    void defaults() {
        RetryPolicy policy = new RetryPolicy(new EmailConfig.Send());

        assertThat(policy.computeRetryDelayMillis(1)).isEqualTo(2_000L);
        assertThat(policy.computeRetryDelayMillis(2)).isEqualTo(4_000L);
        assertThat(policy.canRetry(1)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
        assertThat(policy.maxAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Delay never exceeds the cap, even when the exponent overflows")
    void computeRetryDelayMillis_isCapped() {
        RetryPolicy policy = new RetryPolicy(10, 1_000L, 60_000L, 2.0d);

        assertThat(policy.computeRetryDelayMillis(5)).isEqualTo(32_000L);
        assertThat(policy.computeRetryDelayMillis(6)).isEqualTo(60_000L);
        assertThat(policy.computeRetryDelayMillis(500)).isEqualTo(60_000L);
    }

    @Test
    @DisplayName("Non-positive settings fall back to sane values")
    void constructor_sanitizesInput() {
        RetryPolicy policy = new RetryPolicy(0, -1L, 10_000L, 0d);

        assertThat(policy.maxAttempts()).isEqualTo(1);
        assertThat(policy.canRetry(1)).isFalse();
        assertThat(policy.computeRetryDelayMillis(3)).isZero();
    }
}
