package io.github.hotbrkm.campaignengine.agent.email.content;

import java.time.Clock;
import java.util.Objects;
import java.util.random.RandomGenerator;
import java.security.SecureRandom;

/**
 * Clock and random source for one dispatch run. Fixing both makes personalization reproducible.
 */
public record SendContext(Clock clock, RandomGenerator random) {

    public SendContext {
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(random, "random must not be null");
    }

    public static SendContext systemDefault() {
        return new SendContext(Clock.systemDefaultZone(), new SecureRandom());
    }
}
