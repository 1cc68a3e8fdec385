package io.github.hotbrkm.campaignengine.agent.email.send.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class DeliveryMetricsRecorder {

    private final MeterRegistry registry;

    public DeliveryMetricsRecorder(MeterRegistry registry) {
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    public void recordAttempt(String server, boolean success, Duration elapsed) {
        registry.counter("campaign.delivery.attempt",
                "server", safe(server),
                "outcome", success ? "success" : "failure")
                .increment();

        if (elapsed != null) {
            registry.timer("campaign.delivery.transport",
                    "server", safe(server))
                    .record(elapsed);
        }
    }

    public void recordResult(String status) {
        registry.counter("campaign.delivery.result",
                "status", safe(status))
                .increment();
    }

    public void recordCounterFailure(String counter) {
        registry.counter("campaign.delivery.counter.failure",
                "counter", safe(counter))
                .increment();
    }

    private String safe(String value) {
        return value == null || value.isBlank() ? "none" : value;
    }
}
