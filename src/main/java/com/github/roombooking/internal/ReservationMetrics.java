package com.github.roombooking.internal;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer metrics for repository operations and booking outcomes.
 */
public final class ReservationMetrics {

    private final MeterRegistry registry;
    private final String backend;

    public ReservationMetrics(MeterRegistry registry, String backend) {
        this.registry = registry;
        this.backend = backend;
    }

    public void recordOperation(String operation, Duration elapsed, String result) {
        if (registry == null) return;

        Timer.builder("booking.repository.operation")
            .description("Time spent in a repository operation")
            .tag("backend", backend)
            .tag("operation", operation)
            .tag("result", result)
            .register(registry)
            .record(elapsed);
    }

    public void recordOutcome(String outcome) {
        if (registry == null) return;

        Counter.builder("booking.reservations")
            .description("Number of booking operations by outcome")
            .tag("backend", backend)
            .tag("outcome", outcome)
            .register(registry)
            .increment();
    }

    public boolean isEnabled() {
        return registry != null;
    }
}
