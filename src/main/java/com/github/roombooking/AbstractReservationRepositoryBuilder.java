package com.github.roombooking;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Base builder with common configuration for all ReservationRepository implementations.
 *
 * @param <T> the concrete builder type for fluent API
 */
public abstract class AbstractReservationRepositoryBuilder<T extends AbstractReservationRepositoryBuilder<T>> {

    protected MeterRegistry meterRegistry = null;

    /**
     * Sets the Micrometer registry for metrics. Default: none (metrics disabled)
     *
     * @param meterRegistry the meter registry, or null to disable metrics
     * @return this builder
     */
    @SuppressWarnings("unchecked")
    public T meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return (T) this;
    }

    /**
     * Validates that all required fields are set. Subclasses add their own checks.
     *
     * @throws IllegalStateException if required fields are missing
     */
    protected void validate() {
    }

    /**
     * Builds the ReservationRepository with the configured settings.
     *
     * @return a new ReservationRepository instance
     * @throws IllegalStateException if required configuration is missing
     */
    public abstract ReservationRepository build();
}
