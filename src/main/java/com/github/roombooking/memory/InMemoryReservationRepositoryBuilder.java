package com.github.roombooking.memory;

import com.github.roombooking.AbstractReservationRepositoryBuilder;
import com.github.roombooking.ReservationRepository;

/**
 * Builder for creating in-memory {@link ReservationRepository} instances.
 */
public final class InMemoryReservationRepositoryBuilder
        extends AbstractReservationRepositoryBuilder<InMemoryReservationRepositoryBuilder> {

    @Override
    public ReservationRepository build() {
        validate();
        return new InMemoryReservationRepository(meterRegistry);
    }
}
