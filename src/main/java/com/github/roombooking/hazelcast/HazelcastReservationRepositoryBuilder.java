package com.github.roombooking.hazelcast;

import com.github.roombooking.AbstractReservationRepositoryBuilder;
import com.github.roombooking.ReservationRepository;
import com.github.roombooking.internal.ReservationJsonCodec;
import com.hazelcast.core.HazelcastInstance;

import java.util.Objects;

/**
 * Builder for creating Hazelcast-backed {@link ReservationRepository} instances.
 *
 * <p>Each repository uses a dedicated Hazelcast IMap named "{prefix}-{name}",
 * "reservations-default" unless configured otherwise.</p>
 */
public final class HazelcastReservationRepositoryBuilder
        extends AbstractReservationRepositoryBuilder<HazelcastReservationRepositoryBuilder> {

    private final HazelcastInstance hazelcastInstance;
    private String mapPrefix = "reservations";
    private String name = "default";

    public HazelcastReservationRepositoryBuilder(HazelcastInstance hazelcastInstance) {
        this.hazelcastInstance = Objects.requireNonNull(hazelcastInstance,
            "hazelcastInstance must not be null");
    }

    /**
     * Sets the prefix for the Hazelcast IMap name. Default: "reservations"
     *
     * @param mapPrefix the map name prefix (must not be null or empty)
     * @return this builder
     */
    public HazelcastReservationRepositoryBuilder mapPrefix(String mapPrefix) {
        Objects.requireNonNull(mapPrefix, "mapPrefix must not be null");
        if (mapPrefix.isEmpty()) {
            throw new IllegalArgumentException("mapPrefix must not be empty");
        }
        this.mapPrefix = mapPrefix;
        return this;
    }

    /**
     * Sets the ledger name, e.g. one per site or tenant. Default: "default"
     *
     * @param name the ledger name (must not be null or empty)
     * @return this builder
     */
    public HazelcastReservationRepositoryBuilder name(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        this.name = name;
        return this;
    }

    @Override
    public ReservationRepository build() {
        validate();
        String mapName = mapPrefix + "-" + name;
        return new HazelcastReservationRepository(
            hazelcastInstance,
            mapName,
            new ReservationJsonCodec(),
            meterRegistry
        );
    }
}
