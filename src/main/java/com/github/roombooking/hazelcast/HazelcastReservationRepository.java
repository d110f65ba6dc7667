package com.github.roombooking.hazelcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.roombooking.Reservation;
import com.github.roombooking.ReservationRepository;
import com.github.roombooking.ReservationStorageException;
import com.github.roombooking.internal.ReservationJsonCodec;
import com.github.roombooking.internal.ReservationMetrics;
import com.github.roombooking.room.Room;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Hazelcast-backed implementation of {@link ReservationRepository}.
 *
 * <p>Each repository uses a dedicated IMap keyed by reservation id. Values are the JSON
 * documents written by {@link ReservationJsonCodec}, so members need no domain classes on
 * their classpath. Conflict queries scan the map values on the caller's side.</p>
 */
public final class HazelcastReservationRepository implements ReservationRepository {

    private static final Logger log = LoggerFactory.getLogger(HazelcastReservationRepository.class);

    static final String BACKEND = "hazelcast";

    private final IMap<String, String> reservationMap;
    private final String mapName;
    private final ReservationJsonCodec codec;
    private final ReservationMetrics metrics;

    HazelcastReservationRepository(
            HazelcastInstance hazelcastInstance,
            String mapName,
            ReservationJsonCodec codec,
            MeterRegistry meterRegistry) {
        this.reservationMap = hazelcastInstance.getMap(mapName);
        this.mapName = mapName;
        this.codec = codec;
        this.metrics = new ReservationMetrics(meterRegistry, BACKEND);
    }

    @Override
    public boolean save(Reservation reservation) {
        Instant start = Instant.now();
        try {
            reservationMap.set(reservation.getId(), codec.write(reservation));
            metrics.recordOperation("save", Duration.between(start, Instant.now()), "success");
            log.debug("Saved reservation: {}", reservation.getId());
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            metrics.recordOperation("save", Duration.between(start, Instant.now()), "error");
            log.error("Failed to save reservation {} to map {}: {}", reservation.getId(), mapName, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Reservation> findById(String reservationId) {
        Instant start = Instant.now();
        try {
            String json = reservationMap.get(reservationId);
            Optional<Reservation> found = json == null ? Optional.empty() : Optional.of(decode(json));
            metrics.recordOperation("findById", Duration.between(start, Instant.now()),
                found.isPresent() ? "success" : "absent");
            return found;
        } catch (ReservationStorageException e) {
            metrics.recordOperation("findById", Duration.between(start, Instant.now()), "error");
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation("findById", Duration.between(start, Instant.now()), "error");
            throw new ReservationStorageException(BACKEND, "Failed to read " + reservationId + " from " + mapName, e);
        }
    }

    @Override
    public List<Reservation> findByRoomAndTime(Room room, LocalDateTime start, LocalDateTime end) {
        Instant began = Instant.now();
        List<Reservation> overlapping = new ArrayList<>();
        for (Reservation reservation : readAll("findByRoomAndTime", began)) {
            if (reservation.getRoom().id().equals(room.id())
                    && reservation.overlapsWith(start, end)
                    && !reservation.isCancelled()) {
                overlapping.add(reservation);
            }
        }
        metrics.recordOperation("findByRoomAndTime", Duration.between(began, Instant.now()), "success");
        return overlapping;
    }

    @Override
    public List<Reservation> findAll() {
        Instant start = Instant.now();
        List<Reservation> reservations = readAll("findAll", start);
        metrics.recordOperation("findAll", Duration.between(start, Instant.now()), "success");
        return reservations;
    }

    @Override
    public boolean delete(String reservationId) {
        Instant start = Instant.now();
        try {
            boolean removed = reservationMap.remove(reservationId) != null;
            metrics.recordOperation("delete", Duration.between(start, Instant.now()),
                removed ? "success" : "absent");
            if (removed) {
                log.debug("Deleted reservation: {}", reservationId);
            }
            return removed;
        } catch (RuntimeException e) {
            metrics.recordOperation("delete", Duration.between(start, Instant.now()), "error");
            log.error("Failed to delete reservation {} from map {}: {}", reservationId, mapName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getBackend() {
        return BACKEND;
    }

    /**
     * Returns the Hazelcast IMap name used for storing reservations.
     *
     * @return the map name
     */
    public String getMapName() {
        return mapName;
    }

    @Override
    public void close() {
        // Do not close the Hazelcast instance - it's managed externally
    }

    private List<Reservation> readAll(String operation, Instant start) {
        try {
            Collection<String> values;
            try {
                values = reservationMap.values();
            } catch (RuntimeException e) {
                throw new ReservationStorageException(BACKEND, "Failed to read map " + mapName, e);
            }
            List<Reservation> reservations = new ArrayList<>(values.size());
            for (String json : values) {
                reservations.add(decode(json));
            }
            return reservations;
        } catch (ReservationStorageException e) {
            metrics.recordOperation(operation, Duration.between(start, Instant.now()), "error");
            throw e;
        }
    }

    private Reservation decode(String json) {
        try {
            return codec.read(json);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new ReservationStorageException(BACKEND, "Corrupt entry in map " + mapName, e);
        }
    }
}
