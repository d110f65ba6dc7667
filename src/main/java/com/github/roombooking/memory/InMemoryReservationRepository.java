package com.github.roombooking.memory;

import com.github.roombooking.Reservation;
import com.github.roombooking.ReservationRepository;
import com.github.roombooking.internal.ReservationMetrics;
import com.github.roombooking.room.Room;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Volatile {@link ReservationRepository} backed by a map keyed by reservation id.
 *
 * <p>Stores a copy on save and hands out copies on read so that it behaves like the
 * persistent backends. Not synchronized: callers sharing an instance between threads
 * must guard it themselves.</p>
 */
public final class InMemoryReservationRepository implements ReservationRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReservationRepository.class);

    static final String BACKEND = "memory";

    private final Map<String, Reservation> reservations = new LinkedHashMap<>();
    private final ReservationMetrics metrics;

    InMemoryReservationRepository(MeterRegistry meterRegistry) {
        this.metrics = new ReservationMetrics(meterRegistry, BACKEND);
    }

    @Override
    public boolean save(Reservation reservation) {
        Instant start = Instant.now();
        reservations.put(reservation.getId(), reservation.copy());
        metrics.recordOperation("save", Duration.between(start, Instant.now()), "success");
        log.debug("Saved reservation: {}", reservation.getId());
        return true;
    }

    @Override
    public Optional<Reservation> findById(String reservationId) {
        Instant start = Instant.now();
        Reservation found = reservations.get(reservationId);
        metrics.recordOperation("findById", Duration.between(start, Instant.now()),
            found != null ? "success" : "absent");
        return Optional.ofNullable(found).map(Reservation::copy);
    }

    @Override
    public List<Reservation> findByRoomAndTime(Room room, LocalDateTime start, LocalDateTime end) {
        Instant began = Instant.now();
        List<Reservation> overlapping = new ArrayList<>();
        for (Reservation reservation : reservations.values()) {
            if (reservation.getRoom().id().equals(room.id())
                    && reservation.overlapsWith(start, end)
                    && !reservation.isCancelled()) {
                overlapping.add(reservation.copy());
            }
        }
        metrics.recordOperation("findByRoomAndTime", Duration.between(began, Instant.now()), "success");
        return overlapping;
    }

    @Override
    public List<Reservation> findAll() {
        Instant start = Instant.now();
        List<Reservation> all = new ArrayList<>(reservations.size());
        for (Reservation reservation : reservations.values()) {
            all.add(reservation.copy());
        }
        metrics.recordOperation("findAll", Duration.between(start, Instant.now()), "success");
        return all;
    }

    @Override
    public boolean delete(String reservationId) {
        Instant start = Instant.now();
        boolean removed = reservations.remove(reservationId) != null;
        metrics.recordOperation("delete", Duration.between(start, Instant.now()),
            removed ? "success" : "absent");
        if (removed) {
            log.debug("Deleted reservation: {}", reservationId);
        }
        return removed;
    }

    @Override
    public String getBackend() {
        return BACKEND;
    }

    /**
     * Returns the number of stored reservations.
     *
     * @return the size, cancelled reservations included
     */
    public int size() {
        return reservations.size();
    }

    @Override
    public void close() {
        // Nothing to release
    }
}
