package com.github.roombooking.file;

import com.github.roombooking.Reservation;
import com.github.roombooking.ReservationRepository;
import com.github.roombooking.ReservationStorageException;
import com.github.roombooking.internal.ReservationJsonCodec;
import com.github.roombooking.internal.ReservationMetrics;
import com.github.roombooking.room.Room;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ReservationRepository} persisted as a JSON array in a single file.
 *
 * <p>Every call reads the whole file. Every mutating call applies its change in memory
 * and rewrites the whole file. There is no append log, no lock and no atomic replace:
 * concurrent writers can lose updates, and a failure part-way through a write can leave
 * the file corrupted. A missing file is (re)created as an empty array before it is read.</p>
 */
public final class FileReservationRepository implements ReservationRepository {

    private static final Logger log = LoggerFactory.getLogger(FileReservationRepository.class);

    static final String BACKEND = "file";

    private final Path path;
    private final ReservationJsonCodec codec;
    private final ReservationMetrics metrics;

    FileReservationRepository(Path path, ReservationJsonCodec codec, MeterRegistry meterRegistry) {
        this.path = path;
        this.codec = codec;
        this.metrics = new ReservationMetrics(meterRegistry, BACKEND);
        ensureFileExists();
    }

    @Override
    public boolean save(Reservation reservation) {
        Instant start = Instant.now();
        try {
            List<Reservation> reservations = load();
            boolean updated = false;
            for (int i = 0; i < reservations.size(); i++) {
                if (reservations.get(i).getId().equals(reservation.getId())) {
                    reservations.set(i, reservation);
                    updated = true;
                    break;
                }
            }
            if (!updated) {
                reservations.add(reservation);
            }
            boolean written = store(reservations);
            metrics.recordOperation("save", Duration.between(start, Instant.now()), written ? "success" : "error");
            return written;
        } catch (ReservationStorageException e) {
            metrics.recordOperation("save", Duration.between(start, Instant.now()), "error");
            log.error("Failed to save reservation {}: {}", reservation.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Reservation> findById(String reservationId) {
        Instant start = Instant.now();
        List<Reservation> reservations = timedLoad("findById", start);
        for (Reservation reservation : reservations) {
            if (reservation.getId().equals(reservationId)) {
                metrics.recordOperation("findById", Duration.between(start, Instant.now()), "success");
                return Optional.of(reservation);
            }
        }
        metrics.recordOperation("findById", Duration.between(start, Instant.now()), "absent");
        return Optional.empty();
    }

    @Override
    public List<Reservation> findByRoomAndTime(Room room, LocalDateTime start, LocalDateTime end) {
        Instant began = Instant.now();
        List<Reservation> overlapping = new ArrayList<>();
        for (Reservation reservation : timedLoad("findByRoomAndTime", began)) {
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
        List<Reservation> reservations = timedLoad("findAll", start);
        metrics.recordOperation("findAll", Duration.between(start, Instant.now()), "success");
        return reservations;
    }

    @Override
    public boolean delete(String reservationId) {
        Instant start = Instant.now();
        try {
            List<Reservation> reservations = load();
            boolean removed = reservations.removeIf(r -> r.getId().equals(reservationId));
            if (!removed) {
                metrics.recordOperation("delete", Duration.between(start, Instant.now()), "absent");
                return false;
            }
            boolean written = store(reservations);
            metrics.recordOperation("delete", Duration.between(start, Instant.now()), written ? "success" : "error");
            return written;
        } catch (ReservationStorageException e) {
            metrics.recordOperation("delete", Duration.between(start, Instant.now()), "error");
            log.error("Failed to delete reservation {}: {}", reservationId, e.getMessage());
            return false;
        }
    }

    @Override
    public String getBackend() {
        return BACKEND;
    }

    /**
     * Returns the backing file.
     *
     * @return the path
     */
    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        // Nothing held open between calls
    }

    // Records the error result for a failed read before rethrowing.
    private List<Reservation> timedLoad(String operation, Instant start) {
        try {
            return load();
        } catch (ReservationStorageException e) {
            metrics.recordOperation(operation, Duration.between(start, Instant.now()), "error");
            throw e;
        }
    }

    private List<Reservation> load() {
        ensureFileExists();
        try {
            if (Files.size(path) == 0) {
                return new ArrayList<>();
            }
            try (InputStream in = Files.newInputStream(path)) {
                return codec.readAll(in);
            }
        } catch (IOException | RuntimeException e) {
            throw new ReservationStorageException(BACKEND, "Failed to read " + path, e);
        }
    }

    private boolean store(List<Reservation> reservations) {
        try (OutputStream out = Files.newOutputStream(path)) {
            codec.writeAll(out, reservations);
            log.debug("Wrote {} reservations to {}", reservations.size(), path);
            return true;
        } catch (IOException e) {
            log.error("Failed to write {}: {}", path, e.getMessage());
            return false;
        }
    }

    private void ensureFileExists() {
        if (Files.exists(path)) {
            return;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(path)) {
                codec.writeAll(out, List.of());
            }
            log.info("Initialized empty reservation file: {}", path);
        } catch (IOException e) {
            throw new ReservationStorageException(BACKEND, "Failed to initialize " + path, e);
        }
    }
}
