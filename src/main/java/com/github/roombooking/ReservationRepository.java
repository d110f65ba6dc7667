package com.github.roombooking;

import com.github.roombooking.file.FileReservationRepositoryBuilder;
import com.github.roombooking.hazelcast.HazelcastReservationRepositoryBuilder;
import com.github.roombooking.jdbc.JdbcReservationRepositoryBuilder;
import com.github.roombooking.memory.InMemoryReservationRepositoryBuilder;
import com.github.roombooking.room.Room;
import com.hazelcast.core.HazelcastInstance;

import javax.sql.DataSource;
import java.io.Closeable;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Storage for {@link Reservation}s keyed by reservation id.
 *
 * <p>All implementations behave identically from the caller's point of view: the same
 * sequence of calls yields the same results whichever backend is used. Every returned
 * reservation is a detached copy.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ReservationRepository repository = ReservationRepository.file(Path.of("reservations.json"))
 *     .meterRegistry(registry)
 *     .build();
 *
 * repository.save(reservation);
 * List<Reservation> conflicts = repository.findByRoomAndTime(room, start, end);
 * }</pre>
 *
 * <p>No implementation provides locking or isolation between concurrent writers.</p>
 */
public interface ReservationRepository extends Closeable {

    /**
     * Creates a builder for a volatile, map-backed repository.
     *
     * @return a new builder instance
     */
    static InMemoryReservationRepositoryBuilder inMemory() {
        return new InMemoryReservationRepositoryBuilder();
    }

    /**
     * Creates a builder for a repository persisted as a JSON file.
     *
     * @param path the backing file, created as an empty collection if missing
     * @return a new builder instance
     * @throws NullPointerException if path is null
     */
    static FileReservationRepositoryBuilder file(Path path) {
        return new FileReservationRepositoryBuilder(path);
    }

    /**
     * Creates a builder for a repository stored in a Hazelcast IMap.
     *
     * @param hazelcastInstance the member or client instance to use
     * @return a new builder instance
     * @throws NullPointerException if hazelcastInstance is null
     */
    static HazelcastReservationRepositoryBuilder hazelcast(HazelcastInstance hazelcastInstance) {
        return new HazelcastReservationRepositoryBuilder(hazelcastInstance);
    }

    /**
     * Creates a builder for a repository stored in a relational table.
     *
     * @param dataSource the DataSource to use for database connections
     * @return a new builder instance
     * @throws NullPointerException if dataSource is null
     */
    static JdbcReservationRepositoryBuilder jdbc(DataSource dataSource) {
        return new JdbcReservationRepositoryBuilder(dataSource);
    }

    /**
     * Inserts the reservation, or overwrites the stored one with the same id.
     *
     * @param reservation the reservation to store
     * @return true if stored, false if the backing store could not be written
     */
    boolean save(Reservation reservation);

    /**
     * Looks up a reservation by id.
     *
     * @param reservationId the id
     * @return the reservation, or empty if absent
     * @throws ReservationStorageException if the backing store cannot be read
     */
    Optional<Reservation> findById(String reservationId);

    /**
     * Returns the reservations that block {@code [start, end)} on the given room.
     *
     * <p>A stored reservation is returned when its room id matches, its interval overlaps
     * the requested one and it is not cancelled. Order is unspecified.</p>
     *
     * @param room the room to check
     * @param start requested start
     * @param end requested end
     * @return the conflicting reservations, empty if the room is free
     * @throws ReservationStorageException if the backing store cannot be read
     */
    List<Reservation> findByRoomAndTime(Room room, LocalDateTime start, LocalDateTime end);

    /**
     * Returns every stored reservation, cancelled ones included. Order is unspecified.
     *
     * @return all reservations
     * @throws ReservationStorageException if the backing store cannot be read
     */
    List<Reservation> findAll();

    /**
     * Permanently removes a reservation. This is a data-retention operation, not a
     * cancellation.
     *
     * @param reservationId the id
     * @return true if removed, false if absent or the backing store could not be written
     */
    boolean delete(String reservationId);

    /**
     * Returns the backend name, used as a metrics tag.
     *
     * @return the backend name, never null
     */
    String getBackend();

    /**
     * Closes this repository.
     *
     * <p>Note: This does NOT close an externally managed Hazelcast instance or DataSource.</p>
     */
    @Override
    void close();
}
