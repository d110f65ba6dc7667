package com.github.roombooking.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.roombooking.Reservation;
import com.github.roombooking.ReservationRepository;
import com.github.roombooking.ReservationStatus;
import com.github.roombooking.ReservationStorageException;
import com.github.roombooking.internal.ReservationJsonCodec;
import com.github.roombooking.internal.ReservationMetrics;
import com.github.roombooking.room.Room;
import com.github.roombooking.room.RoomFactory;
import com.github.roombooking.room.RoomType;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC-backed implementation of {@link ReservationRepository}.
 *
 * <p>The conflict query runs in SQL using the same half-open overlap rule as
 * {@link Reservation#overlapsWith(LocalDateTime, LocalDateTime)}. Upserts are an UPDATE
 * followed by an INSERT when no row matched, in one transaction.</p>
 *
 * <p>Required table schema:</p>
 * <pre>{@code
 * CREATE TABLE RESERVATIONS (
 *     reservation_id  VARCHAR(64)    NOT NULL,
 *     room_type       VARCHAR(32)    NOT NULL,
 *     room_id         VARCHAR(128)   NOT NULL,
 *     room_name       VARCHAR(256)   NOT NULL,
 *     capacity        INTEGER        NOT NULL,
 *     equipment       VARCHAR(2000),
 *     user_name       VARCHAR(256)   NOT NULL,
 *     start_time      TIMESTAMP(9)   NOT NULL,
 *     end_time        TIMESTAMP(9)   NOT NULL,
 *     purpose         VARCHAR(1000),
 *     status          VARCHAR(16)    NOT NULL,
 *     PRIMARY KEY (reservation_id)
 * );
 * }</pre>
 *
 * <p>The timestamp columns need nanosecond precision; a narrower type rounds stored times.</p>
 */
public final class JdbcReservationRepository implements ReservationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcReservationRepository.class);

    static final String BACKEND = "jdbc";

    private static final String COLUMNS =
        "reservation_id, room_type, room_id, room_name, capacity, equipment, "
            + "user_name, start_time, end_time, purpose, status";

    private final DataSource dataSource;
    private final String tableName;
    private final ReservationJsonCodec codec;
    private final ReservationMetrics metrics;

    // SQL statements
    private final String insertSql;
    private final String updateSql;
    private final String deleteSql;
    private final String selectByIdSql;
    private final String selectAllSql;
    private final String selectConflictsSql;

    JdbcReservationRepository(
            DataSource dataSource,
            String tableName,
            ReservationJsonCodec codec,
            MeterRegistry meterRegistry) {
        this.dataSource = dataSource;
        this.tableName = tableName;
        this.codec = codec;
        this.metrics = new ReservationMetrics(meterRegistry, BACKEND);

        this.insertSql = String.format(
            "INSERT INTO %s (%s) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            tableName, COLUMNS);
        this.updateSql = String.format(
            "UPDATE %s SET room_type = ?, room_id = ?, room_name = ?, capacity = ?, equipment = ?, "
                + "user_name = ?, start_time = ?, end_time = ?, purpose = ?, status = ? "
                + "WHERE reservation_id = ?",
            tableName);
        this.deleteSql = String.format(
            "DELETE FROM %s WHERE reservation_id = ?",
            tableName);
        this.selectByIdSql = String.format(
            "SELECT %s FROM %s WHERE reservation_id = ?",
            COLUMNS, tableName);
        this.selectAllSql = String.format(
            "SELECT %s FROM %s",
            COLUMNS, tableName);
        this.selectConflictsSql = String.format(
            "SELECT %s FROM %s WHERE room_id = ? AND status <> ? AND start_time < ? AND end_time > ?",
            COLUMNS, tableName);
    }

    @Override
    public boolean save(Reservation reservation) {
        Instant start = Instant.now();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                String equipment = codec.writeEquipment(reservation.getRoom().equipment());
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    bindColumns(ps, 1, reservation, equipment);
                    ps.setString(11, reservation.getId());
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, reservation.getId());
                        bindColumns(ps, 2, reservation, equipment);
                        ps.executeUpdate();
                    }
                }
                conn.commit();
                metrics.recordOperation("save", Duration.between(start, Instant.now()), "success");
                log.debug("Saved reservation: {} ({})", reservation.getId(), updated == 0 ? "inserted" : "updated");
                return true;
            } catch (SQLException | JsonProcessingException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | JsonProcessingException e) {
            metrics.recordOperation("save", Duration.between(start, Instant.now()), "error");
            log.error("Failed to save reservation {}: {}", reservation.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Reservation> findById(String reservationId) {
        Instant start = Instant.now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(selectByIdSql)) {
            ps.setString(1, reservationId);
            List<Reservation> found = readAll(ps);
            metrics.recordOperation("findById", Duration.between(start, Instant.now()),
                found.isEmpty() ? "absent" : "success");
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            metrics.recordOperation("findById", Duration.between(start, Instant.now()), "error");
            throw new ReservationStorageException(BACKEND, "Failed to read reservation " + reservationId, e);
        } catch (ReservationStorageException e) {
            metrics.recordOperation("findById", Duration.between(start, Instant.now()), "error");
            throw e;
        }
    }

    @Override
    public List<Reservation> findByRoomAndTime(Room room, LocalDateTime start, LocalDateTime end) {
        Instant began = Instant.now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(selectConflictsSql)) {
            ps.setString(1, room.id());
            ps.setString(2, ReservationStatus.CANCELLED.name());
            ps.setObject(3, end);
            ps.setObject(4, start);
            List<Reservation> overlapping = readAll(ps);
            metrics.recordOperation("findByRoomAndTime", Duration.between(began, Instant.now()), "success");
            return overlapping;
        } catch (SQLException e) {
            metrics.recordOperation("findByRoomAndTime", Duration.between(began, Instant.now()), "error");
            throw new ReservationStorageException(BACKEND, "Failed to query conflicts for room " + room.id(), e);
        } catch (ReservationStorageException e) {
            metrics.recordOperation("findByRoomAndTime", Duration.between(began, Instant.now()), "error");
            throw e;
        }
    }

    @Override
    public List<Reservation> findAll() {
        Instant start = Instant.now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(selectAllSql)) {
            List<Reservation> reservations = readAll(ps);
            metrics.recordOperation("findAll", Duration.between(start, Instant.now()), "success");
            return reservations;
        } catch (SQLException e) {
            metrics.recordOperation("findAll", Duration.between(start, Instant.now()), "error");
            throw new ReservationStorageException(BACKEND, "Failed to read " + tableName, e);
        } catch (ReservationStorageException e) {
            metrics.recordOperation("findAll", Duration.between(start, Instant.now()), "error");
            throw e;
        }
    }

    @Override
    public boolean delete(String reservationId) {
        Instant start = Instant.now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(deleteSql)) {
            ps.setString(1, reservationId);
            int deleted = ps.executeUpdate();
            metrics.recordOperation("delete", Duration.between(start, Instant.now()),
                deleted > 0 ? "success" : "absent");
            log.debug("Delete reservation {}: {} rows", reservationId, deleted);
            return deleted > 0;
        } catch (SQLException e) {
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
     * Returns the table name used for storing reservations.
     *
     * @return the table name
     */
    public String getTableName() {
        return tableName;
    }

    @Override
    public void close() {
        // Do not close the DataSource - it's managed externally
    }

    private static void bindColumns(PreparedStatement ps, int first, Reservation reservation, String equipment)
            throws SQLException {
        Room room = reservation.getRoom();
        int i = first;
        ps.setString(i++, room.type().name());
        ps.setString(i++, room.id());
        ps.setString(i++, room.name());
        ps.setInt(i++, room.capacity());
        ps.setString(i++, equipment);
        ps.setString(i++, reservation.getUserName());
        ps.setObject(i++, reservation.getStartTime());
        ps.setObject(i++, reservation.getEndTime());
        ps.setString(i++, reservation.getPurpose());
        ps.setString(i, reservation.getStatus().name());
    }

    private List<Reservation> readAll(PreparedStatement ps) throws SQLException {
        List<Reservation> reservations = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                reservations.add(mapRow(rs));
            }
        }
        return reservations;
    }

    private Reservation mapRow(ResultSet rs) throws SQLException {
        String reservationId = rs.getString("reservation_id");
        try {
            Room room = RoomFactory.fromEquipment(
                RoomType.fromTag(rs.getString("room_type")),
                rs.getString("room_id"),
                rs.getString("room_name"),
                rs.getInt("capacity"),
                codec.readEquipment(rs.getString("equipment")));
            return new Reservation(
                reservationId,
                room,
                rs.getString("user_name"),
                rs.getObject("start_time", LocalDateTime.class),
                rs.getObject("end_time", LocalDateTime.class),
                rs.getString("purpose"),
                ReservationStatus.valueOf(rs.getString("status")));
        } catch (JsonProcessingException | IllegalArgumentException | NullPointerException e) {
            // NULL columns from a table without NOT NULL constraints end up here too
            throw new ReservationStorageException(BACKEND, "Corrupt row for reservation " + reservationId, e);
        }
    }
}
