package com.github.roombooking;

import com.github.roombooking.room.Room;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A booking of a {@link Room} for a half-open time interval {@code [startTime, endTime)}.
 *
 * <p>A reservation starts out {@link ReservationStatus#CONFIRMED} and can be moved to
 * {@link ReservationStatus#CANCELLED} once; it never goes back. The entity itself does
 * not check that the interval is well-formed or that the room belongs to a catalog;
 * that is done by the service and the validator.</p>
 *
 * <p>Instances are not thread-safe. Repositories hand out detached copies, so changes
 * made to an instance are only visible to other readers after it has been saved.</p>
 */
public final class Reservation {

    private final String id;
    private final Room room;
    private final String userName;
    private final LocalDateTime startTime;
    private final LocalDateTime endTime;
    private final String purpose;
    private ReservationStatus status;

    public Reservation(String id, Room room, String userName,
                       LocalDateTime startTime, LocalDateTime endTime, String purpose) {
        this(id, room, userName, startTime, endTime, purpose, ReservationStatus.CONFIRMED);
    }

    /**
     * Restores a reservation with a previously stored status.
     *
     * @param status the stored status, null means CONFIRMED
     */
    public Reservation(String id, Room room, String userName,
                       LocalDateTime startTime, LocalDateTime endTime, String purpose,
                       ReservationStatus status) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.room = Objects.requireNonNull(room, "room must not be null");
        this.userName = Objects.requireNonNull(userName, "userName must not be null");
        this.startTime = Objects.requireNonNull(startTime, "startTime must not be null");
        this.endTime = Objects.requireNonNull(endTime, "endTime must not be null");
        this.purpose = purpose == null ? "" : purpose;
        this.status = status == null ? ReservationStatus.CONFIRMED : status;
    }

    public String getId() {
        return id;
    }

    public Room getRoom() {
        return room;
    }

    public String getUserName() {
        return userName;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getEndTime() {
        return endTime;
    }

    /**
     * Returns the purpose text.
     *
     * @return the purpose, empty if none was given
     */
    public String getPurpose() {
        return purpose;
    }

    public ReservationStatus getStatus() {
        return status;
    }

    public boolean isCancelled() {
        return status == ReservationStatus.CANCELLED;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    /**
     * Checks whether {@code [start, end)} shares any instant with this reservation's interval.
     *
     * <p>Intervals that only touch at an endpoint do not overlap. The status of this
     * reservation is not taken into account.</p>
     *
     * @param start candidate start
     * @param end candidate end
     * @return true if {@code startTime < end && start < endTime}
     */
    public boolean overlapsWith(LocalDateTime start, LocalDateTime end) {
        return startTime.isBefore(end) && start.isBefore(endTime);
    }

    /**
     * Marks this reservation as cancelled. Callers decide whether re-cancelling is allowed.
     */
    public void cancel() {
        this.status = ReservationStatus.CANCELLED;
    }

    /**
     * Returns a detached copy sharing the same room.
     *
     * @return a new instance with identical state
     */
    public Reservation copy() {
        return new Reservation(id, room, userName, startTime, endTime, purpose, status);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reservation)) return false;
        return id.equals(((Reservation) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Reservation[" + id + ", room=" + room.id() + ", user=" + userName
            + ", " + startTime + " - " + endTime + ", " + status + "]";
    }
}
