package com.github.roombooking.service;

import com.github.roombooking.Reservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps an in-memory audit trail of committed reservation transitions.
 *
 * <p>Each entry is stamped with the listener's clock and also logged at INFO. Reservations
 * only ever move from CONFIRMED to CANCELLED, so the trail holds creations and
 * cancellations. Not thread-safe.</p>
 */
public final class AuditLogListener implements ReservationListener {

    private static final Logger log = LoggerFactory.getLogger(AuditLogListener.class);

    public enum Event {
        CREATED,
        CANCELLED
    }

    public record Entry(LocalDateTime timestamp, Event event, String reservationId, String roomName,
                        String userName) {
    }

    private final Clock clock;
    private final List<Entry> entries = new ArrayList<>();

    public AuditLogListener() {
        this(Clock.systemDefaultZone());
    }

    public AuditLogListener(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void onCreated(Reservation reservation) {
        record(Event.CREATED, reservation);
    }

    @Override
    public void onCancelled(Reservation reservation) {
        record(Event.CANCELLED, reservation);
    }

    /**
     * Returns the entries recorded so far, oldest first.
     *
     * @return an unmodifiable snapshot
     */
    public List<Entry> getEntries() {
        return List.copyOf(entries);
    }

    private void record(Event event, Reservation reservation) {
        Entry entry = new Entry(LocalDateTime.now(clock), event, reservation.getId(),
            reservation.getRoom().name(), reservation.getUserName());
        entries.add(entry);
        log.info("Audit: {} {} room={} user={}", entry.event(), entry.reservationId(),
            entry.roomName(), entry.userName());
    }
}
