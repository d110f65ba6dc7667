package com.github.roombooking.service;

import com.github.roombooking.Reservation;
import com.github.roombooking.ReservationRepository;
import com.github.roombooking.notification.LoggingNotifier;
import com.github.roombooking.room.Classroom;
import com.github.roombooking.room.Room;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditLogListenerTest {

    private static final Room ROOM = new Classroom("CL-1", "Room 1", 10);
    private static final LocalDateTime T = LocalDateTime.of(2030, 4, 1, 9, 0);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2030-03-01T08:30:00Z"), ZoneOffset.UTC);

    @Test
    void shouldRecordCommittedTransitionsInOrder() {
        AuditLogListener audit = new AuditLogListener(CLOCK);
        ReservationService service = ReservationService.builder()
            .repository(ReservationRepository.inMemory().build())
            .notifier(new LoggingNotifier())
            .listener(audit)
            .build();

        Reservation booked = service.createReservation(ROOM, "Jane", T, T.plusHours(1), "Review")
            .getReservation().orElseThrow();
        service.createReservation(ROOM, "John", T, T.plusHours(2), "Clash");
        service.cancelReservation(booked.getId());
        service.cancelReservation(booked.getId());

        LocalDateTime now = LocalDateTime.of(2030, 3, 1, 8, 30);
        assertThat(audit.getEntries()).containsExactly(
            new AuditLogListener.Entry(now, AuditLogListener.Event.CREATED, booked.getId(), "Room 1", "Jane"),
            new AuditLogListener.Entry(now, AuditLogListener.Event.CANCELLED, booked.getId(), "Room 1", "Jane"));
    }

    @Test
    void entriesShouldBeReadOnlySnapshot() {
        AuditLogListener audit = new AuditLogListener(CLOCK);
        audit.onCreated(new Reservation("RES-0000E001", ROOM, "Jane", T, T.plusHours(1), ""));

        List<AuditLogListener.Entry> entries = audit.getEntries();
        audit.onCancelled(new Reservation("RES-0000E001", ROOM, "Jane", T, T.plusHours(1), ""));

        assertThat(entries).hasSize(1);
        assertThat(audit.getEntries()).hasSize(2);
        assertThatThrownBy(() -> entries.clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
