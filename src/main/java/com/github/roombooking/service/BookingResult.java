package com.github.roombooking.service;

import com.github.roombooking.Reservation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What a create or cancel call did, with human-readable messages.
 *
 * <p>Successful results carry the reservation. Failed results carry at least one
 * message explaining the rejection; a {@link BookingOutcome#STORAGE_FAILURE} on cancel also
 * carries the reservation, whose in-memory status may no longer match storage.</p>
 */
public final class BookingResult {

    private final BookingOutcome outcome;
    private final Reservation reservation;
    private final List<String> messages;

    private BookingResult(BookingOutcome outcome, Reservation reservation, List<String> messages) {
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        this.reservation = reservation;
        this.messages = List.copyOf(messages);
    }

    static BookingResult success(BookingOutcome outcome, Reservation reservation, List<String> messages) {
        return new BookingResult(outcome, Objects.requireNonNull(reservation, "reservation must not be null"),
            messages);
    }

    static BookingResult rejected(BookingOutcome outcome, String message) {
        return new BookingResult(outcome, null, List.of(message));
    }

    static BookingResult rejected(BookingOutcome outcome, List<String> messages) {
        return new BookingResult(outcome, null, messages);
    }

    static BookingResult failed(BookingOutcome outcome, Reservation reservation, String message) {
        return new BookingResult(outcome, reservation, List.of(message));
    }

    public BookingOutcome getOutcome() {
        return outcome;
    }

    public Optional<Reservation> getReservation() {
        return Optional.ofNullable(reservation);
    }

    public List<String> getMessages() {
        return messages;
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    @Override
    public String toString() {
        return "BookingResult[" + outcome
            + (reservation != null ? ", " + reservation.getId() : "")
            + (messages.isEmpty() ? "" : ", " + messages) + "]";
    }
}
