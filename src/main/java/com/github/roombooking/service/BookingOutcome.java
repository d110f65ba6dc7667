package com.github.roombooking.service;

/**
 * Result categories of {@link ReservationService} operations.
 */
public enum BookingOutcome {

    /** A new reservation was stored. */
    CONFIRMED(true),
    /** An existing reservation was moved to CANCELLED and stored. */
    CANCELLED(true),
    /** Start was not before end. */
    INVALID_TIME_RANGE(false),
    /** One or more business rules failed. */
    RULE_VIOLATION(false),
    /** The room is already booked for an overlapping interval. */
    CONFLICT(false),
    /** No reservation with the given id. */
    NOT_FOUND(false),
    /** The reservation had already been cancelled. */
    ALREADY_CANCELLED(false),
    /** The repository could not be read or written. */
    STORAGE_FAILURE(false);

    private final boolean success;

    BookingOutcome(boolean success) {
        this.success = success;
    }

    public boolean isSuccess() {
        return success;
    }
}
