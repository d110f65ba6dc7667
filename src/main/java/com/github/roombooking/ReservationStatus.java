package com.github.roombooking;

/**
 * Lifecycle state of a {@link Reservation}. The only transition is CONFIRMED to CANCELLED.
 */
public enum ReservationStatus {
    CONFIRMED,
    CANCELLED
}
