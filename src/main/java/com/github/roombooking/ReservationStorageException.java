package com.github.roombooking;

/**
 * Thrown when a repository cannot read its backing store.
 *
 * <p>Writes report failure through their boolean result instead.</p>
 */
public class ReservationStorageException extends RoomBookingException {

    private final String backend;

    public ReservationStorageException(String backend, String message, Throwable cause) {
        super(String.format("[%s] %s", backend, message), cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
