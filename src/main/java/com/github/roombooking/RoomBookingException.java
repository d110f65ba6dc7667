package com.github.roombooking;

/**
 * Base type for unchecked errors raised by this library.
 */
public class RoomBookingException extends RuntimeException {

    public RoomBookingException(String message) {
        super(message);
    }

    public RoomBookingException(String message, Throwable cause) {
        super(message, cause);
    }
}
