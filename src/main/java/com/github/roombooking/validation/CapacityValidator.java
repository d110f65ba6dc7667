package com.github.roombooking.validation;

import com.github.roombooking.room.Room;

import java.util.List;
import java.util.Objects;

/**
 * Checks an attendee count against a room's capacity.
 *
 * <p>Counts above 90% of capacity are accepted with a warning.</p>
 */
public final class CapacityValidator {

    private static final double NEAR_CAPACITY_RATIO = 0.9;

    public ValidationResult validate(Room room, int attendees) {
        Objects.requireNonNull(room, "room must not be null");
        if (attendees <= 0) {
            return new ValidationResult(List.of("Number of attendees must be positive"), List.of());
        }
        int capacity = room.capacity();
        if (attendees > capacity) {
            return new ValidationResult(
                List.of(String.format("Room capacity (%d) exceeded by %d people", capacity, attendees - capacity)),
                List.of());
        }
        if (attendees > capacity * NEAR_CAPACITY_RATIO) {
            long percent = Math.round(attendees * 100.0 / capacity);
            return new ValidationResult(
                List.of(),
                List.of(String.format("Room will be at %d%% capacity", percent)));
        }
        return ValidationResult.valid();
    }
}
