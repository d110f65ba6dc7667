package com.github.roombooking.validation;

import com.github.roombooking.room.Room;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks a requested booking against business rules.
 *
 * <p>{@link #validateAll(Room, LocalDateTime, LocalDateTime, String)} evaluates every rule
 * and returns all violations at once. Each rule is also exposed on its own and returns
 * the violation message, or empty when the rule holds.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class ReservationValidator {

    private static final DateTimeFormatter HOURS = DateTimeFormatter.ofPattern("HH:mm");

    private final int minDurationHours;
    private final int maxDurationHours;
    private final LocalTime businessStart;
    private final LocalTime businessEnd;
    private final int maxAdvanceDays;
    private final int smallRoomThreshold;
    private final Clock clock;

    private ReservationValidator(Builder builder) {
        this.minDurationHours = builder.minDurationHours;
        this.maxDurationHours = builder.maxDurationHours;
        this.businessStart = builder.businessStart;
        this.businessEnd = builder.businessEnd;
        this.maxAdvanceDays = builder.maxAdvanceDays;
        this.smallRoomThreshold = builder.smallRoomThreshold;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a validator with the default rules: 1 to 8 hours, 07:00 to 22:00,
     * at most 90 days ahead, warning below 5 seats, system clock.
     *
     * @return a default validator
     */
    public static ReservationValidator defaults() {
        return builder().build();
    }

    /**
     * Runs every rule without short-circuiting.
     *
     * @param room the room to book
     * @param start requested start
     * @param end requested end
     * @param userName the booking user
     * @return all errors, plus a warning when the room is small
     */
    public ValidationResult validateAll(Room room, LocalDateTime start, LocalDateTime end, String userName) {
        Objects.requireNonNull(room, "room must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");

        List<String> errors = new ArrayList<>();
        checkTimeOrder(start, end).ifPresent(errors::add);
        checkDuration(start, end).ifPresent(errors::add);
        checkBusinessHours(start, end).ifPresent(errors::add);
        checkAdvanceBooking(start).ifPresent(errors::add);
        checkNotInPast(start).ifPresent(errors::add);
        checkUserName(userName).ifPresent(errors::add);

        List<String> warnings = new ArrayList<>();
        checkRoomSize(room).ifPresent(warnings::add);

        return new ValidationResult(errors, warnings);
    }

    public Optional<String> checkTimeOrder(LocalDateTime start, LocalDateTime end) {
        if (start.isBefore(end)) {
            return Optional.empty();
        }
        return Optional.of("End time must be after start time");
    }

    /**
     * Duration must lie within [min, max] hours. Fractional hours count exactly.
     */
    public Optional<String> checkDuration(LocalDateTime start, LocalDateTime end) {
        Duration duration = Duration.between(start, end);
        if (duration.compareTo(Duration.ofHours(minDurationHours)) < 0) {
            return Optional.of(String.format("Minimum reservation duration is %d hour(s)", minDurationHours));
        }
        if (duration.compareTo(Duration.ofHours(maxDurationHours)) > 0) {
            return Optional.of(String.format("Maximum reservation duration is %d hours", maxDurationHours));
        }
        return Optional.empty();
    }

    /**
     * Start time-of-day must not be before opening, end time-of-day must not be after closing.
     */
    public Optional<String> checkBusinessHours(LocalDateTime start, LocalDateTime end) {
        if (start.toLocalTime().isBefore(businessStart) || end.toLocalTime().isAfter(businessEnd)) {
            return Optional.of(String.format("Reservations must be between %s and %s",
                businessStart.format(HOURS), businessEnd.format(HOURS)));
        }
        return Optional.empty();
    }

    public Optional<String> checkAdvanceBooking(LocalDateTime start) {
        long daysAhead = ChronoUnit.DAYS.between(LocalDate.now(clock), start.toLocalDate());
        if (daysAhead > maxAdvanceDays) {
            return Optional.of(String.format("Cannot book more than %d days in advance", maxAdvanceDays));
        }
        return Optional.empty();
    }

    /**
     * The start must be strictly after the current moment.
     */
    public Optional<String> checkNotInPast(LocalDateTime start) {
        if (start.isAfter(LocalDateTime.now(clock))) {
            return Optional.empty();
        }
        return Optional.of("Cannot book reservations in the past");
    }

    public Optional<String> checkUserName(String userName) {
        if (userName != null && userName.trim().length() >= 2) {
            return Optional.empty();
        }
        return Optional.of("User name must be at least 2 characters");
    }

    /**
     * Advisory only: never makes a result invalid.
     */
    public Optional<String> checkRoomSize(Room room) {
        if (room.capacity() < smallRoomThreshold) {
            return Optional.of(String.format("Small room capacity (%d people)", room.capacity()));
        }
        return Optional.empty();
    }

    public int getMinDurationHours() {
        return minDurationHours;
    }

    public int getMaxDurationHours() {
        return maxDurationHours;
    }

    public LocalTime getBusinessStart() {
        return businessStart;
    }

    public LocalTime getBusinessEnd() {
        return businessEnd;
    }

    public int getMaxAdvanceDays() {
        return maxAdvanceDays;
    }

    /**
     * Builder for {@link ReservationValidator}.
     */
    public static final class Builder {

        private int minDurationHours = 1;
        private int maxDurationHours = 8;
        private LocalTime businessStart = LocalTime.of(7, 0);
        private LocalTime businessEnd = LocalTime.of(22, 0);
        private int maxAdvanceDays = 90;
        private int smallRoomThreshold = 5;
        private Clock clock = Clock.systemDefaultZone();

        private Builder() {
        }

        /**
         * Sets the allowed duration range in whole hours. Default: 1 to 8.
         *
         * @throws IllegalArgumentException if min is negative or max is below min
         */
        public Builder durationHours(int min, int max) {
            if (min < 0 || max < min) {
                throw new IllegalArgumentException("invalid duration range: " + min + ".." + max);
            }
            this.minDurationHours = min;
            this.maxDurationHours = max;
            return this;
        }

        /**
         * Sets the business-hours window. Default: 07:00 to 22:00.
         *
         * @throws IllegalArgumentException if open is not before close
         */
        public Builder businessHours(LocalTime open, LocalTime close) {
            Objects.requireNonNull(open, "open must not be null");
            Objects.requireNonNull(close, "close must not be null");
            if (!open.isBefore(close)) {
                throw new IllegalArgumentException("business hours must open before they close");
            }
            this.businessStart = open;
            this.businessEnd = close;
            return this;
        }

        public Builder maxAdvanceDays(int maxAdvanceDays) {
            if (maxAdvanceDays < 0) {
                throw new IllegalArgumentException("maxAdvanceDays must not be negative");
            }
            this.maxAdvanceDays = maxAdvanceDays;
            return this;
        }

        public Builder smallRoomThreshold(int smallRoomThreshold) {
            this.smallRoomThreshold = smallRoomThreshold;
            return this;
        }

        /**
         * Sets the clock used for "now" and "today". Default: system default zone.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public ReservationValidator build() {
            return new ReservationValidator(this);
        }
    }
}
