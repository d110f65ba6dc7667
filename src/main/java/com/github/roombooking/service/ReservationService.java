package com.github.roombooking.service;

import com.github.roombooking.Reservation;
import com.github.roombooking.ReservationRepository;
import com.github.roombooking.internal.ReservationIds;
import com.github.roombooking.internal.ReservationMetrics;
import com.github.roombooking.notification.Notifier;
import com.github.roombooking.room.Room;
import com.github.roombooking.validation.ReservationValidator;
import com.github.roombooking.validation.ValidationResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Books and cancels reservations.
 *
 * <p>Creation checks the time range and looks for conflicting reservations in the
 * repository; it does not apply the business rules of {@link ReservationValidator}.
 * Use {@link #createValidatedReservation} to run the validator first.</p>
 *
 * <p>Rejections and storage failures are reported through {@link BookingResult}, never by
 * throwing. Notifier and listener failures are logged and never undo a committed write.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ReservationService service = ReservationService.builder()
 *     .repository(ReservationRepository.inMemory().build())
 *     .notifier(new LoggingNotifier())
 *     .build();
 *
 * BookingResult result = service.createReservation(room, "Jane Doe", start, end, "Workshop");
 * if (result.isSuccess()) {
 *     String id = result.getReservation().orElseThrow().getId();
 * }
 * }</pre>
 *
 * <p>Not thread-safe: the conflict check and the write are separate repository calls.</p>
 */
public final class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    static final int MAX_ID_ATTEMPTS = 5;

    private final ReservationRepository repository;
    private final Notifier notifier;
    private final ReservationValidator validator;
    private final List<ReservationListener> listeners;
    private final Supplier<String> idGenerator;
    private final ReservationMetrics metrics;

    private ReservationService(Builder builder) {
        this.repository = builder.repository;
        this.notifier = builder.notifier;
        this.validator = builder.validator;
        this.listeners = List.copyOf(builder.listeners);
        this.idGenerator = builder.idGenerator;
        this.metrics = new ReservationMetrics(builder.meterRegistry, repository.getBackend());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Books a room without applying the validator's business rules.
     *
     * @param room the room to book
     * @param userName the booking user
     * @param start requested start
     * @param end requested end, must be after start
     * @param purpose free text, may be null
     * @return {@link BookingOutcome#CONFIRMED} with the new reservation, or
     *         {@link BookingOutcome#INVALID_TIME_RANGE}, {@link BookingOutcome#CONFLICT},
     *         {@link BookingOutcome#STORAGE_FAILURE}
     */
    public BookingResult createReservation(Room room, String userName,
                                           LocalDateTime start, LocalDateTime end, String purpose) {
        return create(room, userName, start, end, purpose, List.of());
    }

    /**
     * Runs the validator, then books the room if no rule failed.
     *
     * <p>Validator warnings are carried into the result messages of a successful booking.</p>
     *
     * @return {@link BookingOutcome#RULE_VIOLATION} with every failed rule, or the result of
     *         {@link #createReservation}
     */
    public BookingResult createValidatedReservation(Room room, String userName,
                                                    LocalDateTime start, LocalDateTime end, String purpose) {
        Objects.requireNonNull(room, "room must not be null");
        if (start == null || end == null) {
            return reject(BookingOutcome.INVALID_TIME_RANGE, "Start and end time are required");
        }
        ValidationResult validation = validator.validateAll(room, start, end, userName);
        if (!validation.isValid()) {
            log.info("Rejected reservation for room {}: {}", room.id(), validation.errors());
            metrics.recordOutcome(outcomeTag(BookingOutcome.RULE_VIOLATION));
            return BookingResult.rejected(BookingOutcome.RULE_VIOLATION, validation.messages());
        }
        return create(room, userName, start, end, purpose, validation.warnings());
    }

    /**
     * Cancels a confirmed reservation.
     *
     * @param reservationId the id
     * @return {@link BookingOutcome#CANCELLED}, or {@link BookingOutcome#NOT_FOUND},
     *         {@link BookingOutcome#ALREADY_CANCELLED}, {@link BookingOutcome#STORAGE_FAILURE}
     */
    public BookingResult cancelReservation(String reservationId) {
        Optional<Reservation> found;
        try {
            found = repository.findById(reservationId);
        } catch (RuntimeException e) {
            return storageFailure(null, "Failed to look up reservation " + reservationId, e);
        }

        if (found.isEmpty()) {
            return reject(BookingOutcome.NOT_FOUND, "Reservation " + reservationId + " not found");
        }
        Reservation reservation = found.get();
        if (reservation.isCancelled()) {
            return reject(BookingOutcome.ALREADY_CANCELLED, "Reservation " + reservationId + " is already cancelled");
        }

        reservation.cancel();
        if (!saveQuietly(reservation)) {
            // The instance is cancelled but storage may still say CONFIRMED
            return storageFailure(reservation, "Failed to update reservation " + reservationId, null);
        }

        log.info("Cancelled reservation {} for room {}", reservation.getId(), reservation.getRoom().id());
        metrics.recordOutcome(outcomeTag(BookingOutcome.CANCELLED));
        deliver(reservation, false);
        return BookingResult.success(BookingOutcome.CANCELLED, reservation, List.of());
    }

    public Optional<Reservation> getReservation(String reservationId) {
        return repository.findById(reservationId);
    }

    public List<Reservation> getAllReservations() {
        return repository.findAll();
    }

    /**
     * Returns the reservations blocking the given slot.
     *
     * @return conflicting reservations, empty if the room is free
     */
    public List<Reservation> getRoomAvailability(Room room, LocalDateTime start, LocalDateTime end) {
        return repository.findByRoomAndTime(room, start, end);
    }

    public boolean isRoomAvailable(Room room, LocalDateTime start, LocalDateTime end) {
        return getRoomAvailability(room, start, end).isEmpty();
    }

    /**
     * Permanently removes a reservation. No notification is sent.
     *
     * @return true if removed
     */
    public boolean deleteReservation(String reservationId) {
        boolean deleted = repository.delete(reservationId);
        if (deleted) {
            log.info("Deleted reservation {}", reservationId);
        }
        return deleted;
    }

    public ReservationRepository getRepository() {
        return repository;
    }

    private BookingResult create(Room room, String userName, LocalDateTime start, LocalDateTime end,
                                 String purpose, List<String> warnings) {
        Objects.requireNonNull(room, "room must not be null");
        Objects.requireNonNull(userName, "userName must not be null");

        if (start == null || end == null || !start.isBefore(end)) {
            return reject(BookingOutcome.INVALID_TIME_RANGE,
                "Invalid time range. End time must be after start time.");
        }

        List<Reservation> conflicts;
        try {
            conflicts = repository.findByRoomAndTime(room, start, end);
        } catch (RuntimeException e) {
            return storageFailure(null, "Failed to check availability of room " + room.id(), e);
        }
        if (!conflicts.isEmpty()) {
            String ids = conflicts.stream().map(Reservation::getId).collect(Collectors.joining(", "));
            return reject(BookingOutcome.CONFLICT, String.format(
                "Room %s is not available for the requested time slot (conflicts with %s)", room.name(), ids));
        }

        String id;
        try {
            id = freshId();
        } catch (RuntimeException e) {
            return storageFailure(null, "Failed to check reservation id", e);
        }
        if (id == null) {
            return storageFailure(null, "No unused reservation id after " + MAX_ID_ATTEMPTS + " attempts", null);
        }

        Reservation reservation = new Reservation(id, room, userName, start, end, purpose);
        if (!saveQuietly(reservation)) {
            return storageFailure(null, "Failed to save reservation", null);
        }

        log.info("Created reservation {} for room {} ({} - {})", reservation.getId(), room.id(), start, end);
        metrics.recordOutcome(outcomeTag(BookingOutcome.CONFIRMED));
        deliver(reservation, true);
        return BookingResult.success(BookingOutcome.CONFIRMED, reservation, new ArrayList<>(warnings));
    }

    /**
     * Draws ids until one is not yet stored. Saving is an upsert, so a reused id would
     * overwrite another reservation.
     *
     * @return an unused id, or null if every attempt collided
     */
    private String freshId() {
        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
            String candidate = idGenerator.get();
            if (repository.findById(candidate).isEmpty()) {
                return candidate;
            }
            log.warn("Generated reservation id {} is already taken (attempt {})", candidate, attempt);
        }
        return null;
    }

    private boolean saveQuietly(Reservation reservation) {
        try {
            return repository.save(reservation);
        } catch (RuntimeException e) {
            log.error("Repository failed while saving {}", reservation.getId(), e);
            return false;
        }
    }

    private void deliver(Reservation reservation, boolean confirmed) {
        try {
            boolean delivered = confirmed
                ? notifier.notifyConfirmed(reservation)
                : notifier.notifyCancelled(reservation);
            if (!delivered) {
                log.warn("Notification for {} was not delivered", reservation.getId());
            }
        } catch (RuntimeException e) {
            log.warn("Notifier failed for {}: {}", reservation.getId(), e.getMessage());
        }

        for (ReservationListener listener : listeners) {
            try {
                if (confirmed) {
                    listener.onCreated(reservation);
                } else {
                    listener.onCancelled(reservation);
                }
            } catch (RuntimeException e) {
                log.warn("Listener {} failed for {}: {}",
                    listener.getClass().getSimpleName(), reservation.getId(), e.getMessage());
            }
        }
    }

    private BookingResult reject(BookingOutcome outcome, String message) {
        log.info("{}: {}", outcome, message);
        metrics.recordOutcome(outcomeTag(outcome));
        return BookingResult.rejected(outcome, message);
    }

    private BookingResult storageFailure(Reservation reservation, String message, Throwable cause) {
        if (cause != null) {
            log.error(message, cause);
        } else {
            log.error(message);
        }
        metrics.recordOutcome(outcomeTag(BookingOutcome.STORAGE_FAILURE));
        return BookingResult.failed(BookingOutcome.STORAGE_FAILURE, reservation, message);
    }

    private static String outcomeTag(BookingOutcome outcome) {
        return outcome.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Builder for {@link ReservationService}.
     */
    public static final class Builder {

        private ReservationRepository repository;
        private Notifier notifier;
        private ReservationValidator validator = ReservationValidator.defaults();
        private final List<ReservationListener> listeners = new ArrayList<>();
        private Supplier<String> idGenerator = ReservationIds::next;
        private MeterRegistry meterRegistry = null;

        private Builder() {
        }

        /**
         * Sets the repository. This is required.
         */
        public Builder repository(ReservationRepository repository) {
            this.repository = Objects.requireNonNull(repository, "repository must not be null");
            return this;
        }

        /**
         * Sets the notifier. This is required.
         */
        public Builder notifier(Notifier notifier) {
            this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
            return this;
        }

        /**
         * Sets the validator used by {@link #createValidatedReservation}. Default: {@link ReservationValidator#defaults()}
         */
        public Builder validator(ReservationValidator validator) {
            this.validator = Objects.requireNonNull(validator, "validator must not be null");
            return this;
        }

        public Builder listener(ReservationListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        /**
         * Overrides reservation id generation. Default: {@code RES-} plus 8 hex digits.
         */
        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
            return this;
        }

        /**
         * Sets the Micrometer registry for metrics. Default: none (metrics disabled)
         */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /**
         * @throws IllegalStateException if repository or notifier is missing
         */
        public ReservationService build() {
            if (repository == null) {
                throw new IllegalStateException("repository must be set before building");
            }
            if (notifier == null) {
                throw new IllegalStateException("notifier must be set before building");
            }
            return new ReservationService(this);
        }
    }
}
