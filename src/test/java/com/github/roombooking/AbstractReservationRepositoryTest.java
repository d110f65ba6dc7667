package com.github.roombooking;

import com.github.roombooking.room.Classroom;
import com.github.roombooking.room.ComputerLab;
import com.github.roombooking.room.ConferenceRoom;
import com.github.roombooking.room.Laboratory;
import com.github.roombooking.room.Room;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Abstract base test class defining the contract for all ReservationRepository implementations.
 *
 * <p>Subclasses provide the specific implementation to test.</p>
 */
public abstract class AbstractReservationRepositoryTest {

    protected static final LocalDateTime T = LocalDateTime.of(2030, 3, 14, 9, 0);

    protected static final Room CLASSROOM = new Classroom("CL-101", "Python Lab", 30, true, false);
    protected static final Room CONFERENCE = new ConferenceRoom("CF-201", "Board Room", 12);
    protected static final Room LAB = new Laboratory("LB-301", "Chem Lab", 20, "Chemistry", true);
    protected static final Room COMPUTER_LAB = new ComputerLab("CP-401", "Linux Pool", 25, 24, false);

    protected ReservationRepository repository;
    protected MeterRegistry meterRegistry;

    /**
     * Creates the ReservationRepository implementation to test.
     *
     * @param meterRegistry the registry to pass to the builder
     * @return a new, empty ReservationRepository instance
     */
    protected abstract ReservationRepository createRepository(MeterRegistry meterRegistry);

    /**
     * Cleans up resources after each test.
     */
    protected abstract void cleanup();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        repository = createRepository(meterRegistry);
    }

    @AfterEach
    void tearDown() {
        if (repository != null) {
            repository.close();
        }
        cleanup();
    }

    protected static Reservation reservation(String id, Room room, LocalDateTime start, LocalDateTime end) {
        return new Reservation(id, room, "Jane Doe", start, end, "Workshop");
    }

    // ==================== Save / Find Tests ====================

    @Test
    void shouldStartEmpty() {
        assertThat(repository.findAll()).isEmpty();
        assertThat(repository.findById("RES-00000000")).isEmpty();
    }

    @Test
    void shouldSaveAndFindById() {
        Reservation saved = reservation("RES-00000001", CLASSROOM, T, T.plusHours(2));

        assertThat(repository.save(saved)).isTrue();

        Optional<Reservation> found = repository.findById("RES-00000001");
        assertThat(found).isPresent();
        assertThat(found.get().getRoom()).isEqualTo(CLASSROOM);
        assertThat(found.get().getUserName()).isEqualTo("Jane Doe");
        assertThat(found.get().getStartTime()).isEqualTo(T);
        assertThat(found.get().getEndTime()).isEqualTo(T.plusHours(2));
        assertThat(found.get().getPurpose()).isEqualTo("Workshop");
        assertThat(found.get().getStatus()).isEqualTo(ReservationStatus.CONFIRMED);
    }

    @Test
    void shouldKeepTimestampsToTheNanosecond() {
        LocalDateTime start = T.withNano(123_456_789);
        LocalDateTime end = T.plusHours(1).withNano(1);
        repository.save(reservation("RES-00000007", CLASSROOM, start, end));

        Reservation found = repository.findById("RES-00000007").orElseThrow();

        assertThat(found.getStartTime()).isEqualTo(start);
        assertThat(found.getEndTime()).isEqualTo(end);
    }

    @Test
    void shouldPreserveEveryRoomVariant() {
        List<Room> rooms = List.of(CLASSROOM, CONFERENCE, LAB, COMPUTER_LAB);
        for (int i = 0; i < rooms.size(); i++) {
            repository.save(reservation("RES-0000001" + i, rooms.get(i), T, T.plusHours(1)));
        }

        for (int i = 0; i < rooms.size(); i++) {
            Reservation found = repository.findById("RES-0000001" + i).orElseThrow();
            assertThat(found.getRoom()).isEqualTo(rooms.get(i));
            assertThat(found.getRoom().type()).isEqualTo(rooms.get(i).type());
            assertThat(found.getRoom().equipment()).isEqualTo(rooms.get(i).equipment());
        }
    }

    @Test
    void shouldOverwriteOnSaveWithSameId() {
        Reservation original = reservation("RES-00000002", CLASSROOM, T, T.plusHours(2));
        repository.save(original);

        Reservation cancelled = original.copy();
        cancelled.cancel();
        assertThat(repository.save(cancelled)).isTrue();

        assertThat(repository.findAll()).hasSize(1);
        assertThat(repository.findById("RES-00000002").orElseThrow().isCancelled()).isTrue();
    }

    @Test
    void shouldHandOutDetachedCopies() {
        repository.save(reservation("RES-00000003", CLASSROOM, T, T.plusHours(2)));

        Reservation first = repository.findById("RES-00000003").orElseThrow();
        first.cancel();

        assertThat(repository.findById("RES-00000003").orElseThrow().isCancelled()).isFalse();
    }

    @Test
    void shouldNotTrackCallerMutationsAfterSave() {
        Reservation saved = reservation("RES-00000004", CLASSROOM, T, T.plusHours(2));
        repository.save(saved);

        saved.cancel();

        assertThat(repository.findById("RES-00000004").orElseThrow().isCancelled()).isFalse();
    }

    @Test
    void shouldReturnCancelledReservationsFromFindAll() {
        Reservation cancelled = reservation("RES-00000005", CLASSROOM, T, T.plusHours(2));
        cancelled.cancel();
        repository.save(cancelled);
        repository.save(reservation("RES-00000006", LAB, T, T.plusHours(2)));

        assertThat(repository.findAll())
            .extracting(Reservation::getId)
            .containsExactlyInAnyOrder("RES-00000005", "RES-00000006");
    }

    // ==================== Conflict Query Tests ====================

    @Test
    void shouldFindOverlappingReservationOnSameRoom() {
        repository.save(reservation("RES-00000010", CLASSROOM, T, T.plusHours(2)));

        assertThat(repository.findByRoomAndTime(CLASSROOM, T.plusHours(1), T.plusHours(3)))
            .extracting(Reservation::getId)
            .containsExactly("RES-00000010");
    }

    @Test
    void shouldFindReservationContainingRequestedSlot() {
        repository.save(reservation("RES-00000011", CLASSROOM, T, T.plusHours(4)));

        assertThat(repository.findByRoomAndTime(CLASSROOM, T.plusHours(1), T.plusHours(2))).hasSize(1);
        assertThat(repository.findByRoomAndTime(CLASSROOM, T.minusHours(1), T.plusHours(5))).hasSize(1);
    }

    @Test
    void shouldNotReportTouchingIntervals() {
        repository.save(reservation("RES-00000012", CLASSROOM, T, T.plusHours(2)));

        assertThat(repository.findByRoomAndTime(CLASSROOM, T.plusHours(2), T.plusHours(4))).isEmpty();
        assertThat(repository.findByRoomAndTime(CLASSROOM, T.minusHours(2), T)).isEmpty();
    }

    @Test
    void shouldIgnoreOtherRooms() {
        repository.save(reservation("RES-00000013", CLASSROOM, T, T.plusHours(2)));

        assertThat(repository.findByRoomAndTime(LAB, T, T.plusHours(2))).isEmpty();
    }

    @Test
    void shouldExcludeCancelledReservationsFromConflicts() {
        Reservation booked = reservation("RES-00000014", CLASSROOM, T, T.plusHours(2));
        booked.cancel();
        repository.save(booked);

        assertThat(repository.findByRoomAndTime(CLASSROOM, T, T.plusHours(2))).isEmpty();
    }

    @Test
    void shouldReturnEveryConflict() {
        repository.save(reservation("RES-00000015", CLASSROOM, T, T.plusHours(1)));
        repository.save(reservation("RES-00000016", CLASSROOM, T.plusHours(1), T.plusHours(2)));
        repository.save(reservation("RES-00000017", CLASSROOM, T.plusHours(3), T.plusHours(4)));

        assertThat(repository.findByRoomAndTime(CLASSROOM, T.plusMinutes(30), T.plusMinutes(90)))
            .extracting(Reservation::getId)
            .containsExactlyInAnyOrder("RES-00000015", "RES-00000016");
    }

    // ==================== Delete Tests ====================

    @Test
    void shouldReturnFalseWhenDeletingAbsentId() {
        assertThat(repository.delete("RES-DEADBEEF")).isFalse();
    }

    @Test
    void shouldDeletePresentReservation() {
        repository.save(reservation("RES-00000020", CLASSROOM, T, T.plusHours(2)));
        repository.save(reservation("RES-00000021", CLASSROOM, T.plusHours(3), T.plusHours(4)));

        assertThat(repository.delete("RES-00000020")).isTrue();

        assertThat(repository.findById("RES-00000020")).isEmpty();
        assertThat(repository.findById("RES-00000021")).isPresent();
        assertThat(repository.delete("RES-00000020")).isFalse();
    }

    // ==================== Metrics Tests ====================

    @Test
    void shouldRecordOperationTimers() {
        repository.save(reservation("RES-00000030", CLASSROOM, T, T.plusHours(2)));
        repository.findByRoomAndTime(CLASSROOM, T, T.plusHours(1));

        Timer saves = meterRegistry.find("booking.repository.operation")
            .tag("backend", repository.getBackend())
            .tag("operation", "save")
            .tag("result", "success")
            .timer();
        assertThat(saves).isNotNull();
        assertThat(saves.count()).isEqualTo(1);
        assertThat(meterRegistry.find("booking.repository.operation")
            .tag("operation", "findByRoomAndTime")
            .timer())
            .isNotNull();
    }

    @Test
    void shouldTimeLookupsByOutcome() {
        repository.save(reservation("RES-00000031", CLASSROOM, T, T.plusHours(2)));
        repository.findById("RES-00000031");
        repository.findById("RES-DEADBEEF");
        repository.findAll();

        assertThat(lookupTimer("findById", "success").count()).isEqualTo(1);
        assertThat(lookupTimer("findById", "absent").count()).isEqualTo(1);
        assertThat(lookupTimer("findAll", "success").count()).isEqualTo(1);
    }

    private Timer lookupTimer(String operation, String result) {
        Timer timer = meterRegistry.find("booking.repository.operation")
            .tag("backend", repository.getBackend())
            .tag("operation", operation)
            .tag("result", result)
            .timer();
        assertThat(timer).as(operation + "/" + result).isNotNull();
        return timer;
    }

    @Test
    void shouldReportBackendName() {
        assertThat(repository.getBackend()).isNotBlank();
    }
}
