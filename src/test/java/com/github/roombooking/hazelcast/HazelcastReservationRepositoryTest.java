package com.github.roombooking.hazelcast;

import com.github.roombooking.AbstractReservationRepositoryTest;
import com.github.roombooking.ReservationRepository;
import com.github.roombooking.ReservationStorageException;
import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.*;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the Hazelcast-backed ReservationRepository implementation.
 * Uses embedded Hazelcast for fast, isolated tests.
 */
class HazelcastReservationRepositoryTest extends AbstractReservationRepositoryTest {

    private static HazelcastInstance hazelcast;
    private String currentMapName;

    @BeforeAll
    static void setupHazelcast() {
        Config config = new Config();
        config.setClusterName("test-" + UUID.randomUUID());
        // Disable network for embedded testing
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        hazelcast = Hazelcast.newHazelcastInstance(config);
    }

    @AfterAll
    static void teardownHazelcast() {
        if (hazelcast != null) {
            hazelcast.shutdown();
        }
    }

    @Override
    protected ReservationRepository createRepository(MeterRegistry meterRegistry) {
        // Unique ledger name per test keeps maps apart
        String name = "ledger-" + UUID.randomUUID().toString().substring(0, 8);
        currentMapName = "test-reservations-" + name;
        return ReservationRepository.hazelcast(hazelcast)
            .mapPrefix("test-reservations")
            .name(name)
            .meterRegistry(meterRegistry)
            .build();
    }

    @Override
    protected void cleanup() {
        if (currentMapName != null && hazelcast != null) {
            hazelcast.getMap(currentMapName).destroy();
        }
    }

    // ==================== Hazelcast-Specific Tests ====================

    @Test
    void shouldStoreJsonDocumentInMap() {
        repository.save(reservation("RES-0000C001", CLASSROOM, T, T.plusHours(2)));

        Object value = hazelcast.getMap(currentMapName).get("RES-0000C001");
        assertThat(value).isInstanceOf(String.class);
        assertThat((String) value)
            .contains("\"room_id\" : \"CL-101\"")
            .contains("\"type\" : \"CLASSROOM\"");
    }

    @Test
    void shouldReturnCorrectMapName() {
        HazelcastReservationRepository hzRepository = (HazelcastReservationRepository) repository;
        assertThat(hzRepository.getMapName()).isEqualTo(currentMapName);
    }

    @Test
    void shouldUseDefaultMapName() {
        ReservationRepository defaults = ReservationRepository.hazelcast(hazelcast).build();
        try {
            assertThat(((HazelcastReservationRepository) defaults).getMapName())
                .isEqualTo("reservations-default");
        } finally {
            defaults.close();
            hazelcast.getMap("reservations-default").destroy();
        }
    }

    @Test
    void shouldIsolateLedgers() {
        ReservationRepository other = ReservationRepository.hazelcast(hazelcast)
            .mapPrefix("test-reservations")
            .name("other-" + UUID.randomUUID().toString().substring(0, 8))
            .build();
        try {
            repository.save(reservation("RES-0000C002", CLASSROOM, T, T.plusHours(2)));

            assertThat(other.findById("RES-0000C002")).isEmpty();
            assertThat(other.findByRoomAndTime(CLASSROOM, T, T.plusHours(2))).isEmpty();
        } finally {
            hazelcast.getMap(((HazelcastReservationRepository) other).getMapName()).destroy();
        }
    }

    @Test
    void shouldRaiseStorageExceptionOnCorruptEntry() {
        hazelcast.getMap(currentMapName).put("RES-0000C003", "garbage");

        assertThatThrownBy(() -> repository.findById("RES-0000C003"))
            .isInstanceOf(ReservationStorageException.class)
            .hasMessageContaining("[hazelcast]");
    }

    @Test
    void builderShouldRejectEmptyNames() {
        assertThatThrownBy(() -> ReservationRepository.hazelcast(hazelcast).mapPrefix(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("mapPrefix");
        assertThatThrownBy(() -> ReservationRepository.hazelcast(hazelcast).name(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name");
        assertThatThrownBy(() -> ReservationRepository.hazelcast(null))
            .isInstanceOf(NullPointerException.class);
    }
}
