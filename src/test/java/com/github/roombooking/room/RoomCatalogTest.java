package com.github.roombooking.room;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomCatalogTest {

    private final Room classroom = new Classroom("CL-101", "Python Lab", 30);
    private final Room conference = new ConferenceRoom("CF-201", "Board Room", 12);
    private final Room pool = new ComputerLab("CP-301", "Pool", 24);

    @Test
    void shouldKeepInsertionOrder() {
        RoomCatalog catalog = RoomCatalog.builder()
            .add(pool)
            .addAll(List.of(classroom, conference))
            .build();

        assertThat(catalog.rooms()).containsExactly(pool, classroom, conference);
        assertThat(catalog.size()).isEqualTo(3);
    }

    @Test
    void shouldFindById() {
        RoomCatalog catalog = RoomCatalog.builder().add(classroom).build();

        assertThat(catalog.find("CL-101")).contains(classroom);
        assertThat(catalog.find("XX-000")).isEmpty();
    }

    @Test
    void shouldFilterByType() {
        RoomCatalog catalog = RoomCatalog.builder().addAll(List.of(classroom, conference, pool)).build();

        assertThat(catalog.byType(RoomType.CONFERENCE_ROOM)).containsExactly(conference);
        assertThat(catalog.byType(RoomType.LABORATORY)).isEmpty();
    }

    @Test
    void shouldRejectDuplicateIds() {
        RoomCatalog.Builder builder = RoomCatalog.builder().add(classroom);

        assertThatThrownBy(() -> builder.add(new Laboratory("CL-101", "Other", 5)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("CL-101");
    }

    @Test
    void shouldNotChangeAfterBuild() {
        RoomCatalog.Builder builder = RoomCatalog.builder().add(classroom);
        RoomCatalog catalog = builder.build();
        builder.add(conference);

        assertThat(catalog.size()).isEqualTo(1);
        assertThatThrownBy(() -> catalog.rooms().add(pool))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
