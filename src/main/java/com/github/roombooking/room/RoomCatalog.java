package com.github.roombooking.room;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fixed, ordered set of rooms keyed by id.
 *
 * <p>Built once; never mutated afterwards.</p>
 */
public final class RoomCatalog {

    private final Map<String, Room> rooms;

    private RoomCatalog(Map<String, Room> rooms) {
        this.rooms = Collections.unmodifiableMap(new LinkedHashMap<>(rooms));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Room> find(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    /**
     * Returns all rooms in insertion order.
     *
     * @return an unmodifiable list
     */
    public List<Room> rooms() {
        return List.copyOf(rooms.values());
    }

    public List<Room> byType(RoomType type) {
        return rooms.values().stream()
            .filter(room -> room.type() == type)
            .collect(Collectors.toUnmodifiableList());
    }

    public int size() {
        return rooms.size();
    }

    /**
     * Builder for {@link RoomCatalog}.
     */
    public static final class Builder {

        private final Map<String, Room> rooms = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a room.
         *
         * @param room the room to add
         * @return this builder
         * @throws IllegalArgumentException if a room with the same id was already added
         */
        public Builder add(Room room) {
            Objects.requireNonNull(room, "room must not be null");
            if (rooms.containsKey(room.id())) {
                throw new IllegalArgumentException("duplicate room id: " + room.id());
            }
            rooms.put(room.id(), room);
            return this;
        }

        public Builder addAll(Iterable<? extends Room> toAdd) {
            List<Room> copy = new ArrayList<>();
            toAdd.forEach(copy::add);
            copy.forEach(this::add);
            return this;
        }

        public RoomCatalog build() {
            return new RoomCatalog(rooms);
        }
    }
}
