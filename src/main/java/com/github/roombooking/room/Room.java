package com.github.roombooking.room;

import java.util.Map;

/**
 * A bookable space.
 *
 * <p>Rooms are immutable values and are shared between all reservations made for them.
 * The variant set is closed; {@link #type()} identifies the variant and is what gets
 * persisted, {@link #equipment()} describes what the room offers. Keys and value types
 * of the equipment map differ per variant (presence flags, counts, descriptive text).</p>
 */
public sealed interface Room permits Classroom, ConferenceRoom, Laboratory, ComputerLab {

    /**
     * Returns the identifier, unique within a {@link RoomCatalog}.
     *
     * @return the room id, never null
     */
    String id();

    /**
     * Returns the display name.
     *
     * @return the name, never null
     */
    String name();

    /**
     * Returns the maximum number of occupants.
     *
     * @return the capacity, always positive
     */
    int capacity();

    /**
     * Returns the variant discriminant.
     *
     * @return the room type, never null
     */
    RoomType type();

    /**
     * Returns the equipment offered by this room.
     *
     * @return an unmodifiable mapping of equipment name to Boolean, Integer or String
     */
    Map<String, Object> equipment();

    /**
     * Returns the type label shown to users. Defaults to the type's display name.
     *
     * @return the label
     */
    default String typeLabel() {
        return type().getDisplayName();
    }

    /**
     * Checks the invariants shared by every variant.
     */
    static void checkCommon(String id, String name, int capacity) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("room id must not be null or blank");
        }
        if (name == null) {
            throw new IllegalArgumentException("room name must not be null");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("room capacity must be positive: " + capacity);
        }
    }
}
