package com.github.roombooking.room;

import java.util.Locale;
import java.util.Optional;

/**
 * Discriminant for the closed set of {@link Room} variants.
 *
 * <p>The constant name is the tag written to persisted records.</p>
 */
public enum RoomType {

    CLASSROOM("Classroom"),
    CONFERENCE_ROOM("Conference Room"),
    LABORATORY("Laboratory"),
    COMPUTER_LAB("Computer Lab");

    private final String displayName;

    RoomType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the human-readable name, e.g. "Conference Room".
     *
     * @return the display name, never null
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a persisted type tag.
     *
     * <p>An exact constant name wins. Otherwise the tag is treated as a legacy display
     * string and matched by substring: "Classroom", "Conference", "Computer", with
     * {@link #LABORATORY} as the fallback (display tags such as "Laboratory (Physics)").</p>
     *
     * @param tag the stored tag
     * @return the resolved type
     * @throws IllegalArgumentException if tag is null or blank
     */
    public static RoomType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("room type tag must not be null or blank");
        }
        Optional<RoomType> exact = byName(tag);
        if (exact.isPresent()) {
            return exact.get();
        }
        if (tag.contains("Classroom")) {
            return CLASSROOM;
        }
        if (tag.contains("Conference")) {
            return CONFERENCE_ROOM;
        }
        if (tag.contains("Computer")) {
            return COMPUTER_LAB;
        }
        return LABORATORY;
    }

    static Optional<RoomType> byName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (RoomType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
