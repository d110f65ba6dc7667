package com.github.roombooking.room;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Creates {@link Room} variants from a type name and loosely typed attributes.
 *
 * <p>Attributes override the per-variant defaults. The same keys are used by
 * {@link Room#equipment()}, so an equipment snapshot can be fed back in to rebuild
 * an equal room.</p>
 */
public final class RoomFactory {

    private static final Logger log = LoggerFactory.getLogger(RoomFactory.class);

    private static final List<String> AVAILABLE_TYPES =
        List.of("classroom", "conference", "laboratory", "computer_lab");

    private RoomFactory() {
    }

    /**
     * Creates a room from a user-supplied type name.
     *
     * <p>Accepted names (case-insensitive, spaces and hyphens read as underscores):
     * {@code classroom}, {@code conference} / {@code conference_room},
     * {@code laboratory} / {@code lab}, {@code computer_lab}.</p>
     *
     * @param typeName the type name
     * @param id the room id
     * @param name the display name
     * @param capacity the capacity (must be positive)
     * @param attributes equipment overrides, may be empty
     * @return the room, or empty if the type name is unknown
     * @throws IllegalArgumentException if id, name or capacity are invalid
     */
    public static Optional<Room> create(String typeName, String id, String name, int capacity,
                                        Map<String, ?> attributes) {
        Optional<RoomType> type = resolve(typeName);
        if (type.isEmpty()) {
            log.warn("Unknown room type: {}", typeName);
            return Optional.empty();
        }
        return Optional.of(create(type.get(), id, name, capacity, attributes));
    }

    public static Optional<Room> create(String typeName, String id, String name, int capacity) {
        return create(typeName, id, name, capacity, Map.of());
    }

    /**
     * Creates a room of a known type, applying defaults for missing attributes.
     */
    public static Room create(RoomType type, String id, String name, int capacity, Map<String, ?> attributes) {
        Objects.requireNonNull(type, "type must not be null");
        Map<String, ?> attrs = attributes == null ? Map.of() : attributes;
        switch (type) {
            case CLASSROOM:
                return new Classroom(id, name, capacity,
                    bool(attrs, "projector", true),
                    bool(attrs, "whiteboard", true));
            case CONFERENCE_ROOM:
                return new ConferenceRoom(id, name, capacity,
                    bool(attrs, "video_conference", true),
                    bool(attrs, "sound_system", true));
            case LABORATORY:
                return new Laboratory(id, name, capacity,
                    text(attrs, "lab_type", Laboratory.DEFAULT_LAB_TYPE),
                    bool(attrs, "safety_equipment", true));
            case COMPUTER_LAB:
                return new ComputerLab(id, name, capacity,
                    number(attrs, "computers", capacity),
                    bool(attrs, "printer", true));
            default:
                throw new IllegalArgumentException("Unsupported room type: " + type);
        }
    }

    /**
     * Rebuilds a room from a persisted equipment snapshot.
     */
    public static Room fromEquipment(RoomType type, String id, String name, int capacity,
                                     Map<String, ?> equipment) {
        return create(type, id, name, capacity, equipment);
    }

    /**
     * Returns the type names accepted by {@link #create(String, String, String, int, Map)}.
     *
     * @return the canonical type names
     */
    public static List<String> availableTypes() {
        return AVAILABLE_TYPES;
    }

    static Optional<RoomType> resolve(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        String normalized = typeName.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        switch (normalized) {
            case "classroom":
                return Optional.of(RoomType.CLASSROOM);
            case "conference":
            case "conference_room":
                return Optional.of(RoomType.CONFERENCE_ROOM);
            case "laboratory":
            case "lab":
                return Optional.of(RoomType.LABORATORY);
            case "computer_lab":
                return Optional.of(RoomType.COMPUTER_LAB);
            default:
                return Optional.empty();
        }
    }

    private static boolean bool(Map<String, ?> attrs, String key, boolean defaultValue) {
        Object value = attrs.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private static int number(Map<String, ?> attrs, String key, int defaultValue) {
        Object value = attrs.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric value for {}: {}", key, value);
            }
        }
        return defaultValue;
    }

    private static String text(Map<String, ?> attrs, String key, String defaultValue) {
        Object value = attrs.get(key);
        return value == null ? defaultValue : value.toString();
    }
}
