package com.github.roombooking.room;

import java.util.Map;

/**
 * Teaching room with presentation equipment.
 */
public record Classroom(String id, String name, int capacity, boolean projector, boolean whiteboard)
        implements Room {

    public Classroom {
        Room.checkCommon(id, name, capacity);
    }

    public Classroom(String id, String name, int capacity) {
        this(id, name, capacity, true, true);
    }

    @Override
    public RoomType type() {
        return RoomType.CLASSROOM;
    }

    @Override
    public Map<String, Object> equipment() {
        return Map.of(
            "projector", projector,
            "whiteboard", whiteboard,
            "desks", true
        );
    }
}
