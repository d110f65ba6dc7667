package com.github.roombooking.room;

import java.util.Map;
import java.util.Objects;

/**
 * Laboratory specialised by discipline (Chemistry, Physics, ...).
 */
public record Laboratory(String id, String name, int capacity, String labType, boolean safetyEquipment)
        implements Room {

    public static final String DEFAULT_LAB_TYPE = "General";

    public Laboratory {
        Room.checkCommon(id, name, capacity);
        Objects.requireNonNull(labType, "labType must not be null");
    }

    public Laboratory(String id, String name, int capacity) {
        this(id, name, capacity, DEFAULT_LAB_TYPE, true);
    }

    @Override
    public RoomType type() {
        return RoomType.LABORATORY;
    }

    @Override
    public Map<String, Object> equipment() {
        return Map.of(
            "lab_type", labType,
            "safety_equipment", safetyEquipment,
            "workbenches", true,
            "storage", true
        );
    }

    @Override
    public String typeLabel() {
        return "Laboratory (" + labType + ")";
    }
}
