package com.github.roombooking.room;

import java.util.Map;

/**
 * Room with workstations.
 *
 * <p>A non-positive computer count means "unspecified" and is replaced by the
 * capacity, one workstation per seat.</p>
 */
public record ComputerLab(String id, String name, int capacity, int computers, boolean printer)
        implements Room {

    public ComputerLab {
        Room.checkCommon(id, name, capacity);
        if (computers <= 0) {
            computers = capacity;
        }
    }

    public ComputerLab(String id, String name, int capacity) {
        this(id, name, capacity, 0, true);
    }

    @Override
    public RoomType type() {
        return RoomType.COMPUTER_LAB;
    }

    @Override
    public Map<String, Object> equipment() {
        return Map.of(
            "computers", computers,
            "printer", printer,
            "network", true
        );
    }
}
