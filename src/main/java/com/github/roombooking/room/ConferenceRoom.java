package com.github.roombooking.room;

import java.util.Map;

/**
 * Meeting room with audio/video equipment.
 */
public record ConferenceRoom(String id, String name, int capacity, boolean videoConference, boolean soundSystem)
        implements Room {

    public ConferenceRoom {
        Room.checkCommon(id, name, capacity);
    }

    public ConferenceRoom(String id, String name, int capacity) {
        this(id, name, capacity, true, true);
    }

    @Override
    public RoomType type() {
        return RoomType.CONFERENCE_ROOM;
    }

    @Override
    public Map<String, Object> equipment() {
        return Map.of(
            "video_conference", videoConference,
            "sound_system", soundSystem,
            "projector", true,
            "conference_table", true
        );
    }
}
