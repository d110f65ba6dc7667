package com.github.roombooking.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.roombooking.Reservation;
import com.github.roombooking.ReservationStatus;
import com.github.roombooking.room.Room;
import com.github.roombooking.room.RoomFactory;
import com.github.roombooking.room.RoomType;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON mapping of reservations shared by the file and Hazelcast backends.
 *
 * <p>One record looks like:</p>
 * <pre>{@code
 * {
 *   "reservation_id": "RES-1A2B3C4D",
 *   "room": {"type": "CLASSROOM", "room_id": "CL-101", "name": "Python Lab", "capacity": 30,
 *            "equipment": {"desks": true, "projector": true, "whiteboard": true}},
 *   "user_name": "Jane Doe",
 *   "start_time": "2026-12-20T09:00:00",
 *   "end_time": "2026-12-20T11:00:00",
 *   "purpose": "Workshop",
 *   "status": "CONFIRMED"
 * }
 * }</pre>
 *
 * <p>The room type is written as the {@link RoomType} constant name and resolved with
 * {@link RoomType#fromTag(String)} on read, so older files using display tags still load.</p>
 */
public final class ReservationJsonCodec {

    private static final TypeReference<List<ReservationDocument>> DOCUMENT_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> EQUIPMENT = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ReservationJsonCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String write(Reservation reservation) throws JsonProcessingException {
        return mapper.writeValueAsString(toDocument(reservation));
    }

    public Reservation read(String json) throws JsonProcessingException {
        return fromDocument(mapper.readValue(json, ReservationDocument.class));
    }

    public void writeAll(OutputStream out, List<Reservation> reservations) throws IOException {
        List<ReservationDocument> documents = new ArrayList<>(reservations.size());
        for (Reservation reservation : reservations) {
            documents.add(toDocument(reservation));
        }
        mapper.writeValue(out, documents);
    }

    public List<Reservation> readAll(InputStream in) throws IOException {
        List<ReservationDocument> documents = mapper.readValue(in, DOCUMENT_LIST);
        List<Reservation> reservations = new ArrayList<>(documents == null ? 0 : documents.size());
        if (documents != null) {
            for (ReservationDocument document : documents) {
                reservations.add(fromDocument(document));
            }
        }
        return reservations;
    }

    public String writeEquipment(Map<String, Object> equipment) throws JsonProcessingException {
        return mapper.writeValueAsString(new TreeMap<>(equipment));
    }

    public Map<String, Object> readEquipment(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return mapper.readValue(json, EQUIPMENT);
    }

    private static ReservationDocument toDocument(Reservation reservation) {
        Room room = reservation.getRoom();
        RoomDocument roomDocument = new RoomDocument(
            room.type().name(),
            room.id(),
            room.name(),
            room.capacity(),
            new TreeMap<>(room.equipment()));
        return new ReservationDocument(
            reservation.getId(),
            roomDocument,
            reservation.getUserName(),
            reservation.getStartTime(),
            reservation.getEndTime(),
            reservation.getPurpose(),
            reservation.getStatus().name());
    }

    private static Reservation fromDocument(ReservationDocument document) {
        RoomDocument roomDocument = document.room();
        if (roomDocument == null) {
            throw new IllegalArgumentException("reservation " + document.reservationId() + " has no room");
        }
        Room room = RoomFactory.fromEquipment(
            RoomType.fromTag(roomDocument.type()),
            roomDocument.roomId(),
            roomDocument.name(),
            roomDocument.capacity(),
            roomDocument.equipment() == null ? Map.of() : roomDocument.equipment());
        ReservationStatus status = document.status() == null
            ? ReservationStatus.CONFIRMED
            : ReservationStatus.valueOf(document.status());
        return new Reservation(
            document.reservationId(),
            room,
            document.userName(),
            document.startTime(),
            document.endTime(),
            document.purpose(),
            status);
    }

    /**
     * Persisted form of a reservation.
     */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record ReservationDocument(
        @JsonProperty("reservation_id") String reservationId,
        @JsonProperty("room") RoomDocument room,
        @JsonProperty("user_name") String userName,
        @JsonProperty("start_time") LocalDateTime startTime,
        @JsonProperty("end_time") LocalDateTime endTime,
        @JsonProperty("purpose") String purpose,
        @JsonProperty("status") String status
    ) {
    }

    /**
     * Persisted form of a room, including an equipment snapshot.
     */
    public record RoomDocument(
        @JsonProperty("type") String type,
        @JsonProperty("room_id") String roomId,
        @JsonProperty("name") String name,
        @JsonProperty("capacity") int capacity,
        @JsonProperty("equipment") Map<String, Object> equipment
    ) {
        public RoomDocument {
            equipment = equipment == null ? new LinkedHashMap<>() : equipment;
        }
    }
}
