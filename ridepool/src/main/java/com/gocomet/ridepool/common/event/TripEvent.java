package com.gocomet.ridepool.common.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A state change of a pooled trip or of a request before it joins one.
 *
 * Published to the "trip-events" topic, keyed by tripId once a trip exists and by
 * requestId before that, so every event of one trip lands in one partition.
 *
 * REQUESTED → BOOKED → STARTED → COMPLETED
 * REQUESTED → NO_VEHICLE
 * BOOKED | STARTED → CANCELLED
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripEvent {

    private String eventId;
    private UUID tripId; // null for REQUESTED / NO_VEHICLE
    private UUID requestId; // null for trip-level events
    private List<UUID> requestIds;
    private UUID vehicleId;
    private EventType eventType;
    private Instant timestamp;
    private String metadata;

    public enum EventType {
        REQUESTED,
        NO_VEHICLE,
        BOOKED,
        STARTED,
        COMPLETED,
        CANCELLED
    }

    public String partitionKey() {
        return tripId != null ? tripId.toString() : requestId.toString();
    }

    public static TripEvent requested(UUID requestId) {
        return forRequest(requestId, EventType.REQUESTED, null);
    }

    public static TripEvent noVehicle(UUID requestId, String reason) {
        return forRequest(requestId, EventType.NO_VEHICLE, reason);
    }

    public static TripEvent booked(UUID tripId, UUID vehicleId, List<UUID> requestIds, String priceJson) {
        return forTrip(tripId, vehicleId, requestIds, EventType.BOOKED, priceJson);
    }

    public static TripEvent started(UUID tripId, UUID vehicleId, List<UUID> requestIds) {
        return forTrip(tripId, vehicleId, requestIds, EventType.STARTED, null);
    }

    public static TripEvent completed(UUID tripId, UUID vehicleId, List<UUID> requestIds) {
        return forTrip(tripId, vehicleId, requestIds, EventType.COMPLETED, null);
    }

    public static TripEvent cancelled(UUID tripId, UUID vehicleId, List<UUID> requestIds, String reason) {
        return forTrip(tripId, vehicleId, requestIds, EventType.CANCELLED, reason);
    }

    private static TripEvent forRequest(UUID requestId, EventType type, String metadata) {
        return TripEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .requestId(requestId)
                .requestIds(List.of(requestId))
                .eventType(type)
                .timestamp(Instant.now())
                .metadata(metadata)
                .build();
    }

    private static TripEvent forTrip(UUID tripId, UUID vehicleId, List<UUID> requestIds,
                                     EventType type, String metadata) {
        return TripEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .tripId(tripId)
                .vehicleId(vehicleId)
                .requestIds(requestIds)
                .eventType(type)
                .timestamp(Instant.now())
                .metadata(metadata)
                .build();
    }
}
