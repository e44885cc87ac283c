package com.gocomet.ridepool.request.model;

import com.gocomet.ridepool.common.model.GeoPoint;
import com.gocomet.ridepool.common.util.GeoUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of a {@link RideRequest} as seen by matching and routing.
 * This is also the shape cached in Redis under {@code request:{id}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestSnapshot {

    private UUID id;
    private UUID requesterId;
    private GeoPoint pickup;
    private GeoPoint dropoff;
    private int passengers;
    @Builder.Default
    private List<Integer> luggage = new ArrayList<>();
    private int maxDetourMinutes;
    private RequestStatus status;
    private int version;
    private LocalDateTime requestedAt;

    public static RequestSnapshot from(RideRequest request) {
        return RequestSnapshot.builder()
                .id(request.getId())
                .requesterId(request.getRequesterId())
                .pickup(new GeoPoint(request.getPickupLat(), request.getPickupLng(), request.getPickupAddress()))
                .dropoff(new GeoPoint(request.getDropoffLat(), request.getDropoffLng(), request.getDropoffAddress()))
                .passengers(request.getPassengers())
                .luggage(new ArrayList<>(request.getLuggage()))
                .maxDetourMinutes(request.getMaxDetourMinutes())
                .status(request.getStatus())
                .version(request.getVersion())
                .requestedAt(request.getRequestedAt())
                .build();
    }

    public int luggageUnits() {
        return luggage == null ? 0 : luggage.stream().mapToInt(Integer::intValue).sum();
    }

    public double directDistanceKm() {
        return GeoUtils.distanceKm(pickup, dropoff);
    }

    public int directMinutes() {
        return GeoUtils.travelMinutes(directDistanceKm());
    }
}
