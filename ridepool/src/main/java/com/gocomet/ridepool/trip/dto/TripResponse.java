package com.gocomet.ridepool.trip.dto;

import com.gocomet.ridepool.trip.model.PassengerLeg;
import com.gocomet.ridepool.trip.model.Trip;
import com.gocomet.ridepool.trip.model.TripStatus;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TripResponse {

    private UUID id;
    private UUID vehicleId;
    private TripStatus status;
    private List<WaypointResponse> waypoints;
    private List<PassengerLegResponse> legs;
    private BigDecimal totalDistanceKm;
    private Integer estimatedDurationMinutes;
    private BigDecimal basePrice;
    private BigDecimal surgeFactor;
    private Integer version;
    private LocalDateTime createdAt;

    public static TripResponse from(Trip trip, UUID vehicleId, List<PassengerLeg> legs) {
        return TripResponse.builder()
                .id(trip.getId())
                .vehicleId(vehicleId)
                .status(trip.getStatus())
                .waypoints(trip.getWaypoints().stream()
                        .map(waypoint -> WaypointResponse.builder()
                                .type(waypoint.getType())
                                .requestId(waypoint.getRequestId())
                                .lat(waypoint.getLatitude())
                                .lng(waypoint.getLongitude())
                                .address(waypoint.getAddress())
                                .build())
                        .collect(Collectors.toList()))
                .legs(legs.stream()
                        .map(leg -> PassengerLegResponse.builder()
                                .requestId(leg.getRequestId())
                                .requesterId(leg.getRequesterId())
                                .passengers(leg.getPassengers())
                                .pickupOrder(leg.getPickupOrder())
                                .dropoffOrder(leg.getDropoffOrder())
                                .fare(leg.getFare())
                                .detourMinutes(leg.getDetourMinutes())
                                .build())
                        .collect(Collectors.toList()))
                .totalDistanceKm(trip.getTotalDistanceKm())
                .estimatedDurationMinutes(trip.getEstimatedDurationMinutes())
                .basePrice(trip.getBasePrice())
                .surgeFactor(trip.getSurgeFactor())
                .version(trip.getVersion())
                .createdAt(trip.getCreatedAt())
                .build();
    }
}
