package com.gocomet.ridepool.trip.model;

import com.gocomet.ridepool.routing.model.WaypointType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.*;

import java.util.UUID;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TripWaypoint {

    @Enumerated(EnumType.STRING)
    @Column(name = "waypoint_type", nullable = false)
    private WaypointType type;

    @Column(name = "request_id", nullable = false)
    private UUID requestId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private String address;
}
