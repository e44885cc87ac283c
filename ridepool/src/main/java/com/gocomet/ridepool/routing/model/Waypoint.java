package com.gocomet.ridepool.routing.model;

import com.gocomet.ridepool.common.model.GeoPoint;
import com.gocomet.ridepool.request.model.RequestSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * One stop of a route: a pickup or a dropoff of a specific request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Waypoint {

    private WaypointType type;
    private UUID requestId;
    private GeoPoint location;
    private int passengers;

    public static Waypoint pickupOf(RequestSnapshot request) {
        return new Waypoint(WaypointType.PICKUP, request.getId(), request.getPickup(), request.getPassengers());
    }

    public static Waypoint dropoffOf(RequestSnapshot request) {
        return new Waypoint(WaypointType.DROPOFF, request.getId(), request.getDropoff(), request.getPassengers());
    }
}
