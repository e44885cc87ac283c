package com.gocomet.ridepool.routing.model;

import com.gocomet.ridepool.common.util.GeoUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutePlan {

    private List<Waypoint> waypoints;
    private double totalDistanceKm;
    private int estimatedDurationMinutes;

    public int indexOf(WaypointType type, UUID requestId) {
        for (int i = 0; i < waypoints.size(); i++) {
            Waypoint waypoint = waypoints.get(i);
            if (waypoint.getType() == type && waypoint.getRequestId().equals(requestId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Distance travelled along this route between two waypoint positions.
     */
    public double distanceBetweenKm(int fromIndex, int toIndex) {
        double distance = 0;
        for (int i = fromIndex; i < toIndex; i++) {
            distance += GeoUtils.distanceKm(waypoints.get(i).getLocation(), waypoints.get(i + 1).getLocation());
        }
        return distance;
    }
}
