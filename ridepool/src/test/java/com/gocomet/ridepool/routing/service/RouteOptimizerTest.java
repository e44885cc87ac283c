package com.gocomet.ridepool.routing.service;

import com.gocomet.ridepool.common.model.GeoPoint;
import com.gocomet.ridepool.common.util.GeoUtils;
import com.gocomet.ridepool.request.model.RequestSnapshot;
import com.gocomet.ridepool.routing.model.RoutePlan;
import com.gocomet.ridepool.routing.model.Waypoint;
import com.gocomet.ridepool.routing.model.WaypointType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.gocomet.ridepool.request.model.RequestFixtures.request;
import static org.junit.jupiter.api.Assertions.*;

class RouteOptimizerTest {

    private final RouteOptimizer optimizer = new RouteOptimizer();

    @Test
    void rejectsEmptyGroup() {
        assertThrows(IllegalArgumentException.class, () -> optimizer.optimize(List.of()));
    }

    @Test
    void singleRequestGoesStraightFromPickupToDropoff() {
        RequestSnapshot only = request(GeoPoint.of(12.9352, 77.6245), GeoPoint.of(12.9716, 77.5946), 1);

        RoutePlan plan = optimizer.optimize(List.of(only));

        assertEquals(2, plan.getWaypoints().size());
        assertEquals(WaypointType.PICKUP, plan.getWaypoints().get(0).getType());
        assertEquals(WaypointType.DROPOFF, plan.getWaypoints().get(1).getType());
        assertEquals(only.directDistanceKm(), plan.getTotalDistanceKm(), 1e-9);
        assertEquals(GeoUtils.travelMinutes(plan.getTotalDistanceKm()), plan.getEstimatedDurationMinutes());
    }

    @Test
    @DisplayName("Nested trip along one road: outer rider is dropped last")
    void nestsInnerTripInsideOuterTrip() {
        RequestSnapshot outer = request(GeoPoint.of(0, 0.00), GeoPoint.of(0, 0.03), 1);
        RequestSnapshot inner = request(GeoPoint.of(0, 0.01), GeoPoint.of(0, 0.02), 1);

        RoutePlan plan = optimizer.optimize(List.of(outer, inner));

        List<String> stops = plan.getWaypoints().stream()
                .map(w -> w.getType() + ":" + (w.getRequestId().equals(outer.getId()) ? "outer" : "inner"))
                .collect(Collectors.toList());
        assertEquals(List.of("PICKUP:outer", "PICKUP:inner", "DROPOFF:inner", "DROPOFF:outer"), stops);
        assertEquals(GeoUtils.distanceKm(0, 0, 0, 0.03), plan.getTotalDistanceKm(), 1e-9);
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5, 6})
    void everyPickupPrecedesItsDropoff(int groupSize) {
        List<RequestSnapshot> group = scatteredGroup(groupSize);

        RoutePlan plan = optimizer.optimize(group);

        assertEquals(groupSize * 2, plan.getWaypoints().size());
        for (RequestSnapshot member : group) {
            int pickup = plan.indexOf(WaypointType.PICKUP, member.getId());
            int dropoff = plan.indexOf(WaypointType.DROPOFF, member.getId());
            assertTrue(pickup >= 0 && pickup < dropoff, "pickup must precede dropoff for " + member.getId());
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 4, 5, 6})
    void neverLongerThanAllPickupsThenAllDropoffs(int groupSize) {
        List<RequestSnapshot> group = scatteredGroup(groupSize);

        List<GeoPoint> naive = new ArrayList<>();
        group.forEach(r -> naive.add(r.getPickup()));
        group.forEach(r -> naive.add(r.getDropoff()));

        RoutePlan plan = optimizer.optimize(group);

        assertTrue(plan.getTotalDistanceKm() <= GeoUtils.routeLengthKm(naive) + 1e-9);
    }

    @Test
    void exactSearchMatchesBruteForceForThreeRequests() {
        List<RequestSnapshot> group = scatteredGroup(3);

        RoutePlan plan = optimizer.optimize(group);

        List<Waypoint> stops = new ArrayList<>();
        for (RequestSnapshot r : group) {
            stops.add(Waypoint.pickupOf(r));
            stops.add(Waypoint.dropoffOf(r));
        }
        double best = bruteForce(stops, new boolean[stops.size()], null, 0.0, 0);
        assertEquals(best, plan.getTotalDistanceKm(), 1e-9);
    }

    @Test
    void sameInputGivesSameOrder() {
        List<RequestSnapshot> group = scatteredGroup(4);

        RoutePlan first = optimizer.optimize(group);
        RoutePlan second = optimizer.optimize(group);

        assertEquals(first.getWaypoints(), second.getWaypoints());
    }

    private List<RequestSnapshot> scatteredGroup(int size) {
        double[][] coords = {
                {12.9352, 77.6245, 12.9716, 77.5946},
                {12.9380, 77.6200, 12.9600, 77.6000},
                {12.9300, 77.6300, 12.9750, 77.6100},
                {12.9400, 77.6150, 12.9500, 77.5900},
                {12.9330, 77.6280, 12.9800, 77.6050},
                {12.9370, 77.6220, 12.9650, 77.5980}
        };
        List<RequestSnapshot> group = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            double[] c = coords[i];
            group.add(request(GeoPoint.of(c[0], c[1]), GeoPoint.of(c[2], c[3]), 1));
        }
        return group;
    }

    private double bruteForce(List<Waypoint> stops, boolean[] used, Waypoint last, double distance, int depth) {
        if (depth == stops.size()) {
            return distance;
        }
        double best = Double.POSITIVE_INFINITY;
        for (int i = 0; i < stops.size(); i++) {
            if (used[i] || (i % 2 == 1 && !used[i - 1])) {
                continue;
            }
            double hop = last == null ? 0 : GeoUtils.distanceKm(last.getLocation(), stops.get(i).getLocation());
            used[i] = true;
            best = Math.min(best, bruteForce(stops, used, stops.get(i), distance + hop, depth + 1));
            used[i] = false;
        }
        return best;
    }
}
