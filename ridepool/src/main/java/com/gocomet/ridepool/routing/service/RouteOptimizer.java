package com.gocomet.ridepool.routing.service;

import com.gocomet.ridepool.common.util.GeoUtils;
import com.gocomet.ridepool.request.model.RequestSnapshot;
import com.gocomet.ridepool.routing.model.RoutePlan;
import com.gocomet.ridepool.routing.model.Waypoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Orders the pickups and dropoffs of a group of requests so that every request is
 * picked up before it is dropped off and the total haversine distance is small.
 *
 * Groups of up to {@value #EXACT_SEARCH_LIMIT} requests are solved exactly with a
 * depth-first branch-and-bound search. Larger groups fall back to a nearest-neighbour
 * heuristic, which is never allowed to be worse than visiting all pickups and then all
 * dropoffs in input order.
 */
@Component
@Slf4j
public class RouteOptimizer {

    static final int EXACT_SEARCH_LIMIT = 4;

    public RoutePlan optimize(List<RequestSnapshot> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a route for an empty group");
        }

        List<Waypoint> order;
        if (requests.size() == 1) {
            RequestSnapshot only = requests.get(0);
            order = List.of(Waypoint.pickupOf(only), Waypoint.dropoffOf(only));
        } else if (requests.size() <= EXACT_SEARCH_LIMIT) {
            order = exactOrder(requests);
        } else {
            order = shorter(greedyOrder(requests), inputOrder(requests));
        }

        double totalKm = lengthKm(order);
        log.debug("Route for {} requests: {} stops, {} km", requests.size(), order.size(), totalKm);

        return RoutePlan.builder()
                .waypoints(new ArrayList<>(order))
                .totalDistanceKm(totalKm)
                .estimatedDurationMinutes(GeoUtils.travelMinutes(totalKm))
                .build();
    }

    // Stop 2i is the pickup of request i, stop 2i+1 its dropoff.
    private List<Waypoint> exactOrder(List<RequestSnapshot> requests) {
        List<Waypoint> stops = new ArrayList<>(requests.size() * 2);
        for (RequestSnapshot request : requests) {
            stops.add(Waypoint.pickupOf(request));
            stops.add(Waypoint.dropoffOf(request));
        }

        SearchState state = new SearchState(stops);
        state.search(-1, 0.0);
        List<Waypoint> best = new ArrayList<>(stops.size());
        for (int index : state.bestOrder) {
            best.add(stops.get(index));
        }
        return best;
    }

    private List<Waypoint> greedyOrder(List<RequestSnapshot> requests) {
        int n = requests.size();
        boolean[] picked = new boolean[n];
        boolean[] dropped = new boolean[n];
        List<Waypoint> order = new ArrayList<>(n * 2);

        picked[0] = true;
        order.add(Waypoint.pickupOf(requests.get(0)));

        while (order.size() < n * 2) {
            Waypoint current = order.get(order.size() - 1);

            int nearestPickup = -1;
            double pickupKm = Double.MAX_VALUE;
            int nearestDropoff = -1;
            double dropoffKm = Double.MAX_VALUE;
            for (int i = 0; i < n; i++) {
                RequestSnapshot request = requests.get(i);
                if (!picked[i]) {
                    double km = GeoUtils.distanceKm(current.getLocation(), request.getPickup());
                    if (km < pickupKm) {
                        pickupKm = km;
                        nearestPickup = i;
                    }
                } else if (!dropped[i]) {
                    double km = GeoUtils.distanceKm(current.getLocation(), request.getDropoff());
                    if (km < dropoffKm) {
                        dropoffKm = km;
                        nearestDropoff = i;
                    }
                }
            }

            if (nearestPickup >= 0 && pickupKm <= dropoffKm) {
                picked[nearestPickup] = true;
                order.add(Waypoint.pickupOf(requests.get(nearestPickup)));
            } else {
                dropped[nearestDropoff] = true;
                order.add(Waypoint.dropoffOf(requests.get(nearestDropoff)));
            }
        }
        return order;
    }

    private List<Waypoint> inputOrder(List<RequestSnapshot> requests) {
        List<Waypoint> order = new ArrayList<>(requests.size() * 2);
        requests.forEach(request -> order.add(Waypoint.pickupOf(request)));
        requests.forEach(request -> order.add(Waypoint.dropoffOf(request)));
        return order;
    }

    private List<Waypoint> shorter(List<Waypoint> preferred, List<Waypoint> fallback) {
        return lengthKm(preferred) <= lengthKm(fallback) ? preferred : fallback;
    }

    private double lengthKm(List<Waypoint> order) {
        return GeoUtils.routeLengthKm(order.stream().map(Waypoint::getLocation).collect(Collectors.toList()));
    }

    private static final class SearchState {

        private final List<Waypoint> stops;
        private final boolean[] visited;
        private final int[] path;
        private int depth;
        private double bestDistance = Double.POSITIVE_INFINITY;
        private int[] bestOrder;

        private SearchState(List<Waypoint> stops) {
            this.stops = stops;
            this.visited = new boolean[stops.size()];
            this.path = new int[stops.size()];
        }

        private void search(int last, double distance) {
            if (distance >= bestDistance) {
                return;
            }
            if (depth == stops.size()) {
                bestDistance = distance;
                bestOrder = path.clone();
                return;
            }
            for (int i = 0; i < stops.size(); i++) {
                boolean dropoff = (i & 1) == 1;
                if (visited[i] || (dropoff && !visited[i - 1])) {
                    continue;
                }
                double leg = last < 0 ? 0.0
                        : GeoUtils.distanceKm(stops.get(last).getLocation(), stops.get(i).getLocation());
                visited[i] = true;
                path[depth++] = i;
                search(i, distance + leg);
                depth--;
                visited[i] = false;
            }
        }
    }
}
