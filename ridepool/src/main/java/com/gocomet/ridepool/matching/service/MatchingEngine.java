package com.gocomet.ridepool.matching.service;

import com.gocomet.ridepool.common.util.GeoUtils;
import com.gocomet.ridepool.matching.model.MatchResult;
import com.gocomet.ridepool.matching.model.PassengerLegPlan;
import com.gocomet.ridepool.matching.model.TripPlan;
import com.gocomet.ridepool.pricing.model.PricingSnapshot;
import com.gocomet.ridepool.pricing.service.PricingEngine;
import com.gocomet.ridepool.request.model.RequestSnapshot;
import com.gocomet.ridepool.routing.model.RoutePlan;
import com.gocomet.ridepool.routing.model.WaypointType;
import com.gocomet.ridepool.routing.service.RouteOptimizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ranks the ways a request can share a vehicle with nearby pending requests.
 *
 * Pure and deterministic: the same target, candidates and pricing snapshot always
 * produce the same ranked list. Nothing here touches the store or the cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchingEngine {

    public static final int MAX_PASSENGERS = 4;
    public static final int MAX_LUGGAGE_UNITS = 6;
    public static final double MAX_PICKUP_DISTANCE_KM = 5.0;
    public static final double DETOUR_RATIO = 0.20;
    public static final double SOLO_SCORE = 50.0;
    public static final int MAX_RESULTS = 5;

    private final RouteOptimizer routeOptimizer;
    private final PricingEngine pricingEngine;

    /**
     * Up to {@value #MAX_RESULTS} options, best first. The solo option is always present.
     */
    public List<MatchResult> findMatches(RequestSnapshot target, List<RequestSnapshot> candidates,
                                         PricingSnapshot pricing) {
        List<MatchResult> options = new ArrayList<>();
        options.add(soloOption(target, pricing));

        List<RequestSnapshot> nearby = candidates.stream()
                .filter(candidate -> !candidate.getId().equals(target.getId()))
                .filter(candidate -> GeoUtils.distanceKm(target.getPickup(), candidate.getPickup())
                        <= MAX_PICKUP_DISTANCE_KM)
                .collect(Collectors.toList());

        for (List<RequestSnapshot> group : candidateGroups(nearby)) {
            if (!canJoin(group, target)) {
                continue;
            }
            List<RequestSnapshot> members = new ArrayList<>(group);
            members.add(target);
            if (!checkConstraints(members)) {
                continue;
            }
            MatchResult pooled = pooledOption(members, pricing);
            if (pooled != null) {
                options.add(pooled);
            }
        }

        // List.sort is stable, so ties keep enumeration order
        options.sort(Comparator.comparingDouble(MatchResult::getScore).reversed());
        List<MatchResult> top = new ArrayList<>(options.subList(0, Math.min(MAX_RESULTS, options.size())));

        log.debug("Request {}: {} nearby candidates, {} admissible options, returning {}",
                target.getId(), nearby.size(), options.size(), top.size());
        return top;
    }

    /**
     * Total passengers ≤ {@value #MAX_PASSENGERS} and total luggage units ≤ {@value #MAX_LUGGAGE_UNITS}.
     */
    public boolean checkConstraints(List<RequestSnapshot> group) {
        int passengers = group.stream().mapToInt(RequestSnapshot::getPassengers).sum();
        int luggage = group.stream().mapToInt(RequestSnapshot::luggageUnits).sum();
        return passengers <= MAX_PASSENGERS && luggage <= MAX_LUGGAGE_UNITS;
    }

    boolean canJoin(List<RequestSnapshot> group, RequestSnapshot target) {
        int passengers = group.stream().mapToInt(RequestSnapshot::getPassengers).sum();
        return passengers + target.getPassengers() <= MAX_PASSENGERS;
    }

    // Singles, then pairs, then triples; each size in ascending index order.
    // Pairs and triples must already satisfy the constraints without the target.
    private List<List<RequestSnapshot>> candidateGroups(List<RequestSnapshot> nearby) {
        List<List<RequestSnapshot>> groups = new ArrayList<>();
        int n = nearby.size();
        for (int i = 0; i < n; i++) {
            groups.add(List.of(nearby.get(i)));
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                List<RequestSnapshot> pair = List.of(nearby.get(i), nearby.get(j));
                if (checkConstraints(pair)) {
                    groups.add(pair);
                }
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                for (int k = j + 1; k < n; k++) {
                    List<RequestSnapshot> triple = List.of(nearby.get(i), nearby.get(j), nearby.get(k));
                    if (checkConstraints(triple)) {
                        groups.add(triple);
                    }
                }
            }
        }
        return groups;
    }

    private MatchResult soloOption(RequestSnapshot target, PricingSnapshot pricing) {
        RoutePlan route = routeOptimizer.optimize(List.of(target));
        BigDecimal fare = soloFare(target, pricing);
        PassengerLegPlan leg = PassengerLegPlan.builder()
                .requestId(target.getId())
                .requesterId(target.getRequesterId())
                .requestVersion(target.getVersion())
                .passengers(target.getPassengers())
                .pickupOrder(0)
                .dropoffOrder(1)
                .distanceKm(route.getTotalDistanceKm())
                .fare(fare)
                .detourMinutes(0)
                .build();

        return MatchResult.builder()
                .plan(toPlan(route, List.of(leg), List.of(target), pricing, fare))
                .score(SOLO_SCORE)
                .savings(BigDecimal.ZERO.setScale(2))
                .maxDetourMinutes(0)
                .build();
    }

    /**
     * Routes and prices a pooled group, or returns null when any member's detour is too large.
     */
    private MatchResult pooledOption(List<RequestSnapshot> members, PricingSnapshot pricing) {
        RoutePlan route = routeOptimizer.optimize(members);
        int totalPassengers = members.stream().mapToInt(RequestSnapshot::getPassengers).sum();

        List<PassengerLegPlan> legs = new ArrayList<>(members.size());
        double sumDirectKm = 0;
        int sumDetour = 0;
        int maxDetour = 0;
        BigDecimal pooledTotal = BigDecimal.ZERO;
        BigDecimal soloTotal = BigDecimal.ZERO;

        for (RequestSnapshot member : members) {
            int pickupOrder = route.indexOf(WaypointType.PICKUP, member.getId());
            int dropoffOrder = route.indexOf(WaypointType.DROPOFF, member.getId());
            double sharedKm = route.distanceBetweenKm(pickupOrder, dropoffOrder);
            double directKm = member.directDistanceKm();
            int directMinutes = member.directMinutes();
            int detour = GeoUtils.travelMinutes(sharedKm) - directMinutes;

            double allowed = Math.max(directMinutes * DETOUR_RATIO, member.getMaxDetourMinutes());
            if (detour > allowed) {
                log.debug("Group rejected: request {} detour {} min exceeds {} min",
                        member.getId(), detour, allowed);
                return null;
            }

            BigDecimal fare = pricingEngine.fare(sharedKm, member.getPassengers(), totalPassengers,
                    pricing.getSurgeFactor(), pricing.getHourOfDay());
            legs.add(PassengerLegPlan.builder()
                    .requestId(member.getId())
                    .requesterId(member.getRequesterId())
                    .requestVersion(member.getVersion())
                    .passengers(member.getPassengers())
                    .pickupOrder(pickupOrder)
                    .dropoffOrder(dropoffOrder)
                    .distanceKm(sharedKm)
                    .fare(fare)
                    .detourMinutes(detour)
                    .build());

            sumDirectKm += directKm;
            sumDetour += detour;
            maxDetour = Math.max(maxDetour, detour);
            pooledTotal = pooledTotal.add(fare);
            soloTotal = soloTotal.add(soloFare(member, pricing));
        }

        double efficiency = route.getTotalDistanceKm() > 0 ? sumDirectKm / route.getTotalDistanceKm() : 1.0;
        double averageDetour = (double) sumDetour / members.size();
        double score = Math.min(100.0,
                (double) members.size() / MAX_PASSENGERS * 40
                        + efficiency * 40
                        + Math.max(0.0, 20 - averageDetour));

        return MatchResult.builder()
                .plan(toPlan(route, legs, members, pricing, pooledTotal))
                .score(score)
                .savings(pricingEngine.savings(soloTotal, pooledTotal))
                .maxDetourMinutes(maxDetour)
                .build();
    }

    private BigDecimal soloFare(RequestSnapshot request, PricingSnapshot pricing) {
        return pricingEngine.fare(request.directDistanceKm(), request.getPassengers(), request.getPassengers(),
                pricing.getSurgeFactor(), pricing.getHourOfDay());
    }

    private TripPlan toPlan(RoutePlan route, List<PassengerLegPlan> legs, List<RequestSnapshot> members,
                            PricingSnapshot pricing, BigDecimal basePrice) {
        return TripPlan.builder()
                .waypoints(route.getWaypoints())
                .legs(legs)
                .totalDistanceKm(route.getTotalDistanceKm())
                .estimatedDurationMinutes(route.getEstimatedDurationMinutes())
                .surgeFactor(pricing.getSurgeFactor())
                .basePrice(basePrice)
                .totalPassengers(members.stream().mapToInt(RequestSnapshot::getPassengers).sum())
                .totalLuggageUnits(members.stream().mapToInt(RequestSnapshot::luggageUnits).sum())
                .build();
    }
}
