package com.gocomet.ridepool.matching.service;

import com.gocomet.ridepool.matching.model.MatchResult;
import com.gocomet.ridepool.matching.model.PassengerLegPlan;
import com.gocomet.ridepool.pricing.model.PricingSnapshot;
import com.gocomet.ridepool.pricing.service.PricingEngine;
import com.gocomet.ridepool.request.model.RequestSnapshot;
import com.gocomet.ridepool.routing.service.RouteOptimizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.gocomet.ridepool.request.model.RequestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MatchingEngineTest {

    private static final PricingSnapshot NOON = new PricingSnapshot(1.0, 12);

    private final MatchingEngine engine = new MatchingEngine(new RouteOptimizer(), new PricingEngine());

    // ========== Solo option ==========

    @Test
    void zeroCandidatesYieldsOnlySolo() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 1);

        List<MatchResult> results = engine.findMatches(target, List.of(), NOON);

        assertEquals(1, results.size());
        MatchResult solo = results.get(0);
        assertTrue(solo.isSolo());
        assertEquals(50.0, solo.getScore());
        assertEquals(0, solo.getSavings().compareTo(BigDecimal.ZERO));
        assertEquals(0, solo.getMaxDetourMinutes());
        assertEquals(target.getId(), solo.getPlan().getLegs().get(0).getRequestId());
    }

    @Test
    void targetInCandidateListIsIgnored() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 1);

        List<MatchResult> results = engine.findMatches(target, List.of(target), NOON);

        assertEquals(1, results.size());
    }

    // ========== End-to-end scenarios ==========

    @Test
    @DisplayName("Two pairs 0.2 km apart heading to the same place pool with positive savings")
    void scenarioA_nearbyPairsPool() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 2, 1, 1);
        RequestSnapshot partner = request(north(KORAMANGALA, 0.2), MG_ROAD, 2, 2);

        List<MatchResult> results = engine.findMatches(target, List.of(partner), NOON);

        assertEquals(2, results.size());
        MatchResult pooled = results.get(0);
        assertFalse(pooled.isSolo());
        assertEquals(4, pooled.getPlan().getTotalPassengers());
        assertEquals(4, pooled.getPlan().getTotalLuggageUnits());
        assertTrue(pooled.getSavings().signum() > 0);
        assertEquals(100.0, pooled.getScore(), 1e-9);
        assertTrue(results.get(1).isSolo());
    }

    @Test
    @DisplayName("Two groups of three at the same pickup cannot share")
    void scenarioB_overCapacityStaysSolo() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 3);
        RequestSnapshot other = request(KORAMANGALA, MG_ROAD, 3);

        List<MatchResult> results = engine.findMatches(target, List.of(other), NOON);

        assertEquals(1, results.size());
        assertTrue(results.get(0).isSolo());
    }

    // ========== Constraints ==========

    @Test
    void luggageOverSixUnitsIsRejected() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 1, 3, 3);
        RequestSnapshot partner = request(KORAMANGALA, MG_ROAD, 1, 1);

        List<MatchResult> results = engine.findMatches(target, List.of(partner), NOON);

        assertEquals(1, results.size());
    }

    @Test
    void candidatesBeyondFiveKilometresAreIgnored() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 1);
        RequestSnapshot far = request(north(KORAMANGALA, 6.0), MG_ROAD, 1);

        List<MatchResult> results = engine.findMatches(target, List.of(far), NOON);

        assertEquals(1, results.size());
    }

    @Test
    @DisplayName("Shared pickup, partner dropped 3 km east first: target rides ~8 km instead of 4")
    void divergingDropoffsExceedStrictDetourTolerance() {
        RequestSnapshot target = request(KORAMANGALA, north(KORAMANGALA, 4.0), 1);
        RequestSnapshot partner = request(KORAMANGALA, east(KORAMANGALA, 3.0), 1);
        target.setMaxDetourMinutes(0);
        partner.setMaxDetourMinutes(0);

        List<MatchResult> results = engine.findMatches(target, List.of(partner), NOON);

        assertEquals(1, results.size());
        assertTrue(results.get(0).isSolo());
    }

    @Test
    void generousToleranceAdmitsTheSameDetour() {
        RequestSnapshot target = request(KORAMANGALA, north(KORAMANGALA, 4.0), 1);
        RequestSnapshot partner = request(KORAMANGALA, east(KORAMANGALA, 3.0), 1);
        target.setMaxDetourMinutes(30);
        partner.setMaxDetourMinutes(30);

        List<MatchResult> results = engine.findMatches(target, List.of(partner), NOON);

        assertEquals(2, results.size());
        MatchResult pooled = results.stream().filter(r -> !r.isSolo()).findFirst().orElseThrow();
        assertTrue(pooled.getMaxDetourMinutes() > 0);
        assertTrue(pooled.getMaxDetourMinutes() <= 30);
    }

    @Test
    void everyReturnedGroupRespectsCapacity() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 1, 2);
        List<RequestSnapshot> candidates = List.of(
                request(north(KORAMANGALA, 0.1), MG_ROAD, 2, 3),
                request(north(KORAMANGALA, 0.2), MG_ROAD, 1, 1, 1),
                request(north(KORAMANGALA, 0.3), MG_ROAD, 1),
                request(north(KORAMANGALA, 0.4), MG_ROAD, 3),
                request(north(KORAMANGALA, 0.5), MG_ROAD, 1, 3));

        List<MatchResult> results = engine.findMatches(target, candidates, NOON);

        assertFalse(results.isEmpty());
        for (MatchResult result : results) {
            int passengers = result.getPlan().getLegs().stream().mapToInt(PassengerLegPlan::getPassengers).sum();
            assertTrue(passengers <= 4);
            assertTrue(result.getPlan().getTotalLuggageUnits() <= 6);
            for (PassengerLegPlan leg : result.getPlan().getLegs()) {
                assertTrue(leg.getPickupOrder() < leg.getDropoffOrder());
            }
        }
    }

    // ========== Ranking ==========

    @Test
    void returnsAtMostFiveSortedByScore() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 1);
        List<RequestSnapshot> candidates = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            candidates.add(request(KORAMANGALA, MG_ROAD, 1));
        }

        List<MatchResult> results = engine.findMatches(target, candidates, NOON);

        assertEquals(5, results.size());
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).getScore() >= results.get(i).getScore());
        }
    }

    @Test
    @DisplayName("Equal scores keep enumeration order: singles by candidate index first")
    void tiesKeepEnumerationOrder() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 1);
        List<RequestSnapshot> candidates = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            candidates.add(request(KORAMANGALA, MG_ROAD, 1));
        }

        List<MatchResult> results = engine.findMatches(target, candidates, NOON);

        for (int i = 0; i < 5; i++) {
            MatchResult result = results.get(i);
            assertEquals(2, result.getPlan().getLegs().size());
            assertTrue(result.getPlan().requestIds().contains(candidates.get(i).getId()));
        }
    }

    @Test
    void identicalInputsGiveIdenticalRanking() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 1);
        List<RequestSnapshot> candidates = List.of(
                request(north(KORAMANGALA, 0.3), MG_ROAD, 1),
                request(north(KORAMANGALA, 1.1), north(MG_ROAD, 0.5), 2),
                request(north(KORAMANGALA, -0.4), MG_ROAD, 1, 2));

        List<MatchResult> first = engine.findMatches(target, candidates, NOON);
        List<MatchResult> second = engine.findMatches(target, candidates, NOON);

        assertEquals(ids(first), ids(second));
        assertEquals(first, second);
    }

    private List<List<String>> ids(List<MatchResult> results) {
        return results.stream()
                .map(r -> r.getPlan().getLegs().stream()
                        .map(leg -> leg.getRequestId().toString())
                        .collect(Collectors.toList()))
                .collect(Collectors.toList());
    }

    @Test
    void pooledLegFaresUseWholeTripOccupancy() {
        RequestSnapshot target = request(KORAMANGALA, MG_ROAD, 2);
        RequestSnapshot partner = request(KORAMANGALA, MG_ROAD, 2);
        PricingEngine pricing = new PricingEngine();

        MatchResult pooled = engine.findMatches(target, List.of(partner), NOON).get(0);

        for (PassengerLegPlan leg : pooled.getPlan().getLegs()) {
            assertEquals(pricing.fare(leg.getDistanceKm(), 2, 4, 1.0, 12), leg.getFare());
        }
        BigDecimal sum = pooled.getPlan().getLegs().stream()
                .map(PassengerLegPlan::getFare)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, sum.compareTo(pooled.getPlan().getBasePrice()));
    }
}
