package com.gocomet.ridepool.pricing.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PricingEngineTest {

    private final PricingEngine pricing = new PricingEngine();

    // ========== Surge ==========

    @Test
    @DisplayName("200 active / 100 available: 1 + 2² = 5, clamped to 3")
    void surgeIsClampedToMaximum() {
        assertEquals(3.0, pricing.surgeFactor(200, 100), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({
            "0, 10, 1.0",
            "50, 100, 1.25",
            "100, 100, 2.0",
            "150, 100, 3.0",
            "5, 0, 3.0"     // no supply at all
    })
    void surgeGrowsWithSquaredDemandRatio(long active, long available, double expected) {
        assertEquals(expected, pricing.surgeFactor(active, available), 1e-9);
    }

    // ========== Multipliers ==========

    @ParameterizedTest
    @CsvSource({
            "7, 1.5", "8, 1.5", "17, 1.5", "18, 1.5",
            "23, 1.3", "0, 1.3", "4, 1.3",
            "5, 1.0", "6, 1.0", "9, 1.0", "12, 1.0", "16, 1.0", "19, 1.0", "22, 1.0"
    })
    void timeMultiplierByHour(int hour, double expected) {
        assertEquals(expected, pricing.timeMultiplier(hour), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({"8, 45.00", "9, 30.00", "18, 45.00", "19, 30.00", "4, 39.00", "5, 30.00"})
    void peakAndNightEndAtTheTopOfTheHour(int hour, String expected) {
        assertEquals(new BigDecimal(expected), pricing.fare(10.0, 1, 1, 1.0, hour));
    }

    @ParameterizedTest
    @CsvSource({"1, 0.0", "2, 0.20", "3, 0.30", "4, 0.40", "6, 0.40"})
    void poolingDiscountByOccupancy(int totalPassengers, double expected) {
        assertEquals(expected, pricing.poolingDiscount(totalPassengers), 1e-9);
    }

    // ========== Fare ==========

    @ParameterizedTest
    @CsvSource({
            "10.0, 2, 4, 1.0, 12, 36.00",  // (5 + 25) * 0.6 * 2
            "10.0, 2, 2, 1.0, 12, 48.00",  // (5 + 25) * 0.8 * 2
            "10.0, 1, 1, 1.0, 12, 30.00",
            "10.0, 1, 1, 1.0, 8, 45.00",   // morning peak
            "2.0, 1, 1, 2.0, 23, 26.00"    // (5 + 5) * 2 * 1.3
    })
    void fareFormula(double km, int booking, int trip, double surge, int hour, String expected) {
        assertEquals(new BigDecimal(expected), pricing.fare(km, booking, trip, surge, hour));
    }

    @Test
    void fareNeverFallsBelowMinimum() {
        assertEquals(new BigDecimal("8.00"), pricing.fare(0.1, 1, 4, 1.0, 12));
        assertEquals(new BigDecimal("8.00"), pricing.fare(0.0, 1, 4, 1.0, 12));
    }

    @Test
    void fareIsMonotonicInDistanceAndSurge() {
        BigDecimal previous = BigDecimal.ZERO;
        for (double km = 0; km <= 30; km += 0.5) {
            BigDecimal fare = pricing.fare(km, 2, 3, 1.4, 18);
            assertTrue(fare.compareTo(previous) >= 0, "fare dropped at " + km + " km");
            previous = fare;
        }

        previous = BigDecimal.ZERO;
        for (double surge = 1.0; surge <= 3.0; surge += 0.1) {
            BigDecimal fare = pricing.fare(7.3, 1, 2, surge, 12);
            assertTrue(fare.compareTo(previous) >= 0, "fare dropped at surge " + surge);
            previous = fare;
        }
    }

    @Test
    void rejectsNegativeDistance() {
        assertThrows(IllegalArgumentException.class, () -> pricing.fare(-1.0, 1, 1, 1.0, 12));
    }

    // ========== Split & savings ==========

    @Test
    void splitsProportionallyToDistance() {
        List<BigDecimal> shares = pricing.splitFare(new BigDecimal("100.00"), List.of(1.0, 3.0));

        assertEquals(List.of(new BigDecimal("25.00"), new BigDecimal("75.00")), shares);
    }

    @Test
    void splitsEvenlyWhenNobodyTravelled() {
        List<BigDecimal> shares = pricing.splitFare(new BigDecimal("10.00"), List.of(0.0, 0.0));

        assertEquals(List.of(new BigDecimal("5.00"), new BigDecimal("5.00")), shares);
    }

    @Test
    void savingsIsRoundedDifference() {
        assertEquals(new BigDecimal("12.35"), pricing.savings(new BigDecimal("30.00"), new BigDecimal("17.654")));
        assertEquals(new BigDecimal("-2.00"), pricing.savings(new BigDecimal("8.00"), new BigDecimal("10.00")));
    }
}
