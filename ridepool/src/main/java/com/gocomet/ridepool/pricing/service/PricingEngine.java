package com.gocomet.ridepool.pricing.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Stateless fare arithmetic. Every amount leaving this class is rounded to two decimals.
 */
@Component
public class PricingEngine {

    public static final BigDecimal BASE_FARE = new BigDecimal("5.00");
    public static final BigDecimal RATE_PER_KM = new BigDecimal("2.50");
    public static final BigDecimal MINIMUM_FARE = new BigDecimal("8.00");
    public static final double MAX_SURGE = 3.0;

    private static final double MAX_DEMAND_RATIO = 2.0;

    /**
     * Surge grows with the square of the demand/supply ratio, capped at {@link #MAX_SURGE}.
     * With no available vehicles the maximum applies.
     */
    public double surgeFactor(long activeRequests, long availableVehicles) {
        if (availableVehicles <= 0) {
            return MAX_SURGE;
        }
        double ratio = Math.min((double) activeRequests / availableVehicles, MAX_DEMAND_RATIO);
        double surge = 1.0 + ratio * ratio;
        return Math.max(1.0, Math.min(MAX_SURGE, surge));
    }

    public double timeMultiplier(int hourOfDay) {
        if ((hourOfDay >= 7 && hourOfDay < 9) || (hourOfDay >= 17 && hourOfDay < 19)) {
            return 1.5;
        }
        if (hourOfDay >= 23 || hourOfDay < 5) {
            return 1.3;
        }
        return 1.0;
    }

    /**
     * Discount tier keyed on how many people share the vehicle.
     */
    public double poolingDiscount(int totalPassengersInTrip) {
        return switch (totalPassengersInTrip) {
            case 0, 1 -> 0.0;
            case 2 -> 0.20;
            case 3 -> 0.30;
            default -> 0.40;
        };
    }

    public BigDecimal fare(double actualDistanceKm, int passengersInBooking, int totalPassengersInTrip,
                           double surgeFactor, int hourOfDay) {
        if (actualDistanceKm < 0 || passengersInBooking < 1) {
            throw new IllegalArgumentException("Distance must be non-negative and passengers at least 1");
        }
        BigDecimal perPassenger = BASE_FARE
                .add(RATE_PER_KM.multiply(BigDecimal.valueOf(actualDistanceKm)))
                .multiply(BigDecimal.valueOf(surgeFactor))
                .multiply(BigDecimal.valueOf(timeMultiplier(hourOfDay)))
                .multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(poolingDiscount(totalPassengersInTrip))));

        BigDecimal fare = perPassenger
                .multiply(BigDecimal.valueOf(passengersInBooking))
                .setScale(2, RoundingMode.HALF_UP);
        return fare.max(MINIMUM_FARE);
    }

    /**
     * Splits a total in proportion to each member's distance. Falls back to an even split
     * when no distance was travelled.
     */
    public List<BigDecimal> splitFare(BigDecimal total, List<Double> distancesKm) {
        if (distancesKm.isEmpty()) {
            throw new IllegalArgumentException("Cannot split a fare between zero members");
        }
        double sum = distancesKm.stream().mapToDouble(Double::doubleValue).sum();
        List<BigDecimal> shares = new ArrayList<>(distancesKm.size());
        for (Double distance : distancesKm) {
            BigDecimal share = sum == 0
                    ? total.divide(BigDecimal.valueOf(distancesKm.size()), 2, RoundingMode.HALF_UP)
                    : total.multiply(BigDecimal.valueOf(distance / sum)).setScale(2, RoundingMode.HALF_UP);
            shares.add(share);
        }
        return shares;
    }

    public BigDecimal savings(BigDecimal soloTotal, BigDecimal pooledTotal) {
        return soloTotal.subtract(pooledTotal).setScale(2, RoundingMode.HALF_UP);
    }
}
