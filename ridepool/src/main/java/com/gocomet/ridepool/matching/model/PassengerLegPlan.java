package com.gocomet.ridepool.matching.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One request's share of a planned trip. Orders are positions in the trip's waypoint list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PassengerLegPlan {

    private UUID requestId;
    private UUID requesterId;
    private int requestVersion;
    private int passengers;
    private int pickupOrder;
    private int dropoffOrder;
    private double distanceKm;
    private BigDecimal fare;
    private int detourMinutes;
}
