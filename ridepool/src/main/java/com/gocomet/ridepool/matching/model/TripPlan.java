package com.gocomet.ridepool.matching.model;

import com.gocomet.ridepool.routing.model.Waypoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A trip that could be booked: the stop sequence plus the priced legs of every member.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripPlan {

    private List<Waypoint> waypoints;
    private List<PassengerLegPlan> legs;
    private double totalDistanceKm;
    private int estimatedDurationMinutes;
    private double surgeFactor;
    private BigDecimal basePrice;
    private int totalPassengers;
    private int totalLuggageUnits;

    public List<UUID> requestIds() {
        return legs.stream().map(PassengerLegPlan::getRequestId).collect(Collectors.toList());
    }
}
