package com.gocomet.ridepool.matching.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {

    private TripPlan plan;
    // 0..100, higher is better
    private double score;
    private BigDecimal savings;
    private int maxDetourMinutes;

    @JsonIgnore
    public boolean isSolo() {
        return plan.getLegs().size() == 1;
    }
}
