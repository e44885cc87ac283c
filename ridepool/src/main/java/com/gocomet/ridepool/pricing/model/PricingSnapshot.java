package com.gocomet.ridepool.pricing.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Market conditions frozen for the duration of one matching call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingSnapshot {

    private double surgeFactor;
    private int hourOfDay;
}
