package com.gocomet.ridepool.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A latitude/longitude pair with an optional human-readable label.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoPoint {

    private double latitude;
    private double longitude;
    private String address;

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude, null);
    }
}
