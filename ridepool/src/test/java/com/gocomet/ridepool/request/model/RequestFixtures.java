package com.gocomet.ridepool.request.model;

import com.gocomet.ridepool.common.model.GeoPoint;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.UUID;

/**
 * Builders for request snapshots around Koramangala, Bangalore.
 */
public final class RequestFixtures {

    public static final GeoPoint KORAMANGALA = GeoPoint.of(12.9352, 77.6245);
    public static final GeoPoint MG_ROAD = GeoPoint.of(12.9716, 77.5946);

    // ~1 km of latitude
    public static final double KM_LAT = 1 / 111.195;

    private RequestFixtures() {
    }

    public static RequestSnapshot request(GeoPoint pickup, GeoPoint dropoff, int passengers, Integer... luggage) {
        return RequestSnapshot.builder()
                .id(UUID.randomUUID())
                .requesterId(UUID.randomUUID())
                .pickup(pickup)
                .dropoff(dropoff)
                .passengers(passengers)
                .luggage(new ArrayList<>(Arrays.asList(luggage)))
                .maxDetourMinutes(15)
                .status(RequestStatus.PENDING)
                .version(1)
                .requestedAt(LocalDateTime.of(2026, 3, 2, 12, 0))
                .build();
    }

    public static GeoPoint north(GeoPoint from, double km) {
        return GeoPoint.of(from.getLatitude() + km * KM_LAT, from.getLongitude());
    }

    public static GeoPoint east(GeoPoint from, double km) {
        double cosLat = Math.cos(Math.toRadians(from.getLatitude()));
        return GeoPoint.of(from.getLatitude(), from.getLongitude() + km * KM_LAT / cosLat);
    }
}
