package com.gocomet.ridepool.common.util;

import com.gocomet.ridepool.common.model.GeoPoint;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Great-circle geometry and the fixed-speed travel time model shared by routing,
 * matching and pricing.
 */
public final class GeoUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double AVERAGE_SPEED_KMH = 40.0;

    private static final double KM_PER_DEGREE_LATITUDE = 111.0;

    private GeoUtils() {
    }

    /**
     * Haversine distance in kilometers.
     */
    public static double distanceKm(GeoPoint from, GeoPoint to) {
        return distanceKm(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
    }

    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Sum of consecutive distances along an ordered sequence of points.
     */
    public static double routeLengthKm(List<GeoPoint> points) {
        double total = 0;
        for (int i = 0; i < points.size() - 1; i++) {
            total += distanceKm(points.get(i), points.get(i + 1));
        }
        return total;
    }

    /**
     * Whole minutes needed to cover the distance at the average city speed, rounded up.
     */
    public static int travelMinutes(double distanceKm) {
        return (int) Math.ceil(distanceKm / AVERAGE_SPEED_KMH * 60);
    }

    /**
     * Rectangle enclosing the circle of {@code radiusKm} around {@code center}. Used to
     * narrow store queries before the exact haversine filter. A circle that crosses the
     * antimeridian gets the full longitude range, since a single min/max pair cannot wrap.
     */
    public static BoundingBox boundingBox(GeoPoint center, double radiusKm) {
        double latDelta = radiusKm / KM_PER_DEGREE_LATITUDE;
        double cosLat = Math.cos(Math.toRadians(center.getLatitude()));
        double lngDelta = cosLat < 1e-6 ? 180.0 : radiusKm / (KM_PER_DEGREE_LATITUDE * cosLat);
        double minLng = center.getLongitude() - lngDelta;
        double maxLng = center.getLongitude() + lngDelta;
        if (minLng < -180.0 || maxLng > 180.0) {
            minLng = -180.0;
            maxLng = 180.0;
        }
        return new BoundingBox(
                Math.max(-90.0, center.getLatitude() - latDelta),
                Math.min(90.0, center.getLatitude() + latDelta),
                minLng,
                maxLng);
    }

    @Getter
    @AllArgsConstructor
    public static class BoundingBox {
        private final double minLat;
        private final double maxLat;
        private final double minLng;
        private final double maxLng;
    }
}
