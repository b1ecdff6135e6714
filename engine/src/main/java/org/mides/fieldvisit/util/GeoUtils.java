package org.mides.fieldvisit.util;

import org.mides.fieldvisit.model.GeoPoint;

public final class GeoUtils {
    private static final double EARTH_RADIUS_KM = 6371.0;

    private GeoUtils() {
    }

    /**
     * Great-circle distance in km between two valid points.
     */
    public static double haversineKm(GeoPoint from, GeoPoint to) {
        double lat1 = Math.toRadians(from.getLatitude());
        double lat2 = Math.toRadians(to.getLatitude());
        double deltaLat = Math.toRadians(to.getLatitude() - from.getLatitude());
        double deltaLon = Math.toRadians(to.getLongitude() - from.getLongitude());

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
            + Math.cos(lat1) * Math.cos(lat2) * Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /* Converts provider meters to km with one decimal */
    public static double metersToKm(long meters) {
        return roundOneDecimal(meters / 1000.0);
    }

    public static double roundOneDecimal(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
