package com.miniuber.rideservice.util;

/**
 * Great-circle distance helpers.
 *
 *  - distanceKm : Haversine distance between two coordinates
 *  - boundingBox: lat/lon box enclosing a circle, used as a cheap index-friendly
 *                 pre-filter before the exact distance check
 */
public final class GeoDistance {

    // Earth's mean radius in km
    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    /**
     * Calculate distance between two GPS coordinates using Haversine formula
     *
     * @param lat1 Latitude of first point
     * @param lon1 Longitude of first point
     * @param lat2 Latitude of second point
     * @param lon2 Longitude of second point
     * @return Distance in kilometres
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = lat2Rad - lat1Rad;
        double deltaLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }

    public static double distanceKm(GeoPoint from, GeoPoint to) {
        return distanceKm(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
    }

    public static boolean isWithinRadius(GeoPoint center, GeoPoint point, double radiusKm) {
        return distanceKm(center, point) <= radiusKm;
    }

    /**
     * Returns {minLat, maxLat, minLon, maxLon} of a box that fully contains the circle of
     * {@code radiusKm} around {@code center}. Near a pole, or when the box would cross the
     * antimeridian, the longitude span widens to the whole globe.
     */
    public static double[] boundingBox(GeoPoint center, double radiusKm) {
        double angular = radiusKm / EARTH_RADIUS_KM;
        double latDelta = Math.toDegrees(angular);
        double minLat = Math.max(-90.0, center.getLatitude() - latDelta);
        double maxLat = Math.min(90.0, center.getLatitude() + latDelta);

        double cosLat = Math.cos(Math.toRadians(center.getLatitude()));
        double ratio = cosLat > 0 ? Math.sin(angular) / cosLat : Double.POSITIVE_INFINITY;
        if (maxLat >= 90.0 || minLat <= -90.0 || ratio >= 1.0) {
            return new double[]{minLat, maxLat, -180.0, 180.0};
        }

        double lonDelta = Math.toDegrees(Math.asin(ratio));
        double minLon = center.getLongitude() - lonDelta;
        double maxLon = center.getLongitude() + lonDelta;
        if (minLon < -180.0 || maxLon > 180.0) {
            return new double[]{minLat, maxLat, -180.0, 180.0};
        }
        return new double[]{minLat, maxLat, minLon, maxLon};
    }
}
