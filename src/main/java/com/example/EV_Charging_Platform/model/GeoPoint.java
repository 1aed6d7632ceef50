package com.example.EV_Charging_Platform.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * WGS84 coordinate with great-circle distance helper
 */
public class GeoPoint {

    private static final double EARTH_RADIUS_METERS = 6_371_008.8;

    @JsonProperty("latitude")
    public final double latitude;

    @JsonProperty("longitude")
    public final double longitude;

    @JsonCreator
    public GeoPoint(@JsonProperty("latitude") double latitude, @JsonProperty("longitude") double longitude) {
        if (!isValid(latitude, longitude)) {
            throw new IllegalArgumentException(
                    String.format("Coordinate out of range: lat=%f, lon=%f", latitude, longitude));
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static boolean isValid(double latitude, double longitude) {
        return !Double.isNaN(latitude) && !Double.isNaN(longitude)
                && latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }

    /**
     * Haversine distance in meters
     */
    public double distanceMeters(GeoPoint other) {
        double lat1 = Math.toRadians(latitude);
        double lat2 = Math.toRadians(other.latitude);
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(other.longitude - longitude);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GeoPoint geoPoint = (GeoPoint) o;
        return Double.compare(latitude, geoPoint.latitude) == 0 && Double.compare(longitude, geoPoint.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(latitude) + Double.hashCode(longitude);
    }

    @Override
    public String toString() {
        return String.format("(%.6f, %.6f)", latitude, longitude);
    }
}
