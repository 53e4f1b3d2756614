package com.fotogeo.core.geo;

/**
 * Latitude/longitude pair in decimal degrees (WGS84).
 */
public record GeoPosition(double latitude, double longitude) {

    public boolean isInRange() {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
            && latitude >= -90 && latitude <= 90
            && longitude >= -180 && longitude <= 180;
    }
}
