package com.fotogeo.core.model;

/**
 * Planar UTM position of a photo. Always derived from latitude/longitude, never read from the file.
 */
public record ProjectedCoordinate(double easting, double northing, int zone, char hemisphere) {

    public ProjectedCoordinate {
        if (zone < 1 || zone > 60) {
            throw new IllegalArgumentException("zone must be between 1 and 60: " + zone);
        }
        if (hemisphere != 'N' && hemisphere != 'S') {
            throw new IllegalArgumentException("hemisphere must be N or S: " + hemisphere);
        }
        if (!Double.isFinite(easting) || !Double.isFinite(northing)) {
            throw new IllegalArgumentException("easting/northing must be finite");
        }
    }

    public boolean southern() {
        return hemisphere == 'S';
    }
}
