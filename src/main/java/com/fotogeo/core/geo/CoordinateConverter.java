package com.fotogeo.core.geo;

import com.fotogeo.core.model.ProjectedCoordinate;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

import java.util.HashMap;
import java.util.Map;

/**
 * Converts WGS84 latitude/longitude to UTM easting/northing on the WGS84 ellipsoid.
 * <p>
 * The zone follows the plain 6-degree band rule (no Norway/Svalbard exceptions), the hemisphere follows the
 * sign of the latitude. UTM is only defined between 80&deg;S and 84&deg;N; positions outside that band
 * (including the poles) are rejected.
 * <p>
 * Instances cache one transform per zone/hemisphere and are not thread-safe.
 */
public final class CoordinateConverter {
    static final double MIN_UTM_LATITUDE = -80.0;
    static final double MAX_UTM_LATITUDE = 84.0;

    private static final String GEOGRAPHIC_PARAMS = "+proj=longlat +datum=WGS84 +no_defs";

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private final CoordinateReferenceSystem geographic;
    private final Map<String, CoordinateTransform> forward = new HashMap<>();
    private final Map<String, CoordinateTransform> inverse = new HashMap<>();

    public CoordinateConverter() {
        this.geographic = crsFactory.createFromParameters("WGS84", GEOGRAPHIC_PARAMS);
    }

    public ProjectedCoordinate convert(double latitude, double longitude) throws ConversionException {
        GeoPosition position = new GeoPosition(latitude, longitude);
        if (!position.isInRange()) {
            throw new ConversionException("Latitude/longitude out of range: (%s, %s)".formatted(latitude, longitude));
        }
        if (latitude < MIN_UTM_LATITUDE || latitude > MAX_UTM_LATITUDE) {
            throw new ConversionException("Latitude %s is outside the UTM band (80S to 84N)".formatted(latitude));
        }

        int zone = zoneFor(longitude);
        char hemisphere = latitude >= 0 ? 'N' : 'S';
        ProjCoordinate result = new ProjCoordinate();
        try {
            forward.computeIfAbsent(key(zone, hemisphere), k -> transformFactory.createTransform(geographic, utm(zone, hemisphere)))
                .transform(new ProjCoordinate(longitude, latitude), result);
        } catch (Proj4jException | IllegalStateException ex) {
            throw new ConversionException("UTM projection failed for (%s, %s): %s".formatted(latitude, longitude, ex.getMessage()), ex);
        }
        if (!Double.isFinite(result.x) || !Double.isFinite(result.y)) {
            throw new ConversionException("UTM projection produced a non-finite result for (%s, %s)".formatted(latitude, longitude));
        }
        return new ProjectedCoordinate(result.x, result.y, zone, hemisphere);
    }

    /**
     * Projects a UTM coordinate back to latitude/longitude.
     */
    public GeoPosition inverse(ProjectedCoordinate coordinate) throws ConversionException {
        int zone = coordinate.zone();
        char hemisphere = coordinate.hemisphere();
        ProjCoordinate result = new ProjCoordinate();
        try {
            inverse.computeIfAbsent(key(zone, hemisphere), k -> transformFactory.createTransform(utm(zone, hemisphere), geographic))
                .transform(new ProjCoordinate(coordinate.easting(), coordinate.northing()), result);
        } catch (Proj4jException | IllegalStateException ex) {
            throw new ConversionException("Inverse UTM projection failed for " + coordinate + ": " + ex.getMessage(), ex);
        }
        return new GeoPosition(result.y, result.x);
    }

    static int zoneFor(double longitude) {
        int zone = (int) Math.floor((longitude + 180.0) / 6.0) + 1;
        return Math.max(1, Math.min(60, zone));
    }

    private CoordinateReferenceSystem utm(int zone, char hemisphere) {
        String params = "+proj=utm +zone=" + zone + (hemisphere == 'S' ? " +south" : "") + " +datum=WGS84 +units=m +no_defs";
        return crsFactory.createFromParameters("UTM" + zone + hemisphere, params);
    }

    private static String key(int zone, char hemisphere) {
        return zone + String.valueOf(hemisphere);
    }
}
