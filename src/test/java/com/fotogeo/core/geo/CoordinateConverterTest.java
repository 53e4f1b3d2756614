package com.fotogeo.core.geo;

import com.fotogeo.core.model.ProjectedCoordinate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CoordinateConverterTest {

    private final CoordinateConverter converter = new CoordinateConverter();

    @Test
    void projectsPointOnCentralMeridian() throws ConversionException {
        ProjectedCoordinate utm = converter.convert(45.0, -93.0);

        assertEquals(15, utm.zone());
        assertEquals('N', utm.hemisphere());
        assertEquals(500000.0, utm.easting(), 0.01, "Central meridian should map to the false easting");
        assertEquals(4982950.4, utm.northing(), 0.5);
    }

    @Test
    void southernLatitudeUsesFalseNorthing() throws ConversionException {
        ProjectedCoordinate utm = converter.convert(-23.5505, -46.6333);

        assertEquals(23, utm.zone());
        assertEquals('S', utm.hemisphere());
        assertEquals(7395000.0, utm.northing(), 5000.0, "Sao Paulo sits around 7.39 million meters north");
    }

    @Test
    void inverseRecoversOriginalPoint() throws ConversionException {
        double[][] points = {
            {45.0, -93.0},
            {-33.8688, 151.2093},
            {0.5, 0.5},
            {60.1699, 24.9384},
            {-54.8019, -68.3030},
            {83.9, 179.9}
        };
        for (double[] point : points) {
            GeoPosition back = converter.inverse(converter.convert(point[0], point[1]));
            assertEquals(point[0], back.latitude(), 1e-6, "latitude of " + point[0] + "," + point[1]);
            assertEquals(point[1], back.longitude(), 1e-6, "longitude of " + point[0] + "," + point[1]);
        }
    }

    @Test
    void rejectsOutOfRangeAndPolarInput() {
        assertThrows(ConversionException.class, () -> converter.convert(91.0, 10.0));
        assertThrows(ConversionException.class, () -> converter.convert(10.0, -181.0));
        assertThrows(ConversionException.class, () -> converter.convert(90.0, 0.0));
        assertThrows(ConversionException.class, () -> converter.convert(-85.0, 0.0));
        assertThrows(ConversionException.class, () -> converter.convert(Double.NaN, 0.0));
    }

    @Test
    void zoneFollowsSixDegreeBands() {
        assertEquals(1, CoordinateConverter.zoneFor(-180.0));
        assertEquals(30, CoordinateConverter.zoneFor(-0.1));
        assertEquals(31, CoordinateConverter.zoneFor(0.0));
        assertEquals(60, CoordinateConverter.zoneFor(179.99));
        assertEquals(60, CoordinateConverter.zoneFor(180.0));
    }
}
