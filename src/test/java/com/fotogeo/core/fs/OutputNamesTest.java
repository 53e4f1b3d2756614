package com.fotogeo.core.fs;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OutputNamesTest {

    @Test
    void derivesArtifactNamesFromFolder() {
        OutputNames names = OutputNames.forFolder(Path.of("/photos/Field Trip"));

        assertEquals("coordenadas_utm_Field_Trip", names.baseName());
        assertEquals("coordenadas_utm_Field_Trip.kmz", names.kmz());
        assertEquals("coordenadas_utm_Field_Trip_simple.kml", names.simpleKml());
        assertEquals("coordenadas_utm_Field_Trip.csv", names.csv());
        assertEquals("coordenadas_utm_Field_Trip_con_fotos.xlsx", names.excel());
        assertEquals("coordenadas_utm_Field_Trip_report.json", names.report());
    }

    @Test
    void sanitizeDropsReservedCharactersAndCapsLength() {
        assertEquals("ab_c", OutputNames.sanitize("a<b>:\"| c?*"));
        assertEquals(OutputNames.MAX_BASE_LENGTH, OutputNames.sanitize("x".repeat(300)).length());
    }
}
