package com.fotogeo.core.exif;

import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.model.Orientation;
import com.fotogeo.core.model.ProjectedCoordinate;
import com.fotogeo.testing.TestPhotos;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataExtractorTest {

    @TempDir
    Path tempDir;

    private final MetadataExtractor extractor = new MetadataExtractor();

    @Test
    void readsAllTagsAndProjectsCoordinates() throws Exception {
        Path photo = TestPhotos.jpeg("IMG_01.jpg")
            .description("Bridge\nbuilt 1920")
            .orientation(6)
            .dateTimeOriginal("2021:07:04 09:15:30")
            .dateTime("2022:01:01 00:00:00")
            .gps(45.0, -93.0)
            .writeTo(tempDir);
        byte[] before = Files.readAllBytes(photo);

        ImageRecord record = extractor.extract(photo);

        assertEquals("IMG_01.jpg", record.filename());
        assertEquals("Bridge\nbuilt 1920", record.description().orElseThrow());
        assertEquals(Orientation.ROTATE_90_CW, record.orientation());
        assertEquals(LocalDateTime.of(2021, 7, 4, 9, 15, 30), record.captureTimestamp().orElseThrow(),
            "Original capture time should win over DateTime");
        assertEquals(45.0, record.latitude().orElseThrow(), 1e-6);
        assertEquals(-93.0, record.longitude().orElseThrow(), 1e-6);
        ProjectedCoordinate utm = record.projected().orElseThrow();
        assertEquals(15, utm.zone());
        assertEquals('N', utm.hemisphere());
        assertArrayEquals(before, Files.readAllBytes(photo), "Extraction must not modify the file");
    }

    @Test
    void photoWithoutTagsYieldsBareRecord() throws Exception {
        Path photo = TestPhotos.jpeg("plain.jpg").writeTo(tempDir);

        ImageRecord record = extractor.extract(photo);

        assertFalse(record.hasCoordinates());
        assertFalse(record.isPlaceable());
        assertTrue(record.customName().isEmpty());
        assertTrue(record.description().isEmpty());
        assertTrue(record.captureTimestamp().isEmpty());
        assertEquals(Orientation.IDENTITY, record.orientation());
    }

    @Test
    void fallsBackToGenericDateTime() throws Exception {
        Path photo = TestPhotos.jpeg("dated.jpg").dateTime("2020:02:29 23:59:59").writeTo(tempDir);

        ImageRecord record = extractor.extract(photo);

        assertEquals(LocalDateTime.of(2020, 2, 29, 23, 59, 59), record.captureTimestamp().orElseThrow());
    }

    @Test
    void malformedDateIsTreatedAsAbsent() throws Exception {
        Path photo = TestPhotos.jpeg("baddate.jpg").dateTimeOriginal("not a date").writeTo(tempDir);

        assertTrue(extractor.extract(photo).captureTimestamp().isEmpty());
    }

    @Test
    void polarCoordinatesKeepLatLonButNoProjection() throws Exception {
        Path photo = TestPhotos.jpeg("pole.jpg").gps(89.5, 10.0).writeTo(tempDir);

        ImageRecord record = extractor.extract(photo);

        assertTrue(record.hasCoordinates());
        assertFalse(record.isPlaceable(), "UTM is undefined near the pole");
    }

    @Test
    void unreadableFileIsReported() throws Exception {
        Path corrupt = TestPhotos.writeCorrupt(tempDir, "broken.jpg");

        assertThrows(UnreadableImageException.class, () -> extractor.extract(corrupt));
    }
}
