package com.fotogeo.core.fs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhotoDiscoveryServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void listsSupportedPhotosSortedByName() throws IOException {
        for (String name : List.of("b.JPG", "a.jpeg", "c.tiff", "d.png", "e.txt", "f.gif")) {
            Files.writeString(tempDir.resolve(name), "x");
        }
        Files.createDirectories(tempDir.resolve("sub"));
        Files.writeString(tempDir.resolve("sub/nested.jpg"), "x");

        List<Path> photos = new PhotoDiscoveryService().findPhotos(tempDir);

        assertEquals(List.of("a.jpeg", "b.JPG", "c.tiff", "d.png"),
            photos.stream().map(p -> p.getFileName().toString()).toList());
    }

    @Test
    void rejectsMissingFolder() {
        assertThrows(IllegalArgumentException.class,
            () -> new PhotoDiscoveryService().findPhotos(tempDir.resolve("nope")));
    }

    @Test
    void recognizesJpegExtensions() {
        assertTrue(PhotoDiscoveryService.isJpeg(Path.of("x.JPEG")));
        assertTrue(PhotoDiscoveryService.isJpeg(Path.of("x.jpg")));
        assertFalse(PhotoDiscoveryService.isJpeg(Path.of("x.png")));
        assertFalse(PhotoDiscoveryService.isJpeg(Path.of("jpg")));
    }
}
