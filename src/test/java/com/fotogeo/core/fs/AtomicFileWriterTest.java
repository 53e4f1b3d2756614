package com.fotogeo.core.fs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AtomicFileWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void replacesTargetOnSuccess() throws IOException {
        Path target = tempDir.resolve("out.txt");
        Files.writeString(target, "old");

        AtomicFileWriter.write(target, out -> out.write("new".getBytes(StandardCharsets.UTF_8)));

        assertEquals("new", Files.readString(target));
        assertEquals(1, countFiles(), "Temporary file should be gone");
    }

    @Test
    void failedWriteLeavesNoArtifact() throws IOException {
        Path target = tempDir.resolve("out.txt");

        assertThrows(IOException.class, () -> AtomicFileWriter.write(target, out -> {
            out.write(1);
            throw new IOException("boom");
        }));

        assertFalse(Files.exists(target));
        assertEquals(0, countFiles());
    }

    private long countFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.count();
        }
    }
}
