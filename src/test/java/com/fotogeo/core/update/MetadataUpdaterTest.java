package com.fotogeo.core.update;

import com.fotogeo.core.exif.MetadataExtractor;
import com.fotogeo.core.export.ExcelTableRenderer;
import com.fotogeo.core.export.ExportContext;
import com.fotogeo.core.export.ExportSettings;
import com.fotogeo.core.image.OrientedThumbnailer;
import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.model.UpdateRow;
import com.fotogeo.testing.TestPhotos;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataUpdaterTest {

    @TempDir
    Path tempDir;

    private final MetadataExtractor extractor = new MetadataExtractor();

    @Test
    void spreadsheetEditsRoundTripIntoPhotos() throws Exception {
        Path photos = Files.createDirectories(tempDir.resolve("photos"));
        Path first = TestPhotos.jpeg("IMG_01.jpg")
            .description("Bridge\nbuilt 1920")
            .gps(45.0, -93.0)
            .dateTimeOriginal("2021:07:04 09:15:30")
            .orientation(3)
            .writeTo(photos);
        Path second = TestPhotos.jpeg("IMG_02.jpg").artist("Keep me").description("Old").writeTo(photos);
        ImageRecord before = extractor.extract(first);
        ImageRecord secondBefore = extractor.extract(second);
        int[] pixelsBefore = TestPhotos.pixels(first);

        ExportContext context = ExportContext.forFolder(photos, tempDir, ExportSettings.defaults());
        Path xlsx = new ExcelTableRenderer(new OrientedThumbnailer())
            .render(List.of(before, secondBefore), context).artifact();
        try (InputStream in = Files.newInputStream(xlsx); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            XSSFSheet sheet = workbook.getSheet(ExcelTableRenderer.SHEET_NAME);
            sheet.getRow(1).getCell(2).setCellValue("North Bridge");
            try (OutputStream out = Files.newOutputStream(xlsx)) {
                workbook.write(out);
            }
        }

        UpdateReport report = new MetadataUpdater().applyTable(xlsx, photos);

        assertEquals(1, report.updatedCount());
        assertTrue(report.skipped().isEmpty());
        assertEquals(RowOutcome.Status.UNCHANGED, report.outcomes().get(1).status());
        ImageRecord after = extractor.extract(first);
        assertEquals("North Bridge", after.customName().orElseThrow());
        assertEquals(before.description(), after.description());
        assertEquals(before.latitude(), after.latitude());
        assertEquals(before.longitude(), after.longitude());
        assertEquals(before.projected(), after.projected());
        assertEquals(before.captureTimestamp(), after.captureTimestamp());
        assertEquals(before.orientation(), after.orientation());
        assertArrayEquals(pixelsBefore, TestPhotos.pixels(first), "Pixel data must be untouched");

        ImageRecord secondAfter = extractor.extract(second);
        assertEquals(secondBefore.customName(), secondAfter.customName());
        assertEquals(secondBefore.description(), secondAfter.description());
    }

    @Test
    void emptyValueRemovesTagAndNullKeepsIt() throws Exception {
        Path photo = TestPhotos.jpeg("IMG_01.jpg").artist("Someone").description("Text").writeTo(tempDir);

        new MetadataUpdater().apply(List.of(new UpdateRow(2, "IMG_01.jpg", "", null)), tempDir);

        ImageRecord after = extractor.extract(photo);
        assertTrue(after.customName().isEmpty(), "Empty edit removes the Artist tag");
        assertEquals("Text", after.description().orElseThrow());
    }

    @Test
    void untouchedRowKeepsPaddedDescriptionByteForByte() throws Exception {
        Path photos = Files.createDirectories(tempDir.resolve("photos"));
        Path photo = TestPhotos.jpeg("P1010001.jpg").description("OLYMPUS DIGITAL CAMERA         ").writeTo(photos);
        byte[] original = Files.readAllBytes(photo);

        ExportContext context = ExportContext.forFolder(photos, tempDir, ExportSettings.defaults());
        Path xlsx = new ExcelTableRenderer(new OrientedThumbnailer())
            .render(List.of(extractor.extract(photo)), context).artifact();

        UpdateReport report = new MetadataUpdater().applyTable(xlsx, photos);

        assertEquals(0, report.updatedCount());
        assertTrue(report.skipped().isEmpty());
        assertEquals(RowOutcome.Status.UNCHANGED, report.outcomes().get(0).status());
        assertEquals("OLYMPUS DIGITAL CAMERA         ", extractor.extract(photo).description().orElseThrow());
        assertArrayEquals(original, Files.readAllBytes(photo));
    }

    @Test
    void onlyTheEditedFieldIsRewritten() throws Exception {
        Path photo = TestPhotos.jpeg("IMG_01.jpg").artist("Ana").description("  padded  ").writeTo(tempDir);

        UpdateReport report = new MetadataUpdater().apply(List.of(new UpdateRow(2, "IMG_01.jpg", "Bea", "padded")), tempDir);

        assertEquals(1, report.updatedCount());
        ImageRecord after = extractor.extract(photo);
        assertEquals("Bea", after.customName().orElseThrow());
        assertEquals("  padded  ", after.description().orElseThrow());
    }

    @Test
    void tableWithoutEditableColumnsIsSkipped() throws Exception {
        Path photo = TestPhotos.jpeg("IMG_01.jpg").description("Text").writeTo(tempDir);
        byte[] original = Files.readAllBytes(photo);

        UpdateReport report = new MetadataUpdater().apply(List.of(new UpdateRow(2, "IMG_01.jpg", null, null)), tempDir);

        assertEquals(0, report.updatedCount());
        assertEquals(1, report.skipped().size());
        assertEquals(RowOutcome.Status.NO_EDITABLE_COLUMNS, report.outcomes().get(0).status());
        assertArrayEquals(original, Files.readAllBytes(photo));
    }

    @Test
    void emptyCellMatchesAbsentTag() {
        assertNull(MetadataUpdater.changedValue("", Optional.empty()));
        assertNull(MetadataUpdater.changedValue("Text", Optional.of(" Text  ")));
        assertEquals("New", MetadataUpdater.changedValue("New", Optional.of("Old")));
        assertEquals("", MetadataUpdater.changedValue("", Optional.of("Old")));
    }

    @Test
    void unmatchedRowTouchesNothing() throws Exception {
        Path photo = TestPhotos.jpeg("IMG_01.jpg").description("Text").writeTo(tempDir);
        byte[] original = Files.readAllBytes(photo);

        UpdateReport report = new MetadataUpdater().apply(
            List.of(new UpdateRow(2, "img_01.jpg", "x", "y"), new UpdateRow(3, "missing.jpg", "x", "y")), tempDir);

        assertEquals(0, report.updatedCount());
        assertEquals(2, report.skipped().size());
        assertEquals(RowOutcome.Status.UNMATCHED, report.outcomes().get(0).status(), "Matching is case-sensitive");
        assertEquals(RowOutcome.Status.UNMATCHED, report.outcomes().get(1).status());
        assertArrayEquals(original, Files.readAllBytes(photo));
    }

    @Test
    void duplicateRowsAreSkippedAsAmbiguous() throws Exception {
        Path photo = TestPhotos.jpeg("IMG_01.jpg").description("Text").writeTo(tempDir);
        byte[] original = Files.readAllBytes(photo);

        UpdateReport report = new MetadataUpdater().apply(
            List.of(new UpdateRow(2, "IMG_01.jpg", "a", "b"), new UpdateRow(3, "IMG_01.jpg", "c", "d")), tempDir);

        assertEquals(0, report.updatedCount());
        assertTrue(report.outcomes().stream().allMatch(o -> o.status() == RowOutcome.Status.AMBIGUOUS));
        assertArrayEquals(original, Files.readAllBytes(photo));
    }

    @Test
    void nonJpegIsReportedAsWriteFailure() throws Exception {
        Path png = TestPhotos.writePng(tempDir, "map.png", 10, 10);
        byte[] original = Files.readAllBytes(png);

        UpdateReport report = new MetadataUpdater().apply(List.of(new UpdateRow(2, "map.png", "x", "y")), tempDir);

        RowOutcome outcome = report.outcomes().get(0);
        assertEquals(RowOutcome.Status.WRITE_FAILED, outcome.status());
        assertEquals("metadata writing is only supported for JPEG", outcome.reason());
        assertArrayEquals(original, Files.readAllBytes(png));
    }

    @Test
    void missingPhotoFolderIsFatal() {
        assertThrows(IllegalArgumentException.class,
            () -> new MetadataUpdater().apply(List.of(), tempDir.resolve("missing")));
    }
}
