package com.fotogeo.core.report;

import com.fotogeo.core.exif.ExtractionBatch;
import com.fotogeo.core.exif.ExtractionSummary;
import com.fotogeo.core.export.ArtifactOutcome;
import com.fotogeo.core.export.ExportReport;
import com.fotogeo.core.export.RenderFailure;
import com.fotogeo.core.fs.AtomicFileWriter;
import com.fotogeo.core.model.SkippedItem;
import com.fotogeo.core.update.RowOutcome;
import com.fotogeo.core.update.UpdateReport;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Persists what a run did, including every skipped file and failed render, as a JSON document next to
 * the artifacts.
 */
public final class RunReportWriter {
    private final Clock clock;

    public RunReportWriter() {
        this(Clock.systemUTC());
    }

    RunReportWriter(Clock clock) {
        this.clock = clock;
    }

    public Path writeExportReport(Path target, ExtractionBatch batch, ExportReport export) throws IOException {
        JSONObject root = header(batch.sourceDirectory());
        root.put("summary", toJson(batch.summary()));
        root.put("extractionSkipped", skippedToJson(batch.skipped()));

        JSONArray artifacts = new JSONArray();
        for (ArtifactOutcome outcome : export.artifacts()) {
            JSONObject obj = new JSONObject();
            obj.put("format", outcome.format().keyword());
            if (outcome.succeeded()) {
                obj.put("path", outcome.path().toString());
                obj.put("entries", outcome.entries());
            } else {
                obj.put("error", outcome.errorMessage().orElse("unknown error"));
            }
            artifacts.put(obj);
        }
        root.put("artifacts", artifacts);

        JSONArray failures = new JSONArray();
        for (RenderFailure failure : export.renderFailures()) {
            JSONObject obj = new JSONObject();
            obj.put("format", failure.format().keyword());
            if (failure.filename() != null) {
                obj.put("filename", failure.filename());
            }
            obj.put("reason", failure.reason());
            failures.put(obj);
        }
        root.put("renderFailures", failures);
        return write(target, root);
    }

    public Path writeUpdateReport(Path target, Path sourceDirectory, Path table, UpdateReport report) throws IOException {
        JSONObject root = header(sourceDirectory);
        root.put("editedTable", table.toAbsolutePath().toString());
        root.put("updatedCount", report.updatedCount());
        root.put("updateSkipped", skippedToJson(report.skipped()));

        JSONArray rows = new JSONArray();
        for (RowOutcome outcome : report.outcomes()) {
            JSONObject obj = new JSONObject();
            obj.put("row", outcome.rowNumber());
            obj.put("filename", outcome.filename());
            obj.put("status", outcome.status().name());
            if (outcome.reason() != null) {
                obj.put("reason", outcome.reason());
            }
            rows.put(obj);
        }
        root.put("rows", rows);
        return write(target, root);
    }

    private JSONObject header(Path sourceDirectory) {
        JSONObject root = new JSONObject();
        root.put("generatedAt", Instant.now(clock).toString());
        root.put("sourceDirectory", sourceDirectory.toAbsolutePath().toString());
        return root;
    }

    private static JSONObject toJson(ExtractionSummary summary) {
        JSONObject obj = new JSONObject();
        obj.put("filesFound", summary.filesFound());
        obj.put("records", summary.records());
        obj.put("unreadable", summary.unreadable());
        obj.put("withCoordinates", summary.withCoordinates());
        obj.put("withoutCoordinates", summary.withoutCoordinates());
        obj.put("projectionFailures", summary.projectionFailures());
        obj.put("withTimestamp", summary.withTimestamp());
        obj.put("withDescription", summary.withDescription());
        obj.put("withCustomName", summary.withCustomName());
        return obj;
    }

    private static JSONArray skippedToJson(List<SkippedItem> skipped) {
        JSONArray array = new JSONArray();
        for (SkippedItem item : skipped) {
            JSONObject obj = new JSONObject();
            obj.put("filename", item.filename());
            obj.put("reason", item.reason());
            array.put(obj);
        }
        return array;
    }

    private static Path write(Path target, JSONObject root) throws IOException {
        byte[] bytes = root.toString(2).getBytes(StandardCharsets.UTF_8);
        return AtomicFileWriter.write(target, out -> out.write(bytes));
    }
}
