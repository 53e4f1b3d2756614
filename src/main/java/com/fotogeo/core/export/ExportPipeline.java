package com.fotogeo.core.export;

import com.fotogeo.core.image.OrientedThumbnailer;
import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.title.TitleResolver;
import com.fotogeo.logging.AppLogger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the selected renderers one after another over the same ordered records. A format that fails is
 * reported and the remaining formats still run.
 */
public final class ExportPipeline {
    private static final Logger LOGGER = AppLogger.get();

    private final Map<ExportFormat, ExportRenderer> renderers = new EnumMap<>(ExportFormat.class);

    public ExportPipeline(List<ExportRenderer> renderers) {
        for (ExportRenderer renderer : renderers) {
            this.renderers.put(renderer.format(), renderer);
        }
    }

    /**
     * Pipeline with the four standard renderers sharing one title resolver and one thumbnailer.
     */
    public static ExportPipeline standard() {
        TitleResolver titleResolver = new TitleResolver();
        OrientedThumbnailer thumbnailer = new OrientedThumbnailer();
        return new ExportPipeline(List.of(
            new KmzRenderer(titleResolver, thumbnailer),
            new SimpleKmlRenderer(titleResolver),
            new CsvTableRenderer(),
            new ExcelTableRenderer(thumbnailer)
        ));
    }

    public ExportReport run(List<ImageRecord> records, Set<ExportFormat> formats, ExportContext context) {
        List<ArtifactOutcome> artifacts = new ArrayList<>();
        List<RenderFailure> failures = new ArrayList<>();
        if (records.isEmpty()) {
            LOGGER.warning("No photo metadata to export");
        }

        for (ExportFormat format : ExportFormat.values()) {
            if (!formats.contains(format)) {
                continue;
            }
            ExportRenderer renderer = renderers.get(format);
            if (renderer == null) {
                String reason = "no renderer registered";
                artifacts.add(ArtifactOutcome.failed(format, reason));
                failures.add(new RenderFailure(format, null, reason));
                continue;
            }
            List<ImageRecord> input = format.isMapOverlay() ? placeable(records, format) : records;
            try {
                RenderResult result = renderer.render(input, context);
                artifacts.add(ArtifactOutcome.written(result));
                failures.addAll(result.failures());
            } catch (IOException | RuntimeException ex) {
                LOGGER.log(Level.SEVERE, "Failed to write " + format.keyword() + " output: " + ex.getMessage(), ex);
                artifacts.add(ArtifactOutcome.failed(format, ex.getMessage()));
                failures.add(new RenderFailure(format, null, String.valueOf(ex.getMessage())));
            }
        }
        return new ExportReport(artifacts, failures);
    }

    private static List<ImageRecord> placeable(List<ImageRecord> records, ExportFormat format) {
        List<ImageRecord> placeable = records.stream().filter(ImageRecord::isPlaceable).toList();
        int omitted = records.size() - placeable.size();
        if (omitted > 0) {
            LOGGER.info(format.keyword() + ": " + omitted + " photo(s) without a UTM position are left off the map");
        }
        return placeable;
    }
}
