package com.fotogeo.cli;

import com.fotogeo.config.ConfigService;
import com.fotogeo.core.exif.ExtractionBatch;
import com.fotogeo.core.exif.PhotoCatalog;
import com.fotogeo.core.export.ArtifactOutcome;
import com.fotogeo.core.export.ExportContext;
import com.fotogeo.core.export.ExportFormat;
import com.fotogeo.core.export.ExportPipeline;
import com.fotogeo.core.export.ExportReport;
import com.fotogeo.core.export.ExportSettings;
import com.fotogeo.core.export.RenderFailure;
import com.fotogeo.core.fs.OutputNames;
import com.fotogeo.core.model.SkippedItem;
import com.fotogeo.core.report.RunReportWriter;
import com.fotogeo.core.update.MetadataUpdater;
import com.fotogeo.core.update.UpdateReport;
import com.fotogeo.logging.AppLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point.
 * <pre>
 *   export [photoFolder] [kmz|kml|csv|excel|all ...]
 *   update [photoFolder] [editedTable]
 * </pre>
 * Omitted paths fall back to {@code -Dfotogeo.folder} / {@code -Dfotogeo.table}, then to the paths used last time.
 */
public final class PhotoGeoTool {
    private static final Logger LOGGER = AppLogger.get();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
        "Usage:",
        "  export [photoFolder] [kmz|kml|csv|excel|all ...]   create map and table exports (default: all)",
        "  update [photoFolder] [editedTable]                 write edited names/descriptions back into the photos");

    private final ConfigService config;
    private final PrintStream out;

    PhotoGeoTool(ConfigService config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new PhotoGeoTool(ConfigService.getInstance(), System.out).run(args));
    }

    int run(String[] args) {
        if (args == null || args.length == 0) {
            out.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args[0].trim().toLowerCase(Locale.ROOT);
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            return switch (command) {
                case "export" -> runExport(rest);
                case "update" -> runUpdate(rest);
                default -> usage("Unknown command: " + args[0]);
            };
        } catch (UsageException ex) {
            return usage(ex.getMessage());
        } catch (IOException | UncheckedIOException | IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int runExport(List<String> args) throws IOException, UsageException {
        String folderArg = null;
        Set<ExportFormat> formats = EnumSet.noneOf(ExportFormat.class);
        for (String arg : args) {
            if (folderArg == null && formats.isEmpty() && !isFormatKeyword(arg)) {
                folderArg = arg;
                continue;
            }
            try {
                formats.addAll(ExportFormat.parse(arg));
            } catch (IllegalArgumentException ex) {
                throw new UsageException(ex.getMessage());
            }
        }
        if (formats.isEmpty()) {
            formats = EnumSet.allOf(ExportFormat.class);
        }

        Path folder = resolveFolder(folderArg);
        config.setLastPhotoDirectory(folder);
        Path outputDirectory = config.getOutputDirectory().orElse(folder);

        ExtractionBatch batch = new PhotoCatalog().scan(folder, config.getSortOrder());
        ExportContext context = ExportContext.forFolder(folder, outputDirectory, ExportSettings.fromConfig(config));
        ExportReport report = ExportPipeline.standard().run(batch.records(), formats, context);
        Path reportFile = new RunReportWriter().writeExportReport(
            outputDirectory.resolve(context.names().report()), batch, report);

        out.println(batch.summary().describe());
        printSkipped("Skipped photos", batch.skipped());
        for (ArtifactOutcome artifact : report.artifacts()) {
            out.println(artifact.succeeded()
                ? "  [" + artifact.format().keyword() + "] " + artifact.path() + " (" + artifact.entries() + ")"
                : "  [" + artifact.format().keyword() + "] FAILED: " + artifact.errorMessage().orElse(""));
        }
        for (RenderFailure failure : report.renderFailures()) {
            if (failure.filename() != null) {
                out.println("  ! " + failure.format().keyword() + " " + failure.filename() + ": " + failure.reason());
            }
        }
        out.println("Report: " + reportFile);
        return report.allFormatsWritten() ? EXIT_OK : EXIT_FAILURE;
    }

    private int runUpdate(List<String> args) throws IOException, UsageException {
        if (args.size() > 2) {
            throw new UsageException("update takes at most a photo folder and an edited table");
        }
        Path folder = resolveFolder(args.size() > 0 ? args.get(0) : null);
        Path table = resolveTable(args.size() > 1 ? args.get(1) : null);
        config.setLastPhotoDirectory(folder);
        config.setLastEditedTable(table);

        LOGGER.info("Updating photos in " + folder + " from " + table + "; original files are modified");
        UpdateReport report = new MetadataUpdater().applyTable(table, folder);

        Path outputDirectory = config.getOutputDirectory().orElse(folder);
        Path reportFile = new RunReportWriter().writeUpdateReport(
            outputDirectory.resolve(OutputNames.forFolder(folder).updateReport()), folder, table, report);

        out.println(report.updatedCount() + " photo(s) updated");
        printSkipped("Skipped rows", report.skipped());
        out.println("Report: " + reportFile);
        return EXIT_OK;
    }

    private Path resolveFolder(String argument) throws UsageException {
        Path folder = firstPresent(argument, config.lookup("folder"), config.getLastPhotoDirectory())
            .orElseThrow(() -> new UsageException("No photo folder given"));
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException(folder + " is not a directory");
        }
        return folder.toAbsolutePath().normalize();
    }

    private Path resolveTable(String argument) throws UsageException {
        return firstPresent(argument, config.lookup("table"), config.getLastEditedTable())
            .map(path -> path.toAbsolutePath().normalize())
            .orElseThrow(() -> new UsageException("No edited table given"));
    }

    private static Optional<Path> firstPresent(String argument, String configured, Optional<Path> remembered) {
        if (argument != null && !argument.isBlank()) {
            return Optional.of(Path.of(argument.trim()));
        }
        if (configured != null) {
            return Optional.of(Path.of(configured));
        }
        return remembered;
    }

    private static boolean isFormatKeyword(String arg) {
        try {
            ExportFormat.parse(arg);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    private void printSkipped(String title, List<SkippedItem> skipped) {
        if (skipped.isEmpty()) {
            return;
        }
        out.println(title + " (" + skipped.size() + "):");
        for (SkippedItem item : skipped) {
            out.println("  - " + item.filename() + ": " + item.reason());
        }
    }

    private int usage(String message) {
        out.println(message);
        out.println(USAGE);
        return EXIT_USAGE;
    }

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }
}
