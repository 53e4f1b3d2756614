package com.fotogeo.core.exif;

import com.fotogeo.core.fs.AtomicFileWriter;
import com.fotogeo.core.fs.PhotoDiscoveryService;
import com.fotogeo.logging.AppLogger;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.taginfos.TagInfoAscii;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Lossless EXIF rewrite for JPEG files: only the APP1 segment is regenerated, the compressed image data is
 * copied as-is. The new file is assembled next to the original and moved over it in one step.
 */
public final class JpegExifTagWriter implements ImageTagWriter {
    private static final Logger LOGGER = AppLogger.get();

    @Override
    public void writeTags(Path photo, String description, String artist) throws WriteFailedException {
        String name = photo.getFileName().toString();
        if (!PhotoDiscoveryService.isJpeg(photo)) {
            throw new WriteFailedException("metadata writing is only supported for JPEG");
        }
        if (!Files.isRegularFile(photo) || !Files.isWritable(photo)) {
            throw new WriteFailedException("file is not writable: " + name);
        }
        if (description == null && artist == null) {
            LOGGER.fine(() -> name + ": nothing to write");
            return;
        }

        TiffOutputSet outputSet = readOutputSet(photo);
        Path temp = null;
        try {
            TiffOutputDirectory root = outputSet.getOrCreateRootDirectory();
            replace(root, TiffTagConstants.TIFF_TAG_IMAGE_DESCRIPTION, description);
            replace(root, TiffTagConstants.TIFF_TAG_ARTIST, artist);

            temp = Files.createTempFile(photo.toAbsolutePath().getParent(), "." + name, ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                new ExifRewriter().updateExifMetadataLossless(photo.toFile(), out, outputSet);
            }
            AtomicFileWriter.moveIntoPlace(temp, photo);
            temp = null;
        } catch (Exception ex) {
            throw new WriteFailedException("could not write metadata to " + name + ": " + ex.getMessage(), ex);
        } finally {
            if (temp != null) {
                AtomicFileWriter.deleteQuietly(temp);
            }
        }
    }

    /**
     * Starts from the photo's existing EXIF so every other tag is carried over.
     */
    private static TiffOutputSet readOutputSet(Path photo) throws WriteFailedException {
        try {
            ImageMetadata metadata = Imaging.getMetadata(photo.toFile());
            if (metadata instanceof JpegImageMetadata jpegMetadata) {
                TiffImageMetadata exif = jpegMetadata.getExif();
                if (exif != null) {
                    TiffOutputSet existing = exif.getOutputSet();
                    if (existing != null) {
                        return existing;
                    }
                }
            }
            return new TiffOutputSet();
        } catch (Exception ex) {
            throw new WriteFailedException("could not read existing metadata of " + photo.getFileName()
                + ": " + ex.getMessage(), ex);
        }
    }

    private static void replace(TiffOutputDirectory directory, TagInfoAscii tag, String value) throws Exception {
        if (value == null) {
            return;
        }
        directory.removeField(tag);
        if (!value.isEmpty()) {
            directory.add(tag, value);
        }
    }
}
