package com.fotogeo.testing;

import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds small JPEG fixtures with chosen EXIF tags at test time.
 */
public final class TestPhotos {
    private final String name;
    private int width = 64;
    private int height = 48;
    private String description;
    private String artist;
    private Integer orientation;
    private String dateTimeOriginal;
    private String dateTime;
    private Double latitude;
    private Double longitude;

    private TestPhotos(String name) {
        this.name = name;
    }

    public static TestPhotos jpeg(String name) {
        return new TestPhotos(name);
    }

    public TestPhotos size(int width, int height) {
        this.width = width;
        this.height = height;
        return this;
    }

    public TestPhotos description(String description) {
        this.description = description;
        return this;
    }

    public TestPhotos artist(String artist) {
        this.artist = artist;
        return this;
    }

    public TestPhotos orientation(int orientation) {
        this.orientation = orientation;
        return this;
    }

    public TestPhotos dateTimeOriginal(String value) {
        this.dateTimeOriginal = value;
        return this;
    }

    public TestPhotos dateTime(String value) {
        this.dateTime = value;
        return this;
    }

    public TestPhotos gps(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
        return this;
    }

    public Path writeTo(Path directory) throws Exception {
        byte[] plain = encode(pattern(width, height));
        Path target = directory.resolve(name);
        TiffOutputSet outputSet = new TiffOutputSet();
        TiffOutputDirectory root = outputSet.getOrCreateRootDirectory();
        if (description != null) {
            root.add(TiffTagConstants.TIFF_TAG_IMAGE_DESCRIPTION, description);
        }
        if (artist != null) {
            root.add(TiffTagConstants.TIFF_TAG_ARTIST, artist);
        }
        if (orientation != null) {
            root.add(TiffTagConstants.TIFF_TAG_ORIENTATION, orientation.shortValue());
        }
        if (dateTime != null) {
            root.add(TiffTagConstants.TIFF_TAG_DATE_TIME, dateTime);
        }
        if (dateTimeOriginal != null) {
            outputSet.getOrCreateExifDirectory().add(ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL, dateTimeOriginal);
        }
        if (latitude != null) {
            outputSet.setGpsInDegrees(longitude, latitude);
        }
        try (OutputStream out = Files.newOutputStream(target)) {
            new ExifRewriter().updateExifMetadataLossless(plain, out, outputSet);
        }
        return target;
    }

    /**
     * A quadrant pattern, so orientation changes are visible in the corner pixels.
     */
    public static BufferedImage pattern(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.RED);
            g.fillRect(0, 0, width / 2, height / 2);
            g.setColor(Color.GREEN);
            g.fillRect(width / 2, 0, width - width / 2, height / 2);
            g.setColor(Color.BLUE);
            g.fillRect(0, height / 2, width / 2, height - height / 2);
            g.setColor(Color.WHITE);
            g.fillRect(width / 2, height / 2, width - width / 2, height - height / 2);
        } finally {
            g.dispose();
        }
        return image;
    }

    public static Path writePng(Path directory, String name, int width, int height) throws IOException {
        Path target = directory.resolve(name);
        ImageIO.write(pattern(width, height), "png", target.toFile());
        return target;
    }

    public static Path writeCorrupt(Path directory, String name) throws IOException {
        Path target = directory.resolve(name);
        Files.writeString(target, "this is not an image");
        return target;
    }

    /**
     * Decoded RGB pixels, for checking that a metadata rewrite left the image data alone.
     */
    public static int[] pixels(Path jpeg) throws IOException {
        BufferedImage image = ImageIO.read(jpeg.toFile());
        return image.getRGB(0, 0, image.getWidth(), image.getHeight(), null, 0, image.getWidth());
    }

    private static byte[] encode(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "jpg", out)) {
            throw new IOException("No JPEG writer available");
        }
        return out.toByteArray();
    }
}
