package com.fotogeo.core.image;

import com.fotogeo.core.model.Orientation;
import net.coobird.thumbnailator.Thumbnails;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Produces the previews embedded in the KMZ and the spreadsheet. Both formats go through
 * {@link #createThumbnail}, so the orientation handling cannot drift between them.
 * <p>
 * Orientation is applied to the full-size pixels first, then the upright image is shrunk to the
 * requested width. Images already narrower than that width are not enlarged.
 */
public final class OrientedThumbnailer {

    public Thumbnail createThumbnail(Path photo, Orientation orientation, int maxWidth, double quality) throws IOException {
        BufferedImage source = read(photo);
        BufferedImage upright = applyOrientation(source, orientation);
        BufferedImage scaled = upright.getWidth() > maxWidth
            ? Thumbnails.of(upright).width(maxWidth).asBufferedImage()
            : upright;

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Thumbnails.of(scaled)
            .scale(1.0)
            .outputFormat("jpg")
            .outputQuality(quality)
            .toOutputStream(out);
        return new Thumbnail(out.toByteArray(), scaled.getWidth(), scaled.getHeight());
    }

    /**
     * Pure pixel transform: returns an RGB copy of {@code source} turned upright. Transparent areas become white.
     */
    public static BufferedImage applyOrientation(BufferedImage source, Orientation orientation) {
        int width = source.getWidth();
        int height = source.getHeight();
        int targetWidth = orientation.swapsDimensions() ? height : width;
        int targetHeight = orientation.swapsDimensions() ? width : height;

        BufferedImage target = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, targetWidth, targetHeight);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            AffineTransform transform = orientation.toUpright(width, height);
            g.drawImage(source, transform, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    private static BufferedImage read(Path photo) throws IOException {
        try (InputStream in = Files.newInputStream(photo)) {
            BufferedImage image = ImageIO.read(in);
            if (image == null) {
                throw new IOException("No image decoder for " + photo.getFileName());
            }
            return image;
        }
    }
}
