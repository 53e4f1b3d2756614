package com.fotogeo.core.model;

import java.awt.geom.AffineTransform;

/**
 * EXIF orientation values. Each constant knows the transform that maps stored pixels onto the upright picture.
 */
public enum Orientation {
    IDENTITY(1),
    FLIP_HORIZONTAL(2),
    ROTATE_180(3),
    FLIP_VERTICAL(4),
    TRANSPOSE(5),
    ROTATE_90_CW(6),
    TRANSVERSE(7),
    ROTATE_90_CCW(8);

    private final int exifValue;

    Orientation(int exifValue) {
        this.exifValue = exifValue;
    }

    /**
     * Maps the raw tag value; absent or unknown values fall back to {@link #IDENTITY}.
     */
    public static Orientation fromExifValue(Integer value) {
        if (value == null) {
            return IDENTITY;
        }
        for (Orientation orientation : values()) {
            if (orientation.exifValue == value) {
                return orientation;
            }
        }
        return IDENTITY;
    }

    public boolean swapsDimensions() {
        return exifValue >= 5;
    }

    /**
     * Transform from stored pixel space ({@code width} x {@code height}) to upright pixel space.
     */
    public AffineTransform toUpright(int width, int height) {
        return switch (this) {
            case IDENTITY -> new AffineTransform();
            case FLIP_HORIZONTAL -> new AffineTransform(-1, 0, 0, 1, width, 0);
            case ROTATE_180 -> new AffineTransform(-1, 0, 0, -1, width, height);
            case FLIP_VERTICAL -> new AffineTransform(1, 0, 0, -1, 0, height);
            case TRANSPOSE -> new AffineTransform(0, 1, 1, 0, 0, 0);
            case ROTATE_90_CW -> new AffineTransform(0, 1, -1, 0, height, 0);
            case TRANSVERSE -> new AffineTransform(0, -1, -1, 0, height, width);
            case ROTATE_90_CCW -> new AffineTransform(0, -1, 1, 0, 0, width);
        };
    }
}
