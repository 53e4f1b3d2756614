package com.fotogeo.core.export;

import com.fotogeo.config.ConfigService;

/**
 * Image sizes and JPEG qualities used when embedding photos.
 */
public record ExportSettings(int kmzImageWidth,
                             double kmzImageQuality,
                             int excelThumbnailWidth,
                             double excelImageQuality) {

    public static ExportSettings fromConfig(ConfigService config) {
        return new ExportSettings(
            config.getKmzImageWidth(),
            config.getKmzImageQuality(),
            config.getExcelThumbnailWidth(),
            config.getExcelImageQuality()
        );
    }

    public static ExportSettings defaults() {
        return new ExportSettings(400, 0.85, 250, 0.90);
    }
}
