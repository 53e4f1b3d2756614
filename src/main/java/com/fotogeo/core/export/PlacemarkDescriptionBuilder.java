package com.fotogeo.core.export;

import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.model.ProjectedCoordinate;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the HTML shown in a placemark's balloon. Both KML outputs use the same text; the KMZ only
 * appends the embedded image.
 */
public final class PlacemarkDescriptionBuilder {
    private static final DateTimeFormatter DISPLAY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String IMAGE_UNAVAILABLE = "<hr/><i>Imagen no disponible.</i>";

    private PlacemarkDescriptionBuilder() {
    }

    public static String build(ImageRecord record, String title) {
        List<String> parts = new ArrayList<>();
        parts.add("<b>" + escape(title) + "</b>");
        record.customName().filter(s -> !s.isBlank())
            .ifPresent(name -> parts.add("<b>Nome Personalizado:</b> " + escape(name)));
        parts.add("<b>Archivo:</b> " + escape(record.filename()));
        record.description().filter(s -> !s.isBlank())
            .ifPresent(text -> parts.add("<b>Descripción:</b> " + escape(text).replace("\r\n", "\n").replace("\n", "<br/>")));
        parts.add("<b>Data:</b> " + record.captureTimestamp().map(DISPLAY_TIMESTAMP::format).orElse("N/A"));
        if (record.hasCoordinates()) {
            parts.add("<b>Lat/Lon:</b> " + TableRowFormatter.degrees(record.latitude().orElseThrow())
                + ", " + TableRowFormatter.degrees(record.longitude().orElseThrow()));
        }
        record.projected().ifPresent(utm -> parts.add("<b>UTM:</b> " + utm(utm)));
        return String.join("<br/>", parts);
    }

    public static String withImage(String description, String assetPath, int width) {
        return description + "<hr/><img src=\"" + escape(assetPath) + "\" alt=\"Foto\" width=\"" + width + "\"/>";
    }

    public static String withoutImage(String description) {
        return description + IMAGE_UNAVAILABLE;
    }

    static String utm(ProjectedCoordinate utm) {
        return "Zona " + utm.zone() + utm.hemisphere()
            + ", E: " + TableRowFormatter.meters(utm.easting())
            + ", N: " + TableRowFormatter.meters(utm.northing());
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
