package com.fotogeo.core.export;

import com.fotogeo.core.geo.CoordinateConverter;
import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.title.TitleResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class SimpleKmlRendererTest {

    @TempDir
    Path tempDir;

    @Test
    void controlCharactersInTagsStillGiveParseableKml() throws Exception {
        Path photos = Files.createDirectories(tempDir.resolve("Trip"));
        ImageRecord record = ImageRecord.builder("IMG_01.jpg")
            .customName("Cam\u0001era")
            .description("Line\u0000one\nline\u001Ftwo")
            .coordinates(45.0, -93.0)
            .projected(new CoordinateConverter().convert(45.0, -93.0))
            .build();
        ExportContext context = ExportContext.forFolder(photos, tempDir, ExportSettings.defaults());

        Path kml = new SimpleKmlRenderer(new TitleResolver()).render(List.of(record), context).artifact();

        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        Document doc = factory.newDocumentBuilder().parse(kml.toFile());
        NodeList placemarks = doc.getElementsByTagNameNS(KmlDocumentWriter.KML_NAMESPACE, "Placemark");
        assertEquals(1, placemarks.getLength());
        String name = doc.getElementsByTagNameNS(KmlDocumentWriter.KML_NAMESPACE, "name").item(1).getTextContent();
        assertEquals("Camera", name);
        String description = doc.getElementsByTagNameNS(KmlDocumentWriter.KML_NAMESPACE, "description").item(0).getTextContent();
        assertFalse(description.contains("\u0000"));
        assertFalse(description.contains("\u001F"));
    }

    @Test
    void xmlSafeKeepsLegalTextAndSurrogatePairs() {
        assertEquals("tab\tline\nend\r", KmlDocumentWriter.xmlSafe("tab\tline\nend\r"));
        assertEquals("map \uD83D\uDDFA", KmlDocumentWriter.xmlSafe("map \uD83D\uDDFA"));
        assertEquals("ab", KmlDocumentWriter.xmlSafe("a\uFFFE\uD800b"));
    }
}
