package com.fotogeo.core.export;

import com.fotogeo.core.model.ImageRecord;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Streams a KML 2.2 document with one point placemark per call to {@link #placemark}.
 * Closing the writer ends the document; the underlying stream stays open.
 */
final class KmlDocumentWriter implements AutoCloseable {
    static final String KML_NAMESPACE = "http://www.opengis.net/kml/2.2";
    static final DateTimeFormatter KML_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final XMLStreamWriter xml;

    KmlDocumentWriter(OutputStream out, String documentName) throws IOException {
        try {
            xml = XMLOutputFactory.newFactory().createXMLStreamWriter(out, "UTF-8");
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeCharacters("\n");
            xml.writeStartElement("kml");
            xml.writeDefaultNamespace(KML_NAMESPACE);
            xml.writeStartElement("Document");
            element("name", documentName);
        } catch (XMLStreamException ex) {
            throw new IOException("Unable to start KML document", ex);
        }
    }

    /**
     * Writes a point placemark. The record must carry coordinates.
     */
    void placemark(ImageRecord record, String title, String descriptionHtml) throws IOException {
        double latitude = record.latitude().orElseThrow(() -> new IllegalArgumentException("No coordinates: " + record.filename()));
        double longitude = record.longitude().orElseThrow();
        try {
            xml.writeStartElement("Placemark");
            element("name", title);
            xml.writeStartElement("description");
            xml.writeCData(xmlSafe(descriptionHtml).replace("]]>", "]]]]><![CDATA[>"));
            xml.writeEndElement();
            if (record.captureTimestamp().isPresent()) {
                xml.writeStartElement("TimeStamp");
                element("when", KML_TIMESTAMP.format(record.captureTimestamp().get()));
                xml.writeEndElement();
            }
            xml.writeStartElement("Point");
            element("coordinates", String.format(Locale.ROOT, "%.7f,%.7f,0", longitude, latitude));
            xml.writeEndElement();
            xml.writeEndElement();
        } catch (XMLStreamException ex) {
            throw new IOException("Unable to write placemark for " + record.filename(), ex);
        }
    }

    private void element(String name, String text) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeCharacters(xmlSafe(text));
        xml.writeEndElement();
    }

    /**
     * Drops code points XML 1.0 does not allow (control characters other than tab, LF and CR, lone surrogates,
     * U+FFFE and U+FFFF). EXIF text may carry them and the stream writer passes them through.
     */
    static String xmlSafe(String text) {
        StringBuilder sb = null;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int next = i + Character.charCount(cp);
            if (isXmlChar(cp)) {
                if (sb != null) {
                    sb.appendCodePoint(cp);
                }
            } else if (sb == null) {
                sb = new StringBuilder(text.length()).append(text, 0, i);
            }
            i = next;
        }
        return sb == null ? text : sb.toString();
    }

    private static boolean isXmlChar(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
            || (cp >= 0x20 && cp <= 0xD7FF)
            || (cp >= 0xE000 && cp <= 0xFFFD)
            || (cp >= 0x10000 && cp <= 0x10FFFF);
    }

    @Override
    public void close() throws IOException {
        try {
            xml.writeEndElement();
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException ex) {
            throw new IOException("Unable to finish KML document", ex);
        }
    }
}
