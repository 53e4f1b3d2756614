package com.fotogeo.core.title;

import com.fotogeo.core.model.ImageRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Derives the label shown for a photo in every export. Sources are tried in order and the first
 * non-blank value wins: custom name, first line of the description, file name.
 */
public final class TitleResolver {

    private static final List<Function<ImageRecord, Optional<String>>> SOURCES = List.of(
        ImageRecord::customName,
        record -> record.description().map(TitleResolver::firstLine)
    );

    public String resolve(ImageRecord record) {
        for (Function<ImageRecord, Optional<String>> source : SOURCES) {
            Optional<String> value = source.apply(record)
                .map(String::strip)
                .filter(s -> !s.isEmpty());
            if (value.isPresent()) {
                return value.get();
            }
        }
        return record.filename();
    }

    static String firstLine(String text) {
        int newline = text.indexOf('\n');
        String line = newline < 0 ? text : text.substring(0, newline);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
