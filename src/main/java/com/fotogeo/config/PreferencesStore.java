package com.fotogeo.config;

import com.fotogeo.logging.AppLogger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Lightweight wrapper around {@link Preferences} so the command line can remember the last photo folder and table.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/fotogeo/exporter";

    private final Preferences delegate;

    PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    public Optional<Path> getPath(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Path.of(value));
    }

    public void putPath(String key, Path path) {
        if (key == null || key.isBlank() || path == null) return;
        delegate.put(key, path.toAbsolutePath().toString());
        flushQuietly();
    }

    private void flushQuietly() {
        try {
            delegate.flush();
        } catch (BackingStoreException ex) {
            AppLogger.get().fine(() -> "Preferences not persisted, kept in memory for this run: " + ex.getMessage());
        }
    }
}
