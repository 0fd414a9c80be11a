package com.orbiter.app.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.prefs.Preferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Favorite scan roots, kept as a JSON array of absolute paths in user preferences.
 */
public final class FavoritesStore {

    private static final Logger logger = LoggerFactory.getLogger(FavoritesStore.class);

    static final String KEY = "favorites";
    private static final TypeReference<List<String>> LIST_OF_STRINGS = new TypeReference<>() {};

    private final Preferences prefs;
    private final ObjectMapper mapper = new ObjectMapper();

    public FavoritesStore() {
        this(OrbiterConfig.preferences());
    }

    public FavoritesStore(Preferences prefs) {
        this.prefs = Objects.requireNonNull(prefs, "prefs");
    }

    public synchronized List<String> list() {
        String raw = prefs.get(KEY, null);
        if (raw == null || raw.isBlank()) return List.of();
        try {
            List<String> values = mapper.readValue(raw, LIST_OF_STRINGS);
            return values == null ? List.of() : List.copyOf(values);
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring unreadable favorites: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    /** Adds the absolute form of {@code path}; false if it was already there. */
    public synchronized boolean add(Path path) {
        String value = normalize(path);
        var current = new ArrayList<>(list());
        if (current.contains(value)) return false;
        current.add(value);
        store(current);
        return true;
    }

    public synchronized boolean remove(Path path) {
        String value = normalize(path);
        var current = new ArrayList<>(list());
        if (!current.remove(value)) return false;
        store(current);
        return true;
    }

    public synchronized boolean contains(Path path) {
        return list().contains(normalize(path));
    }

    private void store(List<String> values) {
        try {
            prefs.put(KEY, mapper.writeValueAsString(values));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode favorites", e);
        }
    }

    private static String normalize(Path path) {
        return Objects.requireNonNull(path, "path").toAbsolutePath().normalize().toString();
    }
}
