package com.orbiter.app.scan;

import java.util.Locale;

/**
 * How a regular file's size is measured.
 */
public enum SizeMode {
    /** {@code BasicFileAttributes.size()}. */
    LOGICAL,
    /** Logical size rounded up to the file store's block size. */
    ALLOCATED;

    public static SizeMode parse(String value, SizeMode fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
