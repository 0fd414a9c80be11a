package com.orbiter.app.scan;

import java.nio.file.Path;

/**
 * The scan root could not be scanned at all. Failures below the root never
 * surface as this exception; they are recorded as empty or zero-size entries.
 */
public class ScanException extends Exception {

    public enum Reason { NOT_FOUND, NOT_ACCESSIBLE }

    private final Reason reason;
    private final Path path;

    public ScanException(Reason reason, Path path, Throwable cause) {
        super(messageFor(reason, path), cause);
        this.reason = reason;
        this.path = path;
    }

    public ScanException(Reason reason, Path path) {
        this(reason, path, null);
    }

    public Reason reason() { return reason; }
    public Path path() { return path; }

    private static String messageFor(Reason reason, Path path) {
        return switch (reason) {
            case NOT_FOUND -> "Path not found: " + path;
            case NOT_ACCESSIBLE -> "Path not accessible: " + path;
        };
    }
}
