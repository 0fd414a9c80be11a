package com.orbiter.app.scan;

import java.nio.file.Path;

/**
 * How a session scan ended. {@code root} is set only for {@link Status#COMPLETED},
 * {@code error} only for {@link Status#FAILED}.
 */
public record ScanOutcome(Status status, Path path, FileSystemEntry root, ScanException error) {

    public enum Status { COMPLETED, CANCELLED, FAILED }

    public static ScanOutcome completed(Path path, FileSystemEntry root) {
        return new ScanOutcome(Status.COMPLETED, path, root, null);
    }

    public static ScanOutcome cancelled(Path path) {
        return new ScanOutcome(Status.CANCELLED, path, null, null);
    }

    public static ScanOutcome failed(Path path, ScanException error) {
        return new ScanOutcome(Status.FAILED, path, null, error);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
