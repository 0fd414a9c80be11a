package com.orbiter.app.trash;

import java.nio.file.Path;

public class TrashException extends Exception {

    private final Path path;

    public TrashException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public TrashException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
