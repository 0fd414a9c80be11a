package com.orbiter.app.trash;

import java.nio.file.Path;

public record TrashResult(Path path, boolean success, String message) {

    public static TrashResult ok(Path path) {
        return new TrashResult(path, true, "Moved to trash: " + path);
    }

    public static TrashResult failed(Path path, String message) {
        return new TrashResult(path, false, message);
    }
}
