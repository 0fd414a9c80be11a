package com.orbiter.app.trash;

import java.nio.file.Path;

/**
 * Moves an item to the operating system's trash. The scan tree is never patched
 * afterwards; callers rescan to see the change.
 */
public interface TrashService {

    boolean isSupported();

    void moveToTrash(Path path) throws TrashException;
}
