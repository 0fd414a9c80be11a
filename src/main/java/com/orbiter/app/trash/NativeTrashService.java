package com.orbiter.app.trash;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.jna.platform.FileUtils;

/**
 * Trash backed by JNA platform's {@link FileUtils}: the native recycle bin on Windows,
 * {@code NSFileManager} on macOS and the freedesktop trash elsewhere.
 */
public final class NativeTrashService implements TrashService {

    private static final Logger logger = LoggerFactory.getLogger(NativeTrashService.class);

    private final FileUtils fileUtils;

    public NativeTrashService() {
        this(FileUtils.getInstance());
    }

    NativeTrashService(FileUtils fileUtils) {
        this.fileUtils = fileUtils;
    }

    @Override
    public boolean isSupported() {
        return fileUtils.hasTrash();
    }

    @Override
    public void moveToTrash(Path path) throws TrashException {
        if (path == null) throw new TrashException(null, "No path given");
        var abs = path.toAbsolutePath().normalize();

        if (!Files.exists(abs, LinkOption.NOFOLLOW_LINKS)) {
            throw new TrashException(abs, "Path not found: " + abs);
        }
        if (!isSupported()) {
            throw new TrashException(abs, "Trash is not available on this platform");
        }

        try {
            fileUtils.moveToTrash(new File[] { abs.toFile() });
            logger.info("Moved to trash: {}", abs);
        } catch (IOException e) {
            throw new TrashException(abs, "Could not move to trash: " + e.getMessage(), e);
        }
    }
}
