package com.orbiter.app.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem reads used by the scan: attributes, per-file size, package detection
 * and the synchronous size walk of a package. One instance per scan.
 */
final class EntryMeasurer {

    private static final Logger logger = LoggerFactory.getLogger(EntryMeasurer.class);

    private final SizeMode sizeMode;
    private final Set<String> packageExtensions;
    private final ScanMetrics metrics;
    private final long blockSize;

    EntryMeasurer(ScanConfig cfg, ScanMetrics metrics, Path root) {
        this.sizeMode = cfg.sizeMode();
        this.packageExtensions = cfg.packageExtensions();
        this.metrics = metrics;
        this.blockSize = sizeMode == SizeMode.ALLOCATED ? resolveBlockSize(root) : 0L;
    }

    BasicFileAttributes attributes(Path path) throws IOException {
        return Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
    }

    boolean isPackage(Path dir) {
        if (packageExtensions.isEmpty()) return false;
        var ext = FileKind.extensionOf(displayName(dir));
        return !ext.isEmpty() && packageExtensions.contains(ext);
    }

    long fileSize(BasicFileAttributes attrs) {
        long logical = Math.max(0L, attrs.size());
        if (sizeMode != SizeMode.ALLOCATED || blockSize <= 0) return logical;
        long blocks = (logical + blockSize - 1) / blockSize;
        return blocks * blockSize;
    }

    /**
     * Recursive byte sum of a package. Runs on the calling thread; unreadable
     * entries inside the package count as zero.
     */
    long packageSize(Path dir, AtomicBoolean cancel) {
        long[] total = {0L};
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                    return cancel.get() ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (cancel.get()) return FileVisitResult.TERMINATE;
                    if (!attrs.isDirectory()) total[0] += fileSize(attrs);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    metrics.entryErrors.increment();
                    logger.debug("Skipping unreadable entry inside package {}: {}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            metrics.entryErrors.increment();
            logger.debug("Package walk failed for {}", dir, e);
        }
        return total[0];
    }

    static String displayName(Path path) {
        Path fileName = path.getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }

    private static long resolveBlockSize(Path root) {
        try {
            return Files.getFileStore(root).getBlockSize();
        } catch (IOException | UnsupportedOperationException e) {
            logger.debug("Block size unavailable for {}, using logical sizes", root, e);
            return 0L;
        }
    }
}
