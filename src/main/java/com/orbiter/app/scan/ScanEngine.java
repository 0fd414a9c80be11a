package com.orbiter.app.scan;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures a directory tree concurrently and returns it as a {@link FileSystemEntry} tree.
 * <p>
 * Every directory forks one task per immediate child and joins all of them before
 * reducing, so each branch builds and returns its own subtree and a parent is never
 * finished before its children. The only state shared between tasks is the cancel
 * flag, the top-level progress counter and the metrics counters.
 * <p>
 * Failures below the root are absorbed (zero-size file or empty directory). Only a
 * missing or unreadable root raises {@link ScanException}. Cancellation is not an
 * error: {@link #scan} then returns {@link Optional#empty()}, never a partial tree.
 */
public final class ScanEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScanEngine.class);

    private final ScanConfig cfg;
    private final ForkJoinPool pool;
    private volatile ScanMetrics lastMetrics = new ScanMetrics();

    public ScanEngine(ScanConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.pool = new ForkJoinPool(cfg.effectiveParallelism(), namedFactory("orbiter-scan-"), null, false);
    }

    public ScanConfig config() {
        return cfg;
    }

    /** Counters of the most recent (or running) scan. */
    public ScanMetrics lastMetrics() {
        return lastMetrics;
    }

    // --- ENGINE ---

    /**
     * Scans {@code root} and blocks until the whole tree is built or the scan is cancelled.
     *
     * @param cancel   set by the caller to stop the scan; checked before every filesystem read
     * @param listener progress events; the last one is 1.0 on success
     * @return the unannotated tree, or empty if cancelled
     * @throws ScanException if the root does not exist or cannot be read
     */
    public Optional<FileSystemEntry> scan(Path root, AtomicBoolean cancel, ScanListener listener) throws ScanException {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(cancel, "cancel");
        var events = listener == null ? ScanListener.NONE : listener;
        var rootAbs = root.toAbsolutePath().normalize();

        var metrics = new ScanMetrics();
        lastMetrics = metrics;
        metrics.running.set(true);
        try {
            if (cancel.get()) return Optional.empty();

            if (!Files.exists(rootAbs)) {
                logger.warn("Scan root not found: {}", rootAbs);
                throw new ScanException(ScanException.Reason.NOT_FOUND, rootAbs);
            }

            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(rootAbs, BasicFileAttributes.class);
            } catch (IOException e) {
                logger.warn("Scan root not accessible: {}", rootAbs, e);
                throw new ScanException(ScanException.Reason.NOT_ACCESSIBLE, rootAbs, e);
            }

            var measurer = new EntryMeasurer(cfg, metrics, rootAbs);
            var rootName = EntryMeasurer.displayName(rootAbs);

            if (!attrs.isDirectory()) {
                metrics.filesSeen.increment();
                var leaf = FileSystemEntry.file(rootAbs, rootName, measurer.fileSize(attrs));
                emit(events, new ScanProgress(1.0, leaf.name()));
                return Optional.of(leaf);
            }

            List<Path> listing;
            try {
                listing = list(rootAbs);
            } catch (IOException e) {
                logger.warn("Cannot list scan root: {}", rootAbs, e);
                throw new ScanException(ScanException.Reason.NOT_ACCESSIBLE, rootAbs, e);
            }

            logger.info("Scanning {} ({} entries, parallelism={})", rootAbs, listing.size(), pool.getParallelism());

            var ctx = new ScanContext(measurer, metrics, cancel);
            var tracker = new ProgressTracker(listing.size(), events);
            FileSystemEntry tree = pool.invoke(new DirectoryTask(rootAbs, listing, ctx, tracker));

            if (tree == null || cancel.get()) {
                logger.info("Scan cancelled: {} ({})", rootAbs, metrics);
                return Optional.empty();
            }

            emit(events, new ScanProgress(1.0, tree.name()));
            logger.info("Scan finished: {} -> {} ({})", rootAbs, tree.formattedSize(), metrics);
            return Optional.of(tree);
        } finally {
            metrics.running.set(false);
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Scan pool did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- TASKS ---

    private record ScanContext(EntryMeasurer measurer, ScanMetrics metrics, AtomicBoolean cancel) {}

    /**
     * Enumerates one directory, forks a task per child and reduces once all joined.
     * {@code listing} is pre-read for the root so that its failure is fatal; below the
     * root it is null and read here, failures giving an empty directory.
     */
    private static final class DirectoryTask extends RecursiveTask<FileSystemEntry> {
        private final Path dir;
        private final List<Path> listing;
        private final ScanContext ctx;
        private final ProgressTracker tracker;

        DirectoryTask(Path dir, List<Path> listing, ScanContext ctx, ProgressTracker tracker) {
            this.dir = dir;
            this.listing = listing;
            this.ctx = ctx;
            this.tracker = tracker;
        }

        @Override
        protected FileSystemEntry compute() {
            if (ctx.cancel().get()) return null;

            var name = EntryMeasurer.displayName(dir);
            List<Path> entries = listing;
            if (entries == null) {
                try {
                    entries = list(dir);
                } catch (IOException e) {
                    ctx.metrics().entryErrors.increment();
                    logger.debug("Cannot list {}, recording as empty: {}", dir, e.toString());
                    return FileSystemEntry.emptyDirectory(dir, name);
                }
            }
            if (ctx.cancel().get()) return null;
            ctx.metrics().directoriesSeen.increment();

            var tasks = new ArrayList<EntryTask>(entries.size());
            for (Path child : entries) {
                tasks.add(new EntryTask(child, ctx, tracker));
            }
            invokeAll(tasks);

            if (ctx.cancel().get()) return null;

            var children = new ArrayList<FileSystemEntry>(tasks.size());
            for (EntryTask t : tasks) {
                var child = t.join();
                if (child != null) children.add(child);
            }
            return FileSystemEntry.directory(dir, name, children);
        }
    }

    /**
     * One child of a directory: a file, a package (summed synchronously) or a
     * subdirectory (recursed into, with its own fan-out).
     */
    private static final class EntryTask extends RecursiveTask<FileSystemEntry> {
        private final Path path;
        private final ScanContext ctx;
        private final ProgressTracker tracker;

        EntryTask(Path path, ScanContext ctx, ProgressTracker tracker) {
            this.path = path;
            this.ctx = ctx;
            this.tracker = tracker;
        }

        @Override
        protected FileSystemEntry compute() {
            if (ctx.cancel().get()) return null;

            var name = EntryMeasurer.displayName(path);
            var measurer = ctx.measurer();
            FileSystemEntry result;
            try {
                BasicFileAttributes attrs = measurer.attributes(path);
                if (attrs.isDirectory()) {
                    if (measurer.isPackage(path)) {
                        ctx.metrics().packagesSeen.increment();
                        long size = measurer.packageSize(path, ctx.cancel());
                        result = FileSystemEntry.pkg(path, name, size);
                    } else {
                        result = new DirectoryTask(path, null, ctx, null).invoke();
                    }
                } else {
                    ctx.metrics().filesSeen.increment();
                    result = FileSystemEntry.file(path, name, measurer.fileSize(attrs));
                }
            } catch (IOException e) {
                ctx.metrics().entryErrors.increment();
                logger.debug("Cannot read attributes of {}, recording as empty: {}", path, e.toString());
                result = FileSystemEntry.file(path, name, 0L);
            }

            if (ctx.cancel().get()) return null;
            if (tracker != null) tracker.childCompleted(result == null ? name : result.name());
            return result;
        }
    }

    /**
     * Completion counter for the root's immediate children. Emits under the lock so
     * listeners see strictly increasing fractions; the final 1.0 is left to the engine.
     */
    static final class ProgressTracker {
        private final int total;
        private final ScanListener listener;
        private int completed;
        private double lastFraction;

        ProgressTracker(int total, ScanListener listener) {
            this.total = total;
            this.listener = listener;
        }

        synchronized void childCompleted(String name) {
            completed++;
            if (total <= 0 || completed >= total) return;
            double fraction = (double) completed / total;
            if (fraction > lastFraction) {
                lastFraction = fraction;
                emit(listener, new ScanProgress(fraction, name));
            }
        }
    }

    // --- HELPERS ---

    private static List<Path> list(Path dir) throws IOException {
        var out = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path p : stream) out.add(p);
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
        return out;
    }

    private static void emit(ScanListener listener, ScanProgress progress) {
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            logger.warn("Scan listener failed on {}", progress, e);
        }
    }

    private static ForkJoinPool.ForkJoinWorkerThreadFactory namedFactory(String prefix) {
        var seq = new AtomicInteger(1);
        return p -> {
            var t = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(p);
            t.setName(prefix + seq.getAndIncrement());
            return t;
        };
    }
}
