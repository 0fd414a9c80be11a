package com.orbiter.app.scan;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orbiter.app.trash.TrashException;
import com.orbiter.app.trash.TrashResult;
import com.orbiter.app.trash.TrashService;

/**
 * Owns at most one in-flight scan and the last completed result.
 * <p>
 * Scans run one after another on a single orchestration thread. Starting a scan
 * cancels the previous one first, and the new one only touches the filesystem after
 * the previous scan has returned, which happens once all of its tasks have joined.
 * A cancelled or failed scan leaves the previous result in place.
 */
public final class ScanSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScanSession.class);

    private final ScanEngine engine;
    private final TrashService trash;
    private final ExecutorService runner;

    private final Object lock = new Object();
    private AtomicBoolean currentCancel;

    private final AtomicInteger pending = new AtomicInteger();
    private volatile FileSystemEntry result;
    private volatile Path resultPath;
    private volatile ScanException lastError;
    private volatile ScanProgress progress = ScanProgress.IDLE;

    /** The session closes {@code engine} when it is closed. */
    public ScanSession(ScanEngine engine, TrashService trash) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.trash = Objects.requireNonNull(trash, "trash");
        this.runner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "orbiter-scan-main");
            t.setDaemon(true);
            return t;
        });
    }

    // --- Actions ---

    public CompletableFuture<ScanOutcome> start(Path path) {
        return start(path, ScanListener.NONE);
    }

    /**
     * Supersedes any running scan and scans {@code path}. The returned future completes
     * with the outcome; a completed outcome carries the percentage-annotated tree.
     */
    public CompletableFuture<ScanOutcome> start(Path path, ScanListener listener) {
        Objects.requireNonNull(path, "path");
        var events = listener == null ? ScanListener.NONE : listener;
        var cancel = new AtomicBoolean(false);

        synchronized (lock) {
            if (currentCancel != null) currentCancel.set(true);
            currentCancel = cancel;
        }

        pending.incrementAndGet();
        try {
            return CompletableFuture.supplyAsync(() -> run(path, cancel, events), runner);
        } catch (RuntimeException e) {
            pending.decrementAndGet();
            throw e;
        }
    }

    /** Asks the running scan, if any, to stop. Its outcome will be CANCELLED. */
    public void cancel() {
        synchronized (lock) {
            if (currentCancel != null) currentCancel.set(true);
        }
        progress = ScanProgress.IDLE;
    }

    /** Scans the last completed root again. */
    public CompletableFuture<ScanOutcome> rescan() {
        var path = resultPath;
        if (path == null) throw new IllegalStateException("No completed scan to repeat");
        return start(path);
    }

    /**
     * Hands the entry to the trash. The in-memory tree is left as it is.
     */
    public TrashResult moveToTrash(FileSystemEntry entry) {
        Objects.requireNonNull(entry, "entry");
        try {
            trash.moveToTrash(entry.path());
            return TrashResult.ok(entry.path());
        } catch (TrashException e) {
            logger.warn("Move to trash failed for {}: {}", entry.path(), e.getMessage());
            return TrashResult.failed(entry.path(), e.getMessage());
        }
    }

    /**
     * Moves the entry to the trash and, on success, starts a fresh scan of the current
     * root. On failure the future completes exceptionally with the {@link TrashException}.
     */
    public CompletableFuture<ScanOutcome> moveToTrashAndRescan(FileSystemEntry entry) {
        Objects.requireNonNull(entry, "entry");
        try {
            trash.moveToTrash(entry.path());
        } catch (TrashException e) {
            logger.warn("Move to trash failed for {}: {}", entry.path(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        var root = resultPath;
        if (root == null) root = entry.path().getParent();
        return start(root);
    }

    // --- State ---

    public boolean isScanning() {
        return pending.get() > 0;
    }

    public ScanProgress progress() {
        return progress;
    }

    /** Last completed, annotated tree, or null before the first successful scan. */
    public FileSystemEntry result() {
        return result;
    }

    public Path resultPath() {
        return resultPath;
    }

    public ScanException lastError() {
        return lastError;
    }

    public ScanEngine engine() {
        return engine;
    }

    @Override
    public void close() {
        cancel();
        runner.shutdown();
        try {
            if (!runner.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Scan session did not stop in time");
                runner.shutdownNow();
            }
        } catch (InterruptedException e) {
            runner.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            engine.close();
        }
    }

    // --- Worker ---

    private ScanOutcome run(Path path, AtomicBoolean cancel, ScanListener listener) {
        try {
            if (cancel.get()) return ScanOutcome.cancelled(path);

            progress = ScanProgress.IDLE;
            var tree = engine.scan(path, cancel, p -> {
                progress = p;
                listener.onProgress(p);
            });

            if (tree.isEmpty() || cancel.get()) {
                return ScanOutcome.cancelled(path);
            }

            var root = tree.get();
            PercentageAnnotator.annotate(root);
            if (cancel.get()) return ScanOutcome.cancelled(path);

            result = root;
            resultPath = root.path();
            lastError = null;
            return ScanOutcome.completed(path, root);
        } catch (ScanException e) {
            lastError = e;
            return ScanOutcome.failed(path, e);
        } finally {
            pending.decrementAndGet();
        }
    }
}
