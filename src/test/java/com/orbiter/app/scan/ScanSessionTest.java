package com.orbiter.app.scan;

import com.orbiter.app.trash.TrashException;
import com.orbiter.app.trash.TrashService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.orbiter.app.scan.ScanEngineTest.write;
import static org.junit.jupiter.api.Assertions.*;

public class ScanSessionTest {

    private final DeletingTrash trash = new DeletingTrash();
    private ScanSession session;

    @BeforeEach
    void setUp() {
        session = new ScanSession(new ScanEngine(ScanConfig.defaults().withParallelism(4)), trash);
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    void start_publishesAnnotatedResult() throws Exception {
        Path root = fixture();

        var outcome = session.start(root).get(30, TimeUnit.SECONDS);

        assertTrue(outcome.isCompleted());
        assertEquals(400, outcome.root().sizeBytes());
        assertEquals(100.0, outcome.root().percentageOfTotal(), 1e-9);
        assertEquals(75.0, outcome.root().children().get(0).percentageOfTotal(), 1e-9);
        assertSame(outcome.root(), session.result());
        assertEquals(root.toAbsolutePath().normalize(), session.resultPath());
        assertTrue(session.progress().isComplete());
        assertFalse(session.isScanning());
    }

    @Test
    void start_supersedesRunningScan() throws Exception {
        Path slow = fixture();
        Path fast = Files.createTempDirectory("orbiter-fast-");
        write(fast.resolve("only.bin"), 7);

        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var first = session.start(slow, p -> {
            if (!p.isComplete() && entered.getCount() > 0) {
                entered.countDown();
                awaitQuietly(release);
            }
        });
        assertTrue(entered.await(30, TimeUnit.SECONDS));
        assertTrue(session.isScanning());

        var second = session.start(fast);
        release.countDown();

        assertEquals(ScanOutcome.Status.CANCELLED, first.get(30, TimeUnit.SECONDS).status());
        var last = second.get(30, TimeUnit.SECONDS);
        assertTrue(last.isCompleted());
        assertEquals(7, session.result().sizeBytes());
        assertEquals(fast.toAbsolutePath().normalize(), session.resultPath());
    }

    @Test
    void cancel_leavesNoResult() throws Exception {
        Path root = fixture();
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);

        var future = session.start(root, p -> {
            if (!p.isComplete() && entered.getCount() > 0) {
                entered.countDown();
                awaitQuietly(release);
            }
        });
        assertTrue(entered.await(30, TimeUnit.SECONDS));
        session.cancel();
        release.countDown();

        assertEquals(ScanOutcome.Status.CANCELLED, future.get(30, TimeUnit.SECONDS).status());
        assertNull(session.result());
    }

    @Test
    void failedScanKeepsPreviousResult() throws Exception {
        Path root = fixture();
        var ok = session.start(root).get(30, TimeUnit.SECONDS);

        Path missing = root.resolve("gone");
        var failed = session.start(missing).get(30, TimeUnit.SECONDS);

        assertEquals(ScanOutcome.Status.FAILED, failed.status());
        assertEquals(ScanException.Reason.NOT_FOUND, failed.error().reason());
        assertSame(ok.root(), session.result());
        assertEquals(ScanException.Reason.NOT_FOUND, session.lastError().reason());
    }

    @Test
    void rescanWithoutResultIsRejected() {
        assertThrows(IllegalStateException.class, () -> session.rescan());
    }

    @Test
    void moveToTrash_reportsOutcomeWithoutTouchingTree() throws Exception {
        Path root = fixture();
        var tree = session.start(root).get(30, TimeUnit.SECONDS).root();
        var a = tree.findByPath(root.toAbsolutePath().normalize().resolve("a.txt")).orElseThrow();

        var result = session.moveToTrash(a);

        assertTrue(result.success());
        assertFalse(Files.exists(a.path()));
        assertEquals(400, session.result().sizeBytes());

        var again = session.moveToTrash(a);
        assertFalse(again.success());
        assertNotNull(again.message());
    }

    @Test
    void moveToTrashAndRescan_refreshesResult() throws Exception {
        Path root = fixture();
        var tree = session.start(root).get(30, TimeUnit.SECONDS).root();
        var sub = tree.children().get(0);

        var outcome = session.moveToTrashAndRescan(sub).get(30, TimeUnit.SECONDS);

        assertTrue(outcome.isCompleted());
        assertEquals(100, session.result().sizeBytes());
        assertNotSame(tree, session.result());
    }

    @Test
    void moveToTrashAndRescan_failsWithTrashException() throws Exception {
        Path root = fixture();
        var tree = session.start(root).get(30, TimeUnit.SECONDS).root();
        trash.supported = false;

        var future = session.moveToTrashAndRescan(tree.children().get(0));

        var e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(TrashException.class, e.getCause());
        assertSame(tree, session.result());
    }

    private static Path fixture() throws IOException {
        Path root = Files.createTempDirectory("orbiter-session-");
        write(root.resolve("a.txt"), 100);
        Files.createDirectories(root.resolve("sub"));
        write(root.resolve("sub/b.txt"), 300);
        return root;
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Deletes instead of trashing so tests stay out of the user's trash. */
    private static final class DeletingTrash implements TrashService {
        volatile boolean supported = true;

        @Override
        public boolean isSupported() {
            return supported;
        }

        @Override
        public void moveToTrash(Path path) throws TrashException {
            if (!supported) throw new TrashException(path, "Trash not available");
            try {
                if (Files.isDirectory(path)) {
                    try (var walk = Files.walk(path)) {
                        for (Path p : walk.sorted((x, y) -> y.getNameCount() - x.getNameCount()).toList()) {
                            Files.delete(p);
                        }
                    }
                } else {
                    Files.delete(path);
                }
            } catch (IOException e) {
                throw new TrashException(path, "Cannot delete " + path, e);
            }
        }
    }
}
