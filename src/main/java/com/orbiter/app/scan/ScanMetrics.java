package com.orbiter.app.scan;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

public final class ScanMetrics {
    public final LongAdder filesSeen = new LongAdder();
    public final LongAdder directoriesSeen = new LongAdder();
    public final LongAdder packagesSeen = new LongAdder();
    public final LongAdder entryErrors = new LongAdder();
    public final AtomicBoolean running = new AtomicBoolean(false);
    public final Instant start = Instant.now();

    public Duration elapsed() {
        return Duration.between(start, Instant.now());
    }

    @Override
    public String toString() {
        return "files=" + filesSeen.sum()
                + ", dirs=" + directoriesSeen.sum()
                + ", packages=" + packagesSeen.sum()
                + ", errors=" + entryErrors.sum()
                + ", elapsed=" + elapsed().toMillis() + "ms";
    }
}
