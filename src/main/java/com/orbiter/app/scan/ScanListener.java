package com.orbiter.app.scan;

/**
 * Receives progress events from a scan. Called from scan worker threads, one event
 * at a time and in non-decreasing order of fraction.
 */
@FunctionalInterface
public interface ScanListener {

    ScanListener NONE = progress -> { };

    void onProgress(ScanProgress progress);
}
