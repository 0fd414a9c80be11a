package com.orbiter.app.scan;

/**
 * Progress of a running scan: completed share of the root's immediate children
 * (0..1) and the name of the child that finished last.
 */
public record ScanProgress(double fraction, String currentItemName) {

    public static final ScanProgress IDLE = new ScanProgress(0.0, "");

    public boolean isComplete() {
        return fraction >= 1.0;
    }

    public int percent() {
        return (int) Math.floor(fraction * 100);
    }
}
