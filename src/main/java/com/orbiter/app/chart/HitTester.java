package com.orbiter.app.chart;

import java.util.Optional;

import com.orbiter.app.scan.FileSystemEntry;

/**
 * Maps a pointer back to the node drawn under it, using the same frame as
 * {@link SunburstLayout}.
 */
public final class HitTester {

    private HitTester() {}

    public static Optional<FileSystemEntry> locate(double x, double y, double centerX, double centerY,
                                                   double chartRadius, RingLayout layout) {
        return locate(PolarPoint.fromScreen(x, y, centerX, centerY, chartRadius), layout);
    }

    /**
     * The first ring whose band holds the distance decides: a slice of that ring covering
     * the angle, or nothing. Other rings are not tried.
     */
    public static Optional<FileSystemEntry> locate(PolarPoint point, RingLayout layout) {
        return locateSlice(point, layout).map(SliceGeometry::node);
    }

    public static Optional<SliceGeometry> locateSlice(PolarPoint point, RingLayout layout) {
        if (point == null || layout == null) return Optional.empty();

        for (int i = 0; i < layout.ringCount(); i++) {
            double inner = layout.innerRadius(i);
            double outer = layout.outerRadius(i);
            if (point.distance() < inner || point.distance() > outer) continue;

            for (var slice : layout.ring(i)) {
                if (slice.contains(point.angle())) return Optional.of(slice);
            }
            return Optional.empty();
        }
        return Optional.empty();
    }
}
