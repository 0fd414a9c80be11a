package com.orbiter.app.chart;

import com.orbiter.app.scan.FileSystemEntry;

/**
 * One node's wedge in a ring. Angles are screen degrees (-90 is the top, growing
 * clockwise); the wedge covers {@code [startAngle, endAngle)}.
 */
public record SliceGeometry(
        FileSystemEntry node,
        int ringIndex,
        double startAngle,
        double endAngle,
        int depth,
        int colorIndex,
        double opacity
) {
    public double arcSpan() {
        return endAngle - startAngle;
    }

    /** Angle through the middle of the wedge, where a label would sit. */
    public double midAngle() {
        return (startAngle + endAngle) / 2.0;
    }

    public boolean contains(double angle) {
        return angle >= startAngle && angle < endAngle;
    }
}
