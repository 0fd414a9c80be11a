package com.orbiter.app.chart;

import java.util.List;
import java.util.Optional;

import com.orbiter.app.scan.FileSystemEntry;

/**
 * Rings produced by {@link SunburstLayout}, with the radial bands they occupy.
 * Radii are normalized: 0 is the center, 1 the chart edge.
 */
public record RingLayout(List<List<SliceGeometry>> rings, double centerRadius, double ringWidth) {

    public RingLayout {
        rings = List.copyOf(rings);
    }

    public int ringCount() {
        return rings.size();
    }

    public boolean isEmpty() {
        return rings.isEmpty();
    }

    public List<SliceGeometry> ring(int index) {
        return rings.get(index);
    }

    public double innerRadius(int ringIndex) {
        return centerRadius + ringWidth * ringIndex;
    }

    public double outerRadius(int ringIndex) {
        return centerRadius + ringWidth * (ringIndex + 1);
    }

    public Optional<SliceGeometry> sliceOf(FileSystemEntry node) {
        for (var ring : rings) {
            for (var slice : ring) {
                if (slice.node().equals(node)) return Optional.of(slice);
            }
        }
        return Optional.empty();
    }
}
