package com.orbiter.app.chart;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.orbiter.app.scan.FileSystemEntry;

/**
 * Turns the focused node into rings of angular slices.
 * <p>
 * Ring 0 spreads the focused node's children over the full circle. Every following
 * ring splits each parent slice among that parent's children in proportion to their
 * size. The first {@code baseDepth} rings are always built; past that a parent only
 * gets an outer ring if its id is in the expanded set. Building stops at the first
 * empty ring or at {@code maxRings}.
 * <p>
 * Pure: the same tree, focus and expanded set always give the same geometry.
 */
public final class SunburstLayout {

    private final ChartConfig cfg;

    public SunburstLayout(ChartConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public ChartConfig config() {
        return cfg;
    }

    public RingLayout buildRings(FileSystemEntry focused, Set<UUID> expandedIds) {
        var expanded = expandedIds == null ? Set.<UUID>of() : expandedIds;
        var rings = new ArrayList<List<SliceGeometry>>();

        if (focused != null && focused.hasChildren()) {
            var first = slicesInArc(focused.children(), cfg.startAngle(), 360.0, 0, -1);
            if (!first.isEmpty()) {
                rings.add(first);

                var parents = first;
                int depth = 1;
                while (!parents.isEmpty() && depth < cfg.maxRings()) {
                    var ring = new ArrayList<SliceGeometry>();
                    for (var parent : parents) {
                        if (depth >= cfg.baseDepth() && !expanded.contains(parent.node().id())) continue;
                        if (!parent.node().hasChildren()) continue;
                        double arc = parent.arcSpan();
                        if (arc <= cfg.minArcDegrees()) continue;

                        ring.addAll(slicesInArc(parent.node().children(), parent.startAngle(), arc,
                                depth, parent.colorIndex()));
                    }
                    if (ring.isEmpty()) break;

                    var frozen = List.copyOf(ring);
                    rings.add(frozen);
                    parents = frozen;
                    depth++;
                }
            }
        }

        return new RingLayout(rings, cfg.centerRadius(), ringWidth(rings.size()));
    }

    /** Radial width of one ring when {@code ringCount} rings are shown. */
    public double ringWidth(int ringCount) {
        int count = Math.max(ringCount, cfg.baseDepth());
        return (1.0 - cfg.centerRadius() - cfg.outerPadding()) / count;
    }

    /**
     * Splits {@code arcSpan} degrees from {@code startAngle} among {@code nodes}, in their
     * stored order. Edges come from the running size total, so the last slice ends
     * exactly on the parent's end angle.
     */
    private List<SliceGeometry> slicesInArc(List<FileSystemEntry> nodes, double startAngle, double arcSpan,
                                            int depth, int parentColorIndex) {
        long total = 0L;
        for (var n : nodes) total += n.sizeBytes();
        if (total <= 0) return List.of();

        int palette = cfg.paletteSize();
        int colorOffset = parentColorIndex < 0 ? 0 : (parentColorIndex + 1) % palette;
        double opacity = Math.max(cfg.minOpacity(), 1.0 - cfg.depthFade() * depth);

        var slices = new ArrayList<SliceGeometry>(nodes.size());
        long before = 0L;
        double current = startAngle;
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get(i);
            long through = before + node.sizeBytes();
            double end = startAngle + arcSpan * ((double) through / total);

            slices.add(new SliceGeometry(node, depth, current, end, depth, (i + colorOffset) % palette, opacity));

            current = end;
            before = through;
        }
        return List.copyOf(slices);
    }
}
