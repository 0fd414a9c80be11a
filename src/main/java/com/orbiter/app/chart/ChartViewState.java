package com.orbiter.app.chart;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.orbiter.app.scan.FileSystemEntry;

/**
 * View state over one scan result: the navigation path from the root to the focused
 * directory, the selected node and the expansion set. The expansion set belongs to
 * the current focus and is cleared whenever the focus changes.
 */
public final class ChartViewState {

    private final FileSystemEntry root;
    private final List<FileSystemEntry> path = new ArrayList<>();
    private final ExpansionState expansion = new ExpansionState();
    private FileSystemEntry selected;

    public ChartViewState(FileSystemEntry root) {
        this.root = Objects.requireNonNull(root, "root");
        path.add(root);
    }

    public FileSystemEntry root() {
        return root;
    }

    /** The focused node; ring 0 shows its children. */
    public FileSystemEntry current() {
        return path.get(path.size() - 1);
    }

    public List<FileSystemEntry> navigationPath() {
        return List.copyOf(path);
    }

    public FileSystemEntry selected() {
        return selected;
    }

    public void select(FileSystemEntry node) {
        this.selected = node;
    }

    public ExpansionState expansion() {
        return expansion;
    }

    // --- Navigation ---

    public boolean drillDown(FileSystemEntry node) {
        if (node == null || !node.isDirectory() || !node.hasChildren()) return false;
        path.add(node);
        focusChanged();
        return true;
    }

    public boolean canGoBack() {
        return path.size() > 1;
    }

    public boolean goBack() {
        if (!canGoBack()) return false;
        path.remove(path.size() - 1);
        focusChanged();
        return true;
    }

    /**
     * Focuses the directory holding {@code node} (or {@code node} itself if it is a
     * directory) and selects it. Returns false if the node is not part of this tree.
     */
    public boolean navigateTo(FileSystemEntry node) {
        if (node == null) return false;
        var found = new ArrayList<FileSystemEntry>();
        if (!buildPath(node, root, found)) return false;
        if (!node.isDirectory() && found.size() > 1) found.remove(found.size() - 1);

        var before = current();
        path.clear();
        path.addAll(found);
        if (!before.equals(current())) expansion.clear();
        selected = node;
        return true;
    }

    public Optional<FileSystemEntry> findById(UUID id) {
        return root.findById(id);
    }

    /** Double-click behaviour: expand or collapse a directory past the base depth. */
    public boolean toggleExpansion(FileSystemEntry node) {
        return expansion.toggle(node);
    }

    // --- Geometry ---

    public RingLayout layout(SunburstLayout layout) {
        return layout.buildRings(current(), expansion.ids());
    }

    /** Hit test against a layout built from this state; the hit (or nothing) becomes the selection. */
    public Optional<FileSystemEntry> hit(PolarPoint point, RingLayout rings) {
        var hit = HitTester.locate(point, rings);
        selected = hit.orElse(null);
        return hit;
    }

    private void focusChanged() {
        selected = null;
        expansion.clear();
    }

    private static boolean buildPath(FileSystemEntry target, FileSystemEntry current, List<FileSystemEntry> out) {
        out.add(current);
        if (current.equals(target)) return true;
        if (current.children() != null) {
            for (var child : current.children()) {
                if (buildPath(target, child, out)) return true;
            }
        }
        out.remove(out.size() - 1);
        return false;
    }
}
