package com.orbiter.app.chart;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import com.orbiter.app.scan.FileSystemEntry;

/**
 * Ids of nodes the user opened past the base depth. Kept outside the tree and
 * cleared whenever the focused node changes.
 */
public final class ExpansionState {

    private final Set<UUID> expanded = new HashSet<>();

    public boolean isExpanded(FileSystemEntry node) {
        return node != null && expanded.contains(node.id());
    }

    /** Only directories with children can be expanded. */
    public boolean expand(FileSystemEntry node) {
        if (node == null || !node.isDirectory() || !node.hasChildren()) return false;
        return expanded.add(node.id());
    }

    /**
     * Removes the node and every expanded node anywhere below it.
     */
    public void collapse(FileSystemEntry node) {
        if (node == null) return;
        expanded.remove(node.id());

        Deque<FileSystemEntry> pending = new ArrayDeque<>();
        if (node.children() != null) node.children().forEach(pending::push);
        while (!pending.isEmpty() && !expanded.isEmpty()) {
            var n = pending.pop();
            expanded.remove(n.id());
            if (n.children() != null) n.children().forEach(pending::push);
        }
    }

    /** Expands a collapsed node or collapses an expanded one. Returns the new state. */
    public boolean toggle(FileSystemEntry node) {
        if (isExpanded(node)) {
            collapse(node);
            return false;
        }
        return expand(node);
    }

    public void clear() {
        expanded.clear();
    }

    public Set<UUID> ids() {
        return Set.copyOf(expanded);
    }

    public int size() {
        return expanded.size();
    }
}
