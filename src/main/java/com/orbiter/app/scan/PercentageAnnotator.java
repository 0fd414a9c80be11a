package com.orbiter.app.scan;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stamps every node with its share of the scan root's size.
 */
public final class PercentageAnnotator {

    private PercentageAnnotator() {}

    public static void annotate(FileSystemEntry root) {
        if (root == null) return;
        annotate(root, root.sizeBytes());
    }

    public static void annotate(FileSystemEntry root, long totalSize) {
        if (root == null) return;

        Deque<FileSystemEntry> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            node.setPercentageOfTotal(totalSize > 0 ? 100.0 * node.sizeBytes() / totalSize : 0.0);
            if (node.children() != null) {
                for (var child : node.children()) pending.push(child);
            }
        }
    }
}
