package com.orbiter.app.scan;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

import org.apache.commons.io.FileUtils;

/**
 * One file, package or directory of a scan result.
 * <p>
 * The tree is built bottom-up and never changes shape afterwards. A directory's
 * size is the exact sum of its children, which are kept largest first (ties keep
 * enumeration order). Only {@link #percentageOfTotal()} is written later, by
 * {@link PercentageAnnotator}.
 * <p>
 * Identity is the {@link #id()}, fresh for every scan, so view state keyed by id
 * never leaks from one scan into the next.
 */
public final class FileSystemEntry {

    static final Comparator<FileSystemEntry> BY_SIZE_DESC =
            Comparator.comparingLong(FileSystemEntry::sizeBytes).reversed();

    private final UUID id = UUID.randomUUID();
    private final Path path;
    private final String name;
    private final EntryKind kind;
    private final long sizeBytes;
    private final List<FileSystemEntry> children;

    private volatile double percentageOfTotal;

    private FileSystemEntry(Path path, String name, EntryKind kind, long sizeBytes, List<FileSystemEntry> children) {
        this.path = Objects.requireNonNull(path, "path");
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind;
        this.sizeBytes = Math.max(0L, sizeBytes);
        this.children = children;
    }

    public static FileSystemEntry file(Path path, String name, long sizeBytes) {
        return new FileSystemEntry(path, name, EntryKind.FILE, sizeBytes, null);
    }

    public static FileSystemEntry pkg(Path path, String name, long sizeBytes) {
        return new FileSystemEntry(path, name, EntryKind.PACKAGE, sizeBytes, null);
    }

    /**
     * Builds a directory node from finished children. Size is summed here and the
     * children are stable-sorted by size, descending.
     */
    public static FileSystemEntry directory(Path path, String name, List<FileSystemEntry> children) {
        var sorted = new ArrayList<FileSystemEntry>(children == null ? 0 : children.size());
        long total = 0L;
        if (children != null) {
            for (var child : children) {
                if (child == null) continue;
                sorted.add(child);
                total += child.sizeBytes;
            }
        }
        sorted.sort(BY_SIZE_DESC);
        return new FileSystemEntry(path, name, EntryKind.DIRECTORY, total, List.copyOf(sorted));
    }

    public static FileSystemEntry emptyDirectory(Path path, String name) {
        return new FileSystemEntry(path, name, EntryKind.DIRECTORY, 0L, List.of());
    }

    public UUID id() { return id; }
    public Path path() { return path; }
    public String name() { return name; }
    public EntryKind kind() { return kind; }
    public long sizeBytes() { return sizeBytes; }
    public double percentageOfTotal() { return percentageOfTotal; }

    public boolean isDirectory() { return kind == EntryKind.DIRECTORY; }
    public boolean isPackage() { return kind == EntryKind.PACKAGE; }

    /** Children, largest first; {@code null} for files and packages. */
    public List<FileSystemEntry> children() { return children; }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    public int childCount() {
        return children == null ? 0 : children.size();
    }

    public String formattedSize() {
        return FileUtils.byteCountToDisplaySize(sizeBytes);
    }

    public FileKind fileKind() {
        return FileKind.of(kind, name);
    }

    void setPercentageOfTotal(double value) {
        this.percentageOfTotal = value;
    }

    // --- Lookup ---

    public Optional<FileSystemEntry> findById(UUID target) {
        return find(e -> e.id.equals(target));
    }

    public Optional<FileSystemEntry> findByPath(Path target) {
        if (target == null) return Optional.empty();
        Path normalized = target.toAbsolutePath().normalize();
        return find(e -> e.path.equals(normalized));
    }

    private Optional<FileSystemEntry> find(Predicate<FileSystemEntry> match) {
        Deque<FileSystemEntry> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            var e = stack.pop();
            if (match.test(e)) return Optional.of(e);
            if (e.children != null) {
                for (var c : e.children) stack.push(c);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileSystemEntry other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return kind + "[" + name + ", " + sizeBytes + " B, " + childCount() + " children]";
    }
}
