package com.orbiter.app.scan;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FileSystemEntryTest {

    private static final Path ROOT = Path.of("/data");

    @Test
    void directorySumsChildrenAndSortsDescending() {
        var a = FileSystemEntry.file(ROOT.resolve("a"), "a", 10);
        var b = FileSystemEntry.file(ROOT.resolve("b"), "b", 300);
        var c = FileSystemEntry.file(ROOT.resolve("c"), "c", 40);

        var dir = FileSystemEntry.directory(ROOT, "data", List.of(a, b, c));

        assertEquals(350, dir.sizeBytes());
        assertEquals(List.of(b, c, a), dir.children());
        assertTrue(dir.isDirectory());
        assertEquals(FileKind.FOLDER, dir.fileKind());
    }

    @Test
    void equalSizesKeepInsertionOrder() {
        var first = FileSystemEntry.file(ROOT.resolve("x"), "x", 5);
        var second = FileSystemEntry.file(ROOT.resolve("y"), "y", 5);
        var third = FileSystemEntry.file(ROOT.resolve("z"), "z", 5);

        var dir = FileSystemEntry.directory(ROOT, "data", List.of(first, second, third));

        assertEquals(List.of(first, second, third), dir.children());
    }

    @Test
    void childrenAreImmutableAndNullForLeaves() {
        var file = FileSystemEntry.file(ROOT.resolve("f.txt"), "f.txt", 1);
        var pkg = FileSystemEntry.pkg(ROOT.resolve("Tool.app"), "Tool.app", 2048);
        var dir = FileSystemEntry.directory(ROOT, "data", new ArrayList<>(List.of(file, pkg)));

        assertNull(file.children());
        assertNull(pkg.children());
        assertFalse(pkg.hasChildren());
        assertTrue(pkg.isPackage());
        assertEquals(FileKind.APPLICATION, pkg.fileKind());
        assertThrows(UnsupportedOperationException.class, () -> dir.children().add(file));
    }

    @Test
    void emptyDirectoryHasZeroSizeAndNoChildren() {
        var dir = FileSystemEntry.emptyDirectory(ROOT.resolve("locked"), "locked");

        assertEquals(0, dir.sizeBytes());
        assertNotNull(dir.children());
        assertEquals(0, dir.childCount());
        assertFalse(dir.hasChildren());
    }

    @Test
    void negativeSizeIsClampedToZero() {
        assertEquals(0, FileSystemEntry.file(ROOT.resolve("n"), "n", -42).sizeBytes());
    }

    @Test
    void equalityIsByIdentityNotByPath() {
        var one = FileSystemEntry.file(ROOT.resolve("same"), "same", 1);
        var two = FileSystemEntry.file(ROOT.resolve("same"), "same", 1);

        assertNotEquals(one, two);
        assertNotEquals(one.id(), two.id());
        assertEquals(one, one);
    }

    @Test
    void findsNodesByIdAndPath() {
        var deep = FileSystemEntry.file(ROOT.resolve("sub/deep.bin"), "deep.bin", 7);
        var sub = FileSystemEntry.directory(ROOT.resolve("sub"), "sub", List.of(deep));
        var root = FileSystemEntry.directory(ROOT, "data", List.of(sub));

        assertEquals(deep, root.findById(deep.id()).orElseThrow());
        assertEquals(sub, root.findByPath(ROOT.resolve("sub")).orElseThrow());
        assertTrue(root.findByPath(ROOT.resolve("missing")).isEmpty());
    }

    @Test
    void fileKindFollowsExtension() {
        assertEquals(FileKind.IMAGE, FileSystemEntry.file(ROOT.resolve("p.JPG"), "p.JPG", 1).fileKind());
        assertEquals(FileKind.DISK_IMAGE, FileSystemEntry.file(ROOT.resolve("d.dmg"), "d.dmg", 1).fileKind());
        assertEquals(FileKind.OTHER, FileSystemEntry.file(ROOT.resolve("Makefile"), "Makefile", 1).fileKind());
        assertEquals(FileKind.OTHER, FileSystemEntry.file(ROOT.resolve(".bashrc"), ".bashrc", 1).fileKind());
    }
}
