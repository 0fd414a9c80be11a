package com.orbiter.app.scan;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PercentageAnnotatorTest {

    @Test
    void everyNodeGetsItsShareOfTheRoot() {
        var root = Path.of("/r");
        var a = FileSystemEntry.file(root.resolve("a"), "a", 100);
        var b = FileSystemEntry.file(root.resolve("sub/b"), "b", 300);
        var sub = FileSystemEntry.directory(root.resolve("sub"), "sub", List.of(b));
        var top = FileSystemEntry.directory(root, "r", List.of(a, sub));

        PercentageAnnotator.annotate(top);

        assertEquals(100.0, top.percentageOfTotal(), 1e-9);
        assertEquals(75.0, sub.percentageOfTotal(), 1e-9);
        assertEquals(75.0, b.percentageOfTotal(), 1e-9);
        assertEquals(25.0, a.percentageOfTotal(), 1e-9);
    }

    @Test
    void emptyRootGivesZeroEverywhere() {
        var root = Path.of("/empty");
        var zero = FileSystemEntry.file(root.resolve("z"), "z", 0);
        var top = FileSystemEntry.directory(root, "empty", List.of(zero));

        PercentageAnnotator.annotate(top);

        assertEquals(0.0, top.percentageOfTotal());
        assertEquals(0.0, zero.percentageOfTotal());
    }

    @Test
    void explicitTotalIsUsedAsDenominator() {
        var f = FileSystemEntry.file(Path.of("/x"), "x", 50);

        PercentageAnnotator.annotate(f, 200);

        assertEquals(25.0, f.percentageOfTotal(), 1e-9);
    }

    @Test
    void nullRootIsIgnored() {
        assertDoesNotThrow(() -> PercentageAnnotator.annotate(null));
    }
}
