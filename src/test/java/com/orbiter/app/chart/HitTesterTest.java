package com.orbiter.app.chart;

import com.orbiter.app.scan.FileSystemEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.orbiter.app.chart.TestTrees.dir;
import static com.orbiter.app.chart.TestTrees.file;
import static org.junit.jupiter.api.Assertions.*;

public class HitTesterTest {

    // Chart drawn in a 200x200 box: center (100, 100), radius 100.
    private static final double C = 100, R = 100;

    private FileSystemEntry a, b, c, inner, x;
    private RingLayout rings;

    @BeforeEach
    void setUp() {
        // a: [-90, 90), b: [90, 180), c: [180, 270)
        a = file("a", 50);
        x = file("x", 25);
        inner = dir("inner", x);
        c = file("c", 25);
        var root = dir("root", a, inner, c);
        b = inner;
        rings = new SunburstLayout(ChartConfig.defaults()).buildRings(root, Set.of());
    }

    @Test
    void pointInsideSliceHitsIt() {
        assertEquals(a, HitTester.locate(130, 100, C, C, R, rings).orElseThrow());
        assertEquals(c, HitTester.locate(70, 99.9, C, C, R, rings).orElseThrow());
    }

    @Test
    void boundaryAngleBelongsToSliceStartingThere() {
        // straight down is 90 degrees
        assertEquals(b, HitTester.locate(100, 130, C, C, R, rings).orElseThrow());
        // straight left is 180 degrees
        assertEquals(c, HitTester.locate(70, 100, C, C, R, rings).orElseThrow());
        // straight up is -90, the start of the first slice
        assertEquals(a, HitTester.locate(100, 70, C, C, R, rings).orElseThrow());
    }

    @Test
    void outerRingIsResolvedByDistance() {
        double mid = (rings.innerRadius(1) + rings.outerRadius(1)) / 2;

        var hit = HitTester.locate(new PolarPoint(mid, 120), rings);

        assertEquals(x, hit.orElseThrow());
    }

    @Test
    void emptySpaceInOuterRingIsNotAHit() {
        double mid = (rings.innerRadius(1) + rings.outerRadius(1)) / 2;

        // ring 1 only covers inner's arc, nothing falls back to ring 0
        assertTrue(HitTester.locate(new PolarPoint(mid, 0), rings).isEmpty());
    }

    @Test
    void centerHoleAndOutsideAreMisses() {
        assertTrue(HitTester.locate(100, 100, C, C, R, rings).isEmpty());
        assertTrue(HitTester.locate(new PolarPoint(0.1, 0), rings).isEmpty());
        assertTrue(HitTester.locate(new PolarPoint(0.99, 0), rings).isEmpty());
        assertTrue(HitTester.locate(new PolarPoint(1.5, 0), rings).isEmpty());
    }

    @Test
    void ringBandsAreInclusive() {
        assertEquals(a, HitTester.locate(new PolarPoint(rings.innerRadius(0), 0), rings).orElseThrow());
        assertEquals(a, HitTester.locate(new PolarPoint(rings.outerRadius(0), 0), rings).orElseThrow());
    }

    @Test
    void layoutSliceIsReturnedWithGeometry() {
        var slice = HitTester.locateSlice(new PolarPoint(0.3, 10), rings).orElseThrow();

        assertEquals(0, slice.ringIndex());
        assertEquals(-90.0, slice.startAngle(), 1e-9);
        assertEquals(90.0, slice.endAngle(), 1e-9);
        assertEquals(0.0, slice.midAngle(), 1e-9);
        assertTrue(slice.contains(slice.midAngle()));
    }

    @Test
    void screenAnglesWrapIntoLayoutRange() {
        var upLeft = PolarPoint.fromScreen(90, 90, C, C, R);

        assertTrue(upLeft.angle() >= -90 && upLeft.angle() < 270);
        assertEquals(225.0, upLeft.angle(), 1e-9);
        assertEquals(Math.sqrt(200) / 100, upLeft.distance(), 1e-9);
    }

    @Test
    void emptyLayoutNeverHits() {
        var empty = new SunburstLayout(ChartConfig.defaults()).buildRings(file("solo", 1), Set.of());

        assertTrue(HitTester.locate(130, 100, C, C, R, empty).isEmpty());
    }
}
