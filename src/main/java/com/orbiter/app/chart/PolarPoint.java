package com.orbiter.app.chart;

/**
 * A pointer position relative to the chart center.
 *
 * @param distance normalized radial distance (0 center, 1 chart edge)
 * @param angle    screen degrees in {@code [-90, 270)}, -90 at the top, growing clockwise
 */
public record PolarPoint(double distance, double angle) {

    /**
     * Converts screen coordinates (y grows downwards) to the layout's polar frame.
     */
    public static PolarPoint fromScreen(double x, double y, double centerX, double centerY, double chartRadius) {
        if (chartRadius <= 0) throw new IllegalArgumentException("chartRadius must be > 0");
        double dx = x - centerX;
        double dy = y - centerY;
        double distance = Math.sqrt(dx * dx + dy * dy) / chartRadius;

        double angle = Math.toDegrees(Math.atan2(dy, dx));
        if (angle < -90) angle += 360;
        return new PolarPoint(distance, angle);
    }
}
