package com.orbiter.app.chart;

import com.orbiter.app.config.OrbiterConfig;
import com.typesafe.config.Config;

/**
 * Sunburst geometry settings, read from {@code orbiter.chart}.
 *
 * @param baseDepth     rings built without explicit expansion
 * @param maxRings      hard cap on the number of rings
 * @param centerRadius  normalized radius of the center hole
 * @param outerPadding  normalized gap left outside the outermost ring
 * @param minArcDegrees slices this thin or thinner are not subdivided
 * @param paletteSize   number of colors the color index cycles through
 * @param startAngle    angle of ring 0's first slice (screen degrees, -90 is the top)
 * @param depthFade     opacity lost per ring
 * @param minOpacity    opacity floor
 */
public record ChartConfig(
        int baseDepth,
        int maxRings,
        double centerRadius,
        double outerPadding,
        double minArcDegrees,
        int paletteSize,
        double startAngle,
        double depthFade,
        double minOpacity
) {
    public ChartConfig {
        if (baseDepth < 1) throw new IllegalArgumentException("baseDepth must be >= 1");
        if (maxRings < 1) throw new IllegalArgumentException("maxRings must be >= 1");
        if (paletteSize < 1) throw new IllegalArgumentException("paletteSize must be >= 1");
        if (centerRadius < 0 || outerPadding < 0 || centerRadius + outerPadding >= 1) {
            throw new IllegalArgumentException("centerRadius + outerPadding must be in [0, 1)");
        }
    }

    public static ChartConfig defaults() {
        return new ChartConfig(3, 10, 0.18, 0.02, 0.5, 12, -90.0, 0.15, 0.4);
    }

    public static ChartConfig from(Config cfg) {
        var d = defaults();
        return new ChartConfig(
                OrbiterConfig.getInt(cfg, "orbiter.chart.baseDepth", d.baseDepth()),
                OrbiterConfig.getInt(cfg, "orbiter.chart.maxRings", d.maxRings()),
                OrbiterConfig.getDouble(cfg, "orbiter.chart.centerRadius", d.centerRadius()),
                OrbiterConfig.getDouble(cfg, "orbiter.chart.outerPadding", d.outerPadding()),
                OrbiterConfig.getDouble(cfg, "orbiter.chart.minArcDegrees", d.minArcDegrees()),
                OrbiterConfig.getInt(cfg, "orbiter.chart.paletteSize", d.paletteSize()),
                OrbiterConfig.getDouble(cfg, "orbiter.chart.startAngle", d.startAngle()),
                OrbiterConfig.getDouble(cfg, "orbiter.chart.depthFade", d.depthFade()),
                OrbiterConfig.getDouble(cfg, "orbiter.chart.minOpacity", d.minOpacity())
        );
    }

    public ChartConfig withBaseDepth(int value) {
        return new ChartConfig(value, maxRings, centerRadius, outerPadding, minArcDegrees,
                paletteSize, startAngle, depthFade, minOpacity);
    }
}
