package com.orbiter.app.scan;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.orbiter.app.config.OrbiterConfig;
import com.typesafe.config.Config;

/**
 * Scan tuning, read from {@code orbiter.scan} in reference.conf/application.conf.
 *
 * @param parallelism       worker threads of the scan pool; 0 picks a default
 * @param sizeMode          how file sizes are measured
 * @param packageExtensions lower-case extensions of directories sized as one leaf
 */
public record ScanConfig(int parallelism, SizeMode sizeMode, Set<String> packageExtensions) {

    public ScanConfig {
        parallelism = Math.max(0, parallelism);
        sizeMode = sizeMode == null ? SizeMode.LOGICAL : sizeMode;
        packageExtensions = normalize(packageExtensions == null ? Set.of() : packageExtensions);
    }

    public static ScanConfig defaults() {
        return new ScanConfig(0, SizeMode.LOGICAL, Set.of(
                "app", "appex", "bundle", "framework", "plugin", "kext", "pkg", "mpkg",
                "prefpane", "qlgenerator", "mdimporter", "saver", "xpc", "rtfd",
                "xcodeproj", "xcworkspace", "playground", "photoslibrary", "musiclibrary",
                "tvlibrary", "imovielibrary", "fcpbundle", "logicx"));
    }

    public static ScanConfig from(Config cfg) {
        var defaults = defaults();
        int parallelism = OrbiterConfig.getInt(cfg, "orbiter.scan.parallelism", defaults.parallelism());
        SizeMode mode = SizeMode.parse(OrbiterConfig.getString(cfg, "orbiter.scan.sizeMode", null), defaults.sizeMode());
        List<String> packages = OrbiterConfig.getStringList(cfg, "orbiter.scan.packageExtensions",
                List.copyOf(defaults.packageExtensions()));

        return new ScanConfig(parallelism, mode, new LinkedHashSet<>(packages));
    }

    public ScanConfig withParallelism(int value) {
        return new ScanConfig(value, sizeMode, packageExtensions);
    }

    public ScanConfig withSizeMode(SizeMode value) {
        return new ScanConfig(parallelism, value, packageExtensions);
    }

    /** Threads actually used by the scan pool. */
    public int effectiveParallelism() {
        if (parallelism > 0) return parallelism;
        return Math.max(2, Runtime.getRuntime().availableProcessors() * 2);
    }

    private static Set<String> normalize(Collection<String> raw) {
        var out = new LinkedHashSet<String>();
        for (var s : raw) {
            if (s == null || s.isBlank()) continue;
            var ext = s.trim().toLowerCase(Locale.ROOT);
            if (ext.startsWith(".")) ext = ext.substring(1);
            out.add(ext);
        }
        return Set.copyOf(out);
    }
}
