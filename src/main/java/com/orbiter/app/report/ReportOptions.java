package com.orbiter.app.report;

import com.orbiter.app.config.OrbiterConfig;
import com.typesafe.config.Config;

/**
 * Report sizes, read from {@code orbiter.report}.
 */
public record ReportOptions(int topFiles, int topFolders, int jsonDepth) {

    public ReportOptions {
        topFiles = Math.max(1, topFiles);
        topFolders = Math.max(1, topFolders);
        jsonDepth = Math.max(0, jsonDepth);
    }

    public static ReportOptions defaults() {
        return new ReportOptions(20, 12, 4);
    }

    public static ReportOptions from(Config cfg) {
        var d = defaults();
        return new ReportOptions(
                OrbiterConfig.getInt(cfg, "orbiter.report.topFiles", d.topFiles()),
                OrbiterConfig.getInt(cfg, "orbiter.report.topFolders", d.topFolders()),
                OrbiterConfig.getInt(cfg, "orbiter.report.jsonDepth", d.jsonDepth())
        );
    }

    public ReportOptions withTopFiles(int n) {
        return new ReportOptions(n, topFolders, jsonDepth);
    }
}
