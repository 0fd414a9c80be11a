package com.orbiter.app.config;

import java.util.List;
import java.util.prefs.Preferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orbiter.app.Main;
import com.orbiter.app.chart.ChartConfig;
import com.orbiter.app.report.ReportOptions;
import com.orbiter.app.scan.ScanConfig;
import com.orbiter.app.scan.SizeMode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Central configuration of Orbiter.
 * <p>
 * Defaults live in {@code reference.conf}; {@code application.conf} and {@code -D}
 * system properties override them (Typesafe Config). A few keys can also be set
 * from the environment or a local {@code .env} file. User state (last scanned path)
 * lives in {@link Preferences}.
 */
public final class OrbiterConfig {

    // Environment variables, checked before the HOCON value
    private static final String ENV_SCAN_PARALLELISM = "ORBITER_SCAN_PARALLELISM";
    private static final String ENV_SIZE_MODE = "ORBITER_SIZE_MODE";
    private static final String ENV_BASE_DEPTH = "ORBITER_BASE_DEPTH";

    // Logger must be initialized before any static initializer that may use it
    private static final Logger logger = LoggerFactory.getLogger(OrbiterConfig.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private static final Preferences prefs = Preferences.userNodeForPackage(Main.class);

    private OrbiterConfig() {}

    /** reference.conf + application.conf + system properties. */
    public static Config settings() {
        return ConfigFactory.load();
    }

    public static ScanConfig scanConfig() {
        var cfg = ScanConfig.from(settings());

        Integer parallelism = parseInt(getEnvOrDotenv(ENV_SCAN_PARALLELISM));
        if (parallelism != null) cfg = cfg.withParallelism(parallelism);

        String mode = getEnvOrDotenv(ENV_SIZE_MODE);
        if (mode != null) cfg = cfg.withSizeMode(SizeMode.parse(mode, cfg.sizeMode()));

        return cfg;
    }

    public static ChartConfig chartConfig() {
        var cfg = ChartConfig.from(settings());
        Integer baseDepth = parseInt(getEnvOrDotenv(ENV_BASE_DEPTH));
        if (baseDepth != null && baseDepth >= 1) cfg = cfg.withBaseDepth(baseDepth);
        return cfg;
    }

    public static ReportOptions reportOptions() {
        return ReportOptions.from(settings());
    }

    // --- User state ---

    public static void saveLastPath(String path) {
        prefs.put("last_scan_path", path);
    }

    public static String getLastPath() {
        return prefs.get("last_scan_path", System.getProperty("user.home"));
    }

    public static Preferences preferences() {
        return prefs;
    }

    // --- Lookup helpers (missing or malformed values fall back to the default) ---

    public static String getString(Config cfg, String path, String def) {
        try { return cfg.hasPath(path) ? cfg.getString(path) : def; }
        catch (Exception e) { return fallback(path, def, e); }
    }

    public static int getInt(Config cfg, String path, int def) {
        try { return cfg.hasPath(path) ? cfg.getInt(path) : def; }
        catch (Exception e) { return fallback(path, def, e); }
    }

    public static double getDouble(Config cfg, String path, double def) {
        try { return cfg.hasPath(path) ? cfg.getDouble(path) : def; }
        catch (Exception e) { return fallback(path, def, e); }
    }

    public static boolean getBool(Config cfg, String path, boolean def) {
        try { return cfg.hasPath(path) ? cfg.getBoolean(path) : def; }
        catch (Exception e) { return fallback(path, def, e); }
    }

    public static List<String> getStringList(Config cfg, String path, List<String> def) {
        try { return cfg.hasPath(path) ? cfg.getStringList(path) : def; }
        catch (Exception e) { return fallback(path, def, e); }
    }

    private static <T> T fallback(String path, T def, Exception e) {
        logger.warn("Invalid config value at {}, using default {}: {}", path, def, e.getMessage());
        return def;
    }

    /**
     * Environment variable first, then the local .env file.
     */
    static String getEnvOrDotenv(String key) {
        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static Integer parseInt(String value) {
        if (value == null) return null;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}'", value);
            return null;
        }
    }
}
