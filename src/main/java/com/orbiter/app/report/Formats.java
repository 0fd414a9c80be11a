package com.orbiter.app.report;

import java.util.Locale;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/** Text formatting shared by the report and the command line. */
public final class Formats {

    private Formats() {}

    public static String bytes(long b) {
        return FileUtils.byteCountToDisplaySize(Math.max(0L, b));
    }

    /** {@code pct} on the 0..100 scale. */
    public static String percent(double pct) {
        return String.format(Locale.ROOT, "%.1f%%", pct);
    }

    public static String abbreviateMiddle(String s, int maxLength) {
        if (s == null) return "";
        if (maxLength < 5) return StringUtils.abbreviate(s, Math.max(4, maxLength));
        return StringUtils.abbreviateMiddle(s, "...", maxLength);
    }
}
