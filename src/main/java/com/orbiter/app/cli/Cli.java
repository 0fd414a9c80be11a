package com.orbiter.app.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orbiter.app.chart.ChartViewState;
import com.orbiter.app.chart.RingLayout;
import com.orbiter.app.chart.SliceGeometry;
import com.orbiter.app.chart.SunburstLayout;
import com.orbiter.app.config.FavoritesStore;
import com.orbiter.app.config.OrbiterConfig;
import com.orbiter.app.report.Formats;
import com.orbiter.app.report.ReportExporter;
import com.orbiter.app.report.ScanReport;
import com.orbiter.app.scan.FileSystemEntry;
import com.orbiter.app.scan.ScanEngine;
import com.orbiter.app.scan.ScanOutcome;
import com.orbiter.app.scan.ScanSession;
import com.orbiter.app.system.VolumeService;
import com.orbiter.app.trash.NativeTrashService;
import com.orbiter.app.trash.TrashException;
import com.orbiter.app.trash.TrashService;

/**
 * Command line front end. Exit codes: 0 ok, 1 runtime failure, 2 usage error.
 */
public final class Cli {

    private static final Logger logger = LoggerFactory.getLogger(Cli.class);

    private static final int NAME_WIDTH = 40;

    private final PrintStream out;
    private final PrintStream err;
    private final FavoritesStore favorites;
    private final TrashService trash;

    Cli(PrintStream out, PrintStream err, FavoritesStore favorites, TrashService trash) {
        this.out = out;
        this.err = err;
        this.favorites = favorites;
        this.trash = trash;
    }

    public static void main(String[] args) {
        run(args);
    }

    public static void run(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public static int execute(String[] args) {
        return new Cli(System.out, System.err, new FavoritesStore(), new NativeTrashService()).executeInternal(args);
    }

    int executeInternal(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 0;
        }

        String cmd = safeLower(args[0]);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (cmd) {
                case "scan" -> runScan(rest);
                case "volumes" -> runVolumes(rest);
                case "favorites" -> runFavorites(rest);
                case "trash" -> runTrash(rest);
                case "help", "-h", "--help" -> {
                    printUsage();
                    yield 0;
                }
                default -> {
                    err.println("Unknown command: " + args[0]);
                    printUsage();
                    yield 2;
                }
            };
        } catch (Exception e) {
            logger.debug("Command {} failed", cmd, e);
            err.println("Fatal error: " + safeMsg(e));
            return 1;
        }
    }

    // ----------------- scan -----------------

    private int runScan(String[] args) {
        ParseResult<ScanArgs> parsed = ScanArgs.parse(args);
        if (parsed.help()) {
            printScanUsage();
            return 0;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            printScanUsage();
            return 2;
        }

        ScanArgs a = parsed.value();
        Path root;
        try {
            root = Path.of(a.path()).toAbsolutePath().normalize();
        } catch (Exception e) {
            err.println("Invalid path: " + safeMsg(e));
            return 2;
        }

        var chartCfg = OrbiterConfig.chartConfig();
        if (a.depth() != null) chartCfg = chartCfg.withBaseDepth(a.depth());
        var reportOpts = OrbiterConfig.reportOptions();
        if (a.top() != null) reportOpts = reportOpts.withTopFiles(a.top());

        try (var session = new ScanSession(new ScanEngine(OrbiterConfig.scanConfig()), trash)) {
            // Ctrl+C / kill cancels the scan
            Thread cancelHook = new Thread(() -> {
                session.cancel();
                err.println("Cancel requested (shutdown hook) at " + Instant.now());
            }, "orbiter-cli-cancel");
            boolean hooked = addShutdownHook(cancelHook);

            ScanOutcome outcome;
            try {
                outcome = session.start(root, p -> {
                    if (!p.isComplete()) {
                        err.printf("\r[%3d%%] %s", p.percent(), Formats.abbreviateMiddle(p.currentItemName(), NAME_WIDTH));
                    } else {
                        err.println("\r[100%] done");
                    }
                }).join();
            } finally {
                if (hooked) removeShutdownHook(cancelHook);
            }

            switch (outcome.status()) {
                case CANCELLED -> {
                    err.println("Scan cancelled.");
                    return 1;
                }
                case FAILED -> {
                    err.println("Scan failed: " + safeMsg(outcome.error()));
                    return 1;
                }
                default -> { }
            }

            saveLastPath(root);
            var tree = outcome.root();

            var view = new ChartViewState(tree);
            for (String name : a.expand()) {
                var match = findDirectoryByName(tree, name);
                if (match.isEmpty()) {
                    err.println("No directory named '" + name + "' to expand");
                    continue;
                }
                view.toggleExpansion(match.get());
            }

            var report = ScanReport.from(tree, reportOpts);
            printSummary(report);
            printRings(view.layout(new SunburstLayout(chartCfg)), reportOpts.topFiles());
            printTopFiles(report);

            if (a.json() != null) {
                var target = Path.of(a.json());
                ReportExporter.writeJson(target, tree, report, reportOpts.jsonDepth());
                out.println("JSON written to " + target.toAbsolutePath());
            }
            return 0;
        } catch (IOException e) {
            err.println("Export failed: " + safeMsg(e));
            return 1;
        }
    }

    private void printSummary(ScanReport report) {
        var s = report.summary();
        out.printf("%s%n  %s in %d files, %d folders, %d packages%n",
                s.rootPath(), Formats.bytes(s.totalBytes()), s.files(), s.directories(), s.packages());
    }

    private void printRings(RingLayout layout, int perRing) {
        if (layout.isEmpty()) {
            out.println("  (nothing to chart)");
            return;
        }
        for (int i = 0; i < layout.ringCount(); i++) {
            var ring = layout.ring(i);
            out.printf("Ring %d (%d slices)%n", i, ring.size());

            // biggest first inside the ring
            var sorted = new ArrayList<>(ring);
            sorted.sort((x, y) -> Long.compare(y.node().sizeBytes(), x.node().sizeBytes()));
            int shown = Math.min(perRing, sorted.size());
            for (int k = 0; k < shown; k++) {
                out.println("  " + describe(sorted.get(k)));
            }
            if (sorted.size() > shown) out.printf("  ... %d more%n", sorted.size() - shown);
        }
    }

    private void printTopFiles(ScanReport report) {
        if (report.topFiles().isEmpty()) return;
        out.println("Largest files");
        for (var f : report.topFiles()) {
            out.printf("  %-10s %7s  %s%n", Formats.bytes(f.sizeBytes()), Formats.percent(f.percentage()),
                    Formats.abbreviateMiddle(f.path(), 80));
        }
    }

    private static String describe(SliceGeometry s) {
        var n = s.node();
        return String.format(Locale.ROOT, "%-" + NAME_WIDTH + "s %10s %7s  %7.2f..%7.2f",
                Formats.abbreviateMiddle(n.name() + (n.isDirectory() ? "/" : ""), NAME_WIDTH),
                n.formattedSize(), Formats.percent(n.percentageOfTotal()), s.startAngle(), s.endAngle());
    }

    private static Optional<FileSystemEntry> findDirectoryByName(FileSystemEntry root, String name) {
        var queue = new ArrayDeque<FileSystemEntry>();
        queue.add(root);
        while (!queue.isEmpty()) {
            var e = queue.poll();
            if (e != root && e.isDirectory() && e.name().equals(name)) return Optional.of(e);
            if (e.children() != null) queue.addAll(e.children());
        }
        return Optional.empty();
    }

    private void saveLastPath(Path root) {
        try {
            OrbiterConfig.saveLastPath(root.toString());
        } catch (RuntimeException e) {
            logger.debug("Could not save last path: {}", safeMsg(e));
        }
    }

    // ----------------- volumes -----------------

    private int runVolumes(String[] args) {
        if (args.length > 0) {
            err.println("Unexpected argument: " + args[0]);
            return 2;
        }
        var volumes = new VolumeService().listVolumes();
        if (volumes.isEmpty()) {
            out.println("No volumes found.");
            return 0;
        }
        out.println("name | mount | type | used | total | used%");
        for (var v : volumes) {
            out.printf("%s | %s | %s | %s | %s | %s%n",
                    v.name(), v.mount(), safeText(v.type()),
                    Formats.bytes(v.usedBytes()), Formats.bytes(v.totalBytes()), Formats.percent(v.usedPct()));
        }
        return 0;
    }

    // ----------------- favorites -----------------

    private int runFavorites(String[] args) {
        String action = args.length == 0 ? "list" : safeLower(args[0]);
        switch (action) {
            case "list" -> {
                var list = favorites.list();
                if (list.isEmpty()) out.println("No favorites.");
                list.forEach(out::println);
                return 0;
            }
            case "add", "remove" -> {
                if (args.length != 2 || isBlank(args[1])) {
                    err.println("Usage: favorites " + action + " <path>");
                    return 2;
                }
                var path = Path.of(args[1]);
                boolean changed = action.equals("add") ? favorites.add(path) : favorites.remove(path);
                out.println(changed ? "ok" : "unchanged");
                return 0;
            }
            default -> {
                err.println("Unknown favorites action: " + args[0]);
                err.println("Usage: favorites [list | add <path> | remove <path>]");
                return 2;
            }
        }
    }

    // ----------------- trash -----------------

    private int runTrash(String[] args) {
        String target = null;
        boolean confirmed = false;
        for (String t : args) {
            if ("--yes".equals(t) || "-y".equals(t)) confirmed = true;
            else if (target == null) target = t;
            else {
                err.println("Unexpected argument: " + t);
                return 2;
            }
        }
        if (isBlank(target)) {
            err.println("Usage: trash <path> --yes");
            return 2;
        }
        if (!confirmed) {
            err.println("Refusing to move " + target + " to the trash without --yes");
            return 2;
        }

        var path = Path.of(target).toAbsolutePath().normalize();
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            err.println("No such file: " + path);
            return 2;
        }
        try {
            trash.moveToTrash(path);
            out.println("Moved to trash: " + path);
            return 0;
        } catch (TrashException e) {
            err.println("Move to trash failed: " + safeMsg(e));
            return 1;
        }
    }

    // ----------------- usage -----------------

    private void printUsage() {
        out.println("""
                Orbiter CLI
                Commands:
                  scan <path> [--depth <n>] [--top <n>] [--json <file>] [--expand <name>]...
                  volumes
                  favorites [list | add <path> | remove <path>]
                  trash <path> --yes
                  help
                """);
    }

    private void printScanUsage() {
        out.println("""
                Usage:
                  scan <path> [--depth <n>] [--top <n>] [--json <file>] [--expand <name>]...

                Examples:
                  scan ~/Downloads
                  scan /var/log --depth 4 --top 10 --json report.json --expand nginx
                """);
    }

    // ----------------- parsing -----------------

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Missing value for " + opt);
            return next();
        }
    }

    private record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    private record ScanArgs(String path, Integer depth, Integer top, String json, List<String> expand) {
        static ParseResult<ScanArgs> parse(String[] args) {
            String path = null, json = null;
            Integer depth = null, top = null;
            var expand = new ArrayList<String>();

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--depth" -> depth = positive("--depth", c.requireNext("--depth"));
                        case "--top" -> top = positive("--top", c.requireNext("--top"));
                        case "--json" -> json = c.requireNext("--json");
                        case "--expand" -> expand.add(c.requireNext("--expand"));
                        default -> {
                            if (t.startsWith("--") || path != null) {
                                return ParseResult.errorResult("Invalid option: " + t);
                            }
                            path = t;
                        }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }

            if (isBlank(path)) {
                return ParseResult.errorResult("Missing required argument: <path>");
            }
            return ParseResult.okResult(new ScanArgs(path, depth, top, json, List.copyOf(expand)));
        }

        private static int positive(String opt, String v) {
            int n;
            try {
                n = Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + opt + ": " + v);
            }
            if (n < 1) throw new IllegalArgumentException(opt + " must be >= 1");
            return n;
        }
    }

    // ----------------- misc -----------------

    private boolean addShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().addShutdownHook(hook);
            return true;
        } catch (IllegalStateException | SecurityException e) {
            logger.debug("No cancel hook: {}", safeMsg(e));
            return false;
        }
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
            logger.debug("Cancel hook not removed: {}", safeMsg(e));
        }
    }

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Error" : t.getClass().getSimpleName())
                : m;
    }

    private static String safeText(String v) {
        return isBlank(v) ? "-" : v;
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
