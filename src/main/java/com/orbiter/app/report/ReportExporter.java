package com.orbiter.app.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.orbiter.app.scan.FileSystemEntry;

import static java.util.Objects.requireNonNull;

/**
 * JSON export of a scan result and its report.
 */
public final class ReportExporter {

    private static final Logger logger = LoggerFactory.getLogger(ReportExporter.class);

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ReportExporter() {}

    /**
     * The tree under {@code root} as JSON. Nodes at {@code maxDepth} (root is 0) keep
     * their size and child count but not their children.
     */
    public static ObjectNode toJson(FileSystemEntry root, int maxDepth) {
        requireNonNull(root, "root");
        return node(root, 0, Math.max(0, maxDepth));
    }

    public static ObjectNode toJson(FileSystemEntry root, ScanReport report, int maxDepth) {
        requireNonNull(report, "report");
        var doc = mapper.createObjectNode();
        doc.set("summary", mapper.valueToTree(report.summary()));
        doc.set("topFiles", mapper.valueToTree(report.topFiles()));
        doc.set("topFolders", mapper.valueToTree(report.topFolders()));

        ArrayNode kinds = doc.putArray("byKind");
        for (var k : report.byKind()) {
            kinds.addObject()
                    .put("kind", k.kind().name().toLowerCase(Locale.ROOT))
                    .put("bytes", k.bytes())
                    .put("count", k.count());
        }

        doc.set("tree", toJson(root, maxDepth));
        return doc;
    }

    public static void writeJson(Path file, FileSystemEntry root, ScanReport report, int maxDepth) throws IOException {
        requireNonNull(file, "file");
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        mapper.writeValue(file.toFile(), toJson(root, report, maxDepth));
        logger.info("Report written to {}", file.toAbsolutePath());
    }

    private static ObjectNode node(FileSystemEntry e, int depth, int maxDepth) {
        var n = mapper.createObjectNode();
        n.put("name", e.name());
        n.put("path", e.path().toString());
        n.put("kind", e.kind().name().toLowerCase(Locale.ROOT));
        n.put("sizeBytes", e.sizeBytes());
        n.put("size", e.formattedSize());
        n.put("percentage", Math.round(e.percentageOfTotal() * 100.0) / 100.0);

        if (e.isDirectory()) {
            n.put("childCount", e.childCount());
            if (depth < maxDepth) {
                var children = n.putArray("children");
                for (var c : e.children()) children.add(node(c, depth + 1, maxDepth));
            }
        }
        return n;
    }
}
