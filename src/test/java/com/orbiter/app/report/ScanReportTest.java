package com.orbiter.app.report;

import com.orbiter.app.scan.FileKind;
import com.orbiter.app.scan.FileSystemEntry;
import com.orbiter.app.scan.PercentageAnnotator;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScanReportTest {

    static FileSystemEntry sampleTree() {
        Path r = Path.of("/scan");
        var photos = FileSystemEntry.directory(r.resolve("photos"), "photos", List.of(
                FileSystemEntry.file(r.resolve("photos/a.jpg"), "a.jpg", 400),
                FileSystemEntry.file(r.resolve("photos/b.png"), "b.png", 200)));
        var docs = FileSystemEntry.directory(r.resolve("docs"), "docs", List.of(
                FileSystemEntry.file(r.resolve("docs/cv.pdf"), "cv.pdf", 50),
                FileSystemEntry.file(r.resolve("docs/notes.txt"), "notes.txt", 30)));
        var root = FileSystemEntry.directory(r, "scan", List.of(
                photos,
                docs,
                FileSystemEntry.pkg(r.resolve("Editor.app"), "Editor.app", 300),
                FileSystemEntry.file(r.resolve("disk.iso"), "disk.iso", 20)));
        PercentageAnnotator.annotate(root);
        return root;
    }

    @Test
    void summaryCountsEveryKindOfEntry() {
        var report = ScanReport.from(sampleTree(), ReportOptions.defaults());

        var s = report.summary();
        assertEquals("/scan", s.rootPath());
        assertEquals(5, s.files());
        assertEquals(3, s.directories());
        assertEquals(1, s.packages());
        assertEquals(1000, s.totalBytes());
    }

    @Test
    void topFilesKeepsLargestDescending() {
        var report = ScanReport.from(sampleTree(), new ReportOptions(3, 12, 4));

        var names = report.topFiles().stream().map(ScanReport.TopFile::name).toList();
        assertEquals(List.of("a.jpg", "Editor.app", "b.png"), names);
        assertEquals(40.0, report.topFiles().get(0).percentage(), 1e-9);
    }

    @Test
    void topFoldersExcludeRoot() {
        var report = ScanReport.from(sampleTree(), ReportOptions.defaults());

        var folders = report.topFolders();
        assertEquals(2, folders.size());
        assertEquals("photos", folders.get(0).name());
        assertEquals(600, folders.get(0).sizeBytes());
        assertEquals(2, folders.get(0).childCount());
        assertEquals("docs", folders.get(1).name());
    }

    @Test
    void byKindAggregatesBytesAndCounts() {
        var report = ScanReport.from(sampleTree(), ReportOptions.defaults());

        var byKind = report.byKind();
        assertEquals(FileKind.IMAGE, byKind.get(0).kind());
        assertEquals(600, byKind.get(0).bytes());
        assertEquals(2, byKind.get(0).count());

        var docs = byKind.stream().filter(k -> k.kind() == FileKind.DOCUMENT).findFirst().orElseThrow();
        assertEquals(80, docs.bytes());
        assertEquals(2, docs.count());

        var apps = byKind.stream().filter(k -> k.kind() == FileKind.APPLICATION).findFirst().orElseThrow();
        assertEquals(300, apps.bytes());
    }

    @Test
    void singleFileRootIsReported() {
        var f = FileSystemEntry.file(Path.of("/only.bin"), "only.bin", 9);

        var report = ScanReport.from(f, ReportOptions.defaults());

        assertEquals(1, report.summary().files());
        assertEquals(0, report.summary().directories());
        assertEquals(1, report.topFiles().size());
        assertTrue(report.topFolders().isEmpty());
    }

    @Test
    void formatsAreHumanReadable() {
        assertEquals("1 KB", Formats.bytes(1024));
        assertEquals("0 bytes", Formats.bytes(-5));
        assertEquals("42.5%", Formats.percent(42.5));
        assertEquals("12.3%", Formats.percent(12.345));

        var abbreviated = Formats.abbreviateMiddle("/very/long/path/to/some/deeply/nested/file.txt", 20);
        assertEquals(20, abbreviated.length());
        assertTrue(abbreviated.contains("..."));
        assertEquals("short", Formats.abbreviateMiddle("short", 20));
        assertEquals("", Formats.abbreviateMiddle(null, 20));
    }
}
