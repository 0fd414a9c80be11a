package com.orbiter.app.report;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.ToLongFunction;

import com.orbiter.app.scan.FileKind;
import com.orbiter.app.scan.FileSystemEntry;

import static java.util.Objects.requireNonNull;

/**
 * Summary of one scan result: totals, the largest files and folders and the space
 * taken by each kind of file.
 */
public record ScanReport(
        Summary summary,
        List<TopFile> topFiles,
        List<FolderStat> topFolders,
        List<KindStat> byKind
) {
    public static ScanReport from(FileSystemEntry root, ReportOptions opts) {
        requireNonNull(root, "root");
        requireNonNull(opts, "opts");

        long files = 0, dirs = 0, packages = 0;
        var kindAgg = new EnumMap<FileKind, long[]>(FileKind.class);

        // min-heaps, smallest on top
        var topFiles = new PriorityQueue<TopFile>(Comparator.comparingLong(TopFile::sizeBytes));
        var topFolders = new PriorityQueue<FolderStat>(Comparator.comparingLong(FolderStat::sizeBytes));

        var stack = new ArrayDeque<FileSystemEntry>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var e = stack.pop();

            if (e.isDirectory()) {
                dirs++;
                if (e != root) {
                    offer(topFolders, new FolderStat(e.name(), e.path().toString(), e.sizeBytes(),
                            e.percentageOfTotal(), e.childCount()), opts.topFolders(), FolderStat::sizeBytes);
                }
                for (var c : e.children()) stack.push(c);
                continue;
            }

            if (e.isPackage()) packages++;
            else files++;

            var agg = kindAgg.computeIfAbsent(e.fileKind(), __ -> new long[2]);
            agg[0] += e.sizeBytes();
            agg[1] += 1;

            offer(topFiles, new TopFile(e.name(), e.path().toString(), e.sizeBytes(), e.percentageOfTotal()),
                    opts.topFiles(), TopFile::sizeBytes);
        }

        var summary = new Summary(root.path().toString(), files, dirs, packages, root.sizeBytes());

        var fileList = new ArrayList<>(topFiles);
        fileList.sort(Comparator.comparingLong(TopFile::sizeBytes).reversed());

        var folderList = new ArrayList<>(topFolders);
        folderList.sort(Comparator.comparingLong(FolderStat::sizeBytes).reversed());

        var kinds = new ArrayList<KindStat>(kindAgg.size());
        kindAgg.forEach((k, a) -> kinds.add(new KindStat(k, a[0], a[1])));
        kinds.sort(Comparator.comparingLong(KindStat::bytes).reversed());

        return new ScanReport(summary, List.copyOf(fileList), List.copyOf(folderList), List.copyOf(kinds));
    }

    public record Summary(String rootPath, long files, long directories, long packages, long totalBytes) {}

    public record TopFile(String name, String path, long sizeBytes, double percentage) {}
    public record FolderStat(String name, String path, long sizeBytes, double percentage, int childCount) {}
    public record KindStat(FileKind kind, long bytes, long count) {}

    private static <T> void offer(PriorityQueue<T> pq, T item, int limit,
                                  ToLongFunction<T> size) {
        if (pq.size() < limit) {
            pq.add(item);
        } else if (size.applyAsLong(item) > size.applyAsLong(Objects.requireNonNull(pq.peek()))) {
            pq.poll();
            pq.add(item);
        }
    }
}
