package com.orbiter.app.system;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import oshi.SystemInfo;
import oshi.software.os.FileSystem;
import oshi.software.os.OSFileStore;

/**
 * Mounted local volumes, for picking a scan root.
 */
public class VolumeService {

    private static final Logger logger = LoggerFactory.getLogger(VolumeService.class);

    private static final String ROOT_MOUNT = "/";
    private static final String SYSTEM_VOLUMES_PREFIX = "/System/Volumes";

    private final FileSystem fs;

    public VolumeService() {
        this.fs = new SystemInfo().getOperatingSystem().getFileSystem();
    }

    public record Volume(String name, String mount, String type, long totalBytes, long usableBytes) {
        public long usedBytes() {
            return Math.max(0L, totalBytes - usableBytes);
        }

        public double usedPct() {
            return totalBytes <= 0 ? 0.0 : (usedBytes() * 100.0) / totalBytes;
        }
    }

    /**
     * Local volumes, the root mount first, without macOS system sub-volumes and with
     * one entry per mount point.
     */
    public List<Volume> listVolumes() {
        var byMount = new LinkedHashMap<String, Volume>();
        Volume root = null;

        for (OSFileStore s : fs.getFileStores(true)) {
            String mount = s.getMount();
            if (mount == null || mount.isBlank()) continue;
            if (mount.startsWith(SYSTEM_VOLUMES_PREFIX)) continue;
            if (byMount.containsKey(mount)) continue;

            long total = safeNonNeg(s.getTotalSpace());
            long usable = Math.min(safeNonNeg(s.getUsableSpace()), total);
            var v = new Volume(displayName(s), mount, s.getType(), total, usable);
            if (ROOT_MOUNT.equals(mount)) root = v;
            else byMount.put(mount, v);
        }

        var out = new ArrayList<Volume>(byMount.size() + 1);
        if (root != null) out.add(root);
        out.addAll(byMount.values());
        logger.debug("Found {} volumes", out.size());
        return out;
    }

    private static String displayName(OSFileStore s) {
        String label = s.getLabel();
        if (label != null && !label.isBlank()) return label;
        String name = s.getName();
        return (name == null || name.isBlank()) ? s.getMount() : name;
    }

    private static long safeNonNeg(long v) {
        return Math.max(0L, v);
    }
}
