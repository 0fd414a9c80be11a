package com.orbiter.app.scan;

import java.util.Locale;

/**
 * Display category of an entry, picked from its extension.
 */
public enum FileKind {
    FOLDER,
    IMAGE,
    VIDEO,
    AUDIO,
    DOCUMENT,
    ARCHIVE,
    APPLICATION,
    DISK_IMAGE,
    OTHER;

    static FileKind of(EntryKind kind, String fileName) {
        if (kind == EntryKind.DIRECTORY) return FOLDER;

        String ext = extensionOf(fileName);
        return switch (ext) {
            case "jpg", "jpeg", "png", "gif", "heic", "webp" -> IMAGE;
            case "mp4", "mov", "avi", "mkv" -> VIDEO;
            case "mp3", "wav", "flac", "aac" -> AUDIO;
            case "pdf", "doc", "docx", "txt", "md", "rtf" -> DOCUMENT;
            case "zip", "rar", "7z", "tar", "gz" -> ARCHIVE;
            case "app", "exe" -> APPLICATION;
            case "dmg", "iso", "img" -> DISK_IMAGE;
            default -> kind == EntryKind.PACKAGE ? APPLICATION : OTHER;
        };
    }

    static String extensionOf(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) return "";
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
