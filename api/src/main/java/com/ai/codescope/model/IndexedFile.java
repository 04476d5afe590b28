package com.ai.codescope.model;

import java.util.Locale;

/**
 * One file of a repository snapshot. Immutable for the lifetime of the snapshot.
 *
 * @param path     slash-separated path relative to the repository root, unique within a snapshot
 * @param filename basename of {@code path}
 * @param language language name derived from the extension ("text" when unknown)
 * @param byteSize size of the file on disk in bytes
 */
public record IndexedFile(
        String path,
        String filename,
        String language,
        long byteSize) {

    public static IndexedFile of(String path, long byteSize) {
        String filename = path.contains("/") ? path.substring(path.lastIndexOf('/') + 1) : path;
        return new IndexedFile(path, filename, Languages.forFilename(filename), byteSize);
    }

    /**
     * Filename without its last extension ("main.rs" gives "main", ".gitignore" stays whole).
     */
    public String stem() {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    /**
     * Lower-cased last extension without the dot, or an empty string.
     */
    public String extension() {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Parent directory path, "." for files at the repository root.
     */
    public String directory() {
        int slash = path.lastIndexOf('/');
        return slash > 0 ? path.substring(0, slash) : ".";
    }
}
