package com.ai.codescope.service;

import com.ai.codescope.model.IndexedFile;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Optional narrowing of grep/find candidates by extension and manifest category.
 *
 * @param extensions lower-cased extensions without the dot, empty for no extension filter
 * @param category   category-path prefix (e.g. "web > components"), null for no category filter
 */
public record PathFilter(Set<String> extensions, String category) {

    public static final PathFilter NONE = new PathFilter(Set.of(), null);

    /**
     * @param ext comma-separated extensions, leading dot optional ("ts,.tsx")
     * @param cat category-path prefix as produced by the manifest
     */
    public static PathFilter of(String ext, String cat) {
        Set<String> extensions = ext == null ? Set.of() : Arrays.stream(ext.split(","))
                .map(String::trim)
                .map(e -> e.startsWith(".") ? e.substring(1) : e)
                .filter(e -> !e.isEmpty())
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        String category = cat == null || cat.isBlank() ? null : cat.trim();
        return new PathFilter(extensions, category);
    }

    public boolean isEmpty() {
        return extensions.isEmpty() && category == null;
    }

    public boolean matches(IndexedFile file) {
        if (!extensions.isEmpty() && !extensions.contains(file.extension())) {
            return false;
        }
        return category == null || ManifestService.category(file.path()).startsWith(category);
    }

    /**
     * Matching files, index order preserved.
     */
    public List<IndexedFile> apply(List<IndexedFile> files) {
        if (isEmpty()) {
            return files;
        }
        return files.stream().filter(this::matches).toList();
    }
}
