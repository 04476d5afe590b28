package com.ai.codescope.model;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extension based language and binary-type lookup.
 */
public final class Languages {

    public static final String UNKNOWN = "text";

    // Binary extensions to skip
    private static final Set<String> BINARY_EXTENSIONS = Set.of(
            "png", "jpg", "jpeg", "gif", "webp", "ico", "bmp",
            "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx",
            "zip", "tar", "gz", "rar", "7z", "jar", "war", "class",
            "exe", "dll", "so", "dylib", "o", "a", "lib", "bin",
            "mp3", "mp4", "avi", "mov", "wav",
            "ttf", "otf", "woff", "woff2", "eot");

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("kts", "kotlin"),
            Map.entry("scala", "scala"),
            Map.entry("rs", "rust"),
            Map.entry("go", "go"),
            Map.entry("c", "c"),
            Map.entry("h", "c"),
            Map.entry("cc", "cpp"),
            Map.entry("cpp", "cpp"),
            Map.entry("cxx", "cpp"),
            Map.entry("hpp", "cpp"),
            Map.entry("hxx", "cpp"),
            Map.entry("cs", "csharp"),
            Map.entry("swift", "swift"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("cjs", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("py", "python"),
            Map.entry("pyi", "python"),
            Map.entry("rb", "ruby"),
            Map.entry("lua", "lua"),
            Map.entry("sh", "shell"),
            Map.entry("bash", "shell"),
            Map.entry("zsh", "shell"),
            Map.entry("ps1", "powershell"),
            Map.entry("sql", "sql"),
            Map.entry("html", "html"),
            Map.entry("htm", "html"),
            Map.entry("vue", "vue"),
            Map.entry("svelte", "svelte"),
            Map.entry("css", "css"),
            Map.entry("scss", "css"),
            Map.entry("less", "css"),
            Map.entry("json", "json"),
            Map.entry("yaml", "yaml"),
            Map.entry("yml", "yaml"),
            Map.entry("toml", "toml"),
            Map.entry("xml", "xml"),
            Map.entry("ini", "ini"),
            Map.entry("cfg", "ini"),
            Map.entry("conf", "ini"),
            Map.entry("properties", "properties"),
            Map.entry("md", "markdown"),
            Map.entry("rst", "restructuredtext"),
            Map.entry("txt", "text"),
            Map.entry("gradle", "gradle"),
            Map.entry("cmake", "cmake"));

    private static final Map<String, String> BY_FILENAME = Map.of(
            "dockerfile", "dockerfile",
            "makefile", "make",
            "cmakelists.txt", "cmake",
            "gemfile", "ruby",
            "rakefile", "ruby");

    private Languages() {
    }

    public static String forFilename(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        String byName = BY_FILENAME.get(lower);
        if (byName != null) {
            return byName;
        }
        int dot = lower.lastIndexOf('.');
        if (dot <= 0) {
            return UNKNOWN;
        }
        return BY_EXTENSION.getOrDefault(lower.substring(dot + 1), UNKNOWN);
    }

    public static boolean isBinaryExtension(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot >= 0 && BINARY_EXTENSIONS.contains(lower.substring(dot + 1));
    }
}
