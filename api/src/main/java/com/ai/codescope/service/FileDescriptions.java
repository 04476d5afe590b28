package com.ai.codescope.service;

import java.util.Locale;

/**
 * Human-readable one-line description derived from a file name:
 * the stem split into words plus a kind hint, e.g. "HttpServerConfig.java" gives
 * "Http Server Config (source)".
 */
public final class FileDescriptions {

    private FileDescriptions() {
    }

    public static String describe(String path) {
        String filename = path.contains("/") ? path.substring(path.lastIndexOf('/') + 1) : path;
        int dot = filename.lastIndexOf('.');
        String stem = dot > 0 ? filename.substring(0, dot) : filename;
        String ext = dot > 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";

        String words = splitWords(stem);
        String hint = hint(ext);
        return hint.isEmpty() ? words : words + " (" + hint + ")";
    }

    static String splitWords(String stem) {
        StringBuilder words = new StringBuilder();
        for (int i = 0; i < stem.length(); i++) {
            char c = stem.charAt(i);
            if (i > 0) {
                char prev = stem.charAt(i - 1);
                boolean camelBoundary = Character.isLowerCase(prev) && Character.isUpperCase(c);
                boolean acronymEnd = Character.isUpperCase(prev) && Character.isUpperCase(c)
                        && i + 1 < stem.length() && Character.isLowerCase(stem.charAt(i + 1));
                if (camelBoundary || acronymEnd) {
                    words.append(' ');
                }
            }
            words.append(c == '_' || c == '-' ? ' ' : c);
        }
        return words.toString().trim().replaceAll("\\s+", " ");
    }

    static String hint(String ext) {
        return switch (ext) {
            case "h", "hpp", "hxx" -> "header";
            case "cpp", "cxx", "cc", "c" -> "impl";
            case "usf", "ush", "hlsl", "glsl", "vert", "frag", "comp", "wgsl" -> "shader";
            case "ini", "cfg", "conf", "toml", "yaml", "yml", "json", "xml", "properties" -> "config";
            case "py", "rb", "lua", "sh", "bash", "zsh", "ps1", "psm1", "psd1", "bat", "cmd" -> "script";
            case "csproj", "sln", "cmake", "make", "gradle", "props", "targets" -> "build";
            case "cs", "js", "ts", "jsx", "tsx", "mjs", "cjs", "rs", "go", "java", "kt", "scala", "swift" -> "source";
            case "css", "scss", "less", "sass" -> "style";
            case "html", "htm", "vue", "svelte" -> "template";
            case "md", "rst", "txt", "adoc" -> "doc";
            default -> "";
        };
    }
}
