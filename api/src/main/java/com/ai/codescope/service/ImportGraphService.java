package com.ai.codescope.service;

import com.ai.codescope.model.ContentSource;
import com.ai.codescope.model.Deadline;
import com.ai.codescope.model.ImportEdge;
import com.ai.codescope.model.ImportGraph;
import com.ai.codescope.model.IndexedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the file-level import graph from import statements found with per-language
 * patterns. Specifiers that map onto an indexed file become resolved edges; everything
 * else (third-party packages, system headers) stays as an unresolved edge.
 */
@Service
public class ImportGraphService {

    private static final Logger log = LoggerFactory.getLogger(ImportGraphService.class);

    private static final Pattern JVM_IMPORT = Pattern.compile(
            "^\\s*import\\s+(?:static\\s+)?([\\w.]+?)(?:\\.\\*)?(?:\\s+as\\s+\\w+)?\\s*;?\\s*$", Pattern.MULTILINE);
    private static final Pattern JS_FROM = Pattern.compile(
            "^\\s*(?:import|export)\\b[^'\"`;]*?\\bfrom\\s*['\"]([^'\"]+)['\"]", Pattern.MULTILINE);
    private static final Pattern JS_BARE_IMPORT = Pattern.compile(
            "^\\s*import\\s*['\"]([^'\"]+)['\"]", Pattern.MULTILINE);
    private static final Pattern JS_REQUIRE = Pattern.compile(
            "\\b(?:require|import)\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");
    private static final Pattern PY_IMPORT = Pattern.compile(
            "^\\s*import\\s+([\\w.]+(?:\\s+as\\s+\\w+)?(?:\\s*,\\s*[\\w.]+(?:\\s+as\\s+\\w+)?)*)", Pattern.MULTILINE);
    private static final Pattern PY_FROM = Pattern.compile(
            "^\\s*from\\s+(\\.*[\\w.]*)\\s+import\\b", Pattern.MULTILINE);
    private static final Pattern RUST_MOD = Pattern.compile(
            "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?mod\\s+(\\w+)\\s*;", Pattern.MULTILINE);
    private static final Pattern GO_SINGLE = Pattern.compile(
            "^\\s*import\\s+(?:[\\w.]+\\s+)?\"([^\"]+)\"", Pattern.MULTILINE);
    private static final Pattern GO_BLOCK = Pattern.compile(
            "^\\s*import\\s*\\((.*?)\\)", Pattern.MULTILINE | Pattern.DOTALL);
    private static final Pattern GO_BLOCK_ENTRY = Pattern.compile("\"([^\"]+)\"");
    private static final Pattern C_INCLUDE = Pattern.compile(
            "^\\s*#\\s*include\\s*[\"<]([^\">]+)[\">]", Pattern.MULTILINE);

    private static final List<String> JS_PROBES = List.of(
            "", ".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs", ".d.ts",
            "/index.ts", "/index.tsx", "/index.js", "/index.jsx");

    private final ParallelFileScanner scanner;

    public ImportGraphService(ParallelFileScanner scanner) {
        this.scanner = scanner;
    }

    public ImportGraph build(List<IndexedFile> files, ContentSource content) {
        PathIndex index = new PathIndex(files);

        List<List<String>> specifiers = scanner.scan(files,
                file -> content.read(file.path())
                        .map(text -> extractSpecifiers(file, text))
                        .orElse(List.of()),
                List.of(),
                Deadline.none());

        Map<String, List<ImportEdge>> imports = new TreeMap<>();
        Map<String, Set<String>> importedBy = new TreeMap<>();
        int resolvedCount = 0;
        int edgeCount = 0;

        for (int i = 0; i < files.size(); i++) {
            IndexedFile file = files.get(i);
            Map<String, ImportEdge> edges = new LinkedHashMap<>();
            for (String spec : specifiers.get(i)) {
                Optional<String> target = resolve(file, spec, index);
                ImportEdge edge = target
                        .map(to -> new ImportEdge(file.path(), to, true))
                        .orElseGet(() -> new ImportEdge(file.path(), spec, false));
                if (edge.resolved() && edge.to().equals(file.path())) {
                    continue;
                }
                edges.putIfAbsent(edge.to(), edge);
            }
            if (edges.isEmpty()) {
                continue;
            }
            imports.put(file.path(), List.copyOf(edges.values()));
            for (ImportEdge edge : edges.values()) {
                edgeCount++;
                if (edge.resolved()) {
                    resolvedCount++;
                    importedBy.computeIfAbsent(edge.to(), k -> new TreeSet<>()).add(file.path());
                }
            }
        }

        Map<String, List<String>> reverse = new TreeMap<>();
        importedBy.forEach((to, from) -> reverse.put(to, List.copyOf(from)));

        log.info("[ImportGraphService] {} files with imports, {} edges ({} resolved)",
                imports.size(), edgeCount, resolvedCount);
        return new ImportGraph(Collections.unmodifiableMap(imports), Collections.unmodifiableMap(reverse));
    }

    /**
     * Raw import specifiers of one file, in source order, without duplicates.
     */
    static List<String> extractSpecifiers(IndexedFile file, String content) {
        Set<String> specs = new LinkedHashSet<>();
        switch (file.extension()) {
            case "java", "kt", "kts", "scala", "groovy" -> collect(JVM_IMPORT, content, specs);
            case "js", "jsx", "ts", "tsx", "mjs", "cjs", "vue", "svelte" -> {
                collect(JS_FROM, content, specs);
                collect(JS_BARE_IMPORT, content, specs);
                collect(JS_REQUIRE, content, specs);
            }
            case "py", "pyi" -> {
                Matcher m = PY_IMPORT.matcher(content);
                while (m.find()) {
                    for (String part : m.group(1).split(",")) {
                        String name = part.trim().split("\\s+")[0];
                        if (!name.isEmpty()) {
                            specs.add(name);
                        }
                    }
                }
                collect(PY_FROM, content, specs);
            }
            case "rs" -> collect(RUST_MOD, content, specs);
            case "go" -> {
                collect(GO_SINGLE, content, specs);
                Matcher block = GO_BLOCK.matcher(content);
                while (block.find()) {
                    collect(GO_BLOCK_ENTRY, block.group(1), specs);
                }
            }
            case "c", "h", "cc", "cpp", "cxx", "hpp", "hxx", "m", "mm" -> collect(C_INCLUDE, content, specs);
            default -> {
            }
        }
        return new ArrayList<>(specs);
    }

    private static void collect(Pattern pattern, String content, Set<String> into) {
        Matcher m = pattern.matcher(content);
        while (m.find()) {
            String spec = m.group(1).trim();
            if (!spec.isEmpty()) {
                into.add(spec);
            }
        }
    }

    static Optional<String> resolve(IndexedFile from, String spec, PathIndex index) {
        String dir = from.directory();
        return switch (from.extension()) {
            case "java", "kt", "kts", "scala", "groovy" -> resolveDotted(spec, List.of(".java", ".kt", ".scala", ".groovy"), index, true);
            case "js", "jsx", "ts", "tsx", "mjs", "cjs", "vue", "svelte" -> resolveJs(dir, spec, index);
            case "py", "pyi" -> resolvePython(dir, spec, index);
            case "rs" -> index.firstExisting(List.of(join(dir, spec + ".rs"), join(dir, spec + "/mod.rs")));
            case "go" -> index.firstInDirectoryMatching(spec, ".go");
            case "c", "h", "cc", "cpp", "cxx", "hpp", "hxx", "m", "mm" -> {
                Optional<String> local = index.firstExisting(List.of(join(dir, spec), normalize(spec).orElse("")));
                yield local.isPresent() ? local : index.bySuffix(spec);
            }
            default -> Optional.empty();
        };
    }

    private static Optional<String> resolveDotted(String spec, List<String> extensions, PathIndex index,
                                                  boolean allowMemberImport) {
        String asPath = spec.replace('.', '/');
        for (String ext : extensions) {
            Optional<String> hit = index.bySuffix(asPath + ext);
            if (hit.isPresent()) {
                return hit;
            }
        }
        int lastDot = spec.lastIndexOf('.');
        if (allowMemberImport && lastDot > 0) {
            // static member or nested type import
            return resolveDotted(spec.substring(0, lastDot), extensions, index, false);
        }
        return Optional.empty();
    }

    private static Optional<String> resolveJs(String dir, String spec, PathIndex index) {
        if (!spec.startsWith(".")) {
            return Optional.empty();
        }
        Optional<String> base = normalize(join(dir, spec));
        if (base.isEmpty()) {
            return Optional.empty();
        }
        List<String> candidates = new ArrayList<>(JS_PROBES.size());
        for (String probe : JS_PROBES) {
            candidates.add(base.get() + probe);
        }
        return index.firstExisting(candidates);
    }

    private static Optional<String> resolvePython(String dir, String spec, PathIndex index) {
        int dots = 0;
        while (dots < spec.length() && spec.charAt(dots) == '.') {
            dots++;
        }
        String module = spec.substring(dots).replace('.', '/');
        if (dots > 0) {
            String base = dir;
            for (int i = 1; i < dots; i++) {
                base = parent(base);
            }
            String target = module.isEmpty() ? base : join(base, module);
            return index.firstExisting(List.of(target + ".py", join(target, "__init__.py")));
        }
        Optional<String> sibling = index.firstExisting(List.of(
                join(dir, module + ".py"), join(dir, module + "/__init__.py")));
        if (sibling.isPresent()) {
            return sibling;
        }
        Optional<String> bySuffix = index.bySuffix(module + ".py");
        return bySuffix.isPresent() ? bySuffix : index.bySuffix(module + "/__init__.py");
    }

    static String join(String dir, String rel) {
        return ".".equals(dir) || dir.isEmpty() ? rel : dir + "/" + rel;
    }

    private static String parent(String dir) {
        int slash = dir.lastIndexOf('/');
        return slash < 0 ? "." : dir.substring(0, slash);
    }

    /**
     * Collapses {@code .} and {@code ..} segments; empty if the path climbs above the root.
     */
    static Optional<String> normalize(String path) {
        Deque<String> parts = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (parts.isEmpty()) {
                    return Optional.empty();
                }
                parts.removeLast();
            } else {
                parts.addLast(segment);
            }
        }
        return parts.isEmpty() ? Optional.empty() : Optional.of(String.join("/", parts));
    }

    /**
     * Lookup structure over the indexed paths of one build.
     */
    static final class PathIndex {

        private final Set<String> paths;
        private final Map<String, List<String>> byFilename = new HashMap<>();
        private final Map<String, List<String>> byDirectory = new HashMap<>();

        PathIndex(List<IndexedFile> files) {
            this.paths = new TreeSet<>();
            for (IndexedFile file : files) {
                paths.add(file.path());
            }
            for (String path : paths) {
                int slash = path.lastIndexOf('/');
                String name = slash < 0 ? path : path.substring(slash + 1);
                String dir = slash < 0 ? "." : path.substring(0, slash);
                byFilename.computeIfAbsent(name, k -> new ArrayList<>()).add(path);
                byDirectory.computeIfAbsent(dir, k -> new ArrayList<>()).add(path);
            }
        }

        Optional<String> firstExisting(List<String> candidates) {
            for (String candidate : candidates) {
                Optional<String> normalized = normalize(candidate);
                if (normalized.isPresent() && paths.contains(normalized.get())) {
                    return normalized;
                }
            }
            return Optional.empty();
        }

        /**
         * First path (in path order) equal to {@code suffix} or ending with {@code /suffix}.
         */
        Optional<String> bySuffix(String suffix) {
            Optional<String> normalized = normalize(suffix);
            if (normalized.isEmpty()) {
                return Optional.empty();
            }
            String target = normalized.get();
            String name = target.substring(target.lastIndexOf('/') + 1);
            for (String path : byFilename.getOrDefault(name, List.of())) {
                if (path.equals(target) || path.endsWith("/" + target)) {
                    return Optional.of(path);
                }
            }
            return Optional.empty();
        }

        /**
         * First file with {@code extension} in the deepest-matching directory whose path is a
         * suffix of the package path, e.g. {@code example.com/app/util} matches {@code util/}.
         */
        Optional<String> firstInDirectoryMatching(String packagePath, String extension) {
            String[] segments = packagePath.split("/");
            for (int start = 0; start < segments.length; start++) {
                String dir = String.join("/", Arrays.copyOfRange(segments, start, segments.length));
                for (String path : byDirectory.getOrDefault(dir, List.of())) {
                    if (path.endsWith(extension) && !path.endsWith("_test" + extension)) {
                        return Optional.of(path);
                    }
                }
            }
            return Optional.empty();
        }
    }
}
