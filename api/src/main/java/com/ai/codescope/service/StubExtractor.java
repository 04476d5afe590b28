package com.ai.codescope.service;

import com.ai.codescope.model.IndexedFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural summary of a file used in place of its content when a context budget runs out:
 * a header line naming the file, then declarations and signatures with bodies collapsed.
 */
@Service
public class StubExtractor {

    static final int FALLBACK_LINES = 40;
    static final int INI_ENTRIES_PER_SECTION = 5;

    private static final Pattern STRUCTURAL_KEYWORD = Pattern.compile(
            "\\b(class|interface|enum|record|struct|trait|impl|namespace|mod|module|object|union|protocol|extension)\\b");

    private static final List<String> KEPT_PREFIXES = List.of(
            "#", "import ", "package ", "using ", "use ", "mod ", "from ", "extern ", "typedef ", "template",
            "@", "export ", "pub use ", "pub mod ");

    enum LanguageFamily {
        BRACE_BASED,
        INDENT_BASED,
        CONFIG_INI,
        CONFIG_STRUCTURED,
        UNKNOWN
    }

    private final ObjectMapper objectMapper;

    public StubExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String extract(IndexedFile file, String content) {
        String body = switch (family(file.extension())) {
            case BRACE_BASED -> stubBraceBased(content);
            case INDENT_BASED -> stubIndentBased(content);
            case CONFIG_INI -> stubIni(content);
            case CONFIG_STRUCTURED -> stubStructured(file.extension(), content);
            case UNKNOWN -> stubFallback(content);
        };
        return header(file) + body;
    }

    /**
     * One comment line naming the file and what it is.
     */
    public String header(IndexedFile file) {
        return commentPrefix(file.extension()) + " " + file.path() + " - " + FileDescriptions.describe(file.path())
                + "\n";
    }

    static LanguageFamily family(String ext) {
        return switch (ext) {
            case "h", "hpp", "hxx", "cpp", "cxx", "cc", "c", "cs", "java", "kt", "kts", "scala", "rs", "go",
                    "js", "ts", "jsx", "tsx", "mjs", "cjs", "swift", "usf", "ush", "hlsl", "glsl", "vert",
                    "frag", "comp", "wgsl", "d", "ps1", "psm1", "psd1", "groovy", "gradle" ->
                    LanguageFamily.BRACE_BASED;
            case "py", "pyi", "rb" -> LanguageFamily.INDENT_BASED;
            case "ini", "cfg", "conf", "properties" -> LanguageFamily.CONFIG_INI;
            case "json", "yaml", "yml", "toml", "xml" -> LanguageFamily.CONFIG_STRUCTURED;
            default -> LanguageFamily.UNKNOWN;
        };
    }

    private static String commentPrefix(String ext) {
        return switch (ext) {
            case "py", "pyi", "rb", "sh", "bash", "zsh", "yaml", "yml", "toml", "ini", "cfg", "conf",
                    "properties", "ps1", "txt", "md" -> "#";
            case "sql", "lua" -> "--";
            default -> "//";
        };
    }

    // ---- brace-based languages ----

    static String stubBraceBased(String content) {
        StringBuilder out = new StringBuilder();
        String[] lines = content.split("\n", -1);
        int depth = 0;
        int skipUntilDepth = -1;
        boolean inBlockComment = false;
        String previous = "";

        for (String raw : lines) {
            String line = stripCr(raw);
            String trimmed = line.trim();

            if (inBlockComment) {
                if (trimmed.contains("*/")) {
                    inBlockComment = false;
                }
                continue;
            }

            if (skipUntilDepth >= 0) {
                depth += braceDelta(line);
                if (depth <= skipUntilDepth) {
                    skipUntilDepth = -1;
                }
                continue;
            }

            if (trimmed.isEmpty() || trimmed.startsWith("//")) {
                continue;
            }
            if (trimmed.startsWith("/*")) {
                if (!trimmed.contains("*/")) {
                    inBlockComment = true;
                }
                continue;
            }
            if (startsWithKeptPrefix(trimmed)) {
                out.append(line).append('\n');
                previous = trimmed;
                continue;
            }

            int open = line.indexOf('{');
            int delta = braceDelta(line);
            if (open < 0) {
                // Declarations, fields, closing braces of kept scopes
                out.append(line).append('\n');
                depth = Math.max(0, depth + delta);
                previous = trimmed;
                continue;
            }

            String beforeBrace = line.substring(0, open);
            String signature = beforeBrace.isBlank() ? previous : beforeBrace;
            if (isStructural(signature)) {
                out.append(line).append('\n');
                depth = Math.max(0, depth + delta);
            } else {
                out.append(beforeBrace.isBlank() ? line.substring(0, open) : beforeBrace.stripTrailing())
                        .append(beforeBrace.isBlank() ? "{ ... }" : " { ... }")
                        .append('\n');
                if (delta > 0) {
                    skipUntilDepth = depth;
                    depth += delta;
                }
            }
            previous = trimmed;
        }
        return out.toString();
    }

    static boolean isStructural(String signature) {
        String text = signature.trim();
        if (text.endsWith("=") || text.endsWith("->") || text.endsWith("=>")) {
            return false;
        }
        Matcher keyword = STRUCTURAL_KEYWORD.matcher(text);
        if (!keyword.find()) {
            return false;
        }
        int paren = text.indexOf('(');
        return paren < 0 || keyword.start() < paren;
    }

    private static boolean startsWithKeptPrefix(String trimmed) {
        for (String prefix : KEPT_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return !trimmed.contains("{") || trimmed.endsWith("}") || trimmed.endsWith(";");
            }
        }
        return false;
    }

    private static int braceDelta(String line) {
        int delta = 0;
        boolean inString = false;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    inString = false;
                }
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                inString = true;
                quote = c;
            } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            } else if (c == '{') {
                delta++;
            } else if (c == '}') {
                delta--;
            }
        }
        return delta;
    }

    // ---- indent-based languages ----

    static String stubIndentBased(String content) {
        StringBuilder out = new StringBuilder();
        boolean skipBody = false;
        int bodyIndent = 0;

        for (String raw : content.split("\n", -1)) {
            String line = stripCr(raw);
            String trimmed = line.trim();
            int indent = line.length() - line.stripLeading().length();

            if (skipBody) {
                if (!trimmed.isEmpty() && indent <= bodyIndent) {
                    skipBody = false;
                } else {
                    continue;
                }
            }

            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith("import ") || trimmed.startsWith("from ") || trimmed.startsWith("@")
                    || trimmed.startsWith("require ") || trimmed.startsWith("class ")
                    || trimmed.startsWith("module ")) {
                out.append(line).append('\n');
            } else if (trimmed.startsWith("def ") || trimmed.startsWith("async def ")) {
                out.append(line).append('\n');
                out.append(" ".repeat(indent + 4)).append("...\n");
                bodyIndent = indent;
                skipBody = true;
            } else if (indent == 0 && !trimmed.startsWith("#")) {
                out.append(line).append('\n');
            }
        }
        return out.toString();
    }

    // ---- configuration files ----

    static String stubIni(String content) {
        StringBuilder out = new StringBuilder();
        int entriesInSection = 0;

        for (String raw : content.split("\n", -1)) {
            String line = stripCr(raw);
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(";") || trimmed.startsWith("#")) {
                continue;
            }
            if (trimmed.startsWith("[")) {
                entriesInSection = 0;
                out.append(line).append('\n');
                continue;
            }
            entriesInSection++;
            if (entriesInSection <= INI_ENTRIES_PER_SECTION) {
                out.append(line).append('\n');
            } else if (entriesInSection == INI_ENTRIES_PER_SECTION + 1) {
                out.append("; ... (more entries)\n");
            }
        }
        return out.toString();
    }

    String stubStructured(String ext, String content) {
        return switch (ext) {
            case "json" -> stubJson(content);
            case "yaml", "yml", "toml" -> stubTopLevelLines(content);
            case "xml" -> stubXml(content);
            default -> stubFallback(content);
        };
    }

    private String stubJson(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            return stubFallback(content);
        }
        if (root == null || !root.isObject()) {
            return stubFallback(content);
        }

        StringBuilder out = new StringBuilder("{\n");
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            out.append("  \"").append(field.getKey()).append("\": ").append(summarize(field.getValue()));
            out.append(fields.hasNext() ? ",\n" : "\n");
        }
        return out.append("}\n").toString();
    }

    private static String summarize(JsonNode node) {
        if (node.isObject()) {
            return node.isEmpty() ? "{}" : "{ ... " + node.size() + " keys }";
        }
        if (node.isArray()) {
            return node.isEmpty() ? "[]" : "[ ... " + node.size() + " items ]";
        }
        return node.toString();
    }

    static String stubTopLevelLines(String content) {
        StringBuilder out = new StringBuilder();
        for (String raw : content.split("\n", -1)) {
            String line = stripCr(raw);
            if (line.isBlank() || line.startsWith("#") || Character.isWhitespace(line.charAt(0))
                    || line.startsWith("-")) {
                continue;
            }
            out.append(line).append('\n');
        }
        return out.toString();
    }

    /**
     * Root element and its direct children, assuming conventional indentation.
     */
    static String stubXml(String content) {
        StringBuilder out = new StringBuilder();
        for (String raw : content.split("\n", -1)) {
            String line = stripCr(raw);
            String trimmed = line.trim();
            if (!trimmed.startsWith("<") || trimmed.startsWith("<!--")) {
                continue;
            }
            int indent = line.length() - line.stripLeading().length();
            if (indent <= 4) {
                out.append(line).append('\n');
            }
        }
        return out.toString();
    }

    static String stubFallback(String content) {
        String[] lines = content.split("\n", -1);
        StringBuilder out = new StringBuilder();
        int kept = Math.min(lines.length, FALLBACK_LINES);
        for (int i = 0; i < kept; i++) {
            out.append(stripCr(lines[i])).append('\n');
        }
        if (lines.length > FALLBACK_LINES) {
            out.append("... (truncated at ").append(FALLBACK_LINES).append(" lines)\n");
        }
        return out.toString();
    }

    private static String stripCr(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
