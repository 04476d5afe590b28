package com.ai.codescope.service.deps;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code [dependencies]} and {@code [dev-dependencies]} tables of a Cargo manifest.
 * Handles {@code name = "1.0"} and inline tables carrying a {@code version} key; path and
 * git dependencies without a version are reported as {@code *}.
 */
@Component
public class CargoTomlScanner implements DependencyScanner {

    private static final Set<String> SECTIONS = Set.of("[dependencies]", "[dev-dependencies]");
    private static final Pattern ENTRY = Pattern.compile("^([A-Za-z0-9_\\-]+)\\s*=\\s*(.+)$");
    private static final Pattern INLINE_VERSION = Pattern.compile("version\\s*=\\s*\"([^\"]*)\"");

    @Override
    public boolean supports(String filename) {
        return "Cargo.toml".equals(filename);
    }

    @Override
    public Map<String, String> scan(String content) {
        Map<String, String> deps = new LinkedHashMap<>();
        boolean inSection = false;
        for (String raw : content.split("\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("[")) {
                inSection = SECTIONS.contains(line);
                continue;
            }
            if (!inSection) {
                continue;
            }
            Matcher entry = ENTRY.matcher(line);
            if (entry.matches()) {
                deps.putIfAbsent(entry.group(1), version(entry.group(2).trim()));
            }
        }
        return deps;
    }

    private static String version(String value) {
        if (value.startsWith("\"")) {
            int end = value.indexOf('"', 1);
            return end > 0 ? value.substring(1, end) : "*";
        }
        Matcher inline = INLINE_VERSION.matcher(value);
        return inline.find() ? inline.group(1) : "*";
    }
}
