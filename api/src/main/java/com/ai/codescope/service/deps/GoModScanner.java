package com.ai.codescope.service.deps;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code require} directives of a Go module file, single-line and block form.
 */
@Component
public class GoModScanner implements DependencyScanner {

    @Override
    public boolean supports(String filename) {
        return "go.mod".equals(filename);
    }

    @Override
    public Map<String, String> scan(String content) {
        Map<String, String> deps = new LinkedHashMap<>();
        boolean inBlock = false;
        for (String raw : content.split("\n")) {
            String line = stripComment(raw).trim();
            if (line.isEmpty()) {
                continue;
            }
            if (inBlock) {
                if (line.equals(")")) {
                    inBlock = false;
                } else {
                    addRequirement(deps, line);
                }
            } else if (line.startsWith("require (") || line.equals("require(")) {
                inBlock = true;
            } else if (line.startsWith("require ")) {
                addRequirement(deps, line.substring("require ".length()).trim());
            }
        }
        return deps;
    }

    private static void addRequirement(Map<String, String> deps, String spec) {
        String[] parts = spec.split("\\s+");
        if (parts.length >= 2) {
            deps.putIfAbsent(parts[0], parts[1]);
        }
    }

    private static String stripComment(String line) {
        int idx = line.indexOf("//");
        return idx >= 0 ? line.substring(0, idx) : line;
    }
}
