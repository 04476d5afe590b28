package com.ai.codescope.service.deps;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * pip requirement lines such as {@code requests==2.31.0} or {@code flask>=2}. Options,
 * includes and URLs are ignored.
 */
@Component
public class RequirementsTxtScanner implements DependencyScanner {

    private static final Pattern REQUIREMENT = Pattern.compile(
            "^([A-Za-z0-9][A-Za-z0-9._\\-]*)(\\[[^\\]]*\\])?\\s*((?:==|>=|<=|~=|!=|>|<)\\s*[^;#\\s]+(?:\\s*,\\s*[^;#\\s]+)*)?");

    @Override
    public boolean supports(String filename) {
        return "requirements.txt".equals(filename);
    }

    @Override
    public Map<String, String> scan(String content) {
        Map<String, String> deps = new LinkedHashMap<>();
        for (String raw : content.split("\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("-") || line.contains("://")) {
                continue;
            }
            Matcher m = REQUIREMENT.matcher(line);
            if (m.find()) {
                String spec = m.group(3);
                String version = spec == null ? "*" : spec.replaceAll("\\s+", "");
                if (version.startsWith("==")) {
                    version = version.substring(2);
                }
                deps.putIfAbsent(m.group(1), version);
            }
        }
        return deps;
    }
}
