package com.ai.codescope.service.deps;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code <dependency>} elements of a Maven POM, keyed as {@code groupId:artifactId}.
 * Versions inherited from a parent or BOM are reported as {@code *}.
 */
@Component
public class PomXmlScanner implements DependencyScanner {

    private static final Pattern DEPENDENCY = Pattern.compile("<dependency>(.*?)</dependency>", Pattern.DOTALL);
    private static final Pattern GROUP_ID = Pattern.compile("<groupId>\\s*([^<]+?)\\s*</groupId>");
    private static final Pattern ARTIFACT_ID = Pattern.compile("<artifactId>\\s*([^<]+?)\\s*</artifactId>");
    private static final Pattern VERSION = Pattern.compile("<version>\\s*([^<]+?)\\s*</version>");

    @Override
    public boolean supports(String filename) {
        return "pom.xml".equals(filename);
    }

    @Override
    public Map<String, String> scan(String content) {
        Map<String, String> deps = new LinkedHashMap<>();
        Matcher dependency = DEPENDENCY.matcher(content);
        while (dependency.find()) {
            String block = dependency.group(1);
            Matcher group = GROUP_ID.matcher(block);
            Matcher artifact = ARTIFACT_ID.matcher(block);
            if (!group.find() || !artifact.find()) {
                continue;
            }
            Matcher version = VERSION.matcher(block);
            deps.putIfAbsent(group.group(1) + ":" + artifact.group(1), version.find() ? version.group(1) : "*");
        }
        return deps;
    }
}
