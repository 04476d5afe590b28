package com.ai.codescope.service.deps;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class PackageJsonScanner implements DependencyScanner {

    private static final Logger log = LoggerFactory.getLogger(PackageJsonScanner.class);

    private static final List<String> SECTIONS = List.of("dependencies", "devDependencies");

    private final ObjectMapper objectMapper;

    public PackageJsonScanner(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(String filename) {
        return "package.json".equals(filename);
    }

    @Override
    public Map<String, String> scan(String content) {
        Map<String, String> deps = new LinkedHashMap<>();
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.warn("[PackageJsonScanner] Unparseable package.json: {}", e.getOriginalMessage());
            return deps;
        }
        if (root == null) {
            return deps;
        }
        for (String section : SECTIONS) {
            JsonNode node = root.path(section);
            node.fields().forEachRemaining(field ->
                    deps.putIfAbsent(field.getKey(), field.getValue().asText("*")));
        }
        return deps;
    }
}
