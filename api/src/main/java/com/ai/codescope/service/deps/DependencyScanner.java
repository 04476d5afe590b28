package com.ai.codescope.service.deps;

import java.util.Map;

/**
 * Extracts declared dependencies from one kind of package manifest.
 */
public interface DependencyScanner {

    /**
     * @param filename bare file name, e.g. {@code package.json}
     */
    boolean supports(String filename);

    /**
     * @return dependency name to version constraint, in declaration order
     */
    Map<String, String> scan(String content);
}
