package com.ai.codescope.model;

import java.util.Optional;

/**
 * Raw text content of snapshot files, addressed by relative path.
 * Empty when the file cannot be read or is not decodable text.
 */
@FunctionalInterface
public interface ContentSource {

    Optional<String> read(String path);
}
