package com.ai.codescope.dto;

/**
 * One matching line.
 *
 * @param line    1-based line number
 * @param column  1-based UTF-8 byte offset of the first matched term in the line
 * @param snippet the line, cut to the display cap
 */
public record GrepMatch(
        String path,
        int line,
        int column,
        String snippet) {
}
