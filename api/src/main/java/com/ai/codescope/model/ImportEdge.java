package com.ai.codescope.model;

/**
 * One import/include directive.
 *
 * @param from     importing file path
 * @param to       resolved file path, or the raw module specifier when unresolved
 * @param resolved true when {@code to} is a path of the same snapshot
 */
public record ImportEdge(String from, String to, boolean resolved) {
}
