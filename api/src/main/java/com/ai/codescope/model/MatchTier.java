package com.ai.codescope.model;

/**
 * Filename match tiers, strongest first. A file is scored by the strongest tier it reaches.
 */
public enum MatchTier {
    EXACT_NAME,
    EXACT_STEM,
    NAME_PREFIX,
    PATH_SUBSTRING,
    NAME_SUBSEQUENCE,
    NONE;

    public boolean isStrongerThan(MatchTier other) {
        return ordinal() < other.ordinal();
    }
}
