package com.ai.codescope.model;

/**
 * Outcome of one filename match: the tier reached and the score in [0, 1] it yields.
 */
public record TierMatch(MatchTier tier, double score) {

    public static final TierMatch NONE = new TierMatch(MatchTier.NONE, 0.0);
}
