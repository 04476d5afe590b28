package com.ai.codescope.service;

import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.MatchTier;
import com.ai.codescope.model.TierMatch;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tiered fuzzy matcher scoring how well a query names a file.
 * Strategies are tried strongest first; the strongest tier reached decides the score
 * and scores of different tiers are never added up.
 */
@Service
public class FilenameMatcher {

    @FunctionalInterface
    interface TierStrategy {
        /**
         * @param query    folded, non-empty query
         * @param filename folded filename
         * @param path     folded path
         */
        Optional<TierMatch> apply(String query, String filename, String path);
    }

    private final List<TierStrategy> strategies = List.of(
            FilenameMatcher::exactName,
            FilenameMatcher::exactStem,
            FilenameMatcher::namePrefix,
            FilenameMatcher::pathSubstring,
            FilenameMatcher::nameSubsequence);

    /**
     * Score in [0, 1] of {@code query} against {@code file}.
     */
    public double score(String query, IndexedFile file) {
        return match(query, file).score();
    }

    /**
     * Strongest tier {@code query} reaches against {@code file}, {@link TierMatch#NONE} if none.
     */
    public TierMatch match(String query, IndexedFile file) {
        String folded = QueryTerms.fold(query);
        if (folded.isEmpty()) {
            return TierMatch.NONE;
        }
        String filename = file.filename().toLowerCase(Locale.ROOT);
        String path = file.path().toLowerCase(Locale.ROOT);

        TierMatch best = TierMatch.NONE;
        for (TierStrategy strategy : strategies) {
            Optional<TierMatch> candidate = strategy.apply(folded, filename, path);
            if (candidate.isPresent() && candidate.get().tier().isStrongerThan(best.tier())) {
                best = candidate.get();
            }
        }
        return new TierMatch(best.tier(), clamp(best.score()));
    }

    static Optional<TierMatch> exactName(String query, String filename, String path) {
        return filename.equals(query)
                ? Optional.of(new TierMatch(MatchTier.EXACT_NAME, 1.0))
                : Optional.empty();
    }

    static Optional<TierMatch> exactStem(String query, String filename, String path) {
        int dot = filename.lastIndexOf('.');
        String stem = dot > 0 ? filename.substring(0, dot) : filename;
        return stem.equals(query)
                ? Optional.of(new TierMatch(MatchTier.EXACT_STEM, 0.9))
                : Optional.empty();
    }

    static Optional<TierMatch> namePrefix(String query, String filename, String path) {
        if (!filename.startsWith(query)) {
            return Optional.empty();
        }
        int extraChars = filename.length() - query.length();
        return Optional.of(new TierMatch(MatchTier.NAME_PREFIX, Math.max(0.6, 0.7 - 0.01 * extraChars)));
    }

    static Optional<TierMatch> pathSubstring(String query, String filename, String path) {
        return path.contains(query)
                ? Optional.of(new TierMatch(MatchTier.PATH_SUBSTRING, 0.5))
                : Optional.empty();
    }

    static Optional<TierMatch> nameSubsequence(String query, String filename, String path) {
        if (query.length() > filename.length()) {
            return Optional.empty();
        }
        int qi = 0;
        for (int i = 0; i < filename.length() && qi < query.length(); i++) {
            if (filename.charAt(i) == query.charAt(qi)) {
                qi++;
            }
        }
        if (qi < query.length()) {
            return Optional.empty();
        }
        return Optional.of(new TierMatch(MatchTier.NAME_SUBSEQUENCE,
                0.4 * ((double) query.length() / filename.length())));
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
