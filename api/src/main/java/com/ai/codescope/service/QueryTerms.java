package com.ai.codescope.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Query normalisation shared by the matchers: case folding and whitespace term splitting.
 * Nothing else is ever done to a query.
 */
public final class QueryTerms {

    private QueryTerms() {
    }

    /**
     * Trimmed, case-folded query, or an empty string for null input.
     */
    public static String fold(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String query) {
        return query == null || query.isBlank();
    }

    /**
     * Distinct case-folded terms in first-occurrence order.
     */
    public static List<String> terms(String query) {
        if (isBlank(query)) {
            return List.of();
        }
        Set<String> terms = new LinkedHashSet<>();
        for (String token : fold(query).split("\\s+")) {
            if (!token.isEmpty()) {
                terms.add(token);
            }
        }
        return List.copyOf(terms);
    }

    /**
     * Case-insensitive {@link String#indexOf(String)}; {@code term} must already be folded.
     */
    public static int indexOfIgnoreCase(String text, String term) {
        int last = text.length() - term.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, term, 0, term.length())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Non-overlapping occurrences of {@code term} in {@code foldedText}; both already folded.
     */
    public static int countOccurrences(String foldedText, String term) {
        if (term.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        while (true) {
            int at = foldedText.indexOf(term, from);
            if (at < 0) {
                return count;
            }
            count++;
            from = at + term.length();
        }
    }
}
