package com.ai.codescope.service;

import com.ai.codescope.dto.FindResponse;
import com.ai.codescope.dto.FindResult;
import com.ai.codescope.model.Deadline;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.RepositorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Combined ranking behind {@code /api/find}: filename identity blended with content relevance.
 */
@Service
public class FindService {

    private static final Logger log = LoggerFactory.getLogger(FindService.class);

    static final double FILENAME_WEIGHT = 0.6;
    static final double CONTENT_WEIGHT = 0.4;

    static final Comparator<FindResult> RESULT_ORDER = Comparator
            .comparingDouble(FindResult::combinedScore).reversed()
            .thenComparing(FindResult::path);

    private final FilenameMatcher matcher;
    private final ParallelFileScanner scanner;

    public FindService(FilenameMatcher matcher, ParallelFileScanner scanner) {
        this.matcher = matcher;
        this.scanner = scanner;
    }

    public FindResponse find(RepositorySnapshot snapshot, String query, int limit, Deadline deadline) {
        return find(snapshot, query, limit, PathFilter.NONE, deadline);
    }

    /**
     * Rank only the files accepted by {@code filter}.
     */
    public FindResponse find(RepositorySnapshot snapshot, String query, int limit, PathFilter filter,
            Deadline deadline) {
        List<String> terms = QueryTerms.terms(query);
        if (terms.isEmpty() || limit <= 0) {
            return FindResponse.empty();
        }

        long start = System.currentTimeMillis();
        List<IndexedFile> files = filter.apply(snapshot.files());

        List<Double> contentScores = scanner.scan(
                files,
                file -> snapshot.read(file.path())
                        .map(content -> contentScore(content, terms, file.byteSize()))
                        .orElse(0.0),
                0.0,
                deadline);

        List<FindResult> results = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            IndexedFile file = files.get(i);
            double filenameScore = matcher.score(query, file);
            double contentScore = contentScores.get(i);
            double combined = combinedScore(filenameScore, contentScore);
            if (combined > 0.0) {
                results.add(new FindResult(file.path(), filenameScore, contentScore, combined));
            }
        }

        List<FindResult> ranked = results.stream()
                .sorted(RESULT_ORDER)
                .limit(limit)
                .toList();

        long elapsed = System.currentTimeMillis() - start;
        log.info("[FindService] q='{}' candidates={} returned={} in {}ms", query, results.size(), ranked.size(),
                elapsed);

        return new FindResponse(ranked, elapsed);
    }

    /**
     * Term occurrences discounted by file size: {@code min(1, occurrences / max(1, log2(byteSize)))}.
     */
    static double contentScore(String content, List<String> terms, long byteSize) {
        String folded = content.toLowerCase(Locale.ROOT);
        long occurrences = 0;
        for (String term : terms) {
            occurrences += QueryTerms.countOccurrences(folded, term);
        }
        if (occurrences == 0) {
            return 0.0;
        }
        double normalization = Math.max(1.0, log2(byteSize));
        return Math.min(1.0, occurrences / normalization);
    }

    static double combinedScore(double filenameScore, double contentScore) {
        double combined = FILENAME_WEIGHT * filenameScore + CONTENT_WEIGHT * contentScore;
        return Math.max(0.0, Math.min(1.0, combined));
    }

    private static double log2(long value) {
        return value <= 0 ? 0.0 : Math.log(value) / Math.log(2);
    }
}
