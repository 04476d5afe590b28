package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.dto.GrepMatch;
import com.ai.codescope.dto.GrepResponse;
import com.ai.codescope.model.Deadline;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.RepositorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Multi-term line search over file contents.
 */
@Service
public class ContentGrepService {

    private static final Logger log = LoggerFactory.getLogger(ContentGrepService.class);

    private final ParallelFileScanner scanner;
    private final CodescopeProperties properties;

    public ContentGrepService(ParallelFileScanner scanner, CodescopeProperties properties) {
        this.scanner = scanner;
        this.properties = properties;
    }

    /**
     * Per-file outcome of a scan. {@code readable} is false for skipped (binary/unreadable) files.
     */
    record FileHits(List<GrepMatch> matches, boolean readable) {
        static final FileHits SKIPPED = new FileHits(List.of(), false);
    }

    /**
     * Search all snapshot files in index order.
     *
     * @param limit      maximum matches overall
     * @param maxPerFile maximum matches taken from a single file
     */
    public GrepResponse grep(RepositorySnapshot snapshot, String query, int limit, int maxPerFile, Deadline deadline) {
        return grep(snapshot, snapshot.files(), query, limit, maxPerFile, deadline);
    }

    public GrepResponse grep(RepositorySnapshot snapshot, List<IndexedFile> files, String query, int limit,
            int maxPerFile, Deadline deadline) {
        List<String> terms = QueryTerms.terms(query);
        if (terms.isEmpty() || limit <= 0 || maxPerFile <= 0) {
            return GrepResponse.empty();
        }

        long start = System.currentTimeMillis();
        boolean matchAll = properties.getGrep().isMatchAllTerms();
        int snippetCap = properties.getGrep().getSnippetMaxChars();

        List<FileHits> perFile = scanner.scanWhile(
                files,
                file -> snapshot.read(file.path())
                        .map(content -> new FileHits(scanFile(file.path(), content, terms, matchAll, maxPerFile,
                                snippetCap), true))
                        .orElse(FileHits.SKIPPED),
                FileHits.SKIPPED,
                deadline,
                collected -> collected.stream().mapToInt(h -> h.matches().size()).sum() < limit);

        List<GrepMatch> matches = new ArrayList<>();
        int searched = 0;
        for (FileHits hits : perFile) {
            if (hits.readable()) {
                searched++;
            }
            for (GrepMatch match : hits.matches()) {
                if (matches.size() >= limit) {
                    break;
                }
                matches.add(match);
            }
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("[ContentGrepService] q='{}' terms={} matches={} searchedFiles={} in {}ms",
                abbreviate(query), terms.size(), matches.size(), searched, elapsed);

        return new GrepResponse(List.copyOf(matches), matches.size(), searched, elapsed);
    }

    /**
     * Matching lines of one file in line order, at most {@code maxPerFile}.
     */
    static List<GrepMatch> scanFile(String path, String content, List<String> terms, boolean matchAll,
            int maxPerFile, int snippetCap) {
        List<GrepMatch> matches = new ArrayList<>();
        int lineNumber = 0;
        int lineStart = 0;
        int length = content.length();

        while (lineStart <= length && matches.size() < maxPerFile) {
            int newline = content.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? length : newline;
            lineNumber++;

            String line = content.substring(lineStart, lineEnd);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }

            Optional<Integer> column = firstMatchColumn(line, terms, matchAll);
            if (column.isPresent()) {
                matches.add(new GrepMatch(path, lineNumber, column.get(), snippet(line, snippetCap)));
            }

            if (newline < 0) {
                break;
            }
            lineStart = newline + 1;
        }
        return matches;
    }

    /**
     * 1-based UTF-8 byte column of the earliest matched term, empty when the line does not match.
     */
    static Optional<Integer> firstMatchColumn(String line, List<String> terms, boolean matchAll) {
        int earliest = -1;
        for (String term : terms) {
            int at = QueryTerms.indexOfIgnoreCase(line, term);
            if (at < 0) {
                if (matchAll) {
                    return Optional.empty();
                }
                continue;
            }
            if (earliest < 0 || at < earliest) {
                earliest = at;
            }
        }
        if (earliest < 0) {
            return Optional.empty();
        }
        return Optional.of(line.substring(0, earliest).getBytes(StandardCharsets.UTF_8).length + 1);
    }

    /**
     * Line cut to at most {@code cap} code points, never inside a surrogate pair.
     */
    static String snippet(String line, int cap) {
        if (cap <= 0 || line.codePointCount(0, line.length()) <= cap) {
            return line;
        }
        return line.substring(0, line.offsetByCodePoints(0, cap)) + "...";
    }

    private static String abbreviate(String query) {
        return query.length() > 50 ? query.substring(0, 50) + "..." : query;
    }
}
