package com.ai.codescope.service;

import com.ai.codescope.dto.FileMatch;
import com.ai.codescope.dto.ModuleMatch;
import com.ai.codescope.dto.SearchResponse;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.RepositorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Filename-only ranking behind {@code /api/search}: files by their match score and
 * directories ("modules") by the best score among their files.
 */
@Service
public class SearchRankingService {

    private static final Logger log = LoggerFactory.getLogger(SearchRankingService.class);

    static final Comparator<FileMatch> FILE_ORDER = Comparator
            .comparingDouble(FileMatch::score).reversed()
            .thenComparing(FileMatch::path);

    static final Comparator<ModuleMatch> MODULE_ORDER = Comparator
            .comparingDouble(ModuleMatch::score).reversed()
            .thenComparing(ModuleMatch::id);

    private final FilenameMatcher matcher;

    public SearchRankingService(FilenameMatcher matcher) {
        this.matcher = matcher;
    }

    public SearchResponse search(RepositorySnapshot snapshot, String query, int fileLimit, int moduleLimit) {
        Map<String, Integer> moduleSizes = moduleSizes(snapshot.files());
        if (QueryTerms.isBlank(query)) {
            return SearchResponse.empty(snapshot.fileCount(), moduleSizes.size());
        }

        long start = System.currentTimeMillis();

        List<FileMatch> files = new ArrayList<>();
        Map<String, Double> bestByModule = new HashMap<>();
        for (IndexedFile file : snapshot.files()) {
            double score = matcher.score(query, file);
            if (score <= 0.0) {
                continue;
            }
            files.add(new FileMatch(file.path(), file.filename(), score));
            bestByModule.merge(file.directory(), score, Math::max);
        }

        List<ModuleMatch> modules = new ArrayList<>();
        for (Map.Entry<String, Double> entry : bestByModule.entrySet()) {
            String id = entry.getKey();
            modules.add(new ModuleMatch(id, moduleName(id), moduleSizes.getOrDefault(id, 0), entry.getValue()));
        }

        List<FileMatch> rankedFiles = files.stream()
                .sorted(FILE_ORDER)
                .limit(Math.max(0, fileLimit))
                .toList();
        List<ModuleMatch> rankedModules = modules.stream()
                .sorted(MODULE_ORDER)
                .limit(Math.max(0, moduleLimit))
                .toList();

        long elapsed = System.currentTimeMillis() - start;
        log.info("[SearchRankingService] q='{}' files={}/{} modules={}/{} in {}ms",
                query, rankedFiles.size(), files.size(), rankedModules.size(), modules.size(), elapsed);

        return new SearchResponse(rankedFiles, rankedModules, snapshot.fileCount(), moduleSizes.size(), elapsed);
    }

    private static Map<String, Integer> moduleSizes(List<IndexedFile> files) {
        Map<String, Integer> sizes = new HashMap<>();
        for (IndexedFile file : files) {
            sizes.merge(file.directory(), 1, Integer::sum);
        }
        return sizes;
    }

    static String moduleName(String id) {
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }
}
