package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.dto.FindResponse;
import com.ai.codescope.dto.FindResult;
import com.ai.codescope.model.Deadline;
import com.ai.codescope.model.RepositorySnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FindServiceTest {

    private ThreadPoolTaskExecutor executor;
    private FindService findService;

    @BeforeEach
    void setUp() {
        executor = ServiceTestSupport.executor(3);
        CodescopeProperties properties = ServiceTestSupport.properties();
        findService = new FindService(new FilenameMatcher(), new ParallelFileScanner(executor, properties));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void testExactFilenameOutranksContentOnlyMatches() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("src/main.rs", "fn main() {}\n");
        files.put("src/util.rs", "// main.rs main.rs main.rs main.rs main.rs main.rs main.rs main.rs\n");
        files.put("docs/guide.md", "see main.rs, main.rs and main.rs\n");
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(files);

        FindResponse response = findService.find(snapshot, "main.rs", 50, Deadline.none());

        FindResult top = response.results().get(0);
        assertEquals("src/main.rs", top.path());
        assertEquals(1.0, top.filenameScore());
        assertTrue(top.combinedScore() >= 0.6);
    }

    @Test
    void testStemQuery_MainRsBeatsFilesMentioningMain() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("src/main.rs", "fn main() {}\n");
        files.put("src/app.rs", "// called from main\nfn run() { main_loop(); main_loop(); }\n");
        files.put("notes.txt", "main main main main main main main main main main\n");
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(files);

        List<FindResult> results = findService.find(snapshot, "main", 50, Deadline.none()).results();

        assertEquals("src/main.rs", results.get(0).path());
        assertEquals(3, results.size());
    }

    @Test
    void testScoresAreBoundedAndOrdered() {
        Map<String, String> files = new LinkedHashMap<>();
        for (int i = 0; i < 30; i++) {
            files.put("pkg" + i + "/handler" + i + ".go", "handler ".repeat(i) + "\n");
        }
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(files);

        List<FindResult> results = findService.find(snapshot, "handler", 200, Deadline.none()).results();

        assertFalse(results.isEmpty());
        for (int i = 0; i < results.size(); i++) {
            FindResult r = results.get(i);
            for (double score : new double[]{r.filenameScore(), r.contentScore(), r.combinedScore()}) {
                assertTrue(score >= 0.0 && score <= 1.0);
            }
            assertTrue(r.combinedScore() > 0.0);
            if (i > 0) {
                FindResult prev = results.get(i - 1);
                assertTrue(prev.combinedScore() > r.combinedScore()
                        || (prev.combinedScore() == r.combinedScore() && prev.path().compareTo(r.path()) < 0));
            }
        }
    }

    @Test
    void testFilesWithZeroCombinedScoreAreOmitted() {
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(Map.of(
                "a.txt", "nothing here",
                "b.txt", "the needle is here"));

        List<FindResult> results = findService.find(snapshot, "needle", 50, Deadline.none()).results();

        assertEquals(1, results.size());
        assertEquals("b.txt", results.get(0).path());
        assertEquals(0.0, results.get(0).filenameScore());
    }

    @Test
    void testLimitAndBlankQuery() {
        Map<String, String> files = new LinkedHashMap<>();
        for (int i = 0; i < 10; i++) {
            files.put("f" + i + ".txt", "x");
        }
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(files);

        assertEquals(3, findService.find(snapshot, "f", 3, Deadline.none()).results().size());
        assertTrue(findService.find(snapshot, " ", 50, Deadline.none()).results().isEmpty());
    }

    @Test
    void testFilter_RanksOnlyAcceptedFiles() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("src/handler.rs", "fn handler() {}\n");
        files.put("web/handler.ts", "export function handler() {}\n");
        files.put("web/routes.ts", "import { handler } from './handler';\n");
        files.put("web/handler.css", ".handler { color: red; }\n");
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(files);

        List<String> paths = findService.find(snapshot, "handler", 50, PathFilter.of(".ts", "web"), Deadline.none())
                .results().stream().map(FindResult::path).toList();

        assertEquals(List.of("web/handler.ts", "web/routes.ts"), paths);
    }

    @Test
    void testContentScore_NormalizedBySize() {
        // 8 occurrences in a 256-byte file: 8 / log2(256) = 1.0
        assertEquals(1.0, FindService.contentScore("ab ".repeat(8), List.of("ab"), 256), 1e-9);
        // 2 occurrences in a 256-byte file: 2 / 8
        assertEquals(0.25, FindService.contentScore("ab ab", List.of("ab"), 256), 1e-9);
        // tiny files use a normalization of at least 1
        assertEquals(1.0, FindService.contentScore("ab", List.of("ab"), 1), 1e-9);
        assertEquals(0.0, FindService.contentScore("xyz", List.of("ab"), 256));
    }

    @Test
    void testCombinedScore_IsWeightedAndClamped() {
        assertEquals(0.6 * 0.5 + 0.4 * 0.25, FindService.combinedScore(0.5, 0.25), 1e-9);
        assertEquals(1.0, FindService.combinedScore(1.0, 1.0), 1e-9);
    }
}
