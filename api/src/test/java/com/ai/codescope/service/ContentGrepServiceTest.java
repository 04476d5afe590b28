package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.dto.GrepMatch;
import com.ai.codescope.dto.GrepResponse;
import com.ai.codescope.model.Deadline;
import com.ai.codescope.model.RepositorySnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ContentGrepServiceTest {

    private ThreadPoolTaskExecutor executor;
    private CodescopeProperties properties;
    private ContentGrepService grepService;

    @BeforeEach
    void setUp() {
        executor = ServiceTestSupport.executor(4);
        properties = ServiceTestSupport.properties();
        grepService = new ContentGrepService(new ParallelFileScanner(executor, properties), properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static RepositorySnapshot repo() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("src/server.rs", "fn start_server() {\n    let port = 8080;\n    bind(port);\n}\n");
        files.put("src/client.rs", "fn connect(port: u16) {\n    // connect to server on port\n}\n");
        files.put("README.md", "Server and client.\nRun the server on a port.\r\n");
        files.put("docs/notes.txt", "nothing relevant here\n");
        return ServiceTestSupport.snapshot(files);
    }

    @Test
    void testEveryMatchContainsAllTerms() {
        GrepResponse response = grepService.grep(repo(), "server PORT", 100, 5, Deadline.none());

        assertFalse(response.matches().isEmpty());
        for (GrepMatch match : response.matches()) {
            String line = match.snippet().toLowerCase();
            assertTrue(line.contains("server") && line.contains("port"), match.snippet());
        }
        assertEquals(List.of("README.md", "src/client.rs"),
                response.matches().stream().map(GrepMatch::path).distinct().toList());
    }

    @Test
    void testAddingATermNeverWidensResults() {
        RepositorySnapshot snapshot = repo();
        GrepResponse broad = grepService.grep(snapshot, "port", 100, 5, Deadline.none());
        GrepResponse narrow = grepService.grep(snapshot, "port server", 100, 5, Deadline.none());

        assertTrue(broad.matches().containsAll(narrow.matches()));
        assertTrue(narrow.matches().size() <= broad.matches().size());
    }

    @Test
    void testLineColumnAndCarriageReturnHandling() {
        GrepResponse response = grepService.grep(repo(), "port", 100, 5, Deadline.none());

        GrepMatch readme = response.matches().stream()
                .filter(m -> m.path().equals("README.md"))
                .findFirst()
                .orElseThrow();
        assertEquals(2, readme.line());
        assertEquals(21, readme.column());
        assertEquals("Run the server on a port.", readme.snippet());
    }

    @Test
    void testColumnIsUtf8ByteOffset() {
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(Map.of("a.txt", "héllo world\n"));

        GrepResponse response = grepService.grep(snapshot, "world", 10, 5, Deadline.none());

        assertEquals(1, response.matches().size());
        assertEquals(8, response.matches().get(0).column());
    }

    @Test
    void testCapsAreHonored() {
        Map<String, String> files = new LinkedHashMap<>();
        for (int i = 0; i < 10; i++) {
            files.put("f" + i + ".txt", "todo one\ntodo two\ntodo three\n");
        }
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(files);

        GrepResponse perFile = grepService.grep(snapshot, "todo", 100, 2, Deadline.none());
        assertEquals(20, perFile.matches().size());

        GrepResponse limited = grepService.grep(snapshot, "todo", 7, 5, Deadline.none());
        assertEquals(7, limited.matches().size());
        assertEquals(7, limited.totalMatches());
        // index order: f0 gives 3 matches, f1 gives 3, f2 gives the first one
        assertEquals("f2.txt", limited.matches().get(6).path());
        assertEquals(1, limited.matches().get(6).line());
    }

    @Test
    void testResultsAreDeterministic() {
        Map<String, String> files = new LinkedHashMap<>();
        for (int i = 0; i < 50; i++) {
            files.put(String.format("dir%02d/file.txt", i), "alpha beta\n".repeat(i % 4) + "alpha\n");
        }
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(files);

        GrepResponse first = grepService.grep(snapshot, "alpha", 500, 5, Deadline.none());
        for (int run = 0; run < 5; run++) {
            assertEquals(first.matches(), grepService.grep(snapshot, "alpha", 500, 5, Deadline.none()).matches());
        }
    }

    @Test
    void testUnreadableFilesAreSkipped() {
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(
                Map.of("a.txt", "needle\n", "b.bin", "needle\n"), Set.of("b.bin"));

        GrepResponse response = grepService.grep(snapshot, "needle", 10, 5, Deadline.none());

        assertEquals(1, response.matches().size());
        assertEquals("a.txt", response.matches().get(0).path());
        assertEquals(1, response.searchedFiles());
    }

    @Test
    void testBlankQuery_ReturnsEmptyResult() {
        GrepResponse response = grepService.grep(repo(), "  ", 100, 5, Deadline.none());

        assertTrue(response.matches().isEmpty());
        assertEquals(0, response.totalMatches());
    }

    @Test
    void testOrSemantics_WhenConfigured() {
        properties.getGrep().setMatchAllTerms(false);

        GrepResponse response = grepService.grep(repo(), "bind nothing", 100, 5, Deadline.none());

        assertEquals(List.of("docs/notes.txt", "src/server.rs"),
                response.matches().stream().map(GrepMatch::path).toList());
    }

    @Test
    void testSnippetIsTruncatedWithEllipsis() {
        String longLine = "x".repeat(300) + " needle";
        RepositorySnapshot snapshot = ServiceTestSupport.snapshot(Map.of("long.txt", longLine));

        GrepMatch match = grepService.grep(snapshot, "needle", 10, 5, Deadline.none()).matches().get(0);

        assertEquals(243, match.snippet().length());
        assertTrue(match.snippet().endsWith("..."));
        assertEquals(302, match.column());
    }

    @Test
    void testSnippet_CutsOnCodePointBoundary() {
        // five emoji, each a surrogate pair
        String line = "\uD83D\uDE00".repeat(5);

        String snippet = ContentGrepService.snippet(line, 3);

        assertEquals("\uD83D\uDE00".repeat(3) + "...", snippet);
        assertFalse(Character.isHighSurrogate(snippet.charAt(snippet.length() - 4)));
        assertEquals(line, ContentGrepService.snippet(line, 5));
    }
}
