package com.ai.codescope.controller;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.dto.BatchFilesRequest;
import com.ai.codescope.dto.BatchFilesResponse;
import com.ai.codescope.dto.ContextRequest;
import com.ai.codescope.dto.ContextResponse;
import com.ai.codescope.dto.ContextSummary;
import com.ai.codescope.dto.FileContentResponse;
import com.ai.codescope.model.BudgetUnit;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.RepositorySnapshot;
import com.ai.codescope.service.ContextAssemblyService;
import com.ai.codescope.service.FileContentService;
import com.ai.codescope.service.WorkspaceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class ContextControllerTest {

    @Mock
    private ContextAssemblyService contextAssemblyService;
    @Mock
    private WorkspaceStore workspaceStore;
    @Spy
    private CodescopeProperties properties = new CodescopeProperties();
    @Spy
    private FileContentService fileContentService = new FileContentService(new CodescopeProperties());

    @InjectMocks
    private ContextController contextController;

    private RepositorySnapshot snapshot;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        Map<String, String> contents = Map.of(
                "src/App.java", "class App {}\nclass Other {}\n",
                "src/Broken.java", "");
        snapshot = RepositorySnapshot.of(
                List.of(IndexedFile.of("src/App.java", 28), IndexedFile.of("src/Broken.java", 10)),
                path -> path.equals("src/Broken.java") ? Optional.empty() : Optional.ofNullable(contents.get(path)));
        when(workspaceStore.current()).thenReturn(snapshot);
    }

    @Test
    void testContext_UsesDefaultBudgetWhenOmitted() {
        ContextResponse expected = new ContextResponse(List.of(),
                new ContextSummary(0, 0, 0, 50_000, BudgetUnit.TOKENS));
        when(contextAssemblyService.assemble(any(), any(), any(), anyLong())).thenReturn(expected);

        ContextResponse response = contextController.context(new ContextRequest(List.of("src/App.java"), null, null));

        assertSame(expected, response);
        verify(contextAssemblyService).assemble(snapshot, List.of("src/App.java"), BudgetUnit.TOKENS, 50_000L);
    }

    @Test
    void testContext_PassesExplicitBudgetAndUnit() {
        when(contextAssemblyService.assemble(any(), any(), any(), anyLong())).thenReturn(
                new ContextResponse(List.of(), new ContextSummary(0, 0, 0, 10, BudgetUnit.BYTES)));

        contextController.context(new ContextRequest(List.of("a"), BudgetUnit.BYTES, 10L));

        verify(contextAssemblyService).assemble(snapshot, List.of("a"), BudgetUnit.BYTES, 10L);
    }

    @Test
    void testFile_ReturnsContentWithLineCount() {
        FileContentResponse response = contextController.file("src/App.java");

        assertEquals("src/App.java", response.path());
        assertEquals(2, response.lines());
        assertEquals(28, response.size());
        assertFalse(response.truncated());
    }

    @Test
    void testFile_NotIndexed_404() {
        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> contextController.file("src/Missing.java"));

        assertEquals(HttpStatus.NOT_FOUND, e.getStatusCode());
        assertTrue(e.getReason().startsWith("FILE_NOT_FOUND:"));
    }

    @Test
    void testFile_TraversalPath_400() {
        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> contextController.file("../etc/passwd"));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
        assertTrue(e.getReason().startsWith("INVALID_PATH:"));
    }

    @Test
    void testFile_Unreadable_422() {
        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> contextController.file("src/Broken.java"));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, e.getStatusCode());
    }

    @Test
    void testFiles_ReportsErrorsPerPath() {
        BatchFilesResponse response = contextController.files(
                new BatchFilesRequest(List.of("src/App.java", "nope.txt", "src/Broken.java", "src/App.java"), null));

        assertEquals(List.of("src/App.java", "nope.txt", "src/Broken.java"), List.copyOf(response.files().keySet()));
        assertEquals("class App {}\nclass Other {}\n", response.files().get("src/App.java").content());
        assertEquals(28L, response.files().get("src/App.java").size());
        assertEquals("File not indexed", response.files().get("nope.txt").error());
        assertEquals("Content unavailable", response.files().get("src/Broken.java").error());
    }

    @Test
    void testFiles_StubMode_UsesStubExtraction() {
        when(contextAssemblyService.stubFor(any(), anyString())).thenReturn("// stub\n");

        BatchFilesResponse response = contextController.files(
                new BatchFilesRequest(List.of("src/App.java"), "stubs"));

        assertEquals("// stub\n", response.files().get("src/App.java").content());
        assertEquals(8L, response.files().get("src/App.java").size());
    }

    @Test
    void testCountLines() {
        assertEquals(0, ContextController.countLines(""));
        assertEquals(1, ContextController.countLines("one"));
        assertEquals(1, ContextController.countLines("one\n"));
        assertEquals(2, ContextController.countLines("one\ntwo"));
    }
}
