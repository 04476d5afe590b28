package com.ai.codescope.controller;

import com.ai.codescope.dto.ImportsResponse;
import com.ai.codescope.model.ContentSource;
import com.ai.codescope.model.ImportEdge;
import com.ai.codescope.model.ImportGraph;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.RepositorySnapshot;
import com.ai.codescope.service.ManifestService;
import com.ai.codescope.service.WorkspaceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class RepositoryControllerTest {

    private WorkspaceStore workspaceStore;
    private RepositoryController controller;
    private RepositorySnapshot snapshot;

    @BeforeEach
    void setUp() {
        workspaceStore = mock(WorkspaceStore.class);
        controller = new RepositoryController(workspaceStore, new ManifestService(), "9.9.9");

        ImportGraph graph = new ImportGraph(
                Map.of("web/app.ts", List.of(
                        new ImportEdge("web/app.ts", "react", false),
                        new ImportEdge("web/app.ts", "web/utils.ts", true))),
                Map.of("web/utils.ts", List.of("web/app.ts")));
        ContentSource noContent = path -> Optional.empty();
        snapshot = new RepositorySnapshot(Path.of("."),
                List.of(IndexedFile.of("web/app.ts", 10), IndexedFile.of("web/utils.ts", 5)),
                noContent, Map.of("react", "^18.2.0"), graph, OffsetDateTime.parse("2026-01-01T00:00:00Z"));
        when(workspaceStore.current()).thenReturn(snapshot);
    }

    @Test
    void testImports_BothDirectionsByDefault() {
        ImportsResponse response = controller.imports("web/utils.ts", "both");

        assertTrue(response.imports().isEmpty());
        assertEquals(List.of("web/app.ts"), response.importedBy());
    }

    @Test
    void testImports_SingleDirection() {
        ImportsResponse forward = controller.imports("web/app.ts", "imports");
        ImportsResponse reverse = controller.imports("web/app.ts", "importedBy");

        assertEquals(2, forward.imports().size());
        assertTrue(forward.importedBy().isEmpty());
        assertTrue(reverse.imports().isEmpty());
    }

    @Test
    void testImports_BadDirectionOrUnknownPath() {
        ResponseStatusException badDirection = assertThrows(ResponseStatusException.class,
                () -> controller.imports("web/app.ts", "sideways"));
        assertEquals(HttpStatus.BAD_REQUEST, badDirection.getStatusCode());

        ResponseStatusException unknown = assertThrows(ResponseStatusException.class,
                () -> controller.imports("web/none.ts", "both"));
        assertEquals(HttpStatus.NOT_FOUND, unknown.getStatusCode());
    }

    @Test
    void testHealth_ReportsSnapshot() {
        Map<String, Object> health = controller.health();

        assertEquals("ok", health.get("status"));
        assertEquals("9.9.9", health.get("version"));
        assertEquals(2, health.get("files"));
        assertEquals(snapshot.builtAt(), health.get("snapshotBuiltAt"));
    }

    @Test
    void testRebuild_SwapsSnapshot() {
        when(workspaceStore.rebuild()).thenReturn(snapshot);

        Map<String, Object> body = controller.rebuild();

        assertEquals(2, body.get("files"));
        verify(workspaceStore).rebuild();
    }

    @Test
    void testDependencies() {
        assertEquals("^18.2.0", controller.dependencies().get("react"));
    }
}
