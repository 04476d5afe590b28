package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.model.RepositorySnapshot;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the snapshot that requests are served from. Readers take the current reference
 * once per request; a rebuild swaps in a new snapshot without touching the old one.
 */
@Service
public class WorkspaceStore {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStore.class);

    private final AtomicReference<RepositorySnapshot> current = new AtomicReference<>();
    private final SnapshotService snapshotService;
    private final CodescopeProperties properties;

    public WorkspaceStore(SnapshotService snapshotService, CodescopeProperties properties) {
        this.snapshotService = snapshotService;
        this.properties = properties;
    }

    @PostConstruct
    void init() {
        rebuild();
    }

    public RepositorySnapshot current() {
        RepositorySnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("No repository snapshot loaded");
        }
        return snapshot;
    }

    /**
     * Rebuild from the configured root and publish the result. Concurrent rebuilds are
     * serialised; readers keep using the previous snapshot until the swap.
     */
    public synchronized RepositorySnapshot rebuild() {
        RepositorySnapshot snapshot = snapshotService.build(Path.of(properties.getRoot()));
        swap(snapshot);
        return snapshot;
    }

    public void swap(RepositorySnapshot snapshot) {
        RepositorySnapshot previous = current.getAndSet(snapshot);
        log.info("[WorkspaceStore] Snapshot swapped: {} files (previous: {})", snapshot.fileCount(),
                previous == null ? "none" : previous.fileCount() + " files");
    }
}
