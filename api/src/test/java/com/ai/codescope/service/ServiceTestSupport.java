package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.RepositorySnapshot;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory snapshots and a small scan pool for service tests.
 */
final class ServiceTestSupport {

    private ServiceTestSupport() {
    }

    static RepositorySnapshot snapshot(Map<String, String> contents) {
        return snapshot(contents, Set.of());
    }

    /**
     * @param unreadable indexed paths whose content cannot be read
     */
    static RepositorySnapshot snapshot(Map<String, String> contents, Set<String> unreadable) {
        Map<String, String> copy = new LinkedHashMap<>(contents);
        List<IndexedFile> files = new ArrayList<>();
        for (Map.Entry<String, String> entry : copy.entrySet()) {
            files.add(IndexedFile.of(entry.getKey(), entry.getValue().getBytes(StandardCharsets.UTF_8).length));
        }
        return RepositorySnapshot.of(files, path ->
                unreadable.contains(path) ? Optional.empty() : Optional.ofNullable(copy.get(path)));
    }

    static ThreadPoolTaskExecutor executor(int workers) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(1024);
        executor.setThreadNamePrefix("test-scan-");
        executor.initialize();
        return executor;
    }

    static CodescopeProperties properties() {
        CodescopeProperties properties = new CodescopeProperties();
        properties.getScan().setBatchSize(4);
        return properties;
    }
}
