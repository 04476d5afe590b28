package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.dto.ContextEntry;
import com.ai.codescope.dto.ContextResponse;
import com.ai.codescope.dto.ContextSummary;
import com.ai.codescope.model.BudgetUnit;
import com.ai.codescope.model.ContextSlot;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.RepositorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Packs requested files into a size-bounded context bundle.
 * <p>
 * Paths are taken in request order. Files are included whole while they fit; from the first
 * file that does not fit, every remaining file is replaced by its stub. Content is never cut
 * part-way, and a larger budget never turns a full entry back into a stub.
 */
@Service
public class ContextAssemblyService {

    private static final Logger log = LoggerFactory.getLogger(ContextAssemblyService.class);

    private final StubExtractor stubExtractor;
    private final TokenEstimator tokenEstimator;
    private final int stubMaxBytes;

    public ContextAssemblyService(StubExtractor stubExtractor,
                                  TokenEstimator tokenEstimator,
                                  CodescopeProperties properties) {
        this.stubExtractor = stubExtractor;
        this.tokenEstimator = tokenEstimator;
        this.stubMaxBytes = properties.getStub().getMaxBytes();
    }

    public ContextResponse assemble(RepositorySnapshot snapshot, List<String> paths, BudgetUnit unit, long budget) {
        if (budget < 0) {
            throw new IllegalArgumentException("budget must not be negative: " + budget);
        }
        List<ContextSlot> slots = pack(snapshot, paths, unit, budget);

        List<ContextEntry> entries = new ArrayList<>(slots.size());
        long totalTokens = 0;
        int truncatedFiles = 0;
        for (ContextSlot slot : slots) {
            entries.add(ContextEntry.from(slot));
            totalTokens += slot.size();
            if (slot.truncated()) {
                truncatedFiles++;
            }
        }

        ContextSummary summary = new ContextSummary(entries.size(), totalTokens, truncatedFiles, budget, unit);
        log.info("[ContextAssemblyService] Assembled {} entries: {} {} used of {}, {} truncated",
                entries.size(), totalTokens, unit.value(), budget, truncatedFiles);
        return new ContextResponse(entries, summary);
    }

    List<ContextSlot> pack(RepositorySnapshot snapshot, List<String> paths, BudgetUnit unit, long budget) {
        List<ContextSlot> slots = new ArrayList<>(paths.size());
        long remaining = budget;
        boolean overflowed = false;

        for (String path : paths) {
            Optional<IndexedFile> indexed = path == null ? Optional.empty() : snapshot.find(path);
            if (indexed.isEmpty()) {
                log.debug("[ContextAssemblyService] Unknown path requested: {}", path);
                slots.add(new ContextSlot.Missing(path));
                continue;
            }
            IndexedFile file = indexed.get();

            Optional<String> content = snapshot.read(path);
            if (content.isEmpty()) {
                log.warn("[ContextAssemblyService] Content unavailable, using header stub: {}", path);
                String header = stubExtractor.header(file);
                long size = tokenEstimator.measure(header, unit);
                slots.add(new ContextSlot.Stub(path, header, size));
                remaining = Math.max(0, remaining - size);
                continue;
            }

            String text = content.get();
            long size = tokenEstimator.measure(text, unit);
            if (!overflowed && size <= remaining) {
                slots.add(new ContextSlot.Full(path, text, size));
                remaining -= size;
                continue;
            }

            overflowed = true;
            String stub = stubFor(file, text);
            long stubSize = tokenEstimator.measure(stub, unit);
            slots.add(new ContextSlot.Stub(path, stub, stubSize));
            remaining = Math.max(0, remaining - stubSize);
        }
        return slots;
    }

    /**
     * Stub text capped at the configured maximum and at the size of the file itself.
     * The header line is always kept whole, even when the file is smaller than it.
     */
    public String stubFor(IndexedFile file, String content) {
        long headerBytes = TokenEstimator.utf8Length(stubExtractor.header(file));
        long cap = Math.max(headerBytes, Math.min(stubMaxBytes, TokenEstimator.utf8Length(content)));
        return TokenEstimator.truncateToBytes(stubExtractor.extract(file, content), cap);
    }
}
