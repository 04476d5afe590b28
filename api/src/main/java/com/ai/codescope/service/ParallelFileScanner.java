package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.exception.DeadlineExceededException;
import com.ai.codescope.model.Deadline;
import com.ai.codescope.model.IndexedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Fans per-file work out to the scan pool and fans results back in by input position.
 * Result order always equals input order, whatever order the workers finish in.
 */
@Service
public class ParallelFileScanner {

    private static final Logger log = LoggerFactory.getLogger(ParallelFileScanner.class);

    private static final long MAX_WAIT_NANOS = TimeUnit.HOURS.toNanos(1);

    private final ThreadPoolTaskExecutor executor;
    private final int batchSize;

    public ParallelFileScanner(@Qualifier("scanTaskExecutor") ThreadPoolTaskExecutor executor,
            CodescopeProperties properties) {
        this.executor = executor;
        this.batchSize = Math.max(1, properties.getScan().getBatchSize());
    }

    /**
     * Run {@code work} for every file.
     *
     * @param fallback value recorded for a file whose work threw
     * @throws DeadlineExceededException if the deadline passes before all files are done
     */
    public <T> List<T> scan(List<IndexedFile> files, Function<IndexedFile, T> work, T fallback, Deadline deadline) {
        return scanWhile(files, work, fallback, deadline, results -> true);
    }

    /**
     * Like {@link #scan}, but checks {@code keepGoing} against the results collected so far
     * after each batch and stops early once it returns false.
     */
    public <T> List<T> scanWhile(List<IndexedFile> files, Function<IndexedFile, T> work, T fallback,
            Deadline deadline, Predicate<List<T>> keepGoing) {
        List<T> results = new ArrayList<>(files.size());
        for (int start = 0; start < files.size(); start += batchSize) {
            List<IndexedFile> batch = files.subList(start, Math.min(files.size(), start + batchSize));
            results.addAll(runBatch(batch, work, fallback, deadline));
            if (!keepGoing.test(results)) {
                break;
            }
        }
        return results;
    }

    private <T> List<T> runBatch(List<IndexedFile> batch, Function<IndexedFile, T> work, T fallback,
            Deadline deadline) {
        if (deadline.isExpired()) {
            throw new DeadlineExceededException("Deadline passed before scanning " + batch.size() + " files");
        }

        List<Callable<T>> tasks = new ArrayList<>(batch.size());
        for (IndexedFile file : batch) {
            tasks.add(() -> work.apply(file));
        }

        List<Future<T>> futures;
        try {
            futures = executor.getThreadPoolExecutor()
                    .invokeAll(tasks, Math.min(deadline.remainingNanos(), MAX_WAIT_NANOS), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadlineExceededException("Scan interrupted", e);
        }

        List<T> results = new ArrayList<>(batch.size());
        for (int i = 0; i < futures.size(); i++) {
            Future<T> future = futures.get(i);
            if (future.isCancelled()) {
                throw new DeadlineExceededException("Scan timed out at " + batch.get(i).path());
            }
            try {
                results.add(future.get());
            } catch (CancellationException e) {
                throw new DeadlineExceededException("Scan timed out at " + batch.get(i).path(), e);
            } catch (ExecutionException e) {
                log.warn("[ParallelFileScanner] Scan failed for {}: {}", batch.get(i).path(),
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                results.add(fallback);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DeadlineExceededException("Scan interrupted", e);
            }
        }
        return results;
    }
}
