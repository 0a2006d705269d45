package com.foresight.core.engine;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * Parallel map with a join: runs one task per item, at most {@code maxParallel}
 * at a time, and returns once every task has finished.
 * <p>
 * Tasks are responsible for their own fault isolation. If a task throws, the
 * exception is rethrown from {@link #map} after all siblings have been joined.
 * The caller's MDC is propagated to worker threads.
 */
@Component
public class BoundedFanOut {

    private final ExecutorService executor;
    private final int maxParallel;

    @Autowired
    public BoundedFanOut(@Qualifier(ExecutorConfig.FAN_OUT) ExecutorService executor, PipelineProperties properties) {
        this(executor, properties.getMaxParallel());
    }

    public BoundedFanOut(ExecutorService executor, int maxParallel) {
        this.executor = executor;
        this.maxParallel = Math.max(1, maxParallel);
    }

    public <T, R> List<R> map(Collection<T> items, Function<T, R> task) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        var semaphore = new Semaphore(maxParallel);
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        var futures = new ArrayList<CompletableFuture<R>>(items.size());
        for (T item : items) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    semaphore.acquire();
                    try {
                        return task.apply(item);
                    } finally {
                        semaphore.release();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CompletionException(e);
                } finally {
                    MDC.clear();
                }
            }, executor));
        }

        var results = new ArrayList<R>(futures.size());
        RuntimeException firstFailure = null;
        for (var future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                if (firstFailure == null) {
                    firstFailure = e.getCause() instanceof RuntimeException re ? re : e;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
        return results;
    }

    public int getMaxParallel() {
        return maxParallel;
    }
}
