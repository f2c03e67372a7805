package com.tdnet.insight.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one task per item on a fixed pool of at most {@code maxWorkers} threads and waits for all of them.
 * A failed item yields an empty result and does not affect its siblings.
 */
public class BoundedParallelRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoundedParallelRunner.class);

    private final int maxWorkers;

    public BoundedParallelRunner(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1 but was " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
    }

    /**
     * Results come back in input order, never in completion order.
     */
    public <T, R> List<Optional<R>> runAll(String stage, List<T> items, Function<T, R> task) {
        int total = items.size();
        if (total == 0) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxWorkers, total));
        CompletionService<Indexed<R>> completion = new ExecutorCompletionService<>(pool);
        @SuppressWarnings("unchecked")
        Optional<R>[] results = new Optional[total];
        Arrays.fill(results, Optional.empty());
        int failed = 0;
        try {
            for (int i = 0; i < total; i++) {
                int index = i;
                T item = items.get(i);
                completion.submit(() -> new Indexed<>(index, task.apply(item)));
            }
            for (int done = 1; done <= total; done++) {
                Future<Indexed<R>> future = completion.take();
                try {
                    Indexed<R> indexed = future.get();
                    results[indexed.index()] = Optional.ofNullable(indexed.value());
                } catch (ExecutionException e) {
                    failed++;
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOGGER.error("[{}] item failed: {}", stage, cause.getMessage(), cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(stage + " interrupted", e);
        } finally {
            pool.shutdownNow();
        }
        LOGGER.info("[{}] {} of {} items completed", stage, total - failed, total);
        return new ArrayList<>(Arrays.asList(results));
    }

    private record Indexed<R>(int index, R value) {
    }
}
