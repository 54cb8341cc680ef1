package com.echopost.media.core.concurrent;

import com.echopost.media.logging.AppLogger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Runs a task over a list in fixed-size batches. Items inside a batch run
 * concurrently, each bounded by the item timeout; the next batch starts only
 * after every item of the current one has finished, failed or timed out.
 * Peak concurrency therefore never exceeds the batch size.
 * <p>
 * A failing or timed-out item is handed to the {@link FailureHandler} and never
 * aborts the pass. Results keep the input order.
 */
public final class BoundedBatchRunner {

    private static final Logger LOGGER = AppLogger.get();

    private final int batchSize;
    private final Duration itemTimeout;
    private final String threadName;

    public BoundedBatchRunner(int batchSize, Duration itemTimeout, String threadName) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
        this.itemTimeout = Objects.requireNonNull(itemTimeout, "itemTimeout");
        this.threadName = Objects.requireNonNull(threadName, "threadName");
    }

    @FunctionalInterface
    public interface ItemTask<T, R> {
        /**
         * @return the item's result, or empty to drop it without counting a failure
         */
        Optional<R> run(T item) throws Exception;
    }

    @FunctionalInterface
    public interface FailureHandler<T, R> {
        /**
         * @param cause the task's exception, or a {@link TimeoutException} when the item ran too long
         */
        Optional<R> onFailure(T item, Throwable cause);
    }

    public <T, R> List<R> run(List<? extends T> items, ItemTask<T, R> task) {
        return run(items, task, (item, cause) -> Optional.empty(), BatchListener.NONE);
    }

    public <T, R> List<R> run(List<? extends T> items,
                              ItemTask<T, R> task,
                              FailureHandler<T, R> onFailure,
                              BatchListener listener) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        int batchCount = (items.size() + batchSize - 1) / batchSize;
        List<R> results = new ArrayList<>(items.size());

        for (int batchIndex = 0; batchIndex < batchCount; batchIndex++) {
            int from = batchIndex * batchSize;
            List<? extends T> batch = items.subList(from, Math.min(from + batchSize, items.size()));
            int before = results.size();
            boolean interrupted = runBatch(batch, task, onFailure, results);
            int emitted = results.size() - before;
            listener.onBatchCompleted(batchIndex, batchCount, emitted, batch.size() - emitted);
            if (interrupted) {
                LOGGER.warning("Batch pass interrupted after batch " + (batchIndex + 1) + " of " + batchCount);
                Thread.currentThread().interrupt();
                break;
            }
        }
        return results;
    }

    private <T, R> boolean runBatch(List<? extends T> batch,
                                    ItemTask<T, R> task,
                                    FailureHandler<T, R> onFailure,
                                    List<R> results) {
        ExecutorService pool = Executors.newFixedThreadPool(batch.size(), threadFactory());
        try {
            List<Future<Optional<R>>> futures = new ArrayList<>(batch.size());
            for (T item : batch) {
                futures.add(pool.submit(() -> task.run(item)));
            }
            long deadline = System.nanoTime() + itemTimeout.toNanos();

            for (int i = 0; i < futures.size(); i++) {
                Future<Optional<R>> future = futures.get(i);
                T item = batch.get(i);
                try {
                    long remaining = Math.max(0L, deadline - System.nanoTime());
                    future.get(remaining, TimeUnit.NANOSECONDS).ifPresent(results::add);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    recordFailure(item, new TimeoutException("Timed out after " + itemTimeout.toMillis() + " ms"),
                        onFailure, results);
                } catch (ExecutionException e) {
                    recordFailure(item, e.getCause() == null ? e : e.getCause(), onFailure, results);
                } catch (CancellationException e) {
                    recordFailure(item, e, onFailure, results);
                } catch (InterruptedException e) {
                    for (int j = i; j < futures.size(); j++) {
                        futures.get(j).cancel(true);
                    }
                    return true;
                }
            }
            return false;
        } finally {
            pool.shutdownNow();
        }
    }

    private static <T, R> void recordFailure(T item, Throwable cause, FailureHandler<T, R> onFailure, List<R> results) {
        try {
            onFailure.onFailure(item, cause).ifPresent(results::add);
        } catch (RuntimeException handlerFailure) {
            LOGGER.warning("Failure handler threw for " + item + ": " + handlerFailure.getMessage());
        }
    }

    private ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, threadName + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
