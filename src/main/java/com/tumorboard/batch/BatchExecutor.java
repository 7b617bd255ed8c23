package com.tumorboard.batch;

import com.tumorboard.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one task per input with at most {@code maxConcurrent} in flight.
 *
 * All items are submitted up front to a cached pool; the {@link ConcurrencyGate} is what holds
 * the rest back while {@code maxConcurrent} tasks run.
 *
 * Every item runs to completion. A failing item becomes a failed {@link ItemOutcome} and never
 * affects its siblings. Outcomes come back in input order regardless of completion order.
 */
public class BatchExecutor {

    @FunctionalInterface
    public interface ItemTask<I, O> {
        O run(I input) throws Exception;
    }

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final int maxConcurrent;
    private final AppLogger logger = AppLogger.get();

    public BatchExecutor(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
    }

    /**
     * @throws InterruptedException if the calling thread is interrupted while waiting; in-flight
     *                              items are abandoned
     */
    public <I, O> List<ItemOutcome<I, O>> runAll(List<I> inputs, ItemTask<I, O> task) throws InterruptedException {
        List<ItemOutcome<I, O>> outcomes = new ArrayList<>();
        if (inputs == null || inputs.isEmpty()) {
            return outcomes;
        }

        ConcurrencyGate gate = new ConcurrencyGate(maxConcurrent);
        ExecutorService executor = Executors.newCachedThreadPool(batchThreadFactory());
        try {
            List<Future<ItemOutcome<I, O>>> futures = new ArrayList<>(inputs.size());
            for (int i = 0; i < inputs.size(); i++) {
                final int index = i;
                final I input = inputs.get(i);
                futures.add(executor.submit(() -> runItem(gate, index, input, task)));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    // runItem captures every Exception, so only Errors arrive here
                    Throwable cause = e.getCause();
                    if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    outcomes.add(ItemOutcome.failure(i, inputs.get(i), e));
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw e;
        } finally {
            executor.shutdown();
        }

        long failed = outcomes.stream().filter(o -> !o.isSuccess()).count();
        if (failed > 0) {
            logger.warn("Batch finished with " + failed + "/" + outcomes.size() + " failed items");
        }
        return outcomes;
    }

    private <I, O> ItemOutcome<I, O> runItem(ConcurrencyGate gate, int index, I input, ItemTask<I, O> task) {
        try {
            O value = gate.run(() -> task.run(input));
            return ItemOutcome.success(index, input, value);
        } catch (Exception e) {
            logger.warn("Item " + (index + 1) + " (" + input + ") failed: " + describe(e));
            return ItemOutcome.failure(index, input, e);
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static ThreadFactory batchThreadFactory() {
        int pool = POOL_COUNTER.incrementAndGet();
        AtomicInteger thread = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "tumorboard-batch-" + pool + "-" + thread.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
