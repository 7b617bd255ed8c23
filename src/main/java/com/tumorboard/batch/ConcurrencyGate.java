package com.tumorboard.batch;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Caps how many units of work run their network phase at the same time.
 */
public class ConcurrencyGate {
    private final Semaphore semaphore;

    public ConcurrencyGate(int permits) {
        if (permits < 1) {
            throw new IllegalArgumentException("Concurrency limit must be at least 1, got " + permits);
        }
        this.semaphore = new Semaphore(permits, true);
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public <T> T run(Callable<T> task) throws Exception {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
        try {
            return task.call();
        } finally {
            semaphore.release();
        }
    }
}
