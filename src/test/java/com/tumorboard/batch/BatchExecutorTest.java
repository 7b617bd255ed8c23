package com.tumorboard.batch;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BatchExecutorTest {

    @Test
    void failedItemDoesNotAffectSiblingsAndOrderIsKept() throws Exception {
        List<Integer> inputs = List.of(1, 2, 3, 4, 5);
        List<ItemOutcome<Integer, String>> outcomes = new BatchExecutor(2).runAll(inputs, n -> {
            if (n == 3) {
                throw new IllegalStateException("item three failed");
            }
            Thread.sleep(10L * (6 - n));
            return "v" + n;
        });

        assertEquals(5, outcomes.size());
        List<String> values = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            ItemOutcome<Integer, String> outcome = outcomes.get(i);
            assertEquals(i, outcome.getIndex());
            assertEquals(inputs.get(i), outcome.getInput());
            if (outcome.isSuccess()) {
                values.add(outcome.getValue());
            }
        }
        assertEquals(List.of("v1", "v2", "v4", "v5"), values);
        assertFalse(outcomes.get(2).isSuccess());
        assertEquals("item three failed", outcomes.get(2).getError().getMessage());
        assertThrows(IllegalStateException.class, () -> outcomes.get(2).getValue());
    }

    @Test
    void neverExceedsConcurrencyBound() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Integer> inputs = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            inputs.add(i);
        }

        List<ItemOutcome<Integer, Integer>> outcomes = new BatchExecutor(3).runAll(inputs, n -> {
            int current = inFlight.incrementAndGet();
            peak.accumulateAndGet(current, Math::max);
            try {
                Thread.sleep(15);
                return n * 2;
            } finally {
                inFlight.decrementAndGet();
            }
        });

        assertEquals(20, outcomes.size());
        assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
        assertTrue(peak.get() >= 2, "gate never admitted parallel items, peak was " + peak.get());
        assertTrue(outcomes.stream().allMatch(ItemOutcome::isSuccess));
    }

    @Test
    void gateHoldsBackItemsBeyondTheBound() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger started = new AtomicInteger();
        BatchExecutor executor = new BatchExecutor(2);

        Thread runner = new Thread(() -> {
            try {
                executor.runAll(List.of(1, 2, 3, 4, 5), n -> {
                    started.incrementAndGet();
                    release.await();
                    return n;
                });
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        runner.start();

        long deadline = System.currentTimeMillis() + 2000;
        while (started.get() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        Thread.sleep(100);
        assertEquals(2, started.get());

        release.countDown();
        runner.join(2000);
        assertEquals(5, started.get());
        assertFalse(runner.isAlive());
    }

    @Test
    void emptyInputYieldsNoOutcomes() throws Exception {
        assertTrue(new BatchExecutor(1).runAll(List.<String>of(), s -> s).isEmpty());
        assertTrue(new BatchExecutor(1).runAll(null, (String s) -> s).isEmpty());
    }

    @Test
    void rejectsNonPositiveBound() {
        assertThrows(IllegalArgumentException.class, () -> new BatchExecutor(0));
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyGate(0));
    }

    @Test
    void gateReleasesPermitOnFailure() {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        assertThrows(IllegalStateException.class, () -> gate.run(() -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(1, gate.availablePermits());
    }
}
