/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.characterize.exec;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParallelExecutor Tests")
class ParallelExecutorTest {

    private static List<Integer> range(int count) {
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(i);
        }
        return values;
    }

    private static ProgressContext started(int total) {
        ProgressContext progress = new ProgressContext("test", false);
        progress.start(total);
        return progress;
    }

    @Test
    @DisplayName("Should return results in input order")
    void shouldReturnResultsInInputOrder() throws InterruptedException {
        List<Integer> inputs = range(20);

        ExecutionResult<Integer, Integer> result = new ParallelExecutor(4).execute(inputs, i -> {
            try {
                Thread.sleep((20 - i) % 5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return i * i;
        }, started(inputs.size()));

        List<Integer> expected = new ArrayList<>();
        for (int i : inputs) {
            expected.add(i * i);
        }
        assertEquals(expected, result.getResults());
        assertFalse(result.hasFailures());
    }

    @Test
    @DisplayName("Should record a crashing task with its input and keep going")
    void shouldRecordFailures() throws InterruptedException {
        ProgressContext progress = started(5);

        ExecutionResult<Integer, String> result = new ParallelExecutor(2).execute(range(5), i -> {
            if (i == 3) {
                throw new IllegalStateException("bad input " + i);
            }
            return "ok" + i;
        }, progress);

        assertEquals(List.of("ok0", "ok1", "ok2", "ok4"), result.getResults());
        assertEquals(1, result.getFailures().size());
        TaskFailure<Integer> failure = result.getFailures().get(0);
        assertEquals(3, failure.getInput());
        assertInstanceOf(IllegalStateException.class, failure.getCause());
        assertEquals(5, progress.getCompleted());
    }

    @Test
    @DisplayName("Should run tasks concurrently on the configured workers")
    void shouldRunConcurrently() throws InterruptedException {
        CountDownLatch bothRunning = new CountDownLatch(2);
        Set<String> threads = ConcurrentHashMap.newKeySet();

        ExecutionResult<Integer, Boolean> result = new ParallelExecutor(2).execute(range(2), i -> {
            threads.add(Thread.currentThread().getName());
            bothRunning.countDown();
            try {
                return bothRunning.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }, started(2));

        assertEquals(List.of(true, true), result.getResults());
        assertEquals(2, threads.size());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("characterize-worker-")));
    }

    @Test
    @DisplayName("Should handle no inputs")
    void shouldHandleNoInputs() throws InterruptedException {
        ExecutionResult<Integer, Integer> result = new ParallelExecutor(2).execute(List.of(), i -> i, started(0));

        assertTrue(result.getResults().isEmpty());
        assertFalse(result.hasFailures());
    }

    @Test
    @DisplayName("Should reject a non-positive worker count")
    void shouldRejectNonPositiveWorkers() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelExecutor(0));
    }
}
