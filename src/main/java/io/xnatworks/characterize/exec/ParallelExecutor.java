/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one task per input on a fixed-size worker pool.
 *
 * Tasks share nothing but their inputs. Results are returned in input order. A task that
 * throws is recorded as a {@link TaskFailure} and logged with its input; the other tasks
 * carry on.
 */
public class ParallelExecutor {
    private static final Logger log = LoggerFactory.getLogger(ParallelExecutor.class);

    private final int workers;

    public ParallelExecutor(int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("Worker count must be positive: " + workers);
        }
        this.workers = workers;
    }

    /**
     * @param progress a context in the RUNNING state, notified once per finished task
     */
    public <I, R> ExecutionResult<I, R> execute(List<I> inputs, Function<I, R> task, ProgressContext progress)
            throws InterruptedException {
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "characterize-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.debug("Running {} tasks on {} workers", inputs.size(), workers);

        Object[] slots = new Object[inputs.size()];
        boolean[] done = new boolean[inputs.size()];
        List<TaskFailure<I>> failures = new ArrayList<>();
        try {
            CompletionService<R> completion = new ExecutorCompletionService<>(executor);
            Map<Future<R>, Integer> pending = new HashMap<>();
            for (int i = 0; i < inputs.size(); i++) {
                I input = inputs.get(i);
                pending.put(completion.submit(() -> task.apply(input)), i);
            }

            for (int n = 0; n < inputs.size(); n++) {
                Future<R> future = completion.take();
                int index = pending.remove(future);
                try {
                    slots[index] = future.get();
                    done[index] = true;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Task failed for {}: {}", inputs.get(index), cause.toString(), cause);
                    failures.add(new TaskFailure<>(inputs.get(index), cause));
                }
                progress.taskCompleted();
            }
        } finally {
            executor.shutdownNow();
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate");
            }
        }

        // Results keep input order whatever order the workers finished in
        List<R> results = new ArrayList<>(inputs.size());
        for (int i = 0; i < slots.length; i++) {
            if (done[i]) {
                @SuppressWarnings("unchecked")
                R result = (R) slots[i];
                results.add(result);
            }
        }
        return new ExecutionResult<>(results, failures);
    }
}
