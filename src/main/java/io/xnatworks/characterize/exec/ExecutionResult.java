/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.exec;

import java.util.List;

/**
 * Results of all tasks that returned, in input order, and the tasks that did not.
 */
public final class ExecutionResult<I, R> {
    private final List<R> results;
    private final List<TaskFailure<I>> failures;

    public ExecutionResult(List<R> results, List<TaskFailure<I>> failures) {
        this.results = List.copyOf(results);
        this.failures = List.copyOf(failures);
    }

    public List<R> getResults() { return results; }
    public List<TaskFailure<I>> getFailures() { return failures; }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
