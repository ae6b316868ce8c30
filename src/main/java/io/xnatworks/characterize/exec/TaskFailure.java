/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.exec;

/**
 * A task that ended without a result, with the input it was given.
 */
public final class TaskFailure<I> {
    private final I input;
    private final Throwable cause;

    public TaskFailure(I input, Throwable cause) {
        this.input = input;
        this.cause = cause;
    }

    public I getInput() { return input; }
    public Throwable getCause() { return cause; }

    @Override
    public String toString() {
        return input + ": " + cause;
    }
}
