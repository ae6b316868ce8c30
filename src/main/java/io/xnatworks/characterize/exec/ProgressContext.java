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

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Progress of one batch of tasks.
 *
 * Owned by the caller: {@link #start(int)} before the batch, {@link #taskCompleted()} once
 * per finished task, {@link #close()} after. A line is logged at every tenth of the batch or
 * once a minute, whichever comes first. A disabled context tracks counts but logs nothing.
 */
public class ProgressContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressContext.class);

    static final long REPORT_INTERVAL_MILLIS = TimeUnit.SECONDS.toMillis(60);

    public enum State {
        IDLE,
        RUNNING,
        CLOSED
    }

    private final String label;
    private final boolean enabled;
    private final LongSupplier clock;

    private State state = State.IDLE;
    private int total;
    private int completed;
    private int step;
    private int nextReport;
    private long lastReportAt;
    private int reportCount;

    public ProgressContext(String label, boolean enabled) {
        this(label, enabled, System::currentTimeMillis);
    }

    ProgressContext(String label, boolean enabled, LongSupplier clock) {
        this.label = label;
        this.enabled = enabled;
        this.clock = clock;
    }

    public synchronized void start(int total) {
        requireState(State.IDLE, "start");
        this.total = total;
        this.step = Math.max(1, (int) Math.ceil(total / 10.0));
        this.nextReport = step;
        this.lastReportAt = clock.getAsLong();
        this.state = State.RUNNING;
    }

    public synchronized void taskCompleted() {
        requireState(State.RUNNING, "record a completed task");
        completed++;
        long now = clock.getAsLong();
        if (completed >= nextReport || completed == total || now - lastReportAt >= REPORT_INTERVAL_MILLIS) {
            report(now);
            while (nextReport <= completed) {
                nextReport += step;
            }
        }
    }

    @Override
    public synchronized void close() {
        if (state == State.CLOSED) {
            throw new IllegalStateException("Progress for '" + label + "' is already closed");
        }
        state = State.CLOSED;
    }

    private void report(long now) {
        lastReportAt = now;
        reportCount++;
        if (enabled) {
            int percent = total == 0 ? 100 : (int) (100L * completed / total);
            log.info("{}: {}/{} ({}%)", label, completed, total, percent);
        }
    }

    private void requireState(State expected, String action) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + action + " for '" + label + "' while " + state);
        }
    }

    public synchronized State getState() { return state; }
    public synchronized int getCompleted() { return completed; }
    public synchronized int getTotal() { return total; }

    /**
     * Number of progress lines due so far, whether or not logging is enabled.
     */
    public synchronized int getReportCount() { return reportCount; }
}
