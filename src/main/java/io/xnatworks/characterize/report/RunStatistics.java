/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.report;

/**
 * Counts describing one run.
 */
public final class RunStatistics {
    private final int itemCount;
    private final int problemCount;
    private final int duplicateGroupCount;
    private final int duplicateItemCount;
    private final int failedTaskCount;

    public RunStatistics(int itemCount, int problemCount, int duplicateGroupCount, int duplicateItemCount,
                         int failedTaskCount) {
        this.itemCount = itemCount;
        this.problemCount = problemCount;
        this.duplicateGroupCount = duplicateGroupCount;
        this.duplicateItemCount = duplicateItemCount;
        this.failedTaskCount = failedTaskCount;
    }

    /** Items returned by inspection, problem items included. */
    public int getItemCount() { return itemCount; }
    public int getProblemCount() { return problemCount; }
    public int getReadableCount() { return itemCount - problemCount; }
    public int getDuplicateGroupCount() { return duplicateGroupCount; }
    public int getDuplicateItemCount() { return duplicateItemCount; }
    /** Tasks that crashed without producing an item. */
    public int getFailedTaskCount() { return failedTaskCount; }

    @Override
    public String toString() {
        return String.format("%d items (%d readable, %d problems), %d duplicate groups covering %d items, %d failed tasks",
                itemCount, getReadableCount(), problemCount, duplicateGroupCount, duplicateItemCount, failedTaskCount);
    }
}
