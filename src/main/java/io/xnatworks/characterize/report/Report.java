/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.report;

import io.xnatworks.characterize.exec.TaskFailure;
import io.xnatworks.characterize.inspect.ImageItem;
import io.xnatworks.characterize.thumbnail.Thumbnail;

import java.util.ArrayList;
import java.util.List;

/**
 * All report rows of one run with the duplicate groups and statistics derived from them.
 */
public final class Report {
    private final List<ImageItem> items;
    private final List<DuplicateGroup> duplicateGroups;
    private final List<TaskFailure<?>> failures;
    private final RunStatistics statistics;

    public Report(List<ImageItem> items, List<DuplicateGroup> duplicateGroups, List<TaskFailure<?>> failures,
                  RunStatistics statistics) {
        this.items = List.copyOf(items);
        this.duplicateGroups = List.copyOf(duplicateGroups);
        this.failures = List.copyOf(failures);
        this.statistics = statistics;
    }

    public List<ImageItem> getItems() { return items; }
    public List<DuplicateGroup> getDuplicateGroups() { return duplicateGroups; }
    public List<TaskFailure<?>> getFailures() { return failures; }
    public RunStatistics getStatistics() { return statistics; }

    /**
     * Whether at least one item was decoded.
     */
    public boolean hasReadableItems() {
        return statistics.getReadableCount() > 0;
    }

    /**
     * Thumbnails of the readable items, in row order.
     */
    public List<Thumbnail> getThumbnails() {
        List<Thumbnail> thumbnails = new ArrayList<>();
        for (ImageItem item : items) {
            if (!item.isProblem() && item.getThumbnail() != null) {
                thumbnails.add(item.getThumbnail());
            }
        }
        return thumbnails;
    }
}
