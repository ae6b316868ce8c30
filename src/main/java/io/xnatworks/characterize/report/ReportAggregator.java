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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds a {@link Report} from inspected items.
 *
 * Rows keep the order they were collected in. Duplicate groups are the fingerprint classes
 * with more than one member, sorted by fingerprint, members in row order.
 */
public class ReportAggregator {

    public Report aggregate(List<ImageItem> items, List<? extends TaskFailure<?>> failures) {
        Map<String, List<ImageItem>> byFingerprint = new TreeMap<>();
        int problems = 0;
        for (ImageItem item : items) {
            if (item.isProblem()) {
                problems++;
                continue;
            }
            if (item.getFingerprint() != null) {
                byFingerprint.computeIfAbsent(item.getFingerprint(), k -> new ArrayList<>()).add(item);
            }
        }

        List<DuplicateGroup> groups = new ArrayList<>();
        int duplicateItems = 0;
        for (Map.Entry<String, List<ImageItem>> entry : byFingerprint.entrySet()) {
            if (entry.getValue().size() > 1) {
                groups.add(new DuplicateGroup(entry.getKey(), entry.getValue()));
                duplicateItems += entry.getValue().size();
            }
        }

        RunStatistics statistics = new RunStatistics(items.size(), problems, groups.size(), duplicateItems,
                failures.size());
        return new Report(items, groups, new ArrayList<>(failures), statistics);
    }
}
