/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.series;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Partitions resolved files into series.
 *
 * The grouping depends only on the set of inputs: keys come back in key order and each
 * series lists its files in path order, whatever order the files were resolved in.
 */
public class SeriesAssembler {

    public Map<SeriesKey, List<Path>> assemble(Collection<ResolvedFile> resolved) {
        Map<SeriesKey, TreeSet<Path>> groups = new TreeMap<>();
        for (ResolvedFile file : resolved) {
            groups.computeIfAbsent(file.getKey(), k -> new TreeSet<>()).add(file.getPath());
        }

        Map<SeriesKey, List<Path>> result = new LinkedHashMap<>();
        for (Map.Entry<SeriesKey, TreeSet<Path>> entry : groups.entrySet()) {
            result.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(result);
    }
}
