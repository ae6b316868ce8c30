/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.series;

import java.util.List;
import java.util.Objects;

/**
 * Identifies the files believed to form one multi-file image:
 * {@code seriesUid:studyUid:discriminator1:discriminator2...}.
 *
 * Missing discriminator values are stored as a single space so the key keeps its shape.
 */
public final class SeriesKey implements Comparable<SeriesKey> {

    public static final String MISSING_VALUE = " ";

    private final String seriesUid;
    private final String studyUid;
    private final List<String> discriminators;
    private final String text;

    public SeriesKey(String seriesUid, String studyUid, List<String> discriminators) {
        this.seriesUid = Objects.requireNonNull(seriesUid, "seriesUid");
        this.studyUid = Objects.requireNonNull(studyUid, "studyUid");
        this.discriminators = List.copyOf(discriminators);
        StringBuilder sb = new StringBuilder(seriesUid).append(':').append(studyUid).append(':');
        sb.append(String.join(":", this.discriminators));
        this.text = sb.toString();
    }

    public String getSeriesUid() { return seriesUid; }
    public String getStudyUid() { return studyUid; }
    public List<String> getDiscriminators() { return discriminators; }

    @Override
    public int compareTo(SeriesKey other) {
        return text.compareTo(other.text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeriesKey)) return false;
        return text.equals(((SeriesKey) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
