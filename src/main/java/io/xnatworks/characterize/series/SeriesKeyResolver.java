/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.series;

import io.xnatworks.characterize.image.DicomTags;
import io.xnatworks.characterize.image.ImageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives a {@link SeriesKey} from the header of one file.
 *
 * Only series-capable (DICOM) files resolve. Files whose header cannot be read or that lack
 * the series or study instance UID are left out of series grouping; that is never an error.
 */
public class SeriesKeyResolver {
    private static final Logger log = LoggerFactory.getLogger(SeriesKeyResolver.class);

    private final ImageDecoder decoder;
    private final List<String> discriminatorTags;

    /**
     * @param discriminatorTags canonical tags whose values split series sharing UIDs
     */
    public SeriesKeyResolver(ImageDecoder decoder, List<String> discriminatorTags) {
        this.decoder = decoder;
        this.discriminatorTags = List.copyOf(discriminatorTags);
    }

    public Optional<ResolvedFile> resolve(Path file) {
        Map<String, String> tags;
        try {
            tags = decoder.readSeriesHeader(file);
        } catch (Exception e) {
            log.debug("No series key for {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        String seriesUid = nonBlank(tags.get(DicomTags.SERIES_INSTANCE_UID));
        String studyUid = nonBlank(tags.get(DicomTags.STUDY_INSTANCE_UID));
        if (seriesUid == null || studyUid == null) {
            log.debug("No series key for {}: missing series or study instance UID", file);
            return Optional.empty();
        }

        List<String> values = new ArrayList<>(discriminatorTags.size());
        for (String tag : discriminatorTags) {
            String value = nonBlank(tags.get(tag));
            values.add(value != null ? value : SeriesKey.MISSING_VALUE);
        }
        return Optional.of(new ResolvedFile(new SeriesKey(seriesUid, studyUid, values), file));
    }

    private static String nonBlank(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
