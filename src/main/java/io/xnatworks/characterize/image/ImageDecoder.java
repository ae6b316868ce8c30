/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.image;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Image decoding capability used by the inspector and the series key resolver.
 *
 * Implementations never throw for undecodable content: such input is reported through
 * {@link DecodeResult}. Only {@link #readSeriesHeader(Path)} signals failure by exception,
 * since a header that cannot be read simply excludes the file from series grouping.
 */
public interface ImageDecoder {

    /**
     * Decode one file, pixels and tags.
     */
    DecodeResult decode(Path file);

    /**
     * Decode every slice of one series found in a directory, in physical slice order.
     *
     * @param seriesUid series instance UID to select, or null to use every series file
     */
    DecodeResult decodeSeries(Path directory, String seriesUid);

    /**
     * Read only the header of a series-capable (DICOM) file.
     *
     * @return tag dictionary keyed by canonical {@code GGGG,EEEE} tags
     * @throws IOException if the file is not a series-capable file or its header is unreadable
     */
    Map<String, String> readSeriesHeader(Path file) throws IOException;
}
