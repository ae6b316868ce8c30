/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.series;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file together with the series key read from its header.
 */
public final class ResolvedFile {
    private final SeriesKey key;
    private final Path path;

    public ResolvedFile(SeriesKey key, Path path) {
        this.key = Objects.requireNonNull(key, "key");
        this.path = Objects.requireNonNull(path, "path");
    }

    public SeriesKey getKey() { return key; }
    public Path getPath() { return path; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedFile)) return false;
        ResolvedFile that = (ResolvedFile) o;
        return key.equals(that.key) && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, path);
    }

    @Override
    public String toString() {
        return key + " -> " + path;
    }
}
