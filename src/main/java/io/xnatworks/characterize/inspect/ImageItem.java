/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.inspect;

import io.xnatworks.characterize.thumbnail.Thumbnail;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One report row: a single file or an assembled series.
 *
 * An item whose image could not be decoded carries nothing but its files and is a
 * "problem item". Items are immutable once built.
 */
public final class ImageItem {

    private final String key;
    private final List<Path> files;
    private final String fingerprint;
    private final int[] size;
    private final double[] spacing;
    private final double[] origin;
    private final double[] direction;
    private final String pixelType;
    private final IntensityStatistics statistics;
    private final Map<String, String> metadata;
    private final Map<String, ValidatorOutcome> validatorOutcomes;
    private final Thumbnail thumbnail;

    private ImageItem(Builder builder) {
        this.key = builder.key;
        this.files = List.copyOf(builder.files);
        this.fingerprint = builder.fingerprint;
        this.size = builder.size != null ? builder.size.clone() : null;
        this.spacing = builder.spacing != null ? builder.spacing.clone() : null;
        this.origin = builder.origin != null ? builder.origin.clone() : null;
        this.direction = builder.direction != null ? builder.direction.clone() : null;
        this.pixelType = builder.pixelType;
        this.statistics = builder.statistics;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.validatorOutcomes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.validatorOutcomes));
        this.thumbnail = builder.thumbnail;
    }

    public static Builder builder(String key, List<Path> files) {
        return new Builder(key, files);
    }

    /**
     * An item for input that could not be decoded.
     */
    public static ImageItem problem(String key, List<Path> files) {
        return new Builder(key, files).build();
    }

    public String getKey() { return key; }
    public List<Path> getFiles() { return files; }
    public String getFingerprint() { return fingerprint; }
    public int[] getSize() { return size != null ? size.clone() : null; }
    public double[] getSpacing() { return spacing != null ? spacing.clone() : null; }
    public double[] getOrigin() { return origin != null ? origin.clone() : null; }
    public double[] getDirection() { return direction != null ? direction.clone() : null; }
    public String getPixelType() { return pixelType; }
    /** Null for true color images and problem items. */
    public IntensityStatistics getStatistics() { return statistics; }
    /** Heading to value, only for keys present in the image. */
    public Map<String, String> getMetadata() { return metadata; }
    public Map<String, ValidatorOutcome> getValidatorOutcomes() { return validatorOutcomes; }
    public Thumbnail getThumbnail() { return thumbnail; }

    /**
     * Number of populated report columns, the file list included.
     */
    public int populatedFieldCount() {
        int count = files.isEmpty() ? 0 : 1;
        for (Object field : new Object[]{fingerprint, size, spacing, origin, direction, pixelType}) {
            if (field != null) {
                count++;
            }
        }
        if (statistics != null) {
            count += 4;
        }
        return count + metadata.size() + validatorOutcomes.size();
    }

    public boolean isProblem() {
        return populatedFieldCount() < 2;
    }

    @Override
    public String toString() {
        return "ImageItem{" + key + (isProblem() ? ", problem" : ", " + fingerprint) + "}";
    }

    public static final class Builder {
        private final String key;
        private final List<Path> files;
        private String fingerprint;
        private int[] size;
        private double[] spacing;
        private double[] origin;
        private double[] direction;
        private String pixelType;
        private IntensityStatistics statistics;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private final Map<String, ValidatorOutcome> validatorOutcomes = new LinkedHashMap<>();
        private Thumbnail thumbnail;

        private Builder(String key, List<Path> files) {
            this.key = key;
            this.files = files;
        }

        public Builder fingerprint(String fingerprint) { this.fingerprint = fingerprint; return this; }
        public Builder size(int[] size) { this.size = size; return this; }
        public Builder spacing(double[] spacing) { this.spacing = spacing; return this; }
        public Builder origin(double[] origin) { this.origin = origin; return this; }
        public Builder direction(double[] direction) { this.direction = direction; return this; }
        public Builder pixelType(String pixelType) { this.pixelType = pixelType; return this; }
        public Builder statistics(IntensityStatistics statistics) { this.statistics = statistics; return this; }
        public Builder thumbnail(Thumbnail thumbnail) { this.thumbnail = thumbnail; return this; }

        public Builder metadata(String heading, String value) {
            metadata.put(heading, value);
            return this;
        }

        public Builder validatorOutcome(String heading, ValidatorOutcome outcome) {
            validatorOutcomes.put(heading, outcome);
            return this;
        }

        public ImageItem build() {
            return new ImageItem(this);
        }
    }
}
