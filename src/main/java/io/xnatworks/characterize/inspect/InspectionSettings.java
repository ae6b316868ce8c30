/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.inspect;

import io.xnatworks.characterize.thumbnail.ThumbnailSettings;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What to extract from each image beyond its fixed description.
 */
public final class InspectionSettings {
    private final Map<String, String> metadataColumns;
    private final Map<String, String> validatorColumns;
    private final ThumbnailSettings thumbnailSettings;

    /**
     * @param metadataColumns   heading to metadata key
     * @param validatorColumns  heading to validator executable
     * @param thumbnailSettings thumbnail settings, or null for no thumbnails
     */
    public InspectionSettings(Map<String, String> metadataColumns, Map<String, String> validatorColumns,
                              ThumbnailSettings thumbnailSettings) {
        this.metadataColumns = new LinkedHashMap<>(metadataColumns);
        this.validatorColumns = new LinkedHashMap<>(validatorColumns);
        this.thumbnailSettings = thumbnailSettings;
    }

    public static InspectionSettings none() {
        return new InspectionSettings(Map.of(), Map.of(), null);
    }

    public Map<String, String> getMetadataColumns() { return metadataColumns; }
    public Map<String, String> getValidatorColumns() { return validatorColumns; }
    public ThumbnailSettings getThumbnailSettings() { return thumbnailSettings; }
}
