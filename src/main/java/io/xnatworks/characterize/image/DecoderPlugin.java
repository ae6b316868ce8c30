/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.image;

import ij.io.Opener;

import java.util.Arrays;
import java.util.Set;

/**
 * Decoder selection. {@link #ALL} auto-detects every supported format; the other values
 * restrict decoding to one file format, so files in any other format become problem items.
 */
public enum DecoderPlugin {
    ALL("All"),
    TIFF("TIFF", Opener.TIFF, Opener.TIFF_AND_DICOM),
    DICOM("DICOM", Opener.DICOM, Opener.TIFF_AND_DICOM),
    FITS("FITS", Opener.FITS),
    PGM("PGM", Opener.PGM),
    JPEG("JPEG", Opener.JPEG),
    GIF("GIF", Opener.GIF),
    BMP("BMP", Opener.BMP),
    PNG("PNG", Opener.PNG),
    ZIP("ZIP", Opener.ZIP);

    private static final Set<Integer> IMAGE_FILE_TYPES = Set.of(
            Opener.TIFF, Opener.DICOM, Opener.TIFF_AND_DICOM, Opener.FITS, Opener.PGM,
            Opener.JPEG, Opener.GIF, Opener.BMP, Opener.PNG, Opener.ZIP);

    private final String displayName;
    private final int[] fileTypes;

    DecoderPlugin(String displayName, int... fileTypes) {
        this.displayName = displayName;
        this.fileTypes = fileTypes;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether a file of the given ImageJ file type may be decoded by this plugin.
     */
    public boolean accepts(int fileType) {
        if (this == ALL) {
            return IMAGE_FILE_TYPES.contains(fileType);
        }
        for (int type : fileTypes) {
            if (type == fileType) {
                return true;
            }
        }
        return false;
    }

    /**
     * Case-insensitive lookup by display name, or null.
     */
    public static DecoderPlugin fromName(String name) {
        if (name == null) {
            return null;
        }
        for (DecoderPlugin plugin : values()) {
            if (plugin.displayName.equalsIgnoreCase(name.trim())) {
                return plugin;
            }
        }
        return null;
    }

    public static String[] names() {
        return Arrays.stream(values()).map(DecoderPlugin::getDisplayName).toArray(String[]::new);
    }
}
