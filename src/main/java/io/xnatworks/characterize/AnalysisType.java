/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize;

import java.util.Locale;

/**
 * Whether each file is one report row, or each DICOM series is.
 */
public enum AnalysisType {
    PER_FILE("per_file"),
    PER_SERIES("per_series");

    private final String cliName;

    AnalysisType(String cliName) {
        this.cliName = cliName;
    }

    public static AnalysisType fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (AnalysisType type : values()) {
            if (type.cliName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown analysis type '" + name + "', expected per_file or per_series");
    }

    @Override
    public String toString() {
        return cliName;
    }
}
