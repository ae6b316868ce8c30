/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.inspect;

/**
 * Result of running one external validator against an image.
 */
public enum ValidatorOutcome {
    SUCCEEDED("succeeded"),
    FAILED("failed");

    private final String label;

    ValidatorOutcome(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
