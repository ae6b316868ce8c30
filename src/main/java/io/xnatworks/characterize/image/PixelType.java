/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.image;

/**
 * Storage type of one channel sample.
 */
public enum PixelType {
    UINT8("8-bit unsigned integer", 1, 255.0),
    UINT16("16-bit unsigned integer", 2, 65535.0),
    FLOAT32("32-bit float", 4, Double.NaN);

    private final String label;
    private final int bytesPerSample;
    private final double nominalMax;

    PixelType(String label, int bytesPerSample, double nominalMax) {
        this.label = label;
        this.bytesPerSample = bytesPerSample;
        this.nominalMax = nominalMax;
    }

    public String getLabel() {
        return label;
    }

    public int getBytesPerSample() {
        return bytesPerSample;
    }

    /**
     * Largest representable value for integer types, NaN for floating point.
     */
    public double getNominalMax() {
        return nominalMax;
    }
}
