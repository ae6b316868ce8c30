/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.inspect;

import io.xnatworks.characterize.image.ImageVolume;

/**
 * Minimum, maximum, mean and population standard deviation of one channel.
 */
public final class IntensityStatistics {
    private final double min;
    private final double max;
    private final double mean;
    private final double std;

    public IntensityStatistics(double min, double max, double mean, double std) {
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.std = std;
    }

    /**
     * Statistics of the calibrated values of one channel.
     */
    public static IntensityStatistics of(ImageVolume volume, int channel) {
        int count = volume.getVoxelCount();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double mean = 0;
        double m2 = 0;
        for (int i = 0; i < count; i++) {
            double v = volume.value(channel, i);
            if (v < min) min = v;
            if (v > max) max = v;
            // Welford update
            double delta = v - mean;
            mean += delta / (i + 1);
            m2 += delta * (v - mean);
        }
        return new IntensityStatistics(min, max, mean, Math.sqrt(m2 / count));
    }

    public double getMin() { return min; }
    public double getMax() { return max; }
    public double getMean() { return mean; }
    public double getStd() { return std; }
}
