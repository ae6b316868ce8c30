/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.image;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A decoded image: one primitive sample array per channel, plus spatial metadata and the
 * decoded tag dictionary.
 *
 * Samples are stored x fastest, then y, then z. Channel arrays are {@code byte[]} for
 * {@link PixelType#UINT8}, {@code short[]} for {@link PixelType#UINT16} and {@code float[]}
 * for {@link PixelType#FLOAT32}. The direction matrix is row-major with one column per axis.
 */
public final class ImageVolume {

    private final int width;
    private final int height;
    private final int depth;
    private final int dimension;
    private final PixelType pixelType;
    private final Object[] channels;
    private final double slope;
    private final double intercept;
    private final double[] spacing;
    private final double[] origin;
    private final double[] direction;
    private final Map<String, String> tags;

    private ImageVolume(Builder builder) {
        this.width = builder.width;
        this.height = builder.height;
        this.depth = builder.depth;
        this.dimension = builder.dimension > 0 ? builder.dimension : (builder.depth > 1 ? 3 : 2);
        this.pixelType = builder.pixelType;
        this.channels = builder.channels;
        this.slope = builder.slope;
        this.intercept = builder.intercept;
        this.spacing = builder.spacing.clone();
        this.origin = builder.origin.clone();
        this.direction = builder.direction.clone();
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));

        int expected = width * height * depth;
        for (Object channel : channels) {
            if (length(channel) != expected) {
                throw new IllegalArgumentException("Channel length " + length(channel)
                        + " does not match " + width + "x" + height + "x" + depth);
            }
        }
    }

    public static Builder builder(int width, int height, int depth, PixelType pixelType) {
        return new Builder(width, height, depth, pixelType);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getDepth() { return depth; }
    public int getDimension() { return dimension; }
    public PixelType getPixelType() { return pixelType; }
    public int getChannelCount() { return channels.length; }
    public Map<String, String> getTags() { return tags; }

    public int getVoxelCount() {
        return width * height * depth;
    }

    /**
     * Whether stored samples are mapped through a linear rescale.
     */
    public boolean isCalibrated() {
        return slope != 1.0 || intercept != 0.0;
    }

    /**
     * Calibrated intensity of one sample.
     */
    public double value(int channel, int index) {
        Object data = channels[channel];
        double raw;
        if (data instanceof byte[]) {
            raw = ((byte[]) data)[index] & 0xff;
        } else if (data instanceof short[]) {
            raw = ((short[]) data)[index] & 0xffff;
        } else {
            raw = ((float[]) data)[index];
        }
        return raw * slope + intercept;
    }

    /**
     * Exact, sample-for-sample equality of two channels.
     */
    public boolean channelsIdentical(int a, int b) {
        Object first = channels[a];
        Object second = channels[b];
        if (first instanceof byte[]) {
            return Arrays.equals((byte[]) first, (byte[]) second);
        } else if (first instanceof short[]) {
            return Arrays.equals((short[]) first, (short[]) second);
        }
        return Arrays.equals((float[]) first, (float[]) second);
    }

    /**
     * Stored samples of one channel as little-endian bytes.
     */
    public byte[] channelBytes(int channel) {
        int count = getVoxelCount();
        ByteBuffer buffer = ByteBuffer.allocate(count * pixelType.getBytesPerSample()).order(ByteOrder.LITTLE_ENDIAN);
        putSamples(buffer, channel, 0, count);
        return buffer.array();
    }

    /**
     * Stored samples of all channels, interleaved per voxel, as little-endian bytes.
     */
    public byte[] interleavedBytes() {
        int count = getVoxelCount();
        ByteBuffer buffer = ByteBuffer.allocate(count * channels.length * pixelType.getBytesPerSample())
                .order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < count; i++) {
            for (int c = 0; c < channels.length; c++) {
                putSamples(buffer, c, i, 1);
            }
        }
        return buffer.array();
    }

    private void putSamples(ByteBuffer buffer, int channel, int from, int count) {
        Object data = channels[channel];
        if (data instanceof byte[]) {
            buffer.put((byte[]) data, from, count);
        } else if (data instanceof short[]) {
            short[] samples = (short[]) data;
            for (int i = from; i < from + count; i++) {
                buffer.putShort(samples[i]);
            }
        } else {
            float[] samples = (float[]) data;
            for (int i = from; i < from + count; i++) {
                buffer.putFloat(samples[i]);
            }
        }
    }

    /**
     * Pixel extent per axis, one entry per image dimension.
     */
    public int[] getSize() {
        int[] size = {width, height, depth};
        return Arrays.copyOf(size, dimension);
    }

    public double[] getSpacing() {
        return Arrays.copyOf(spacing, dimension);
    }

    public double[] getOrigin() {
        return Arrays.copyOf(origin, dimension);
    }

    /**
     * Direction cosines, row-major, {@code dimension x dimension}.
     */
    public double[] getDirection() {
        double[] result = new double[dimension * dimension];
        for (int row = 0; row < dimension; row++) {
            for (int col = 0; col < dimension; col++) {
                result[row * dimension + col] = direction[row * 3 + col];
            }
        }
        return result;
    }

    private static int length(Object channel) {
        if (channel instanceof byte[]) return ((byte[]) channel).length;
        if (channel instanceof short[]) return ((short[]) channel).length;
        if (channel instanceof float[]) return ((float[]) channel).length;
        throw new IllegalArgumentException("Unsupported channel array: " + channel);
    }

    public static final class Builder {
        private final int width;
        private final int height;
        private final int depth;
        private final PixelType pixelType;
        private int dimension;
        private Object[] channels = new Object[0];
        private double slope = 1.0;
        private double intercept = 0.0;
        private double[] spacing = {1.0, 1.0, 1.0};
        private double[] origin = {0.0, 0.0, 0.0};
        private double[] direction = {1, 0, 0, 0, 1, 0, 0, 0, 1};
        private Map<String, String> tags = Map.of();

        private Builder(int width, int height, int depth, PixelType pixelType) {
            this.width = width;
            this.height = height;
            this.depth = depth;
            this.pixelType = pixelType;
        }

        /**
         * Force the reported dimension, e.g. 3 for a single DICOM slice with patient geometry.
         */
        public Builder dimension(int dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder channels(Object... channels) {
            this.channels = channels;
            return this;
        }

        public Builder rescale(double slope, double intercept) {
            this.slope = slope;
            this.intercept = intercept;
            return this;
        }

        public Builder spacing(double x, double y, double z) {
            this.spacing = new double[]{x, y, z};
            return this;
        }

        public Builder origin(double x, double y, double z) {
            this.origin = new double[]{x, y, z};
            return this;
        }

        /**
         * Row-major 3x3 direction matrix whose columns are the axis directions.
         */
        public Builder direction(double[] direction) {
            if (direction.length != 9) {
                throw new IllegalArgumentException("Direction must have 9 entries");
            }
            this.direction = direction;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public ImageVolume build() {
            return new ImageVolume(this);
        }
    }
}
