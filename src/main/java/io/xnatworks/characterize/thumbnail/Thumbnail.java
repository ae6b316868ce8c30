/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.thumbnail;

import java.util.Arrays;

/**
 * A single-channel 8-bit raster with unit spacing and zero origin.
 */
public final class Thumbnail {
    private final int width;
    private final int height;
    private final byte[] pixels;

    public Thumbnail(int width, int height, byte[] pixels) {
        if (pixels.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " pixels, got " + pixels.length);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public int getPixel(int x, int y) {
        return pixels[y * width + x] & 0xff;
    }

    public byte[] getPixels() {
        return pixels.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Thumbnail)) return false;
        Thumbnail that = (Thumbnail) o;
        return width == that.width && height == that.height && Arrays.equals(pixels, that.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }
}
