/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.thumbnail;

/**
 * Size, projection axis and interpolation kernel of generated thumbnails.
 */
public final class ThumbnailSettings {
    private final int width;
    private final int height;
    private final int projectionAxis;
    private final Interpolator interpolator;

    public ThumbnailSettings(int width, int height, int projectionAxis, Interpolator interpolator) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Thumbnail size must be positive: " + width + "x" + height);
        }
        if (projectionAxis < 0 || projectionAxis > 2) {
            throw new IllegalArgumentException("Projection axis must be 0, 1 or 2: " + projectionAxis);
        }
        this.width = width;
        this.height = height;
        this.projectionAxis = projectionAxis;
        this.interpolator = interpolator;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getProjectionAxis() { return projectionAxis; }
    public Interpolator getInterpolator() { return interpolator; }
}
