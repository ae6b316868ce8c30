/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.thumbnail;

import com.fasterxml.jackson.annotation.JsonCreator;
import ij.process.ImageProcessor;

import java.util.Locale;

/**
 * Interpolation kernel used when resampling a thumbnail.
 */
public enum Interpolator {
    NEAREST_NEIGHBOR(ImageProcessor.NONE),
    LINEAR(ImageProcessor.BILINEAR),
    CUBIC(ImageProcessor.BICUBIC);

    private final int imageJMethod;

    Interpolator(int imageJMethod) {
        this.imageJMethod = imageJMethod;
    }

    /**
     * Matching {@link ImageProcessor} interpolation method.
     */
    public int getImageJMethod() {
        return imageJMethod;
    }

    /**
     * Lenient lookup: enum names in any case, plus the names other toolkits use for the same
     * kernels ({@code sitkNearestNeighbor}, {@code bilinear}, {@code sitkBSpline3}...).
     */
    @JsonCreator
    public static Interpolator fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Interpolator name is null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        if (normalized.startsWith("sitk")) {
            normalized = normalized.substring(4);
        }
        switch (normalized) {
            case "nearestneighbor":
            case "nearest":
            case "none":
                return NEAREST_NEIGHBOR;
            case "linear":
            case "bilinear":
                return LINEAR;
            case "cubic":
            case "bicubic":
            case "bspline":
            case "bspline3":
                return CUBIC;
            default:
                throw new IllegalArgumentException("Unknown interpolator: " + name);
        }
    }
}
