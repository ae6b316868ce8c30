/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.thumbnail;

import io.xnatworks.characterize.image.ImageVolume;
import io.xnatworks.characterize.image.PixelType;
import ij.process.FloatProcessor;

import java.util.Arrays;

/**
 * Reduces a decoded image to a fixed-size 8-bit grayscale thumbnail.
 *
 * Steps, in order:
 * 1. 3-D images are reduced to 2-D by a maximum intensity projection along the projection
 *    axis. A volume holding a single slice is used as that slice, whatever the axis.
 * 2. Images with three or more channels are converted to sRGB luminance and rescaled to [0,255].
 * 3. Other images are windowed to [0,255]: 8-bit data to its own [min,max], anything else to
 *    the interquartile whisker range {@code [max(Q1-1.5*IQR, min), min(Q3+1.5*IQR, max)]}.
 * 4. The result is resampled onto the thumbnail grid with one isotropic spacing chosen so the
 *    whole image fits, centred on the image centre. Pixels outside the image are mid gray.
 *
 * The output depends only on the input samples, their spacing and the settings.
 */
public class ThumbnailGenerator {

    /** Value of thumbnail pixels that fall outside the image. */
    public static final int PAD_VALUE = 128;

    private static final double WHISKER = 1.5;

    public Thumbnail generate(ImageVolume volume, ThumbnailSettings settings) {
        Plane plane = project(volume, settings.getProjectionAxis());
        double[] gray;
        if (plane.channels.length >= 3) {
            gray = luminance(plane, volume.getPixelType());
        } else if (volume.getPixelType() == PixelType.UINT8 && !volume.isCalibrated()) {
            double[] values = plane.channels[0];
            gray = window(values, min(values), max(values));
        } else {
            gray = robustWindow(plane.channels[0]);
        }
        return resample(gray, plane, settings);
    }

    /**
     * A 2-D image of calibrated samples, one array per channel.
     */
    static final class Plane {
        final int width;
        final int height;
        final double spacingX;
        final double spacingY;
        final double[][] channels;

        Plane(int width, int height, double spacingX, double spacingY, double[][] channels) {
            this.width = width;
            this.height = height;
            this.spacingX = spacingX;
            this.spacingY = spacingY;
            this.channels = channels;
        }
    }

    static Plane project(ImageVolume volume, int axis) {
        int[] size = {volume.getWidth(), volume.getHeight(), volume.getDepth()};
        double[] spacing = Arrays.copyOf(volume.getSpacing(), 3);
        int channelCount = volume.getChannelCount();

        // A single slice is a 2-D image whatever the projection axis.
        if (volume.getDimension() == 2 || size[2] == 1) {
            double[][] channels = new double[channelCount][];
            for (int c = 0; c < channelCount; c++) {
                channels[c] = new double[size[0] * size[1]];
                for (int i = 0; i < channels[c].length; i++) {
                    channels[c][i] = volume.value(c, i);
                }
            }
            return new Plane(size[0], size[1], spacing[0], spacing[1], channels);
        }

        // Remaining axes keep their order.
        int u = axis == 0 ? 1 : 0;
        int v = axis == 2 ? 1 : 2;
        int width = size[u];
        int height = size[v];
        double[][] channels = new double[channelCount][width * height];
        int[] position = new int[3];
        for (int c = 0; c < channelCount; c++) {
            double[] out = channels[c];
            for (int j = 0; j < height; j++) {
                for (int i = 0; i < width; i++) {
                    position[u] = i;
                    position[v] = j;
                    double best = Double.NEGATIVE_INFINITY;
                    for (int k = 0; k < size[axis]; k++) {
                        position[axis] = k;
                        int index = position[0] + size[0] * (position[1] + size[1] * position[2]);
                        best = Math.max(best, volume.value(c, index));
                    }
                    out[j * width + i] = best;
                }
            }
        }
        return new Plane(width, height, spacing[u], spacing[v], channels);
    }

    /**
     * sRGB luminance of the first three channels, gamma encoded, rescaled to [0,255].
     */
    static double[] luminance(Plane plane, PixelType type) {
        double scale = type.getNominalMax();
        if (Double.isNaN(scale)) {
            scale = Math.max(max(plane.channels[0]), Math.max(max(plane.channels[1]), max(plane.channels[2])));
            if (scale <= 0) {
                scale = 1.0;
            }
        }
        double[] r = plane.channels[0];
        double[] g = plane.channels[1];
        double[] b = plane.channels[2];
        double[] result = new double[r.length];
        for (int i = 0; i < result.length; i++) {
            double linear = (0.2126 * r[i] + 0.7152 * g[i] + 0.0722 * b[i]) / scale;
            result[i] = linear <= 0.0031308
                    ? 12.92 * linear
                    : 1.055 * Math.pow(linear, 1.0 / 2.4) - 0.055;
        }
        return rescale(result);
    }

    private static double[] rescale(double[] values) {
        double lo = min(values);
        double hi = max(values);
        double[] result = new double[values.length];
        if (hi <= lo) {
            return result;
        }
        double range = hi - lo;
        for (int i = 0; i < values.length; i++) {
            result[i] = Math.floor((values[i] - lo) / range * 255.0);
        }
        return result;
    }

    static double[] robustWindow(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double min = sorted[0];
        double q1 = percentile(sorted, 25);
        double q3 = percentile(sorted, 75);
        double max = sorted[sorted.length - 1];
        double iqr = q3 - q1;
        return window(values, Math.max(q1 - WHISKER * iqr, min), Math.min(q3 + WHISKER * iqr, max));
    }

    /**
     * Linear interpolation between order statistics of sorted data.
     */
    static double percentile(double[] sorted, double p) {
        double position = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    /**
     * Map {@code [lower, upper]} linearly onto [0,255], clamping outside and truncating to integers.
     */
    static double[] window(double[] values, double lower, double upper) {
        double[] result = new double[values.length];
        double factor = upper > lower ? 255.0 / (upper - lower) : 0.0;
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (value <= lower) {
                result[i] = 0;
            } else if (value >= upper) {
                result[i] = 255;
            } else {
                result[i] = Math.floor((value - lower) * factor);
            }
        }
        return result;
    }

    static Thumbnail resample(double[] gray, Plane plane, ThumbnailSettings settings) {
        int outWidth = settings.getWidth();
        int outHeight = settings.getHeight();
        int inWidth = plane.width;
        int inHeight = plane.height;

        double spacing = Math.max(
                (inWidth - 1) * plane.spacingX / Math.max(outWidth - 1, 1),
                (inHeight - 1) * plane.spacingY / Math.max(outHeight - 1, 1));
        if (spacing <= 0) {
            spacing = Math.max(plane.spacingX, plane.spacingY);
        }
        double centerX = inWidth / 2.0 * plane.spacingX;
        double centerY = inHeight / 2.0 * plane.spacingY;
        double originX = centerX - outWidth / 2.0 * spacing;
        double originY = centerY - outHeight / 2.0 * spacing;

        float[] samples = new float[gray.length];
        for (int i = 0; i < gray.length; i++) {
            samples[i] = (float) gray[i];
        }
        FloatProcessor source = new FloatProcessor(inWidth, inHeight, samples);
        Interpolator interpolator = settings.getInterpolator();
        // ImageJ kernels need at least two samples along each axis
        if (inWidth < 2 || inHeight < 2) {
            interpolator = Interpolator.NEAREST_NEIGHBOR;
        }
        source.setInterpolationMethod(interpolator.getImageJMethod());

        byte[] out = new byte[outWidth * outHeight];
        for (int j = 0; j < outHeight; j++) {
            double y = (originY + j * spacing) / plane.spacingY;
            for (int i = 0; i < outWidth; i++) {
                double x = (originX + i * spacing) / plane.spacingX;
                int value;
                if (x < -0.5 || x >= inWidth - 0.5 || y < -0.5 || y >= inHeight - 0.5) {
                    value = PAD_VALUE;
                } else if (interpolator == Interpolator.NEAREST_NEIGHBOR) {
                    int xi = Math.min((int) Math.floor(x + 0.5), inWidth - 1);
                    int yi = Math.min((int) Math.floor(y + 0.5), inHeight - 1);
                    value = (int) gray[yi * inWidth + xi];
                } else {
                    double interpolated = source.getInterpolatedPixel(x, y);
                    value = (int) Math.max(0, Math.min(255, interpolated));
                }
                out[j * outWidth + i] = (byte) value;
            }
        }
        return new Thumbnail(outWidth, outHeight, out);
    }

    private static double min(double[] values) {
        double result = Double.POSITIVE_INFINITY;
        for (double v : values) {
            result = Math.min(result, v);
        }
        return result;
    }

    private static double max(double[] values) {
        double result = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            result = Math.max(result, v);
        }
        return result;
    }
}
