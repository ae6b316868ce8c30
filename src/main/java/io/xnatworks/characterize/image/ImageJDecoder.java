/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.image;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.Opener;
import ij.measure.Calibration;
import ij.plugin.DICOM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link ImageDecoder} backed by ImageJ.
 *
 * Single files go through {@link Opener}, restricted to the file types of the configured
 * {@link DecoderPlugin}. Series are assembled slice by slice with the ImageJ DICOM reader
 * after ordering the slices by their patient geometry.
 */
public class ImageJDecoder implements ImageDecoder {
    private static final Logger log = LoggerFactory.getLogger(ImageJDecoder.class);

    private final DecoderPlugin plugin;

    public ImageJDecoder(DecoderPlugin plugin) {
        this.plugin = plugin;
    }

    @Override
    public DecodeResult decode(Path file) {
        String path = file.toString();
        Opener opener = new Opener();
        opener.setSilentMode(true);

        int fileType = opener.getFileType(path);
        if (!plugin.accepts(fileType)) {
            return DecodeResult.expectedFailure("Not readable by the " + plugin.getDisplayName() + " decoder");
        }

        ImagePlus imp;
        try {
            imp = opener.openImage(path);
        } catch (RuntimeException e) {
            return DecodeResult.unexpectedError(e.toString(), e);
        }
        if (imp == null || imp.getWidth() == 0 || imp.getHeight() == 0) {
            return DecodeResult.expectedFailure("Could not decode image data");
        }

        try {
            Map<String, String> tags = DicomTags.parseInfo(imp.getInfoProperty());
            boolean dicom = fileType == Opener.DICOM || fileType == Opener.TIFF_AND_DICOM;
            ImageVolume volume = toVolume(imp, tags, dicom ? singleSliceGeometry(file, tags) : null);
            return DecodeResult.success(volume, List.of(file));
        } catch (IllegalArgumentException e) {
            return DecodeResult.expectedFailure(e.getMessage());
        } catch (RuntimeException e) {
            return DecodeResult.unexpectedError(e.toString(), e);
        } finally {
            imp.flush();
        }
    }

    @Override
    public DecodeResult decodeSeries(Path directory, String seriesUid) {
        List<SliceOrdering.Slice> slices = new ArrayList<>();
        try (Stream<Path> listing = Files.list(directory)) {
            for (Path file : listing.filter(Files::isRegularFile).sorted().collect(Collectors.toList())) {
                Map<String, String> tags;
                try {
                    tags = readSeriesHeader(file);
                } catch (IOException e) {
                    log.debug("Skipping {} in series directory: {}", file, e.getMessage());
                    continue;
                }
                if (seriesUid == null || seriesUid.equals(tags.get(DicomTags.SERIES_INSTANCE_UID))) {
                    slices.add(new SliceOrdering.Slice(file, tags));
                }
            }
        } catch (IOException e) {
            return DecodeResult.expectedFailure("Cannot list series directory: " + e.getMessage());
        }
        if (slices.isEmpty()) {
            return DecodeResult.expectedFailure("No DICOM slices found for series " + seriesUid);
        }

        SliceOrdering.SeriesGeometry geometry = SliceOrdering.order(slices);
        for (String warning : geometry.getWarnings()) {
            log.warn("Series {} may mix more than one volume: {}", seriesUid, warning);
        }

        try {
            return readSlices(geometry, seriesUid);
        } catch (RuntimeException e) {
            return DecodeResult.unexpectedError(e.toString(), e);
        }
    }

    private DecodeResult readSlices(SliceOrdering.SeriesGeometry geometry, String seriesUid) {
        ImageStack stack = null;
        ImagePlus first = null;
        for (SliceOrdering.Slice slice : geometry.getSlices()) {
            DICOM dicom = new DICOM();
            dicom.open(slice.getPath().toString());
            if (dicom.getWidth() == 0 || dicom.getProcessor() == null) {
                return DecodeResult.expectedFailure("Could not decode slice " + slice.getPath().getFileName());
            }
            if (first == null) {
                first = dicom;
                stack = new ImageStack(dicom.getWidth(), dicom.getHeight());
            } else if (dicom.getWidth() != first.getWidth() || dicom.getHeight() != first.getHeight()
                    || dicom.getBitDepth() != first.getBitDepth()) {
                return DecodeResult.expectedFailure("Slice " + slice.getPath().getFileName()
                        + " does not match the size or type of the first slice");
            }
            stack.addSlice(slice.getPath().getFileName().toString(), dicom.getProcessor());
        }

        ImagePlus imp = new ImagePlus(seriesUid != null ? seriesUid : "series", stack);
        Calibration calibration = first.getCalibration().copy();
        if (!Double.isNaN(geometry.getSliceSpacing())) {
            calibration.pixelDepth = Math.abs(geometry.getSliceSpacing());
        }
        imp.setCalibration(calibration);

        Map<String, String> tags = geometry.getSlices().get(0).getTags();
        ImageVolume volume = toVolume(imp, tags, geometry);
        return DecodeResult.success(volume, geometry.getPaths());
    }

    @Override
    public Map<String, String> readSeriesHeader(Path file) throws IOException {
        String path = file.toString();
        int fileType = new Opener().getFileType(path);
        if (fileType != Opener.DICOM && fileType != Opener.TIFF_AND_DICOM) {
            throw new IOException("Not a DICOM file: " + file);
        }
        String info;
        try {
            info = new DICOM().getInfo(path);
        } catch (RuntimeException e) {
            throw new IOException("Unreadable DICOM header: " + file, e);
        }
        if (info == null || info.isBlank()) {
            throw new IOException("Empty DICOM header: " + file);
        }
        return DicomTags.parseInfo(info);
    }

    /**
     * A single DICOM slice carrying patient geometry is reported as a one-slice volume,
     * otherwise as a plain 2-D image.
     */
    private SliceOrdering.SeriesGeometry singleSliceGeometry(Path file, Map<String, String> tags) {
        if (DicomTags.parseDoubles(tags.get(DicomTags.IMAGE_POSITION_PATIENT), 3) == null
                || DicomTags.parseDoubles(tags.get(DicomTags.IMAGE_ORIENTATION_PATIENT), 6) == null) {
            return null;
        }
        return SliceOrdering.order(List.of(new SliceOrdering.Slice(file, tags)));
    }

    /**
     * Copy an ImageJ image into an {@link ImageVolume}, splitting RGB into three 8-bit channels
     * and hyperstack channels into separate channels.
     */
    static ImageVolume toVolume(ImagePlus imp, Map<String, String> tags, SliceOrdering.SeriesGeometry geometry) {
        int width = imp.getWidth();
        int height = imp.getHeight();
        int slices = imp.getNSlices();
        int frames = imp.getNFrames();
        int depth = slices * frames;
        int planeSize = width * height;
        int bitDepth = imp.getBitDepth();
        ImageStack stack = imp.getStack();

        PixelType pixelType;
        Object[] channels;
        if (bitDepth == 24) {
            pixelType = PixelType.UINT8;
            byte[] red = new byte[planeSize * depth];
            byte[] green = new byte[planeSize * depth];
            byte[] blue = new byte[planeSize * depth];
            for (int z = 0; z < depth; z++) {
                int[] rgb = (int[]) stack.getPixels(stackIndex(imp, 0, z));
                int offset = z * planeSize;
                for (int i = 0; i < planeSize; i++) {
                    red[offset + i] = (byte) ((rgb[i] >> 16) & 0xff);
                    green[offset + i] = (byte) ((rgb[i] >> 8) & 0xff);
                    blue[offset + i] = (byte) (rgb[i] & 0xff);
                }
            }
            channels = new Object[]{red, green, blue};
        } else {
            int channelCount = imp.getNChannels();
            channels = new Object[channelCount];
            switch (bitDepth) {
                case 8:
                    pixelType = PixelType.UINT8;
                    break;
                case 16:
                    pixelType = PixelType.UINT16;
                    break;
                case 32:
                    pixelType = PixelType.FLOAT32;
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported bit depth: " + bitDepth);
            }
            for (int c = 0; c < channelCount; c++) {
                Object data = allocate(pixelType, planeSize * depth);
                for (int z = 0; z < depth; z++) {
                    Object plane = stack.getPixels(stackIndex(imp, c, z));
                    System.arraycopy(plane, 0, data, z * planeSize, planeSize);
                }
                channels[c] = data;
            }
        }

        Calibration calibration = imp.getCalibration();
        ImageVolume.Builder builder = ImageVolume.builder(width, height, depth, pixelType)
                .channels(channels)
                .tags(tags)
                .spacing(positive(calibration.pixelWidth), positive(calibration.pixelHeight),
                        positive(calibration.pixelDepth));

        if (bitDepth != 32 && calibration.getFunction() == Calibration.STRAIGHT_LINE) {
            double[] coefficients = calibration.getCoefficients();
            if (coefficients != null && coefficients.length >= 2) {
                builder.rescale(coefficients[1], coefficients[0]);
            }
        }

        if (geometry != null) {
            double[] origin = geometry.getOrigin();
            builder.origin(origin[0], origin[1], origin[2]).direction(geometry.getDirection()).dimension(3);
        } else {
            builder.origin(-calibration.xOrigin * calibration.pixelWidth,
                    -calibration.yOrigin * calibration.pixelHeight,
                    -calibration.zOrigin * calibration.pixelDepth);
        }
        return builder.build();
    }

    private static int stackIndex(ImagePlus imp, int channel, int z) {
        int slices = imp.getNSlices();
        return imp.getStackIndex(channel + 1, z % slices + 1, z / slices + 1);
    }

    private static Object allocate(PixelType type, int length) {
        switch (type) {
            case UINT8:
                return new byte[length];
            case UINT16:
                return new short[length];
            default:
                return new float[length];
        }
    }

    private static double positive(double value) {
        return value > 0 && !Double.isInfinite(value) ? value : 1.0;
    }
}
