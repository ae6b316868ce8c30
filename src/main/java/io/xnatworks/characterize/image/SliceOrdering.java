/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.image;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders the slices of one series and derives the volume geometry from their headers.
 *
 * Slices are sorted by Image Position (Patient) projected onto the slice normal taken from
 * Image Orientation (Patient). When any slice lacks that geometry the Instance Number is
 * used, and when that is missing too, the file name.
 */
public final class SliceOrdering {

    private static final double POSITION_TOLERANCE = 1e-4;
    private static final double SPACING_TOLERANCE = 0.01;

    private SliceOrdering() {
    }

    /**
     * One slice header.
     */
    public static final class Slice {
        private final Path path;
        private final Map<String, String> tags;

        public Slice(Path path, Map<String, String> tags) {
            this.path = path;
            this.tags = tags;
        }

        public Path getPath() { return path; }
        public Map<String, String> getTags() { return tags; }
    }

    /**
     * Ordered slices and the geometry they imply.
     */
    public static final class SeriesGeometry {
        private final List<Slice> slices;
        private final double[] origin;
        private final double[] direction;
        private final double sliceSpacing;
        private final List<String> warnings;

        SeriesGeometry(List<Slice> slices, double[] origin, double[] direction, double sliceSpacing,
                       List<String> warnings) {
            this.slices = slices;
            this.origin = origin;
            this.direction = direction;
            this.sliceSpacing = sliceSpacing;
            this.warnings = warnings;
        }

        public List<Slice> getSlices() { return slices; }
        public double[] getOrigin() { return origin; }
        public double[] getDirection() { return direction; }
        /** Distance between slice centres, or NaN when the headers do not determine it. */
        public double getSliceSpacing() { return sliceSpacing; }
        /** Signs of an inconsistent series: duplicated or unevenly spaced positions. */
        public List<String> getWarnings() { return warnings; }

        public List<Path> getPaths() {
            List<Path> paths = new ArrayList<>(slices.size());
            for (Slice slice : slices) {
                paths.add(slice.getPath());
            }
            return paths;
        }
    }

    public static SeriesGeometry order(List<Slice> input) {
        if (input.isEmpty()) {
            throw new IllegalArgumentException("No slices to order");
        }
        double[] orientation = DicomTags.parseDoubles(
                input.get(0).getTags().get(DicomTags.IMAGE_ORIENTATION_PATIENT), 6);

        List<double[]> positions = new ArrayList<>();
        for (Slice slice : input) {
            double[] position = DicomTags.parseDoubles(slice.getTags().get(DicomTags.IMAGE_POSITION_PATIENT), 3);
            if (position == null) {
                positions = null;
                break;
            }
            positions.add(position);
        }

        if (orientation != null && positions != null) {
            return orderByPosition(input, positions, orientation);
        }

        List<Slice> sorted = new ArrayList<>(input);
        if (allHaveInstanceNumber(input)) {
            sorted.sort(Comparator.comparingInt(SliceOrdering::instanceNumber)
                    .thenComparing(s -> s.getPath().getFileName().toString(), SliceOrdering::compareNames));
        } else {
            sorted.sort(Comparator.comparing((Slice s) -> s.getPath().getFileName().toString(), SliceOrdering::compareNames));
        }
        double[] direction = {1, 0, 0, 0, 1, 0, 0, 0, 1};
        return new SeriesGeometry(sorted, new double[]{0, 0, 0}, direction, headerSpacing(input.get(0)), List.of());
    }

    private static SeriesGeometry orderByPosition(List<Slice> input, List<double[]> positions, double[] orientation) {
        double[] row = {orientation[0], orientation[1], orientation[2]};
        double[] col = {orientation[3], orientation[4], orientation[5]};
        double[] normal = cross(row, col);

        List<Integer> indices = new ArrayList<>();
        double[] distance = new double[input.size()];
        for (int i = 0; i < input.size(); i++) {
            indices.add(i);
            distance[i] = dot(positions.get(i), normal);
        }
        indices.sort(Comparator.<Integer>comparingDouble(i -> distance[i])
                .thenComparing(i -> input.get(i).getPath().getFileName().toString(), SliceOrdering::compareNames));

        List<Slice> sorted = new ArrayList<>();
        for (int i : indices) {
            sorted.add(input.get(i));
        }

        List<String> warnings = new ArrayList<>();
        double spacing = Double.NaN;
        int n = indices.size();
        if (n > 1) {
            double first = distance[indices.get(0)];
            double last = distance[indices.get(n - 1)];
            spacing = (last - first) / (n - 1);
            int duplicates = 0;
            boolean uneven = false;
            for (int k = 1; k < n; k++) {
                double step = distance[indices.get(k)] - distance[indices.get(k - 1)];
                if (Math.abs(step) < POSITION_TOLERANCE) {
                    duplicates++;
                } else if (Math.abs(step - spacing) > SPACING_TOLERANCE * Math.abs(spacing)) {
                    uneven = true;
                }
            }
            if (duplicates > 0) {
                warnings.add(duplicates + " slice(s) share a position with another slice");
            }
            if (uneven) {
                warnings.add("slice positions are not evenly spaced");
            }
            if (Math.abs(spacing) < POSITION_TOLERANCE) {
                spacing = Double.NaN;
            }
        }
        if (Double.isNaN(spacing)) {
            spacing = headerSpacing(input.get(0));
        }

        double[] direction = {
                row[0], col[0], normal[0],
                row[1], col[1], normal[1],
                row[2], col[2], normal[2]
        };
        return new SeriesGeometry(sorted, positions.get(indices.get(0)).clone(), direction, spacing, warnings);
    }

    private static double headerSpacing(Slice slice) {
        for (String tag : new String[]{DicomTags.SPACING_BETWEEN_SLICES, DicomTags.SLICE_THICKNESS}) {
            double[] value = DicomTags.parseDoubles(slice.getTags().get(tag), 1);
            if (value != null && value[0] > 0) {
                return value[0];
            }
        }
        return Double.NaN;
    }

    private static boolean allHaveInstanceNumber(List<Slice> slices) {
        for (Slice slice : slices) {
            if (DicomTags.parseDoubles(slice.getTags().get(DicomTags.INSTANCE_NUMBER), 1) == null) {
                return false;
            }
        }
        return true;
    }

    private static int instanceNumber(Slice slice) {
        return (int) DicomTags.parseDoubles(slice.getTags().get(DicomTags.INSTANCE_NUMBER), 1)[0];
    }

    /**
     * Numeric names (the staged 0..n-1 names) compare numerically, anything else lexically.
     */
    static int compareNames(String a, String b) {
        try {
            return Long.compare(Long.parseLong(a), Long.parseLong(b));
        } catch (NumberFormatException e) {
            return a.compareTo(b);
        }
    }

    static double[] cross(double[] a, double[] b) {
        return new double[]{
                a[1] * b[2] - a[2] * b[1],
                a[2] * b[0] - a[0] * b[2],
                a[0] * b[1] - a[1] * b[0]
        };
    }

    static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }
}
