/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.image;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * DICOM tag identifiers and parsing of decoded header text into a tag dictionary.
 *
 * Tags are kept in the canonical form {@code GGGG,EEEE} (upper-case hex), which is the form
 * the ImageJ DICOM decoder prints. User input is accepted as {@code gggg|eeee},
 * {@code gggg,eeee}, {@code (gggg,eeee)} in any case, or as a DICOM keyword.
 */
public final class DicomTags {

    public static final String STUDY_INSTANCE_UID = "0020,000D";
    public static final String SERIES_INSTANCE_UID = "0020,000E";
    public static final String SERIES_NUMBER = "0020,0011";
    public static final String INSTANCE_NUMBER = "0020,0013";
    public static final String IMAGE_POSITION_PATIENT = "0020,0032";
    public static final String IMAGE_ORIENTATION_PATIENT = "0020,0037";
    public static final String SLICE_THICKNESS = "0018,0050";
    public static final String SPACING_BETWEEN_SLICES = "0018,0088";
    public static final String ROWS = "0028,0010";
    public static final String COLUMNS = "0028,0011";

    private static final Pattern TAG_PATTERN = Pattern.compile("([0-9A-Fa-f]{4})\\s*[|,]\\s*([0-9A-Fa-f]{4})");
    private static final Pattern INFO_LINE_TAG = Pattern.compile("^[0-9A-Fa-f]{4},[0-9A-Fa-f]{4}");

    // Common DICOM keyword mappings
    private static final Map<String, String> TAG_NAME_MAP = new HashMap<>();
    static {
        // Patient level
        TAG_NAME_MAP.put("patientid", "0010,0020");
        TAG_NAME_MAP.put("patientname", "0010,0010");
        TAG_NAME_MAP.put("patientsex", "0010,0040");
        TAG_NAME_MAP.put("patientage", "0010,1010");

        // Study level
        TAG_NAME_MAP.put("studyinstanceuid", STUDY_INSTANCE_UID);
        TAG_NAME_MAP.put("studydate", "0008,0020");
        TAG_NAME_MAP.put("studydescription", "0008,1030");
        TAG_NAME_MAP.put("accessionnumber", "0008,0050");

        // Series level
        TAG_NAME_MAP.put("seriesinstanceuid", SERIES_INSTANCE_UID);
        TAG_NAME_MAP.put("modality", "0008,0060");
        TAG_NAME_MAP.put("seriesnumber", SERIES_NUMBER);
        TAG_NAME_MAP.put("seriesdescription", "0008,103E");
        TAG_NAME_MAP.put("bodypartexamined", "0018,0015");
        TAG_NAME_MAP.put("protocolname", "0018,1030");
        TAG_NAME_MAP.put("viewposition", "0018,5101");

        // Instance level
        TAG_NAME_MAP.put("sopinstanceuid", "0008,0018");
        TAG_NAME_MAP.put("sopclassuid", "0008,0016");
        TAG_NAME_MAP.put("instancenumber", INSTANCE_NUMBER);
        TAG_NAME_MAP.put("acquisitionnumber", "0020,0012");
        TAG_NAME_MAP.put("imagepositionpatient", IMAGE_POSITION_PATIENT);
        TAG_NAME_MAP.put("imageorientationpatient", IMAGE_ORIENTATION_PATIENT);

        // Equipment
        TAG_NAME_MAP.put("manufacturer", "0008,0070");
        TAG_NAME_MAP.put("manufacturermodelname", "0008,1090");

        // Image specific
        TAG_NAME_MAP.put("rows", ROWS);
        TAG_NAME_MAP.put("columns", COLUMNS);
        TAG_NAME_MAP.put("bitsstored", "0028,0101");
        TAG_NAME_MAP.put("pixelspacing", "0028,0030");
        TAG_NAME_MAP.put("slicethickness", SLICE_THICKNESS);
        TAG_NAME_MAP.put("spacingbetweenslices", SPACING_BETWEEN_SLICES);
        TAG_NAME_MAP.put("imagetype", "0008,0008");
        TAG_NAME_MAP.put("photometricinterpretation", "0028,0004");

        // MR specific
        TAG_NAME_MAP.put("sequencename", "0018,0024");
        TAG_NAME_MAP.put("echotime", "0018,0081");
        TAG_NAME_MAP.put("repetitiontime", "0018,0080");
    }

    private DicomTags() {
    }

    /**
     * Canonical {@code GGGG,EEEE} form of tag text, or null when the text is
     * neither a group/element pair nor a known keyword.
     */
    public static String canonical(String tagText) {
        if (tagText == null || tagText.isBlank()) {
            return null;
        }
        String cleaned = tagText.replace("(", "").replace(")", "").trim();
        var matcher = TAG_PATTERN.matcher(cleaned);
        if (matcher.matches()) {
            return (matcher.group(1) + "," + matcher.group(2)).toUpperCase(Locale.ROOT);
        }
        String keyword = cleaned.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "").replace(" ", "");
        return TAG_NAME_MAP.get(keyword);
    }

    /**
     * Key used to look a caller-supplied metadata key up in a decoded tag dictionary:
     * the canonical tag when the key names a DICOM tag, the key itself otherwise.
     */
    public static String lookupKey(String key) {
        String canonical = canonical(key);
        return canonical != null ? canonical : key.trim();
    }

    /**
     * Parse decoded header text into an insertion-ordered dictionary.
     *
     * DICOM lines look like {@code 0020,000E  Series Instance UID: 1.2.3}; nested sequence
     * items (marked with '>') are skipped so top-level values win. Other lines of the form
     * {@code key: value} or {@code key = value} are kept under their literal key.
     */
    public static Map<String, String> parseInfo(String info) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (info == null || info.isEmpty()) {
            return tags;
        }
        for (String line : info.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            if (INFO_LINE_TAG.matcher(line).find()) {
                String tag = line.substring(0, 9).toUpperCase(Locale.ROOT);
                String rest = line.substring(9).trim();
                if (rest.startsWith(">")) {
                    continue;
                }
                int colon = rest.indexOf(':');
                String value = colon >= 0 ? rest.substring(colon + 1).trim() : "";
                tags.putIfAbsent(tag, value);
            } else {
                int separator = separatorIndex(line);
                if (separator > 0) {
                    String key = line.substring(0, separator).trim();
                    String value = line.substring(separator + 1).trim();
                    if (!key.isEmpty()) {
                        tags.putIfAbsent(key, value);
                    }
                }
            }
        }
        return tags;
    }

    private static int separatorIndex(String line) {
        int equals = line.indexOf('=');
        int colon = line.indexOf(':');
        if (equals < 0) return colon;
        if (colon < 0) return equals;
        return Math.min(equals, colon);
    }

    /**
     * Parse a backslash separated DICOM multi-value into doubles, or null if any
     * component is missing or not numeric.
     */
    public static double[] parseDoubles(String value, int expectedCount) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String[] parts = value.trim().split("\\\\");
        if (parts.length != expectedCount) {
            return null;
        }
        double[] result = new double[expectedCount];
        try {
            for (int i = 0; i < expectedCount; i++) {
                result[i] = Double.parseDouble(parts[i].trim());
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return result;
    }
}
