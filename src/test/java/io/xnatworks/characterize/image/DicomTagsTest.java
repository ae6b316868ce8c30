/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.characterize.image;

import org.junit.jupiter.api.*;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DicomTags Tests")
class DicomTagsTest {

    @Nested
    @DisplayName("Tag Normalisation Tests")
    class CanonicalTests {

        @Test
        @DisplayName("Should accept pipe, comma and parenthesised forms in any case")
        void shouldAcceptTagForms() {
            assertEquals("0020,000E", DicomTags.canonical("0020|000e"));
            assertEquals("0020,000E", DicomTags.canonical("0020,000E"));
            assertEquals("0020,000E", DicomTags.canonical("(0020,000e)"));
            assertEquals("0020,000E", DicomTags.canonical(" 0020 | 000E "));
        }

        @Test
        @DisplayName("Should resolve DICOM keywords")
        void shouldResolveKeywords() {
            assertEquals("0028,0010", DicomTags.canonical("Rows"));
            assertEquals("0010,0020", DicomTags.canonical("PatientID"));
            assertEquals("0020,0032", DicomTags.canonical("image_position_patient"));
        }

        @Test
        @DisplayName("Should return null for text that is not a tag")
        void shouldRejectNonTags() {
            assertNull(DicomTags.canonical("spacing"));
            assertNull(DicomTags.canonical(""));
            assertNull(DicomTags.canonical(null));
            assertNull(DicomTags.canonical("0020|00"));
        }

        @Test
        @DisplayName("Lookup key should fall back to the literal key")
        void lookupKeyShouldFallBack() {
            assertEquals("0008,0060", DicomTags.lookupKey("0008|0060"));
            assertEquals("ImageJ", DicomTags.lookupKey(" ImageJ "));
        }
    }

    @Nested
    @DisplayName("Header Parsing Tests")
    class ParseInfoTests {

        @Test
        @DisplayName("Should parse decoded DICOM header lines")
        void shouldParseDicomLines() {
            String info = "0008,0060  Modality: CT\n"
                    + "0020,000e  Series Instance UID: 1.2.3.4\n"
                    + "0028,0030  Pixel Spacing: 0.5\\0.5\n";

            Map<String, String> tags = DicomTags.parseInfo(info);

            assertEquals("CT", tags.get("0008,0060"));
            assertEquals("1.2.3.4", tags.get("0020,000E"));
            assertEquals("0.5\\0.5", tags.get("0028,0030"));
        }

        @Test
        @DisplayName("Should keep the top-level value over nested sequence items")
        void shouldSkipSequenceItems() {
            String info = "0008,1140  Referenced Image Sequence:\n"
                    + "0008,1155  >Referenced SOP Instance UID: 9.9.9\n"
                    + "0008,1155  Referenced SOP Instance UID: 1.1.1\n";

            Map<String, String> tags = DicomTags.parseInfo(info);

            assertEquals("1.1.1", tags.get("0008,1155"));
        }

        @Test
        @DisplayName("Should parse key-value lines from other formats")
        void shouldParseKeyValueLines() {
            Map<String, String> tags = DicomTags.parseInfo("BITPIX = 16\nTelescope: north\n\n");

            assertEquals("16", tags.get("BITPIX"));
            assertEquals("north", tags.get("Telescope"));
        }

        @Test
        @DisplayName("Should return an empty dictionary for missing info")
        void shouldHandleMissingInfo() {
            assertTrue(DicomTags.parseInfo(null).isEmpty());
            assertTrue(DicomTags.parseInfo("").isEmpty());
        }
    }

    @Nested
    @DisplayName("Multi-value Parsing Tests")
    class ParseDoublesTests {

        @Test
        @DisplayName("Should parse backslash separated numbers")
        void shouldParseNumbers() {
            assertArrayEquals(new double[]{1.0, -2.5, 3.0}, DicomTags.parseDoubles("1\\-2.5\\ 3", 3));
        }

        @Test
        @DisplayName("Should reject wrong counts and non-numeric components")
        void shouldRejectBadValues() {
            assertNull(DicomTags.parseDoubles("1\\2", 3));
            assertNull(DicomTags.parseDoubles("1\\x\\3", 3));
            assertNull(DicomTags.parseDoubles(null, 1));
        }
    }
}
