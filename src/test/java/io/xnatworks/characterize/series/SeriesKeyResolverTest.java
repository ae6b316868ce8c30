/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.characterize.series;

import io.xnatworks.characterize.image.DicomTags;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SeriesKeyResolver Tests")
class SeriesKeyResolverTest {

    private static Map<String, String> header(String series, String study, String rows) {
        return Map.of(DicomTags.SERIES_INSTANCE_UID, series, DicomTags.STUDY_INSTANCE_UID, study,
                DicomTags.ROWS, rows);
    }

    private final FakeHeaderDecoder decoder = new FakeHeaderDecoder()
            .header("a", header("S1", "SE1", "512"))
            .header("b", header("S1", "SE1", "256"))
            .header("c", header("S1", "SE1", "512"));

    private List<ResolvedFile> resolveAll(SeriesKeyResolver resolver, String... names) {
        List<ResolvedFile> resolved = new ArrayList<>();
        for (String name : names) {
            resolver.resolve(Path.of("/data", name)).ifPresent(resolved::add);
        }
        return resolved;
    }

    @Test
    @DisplayName("Should split a series on a discriminator tag")
    void shouldSplitOnDiscriminator() {
        SeriesKeyResolver resolver = new SeriesKeyResolver(decoder, List.of(DicomTags.ROWS));

        Map<SeriesKey, List<Path>> series = new SeriesAssembler().assemble(resolveAll(resolver, "a", "b", "c"));

        assertEquals(2, series.size());
        assertTrue(series.containsKey(new SeriesKey("S1", "SE1", List.of("512"))));
        assertEquals(2, series.get(new SeriesKey("S1", "SE1", List.of("512"))).size());
    }

    @Test
    @DisplayName("Should keep one series without discriminators")
    void shouldKeepOneSeriesWithoutDiscriminators() {
        SeriesKeyResolver resolver = new SeriesKeyResolver(decoder, List.of());

        Map<SeriesKey, List<Path>> series = new SeriesAssembler().assemble(resolveAll(resolver, "a", "b", "c"));

        assertEquals(1, series.size());
        assertEquals(3, series.values().iterator().next().size());
    }

    @Test
    @DisplayName("Should use a placeholder for missing discriminator values")
    void shouldUsePlaceholderForMissingValues() {
        SeriesKeyResolver resolver = new SeriesKeyResolver(decoder, List.of(DicomTags.ROWS, "0018,0050"));

        Optional<ResolvedFile> resolved = resolver.resolve(Path.of("/data/a"));

        assertTrue(resolved.isPresent());
        assertEquals(List.of("512", SeriesKey.MISSING_VALUE), resolved.get().getKey().getDiscriminators());
        assertEquals("S1:SE1:512: ", resolved.get().getKey().toString());
    }

    @Test
    @DisplayName("Should exclude files that are not DICOM")
    void shouldExcludeNonDicom() {
        SeriesKeyResolver resolver = new SeriesKeyResolver(decoder, List.of());

        assertTrue(resolver.resolve(Path.of("/data/readme.txt")).isEmpty());
    }

    @Test
    @DisplayName("Should exclude files without a series or study UID")
    void shouldExcludeFilesWithoutUids() {
        FakeHeaderDecoder partial = new FakeHeaderDecoder()
                .header("x", Map.of(DicomTags.SERIES_INSTANCE_UID, "S1"))
                .header("y", Map.of(DicomTags.SERIES_INSTANCE_UID, " ", DicomTags.STUDY_INSTANCE_UID, "SE1"));
        SeriesKeyResolver resolver = new SeriesKeyResolver(partial, List.of());

        assertTrue(resolver.resolve(Path.of("/data/x")).isEmpty());
        assertTrue(resolver.resolve(Path.of("/data/y")).isEmpty());
    }
}
