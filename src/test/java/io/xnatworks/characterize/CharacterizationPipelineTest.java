/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.characterize;

import io.xnatworks.characterize.config.CharacterizeConfig;
import io.xnatworks.characterize.config.ConfigurationException;
import io.xnatworks.characterize.fixtures.DicomFixtures;
import io.xnatworks.characterize.fixtures.ImageFixtures;
import io.xnatworks.characterize.image.DecoderPlugin;
import io.xnatworks.characterize.image.ImageJDecoder;
import io.xnatworks.characterize.inspect.ImageItem;
import io.xnatworks.characterize.report.ReportWriter;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CharacterizationPipeline Tests")
class CharacterizationPipelineTest {

    @TempDir
    Path tempDir;

    private Path data;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        data = Files.createDirectories(tempDir.resolve("data"));
        output = tempDir.resolve("out/report.csv");
    }

    private CharacterizationPipeline pipeline(CharacterizeConfig config) {
        config.setDisableProgress(true);
        return new CharacterizationPipeline(config, new ImageJDecoder(DecoderPlugin.ALL), tempDir.resolve("scratch"));
    }

    private List<Path> outputFiles() throws IOException {
        try (Stream<Path> listing = Files.list(output.getParent())) {
            return listing.sorted().collect(Collectors.toList());
        }
    }

    @Nested
    @DisplayName("Per File Tests")
    class PerFileTests {

        @Test
        @DisplayName("Two identical images should give two rows and one duplicate group")
        void identicalImagesShouldBeDuplicates() throws Exception {
            Path original = ImageFixtures.writeGray8Tiff(data.resolve("a.tif"), 8, 8, 0);
            Files.createDirectories(data.resolve("copies"));
            Files.copy(original, data.resolve("copies/b.tif"));

            CharacterizationPipeline.RunResult result = pipeline(new CharacterizeConfig())
                    .run(data, output, AnalysisType.PER_FILE);

            assertTrue(result.isReportCreated());
            assertEquals(3, Files.readAllLines(output).size());
            assertEquals(1, result.getReport().getDuplicateGroups().size());
            assertEquals(3, Files.readAllLines(ReportWriter.duplicatesFile(output)).size());
            assertNotNull(result.getSettingsSnapshot());
            assertTrue(Files.exists(result.getSettingsSnapshot()));
            assertNull(result.getSummaryImage());
        }

        @Test
        @DisplayName("Unreadable files should be reported unless problems are ignored")
        void unreadableFilesShouldBeReported() throws Exception {
            ImageFixtures.writeGray8Tiff(data.resolve("a.tif"), 8, 8, 0);
            ImageFixtures.writeGray8Tiff(data.resolve("b.tif"), 8, 8, 3);
            Files.writeString(data.resolve("notes.txt"), "hello");

            CharacterizationPipeline.RunResult result = pipeline(new CharacterizeConfig())
                    .run(data, output, AnalysisType.PER_FILE);

            assertEquals(4, Files.readAllLines(output).size());
            assertEquals(1, result.getReport().getStatistics().getProblemCount());
            assertTrue(result.getReport().getDuplicateGroups().isEmpty());
            assertFalse(Files.exists(ReportWriter.duplicatesFile(output)));

            CharacterizeConfig ignoring = new CharacterizeConfig();
            ignoring.setIgnoreProblems(true);
            pipeline(ignoring).run(data, output, AnalysisType.PER_FILE);

            assertEquals(3, Files.readAllLines(output).size());
        }

        @Test
        @DisplayName("Should write a summary image of the readable images")
        void shouldWriteSummaryImage() throws Exception {
            for (int i = 0; i < 5; i++) {
                ImageFixtures.writeGray8Tiff(data.resolve("img" + i + ".tif"), 6, 6, i * 10);
            }
            Files.writeString(data.resolve("notes.txt"), "hello");
            CharacterizeConfig config = new CharacterizeConfig();
            config.setCreateSummaryImage(true);
            config.setThumbnailSizes(List.of(8, 8));
            config.setTileSizes(List.of(2, 2));

            CharacterizationPipeline.RunResult result = pipeline(config).run(data, output, AnalysisType.PER_FILE);

            assertEquals(tempDir.resolve("out/report_summary_image.tif"), result.getSummaryImage());
            assertTrue(Files.exists(result.getSummaryImage()));
            assertEquals(5, result.getReport().getThumbnails().size());
        }

        @Test
        @DisplayName("Metadata columns should be filled from image tags")
        void shouldReportMetadata() throws Exception {
            DicomFixtures.slice("1.2.3.10", "1.2.3.44").position(0.0).write(data.resolve("slice.dcm"));
            CharacterizeConfig config = new CharacterizeConfig();
            config.setMetadataKeys(List.of("0008|0060", "0010|0020"));
            config.setMetadataKeysHeadings(List.of("modality", "patient"));

            CharacterizationPipeline.RunResult result = pipeline(config).run(data, output, AnalysisType.PER_FILE);

            ImageItem item = result.getReport().getItems().get(0);
            assertEquals("CT", item.getMetadata().get("modality"));
            assertNull(item.getMetadata().get("patient"));
            assertTrue(Files.readAllLines(output).get(0).endsWith(",modality,patient"));
        }
    }

    @Nested
    @DisplayName("Per Series Tests")
    class PerSeriesTests {

        @Test
        @DisplayName("Should produce one row per series with files in slice order")
        void shouldReportOneRowPerSeries() throws Exception {
            Path first = DicomFixtures.slice("1.2.3.10", "1.2.3.44").instanceNumber(2).position(3.0).ramp(20)
                    .write(data.resolve("p1/x/001.dcm"));
            Path second = DicomFixtures.slice("1.2.3.10", "1.2.3.44").instanceNumber(1).position(0.0).ramp(10)
                    .write(data.resolve("p1/y/002.dcm"));
            DicomFixtures.slice("1.2.3.10", "1.2.3.46").position(0.0).write(data.resolve("p1/z/003.dcm"));
            ImageFixtures.writeGray8Tiff(data.resolve("photo.tif"), 4, 4, 0);

            CharacterizationPipeline.RunResult result = pipeline(new CharacterizeConfig())
                    .run(data, output, AnalysisType.PER_SERIES);

            List<ImageItem> items = result.getReport().getItems();
            assertEquals(2, items.size());
            ImageItem volume = items.get(0);
            assertEquals(List.of(second.toAbsolutePath().normalize(), first.toAbsolutePath().normalize()),
                    volume.getFiles());
            assertArrayEquals(new int[]{4, 4, 2}, volume.getSize());
            assertArrayEquals(new double[]{0.5, 0.5, 3.0}, volume.getSpacing(), 1e-9);
            assertEquals(3, Files.readAllLines(output).size());
        }

        @Test
        @DisplayName("Slices differing in a discriminator tag should form separate series")
        void discriminatorShouldSplitSeries() throws Exception {
            DicomFixtures.slice("1.2.3.10", "1.2.3.44").position(0.0).write(data.resolve("a.dcm"));
            DicomFixtures.slice("1.2.3.10", "1.2.3.44").position(1.0).write(data.resolve("b.dcm"));
            DicomFixtures.slice("1.2.3.10", "1.2.3.44").size(2, 2).position(0.0).write(data.resolve("c.dcm"));

            CharacterizationPipeline.RunResult result = pipeline(new CharacterizeConfig())
                    .run(data, output, AnalysisType.PER_SERIES);

            assertEquals(2, result.getReport().getItems().size());
            assertEquals(0, result.getReport().getStatistics().getProblemCount());

            CharacterizeConfig noDiscriminators = new CharacterizeConfig();
            noDiscriminators.setAdditionalSeriesTags(List.of());
            CharacterizationPipeline.RunResult merged = pipeline(noDiscriminators)
                    .run(data, output, AnalysisType.PER_SERIES);

            assertEquals(1, merged.getReport().getItems().size());
            assertTrue(merged.getReport().getItems().get(0).isProblem());
        }

        @Test
        @DisplayName("Scratch directories should be removed after the run")
        void shouldRemoveScratchDirectories() throws Exception {
            DicomFixtures.slice("1.2.3.10", "1.2.3.44").position(0.0).write(data.resolve("a.dcm"));

            pipeline(new CharacterizeConfig()).run(data, output, AnalysisType.PER_SERIES);

            try (Stream<Path> leftovers = Files.list(tempDir.resolve("scratch"))) {
                assertEquals(0, leftovers.count());
            }
        }
    }

    @Nested
    @DisplayName("No Report Tests")
    class NoReportTests {

        @Test
        @DisplayName("Should write nothing when no image is readable")
        void shouldWriteNothingWithoutReadableImages() throws Exception {
            Files.writeString(data.resolve("notes.txt"), "hello");

            CharacterizationPipeline.RunResult result = pipeline(new CharacterizeConfig())
                    .run(data, output, AnalysisType.PER_FILE);

            assertFalse(result.isReportCreated());
            assertFalse(Files.exists(output));
            assertFalse(Files.exists(output.getParent()));
            assertNull(result.getSettingsSnapshot());
        }

        @Test
        @DisplayName("Per series run without DICOM should write nothing")
        void perSeriesWithoutDicomShouldWriteNothing() throws Exception {
            ImageFixtures.writeGray8Tiff(data.resolve("a.tif"), 4, 4, 0);

            CharacterizationPipeline.RunResult result = pipeline(new CharacterizeConfig())
                    .run(data, output, AnalysisType.PER_SERIES);

            assertFalse(result.isReportCreated());
            assertEquals(0, result.getReport().getStatistics().getItemCount());
        }

        @Test
        @DisplayName("Missing root directory should be a configuration error")
        void missingRootShouldFail() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> pipeline(new CharacterizeConfig()).run(tempDir.resolve("nope"), output, AnalysisType.PER_FILE));
            assertTrue(e.getMessage().contains("does not exist"));
        }

        @Test
        @DisplayName("Invalid settings should fail before anything is written")
        void invalidSettingsShouldFail() throws IOException {
            ImageFixtures.writeGray8Tiff(data.resolve("a.tif"), 4, 4, 0);
            CharacterizeConfig config = new CharacterizeConfig();
            config.setMetadataKeys(List.of("0008|0060"));

            assertThrows(ConfigurationException.class, () -> pipeline(config).run(data, output, AnalysisType.PER_FILE));
            assertFalse(Files.exists(output));
        }
    }

    @Test
    @DisplayName("Output directory should hold the report and the settings snapshot")
    void outputDirectoryContents() throws Exception {
        ImageFixtures.writeGray8Tiff(data.resolve("a.tif"), 4, 4, 0);

        pipeline(new CharacterizeConfig()).run(data, output, AnalysisType.PER_FILE);

        List<Path> files = outputFiles();
        assertEquals(2, files.size());
        assertTrue(files.contains(output));
        assertTrue(files.stream().anyMatch(p -> p.getFileName().toString().endsWith("_characterize_data_settings.json")));
    }
}
