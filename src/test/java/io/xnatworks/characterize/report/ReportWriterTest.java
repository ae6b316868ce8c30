/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.characterize.report;

import io.xnatworks.characterize.exec.TaskFailure;
import io.xnatworks.characterize.inspect.ImageItem;
import io.xnatworks.characterize.inspect.IntensityStatistics;
import io.xnatworks.characterize.inspect.ValidatorOutcome;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReportWriter Tests")
class ReportWriterTest {

    @TempDir
    Path tempDir;

    private static ImageItem fullItem(String name, String fingerprint) {
        return ImageItem.builder(name, List.of(Path.of("/data", name)))
                .fingerprint(fingerprint)
                .size(new int[]{4, 3})
                .spacing(new double[]{0.5, 0.5})
                .origin(new double[]{0.0, 0.0})
                .direction(new double[]{1, 0, 0, 1})
                .pixelType("8-bit unsigned integer gray")
                .statistics(new IntensityStatistics(0, 255, 127.5, 10.25))
                .metadata("modality", "CT")
                .validatorOutcome("valid", ValidatorOutcome.SUCCEEDED)
                .build();
    }

    private static Report report(List<ImageItem> items, List<TaskFailure<?>> failures) {
        return new ReportAggregator().aggregate(items, failures);
    }

    @Nested
    @DisplayName("Primary Report Tests")
    class PrimaryReportTests {

        @Test
        @DisplayName("Should write the fixed, metadata and validator columns in order")
        void shouldWriteHeader() throws IOException {
            Path output = tempDir.resolve("report.csv");
            ReportWriter writer = new ReportWriter(List.of("modality"), List.of("valid"), false);

            writer.write(report(List.of(fullItem("a", "aaa")), List.of()), output);

            List<String> lines = Files.readAllLines(output);
            assertEquals("files,MD5 intensity hash,image size,image spacing,image origin,axis direction,"
                    + "pixel type,min intensity,max intensity,mean intensity,std intensity,modality,valid", lines.get(0));
            assertEquals(2, lines.size());
        }

        @Test
        @DisplayName("Should write list cells as quoted JSON arrays")
        void shouldWriteRow() throws IOException {
            Path output = tempDir.resolve("report.csv");
            ReportWriter writer = new ReportWriter(List.of("modality"), List.of("valid"), false);

            writer.write(report(List.of(fullItem("a", "aaa")), List.of()), output);

            String row = Files.readAllLines(output).get(1);
            assertEquals("\"[\"\"/data/a\"\"]\",aaa,\"[4,3]\",\"[0.5,0.5]\",\"[0.0,0.0]\",\"[1.0,0.0,0.0,1.0]\","
                    + "8-bit unsigned integer gray,0.0,255.0,127.5,10.25,CT,succeeded", row);
        }

        @Test
        @DisplayName("Statistics should be written in decimal notation")
        void shouldWriteStatisticsWithoutExponent() throws IOException {
            Path output = tempDir.resolve("report.csv");
            ReportWriter writer = new ReportWriter(List.of(), List.of(), false);
            ImageItem item = ImageItem.builder("f", List.of(Path.of("/data/f")))
                    .fingerprint("fff")
                    .pixelType("32-bit float gray")
                    .statistics(new IntensityStatistics(-3.0E-4, 1.5E10, 1.0E-4, 0.0))
                    .build();

            writer.write(report(List.of(item), List.of()), output);

            String row = Files.readAllLines(output).get(1);
            assertTrue(row.endsWith(",32-bit float gray,-0.0003,15000000000.0,0.0001,0.0"), row);
            assertFalse(row.contains("E"), row);
        }

        @Test
        @DisplayName("Problem rows should have only the file list")
        void problemRowsShouldBeSparse() throws IOException {
            Path output = tempDir.resolve("report.csv");
            ReportWriter writer = new ReportWriter(List.of("modality"), List.of(), false);
            ImageItem problem = ImageItem.problem("x", List.of(Path.of("/data/x")));

            writer.write(report(List.of(fullItem("a", "aaa"), problem), List.of()), output);

            List<String> lines = Files.readAllLines(output);
            assertEquals(3, lines.size());
            assertEquals("\"[\"\"/data/x\"\"]\",,,,,,,,,,,", lines.get(2));
        }

        @Test
        @DisplayName("Should leave problem rows out when asked to")
        void shouldIgnoreProblems() throws IOException {
            Path output = tempDir.resolve("report.csv");
            ReportWriter writer = new ReportWriter(List.of(), List.of(), true);
            ImageItem problem = ImageItem.problem("x", List.of(Path.of("/data/x")));

            writer.write(report(List.of(fullItem("a", "aaa"), problem), List.of()), output);

            assertEquals(2, Files.readAllLines(output).size());
        }
    }

    @Nested
    @DisplayName("Derived File Tests")
    class DerivedFileTests {

        @Test
        @DisplayName("Should derive sibling file names from the output base name")
        void shouldDeriveNames() {
            Path output = Path.of("/out/run.1/report.csv");

            assertEquals("/out/run.1/report", ReportWriter.baseName(output));
            assertEquals(Path.of("/out/run.1/report_duplicates.csv"), ReportWriter.duplicatesFile(output));
            assertEquals(Path.of("/out/run.1/report_failures.csv"), ReportWriter.failuresFile(output));
            assertEquals("/out/report", ReportWriter.baseName(Path.of("/out/report")));
        }

        @Test
        @DisplayName("Should write duplicates only when there are any")
        void shouldWriteDuplicatesOnDemand() throws IOException {
            Path output = tempDir.resolve("report.csv");
            ReportWriter writer = new ReportWriter(List.of(), List.of(), false);

            List<Path> unique = writer.write(report(List.of(fullItem("a", "aaa"), fullItem("b", "bbb")), List.of()),
                    output);
            assertEquals(List.of(output), unique);
            assertFalse(Files.exists(ReportWriter.duplicatesFile(output)));

            List<Path> duplicated = writer.write(
                    report(List.of(fullItem("a", "aaa"), fullItem("b", "aaa")), List.of()), output);
            Path duplicates = ReportWriter.duplicatesFile(output);
            assertEquals(List.of(output, duplicates), duplicated);
            assertEquals(3, Files.readAllLines(duplicates).size());
        }

        @Test
        @DisplayName("Should list crashed tasks in a failures file")
        void shouldWriteFailures() throws IOException {
            Path output = tempDir.resolve("report.csv");
            ReportWriter writer = new ReportWriter(List.of(), List.of(), false);
            List<TaskFailure<?>> failures = List.of(
                    new TaskFailure<>(Path.of("/data/z"), new IllegalStateException("decoder, crashed")));

            writer.write(report(List.of(fullItem("a", "aaa")), failures), output);

            List<String> lines = Files.readAllLines(ReportWriter.failuresFile(output));
            assertEquals("input,error", lines.get(0));
            assertEquals("/data/z,\"java.lang.IllegalStateException: decoder, crashed\"", lines.get(1));
        }
    }

    @Test
    @DisplayName("Should quote cells with separators, quotes and newlines")
    void shouldEscapeCsv() {
        assertEquals("plain", ReportWriter.escapeCsv("plain"));
        assertEquals("\"a,b\"", ReportWriter.escapeCsv("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", ReportWriter.escapeCsv("say \"hi\""));
        assertEquals("\"two\nlines\"", ReportWriter.escapeCsv("two\nlines"));
        assertEquals("", ReportWriter.escapeCsv(null));
    }
}
