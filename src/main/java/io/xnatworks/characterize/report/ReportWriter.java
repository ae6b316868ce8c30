/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xnatworks.characterize.exec.TaskFailure;
import io.xnatworks.characterize.inspect.ImageItem;
import io.xnatworks.characterize.inspect.IntensityStatistics;
import io.xnatworks.characterize.inspect.ValidatorOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link Report} as CSV files next to the requested output file.
 *
 * - {@code <output>}: one row per item
 * - {@code <output base>_duplicates.csv}: the duplicate groups, only when there are any
 * - {@code <output base>_failures.csv}: tasks that crashed, only when there are any
 *
 * Multi-valued cells (file lists, sizes, vectors) are JSON arrays.
 */
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    public static final List<String> FIXED_COLUMNS = List.of(
            "files", "MD5 intensity hash", "image size", "image spacing", "image origin", "axis direction",
            "pixel type", "min intensity", "max intensity", "mean intensity", "std intensity");

    private static final ObjectMapper mapper = new ObjectMapper();

    private final List<String> metadataHeadings;
    private final List<String> validatorHeadings;
    private final boolean ignoreProblems;

    /**
     * @param ignoreProblems leave problem items out of the primary report
     */
    public ReportWriter(List<String> metadataHeadings, List<String> validatorHeadings, boolean ignoreProblems) {
        this.metadataHeadings = List.copyOf(metadataHeadings);
        this.validatorHeadings = List.copyOf(validatorHeadings);
        this.ignoreProblems = ignoreProblems;
    }

    /**
     * Path without its extension, the prefix of every derived output file.
     */
    public static String baseName(Path outputFile) {
        String name = outputFile.toString();
        String fileName = outputFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? name.substring(0, name.length() - (fileName.length() - dot)) : name;
    }

    public static Path duplicatesFile(Path outputFile) {
        return Path.of(baseName(outputFile) + "_duplicates.csv");
    }

    public static Path failuresFile(Path outputFile) {
        return Path.of(baseName(outputFile) + "_failures.csv");
    }

    /**
     * @return the files written
     */
    public List<Path> write(Report report, Path outputFile) throws IOException {
        List<Path> written = new ArrayList<>();
        if (outputFile.toAbsolutePath().getParent() != null) {
            Files.createDirectories(outputFile.toAbsolutePath().getParent());
        }

        List<ImageItem> rows = new ArrayList<>();
        for (ImageItem item : report.getItems()) {
            if (!(ignoreProblems && item.isProblem())) {
                rows.add(item);
            }
        }
        writeItems(rows, outputFile);
        written.add(outputFile);
        log.info("Report written to {} ({} rows)", outputFile, rows.size());

        if (!report.getDuplicateGroups().isEmpty()) {
            List<ImageItem> duplicates = new ArrayList<>();
            for (DuplicateGroup group : report.getDuplicateGroups()) {
                duplicates.addAll(group.getItems());
            }
            Path duplicatesFile = duplicatesFile(outputFile);
            writeItems(duplicates, duplicatesFile);
            written.add(duplicatesFile);
            log.info("Duplicates written to {} ({} groups)", duplicatesFile, report.getDuplicateGroups().size());
        }

        if (!report.getFailures().isEmpty()) {
            Path failuresFile = failuresFile(outputFile);
            writeFailures(report.getFailures(), failuresFile);
            written.add(failuresFile);
            log.warn("{} tasks failed, listed in {}", report.getFailures().size(), failuresFile);
        }
        return written;
    }

    private void writeItems(List<ImageItem> items, Path file) throws IOException {
        StringBuilder csv = new StringBuilder();
        List<String> header = new ArrayList<>(FIXED_COLUMNS);
        header.addAll(metadataHeadings);
        header.addAll(validatorHeadings);
        appendRow(csv, header);
        for (ImageItem item : items) {
            appendRow(csv, toCells(item));
        }
        Files.writeString(file, csv.toString(), StandardCharsets.UTF_8);
    }

    private void writeFailures(List<TaskFailure<?>> failures, Path file) throws IOException {
        StringBuilder csv = new StringBuilder();
        appendRow(csv, List.of("input", "error"));
        for (TaskFailure<?> failure : failures) {
            appendRow(csv, List.of(String.valueOf(failure.getInput()), String.valueOf(failure.getCause())));
        }
        Files.writeString(file, csv.toString(), StandardCharsets.UTF_8);
    }

    List<String> toCells(ImageItem item) {
        List<String> cells = new ArrayList<>();
        List<String> files = new ArrayList<>();
        item.getFiles().forEach(p -> files.add(p.toString()));
        cells.add(json(files));
        cells.add(item.getFingerprint());
        cells.add(json(item.getSize()));
        cells.add(json(item.getSpacing()));
        cells.add(json(item.getOrigin()));
        cells.add(json(item.getDirection()));
        cells.add(item.getPixelType());

        IntensityStatistics statistics = item.getStatistics();
        if (statistics != null) {
            cells.add(plain(statistics.getMin()));
            cells.add(plain(statistics.getMax()));
            cells.add(plain(statistics.getMean()));
            cells.add(plain(statistics.getStd()));
        } else {
            cells.add(null);
            cells.add(null);
            cells.add(null);
            cells.add(null);
        }

        for (String heading : metadataHeadings) {
            cells.add(item.getMetadata().get(heading));
        }
        for (String heading : validatorHeadings) {
            ValidatorOutcome outcome = item.getValidatorOutcomes().get(heading);
            cells.add(outcome != null ? outcome.getLabel() : null);
        }
        return cells;
    }

    /**
     * Decimal notation without exponent, always with a fractional part, e.g. {@code 0.0001} or {@code 255.0}.
     */
    static String plain(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        String text = decimal.toPlainString();
        return decimal.scale() <= 0 ? text + ".0" : text;
    }

    private static String json(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void appendRow(StringBuilder csv, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                csv.append(',');
            }
            csv.append(escapeCsv(cells.get(i)));
        }
        csv.append('\n');
    }

    static String escapeCsv(String value) {
        if (value == null) return "";
        // Escape quotes and wrap in quotes if contains comma, quote, or newline
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
