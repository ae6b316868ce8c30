/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize;

import io.xnatworks.characterize.config.CharacterizeConfig;
import io.xnatworks.characterize.config.ConfigurationException;
import io.xnatworks.characterize.exec.ExecutionResult;
import io.xnatworks.characterize.exec.ParallelExecutor;
import io.xnatworks.characterize.exec.ProgressContext;
import io.xnatworks.characterize.exec.TaskFailure;
import io.xnatworks.characterize.image.ImageDecoder;
import io.xnatworks.characterize.image.ImageJDecoder;
import io.xnatworks.characterize.inspect.ExternalValidator;
import io.xnatworks.characterize.inspect.ImageInspector;
import io.xnatworks.characterize.inspect.ImageItem;
import io.xnatworks.characterize.inspect.InspectionSettings;
import io.xnatworks.characterize.report.Report;
import io.xnatworks.characterize.report.ReportAggregator;
import io.xnatworks.characterize.report.ReportWriter;
import io.xnatworks.characterize.scan.FileEnumerator;
import io.xnatworks.characterize.series.ResolvedFile;
import io.xnatworks.characterize.series.SeriesAssembler;
import io.xnatworks.characterize.series.SeriesKey;
import io.xnatworks.characterize.series.SeriesKeyResolver;
import io.xnatworks.characterize.series.SeriesStager;
import io.xnatworks.characterize.thumbnail.AtlasAssembler;
import io.xnatworks.characterize.thumbnail.Thumbnail;
import io.xnatworks.characterize.thumbnail.ThumbnailAtlas;
import io.xnatworks.characterize.thumbnail.ThumbnailGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One characterization run: enumerate, inspect (per file or per series), aggregate and write
 * the report, the duplicates report, the optional summary image and the settings snapshot.
 */
public class CharacterizationPipeline {
    private static final Logger log = LoggerFactory.getLogger(CharacterizationPipeline.class);

    private final CharacterizeConfig config;
    private final ImageDecoder decoder;
    private final Path scratchRoot;

    public CharacterizationPipeline(CharacterizeConfig config) {
        this(config, new ImageJDecoder(config.getDecoderPlugin()), null);
    }

    /**
     * @param scratchRoot parent directory for series staging, or null for the system temp directory
     */
    public CharacterizationPipeline(CharacterizeConfig config, ImageDecoder decoder, Path scratchRoot) {
        this.config = config;
        this.decoder = decoder;
        this.scratchRoot = scratchRoot;
    }

    /**
     * Files produced by a run. Everything but the statistics is null or empty when no image
     * could be read.
     */
    public static final class RunResult {
        private final Report report;
        private final List<Path> reportFiles;
        private final Path summaryImage;
        private final Path settingsSnapshot;

        RunResult(Report report, List<Path> reportFiles, Path summaryImage, Path settingsSnapshot) {
            this.report = report;
            this.reportFiles = List.copyOf(reportFiles);
            this.summaryImage = summaryImage;
            this.settingsSnapshot = settingsSnapshot;
        }

        public Report getReport() { return report; }
        public List<Path> getReportFiles() { return reportFiles; }
        public Path getSummaryImage() { return summaryImage; }
        public Path getSettingsSnapshot() { return settingsSnapshot; }

        public boolean isReportCreated() {
            return !reportFiles.isEmpty();
        }
    }

    public RunResult run(Path root, Path outputFile, AnalysisType analysisType)
            throws ConfigurationException, IOException, InterruptedException {
        config.validate();

        List<Path> files;
        try {
            files = new FileEnumerator().enumerate(root);
        } catch (NotDirectoryException e) {
            throw new ConfigurationException("Root data directory does not exist: " + root, e);
        }

        InspectionSettings settings = new InspectionSettings(config.getMetadataColumns(),
                config.getValidatorColumns(), config.getThumbnailSettings());
        ImageInspector inspector = new ImageInspector(decoder, new SeriesStager(scratchRoot),
                new ExternalValidator(config.getValidatorTimeoutSeconds()), new ThumbnailGenerator(), settings);
        ParallelExecutor executor = new ParallelExecutor(config.getMaxWorkers());
        boolean showProgress = !config.isDisableProgress();

        List<ImageItem> items = new ArrayList<>();
        List<TaskFailure<?>> failures = new ArrayList<>();
        if (analysisType == AnalysisType.PER_FILE) {
            ExecutionResult<Path, ImageItem> inspected;
            try (ProgressContext progress = new ProgressContext("Inspecting files", showProgress)) {
                progress.start(files.size());
                inspected = executor.execute(files, inspector::inspectFile, progress);
            }
            items.addAll(inspected.getResults());
            failures.addAll(inspected.getFailures());
        } else {
            Map<SeriesKey, List<Path>> series = resolveSeries(files, executor, showProgress, failures);
            List<Map.Entry<SeriesKey, List<Path>>> tasks = new ArrayList<>(series.entrySet());
            ExecutionResult<Map.Entry<SeriesKey, List<Path>>, ImageItem> inspected;
            try (ProgressContext progress = new ProgressContext("Inspecting series", showProgress)) {
                progress.start(tasks.size());
                inspected = executor.execute(tasks, e -> inspector.inspectSeries(e.getKey(), e.getValue()), progress);
            }
            items.addAll(inspected.getResults());
            for (TaskFailure<Map.Entry<SeriesKey, List<Path>>> failure : inspected.getFailures()) {
                failures.add(new TaskFailure<>(failure.getInput().getKey(), failure.getCause()));
            }
        }

        Report report = new ReportAggregator().aggregate(items, failures);
        log.info("Run summary: {}", report.getStatistics());
        if (!report.hasReadableItems()) {
            log.info("No report created, no successfully read images from root directory ({})", root);
            return new RunResult(report, List.of(), null, null);
        }

        Path outputDirectory = outputFile.toAbsolutePath().getParent();
        Path snapshot = config.writeSnapshot(outputDirectory, LocalDateTime.now());
        log.info("Settings written to {}", snapshot);

        Path summaryImage = null;
        if (config.isCreateSummaryImage()) {
            List<Thumbnail> thumbnails = report.getThumbnails();
            if (!thumbnails.isEmpty()) {
                ThumbnailAtlas atlas = new AtlasAssembler(config.getTileSizes().get(0), config.getTileSizes().get(1))
                        .assemble(thumbnails);
                summaryImage = Path.of(ReportWriter.baseName(outputFile) + "_summary_image.tif");
                atlas.save(summaryImage);
            }
        }

        ReportWriter writer = new ReportWriter(new ArrayList<>(config.getMetadataColumns().keySet()),
                new ArrayList<>(config.getValidatorColumns().keySet()), config.isIgnoreProblems());
        List<Path> written = writer.write(report, outputFile);
        return new RunResult(report, written, summaryImage, snapshot);
    }

    private Map<SeriesKey, List<Path>> resolveSeries(List<Path> files, ParallelExecutor executor, boolean showProgress,
                                                     List<TaskFailure<?>> failures) throws InterruptedException {
        SeriesKeyResolver resolver = new SeriesKeyResolver(decoder, config.getSeriesDiscriminatorTags());
        ExecutionResult<Path, Optional<ResolvedFile>> resolved;
        try (ProgressContext progress = new ProgressContext("Reading series headers", showProgress)) {
            progress.start(files.size());
            resolved = executor.execute(files, resolver::resolve, progress);
        }
        failures.addAll(resolved.getFailures());

        List<ResolvedFile> seriesFiles = new ArrayList<>();
        for (Optional<ResolvedFile> result : resolved.getResults()) {
            result.ifPresent(seriesFiles::add);
        }
        Map<SeriesKey, List<Path>> series = new SeriesAssembler().assemble(seriesFiles);
        log.info("Found {} series in {} files, {} files are not part of a series",
                series.size(), seriesFiles.size(), files.size() - seriesFiles.size());
        return series;
    }
}
