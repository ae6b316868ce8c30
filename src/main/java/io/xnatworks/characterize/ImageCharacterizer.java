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
import io.xnatworks.characterize.thumbnail.Interpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * XNAT Image Characterizer - command line entry point
 *
 * Inspects every file under a directory tree, either file by file or grouped into DICOM
 * series, and writes:
 * - a CSV report describing each image (fingerprint, geometry, pixel type, intensity
 *   statistics, requested metadata, external validator results)
 * - a CSV of exact-content duplicates
 * - optionally, a TIFF atlas of thumbnails for visual review
 * - a snapshot of the settings used, reusable with --configuration-file
 */
@Command(name = "characterize-data",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Characterize an image corpus: per file or per series report, duplicates and summary image")
public class ImageCharacterizer implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ImageCharacterizer.class);

    @Parameters(index = "0", paramLabel = "root_of_data_directory", description = "Path to the root of the data directory")
    Path root;

    @Parameters(index = "1", paramLabel = "output_file", description = "Output CSV file path")
    Path outputFile;

    @Parameters(index = "2", paramLabel = "analysis_type", description = "per_file or per_series")
    AnalysisType analysisType;

    @Option(names = "--configuration-file", description = "JSON or YAML file with settings; explicit options override it")
    File configurationFile;

    @Option(names = "--max-workers", description = "Number of concurrent workers (default: 2)")
    Integer maxWorkers;

    @Option(names = "--disable-progress", description = "Do not report progress")
    Boolean disableProgress;

    @Option(names = "--additional-series-tags", arity = "1..*",
            description = "DICOM tags that split series sharing series and study UIDs")
    List<String> additionalSeriesTags;

    @Option(names = "--decoder", description = "Decoder to use, one of: All, TIFF, DICOM, FITS, PGM, JPEG, GIF, BMP, PNG, ZIP")
    String decoder;

    @Option(names = "--external-applications", arity = "1..*",
            description = "Programs run as '<program> <file>', reported as succeeded/failed")
    List<String> externalApplications;

    @Option(names = "--external-applications-headings", arity = "1..*",
            description = "Report column headings for the external applications")
    List<String> externalApplicationsHeadings;

    @Option(names = "--metadata-keys", arity = "1..*", description = "Metadata keys or DICOM tags to report")
    List<String> metadataKeys;

    @Option(names = "--metadata-keys-headings", arity = "1..*",
            description = "Report column headings for the metadata keys")
    List<String> metadataKeysHeadings;

    @Option(names = "--ignore-problems", description = "Leave unreadable files out of the report")
    Boolean ignoreProblems;

    @Option(names = "--create-summary-image", description = "Write a thumbnail atlas of all readable images")
    Boolean createSummaryImage;

    @Option(names = "--thumbnail-sizes", arity = "2", description = "Thumbnail width and height (default: 64 64)")
    List<Integer> thumbnailSizes;

    @Option(names = "--tile-sizes", arity = "2", description = "Thumbnails per atlas plane along x and y (default: 20 20)")
    List<Integer> tileSizes;

    @Option(names = "--projection-axis", description = "Axis of the maximum intensity projection for 3-D images (default: 2)")
    Integer projectionAxis;

    @Option(names = "--interpolator", description = "Thumbnail interpolator: NEAREST_NEIGHBOR, LINEAR or CUBIC")
    Interpolator interpolator;

    @Option(names = "--validator-timeout-seconds", description = "Time limit for one external application run (default: 300)")
    Long validatorTimeoutSeconds;

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new ImageCharacterizer());
        commandLine.registerConverter(AnalysisType.class, AnalysisType::fromName);
        commandLine.registerConverter(Interpolator.class, Interpolator::fromName);
        return commandLine;
    }

    @Override
    public Integer call() throws Exception {
        CharacterizeConfig config;
        try {
            config = configurationFile != null ? CharacterizeConfig.load(configurationFile) : new CharacterizeConfig();
        } catch (IOException e) {
            System.err.println("Cannot read configuration file " + configurationFile + ": " + e.getMessage());
            return 1;
        }
        applyOverrides(config);

        try {
            CharacterizationPipeline.RunResult result = new CharacterizationPipeline(config)
                    .run(root, outputFile, analysisType);
            if (!result.isReportCreated()) {
                System.out.println("No report created, no successfully read images from root directory (" + root + ")");
            }
            return 0;
        } catch (ConfigurationException e) {
            log.debug("Configuration error", e);
            System.err.println(e.getMessage());
            return 1;
        }
    }

    /**
     * Options given on the command line win over the configuration file.
     */
    void applyOverrides(CharacterizeConfig config) {
        if (maxWorkers != null) config.setMaxWorkers(maxWorkers);
        if (disableProgress != null) config.setDisableProgress(disableProgress);
        if (additionalSeriesTags != null) config.setAdditionalSeriesTags(additionalSeriesTags);
        if (decoder != null) config.setDecoder(decoder);
        if (externalApplications != null) config.setExternalApplications(externalApplications);
        if (externalApplicationsHeadings != null) config.setExternalApplicationsHeadings(externalApplicationsHeadings);
        if (metadataKeys != null) config.setMetadataKeys(metadataKeys);
        if (metadataKeysHeadings != null) config.setMetadataKeysHeadings(metadataKeysHeadings);
        if (ignoreProblems != null) config.setIgnoreProblems(ignoreProblems);
        if (createSummaryImage != null) config.setCreateSummaryImage(createSummaryImage);
        if (thumbnailSizes != null) config.setThumbnailSizes(thumbnailSizes);
        if (tileSizes != null) config.setTileSizes(tileSizes);
        if (projectionAxis != null) config.setProjectionAxis(projectionAxis);
        if (interpolator != null) config.setInterpolator(interpolator);
        if (validatorTimeoutSeconds != null) config.setValidatorTimeoutSeconds(validatorTimeoutSeconds);
    }
}
