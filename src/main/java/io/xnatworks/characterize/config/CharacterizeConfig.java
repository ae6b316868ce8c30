/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.config;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.xnatworks.characterize.image.DecoderPlugin;
import io.xnatworks.characterize.image.DicomTags;
import io.xnatworks.characterize.thumbnail.Interpolator;
import io.xnatworks.characterize.thumbnail.ThumbnailSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Optional settings for a characterization run.
 *
 * Values come from three layers, later layers winning:
 * - built-in defaults (field initializers below)
 * - a JSON or YAML configuration file ({@link #load(File)})
 * - options given explicitly on the command line
 *
 * The positional run arguments (root directory, output file, analysis type) are not part of
 * this object, so a saved snapshot can be reused against a different data directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CharacterizeConfig {
    private static final Logger log = LoggerFactory.getLogger(CharacterizeConfig.class);

    static final DateTimeFormatter SNAPSHOT_PREFIX = DateTimeFormatter.ofPattern("dd_MM_yyyy-HH_mm_ss_");
    static final String SNAPSHOT_SUFFIX = "characterize_data_settings.json";

    /**
     * Default series discriminators, after GDCM's default unique series identifier:
     * series number, sequence name, slice thickness, rows, columns.
     */
    public static final List<String> DEFAULT_SERIES_TAGS = List.of(
            "0020|0011", "0018|0024", "0018|0050", "0028|0010", "0028|0011");

    @JsonProperty("max_workers")
    private int maxWorkers = 2;

    @JsonProperty("disable_progress")
    private boolean disableProgress = false;

    @JsonProperty("additional_series_tags")
    private List<String> additionalSeriesTags = new ArrayList<>(DEFAULT_SERIES_TAGS);

    /**
     * Decoder name, or "All" for format auto-detection.
     */
    private String decoder = "All";

    @JsonProperty("external_applications")
    private List<String> externalApplications = new ArrayList<>();

    @JsonProperty("external_applications_headings")
    private List<String> externalApplicationsHeadings = new ArrayList<>();

    @JsonProperty("metadata_keys")
    private List<String> metadataKeys = new ArrayList<>();

    @JsonProperty("metadata_keys_headings")
    private List<String> metadataKeysHeadings = new ArrayList<>();

    @JsonProperty("ignore_problems")
    private boolean ignoreProblems = false;

    @JsonProperty("create_summary_image")
    private boolean createSummaryImage = false;

    @JsonProperty("thumbnail_sizes")
    private List<Integer> thumbnailSizes = new ArrayList<>(List.of(64, 64));

    /**
     * Number of thumbnails per atlas plane along x and y.
     */
    @JsonProperty("tile_sizes")
    private List<Integer> tileSizes = new ArrayList<>(List.of(20, 20));

    @JsonProperty("projection_axis")
    private int projectionAxis = 2;

    private Interpolator interpolator = Interpolator.NEAREST_NEIGHBOR;

    @JsonProperty("validator_timeout_seconds")
    private long validatorTimeoutSeconds = 300;

    public static CharacterizeConfig load(File configFile) throws IOException {
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        return mapperFor(configFile.getName()).readValue(configFile, CharacterizeConfig.class);
    }

    private static ObjectMapper mapperFor(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        ObjectMapper mapper = lower.endsWith(".yaml") || lower.endsWith(".yml")
                ? new ObjectMapper(new YAMLFactory())
                : new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    /**
     * Keys in a configuration file that do not match any setting are reported, not fatal.
     */
    @JsonAnySetter
    public void reportUnknown(String key, Object value) {
        log.warn("Unexpected setting in configuration file ignored: {}", key);
    }

    /**
     * Save these settings to a specific file, JSON or YAML by extension.
     */
    public void save(File file) throws IOException {
        log.info("Saving configuration to: {}", file.getAbsolutePath());
        mapperFor(file.getName()).writeValue(file, this);
    }

    /**
     * Write a time-stamped JSON snapshot of these settings into a directory.
     *
     * @return path of the written snapshot
     */
    public Path writeSnapshot(Path directory, LocalDateTime timestamp) throws IOException {
        Files.createDirectories(directory);
        Path snapshot = directory.resolve(SNAPSHOT_PREFIX.format(timestamp) + SNAPSHOT_SUFFIX);
        save(snapshot.toFile());
        return snapshot;
    }

    /**
     * Check the constraints that individual option types cannot express.
     */
    public void validate() throws ConfigurationException {
        if (maxWorkers <= 0) {
            throw new ConfigurationException("Invalid max_workers (" + maxWorkers + "), expected value > 0");
        }
        if (externalApplications.size() != externalApplicationsHeadings.size()) {
            throw new ConfigurationException("Number of external applications and their headings do not match.");
        }
        if (metadataKeys.size() != metadataKeysHeadings.size()) {
            throw new ConfigurationException("Number of metadata keys and their headings do not match.");
        }
        if (projectionAxis < 0 || projectionAxis > 2) {
            throw new ConfigurationException("Invalid projection_axis (" + projectionAxis + "), expected 0, 1 or 2");
        }
        requirePositivePair("thumbnail_sizes", thumbnailSizes);
        requirePositivePair("tile_sizes", tileSizes);
        if (DecoderPlugin.fromName(decoder) == null) {
            throw new ConfigurationException("Unknown decoder '" + decoder + "', expected one of "
                    + Arrays.toString(DecoderPlugin.names()));
        }
        if (validatorTimeoutSeconds <= 0) {
            throw new ConfigurationException("Invalid validator_timeout_seconds (" + validatorTimeoutSeconds
                    + "), expected value > 0");
        }
        for (String key : metadataKeys) {
            if (key == null || key.isBlank()) {
                throw new ConfigurationException("Empty metadata key");
            }
        }
        Set<String> headings = new HashSet<>();
        List<String> allHeadings = new ArrayList<>(metadataKeysHeadings);
        allHeadings.addAll(externalApplicationsHeadings);
        for (String heading : allHeadings) {
            if (!headings.add(heading)) {
                throw new ConfigurationException("Duplicate report column heading '" + heading + "'");
            }
        }
    }

    private static void requirePositivePair(String name, List<Integer> values) throws ConfigurationException {
        if (values == null || values.size() != 2 || values.get(0) == null || values.get(1) == null
                || values.get(0) <= 0 || values.get(1) <= 0) {
            throw new ConfigurationException("Invalid " + name + " " + values + ", expected two positive integers");
        }
    }

    /**
     * Heading to metadata key, in heading order.
     */
    @JsonIgnore
    public Map<String, String> getMetadataColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        for (int i = 0; i < metadataKeys.size(); i++) {
            columns.put(metadataKeysHeadings.get(i), metadataKeys.get(i));
        }
        return columns;
    }

    /**
     * Heading to validator executable, in heading order.
     */
    @JsonIgnore
    public Map<String, String> getValidatorColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        for (int i = 0; i < externalApplications.size(); i++) {
            columns.put(externalApplicationsHeadings.get(i), externalApplications.get(i));
        }
        return columns;
    }

    /**
     * Discriminator tags in canonical form, de-duplicated, without the series and study
     * instance UIDs which are always part of the series key.
     */
    @JsonIgnore
    public List<String> getSeriesDiscriminatorTags() {
        Set<String> tags = new LinkedHashSet<>();
        for (String tag : additionalSeriesTags) {
            String canonical = DicomTags.canonical(tag);
            if (canonical == null) {
                log.warn("Ignoring unrecognized series tag: {}", tag);
                continue;
            }
            tags.add(canonical);
        }
        tags.remove(DicomTags.SERIES_INSTANCE_UID);
        tags.remove(DicomTags.STUDY_INSTANCE_UID);
        return new ArrayList<>(tags);
    }

    /**
     * Thumbnail settings, or null when no summary image was requested.
     */
    @JsonIgnore
    public ThumbnailSettings getThumbnailSettings() {
        if (!createSummaryImage) {
            return null;
        }
        return new ThumbnailSettings(thumbnailSizes.get(0), thumbnailSizes.get(1), projectionAxis, interpolator);
    }

    @JsonIgnore
    public DecoderPlugin getDecoderPlugin() {
        return DecoderPlugin.fromName(decoder);
    }

    // Getters and setters
    public int getMaxWorkers() { return maxWorkers; }
    public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

    public boolean isDisableProgress() { return disableProgress; }
    public void setDisableProgress(boolean disableProgress) { this.disableProgress = disableProgress; }

    public List<String> getAdditionalSeriesTags() { return additionalSeriesTags; }
    public void setAdditionalSeriesTags(List<String> additionalSeriesTags) { this.additionalSeriesTags = additionalSeriesTags; }

    public String getDecoder() { return decoder; }
    public void setDecoder(String decoder) { this.decoder = decoder; }

    public List<String> getExternalApplications() { return externalApplications; }
    public void setExternalApplications(List<String> externalApplications) { this.externalApplications = externalApplications; }

    public List<String> getExternalApplicationsHeadings() { return externalApplicationsHeadings; }
    public void setExternalApplicationsHeadings(List<String> externalApplicationsHeadings) { this.externalApplicationsHeadings = externalApplicationsHeadings; }

    public List<String> getMetadataKeys() { return metadataKeys; }
    public void setMetadataKeys(List<String> metadataKeys) { this.metadataKeys = metadataKeys; }

    public List<String> getMetadataKeysHeadings() { return metadataKeysHeadings; }
    public void setMetadataKeysHeadings(List<String> metadataKeysHeadings) { this.metadataKeysHeadings = metadataKeysHeadings; }

    public boolean isIgnoreProblems() { return ignoreProblems; }
    public void setIgnoreProblems(boolean ignoreProblems) { this.ignoreProblems = ignoreProblems; }

    public boolean isCreateSummaryImage() { return createSummaryImage; }
    public void setCreateSummaryImage(boolean createSummaryImage) { this.createSummaryImage = createSummaryImage; }

    public List<Integer> getThumbnailSizes() { return thumbnailSizes; }
    public void setThumbnailSizes(List<Integer> thumbnailSizes) { this.thumbnailSizes = thumbnailSizes; }

    public List<Integer> getTileSizes() { return tileSizes; }
    public void setTileSizes(List<Integer> tileSizes) { this.tileSizes = tileSizes; }

    public int getProjectionAxis() { return projectionAxis; }
    public void setProjectionAxis(int projectionAxis) { this.projectionAxis = projectionAxis; }

    public Interpolator getInterpolator() { return interpolator; }
    public void setInterpolator(Interpolator interpolator) { this.interpolator = interpolator; }

    public long getValidatorTimeoutSeconds() { return validatorTimeoutSeconds; }
    public void setValidatorTimeoutSeconds(long validatorTimeoutSeconds) { this.validatorTimeoutSeconds = validatorTimeoutSeconds; }
}
