/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.inspect;

import io.xnatworks.characterize.image.DecodeResult;
import io.xnatworks.characterize.image.DicomTags;
import io.xnatworks.characterize.image.ImageDecoder;
import io.xnatworks.characterize.image.ImageVolume;
import io.xnatworks.characterize.series.SeriesKey;
import io.xnatworks.characterize.series.SeriesStager;
import io.xnatworks.characterize.thumbnail.ThumbnailGenerator;
import io.xnatworks.characterize.thumbnail.ThumbnailSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns one file or one series into an {@link ImageItem}.
 *
 * Input that cannot be decoded yields a problem item holding only its files. Decoder defects
 * are logged but still end as problem items, so a single bad file never stops a run.
 */
public class ImageInspector {
    private static final Logger log = LoggerFactory.getLogger(ImageInspector.class);

    private final ImageDecoder decoder;
    private final SeriesStager stager;
    private final ExternalValidator validator;
    private final ThumbnailGenerator thumbnailGenerator;
    private final InspectionSettings settings;

    public ImageInspector(ImageDecoder decoder, SeriesStager stager, ExternalValidator validator,
                          ThumbnailGenerator thumbnailGenerator, InspectionSettings settings) {
        this.decoder = decoder;
        this.stager = stager;
        this.validator = validator;
        this.thumbnailGenerator = thumbnailGenerator;
        this.settings = settings;
    }

    public ImageItem inspectFile(Path file) {
        List<Path> files = List.of(file);
        DecodeResult result = decoder.decode(file);
        if (!result.isSuccess()) {
            logFailure(file.toString(), result);
            return ImageItem.problem(file.toString(), files);
        }
        ImageItem.Builder builder = describe(file.toString(), files, result.getVolume());
        runValidators(builder, file);
        return builder.build();
    }

    /**
     * @param files the series members, in any order; the item lists them in slice order
     */
    public ImageItem inspectSeries(SeriesKey key, List<Path> files) {
        try (SeriesStager.StagedSeries staged = stager.stage(files)) {
            DecodeResult result = decoder.decodeSeries(staged.getDirectory(), key.getSeriesUid());
            if (!result.isSuccess()) {
                logFailure(key.toString(), result);
                return ImageItem.problem(key.toString(), files);
            }

            List<Path> ordered = new ArrayList<>(result.getOrderedFiles().size());
            for (Path stagedFile : result.getOrderedFiles()) {
                Path original = staged.originalOf(stagedFile);
                ordered.add(original != null ? original : stagedFile);
            }
            ImageItem.Builder builder = describe(key.toString(), ordered, result.getVolume());
            runValidators(builder, ordered.get(0));
            return builder.build();
        } catch (IOException e) {
            log.debug("Could not stage series {}: {}", key, e.getMessage());
            return ImageItem.problem(key.toString(), files);
        }
    }

    private ImageItem.Builder describe(String key, List<Path> files, ImageVolume volume) {
        ImageItem.Builder builder = ImageItem.builder(key, files)
                .size(volume.getSize())
                .spacing(volume.getSpacing())
                .origin(volume.getOrigin())
                .direction(volume.getDirection());

        String typeLabel = volume.getPixelType().getLabel();
        int channels = volume.getChannelCount();
        // ImageJ opens a JPEG whose channels are all equal as one 8-bit channel.
        if (channels == 1) {
            builder.pixelType(typeLabel + " gray")
                    .fingerprint(Fingerprint.md5(volume.channelBytes(0)))
                    .statistics(IntensityStatistics.of(volume, 0));
        } else if (channels >= 3 && volume.channelsIdentical(0, 1) && volume.channelsIdentical(0, 2)) {
            builder.pixelType(typeLabel + " " + channels + " channels gray")
                    .fingerprint(Fingerprint.md5(volume.channelBytes(0)))
                    .statistics(IntensityStatistics.of(volume, 0));
        } else {
            builder.pixelType(typeLabel + " " + channels + " channels color")
                    .fingerprint(Fingerprint.md5(volume.interleavedBytes()));
        }

        Map<String, String> tags = volume.getTags();
        for (Map.Entry<String, String> column : settings.getMetadataColumns().entrySet()) {
            String value = tags.get(DicomTags.lookupKey(column.getValue()));
            if (value != null) {
                builder.metadata(column.getKey(), value);
            }
        }

        ThumbnailSettings thumbnailSettings = settings.getThumbnailSettings();
        if (thumbnailSettings != null) {
            builder.thumbnail(thumbnailGenerator.generate(volume, thumbnailSettings));
        }
        return builder;
    }

    private void runValidators(ImageItem.Builder builder, Path file) {
        for (Map.Entry<String, String> column : settings.getValidatorColumns().entrySet()) {
            builder.validatorOutcome(column.getKey(), validator.validate(column.getValue(), file));
        }
    }

    private static void logFailure(String input, DecodeResult result) {
        if (result.getStatus() == DecodeResult.Status.UNEXPECTED_ERROR) {
            log.warn("Unexpected decoder error for {}: {}", input, result.getMessage(), result.getError());
        } else {
            log.debug("Could not decode {}: {}", input, result.getMessage());
        }
    }
}
