/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.image;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of decoding one file or one series.
 *
 * Expected failures (unsupported format, unreadable or truncated data) and unexpected errors
 * (a decoder defect surfacing as a runtime exception) are kept apart so callers can log
 * the latter without treating the former as noise.
 */
public final class DecodeResult {

    public enum Status {
        SUCCESS,
        EXPECTED_FAILURE,
        UNEXPECTED_ERROR
    }

    private final Status status;
    private final ImageVolume volume;
    private final List<Path> orderedFiles;
    private final String message;
    private final Throwable error;

    private DecodeResult(Status status, ImageVolume volume, List<Path> orderedFiles, String message, Throwable error) {
        this.status = status;
        this.volume = volume;
        this.orderedFiles = orderedFiles;
        this.message = message;
        this.error = error;
    }

    /**
     * @param orderedFiles files that make up the volume, in slice order
     */
    public static DecodeResult success(ImageVolume volume, List<Path> orderedFiles) {
        return new DecodeResult(Status.SUCCESS, volume, List.copyOf(orderedFiles), null, null);
    }

    public static DecodeResult expectedFailure(String message) {
        return new DecodeResult(Status.EXPECTED_FAILURE, null, List.of(), message, null);
    }

    public static DecodeResult unexpectedError(String message, Throwable error) {
        return new DecodeResult(Status.UNEXPECTED_ERROR, null, List.of(), message, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Status getStatus() { return status; }
    public ImageVolume getVolume() { return volume; }
    public List<Path> getOrderedFiles() { return orderedFiles; }
    public String getMessage() { return message; }
    public Throwable getError() { return error; }

    @Override
    public String toString() {
        return status + (message != null ? ": " + message : "");
    }
}
