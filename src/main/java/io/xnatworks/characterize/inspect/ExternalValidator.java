/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.inspect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external program as {@code program <file>} and reports pass/fail from its exit code.
 * Output is discarded. A program that does not finish within the timeout is killed and
 * counts as failed.
 */
public class ExternalValidator {
    private static final Logger log = LoggerFactory.getLogger(ExternalValidator.class);

    private final long timeoutSeconds;

    public ExternalValidator(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public ValidatorOutcome validate(String program, Path file) {
        ProcessBuilder pb = new ProcessBuilder(program, file.toString());
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.debug("Could not start validator {}: {}", program, e.getMessage());
            return ValidatorOutcome.FAILED;
        }

        try {
            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                log.warn("Validator {} timed out after {}s on {}", program, timeoutSeconds, file);
                process.destroyForcibly();
                return ValidatorOutcome.FAILED;
            }
            return process.exitValue() == 0 ? ValidatorOutcome.SUCCEEDED : ValidatorOutcome.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ValidatorOutcome.FAILED;
        }
    }
}
