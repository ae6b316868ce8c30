/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.series;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gathers the files of one series into a private scratch directory.
 *
 * Series members may live in different directories and share base names, so each file is
 * staged under a synthetic name {@code 0..n-1}. Files are hard-linked when the filesystem
 * allows it, which is probed with the first file, and copied otherwise.
 */
public class SeriesStager {
    private static final Logger log = LoggerFactory.getLogger(SeriesStager.class);

    private final Path scratchRoot;

    /**
     * @param scratchRoot parent of the scratch directories, or null for the system temp directory
     */
    public SeriesStager(Path scratchRoot) {
        this.scratchRoot = scratchRoot;
    }

    public StagedSeries stage(List<Path> files) throws IOException {
        Path directory = scratchRoot != null
                ? Files.createTempDirectory(Files.createDirectories(scratchRoot), "series-")
                : Files.createTempDirectory("series-");
        Map<Path, Path> originals = new LinkedHashMap<>();
        StagedSeries staged = new StagedSeries(directory, originals);
        try {
            boolean linking = true;
            for (int i = 0; i < files.size(); i++) {
                Path source = files.get(i);
                Path target = directory.resolve(Integer.toString(i));
                if (linking) {
                    linking = tryLink(target, source);
                }
                if (!linking) {
                    Files.copy(source, target);
                }
                originals.put(target.getFileName(), source);
            }
            log.debug("Staged {} files into {} ({})", files.size(), directory, linking ? "hard links" : "copies");
            return staged;
        } catch (IOException | RuntimeException e) {
            staged.close();
            throw e;
        }
    }

    private static boolean tryLink(Path target, Path source) {
        try {
            Files.createLink(target, source);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("Hard links unavailable for {}, copying instead: {}", source, e.toString());
            return false;
        }
    }

    /**
     * A scratch directory holding one staged series. Closing it deletes the directory.
     */
    public static final class StagedSeries implements AutoCloseable {
        private final Path directory;
        private final Map<Path, Path> originals;

        private StagedSeries(Path directory, Map<Path, Path> originals) {
            this.directory = directory;
            this.originals = originals;
        }

        public Path getDirectory() {
            return directory;
        }

        /**
         * Original path of a staged file, or null when it was not staged here.
         */
        public Path originalOf(Path staged) {
            return originals.get(staged.getFileName());
        }

        public Map<Path, Path> getOriginals() {
            return Collections.unmodifiableMap(originals);
        }

        @Override
        public void close() {
            if (!Files.exists(directory)) {
                return;
            }
            try {
                Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                        Files.delete(file);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                        Files.delete(dir);
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                log.warn("Failed to delete scratch directory {}: {}", directory, e.getMessage());
            }
        }
    }
}
