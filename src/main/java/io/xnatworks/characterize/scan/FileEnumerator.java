/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists every regular file under a directory tree.
 *
 * No extension filtering is done: files that turn out not to be images still get a report
 * row, which tells "present but unreadable" apart from "absent".
 */
public class FileEnumerator {
    private static final Logger log = LoggerFactory.getLogger(FileEnumerator.class);

    /**
     * @return absolute paths of all regular files under {@code root}, in walk order
     * @throws NotDirectoryException if {@code root} is not an existing directory
     */
    public List<Path> enumerate(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> files = stream.filter(Files::isRegularFile)
                    .map(p -> p.toAbsolutePath().normalize())
                    .collect(Collectors.toList());
            log.info("Found {} files under {}", files.size(), root);
            return files;
        }
    }
}
