/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.thumbnail;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.ByteProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A stack of mosaic planes built by {@link AtlasAssembler}.
 */
public final class ThumbnailAtlas {
    private static final Logger log = LoggerFactory.getLogger(ThumbnailAtlas.class);

    private final int width;
    private final int height;
    private final int tileWidth;
    private final int tileHeight;
    private final int columns;
    private final int rows;
    private final int thumbnailCount;
    private final List<byte[]> planes;

    ThumbnailAtlas(int width, int height, int tileWidth, int tileHeight, int columns, int rows,
                   int thumbnailCount, List<byte[]> planes) {
        this.width = width;
        this.height = height;
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.columns = columns;
        this.rows = rows;
        this.thumbnailCount = thumbnailCount;
        this.planes = List.copyOf(planes);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getPlaneCount() { return planes.size(); }
    public int getThumbnailCount() { return thumbnailCount; }

    public int getPixel(int x, int y, int z) {
        return planes.get(z)[y * width + x] & 0xff;
    }

    /**
     * Index of the thumbnail covering an atlas voxel, or -1 for an empty slot.
     */
    public int thumbnailIndex(int x, int y, int z) {
        if (x < 0 || x >= width || y < 0 || y >= height || z < 0 || z >= planes.size()) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + "," + z + ") outside atlas");
        }
        int index = z * columns * rows + (y / tileHeight) * columns + x / tileWidth;
        return index < thumbnailCount ? index : -1;
    }

    public ImagePlus toImagePlus(String title) {
        ImageStack stack = new ImageStack(width, height);
        for (int z = 0; z < planes.size(); z++) {
            stack.addSlice("plane " + z, new ByteProcessor(width, height, planes.get(z).clone()));
        }
        return new ImagePlus(title, stack);
    }

    /**
     * Write the atlas as a TIFF, multi-page when it has more than one plane.
     */
    public void save(Path file) throws IOException {
        ImagePlus imp = toImagePlus(file.getFileName().toString());
        FileSaver saver = new FileSaver(imp);
        boolean saved = planes.size() > 1
                ? saver.saveAsTiffStack(file.toString())
                : saver.saveAsTiff(file.toString());
        if (!saved) {
            throw new IOException("Failed to write summary image: " + file);
        }
        log.info("Summary image written to {} ({} planes of {}x{})", file, planes.size(), width, height);
    }
}
