/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.thumbnail;

import java.util.ArrayList;
import java.util.List;

/**
 * Tiles thumbnails into a stack of equally sized mosaic planes.
 *
 * Each plane holds {@code columns x rows} thumbnails in row-major order. Slots of the last
 * plane left without a thumbnail stay zero.
 */
public class AtlasAssembler {

    private final int columns;
    private final int rows;

    public AtlasAssembler(int columns, int rows) {
        if (columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException("Tile grid must be positive: " + columns + "x" + rows);
        }
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * @param thumbnails equally sized thumbnails, in report row order; must not be empty
     */
    public ThumbnailAtlas assemble(List<Thumbnail> thumbnails) {
        if (thumbnails.isEmpty()) {
            throw new IllegalArgumentException("No thumbnails to assemble");
        }
        int tileWidth = thumbnails.get(0).getWidth();
        int tileHeight = thumbnails.get(0).getHeight();
        int planeWidth = columns * tileWidth;
        int planeHeight = rows * tileHeight;
        int perPlane = columns * rows;

        List<byte[]> planes = new ArrayList<>();
        for (int start = 0; start < thumbnails.size(); start += perPlane) {
            byte[] plane = new byte[planeWidth * planeHeight];
            int end = Math.min(start + perPlane, thumbnails.size());
            for (int n = start; n < end; n++) {
                Thumbnail thumbnail = thumbnails.get(n);
                if (thumbnail.getWidth() != tileWidth || thumbnail.getHeight() != tileHeight) {
                    throw new IllegalArgumentException("Thumbnail " + n + " is " + thumbnail.getWidth() + "x"
                            + thumbnail.getHeight() + ", expected " + tileWidth + "x" + tileHeight);
                }
                int slot = n - start;
                int x0 = (slot % columns) * tileWidth;
                int y0 = (slot / columns) * tileHeight;
                byte[] pixels = thumbnail.getPixels();
                for (int y = 0; y < tileHeight; y++) {
                    System.arraycopy(pixels, y * tileWidth, plane, (y0 + y) * planeWidth + x0, tileWidth);
                }
            }
            planes.add(plane);
        }
        return new ThumbnailAtlas(planeWidth, planeHeight, tileWidth, tileHeight, columns, rows,
                thumbnails.size(), planes);
    }
}
