/*
 * XNAT Image Characterizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.characterize.report;

import io.xnatworks.characterize.inspect.ImageItem;

import java.util.List;

/**
 * Items sharing one content fingerprint, in report row order.
 */
public final class DuplicateGroup {
    private final String fingerprint;
    private final List<ImageItem> items;

    public DuplicateGroup(String fingerprint, List<ImageItem> items) {
        this.fingerprint = fingerprint;
        this.items = List.copyOf(items);
    }

    public String getFingerprint() { return fingerprint; }
    public List<ImageItem> getItems() { return items; }

    public int size() {
        return items.size();
    }
}
