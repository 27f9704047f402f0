/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo.fs;

import com.example.treeprinter.api.TreeEmbedded;

public class FileEntry {

    @TreeEmbedded
    private final Metadata metadata;

    // Not annotated, so never rendered
    private final long size;

    public FileEntry(String name, long size) {
        this.metadata = new Metadata(name).attribute(size + " bytes");
        this.size = size;
    }

    public long getSize() {
        return size;
    }
}
