/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo.fs;

import com.example.treeprinter.api.TreeEmbedded;
import com.example.treeprinter.api.TreeRole;

import java.util.ArrayList;
import java.util.List;

public class DirectoryEntry {

    @TreeEmbedded
    private final Metadata metadata;

    @TreeRole("children")
    private final List<Object> entries = new ArrayList<>();

    public DirectoryEntry(String name) {
        this.metadata = new Metadata(name);
    }

    public DirectoryEntry add(Object entry) {
        entries.add(entry);
        return this;
    }

    public DirectoryEntry attribute(String attribute) {
        metadata.attribute(attribute);
        return this;
    }
}
