/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo.fs;

import com.example.treeprinter.api.TreeRole;

import java.util.ArrayList;
import java.util.List;

/**
 * Common file system entry data. Embedded into both files and directories.
 */
public class Metadata {

    @TreeRole("label")
    private final String name;

    @TreeRole("properties")
    private final List<String> attributes = new ArrayList<>();

    public Metadata(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Metadata attribute(String attribute) {
        attributes.add(attribute);
        return this;
    }
}
