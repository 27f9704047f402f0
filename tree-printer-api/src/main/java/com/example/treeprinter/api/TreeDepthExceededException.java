/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.api;

/**
 * A tree is nested deeper than the renderer allows. Usually this means the data
 * contains a cycle (a node reachable from itself).
 */
public class TreeDepthExceededException extends TreeRenderException {

    private static final long serialVersionUID = 1L;

    private final int maxDepth;

    public TreeDepthExceededException(int maxDepth, String label) {
        super("tree deeper than " + maxDepth + " levels at node '" + label +
            "' (cyclic data?)");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
