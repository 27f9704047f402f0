/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.api;

/**
 * A value encountered as a tree node is neither an annotated object nor a map.
 */
public class UnsupportedNodeTypeException extends TreeRenderException {

    private static final long serialVersionUID = 1L;

    public UnsupportedNodeTypeException(Object node) {
        super("unsupported tree node type " + typeName(node));
    }
}
