/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.api;

/**
 * The top-level roots value is not an annotated object, a map, or a sequence.
 */
public class UnsupportedRootsTypeException extends TreeRenderException {

    private static final long serialVersionUID = 1L;

    public UnsupportedRootsTypeException(Object roots) {
        super("unsupported roots type: expected sequence, map, or annotated object; got " +
            typeName(roots));
    }
}
