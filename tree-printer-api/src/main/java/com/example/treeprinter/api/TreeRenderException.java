/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.api;

/**
 * Base class of all faults raised while rendering a tree.
 *
 * <p>Every fault is a caller-contract violation (malformed input shape or data), so none
 * of them is worth retrying. A render call that raises one produces no output at all.
 */
public class TreeRenderException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public TreeRenderException(String message) {
        super(message);
    }

    public TreeRenderException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Describe the runtime type of a value for diagnostics.
     * @param value any value, possibly null
     * @return the fully qualified class name, or "null"
     */
    protected static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
