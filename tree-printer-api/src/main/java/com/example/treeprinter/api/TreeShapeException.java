/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.api;

/**
 * A type's tree roles are declared incorrectly: a role is declared twice at the same
 * level, a {@link TreeRole} value is not a role name, or embedded types form a cycle.
 *
 * <p>The fault is a property of the type, not of a particular instance, so it recurs on
 * every render of that type.
 */
public class TreeShapeException extends TreeRenderException {

    private static final long serialVersionUID = 1L;

    private final Class<?> shape;

    public TreeShapeException(Class<?> shape, String message) {
        super(message);
        this.shape = shape;
    }

    public TreeShapeException(Class<?> shape, String message, Throwable cause) {
        super(message, cause);
        this.shape = shape;
    }

    /**
     * @return the offending type
     */
    public Class<?> getShape() {
        return shape;
    }
}
