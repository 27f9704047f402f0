/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.shape;

import com.example.treeprinter.api.Role;

/**
 * Where a type keeps its label, properties, children and roots.
 *
 * <p>Learned once per type by {@link TreeShapeCache} and shared afterwards.
 * Immutable and thread-safe.
 */
public final class TreeShape {

    private final Class<?> type;
    private final FieldPath[] paths;

    TreeShape(Class<?> type, FieldPath[] paths) {
        this.type = type;
        this.paths = paths.clone();
    }

    public Class<?> getType() {
        return type;
    }

    /**
     * @param role a role
     * @return the path to the member playing this role, or null if the type has none
     */
    public FieldPath getPath(Role role) {
        return paths[role.ordinal()];
    }

    public boolean has(Role role) {
        return paths[role.ordinal()] != null;
    }

    /**
     * Read a role's value from a node of this shape.
     *
     * @return the value, or null if the role is absent or unset on this node
     */
    public Object read(Role role, Object node) {
        FieldPath path = paths[role.ordinal()];
        return path == null ? null : path.read(node);
    }

    /**
     * @return true if no role at all is declared
     */
    public boolean isBare() {
        for (FieldPath path : paths) {
            if (path != null) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TreeShape{").append(type.getName());
        for (Role role : Role.values()) {
            FieldPath path = paths[role.ordinal()];
            if (path != null) {
                sb.append(", ").append(role.key()).append('=').append(path);
            }
        }
        return sb.append('}').toString();
    }
}
