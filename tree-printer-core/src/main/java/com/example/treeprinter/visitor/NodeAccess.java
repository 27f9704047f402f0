/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.visitor;

import com.example.treeprinter.api.Role;
import com.example.treeprinter.api.UnsupportedNodeTypeException;
import com.example.treeprinter.shape.TreeShape;
import com.example.treeprinter.shape.TreeShapeCache;

import java.util.Map;

/**
 * A node classified once as either an annotated object or a map with well-known keys.
 */
abstract class NodeAccess {

    /**
     * Classify a value. An {@link Iterable} counts as an object only when its type declares
     * at least one role; otherwise it is left to be treated as a sequence.
     *
     * @return access to its roles, or null if the value is neither a map nor an object that
     *         can carry roles
     */
    static NodeAccess of(Object value, TreeShapeCache cache) {
        if (value instanceof Map) {
            return new MapAccess((Map<?, ?>) value);
        }
        if (isRecord(value)) {
            TreeShape shape = cache.lookup(value.getClass());
            if (!(value instanceof Iterable) || !shape.isBare()) {
                return new RecordAccess(shape, value);
            }
        }
        return null;
    }

    /**
     * Like {@link #of} but for values that must be nodes.
     * @throws UnsupportedNodeTypeException naming the value's type
     */
    static NodeAccess node(Object value, TreeShapeCache cache) {
        NodeAccess access = of(value, cache);
        if (access == null) {
            throw new UnsupportedNodeTypeException(value);
        }
        return access;
    }

    /**
     * Objects other than maps, arrays and scalars may carry roles.
     */
    static boolean isRecord(Object value) {
        return value != null
            && !(value instanceof Map)
            && !value.getClass().isArray()
            && !(value instanceof CharSequence)
            && !(value instanceof Number)
            && !(value instanceof Boolean)
            && !(value instanceof Character)
            && !(value instanceof Enum)
            && !(value instanceof Class);
    }

    abstract boolean has(Role role);

    /**
     * @return the label text, empty if absent
     */
    abstract String label();

    /**
     * @return the role's value, or null if absent
     */
    abstract Object get(Role role);

    static final class MapAccess extends NodeAccess {
        private final Map<?, ?> map;

        MapAccess(Map<?, ?> map) {
            this.map = map;
        }

        @Override
        boolean has(Role role) {
            return map.containsKey(role.key());
        }

        @Override
        Object get(Role role) {
            return map.get(role.key());
        }

        /**
         * Only text values are labels; any other value under the key gives an empty label.
         */
        @Override
        String label() {
            Object label = map.get(Role.LABEL.key());
            return label instanceof CharSequence ? label.toString() : "";
        }
    }

    static final class RecordAccess extends NodeAccess {
        private final TreeShape shape;
        private final Object record;

        RecordAccess(TreeShape shape, Object record) {
            this.shape = shape;
            this.record = record;
        }

        @Override
        boolean has(Role role) {
            return shape.has(role);
        }

        @Override
        Object get(Role role) {
            return shape.read(role, record);
        }

        @Override
        String label() {
            return Sequences.text(get(Role.LABEL));
        }
    }
}
