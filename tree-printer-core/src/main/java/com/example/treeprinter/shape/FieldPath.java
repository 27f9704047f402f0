/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.shape;

import com.example.treeprinter.api.TreeShapeException;

import java.lang.reflect.Field;
import java.util.Arrays;

/**
 * Route from a node to one of its role members, through zero or more embedded members.
 *
 * <p>The depth counts how far from the node's own class the member was declared: one
 * level per embedded member and one per superclass. Immutable.
 */
public final class FieldPath {

    private final Field[] fields;
    private final int[] indices;
    private final int depth;

    FieldPath(Field field, int index) {
        this(new Field[] {field}, new int[] {index}, 0);
    }

    private FieldPath(Field[] fields, int[] indices, int depth) {
        this.fields = fields;
        this.indices = indices;
        this.depth = depth;
    }

    /**
     * Prepend an embedded member to this path.
     */
    FieldPath under(Field embedded, int index) {
        Field[] f = new Field[fields.length + 1];
        int[] i = new int[indices.length + 1];
        f[0] = embedded;
        i[0] = index;
        System.arraycopy(fields, 0, f, 1, fields.length);
        System.arraycopy(indices, 0, i, 1, indices.length);
        return new FieldPath(f, i, depth + 1);
    }

    /**
     * Same members, seen from a subclass.
     */
    FieldPath inherited() {
        return new FieldPath(fields, indices, depth + 1);
    }

    /**
     * Nesting level of the role member: 0 when declared directly on the type.
     */
    public int depth() {
        return depth;
    }

    /**
     * Member positions along the path, counted over each declaring class's instance
     * fields in declaration order.
     * @return a copy of the index path
     */
    public int[] getIndices() {
        return indices.clone();
    }

    /**
     * @return the role member itself
     */
    public Field getTarget() {
        return fields[fields.length - 1];
    }

    /**
     * Read the role member's value from a node.
     *
     * @param node an instance of the type this path was learned from
     * @return the member value, or null if the member or an embedded value on the way is null
     */
    public Object read(Object node) {
        Object current = node;
        for (Field field : fields) {
            if (current == null) {
                return null;
            }
            try {
                current = field.get(current);
            } catch (IllegalAccessException e) {
                throw new TreeShapeException(field.getDeclaringClass(),
                    "cannot read " + field.getDeclaringClass().getName() + "." + field.getName(), e);
            }
        }
        return current;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Field field : fields) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(field.getName());
        }
        return sb.append(' ').append(Arrays.toString(indices)).toString();
    }
}
