/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.shape;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache of learned {@link TreeShape}s, keyed by type.
 *
 * <p>Trees are usually built from one or two node types, so every node after the first
 * of its type is served from here. Once a type is cached, every lookup returns the very
 * same {@link TreeShape} instance.
 *
 * <p><b>Thread Safety:</b> Scans run without any lock. When two threads learn the same
 * type concurrently, both scan it but only the first result is published
 * ({@code putIfAbsent}); the loser discards its own result and returns the published
 * one. Published shapes are immutable.
 *
 * <p>Faulty types are not cached: each lookup scans them again and faults again.
 *
 * <p>Set {@code -Dtree.printer.verbose=true} to print each newly learned shape.
 */
public final class TreeShapeCache {

    private static final TreeShapeCache SHARED = new TreeShapeCache();

    private static final boolean VERBOSE = Boolean.getBoolean("tree.printer.verbose");

    private final ConcurrentHashMap<Class<?>, TreeShape> shapes = new ConcurrentHashMap<>(64);

    /**
     * Get the process-wide cache used by default visitors.
     */
    public static TreeShapeCache shared() {
        return SHARED;
    }

    /**
     * Get the shape of a type, learning it on first use.
     *
     * @param type a node type
     * @return the cached shape (identical instance on every call)
     * @throws com.example.treeprinter.api.TreeShapeException if the type declares its roles incorrectly
     */
    public TreeShape lookup(Class<?> type) {
        TreeShape shape = shapes.get(type);
        if (shape != null) {
            return shape;
        }
        return lookup(type, new HashSet<Class<?>>());
    }

    TreeShape lookup(Class<?> type, Set<Class<?>> inProgress) {
        TreeShape shape = shapes.get(type);
        if (shape != null) {
            return shape;
        }
        shape = ShapeScanner.scan(type, this, inProgress);
        TreeShape published = shapes.putIfAbsent(type, shape);
        if (published != null) {
            return published;
        }
        if (VERBOSE) {
            System.out.println("[TreeShapeCache] Learned " + shape);
        }
        return shape;
    }

    /**
     * @return number of cached shapes
     */
    public int size() {
        return shapes.size();
    }

    /**
     * Forget all learned shapes. Meant for tests; never needed in normal operation.
     */
    public void reset() {
        shapes.clear();
    }
}
