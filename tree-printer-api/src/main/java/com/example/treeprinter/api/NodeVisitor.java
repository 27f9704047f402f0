/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.api;

import java.util.List;

/**
 * Looks into caller-owned data and retrieves the tree-relevant parts of it.
 *
 * <p>Visitors do not traverse; walking the tree is the renderer's job. A visitor only
 * answers, for one value at a time, which values are the roots and what a node's label,
 * properties and children are. This keeps user types free of any tree-specific
 * interface.
 *
 * <p><b>Thread Safety:</b> Implementations must be safe for concurrent use by
 * independent render calls.
 */
public interface NodeVisitor {

    /**
     * Resolve the top-level root nodes of a roots value.
     *
     * @param roots a single node, a sequence of nodes, or a roots-bearing container
     * @return the root nodes in render order (never null)
     * @throws UnsupportedRootsTypeException if the value cannot hold roots
     */
    List<Object> roots(Object roots);

    /**
     * Get the label of a node.
     *
     * @param node a tree node
     * @return the label, or an empty string if the node has none
     * @throws UnsupportedNodeTypeException if the value is not a tree node
     */
    String label(Object node);

    /**
     * Get the label, properties and children of a node.
     *
     * @param node a tree node
     * @return node details (never null)
     * @throws UnsupportedNodeTypeException if the value is not a tree node
     */
    NodeDetails get(Object node);
}
