/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.visitor;

import com.example.treeprinter.api.NodeDetails;
import com.example.treeprinter.api.NodeVisitor;
import com.example.treeprinter.api.Role;
import com.example.treeprinter.api.UnsupportedRootsTypeException;
import com.example.treeprinter.shape.TreeShapeCache;

import java.util.Collections;
import java.util.List;

/**
 * Visits objects annotated with {@link com.example.treeprinter.api.TreeRole} as well as
 * maps using the well-known keys {@code "label"}, {@code "properties"},
 * {@code "children"} and {@code "roots"}.
 *
 * <p>Sibling nodes (including roots) and node properties can optionally be sorted by
 * label, using a stable code point comparison.
 *
 * <p><b>Thread Safety:</b> Immutable; shapes are shared through a {@link TreeShapeCache}.
 */
public class AnnotatedNodeVisitor implements NodeVisitor {

    /**
     * Visitor that keeps nodes and properties in their original order.
     */
    public static final AnnotatedNodeVisitor DEFAULT = new AnnotatedNodeVisitor(false, false);

    private final boolean sortNodes;
    private final boolean sortProperties;
    private final TreeShapeCache cache;

    public AnnotatedNodeVisitor(boolean sortNodes, boolean sortProperties) {
        this(sortNodes, sortProperties, TreeShapeCache.shared());
    }

    public AnnotatedNodeVisitor(boolean sortNodes, boolean sortProperties, TreeShapeCache cache) {
        if (cache == null) {
            throw new IllegalArgumentException("Shape cache cannot be null");
        }
        this.sortNodes = sortNodes;
        this.sortProperties = sortProperties;
        this.cache = cache;
    }

    public boolean isSortNodes() {
        return sortNodes;
    }

    public boolean isSortProperties() {
        return sortProperties;
    }

    /**
     * Resolve roots given as a sequence of nodes, a single map or object, or a map or
     * object holding a {@code roots} member.
     */
    @Override
    public List<Object> roots(Object roots) {
        NodeAccess access = NodeAccess.of(roots, cache);
        if (access == null) {
            if (Sequences.isSequence(roots)) {
                return nodes(Sequences.toList(roots));
            }
            throw new UnsupportedRootsTypeException(roots);
        }
        if (!access.has(Role.ROOTS)) {
            return Collections.singletonList(roots);
        }
        Object member = access.get(Role.ROOTS);
        if (member == null) {
            return Collections.emptyList();
        }
        if (Sequences.isSequence(member) && NodeAccess.of(member, cache) == null) {
            return nodes(Sequences.toList(member));
        }
        return Collections.singletonList(member);
    }

    @Override
    public String label(Object node) {
        return NodeAccess.node(node, cache).label();
    }

    /**
     * Get a node's label, properties and children, sorted as configured. The returned
     * lists never alias the node's own collections.
     */
    @Override
    public NodeDetails get(Object node) {
        NodeAccess access = NodeAccess.node(node, cache);
        String label = access.label();
        List<String> properties = Sequences.toTexts(access.get(Role.PROPERTIES));
        if (sortProperties) {
            properties.sort(LabelOrder.CODE_POINT_ORDER);
        }
        List<Object> children = nodes(Sequences.toList(access.get(Role.CHILDREN)));
        return new NodeDetails(label, properties, children);
    }

    private List<Object> nodes(List<Object> nodes) {
        if (!sortNodes || nodes.size() < 2) {
            return nodes;
        }
        return LabelOrder.sortedBy(nodes, this::label);
    }
}
