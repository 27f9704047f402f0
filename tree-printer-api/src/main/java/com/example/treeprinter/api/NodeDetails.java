/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Label, properties and children of a single tree node, as retrieved by a
 * {@link NodeVisitor}.
 * Immutable and thread-safe.
 */
public final class NodeDetails {

    private final String label;
    private final List<String> properties;
    private final List<Object> children;

    public NodeDetails(String label, List<String> properties, List<Object> children) {
        this.label = label != null ? label : "";
        this.properties = properties != null && !properties.isEmpty()
            ? Collections.unmodifiableList(new ArrayList<String>(properties))
            : Collections.<String>emptyList();
        this.children = children != null && !children.isEmpty()
            ? Collections.unmodifiableList(new ArrayList<Object>(children))
            : Collections.<Object>emptyList();
    }

    /**
     * @return the node label, empty if the node has none
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return the node properties in render order (never null)
     */
    public List<String> getProperties() {
        return properties;
    }

    /**
     * @return the child nodes in render order (never null)
     */
    public List<Object> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public String toString() {
        return "NodeDetails{label='" + label + "', properties=" + properties.size() +
            ", children=" + children.size() + "}";
    }
}
