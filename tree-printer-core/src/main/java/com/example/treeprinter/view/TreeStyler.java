/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.view;

/**
 * Turns line-art decisions into text: which glyphs go in front of a node or property
 * line, and how far child nodes and properties are indented.
 *
 * <p>With the ASCII style and the default indentation of 3, a node with two children,
 * the last of which has a property, looks like this:
 * <pre>
 * root
 * +- first
 * `- second
 *       * some property
 * </pre>
 *
 * <p>{@link #renderNodeLabel} and {@link #renderProperty} return their text unchanged;
 * subclasses may override them to adorn labels or properties.
 */
public class TreeStyler {

    public static final int DEFAULT_CHILD_INDENT = 3;
    public static final int DEFAULT_PROPERTY_INDENT = 3;

    static final int MIN_CHILD_INDENT = 2;
    static final int MIN_PROPERTY_INDENT = 1;

    /**
     * Pure ASCII styler with default indentation.
     */
    public static final TreeStyler DEFAULT = new TreeStyler(TreeStyle.ASCII);

    /**
     * Unicode box-drawing styler with default indentation.
     */
    public static final TreeStyler LINES = new TreeStyler(TreeStyle.LINES);

    private final TreeStyle style;
    private final int childIndent;
    private final int propertyIndent;

    public TreeStyler(TreeStyle style) {
        this(style, DEFAULT_CHILD_INDENT, DEFAULT_PROPERTY_INDENT);
    }

    /**
     * @param style glyphs to paint with
     * @param childIndent columns a child subtree is indented by, at least 2
     * @param propertyIndent columns a property marker is indented by, at least 1
     */
    public TreeStyler(TreeStyle style, int childIndent, int propertyIndent) {
        if (style == null) {
            throw new IllegalArgumentException("Style cannot be null");
        }
        if (childIndent < MIN_CHILD_INDENT) {
            throw new IllegalArgumentException(
                "childIndent must be at least " + MIN_CHILD_INDENT + ", got " + childIndent);
        }
        if (propertyIndent < MIN_PROPERTY_INDENT) {
            throw new IllegalArgumentException(
                "propertyIndent must be at least " + MIN_PROPERTY_INDENT + ", got " + propertyIndent);
        }
        this.style = style;
        this.childIndent = childIndent;
        this.propertyIndent = propertyIndent;
    }

    public TreeStyle getStyle() {
        return style;
    }

    public int getChildIndent() {
        return childIndent;
    }

    public int getPropertyIndent() {
        return propertyIndent;
    }

    public String renderNodeLabel(String label) {
        return label;
    }

    public String renderProperty(String property) {
        return property;
    }

    /**
     * First line of a child that has further siblings after it.
     */
    public String branchedNode(String line) {
        return style.getFork() + repeat(style.getNodeConnector(), childIndent - 2) + " " + line;
    }

    /**
     * First line of the last child.
     */
    public String lastNode(String line) {
        return style.getLastNode() + repeat(style.getNodeConnector(), childIndent - 2) + " " + line;
    }

    /**
     * Following lines of a child that has further siblings after it.
     */
    public String indentContinuation(String line) {
        return style.getNoFork() + repeat(" ", childIndent - 2) + " " + line;
    }

    /**
     * Following lines of the last child.
     */
    public String indentContinuationLast(String line) {
        return repeat(" ", childIndent) + line;
    }

    /**
     * Property of a node without children.
     */
    public String propertyLeaf(String property) {
        return repeat(" ", propertyIndent) + style.getProperty() + " " + property;
    }

    /**
     * Property of a node whose children follow below, so the vertical branch continues.
     */
    public String propertyWithChildrenFollowing(String property) {
        return style.getNoFork() + repeat(" ", propertyIndent - 1) + style.getProperty() + " " + property;
    }

    /**
     * Repeat a string; zero or negative counts give an empty string.
     */
    static String repeat(String s, int count) {
        return count > 0 ? s.repeat(count) : "";
    }

    @Override
    public String toString() {
        return "TreeStyler{style=" + style + ", childIndent=" + childIndent +
            ", propertyIndent=" + propertyIndent + "}";
    }
}
