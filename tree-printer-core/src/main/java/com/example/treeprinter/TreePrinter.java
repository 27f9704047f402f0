/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter;

import com.example.treeprinter.api.NodeVisitor;
import com.example.treeprinter.view.TreeRenderer;
import com.example.treeprinter.view.TreeStyle;
import com.example.treeprinter.view.TreeStyler;
import com.example.treeprinter.visitor.AnnotatedNodeVisitor;

/**
 * Entry points for rendering trees.
 *
 * <p>Roots may be given as a single annotated object or map, as a sequence (iterable or
 * array) of them, or as an annotated object or map whose {@code roots} member holds them.
 * Nodes are plain objects with {@link com.example.treeprinter.api.TreeRole} members, or
 * maps with the keys {@code "label"}, {@code "properties"} and {@code "children"}.
 *
 * <p><b>Example:</b>
 * <pre>
 * class Node {
 *     &#64;TreeRole("label") String name;
 *     &#64;TreeRole("children") List&lt;Node&gt; children;
 * }
 *
 * System.out.print(TreePrinter.renderDefaultAscii(root));
 * // root
 * // +- child 1
 * // `- child 2
 * </pre>
 */
public final class TreePrinter {

    private static final TreeRenderer ASCII_RENDERER =
        new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, TreeStyler.DEFAULT);
    private static final TreeRenderer UNICODE_RENDERER =
        new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, TreeStyler.LINES);

    private TreePrinter() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Render using plain ASCII line art and unsorted nodes.
     */
    public static String renderDefaultAscii(Object roots) {
        return ASCII_RENDERER.render(roots);
    }

    /**
     * Render using Unicode box-drawing line art and unsorted nodes.
     */
    public static String renderDefaultUnicode(Object roots) {
        return UNICODE_RENDERER.render(roots);
    }

    /**
     * Render with a caller-supplied visitor and styler.
     */
    public static String render(Object roots, NodeVisitor visitor, TreeStyler styler) {
        return new TreeRenderer(visitor, styler).render(roots);
    }

    /**
     * Create a visitor for annotated objects and maps that optionally sorts sibling nodes
     * and node properties by label.
     */
    public static NodeVisitor sortingVisitor(boolean sortNodes, boolean sortProperties) {
        return new AnnotatedNodeVisitor(sortNodes, sortProperties);
    }

    /**
     * Create a styler with custom indentation.
     *
     * @param childIndent at least 2
     * @param propertyIndent at least 1
     */
    public static TreeStyler styler(TreeStyle style, int childIndent, int propertyIndent) {
        return new TreeStyler(style, childIndent, propertyIndent);
    }

    /**
     * Create a renderer from explicit settings.
     */
    public static TreeRenderer configured(TreePrinterConfig config) {
        return config.newRenderer();
    }

    /**
     * Create a renderer from {@code -Dtree.printer}, falling back to defaults.
     */
    public static TreeRenderer fromSystemProperties() {
        return TreePrinterConfig.fromSystemProperties().newRenderer();
    }
}
