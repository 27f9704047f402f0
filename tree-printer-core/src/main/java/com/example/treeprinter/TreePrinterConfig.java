/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter;

import com.example.treeprinter.view.TreeRenderer;
import com.example.treeprinter.view.TreeStyle;
import com.example.treeprinter.view.TreeStyler;
import com.example.treeprinter.visitor.AnnotatedNodeVisitor;

import java.util.Locale;

/**
 * Rendering settings, parsed from a compact {@code key=value} list.
 *
 * <p>Format: {@code style=lines;childIndent=4;propIndent=3;sortNodes=true;sortProperties=true;maxDepth=100}
 *
 * <ul>
 *   <li>{@code style}: {@code ascii} (default) or {@code lines} (alias {@code unicode})</li>
 *   <li>{@code childIndent}: indentation of child subtrees, at least 2 (default 3)</li>
 *   <li>{@code propIndent}: indentation of property markers, at least 1 (default 3)</li>
 *   <li>{@code sortNodes}, {@code sortProperties}: sort by label (default false)</li>
 *   <li>{@code maxDepth}: deepest allowed node level below a root (default 512)</li>
 * </ul>
 *
 * Unknown keys are ignored. The same format is accepted from the system property
 * {@code -Dtree.printer=...}.
 */
public final class TreePrinterConfig {

    /** System property holding a configuration string */
    public static final String SYSTEM_PROPERTY = "tree.printer";

    private static final String PARAM_STYLE = "style";
    private static final String PARAM_CHILD_INDENT = "childIndent";
    private static final String PARAM_PROPERTY_INDENT = "propIndent";
    private static final String PARAM_SORT_NODES = "sortNodes";
    private static final String PARAM_SORT_PROPERTIES = "sortProperties";
    private static final String PARAM_MAX_DEPTH = "maxDepth";

    private static final TreePrinterConfig DEFAULTS = new TreePrinterConfig(TreeStyle.ASCII,
        TreeStyler.DEFAULT_CHILD_INDENT, TreeStyler.DEFAULT_PROPERTY_INDENT,
        false, false, TreeRenderer.DEFAULT_MAX_DEPTH);

    private final TreeStyle style;
    private final int childIndent;
    private final int propertyIndent;
    private final boolean sortNodes;
    private final boolean sortProperties;
    private final int maxDepth;

    private TreePrinterConfig(TreeStyle style, int childIndent, int propertyIndent,
                              boolean sortNodes, boolean sortProperties, int maxDepth) {
        this.style = style;
        this.childIndent = childIndent;
        this.propertyIndent = propertyIndent;
        this.sortNodes = sortNodes;
        this.sortProperties = sortProperties;
        this.maxDepth = maxDepth;
    }

    public static TreePrinterConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Parse a configuration string. Null or empty gives the defaults.
     *
     * @throws IllegalArgumentException naming the offending parameter
     */
    public static TreePrinterConfig parse(String arguments) {
        TreeStyle style = DEFAULTS.style;
        int childIndent = DEFAULTS.childIndent;
        int propertyIndent = DEFAULTS.propertyIndent;
        boolean sortNodes = DEFAULTS.sortNodes;
        boolean sortProperties = DEFAULTS.sortProperties;
        int maxDepth = DEFAULTS.maxDepth;

        if (arguments != null && !arguments.isEmpty()) {
            for (String part : arguments.split(";")) {
                String[] kv = part.split("=", 2);
                if (kv.length != 2) {
                    continue;
                }
                String key = kv[0].trim();
                String value = kv[1].trim();

                if (PARAM_STYLE.equals(key)) {
                    style = parseStyle(value);
                } else if (PARAM_CHILD_INDENT.equals(key)) {
                    childIndent = parseInt(PARAM_CHILD_INDENT, value, 2);
                } else if (PARAM_PROPERTY_INDENT.equals(key)) {
                    propertyIndent = parseInt(PARAM_PROPERTY_INDENT, value, 1);
                } else if (PARAM_SORT_NODES.equals(key)) {
                    sortNodes = Boolean.parseBoolean(value);
                } else if (PARAM_SORT_PROPERTIES.equals(key)) {
                    sortProperties = Boolean.parseBoolean(value);
                } else if (PARAM_MAX_DEPTH.equals(key)) {
                    maxDepth = parseInt(PARAM_MAX_DEPTH, value, 0);
                }
            }
        }
        return new TreePrinterConfig(style, childIndent, propertyIndent, sortNodes, sortProperties, maxDepth);
    }

    /**
     * Read {@code -Dtree.printer}. An invalid value is reported on stderr and the defaults
     * are used instead, so a typo never breaks the caller.
     */
    public static TreePrinterConfig fromSystemProperties() {
        String arguments = System.getProperty(SYSTEM_PROPERTY);
        try {
            return parse(arguments);
        } catch (IllegalArgumentException e) {
            System.err.println("[TreePrinterConfig] Ignoring -D" + SYSTEM_PROPERTY + "=" + arguments +
                ": " + e.getMessage());
            return DEFAULTS;
        }
    }

    private static TreeStyle parseStyle(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "ascii":
                return TreeStyle.ASCII;
            case "lines":
            case "unicode":
                return TreeStyle.LINES;
            default:
                throw new IllegalArgumentException(
                    PARAM_STYLE + ": Unknown style (expected ascii or lines): " + value);
        }
    }

    private static int parseInt(String paramName, String value, int min) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(paramName + ": Not an integer: " + value, e);
        }
        if (parsed < min) {
            throw new IllegalArgumentException(paramName + ": Must be at least " + min + ": " + value);
        }
        return parsed;
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

    public boolean isSortNodes() {
        return sortNodes;
    }

    public boolean isSortProperties() {
        return sortProperties;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public TreeStyler newStyler() {
        return new TreeStyler(style, childIndent, propertyIndent);
    }

    public AnnotatedNodeVisitor newVisitor() {
        if (!sortNodes && !sortProperties) {
            return AnnotatedNodeVisitor.DEFAULT;
        }
        return new AnnotatedNodeVisitor(sortNodes, sortProperties);
    }

    public TreeRenderer newRenderer() {
        return new TreeRenderer(newVisitor(), newStyler(), maxDepth);
    }

    @Override
    public String toString() {
        return String.format("TreePrinterConfig{style=%s, childIndent=%d, propIndent=%d, " +
                "sortNodes=%b, sortProperties=%b, maxDepth=%d}",
            style, childIndent, propertyIndent, sortNodes, sortProperties, maxDepth);
    }
}
