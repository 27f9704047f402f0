/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.view;

import com.example.treeprinter.api.NodeDetails;
import com.example.treeprinter.api.NodeVisitor;
import com.example.treeprinter.api.TreeDepthExceededException;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders one or more trees into text lines.
 *
 * <p>Each subtree is rendered into its own list of lines first; the parent then prefixes
 * those lines with branch glyphs, because only the parent knows whether a child is the
 * last one (vertical branch ends) or not (vertical branch continues).
 *
 * <p>Any fault raised by the visitor aborts the whole render call; no partial output is
 * ever returned.
 */
public class TreeRenderer {

    /**
     * Maximum node depth below a root; deeper trees are almost always cyclic data.
     */
    public static final int DEFAULT_MAX_DEPTH = 512;

    private final NodeVisitor visitor;
    private final TreeStyler styler;
    private final int maxDepth;

    public TreeRenderer(NodeVisitor visitor, TreeStyler styler) {
        this(visitor, styler, DEFAULT_MAX_DEPTH);
    }

    public TreeRenderer(NodeVisitor visitor, TreeStyler styler, int maxDepth) {
        if (visitor == null) {
            throw new IllegalArgumentException("Visitor cannot be null");
        }
        if (styler == null) {
            throw new IllegalArgumentException("Styler cannot be null");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth cannot be negative, got " + maxDepth);
        }
        this.visitor = visitor;
        this.styler = styler;
        this.maxDepth = maxDepth;
    }

    public NodeVisitor getVisitor() {
        return visitor;
    }

    public TreeStyler getStyler() {
        return styler;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Render trees into a multi-line string, every line (the last included) terminated
     * by a newline.
     *
     * @param roots a single root, a sequence of roots, or a roots-bearing container
     * @return the rendered trees, empty if there are no roots
     */
    public String render(Object roots) {
        StringBuilder sb = new StringBuilder();
        for (String line : renderLines(roots)) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * Render trees into lines, without line terminators.
     */
    public List<String> renderLines(Object roots) {
        List<String> lines = new ArrayList<>();
        for (Object root : visitor.roots(roots)) {
            lines.addAll(renderSubtree(root, 0));
        }
        return lines;
    }

    private List<String> renderSubtree(Object node, int depth) {
        NodeDetails details = visitor.get(node);
        if (depth > maxDepth) {
            throw new TreeDepthExceededException(maxDepth, details.getLabel());
        }

        List<String> lines = new ArrayList<>();
        lines.add(styler.renderNodeLabel(details.getLabel()));

        boolean childrenFollow = !details.isLeaf();
        for (String property : details.getProperties()) {
            String text = styler.renderProperty(property);
            lines.add(childrenFollow
                ? styler.propertyWithChildrenFollowing(text)
                : styler.propertyLeaf(text));
        }

        List<Object> children = details.getChildren();
        int last = children.size() - 1;
        for (int i = 0; i <= last; i++) {
            List<String> childLines = renderSubtree(children.get(i), depth + 1);
            boolean isLast = (i == last);
            lines.add(isLast
                ? styler.lastNode(childLines.get(0))
                : styler.branchedNode(childLines.get(0)));
            for (int j = 1; j < childLines.size(); j++) {
                lines.add(isLast
                    ? styler.indentContinuationLast(childLines.get(j))
                    : styler.indentContinuation(childLines.get(j)));
            }
        }
        return lines;
    }
}
