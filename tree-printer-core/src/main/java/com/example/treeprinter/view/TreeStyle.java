/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.view;

/**
 * The line-art glyphs used to paint a tree.
 * Immutable.
 */
public final class TreeStyle {

    /**
     * Plain ASCII, safe for any terminal.
     */
    public static final TreeStyle ASCII = new TreeStyle("+", "-", "|", "`", "*");

    /**
     * Unicode box-drawing characters.
     */
    public static final TreeStyle LINES = new TreeStyle("├", "─", "│", "└", "•");

    private final String fork;
    private final String nodeConnector;
    private final String noFork;
    private final String lastNode;
    private final String property;

    /**
     * @param fork forks off a node from the vertical branch, e.g. "├"
     * @param nodeConnector horizontal line leading to a node, e.g. "─"
     * @param noFork vertical branch continuing past a line, e.g. "│"
     * @param lastNode vertical branch ending in a node, e.g. "└"
     * @param property marks a property line, e.g. "•"
     */
    public TreeStyle(String fork, String nodeConnector, String noFork, String lastNode, String property) {
        this.fork = requireGlyph(fork, "fork");
        this.nodeConnector = requireGlyph(nodeConnector, "nodeConnector");
        this.noFork = requireGlyph(noFork, "noFork");
        this.lastNode = requireGlyph(lastNode, "lastNode");
        this.property = requireGlyph(property, "property");
    }

    private static String requireGlyph(String glyph, String name) {
        if (glyph == null) {
            throw new IllegalArgumentException(name + " glyph cannot be null");
        }
        return glyph;
    }

    public String getFork() {
        return fork;
    }

    public String getNodeConnector() {
        return nodeConnector;
    }

    public String getNoFork() {
        return noFork;
    }

    public String getLastNode() {
        return lastNode;
    }

    public String getProperty() {
        return property;
    }

    @Override
    public String toString() {
        return "TreeStyle[" + fork + nodeConnector + noFork + lastNode + property + "]";
    }
}
