/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo;

import com.example.treeprinter.TreePrinter;
import com.example.treeprinter.api.TreeRole;

import java.util.Arrays;
import java.util.List;

/**
 * Multiple root nodes passed as a plain list, rendered with Unicode line art.
 */
public class MultiRootExample {

    static class Node {
        @TreeRole("label")
        final String label;
        @TreeRole("properties")
        final List<String> props;
        @TreeRole("children")
        final Node[] children;

        Node(String label, List<String> props, Node... children) {
            this.label = label;
            this.props = props;
            this.children = children;
        }

        Node(String label, Node... children) {
            this(label, null, children);
        }
    }

    public static void main(String[] args) {
        System.out.println("=== Multiple Roots Example ===\n");
        System.out.println(new MultiRootExample().render());
    }

    public String render() {
        List<Node> roots = Arrays.asList(
            new Node("root 1",
                new Node("child 1", Arrays.asList("childish")),
                new Node("child 2",
                    new Node("grandchild 1", Arrays.asList("very childish")),
                    new Node("grandchild 2")),
                new Node("child 3")),
            new Node("root 2",
                new Node("child 2-1")));
        return TreePrinter.renderDefaultUnicode(roots);
    }
}
