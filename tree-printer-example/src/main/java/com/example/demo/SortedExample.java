/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo;

import com.example.treeprinter.TreePrinter;
import com.example.treeprinter.api.TreeRole;
import com.example.treeprinter.view.TreeStyler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Roots held by a container object. Nodes and properties are sorted by label.
 */
public class SortedExample {

    static class Node {
        @TreeRole("label")
        String label;
        @TreeRole("properties")
        List<String> props = new ArrayList<>();
        @TreeRole("children")
        List<Node> children = new ArrayList<>();

        Node(String label, Node... children) {
            this.label = label;
            this.children.addAll(Arrays.asList(children));
        }

        Node props(String... props) {
            this.props.addAll(Arrays.asList(props));
            return this;
        }
    }

    static class Forest {
        @TreeRole("roots")
        List<Node> trees = new ArrayList<>();
    }

    public static void main(String[] args) {
        System.out.println("=== Sorted Example ===\n");
        System.out.println(new SortedExample().render());
    }

    public String render() {
        Forest forest = new Forest();
        forest.trees.add(new Node("beta root",
            new Node("foo").props("childish"),
            new Node("alpha",
                new Node("grandchild 2"),
                new Node("grandchild 1").props("very childish")),
            new Node("bar")));
        forest.trees.add(new Node("alpha root", new Node("alphachild")));
        return TreePrinter.render(forest, TreePrinter.sortingVisitor(true, true), TreeStyler.LINES);
    }
}
