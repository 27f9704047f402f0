/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.view;

import com.example.treeprinter.api.NodeDetails;
import com.example.treeprinter.api.NodeVisitor;
import com.example.treeprinter.api.TreeDepthExceededException;
import com.example.treeprinter.api.TreeRole;
import com.example.treeprinter.api.UnsupportedNodeTypeException;
import com.example.treeprinter.api.UnsupportedRootsTypeException;
import com.example.treeprinter.visitor.AnnotatedNodeVisitor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for TreeRenderer covering line art for intermediate and last children, property
 * connectors, multiple roots and fault propagation.
 */
public class TreeRendererTest {

    static class Node {
        @TreeRole("label")
        String name;
        @TreeRole("properties")
        List<String> properties;
        @TreeRole("children")
        Node[] subnodes;

        Node(String name, List<String> properties, Node... subnodes) {
            this.name = name;
            this.properties = properties;
            this.subnodes = subnodes;
        }

        Node(String name, Node... subnodes) {
            this(name, null, subnodes);
        }
    }

    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private final Node rootnode1 = new Node("root1", Arrays.asList("foo", "bar"),
        new Node("1"),
        new Node("2",
            new Node("2.1", Arrays.asList("whoooosh")),
            new Node("2.2")),
        new Node("3",
            new Node("3.1")));

    private final Node rootnode2 = new Node("root2", new Node("X"));

    private final Map<String, Object> rootmap = map("roots", Arrays.asList(
        map("label", "root1", "properties", Arrays.asList("foo", "bar"), "children", Arrays.asList(
            map("label", "1"),
            map("label", "2", "children", Arrays.asList(
                map("label", "2.2"),
                map("label", "2.1", "properties", Arrays.asList("whoooosh")))),
            map("label", "3", "children", Arrays.asList(
                map("label", "3.1"))))),
        map("label", "alpharot", "properties", Arrays.asList("z", "a"))));

    private final Map<String, Object> rootmap2 = map("label", "root", "properties", Arrays.asList("pr"),
        "children", Arrays.asList(
            map("label", "1", "properties", Arrays.asList("p1", "p2"))));

    private final TreeStyler ts = new TreeStyler(TreeStyle.LINES, 4, 3);

    private final TreeRenderer renderer = new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, ts);
    private final TreeRenderer sortingRenderer = new TreeRenderer(new AnnotatedNodeVisitor(true, true), ts);

    private static final String ROOT1_SORTED =
        "root1\n" +
        "│  • bar\n" +
        "│  • foo\n" +
        "├── 1\n" +
        "├── 2\n" +
        "│   ├── 2.1\n" +
        "│   │      • whoooosh\n" +
        "│   └── 2.2\n" +
        "└── 3\n" +
        "    └── 3.1\n";

    @Test
    public void testRendersSequenceOfRoots() {
        String text = renderer.render(Arrays.asList(rootnode1, rootnode2));
        assertThat(text).isEqualTo(
            "root1\n" +
            "│  • foo\n" +
            "│  • bar\n" +
            "├── 1\n" +
            "├── 2\n" +
            "│   ├── 2.1\n" +
            "│   │      • whoooosh\n" +
            "│   └── 2.2\n" +
            "└── 3\n" +
            "    └── 3.1\n" +
            "root2\n" +
            "└── X\n");
    }

    @Test
    public void testRendersSortedSequenceOfRoots() {
        String text = sortingRenderer.render(Arrays.asList(rootnode2, rootnode1));
        assertThat(text).isEqualTo(ROOT1_SORTED + "root2\n└── X\n");
    }

    @Test
    public void testRendersSingleRoot() {
        assertThat(renderer.render(rootnode2)).isEqualTo("root2\n└── X\n");
        assertThat(renderer.render(new Node[] {rootnode2})).isEqualTo("root2\n└── X\n");
    }

    @Test
    public void testRendersRootsMapSorted() {
        assertThat(sortingRenderer.render(rootmap)).isEqualTo(
            "alpharot\n" +
            "   • a\n" +
            "   • z\n" +
            ROOT1_SORTED);
    }

    @Test
    public void testRendersMap() {
        assertThat(renderer.render(rootmap2)).isEqualTo(
            "root\n" +
            "│  • pr\n" +
            "└── 1\n" +
            "       • p1\n" +
            "       • p2\n");
    }

    @Test
    public void testRendersMapPlainly() {
        TreeRenderer plain = new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, TreeStyler.DEFAULT);
        assertThat(plain.render(rootmap2)).isEqualTo(
            "root\n" +
            "|  * pr\n" +
            "`- 1\n" +
            "      * p1\n" +
            "      * p2\n");
    }

    @Test
    public void testPropertyConnectorDependsOnChildren() {
        TreeRenderer plain = new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, TreeStyler.DEFAULT);
        List<String> withChildren = plain.renderLines(new Node("n", Arrays.asList("p"), new Node("c")));
        List<String> withoutChildren = plain.renderLines(new Node("n", Arrays.asList("p")));
        assertThat(withChildren.get(1)).isEqualTo("|  * p");
        assertThat(withoutChildren.get(1)).isEqualTo("   * p");
    }

    @Test
    public void testRenderLinesHaveNoTerminators() {
        List<String> lines = renderer.renderLines(rootnode2);
        assertThat(lines).containsExactly("root2", "└── X");
    }

    @Test
    public void testNoRootsRendersEmpty() {
        assertThat(renderer.render(Collections.emptyList())).isEmpty();
    }

    @Test
    public void testUnsupportedRootsAbort() {
        assertThatThrownBy(() -> renderer.render(42))
            .isInstanceOf(UnsupportedRootsTypeException.class)
            .hasMessageContaining("java.lang.Integer");
        assertThatThrownBy(() -> renderer.render(new int[] {42}))
            .isInstanceOf(UnsupportedNodeTypeException.class);
    }

    @Test
    public void testUnsupportedChildAbortsWholeRender() {
        Map<String, Object> bad = map("label", "root", "children", Arrays.asList(map("label", "ok"), "oops"));
        assertThatThrownBy(() -> renderer.render(bad))
            .isInstanceOf(UnsupportedNodeTypeException.class)
            .hasMessageContaining("java.lang.String");
    }

    @Test
    public void testCyclicDataHitsDepthLimit() {
        Map<String, Object> loop = new HashMap<>();
        List<Object> children = new ArrayList<>();
        loop.put("label", "loop");
        loop.put("children", children);
        children.add(loop);

        TreeRenderer limited = new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, ts, 10);
        assertThatThrownBy(() -> limited.render(loop))
            .isInstanceOf(TreeDepthExceededException.class)
            .hasMessageContaining("10");
    }

    @Test
    public void testDepthLimitIsInclusive() {
        Node chain = new Node("0", new Node("1", new Node("2")));
        assertThat(new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, ts, 2).renderLines(chain)).hasSize(3);
        assertThatThrownBy(() -> new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, ts, 1).render(chain))
            .isInstanceOf(TreeDepthExceededException.class);
    }

    @Test
    public void testUsesOnlyVisitorToReachNodes() {
        NodeVisitor visitor = mock(NodeVisitor.class);
        when(visitor.roots("r")).thenReturn(Arrays.<Object>asList("r"));
        when(visitor.get("r")).thenReturn(
            new NodeDetails("root", Arrays.asList("p"), Arrays.<Object>asList("c")));
        when(visitor.get("c")).thenReturn(new NodeDetails("child", null, null));

        String text = new TreeRenderer(visitor, TreeStyler.DEFAULT).render("r");

        assertThat(text).isEqualTo("root\n|  * p\n`- child\n");
        verify(visitor).roots("r");
        verify(visitor).get("c");
        verify(visitor, never()).label(any());
    }

    @Test
    public void testStylerHooksAdornLabelsAndProperties() {
        TreeStyler adorned = new TreeStyler(TreeStyle.ASCII) {
            @Override
            public String renderNodeLabel(String label) {
                return "[" + label + "]";
            }

            @Override
            public String renderProperty(String property) {
                return property.toUpperCase();
            }
        };
        String text = new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, adorned).render(rootmap2);
        assertThat(text).isEqualTo(
            "[root]\n" +
            "|  * PR\n" +
            "`- [1]\n" +
            "      * P1\n" +
            "      * P2\n");
    }

    @Test
    public void testRejectsMissingCollaborators() {
        assertThatThrownBy(() -> new TreeRenderer(null, ts)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, ts, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
