/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */
package com.example.treeprinter.benchmarks;

import com.example.treeprinter.api.TreeRole;
import com.example.treeprinter.view.TreeRenderer;
import com.example.treeprinter.view.TreeStyler;
import com.example.treeprinter.visitor.AnnotatedNodeVisitor;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Benchmark for whole-tree rendering of annotated objects and maps.
 *
 * Tests:
 * 1. Wide tree, unsorted
 * 2. Wide tree, nodes and properties sorted by label
 * 3. Same tree expressed as maps
 * 4. Deep chain, close to the default depth limit
 *
 * Run: mvn clean install && java -jar target/benchmarks.jar RenderBenchmark
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 3, timeUnit = TimeUnit.SECONDS)
public class RenderBenchmark {

    public static class Node {
        @TreeRole("label")
        String label;
        @TreeRole("properties")
        List<String> properties;
        @TreeRole("children")
        List<Node> children = new ArrayList<>();

        Node(String label, String... properties) {
            this.label = label;
            this.properties = Arrays.asList(properties);
        }
    }

    @Param({"10", "50"})
    int fanOut;

    private Node wide;
    private Map<String, Object> wideMap;
    private Node deep;

    private final TreeRenderer plain = new TreeRenderer(AnnotatedNodeVisitor.DEFAULT, TreeStyler.LINES);
    private final TreeRenderer sorted = new TreeRenderer(new AnnotatedNodeVisitor(true, true), TreeStyler.LINES);

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(42);
        wide = new Node("root", "kind=dir");
        for (int i = 0; i < fanOut; i++) {
            Node child = new Node("child-" + random.nextInt(10000), "size=" + i, "owner=bench");
            for (int j = 0; j < fanOut; j++) {
                child.children.add(new Node("leaf-" + random.nextInt(10000), "z", "a"));
            }
            wide.children.add(child);
        }
        wideMap = toMap(wide);

        deep = new Node("level-0");
        Node cursor = deep;
        for (int i = 1; i < TreeRenderer.DEFAULT_MAX_DEPTH; i++) {
            Node next = new Node("level-" + i);
            cursor.children.add(next);
            cursor = next;
        }

        System.out.println("Rendered wide tree lines: " + plain.renderLines(wide).size());
    }

    private static Map<String, Object> toMap(Node node) {
        Map<String, Object> map = new HashMap<>();
        map.put("label", node.label);
        map.put("properties", node.properties);
        List<Object> children = new ArrayList<>();
        for (Node child : node.children) {
            children.add(toMap(child));
        }
        map.put("children", children);
        return map;
    }

    @Benchmark
    public void wideUnsorted(Blackhole bh) {
        bh.consume(plain.render(wide));
    }

    @Benchmark
    public void wideSorted(Blackhole bh) {
        bh.consume(sorted.render(wide));
    }

    @Benchmark
    public void wideMaps(Blackhole bh) {
        bh.consume(plain.render(wideMap));
    }

    @Benchmark
    public void deepChain(Blackhole bh) {
        bh.consume(plain.render(deep));
    }
}
