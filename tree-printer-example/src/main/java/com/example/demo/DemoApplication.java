/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo;

import com.example.treeprinter.TreePrinter;
import com.example.treeprinter.TreePrinterConfig;
import com.example.treeprinter.api.TreeRenderException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Demo application showing the tree printer in action.
 *
 * This demonstrates how an external project would use the library: annotated
 * classes, embedded members, maps, sorting, custom stylers, and configuration.
 *
 * Run with:
 *   mvn exec:java
 *
 * Or with a configured renderer:
 *   mvn exec:java -Dtree.printer="style=lines;childIndent=4;sortNodes=true"
 */
public class DemoApplication {

    public static void main(String[] args) {
        System.out.println("=== Tree Printer Demo ===\n");

        System.out.println("--- Multiple roots ---");
        System.out.println(new MultiRootExample().render());

        System.out.println("--- Sorted ---");
        System.out.println(new SortedExample().render());

        System.out.println("--- Embedded metadata ---");
        System.out.println(new FileSystemExample().render());

        System.out.println("--- Maps ---");
        System.out.println(new MapTreeExample().render());

        System.out.println("--- Custom styler ---");
        System.out.println(new CustomStylerExample().render());

        System.out.println("--- Configured from -D" + TreePrinterConfig.SYSTEM_PROPERTY + " ---");
        System.out.println(TreePrinterConfig.fromSystemProperties());
        System.out.println(TreePrinter.fromSystemProperties().render(new FileSystemExample().buildTree()));

        System.out.println("--- Cyclic data ---");
        printCycleFault();
    }

    /**
     * A map that contains itself as a child is stopped by the depth limit.
     */
    static void printCycleFault() {
        Map<String, Object> loop = new HashMap<>();
        List<Object> children = new ArrayList<>();
        loop.put("label", "loop");
        loop.put("children", children);
        children.add(loop);
        try {
            TreePrinter.renderDefaultAscii(loop);
        } catch (TreeRenderException e) {
            System.out.println("Rendering failed: " + e.getMessage());
        }
    }
}
