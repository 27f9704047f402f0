/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo;

import com.example.treeprinter.TreePrinter;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trees built from maps only, as they would come out of a JSON or YAML parser.
 */
public class MapTreeExample {

    public static void main(String[] args) {
        System.out.println("=== Map Tree Example ===\n");
        System.out.println(new MapTreeExample().render());
    }

    public Map<String, Object> buildTree() {
        Map<String, Object> cache = node("cache", "port 6379");
        Map<String, Object> db = node("db", "port 5432", "replicas 2");
        Map<String, Object> api = node("api", "port 8080");
        api.put("children", Arrays.asList(db, cache));

        Map<String, Object> roots = new HashMap<>();
        roots.put("roots", Arrays.asList(api, node("monitoring")));
        return roots;
    }

    private static Map<String, Object> node(String label, String... properties) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("label", label);
        node.put("properties", properties);
        return node;
    }

    public String render() {
        return TreePrinter.renderDefaultAscii(buildTree());
    }
}
