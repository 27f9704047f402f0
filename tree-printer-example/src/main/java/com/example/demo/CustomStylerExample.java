/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo;

import com.example.treeprinter.TreePrinter;
import com.example.treeprinter.api.TreeRole;
import com.example.treeprinter.view.TreeStyle;
import com.example.treeprinter.view.TreeStyler;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Custom glyphs, wider indentation and decorated labels through the styler hooks.
 */
public class CustomStylerExample {

    static class Task {
        @TreeRole("label")
        String title;
        @TreeRole("properties")
        List<String> notes;
        @TreeRole("children")
        List<Task> subtasks;

        Task(String title, List<String> notes, Task... subtasks) {
            this.title = title;
            this.notes = notes;
            this.subtasks = Arrays.asList(subtasks);
        }
    }

    static class ChecklistStyler extends TreeStyler {
        ChecklistStyler() {
            super(new TreeStyle("|", "=", ":", "\\", "#"), 4, 3);
        }

        @Override
        public String renderNodeLabel(String label) {
            return "[ ] " + label;
        }

        @Override
        public String renderProperty(String property) {
            return property.toUpperCase(Locale.ROOT);
        }
    }

    public static void main(String[] args) {
        System.out.println("=== Custom Styler Example ===\n");
        System.out.println(new CustomStylerExample().render());
    }

    public String render() {
        Task release = new Task("release", Arrays.asList("due friday"),
            new Task("tag", null),
            new Task("publish", Arrays.asList("needs credentials"),
                new Task("upload", null)));
        return TreePrinter.render(release, TreePrinter.sortingVisitor(false, false), new ChecklistStyler());
    }
}
