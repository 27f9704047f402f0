/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo;

import com.example.demo.fs.DirectoryEntry;
import com.example.demo.fs.FileEntry;
import com.example.treeprinter.TreePrinter;

/**
 * Renders a directory tree whose nodes share their label and attributes through
 * an embedded {@link com.example.demo.fs.Metadata} member.
 *
 * Children are mixed: files and directories are different types in the same list.
 */
public class FileSystemExample {

    public static void main(String[] args) {
        System.out.println("=== File System Example ===\n");
        System.out.println(new FileSystemExample().render());
    }

    public DirectoryEntry buildTree() {
        return new DirectoryEntry("project")
            .attribute("git repository")
            .add(new DirectoryEntry("src")
                .add(new FileEntry("Main.java", 1024))
                .add(new FileEntry("Util.java", 512)))
            .add(new FileEntry("pom.xml", 2048))
            .add(new FileEntry("README.md", 300));
    }

    public String render() {
        return TreePrinter.renderDefaultUnicode(buildTree());
    }
}
