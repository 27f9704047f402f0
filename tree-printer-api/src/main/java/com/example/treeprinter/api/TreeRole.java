/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field as carrying one (or more) tree roles.
 *
 * <p>Recognized values are {@code "label"}, {@code "properties"}, {@code "children"}
 * and {@code "roots"}. Several roles may be combined with commas, for example
 * {@code @TreeRole("children,roots")}. Blank parts are ignored; any other value makes
 * the declaring type unusable as a tree node and is reported when the type is first
 * rendered.
 *
 * <p><b>Example:</b>
 * <pre>
 * class Node {
 *     &#64;TreeRole("label")
 *     String name;
 *
 *     &#64;TreeRole("properties")
 *     List&lt;String&gt; notes;
 *
 *     &#64;TreeRole("children")
 *     List&lt;Node&gt; children;
 * }
 * </pre>
 *
 * @see TreeEmbedded
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface TreeRole {

    /**
     * Comma-separated role names.
     */
    String value();
}
