/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.visitor;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Treats iterables and arrays alike as ordered sequences.
 */
final class Sequences {

    private Sequences() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static boolean isSequence(Object value) {
        return value instanceof Iterable || (value != null && value.getClass().isArray());
    }

    /**
     * Copy a sequence's elements into a fresh list.
     *
     * @return the elements in order, or an empty list if the value is not a sequence
     */
    static List<Object> toList(Object value) {
        if (value instanceof Collection) {
            return new ArrayList<Object>((Collection<?>) value);
        }
        if (value instanceof Iterable) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Iterable<?>) value) {
                list.add(element);
            }
            return list;
        }
        if (value instanceof Object[]) {
            return new ArrayList<Object>(Arrays.asList((Object[]) value));
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        return Collections.emptyList();
    }

    /**
     * Convert a sequence's elements to text, null elements becoming empty strings.
     *
     * @return the texts in order, or an empty list if the value is not a sequence
     */
    static List<String> toTexts(Object value) {
        List<Object> elements = toList(value);
        List<String> texts = new ArrayList<>(elements.size());
        for (Object element : elements) {
            texts.add(text(element));
        }
        return texts;
    }

    static String text(Object value) {
        return value == null ? "" : value.toString();
    }
}
