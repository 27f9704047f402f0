/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.visitor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Lexicographic ordering of labels by Unicode code point.
 *
 * <p>{@link String#compareTo} compares UTF-16 code units, which sorts supplementary
 * characters before U+E000..U+FFFF.
 */
final class LabelOrder {

    static final Comparator<String> CODE_POINT_ORDER = LabelOrder::compare;

    private LabelOrder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    /**
     * Stable sort of items by a label computed once per item.
     *
     * @return a new sorted list; ties keep their original relative order
     */
    static <T> List<T> sortedBy(List<T> items, Function<? super T, String> labeler) {
        List<Labelled<T>> labelled = new ArrayList<>(items.size());
        for (T item : items) {
            labelled.add(new Labelled<T>(labeler.apply(item), item));
        }
        // List.sort is a stable merge sort
        labelled.sort((x, y) -> compare(x.label, y.label));
        List<T> sorted = new ArrayList<>(items.size());
        for (Labelled<T> entry : labelled) {
            sorted.add(entry.item);
        }
        return sorted;
    }

    private static final class Labelled<T> {
        final String label;
        final T item;

        Labelled(String label, T item) {
            this.label = label;
            this.item = item;
        }
    }
}
