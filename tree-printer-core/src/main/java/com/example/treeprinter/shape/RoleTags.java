/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.shape;

import com.example.treeprinter.api.Role;
import com.example.treeprinter.api.TreeShapeException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Parses {@code @TreeRole} values such as {@code "label"} or {@code "children, roots"}.
 */
final class RoleTags {

    private RoleTags() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Split a tag value into its roles.
     *
     * @param type the declaring type (for error messages)
     * @param fieldName the tagged field (for error messages)
     * @param tagValue raw annotation value
     * @return the roles named by the tag, empty for a blank tag
     * @throws TreeShapeException naming only the invalid parts, or naming a role that the
     *         tag lists twice
     */
    static Set<Role> parse(Class<?> type, String fieldName, String tagValue) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        List<String> invalid = new ArrayList<>();
        for (String part : tagValue.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Role role = Role.fromKey(trimmed);
            if (role == null) {
                invalid.add(trimmed);
            } else if (!roles.add(role)) {
                throw new TreeShapeException(type, "double @TreeRole(\"" + role.key() + "\") on " +
                    type.getName() + "." + fieldName);
            }
        }
        if (!invalid.isEmpty()) {
            throw new TreeShapeException(type,
                "invalid @TreeRole value(s) " + invalid + " on " + type.getName() + "." + fieldName);
        }
        return roles;
    }
}
