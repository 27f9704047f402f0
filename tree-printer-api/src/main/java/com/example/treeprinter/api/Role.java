/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.api;

/**
 * The four roles a member or map key can play in a tree.
 */
public enum Role {
    LABEL("label"),
    PROPERTIES("properties"),
    CHILDREN("children"),
    ROOTS("roots");

    private final String key;

    Role(String key) {
        this.key = key;
    }

    /**
     * Get the tag value and map key for this role.
     * @return the verbatim role name, e.g. "label"
     */
    public String key() {
        return key;
    }

    /**
     * Look up a role by its verbatim name.
     *
     * @param key role name, case-sensitive
     * @return the role, or null if the name is not a role
     */
    public static Role fromKey(String key) {
        for (Role role : values()) {
            if (role.key.equals(key)) {
                return role;
            }
        }
        return null;
    }
}
