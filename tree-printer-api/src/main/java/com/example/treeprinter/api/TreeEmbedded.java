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
 * Promotes the tree roles of the field's declared type into the enclosing type.
 *
 * <p>An embedded field behaves as if its tagged members were declared directly on the
 * enclosing type. Roles the enclosing type already declares at a shallower level take
 * precedence; two definitions of the same role at the same level are an error.
 *
 * <p>Fields without this annotation are never inspected for nested roles, even when
 * their type carries {@link TreeRole} members of its own.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface TreeEmbedded {
}
