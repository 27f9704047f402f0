/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.shape;

import com.example.treeprinter.api.Role;
import com.example.treeprinter.api.TreeEmbedded;
import com.example.treeprinter.api.TreeRole;
import com.example.treeprinter.api.TreeShapeException;
import net.bytebuddy.description.annotation.AnnotationDescription;
import net.bytebuddy.description.annotation.AnnotationList;
import net.bytebuddy.description.field.FieldDescription;
import net.bytebuddy.description.field.FieldList;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.matcher.ElementMatcher;
import net.bytebuddy.matcher.ElementMatchers;

import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.util.Map;
import java.util.Set;

import static net.bytebuddy.matcher.ElementMatchers.isStatic;
import static net.bytebuddy.matcher.ElementMatchers.isSynthetic;
import static net.bytebuddy.matcher.ElementMatchers.not;

/**
 * Learns the {@link TreeShape} of a type from its {@link TreeRole} and
 * {@link TreeEmbedded} members.
 *
 * <p>Members are visited in declaration order. Roles found on a superclass or through an
 * embedded member come in one level deeper than the type's own members; a shallower
 * definition always wins, and two definitions at the same level are an error unless a
 * shallower one shadows both.
 */
final class ShapeScanner {

    private static final ElementMatcher.Junction<FieldDescription> INSTANCE_FIELDS =
        ElementMatchers.<FieldDescription>not(isStatic()).and(not(isSynthetic()));

    private ShapeScanner() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Scan a type. Superclass and embedded shapes are looked up through the cache, so
     * they get cached as a side effect.
     *
     * @param inProgress types whose scan is on the current call stack
     */
    static TreeShape scan(Class<?> type, TreeShapeCache cache, Set<Class<?>> inProgress) {
        if (!inProgress.add(type)) {
            throw new TreeShapeException(type, "@TreeEmbedded cycle through type " + type.getName());
        }
        try {
            FieldPath[] found = new FieldPath[Role.values().length];
            FieldPath[] ambiguous = new FieldPath[Role.values().length];

            Class<?> superclass = type.getSuperclass();
            if (superclass != null && superclass != Object.class) {
                TreeShape inherited = cache.lookup(superclass, inProgress);
                for (Role role : Role.values()) {
                    FieldPath path = inherited.getPath(role);
                    if (path != null) {
                        offer(found, ambiguous, role, path.inherited());
                    }
                }
            }

            FieldList<FieldDescription.InDefinedShape> fields =
                TypeDescription.ForLoadedType.of(type).getDeclaredFields().filter(INSTANCE_FIELDS);
            int index = 0;
            for (FieldDescription.InDefinedShape field : fields) {
                AnnotationList annotations = field.getDeclaredAnnotations();

                if (annotations.isAnnotationPresent(TreeEmbedded.class)) {
                    Field member = accessible(type, field);
                    TreeShape embedded = cache.lookup(embeddedType(type, field, member), inProgress);
                    for (Role role : Role.values()) {
                        FieldPath path = embedded.getPath(role);
                        if (path != null) {
                            offer(found, ambiguous, role, path.under(member, index));
                        }
                    }
                }

                AnnotationDescription.Loadable<TreeRole> tag = annotations.ofType(TreeRole.class);
                if (tag != null) {
                    Set<Role> roles = RoleTags.parse(type, field.getName(), tag.load().value());
                    if (!roles.isEmpty()) {
                        FieldPath path = new FieldPath(accessible(type, field), index);
                        for (Role role : roles) {
                            offer(found, ambiguous, role, path);
                        }
                    }
                }
                index++;
            }

            for (Role role : Role.values()) {
                if (ambiguous[role.ordinal()] != null) {
                    throw new TreeShapeException(type, "double @TreeRole(\"" + role.key() + "\") for type " +
                        type.getName() + ": " + found[role.ordinal()] + " and " + ambiguous[role.ordinal()]);
                }
            }
            return new TreeShape(type, found);
        } finally {
            inProgress.remove(type);
        }
    }

    private static void offer(FieldPath[] found, FieldPath[] ambiguous, Role role, FieldPath candidate) {
        int slot = role.ordinal();
        FieldPath existing = found[slot];
        if (existing == null || candidate.depth() < existing.depth()) {
            found[slot] = candidate;
            ambiguous[slot] = null;
        } else if (candidate.depth() == existing.depth() && ambiguous[slot] == null) {
            ambiguous[slot] = candidate;
        }
    }

    private static Class<?> embeddedType(Class<?> type, FieldDescription field, Field member) {
        TypeDescription fieldType = field.getType().asErasure();
        if (fieldType.isPrimitive() || fieldType.isArray()
                || fieldType.isAssignableTo(Map.class) || fieldType.isAssignableTo(Iterable.class)) {
            throw new TreeShapeException(type, "@TreeEmbedded member " + type.getName() + "." +
                field.getName() + " must have a plain object type, not " + fieldType.getName());
        }
        return member.getType();
    }

    private static Field accessible(Class<?> type, FieldDescription field) {
        try {
            Field member = type.getDeclaredField(field.getName());
            member.setAccessible(true);
            return member;
        } catch (NoSuchFieldException | SecurityException | InaccessibleObjectException e) {
            throw new TreeShapeException(type,
                "cannot access tree member " + type.getName() + "." + field.getName(), e);
        }
    }
}
