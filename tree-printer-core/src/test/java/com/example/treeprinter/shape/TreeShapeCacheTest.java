/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.treeprinter.shape;

import com.example.treeprinter.api.Role;
import com.example.treeprinter.api.TreeEmbedded;
import com.example.treeprinter.api.TreeRole;
import com.example.treeprinter.api.TreeShapeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for shape learning and caching.
 * Each test uses its own cache so results don't depend on test order.
 */
public class TreeShapeCacheTest {

    private TreeShapeCache cache;

    @BeforeEach
    public void setUp() {
        cache = new TreeShapeCache();
    }

    static class NoRoles {
        int foo;
        String bar;
    }

    static class Labelled {
        @TreeRole("label")
        String foo;
    }

    static class Magic {
        int bar;
        @TreeRole("properties")
        List<String> baz;
        @TreeEmbedded
        Labelled labelled;
        @TreeRole("children")
        List<Magic> coolz;
        @TreeRole("roots")
        List<Labelled> ruhtz;
    }

    @Test
    public void testTypeWithoutRolesIsBare() {
        TreeShape shape = cache.lookup(NoRoles.class);
        assertThat(shape.isBare()).isTrue();
        for (Role role : Role.values()) {
            assertThat(shape.getPath(role)).isNull();
        }
    }

    @Test
    public void testRepeatedLookupReturnsIdenticalShape() {
        TreeShape first = cache.lookup(NoRoles.class);
        TreeShape again = cache.lookup(NoRoles.class);
        assertThat(again).isSameAs(first);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    public void testFindsRoleMembersWithIndexPaths() {
        TreeShape shape = cache.lookup(Magic.class);
        assertThat(shape.getPath(Role.LABEL).getIndices()).containsExactly(2, 0);
        assertThat(shape.getPath(Role.PROPERTIES).getIndices()).containsExactly(1);
        assertThat(shape.getPath(Role.CHILDREN).getIndices()).containsExactly(3);
        assertThat(shape.getPath(Role.ROOTS).getIndices()).containsExactly(4);
        assertThat(shape.getPath(Role.LABEL).depth()).isEqualTo(1);
        assertThat(shape.getPath(Role.LABEL).getTarget().getName()).isEqualTo("foo");
        // embedded type is cached along the way
        assertThat(cache.lookup(Labelled.class).getPath(Role.LABEL).getIndices()).containsExactly(0);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    public void testReadsThroughEmbeddedMembers() {
        Magic magic = new Magic();
        magic.labelled = new Labelled();
        magic.labelled.foo = "deep";
        TreeShape shape = cache.lookup(Magic.class);
        assertThat(shape.read(Role.LABEL, magic)).isEqualTo("deep");

        magic.labelled = null;
        assertThat(shape.read(Role.LABEL, magic)).isNull();
    }

    static class DoubleLabel {
        @TreeRole("label")
        String a;
        @TreeRole("label")
        String b;
    }

    static class DoubleProperties {
        @TreeRole("properties")
        List<String> a;
        @TreeRole("properties")
        List<String> b;
    }

    static class DoubleChildren {
        @TreeRole("children")
        List<Object> a;
        @TreeRole("children")
        List<Object> b;
    }

    static class DoubleRoots {
        @TreeRole("roots")
        List<Object> a;
        @TreeRole("roots")
        List<Object> b;
    }

    @ParameterizedTest
    @ValueSource(classes = {DoubleLabel.class, DoubleProperties.class, DoubleChildren.class, DoubleRoots.class})
    public void testDoubleRoleAtSameLevelFaults(Class<?> type) {
        assertThatThrownBy(() -> cache.lookup(type))
            .isInstanceOf(TreeShapeException.class)
            .hasMessageContaining("double @TreeRole")
            .hasMessageContaining(type.getName());
    }

    static class Inner {
        @TreeRole("label")
        String inner;
        @TreeRole("children")
        List<Object> kids;
    }

    static class OtherInner {
        @TreeRole("label")
        String other;
    }

    static class Outer {
        @TreeEmbedded
        Inner inner;
        @TreeRole("label")
        String outer;
    }

    static class Ambiguous {
        @TreeEmbedded
        Inner a;
        @TreeEmbedded
        OtherInner b;
    }

    static class Disambiguated {
        @TreeEmbedded
        Inner a;
        @TreeEmbedded
        OtherInner b;
        @TreeRole("label")
        String name;
    }

    @Test
    public void testShallowerRoleWinsOverEmbedded() {
        TreeShape shape = cache.lookup(Outer.class);
        assertThat(shape.getPath(Role.LABEL).getTarget().getName()).isEqualTo("outer");
        assertThat(shape.getPath(Role.LABEL).depth()).isZero();
        assertThat(shape.getPath(Role.CHILDREN).getIndices()).containsExactly(0, 1);
    }

    @Test
    public void testConflictBetweenEmbeddedMembersFaults() {
        assertThatThrownBy(() -> cache.lookup(Ambiguous.class))
            .isInstanceOf(TreeShapeException.class)
            .hasMessageContaining("\"label\"");
    }

    @Test
    public void testShallowerRoleResolvesEmbeddedConflict() {
        TreeShape shape = cache.lookup(Disambiguated.class);
        assertThat(shape.getPath(Role.LABEL).getTarget().getName()).isEqualTo("name");
        assertThat(shape.getPath(Role.CHILDREN).getIndices()).containsExactly(0, 1);
    }

    static class Named {
        @TreeRole("label")
        String name;
        // not embedded, so its roles stay its own
        Labelled nested;
    }

    @Test
    public void testNamedNestedMembersAreNotScanned() {
        TreeShape shape = cache.lookup(Named.class);
        assertThat(shape.getPath(Role.LABEL).getIndices()).containsExactly(0);
        assertThat(cache.size()).isEqualTo(1);
    }

    static class BaseNode {
        @TreeRole("label")
        String name;
    }

    static class DerivedNode extends BaseNode {
        @TreeRole("children")
        List<DerivedNode> children;
    }

    static class RelabelledNode extends BaseNode {
        @TreeRole("label")
        String title;
    }

    @Test
    public void testSuperclassRolesAreInherited() {
        TreeShape shape = cache.lookup(DerivedNode.class);
        assertThat(shape.getPath(Role.LABEL).getTarget().getDeclaringClass()).isEqualTo(BaseNode.class);
        assertThat(shape.getPath(Role.CHILDREN).depth()).isZero();

        DerivedNode node = new DerivedNode();
        node.name = "inherited";
        assertThat(shape.read(Role.LABEL, node)).isEqualTo("inherited");
    }

    @Test
    public void testSubclassRoleShadowsSuperclassRole() {
        TreeShape shape = cache.lookup(RelabelledNode.class);
        assertThat(shape.getPath(Role.LABEL).getTarget().getName()).isEqualTo("title");
    }

    static class BadTag {
        @TreeRole("label, foobar")
        String name;
    }

    static class CombinedTag {
        @TreeRole("children, roots")
        List<Object> kids;
        @TreeRole(" , ")
        String blank;
    }

    @Test
    public void testInvalidTagValueFaultsNamingOnlyInvalidParts() {
        assertThatThrownBy(() -> cache.lookup(BadTag.class))
            .isInstanceOf(TreeShapeException.class)
            .hasMessageContaining("[foobar]")
            .hasMessageNotContaining("label,");
    }

    static class RepeatedTag {
        @TreeRole("label, children, label")
        String name;
    }

    @Test
    public void testRoleRepeatedWithinOneTagFaults() {
        assertThatThrownBy(() -> cache.lookup(RepeatedTag.class))
            .isInstanceOf(TreeShapeException.class)
            .hasMessageContaining("double @TreeRole(\"label\")")
            .hasMessageContaining(RepeatedTag.class.getName() + ".name");
        assertThat(cache.size()).isZero();
    }

    @Test
    public void testFaultyTypeIsNotCached() {
        assertThatThrownBy(() -> cache.lookup(BadTag.class)).isInstanceOf(TreeShapeException.class);
        assertThatThrownBy(() -> cache.lookup(BadTag.class)).isInstanceOf(TreeShapeException.class);
        assertThat(cache.size()).isZero();
    }

    @Test
    public void testCommaCombinedRoles() {
        TreeShape shape = cache.lookup(CombinedTag.class);
        assertThat(shape.getPath(Role.CHILDREN)).isSameAs(shape.getPath(Role.ROOTS));
        assertThat(shape.has(Role.LABEL)).isFalse();
    }

    static class CycleA {
        @TreeEmbedded
        CycleB b;
    }

    static class CycleB {
        @TreeEmbedded
        CycleA a;
    }

    static class EmbeddedList {
        @TreeEmbedded
        List<String> items;
    }

    @Test
    public void testEmbeddingCycleFaults() {
        assertThatThrownBy(() -> cache.lookup(CycleA.class))
            .isInstanceOf(TreeShapeException.class)
            .hasMessageContaining("cycle");
    }

    @Test
    public void testEmbeddedSequenceFaults() {
        assertThatThrownBy(() -> cache.lookup(EmbeddedList.class))
            .isInstanceOf(TreeShapeException.class)
            .hasMessageContaining("items");
    }

    @Test
    public void testResetForgetsShapes() {
        TreeShape before = cache.lookup(Labelled.class);
        cache.reset();
        assertThat(cache.size()).isZero();
        assertThat(cache.lookup(Labelled.class)).isNotSameAs(before);
    }

    @Test
    public void testSharedCacheIsSingleton() {
        assertThat(TreeShapeCache.shared()).isSameAs(TreeShapeCache.shared());
    }

    /**
     * Many threads learning the same type at once must all end up with the one
     * published shape.
     */
    @Test
    public void testConcurrentLookupsPublishOneShape() throws InterruptedException {
        final int threadCount = 32;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        Set<TreeShape> seen = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    startLatch.await();
                    seen.add(cache.lookup(Magic.class));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            }).start();
        }

        startLatch.countDown();
        doneLatch.await();

        assertThat(seen).hasSize(1);
        assertThat(seen.iterator().next()).isSameAs(cache.lookup(Magic.class));
    }
}
