/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */
package com.example.treeprinter.benchmarks;

import com.example.treeprinter.api.TreeEmbedded;
import com.example.treeprinter.api.TreeRole;
import com.example.treeprinter.shape.TreeShape;
import com.example.treeprinter.shape.TreeShapeCache;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmark for annotated type lookups: cached shape vs a fresh scan.
 *
 * A cached lookup is a single ConcurrentHashMap read. A cold lookup walks the declared
 * fields with ByteBuddy, including the embedded member, and publishes the result.
 *
 * Run: mvn clean install && java -jar target/benchmarks.jar ShapeCacheBenchmark
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 3, timeUnit = TimeUnit.SECONDS)
public class ShapeCacheBenchmark {

    public static class Meta {
        @TreeRole("label")
        String name;
        @TreeRole("properties")
        List<String> tags;
    }

    public static class Entry {
        @TreeEmbedded
        Meta meta = new Meta();
        int size;
        long modified;
        @TreeRole("children")
        List<Entry> entries;
    }

    @State(Scope.Benchmark)
    public static class WarmCacheState {
        TreeShapeCache cache;

        @Setup(Level.Trial)
        public void setup() {
            cache = new TreeShapeCache();
            cache.lookup(Entry.class);
        }
    }

    @State(Scope.Thread)
    public static class ColdCacheState {
        TreeShapeCache cache;

        @Setup(Level.Invocation)
        public void setup() {
            cache = new TreeShapeCache();
        }
    }

    @Benchmark
    @Threads(1)
    public void cachedLookup_SingleThread(WarmCacheState state, Blackhole bh) {
        TreeShape shape = state.cache.lookup(Entry.class);
        bh.consume(shape);
    }

    @Benchmark
    @Threads(4)
    public void cachedLookup_Concurrent(WarmCacheState state, Blackhole bh) {
        TreeShape shape = state.cache.lookup(Entry.class);
        bh.consume(shape);
    }

    /**
     * Scan of a type with an embedded member. Includes the scan of Meta itself.
     */
    @Benchmark
    public void coldLookup(ColdCacheState state, Blackhole bh) {
        TreeShape shape = state.cache.lookup(Entry.class);
        bh.consume(shape);
    }
}
