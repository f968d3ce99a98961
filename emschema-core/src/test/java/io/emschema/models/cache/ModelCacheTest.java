/*
 * ModelCacheTest.java
 *
 * This source file is part of the emschema open source project
 *
 * Copyright 2026 the emschema project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.emschema.models.cache;

import io.emschema.models.SchemaModelException;
import io.emschema.models.compiler.ModelCompiler;
import io.emschema.models.metadata.InvalidSchemaFieldException;
import io.emschema.models.metadata.TableDefinition;
import io.emschema.models.schema.BuiltInSchemas;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ModelCache}.
 */
public class ModelCacheTest {
    private final ModelCompiler compiler = new ModelCompiler();
    private final ModelCache cache = new ModelCache();

    private TableDefinition synapse(String dataset, int version) {
        return cache.getOrCompile(dataset, "synapse", version,
                () -> compiler.compile(dataset, "synapse", BuiltInSchemas.SYNAPSE, version));
    }

    @Test
    public void hitReturnsSameInstance() {
        TableDefinition first = synapse("pinky", 1);
        TableDefinition second = synapse("pinky", 1);
        assertSame(first, second);
        assertEquals(1, cache.getCompilationCount());
        assertEquals(1, cache.size());
        assertTrue(cache.contains("pinky_synapse_v1"));
        assertSame(first, cache.getIfPresent("pinky_synapse_v1"));
        assertEquals(1, cache.getStats().hitCount());
    }

    @Test
    public void keysAreCanonicalNames() {
        synapse("pinky", 1);
        synapse("pinky", 2);
        synapse("basil", 1);
        assertEquals(3, cache.getCompilationCount());
        assertThat(cache.canonicalNames(), containsInAnyOrder("pinky_synapse_v1", "pinky_synapse_v2", "basil_synapse_v1"));
        assertNull(cache.getIfPresent("pinky_synapse_v3"));
    }

    @Test
    public void failureIsNotCached() {
        InvalidSchemaFieldException failure = new InvalidSchemaFieldException("boom");
        InvalidSchemaFieldException thrown = assertThrows(InvalidSchemaFieldException.class,
                () -> cache.getOrCompile("pinky", "broken", 1, () -> {
                    throw failure;
                }));
        assertSame(failure, thrown);
        assertFalse(cache.contains("pinky_broken_v1"));
        assertEquals(0, cache.size());

        TableDefinition table = cache.getOrCompile("pinky", "broken", 1,
                () -> compiler.compile("pinky", "broken", BuiltInSchemas.CELL_TYPE_LOCAL, 1));
        assertSame(table, cache.getIfPresent("pinky_broken_v1"));
        assertEquals(2, cache.getCompilationCount());
    }

    @Test
    public void errorsAreRethrownUnwrapped() {
        assertThrows(StackOverflowError.class, () -> cache.getOrCompile("pinky", "t", 1, () -> {
            throw new StackOverflowError();
        }));
    }

    @Test
    public void mismatchedTableIsRejected() {
        assertThrows(SchemaModelException.class, () -> cache.getOrCompile("pinky", "synapse", 2,
                () -> compiler.compile("pinky", "synapse", BuiltInSchemas.SYNAPSE, 1)));
        assertThrows(SchemaModelException.class, () -> cache.getOrCompile("pinky", "synapse", 2, () -> null));
        assertEquals(0, cache.size());
    }

    @Test
    public void invalidateAll() {
        TableDefinition first = synapse("pinky", 1);
        cache.invalidateAll();
        assertEquals(0, cache.size());
        TableDefinition second = synapse("pinky", 1);
        assertNotSame(first, second);
        assertEquals(first, second);
    }

    @Test
    public void concurrentRequestsCompileOnce() throws Exception {
        final int threads = 8;
        final AtomicInteger compilations = new AtomicInteger();
        final CountDownLatch start = new CountDownLatch(1);
        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<TableDefinition>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return cache.getOrCompile("pinky", "synapse", 1, () -> {
                        compilations.incrementAndGet();
                        try {
                            Thread.sleep(50);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return compiler.compile("pinky", "synapse", BuiltInSchemas.SYNAPSE, 1);
                    });
                }));
            }
            start.countDown();
            TableDefinition expected = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<TableDefinition> future : futures) {
                assertSame(expected, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, compilations.get());
        assertEquals(1, cache.getCompilationCount());
    }
}
