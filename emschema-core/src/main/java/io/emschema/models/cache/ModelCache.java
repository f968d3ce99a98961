/*
 * ModelCache.java
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

import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import io.emschema.annotation.API;
import io.emschema.models.SchemaModelException;
import io.emschema.models.logging.KeyValueLogMessage;
import io.emschema.models.logging.LogMessageKeys;
import io.emschema.models.metadata.TableDefinition;
import io.emschema.models.naming.TableNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Compiled tables by canonical name.
 *
 * <p>
 * Each canonical name is compiled at most once per cache: the first caller for a name runs the compile function
 * while concurrent callers for the same name wait for it and then receive the same instance. Callers for other
 * names are not blocked. A compilation that throws leaves nothing behind, so a later call compiles again, and the
 * original exception reaches the caller. Entries are never evicted; {@link #invalidateAll()} exists to isolate
 * tests from each other.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class ModelCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelCache.class);

    @Nonnull
    private final Cache<String, TableDefinition> cache;
    @Nonnull
    private final AtomicLong compilationCount = new AtomicLong();

    public ModelCache() {
        this.cache = CacheBuilder.newBuilder()
                .recordStats()
                .build();
    }

    /**
     * Get the table stored for the given coordinates, compiling and storing it first if there is none.
     *
     * @param dataset the dataset the table belongs to
     * @param tableName the name of the table within the dataset
     * @param version the table version
     * @param compiler produces the table on a miss; must return a table named after the same coordinates
     * @return the one table instance stored for the coordinates
     */
    @Nonnull
    public TableDefinition getOrCompile(@Nonnull String dataset, @Nonnull String tableName, int version,
                                        @Nonnull Supplier<TableDefinition> compiler) {
        final String canonicalName = TableNames.encode(dataset, tableName, version);
        try {
            return cache.get(canonicalName, () -> compile(canonicalName, compiler));
        } catch (ExecutionException | UncheckedExecutionException | ExecutionError e) {
            final Throwable cause = e.getCause() == null ? e : e.getCause();
            Throwables.throwIfUnchecked(cause);
            throw new SchemaModelException("table compilation failed", cause)
                    .addLogInfo(LogMessageKeys.CANONICAL_NAME.toString(), canonicalName);
        }
    }

    @Nonnull
    private TableDefinition compile(@Nonnull String canonicalName, @Nonnull Supplier<TableDefinition> compiler) {
        compilationCount.incrementAndGet();
        final TableDefinition table = compiler.get();
        if (table == null) {
            throw new SchemaModelException("table compiler returned no table",
                    LogMessageKeys.CANONICAL_NAME, canonicalName);
        }
        if (!canonicalName.equals(table.getTableName())) {
            throw new SchemaModelException("compiled table does not match cache key",
                    LogMessageKeys.CANONICAL_NAME, canonicalName,
                    LogMessageKeys.TABLE_NAME, table.getTableName());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("stored compiled table",
                    LogMessageKeys.CANONICAL_NAME, canonicalName,
                    LogMessageKeys.CACHE_SIZE, cache.size() + 1));
        }
        return table;
    }

    public boolean contains(@Nonnull String canonicalName) {
        return cache.getIfPresent(canonicalName) != null;
    }

    @Nullable
    public TableDefinition getIfPresent(@Nonnull String canonicalName) {
        return cache.getIfPresent(canonicalName);
    }

    public long size() {
        return cache.size();
    }

    /**
     * Number of times a compile function has been run by this cache, including runs that failed.
     * @return the number of compilations
     */
    public long getCompilationCount() {
        return compilationCount.get();
    }

    @Nonnull
    public CacheStats getStats() {
        return cache.stats();
    }

    @Nonnull
    public Set<String> canonicalNames() {
        return ImmutableSet.copyOf(cache.asMap().keySet());
    }

    /**
     * Drop every stored table. Only meant for tests: tables handed out before the call stay valid but a later
     * request compiles a new instance.
     */
    public void invalidateAll() {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("invalidating model cache",
                    LogMessageKeys.CACHE_SIZE, cache.size(),
                    LogMessageKeys.COMPILATION_COUNT, compilationCount.get()));
        }
        cache.invalidateAll();
    }

    @Override
    public String toString() {
        return "ModelCache:" + cache.asMap().keySet();
    }
}
