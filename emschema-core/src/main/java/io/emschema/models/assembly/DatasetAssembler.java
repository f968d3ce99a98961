/*
 * DatasetAssembler.java
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

package io.emschema.models.assembly;

import com.google.common.base.Preconditions;
import io.emschema.annotation.API;
import io.emschema.models.UnknownSchemaException;
import io.emschema.models.cache.ModelCache;
import io.emschema.models.compiler.ModelCompiler;
import io.emschema.models.logging.KeyValueLogMessage;
import io.emschema.models.logging.LogMessageKeys;
import io.emschema.models.metadata.TableDefinition;
import io.emschema.models.schema.AnnotationSchema;
import io.emschema.models.schema.BuiltInSchemas;
import io.emschema.models.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Builds the full set of tables of one or more datasets.
 *
 * <p>
 * Every requested schema name is checked against the registry before anything is compiled, so a request naming
 * unknown schemas fails without side effects and reports all of them at once. Table names are checked at the same
 * time: each may be requested once, and the names of the root and contact tables are reserved. Tables then go through the
 * {@link ModelCache}: the dataset's root table first, then each requested table in request order, then the contact
 * table if asked for. If a compilation fails the assembly stops and the exception propagates; tables compiled
 * before the failure stay cached.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class DatasetAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatasetAssembler.class);

    @Nonnull
    private final SchemaRegistry registry;
    @Nonnull
    private final ModelCompiler compiler;
    @Nonnull
    private final ModelCache cache;

    public DatasetAssembler(@Nonnull SchemaRegistry registry, @Nonnull ModelCompiler compiler, @Nonnull ModelCache cache) {
        this.registry = registry;
        this.compiler = compiler;
        this.cache = cache;
    }

    @Nonnull
    public ModelCache getCache() {
        return cache;
    }

    /**
     * Assemble the tables of one dataset.
     *
     * @param dataset the dataset
     * @param schemaTablePairs the annotation tables to create, each with the schema describing it
     * @param version the table version
     * @param includeContacts whether to add the contact table
     * @return the tables by name within the dataset, the root table first and the rest in request order
     * @throws UnknownSchemaException if a requested schema is not registered
     * @throws IllegalArgumentException if a table name is requested twice or is the root or contact table name
     */
    @Nonnull
    public Map<String, TableDefinition> assembleDataset(@Nonnull String dataset,
                                                        @Nonnull List<SchemaTablePair> schemaTablePairs,
                                                        int version, boolean includeContacts) {
        validateRequest(schemaTablePairs);
        return assembleValidated(dataset, schemaTablePairs, version, includeContacts);
    }

    /**
     * Assemble the same tables for several datasets.
     *
     * @param datasets the datasets
     * @param schemaTablePairs the annotation tables to create in every dataset
     * @param version the table version
     * @param includeContacts whether to add the contact table
     * @return the tables of each dataset, in the order of {@code datasets}
     * @throws UnknownSchemaException if a requested schema is not registered, before any dataset is assembled
     */
    @Nonnull
    public Map<String, Map<String, TableDefinition>> assembleAll(@Nonnull Collection<String> datasets,
                                                                 @Nonnull List<SchemaTablePair> schemaTablePairs,
                                                                 int version, boolean includeContacts) {
        validateRequest(schemaTablePairs);
        final Map<String, Map<String, TableDefinition>> result = new LinkedHashMap<>();
        for (String dataset : datasets) {
            result.put(dataset, assembleValidated(dataset, schemaTablePairs, version, includeContacts));
        }
        logAssembled(result);
        return result;
    }

    /**
     * Assemble several datasets concurrently. Names are validated on the calling thread, so an unknown schema is
     * thrown directly rather than through the returned future.
     *
     * @param datasets the datasets
     * @param schemaTablePairs the annotation tables to create in every dataset
     * @param version the table version
     * @param includeContacts whether to add the contact table
     * @param executor runs the assembly of each dataset
     * @return a future completing with the tables of each dataset, in the order of {@code datasets}, or
     * exceptionally with the first compilation failure
     * @throws UnknownSchemaException if a requested schema is not registered
     */
    @Nonnull
    public CompletableFuture<Map<String, Map<String, TableDefinition>>> assembleAllAsync(
            @Nonnull Collection<String> datasets, @Nonnull List<SchemaTablePair> schemaTablePairs,
            int version, boolean includeContacts, @Nonnull Executor executor) {
        validateRequest(schemaTablePairs);
        final List<String> datasetList = new ArrayList<>(datasets);
        final List<CompletableFuture<Map<String, TableDefinition>>> futures = new ArrayList<>(datasetList.size());
        for (String dataset : datasetList) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> assembleValidated(dataset, schemaTablePairs, version, includeContacts), executor));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).thenApply(ignore -> {
            final Map<String, Map<String, TableDefinition>> result = new LinkedHashMap<>();
            for (int i = 0; i < datasetList.size(); i++) {
                result.put(datasetList.get(i), futures.get(i).join());
            }
            logAssembled(result);
            return result;
        });
    }

    /**
     * Get the cached table of one annotation schema, compiling it if needed.
     *
     * @param dataset the dataset
     * @param schemaName the registered schema describing the table
     * @param tableName the name of the table within the dataset
     * @param version the table version
     * @return the cached table
     * @throws UnknownSchemaException if the schema is not registered
     * @throws IllegalArgumentException if {@code tableName} is the name of the root or contact table
     */
    @Nonnull
    public TableDefinition makeAnnotationModel(@Nonnull String dataset, @Nonnull String schemaName,
                                               @Nonnull String tableName, int version) {
        Preconditions.checkArgument(!isReservedTableName(tableName), "table name %s is reserved", tableName);
        final AnnotationSchema schema = registry.lookup(schemaName);
        return cache.getOrCompile(dataset, tableName, version,
                () -> compiler.compile(dataset, tableName, schema, version));
    }

    /**
     * Compile the table of one annotation schema without looking in or storing into the cache.
     *
     * @param dataset the dataset
     * @param schemaName the registered schema describing the table
     * @param tableName the name of the table within the dataset
     * @param version the table version
     * @return a freshly compiled table
     * @throws UnknownSchemaException if the schema is not registered
     */
    @Nonnull
    public TableDefinition declareAnnotationModel(@Nonnull String dataset, @Nonnull String schemaName,
                                                  @Nonnull String tableName, int version) {
        return compiler.compile(dataset, tableName, registry.lookup(schemaName), version);
    }

    @Nonnull
    private Map<String, TableDefinition> assembleValidated(@Nonnull String dataset,
                                                           @Nonnull List<SchemaTablePair> schemaTablePairs,
                                                           int version, boolean includeContacts) {
        final Map<String, TableDefinition> tables = new LinkedHashMap<>();
        final String rootTableName = compiler.getConfig().getRootTableName();
        tables.put(rootTableName, cache.getOrCompile(dataset, rootTableName, version,
                () -> compiler.compileRoot(dataset, version)));
        for (SchemaTablePair pair : schemaTablePairs) {
            tables.put(pair.getTableName(),
                    makeAnnotationModel(dataset, pair.getSchemaName(), pair.getTableName(), version));
        }
        if (includeContacts) {
            final String contactTableName = compiler.getConfig().getContactTableName();
            tables.put(contactTableName, cache.getOrCompile(dataset, contactTableName, version,
                    () -> compiler.compile(dataset, contactTableName, BuiltInSchemas.CONTACT, version)));
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("assembled dataset",
                    LogMessageKeys.DATASET, dataset,
                    LogMessageKeys.VERSION, version,
                    LogMessageKeys.TABLE_COUNT, tables.size()));
        }
        return tables;
    }

    private void validateRequest(@Nonnull List<SchemaTablePair> schemaTablePairs) {
        final Set<String> validNames = registry.validNames();
        final Set<String> unknownNames = new LinkedHashSet<>();
        for (SchemaTablePair pair : schemaTablePairs) {
            if (!validNames.contains(pair.getSchemaName())) {
                unknownNames.add(pair.getSchemaName());
            }
        }
        if (!unknownNames.isEmpty()) {
            throw new UnknownSchemaException(unknownNames);
        }
        final Set<String> tableNames = new HashSet<>();
        for (SchemaTablePair pair : schemaTablePairs) {
            Preconditions.checkArgument(!isReservedTableName(pair.getTableName()),
                    "table name %s is reserved", pair.getTableName());
            Preconditions.checkArgument(tableNames.add(pair.getTableName()),
                    "table name %s requested more than once", pair.getTableName());
        }
    }

    // the root and contact tables share the cache with annotation tables
    private boolean isReservedTableName(@Nonnull String tableName) {
        return tableName.equals(compiler.getConfig().getRootTableName())
               || tableName.equals(compiler.getConfig().getContactTableName());
    }

    private void logAssembled(@Nonnull Map<String, Map<String, TableDefinition>> result) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("assembled datasets",
                    LogMessageKeys.DATASET_COUNT, result.size(),
                    LogMessageKeys.CACHE_SIZE, cache.size()));
        }
    }
}
