/*
 * ModelCompiler.java
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

package io.emschema.models.compiler;

import io.emschema.annotation.API;
import io.emschema.models.logging.KeyValueLogMessage;
import io.emschema.models.logging.LogMessageKeys;
import io.emschema.models.metadata.ColumnSpec;
import io.emschema.models.metadata.ColumnType;
import io.emschema.models.metadata.InvalidSchemaFieldException;
import io.emschema.models.metadata.TableDefinition;
import io.emschema.models.naming.TableNames;
import io.emschema.models.schema.AnnotationSchema;
import io.emschema.models.schema.FieldDescriptor;
import io.emschema.util.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Compiles annotation schemas into {@link TableDefinition}s.
 *
 * <p>
 * Every table starts with a numeric {@code id} primary key, followed by the columns of each stored field in
 * declaration order. Tables of reference schemas also get a {@code target_id} foreign key to the referenced
 * annotation table of the same dataset. The compiler holds no state besides its configuration, so one instance
 * can be shared between threads. Memoizing compiled tables is the job of the
 * {@link io.emschema.models.cache.ModelCache}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class ModelCompiler {
    public static final String ID_COLUMN = "id";

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelCompiler.class);

    @Nonnull
    private final ModelCompilerConfig config;
    @Nonnull
    private final FieldFlattener flattener;

    public ModelCompiler() {
        this(ModelCompilerConfig.getDefault());
    }

    public ModelCompiler(@Nonnull ModelCompilerConfig config) {
        this.config = config;
        this.flattener = new FieldFlattener(config);
    }

    @Nonnull
    public ModelCompilerConfig getConfig() {
        return config;
    }

    /**
     * Compile the table of an annotation schema.
     *
     * @param dataset the dataset the table belongs to
     * @param tableName the name of the table within the dataset
     * @param schema the schema describing the table's rows
     * @param version the table version
     * @return the compiled table
     * @throws InvalidSchemaFieldException if a field cannot be stored as columns or a reference schema is malformed
     */
    @Nonnull
    public TableDefinition compile(@Nonnull String dataset, @Nonnull String tableName,
                                   @Nonnull AnnotationSchema schema, int version) {
        final String canonicalName = TableNames.encode(dataset, tableName, version);
        final TableDefinition.Builder builder = TableDefinition.newBuilder(canonicalName,
                modelName(dataset, tableName), idColumn());
        for (Map.Entry<String, FieldDescriptor> entry : schema.getFields().entrySet()) {
            for (ColumnSpec column : flattener.flatten(entry.getKey(), entry.getValue(), dataset, version)) {
                addColumn(builder, canonicalName, column);
            }
        }
        if (schema.isReference()) {
            addColumn(builder, canonicalName, targetIdColumn(dataset, schema));
        }
        final TableDefinition table = builder.setConcrete(dataset).build();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("compiled annotation table",
                    LogMessageKeys.CANONICAL_NAME, canonicalName,
                    LogMessageKeys.SCHEMA_NAME, schema.getName(),
                    LogMessageKeys.COLUMN_COUNT, table.getColumnCount()));
        }
        return table;
    }

    /**
     * Compile the dataset's root table, which holds only the {@code id} that bound points reference.
     *
     * @param dataset the dataset
     * @param version the table version
     * @return the root table
     */
    @Nonnull
    public TableDefinition compileRoot(@Nonnull String dataset, int version) {
        final String canonicalName = TableNames.encode(dataset, config.getRootTableName(), version);
        final TableDefinition table = TableDefinition.newBuilder(canonicalName,
                modelName(dataset, config.getRootTableName()), idColumn()).build();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("compiled root table",
                    LogMessageKeys.CANONICAL_NAME, canonicalName));
        }
        return table;
    }

    @Nonnull
    private static ColumnSpec idColumn() {
        return ColumnSpec.primaryKey(ID_COLUMN, ColumnType.NUMERIC);
    }

    @Nonnull
    private static String modelName(@Nonnull String dataset, @Nonnull String tableName) {
        return StringUtils.capitalize(dataset) + StringUtils.capitalize(tableName);
    }

    @Nonnull
    private static ColumnSpec targetIdColumn(@Nonnull String dataset, @Nonnull AnnotationSchema schema) {
        final FieldDescriptor targetId = schema.getField(AnnotationSchema.TARGET_ID);
        if (targetId == null) {
            throw new InvalidSchemaFieldException("reference schema has no target_id field",
                    LogMessageKeys.SCHEMA_NAME, schema.getName(),
                    LogMessageKeys.FIELD_NAME, AnnotationSchema.TARGET_ID,
                    LogMessageKeys.DATASET, dataset);
        }
        final String referenceType = targetId.getReferenceType();
        if (referenceType == null || referenceType.isEmpty()) {
            throw new InvalidSchemaFieldException("reference schema target_id has no reference type",
                    LogMessageKeys.SCHEMA_NAME, schema.getName(),
                    LogMessageKeys.REFERENCE_TYPE, referenceType,
                    LogMessageKeys.DATASET, dataset);
        }
        return ColumnSpec.of(AnnotationSchema.TARGET_ID, ColumnType.INTEGER, false)
                .withForeignKey(dataset + "_" + referenceType + "." + ID_COLUMN);
    }

    private void addColumn(@Nonnull TableDefinition.Builder builder, @Nonnull String canonicalName,
                           @Nonnull ColumnSpec column) {
        if (!builder.hasColumn(column.getName())) {
            builder.addColumn(column);
            return;
        }
        switch (config.getDuplicateColumnPolicy()) {
            case REPLACE:
                if (ID_COLUMN.equals(column.getName())) {
                    throw duplicateColumn(canonicalName, column);
                }
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("replacing duplicate column",
                            LogMessageKeys.CANONICAL_NAME, canonicalName,
                            LogMessageKeys.COLUMN_NAME, column.getName()));
                }
                builder.replaceColumn(column);
                break;
            case REJECT:
            default:
                throw duplicateColumn(canonicalName, column);
        }
    }

    @Nonnull
    private static InvalidSchemaFieldException duplicateColumn(@Nonnull String canonicalName, @Nonnull ColumnSpec column) {
        return new InvalidSchemaFieldException("duplicate column in table",
                LogMessageKeys.CANONICAL_NAME, canonicalName,
                LogMessageKeys.COLUMN_NAME, column.getName());
    }
}
