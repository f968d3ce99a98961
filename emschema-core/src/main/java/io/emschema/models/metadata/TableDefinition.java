/*
 * TableDefinition.java
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

package io.emschema.models.metadata;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.emschema.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A compiled table: everything the storage engine needs to create it.
 *
 * <p>
 * The first column is always the primary key. Annotation tables are <em>concrete</em>: each dataset gets its own
 * independent table, tagged with the dataset as polymorphic identity, and tables of different datasets never
 * share rows even when they come from the same schema. The dataset's root table is not concrete.
 * </p>
 *
 * <p>
 * Instances are immutable and compare by value. The {@link io.emschema.models.cache.ModelCache} additionally
 * guarantees that one process sees a single instance per canonical table name.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class TableDefinition {
    @Nonnull
    private final String tableName;
    @Nonnull
    private final String modelName;
    @Nonnull
    private final ImmutableMap<String, ColumnSpec> columns;
    private final boolean concrete;
    @Nullable
    private final String polymorphicIdentity;

    private TableDefinition(@Nonnull Builder builder) {
        this.tableName = builder.tableName;
        this.modelName = builder.modelName;
        this.columns = ImmutableMap.copyOf(builder.columns);
        this.concrete = builder.concrete;
        this.polymorphicIdentity = builder.polymorphicIdentity;
    }

    /**
     * Start a table whose first column is the given primary key.
     *
     * @param tableName the canonical table name
     * @param modelName the name of the model class the table maps to
     * @param primaryKey the primary key column
     * @return a new builder
     */
    @Nonnull
    public static Builder newBuilder(@Nonnull String tableName, @Nonnull String modelName, @Nonnull ColumnSpec primaryKey) {
        return new Builder(tableName, modelName, primaryKey);
    }

    @Nonnull
    public String getTableName() {
        return tableName;
    }

    @Nonnull
    public String getModelName() {
        return modelName;
    }

    @Nonnull
    public ColumnSpec getPrimaryKey() {
        return columns.values().iterator().next();
    }

    /**
     * All columns, primary key first, then in the order the schema declared them.
     * @return the columns
     */
    @Nonnull
    public List<ColumnSpec> getColumns() {
        return columns.values().asList();
    }

    @Nonnull
    public List<String> getColumnNames() {
        return columns.keySet().asList();
    }

    @Nullable
    public ColumnSpec getColumn(@Nonnull String columnName) {
        return columns.get(columnName);
    }

    public int getColumnCount() {
        return columns.size();
    }

    @Nonnull
    public List<ColumnSpec> getForeignKeyColumns() {
        return columns.values().stream().filter(ColumnSpec::hasForeignKey).collect(ImmutableList.toImmutableList());
    }

    @Nonnull
    public List<ColumnSpec> getIndexedColumns() {
        return columns.values().stream().filter(ColumnSpec::isIndexed).collect(ImmutableList.toImmutableList());
    }

    public boolean isConcrete() {
        return concrete;
    }

    @Nullable
    public String getPolymorphicIdentity() {
        return polymorphicIdentity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TableDefinition that = (TableDefinition)o;
        return concrete == that.concrete
               && tableName.equals(that.tableName)
               && modelName.equals(that.modelName)
               && getColumns().equals(that.getColumns())
               && Objects.equals(polymorphicIdentity, that.polymorphicIdentity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, modelName, getColumns(), concrete, polymorphicIdentity);
    }

    @Override
    public String toString() {
        return modelName + "(" + tableName + ", " + getColumns() + (concrete ? ", concrete" : "") + ")";
    }

    /**
     * A builder for {@link TableDefinition}. Columns keep the order they were added in.
     */
    public static class Builder {
        @Nonnull
        private final String tableName;
        @Nonnull
        private final String modelName;
        @Nonnull
        private final Map<String, ColumnSpec> columns = new LinkedHashMap<>();
        private boolean concrete;
        @Nullable
        private String polymorphicIdentity;

        private Builder(@Nonnull String tableName, @Nonnull String modelName, @Nonnull ColumnSpec primaryKey) {
            Preconditions.checkArgument(primaryKey.isPrimaryKey(), "column %s is not a primary key", primaryKey.getName());
            this.tableName = tableName;
            this.modelName = modelName;
            columns.put(primaryKey.getName(), primaryKey);
        }

        public boolean hasColumn(@Nonnull String columnName) {
            return columns.containsKey(columnName);
        }

        @Nonnull
        public Builder addColumn(@Nonnull ColumnSpec column) {
            Preconditions.checkArgument(!columns.containsKey(column.getName()),
                    "table %s already has a column %s", tableName, column.getName());
            columns.put(column.getName(), column);
            return this;
        }

        /**
         * Replace an existing column, keeping its position.
         *
         * @param column the new column, matched by name
         * @return this builder
         */
        @Nonnull
        public Builder replaceColumn(@Nonnull ColumnSpec column) {
            final ColumnSpec existing = columns.get(column.getName());
            Preconditions.checkArgument(existing != null, "table %s has no column %s", tableName, column.getName());
            Preconditions.checkArgument(!existing.isPrimaryKey(), "cannot replace primary key %s", column.getName());
            columns.put(column.getName(), column);
            return this;
        }

        /**
         * Mark the table as concrete for the given dataset.
         *
         * @param dataset the polymorphic identity of the table
         * @return this builder
         */
        @Nonnull
        public Builder setConcrete(@Nonnull String dataset) {
            this.concrete = true;
            this.polymorphicIdentity = dataset;
            return this;
        }

        @Nonnull
        public TableDefinition build() {
            return new TableDefinition(this);
        }
    }
}
