/*
 * DdlGenerator.java
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

package io.emschema.models.ddl;

import com.google.common.collect.ImmutableList;
import io.emschema.annotation.API;
import io.emschema.models.metadata.ColumnSpec;
import io.emschema.models.metadata.ColumnType;
import io.emschema.models.metadata.TableDefinition;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link TableDefinition}s as PostgreSQL statements, with geometry columns typed for PostGIS.
 * The statements are text only: running them is up to the storage engine.
 *
 * <p>
 * Conventions:
 * </p>
 * <ul>
 * <li>Identifiers are always double-quoted.</li>
 * <li>B-tree indexes are named {@code ix_<table>_<column>}, spatial indexes {@code idx_<table>_<column>}.</li>
 * </ul>
 */
@API(API.Status.EXPERIMENTAL)
public final class DdlGenerator {
    private DdlGenerator() {
    }

    /**
     * Generate the {@code CREATE TABLE} statement of a table, with its primary and foreign keys.
     *
     * @param table the compiled table
     * @return the statement, without a trailing semicolon
     */
    @Nonnull
    public static String createTable(@Nonnull TableDefinition table) {
        final List<String> lines = new ArrayList<>();
        for (ColumnSpec column : table.getColumns()) {
            lines.add("    " + quote(column.getName()) + " " + sqlType(column.getType())
                      + (column.isPrimaryKey() ? " NOT NULL" : ""));
        }
        lines.add("    PRIMARY KEY (" + quote(table.getPrimaryKey().getName()) + ")");
        for (ColumnSpec column : table.getForeignKeyColumns()) {
            lines.add("    FOREIGN KEY (" + quote(column.getName()) + ") REFERENCES "
                      + quote(column.getForeignKeyTable()) + " (" + quote(column.getForeignKeyColumn()) + ")");
        }
        return "CREATE TABLE " + quote(table.getTableName()) + " (\n" + String.join(",\n", lines) + "\n)";
    }

    /**
     * Generate one {@code CREATE INDEX} statement per indexed column, in column order.
     *
     * @param table the compiled table
     * @return the statements, without trailing semicolons
     */
    @Nonnull
    public static List<String> createIndexes(@Nonnull TableDefinition table) {
        final ImmutableList.Builder<String> statements = ImmutableList.builder();
        for (ColumnSpec column : table.getIndexedColumns()) {
            if (column.getType().isGeometry()) {
                statements.add("CREATE INDEX " + quote("idx_" + table.getTableName() + "_" + column.getName())
                               + " ON " + quote(table.getTableName()) + " USING GIST (" + quote(column.getName()) + ")");
            } else {
                statements.add("CREATE INDEX " + quote("ix_" + table.getTableName() + "_" + column.getName())
                               + " ON " + quote(table.getTableName()) + " (" + quote(column.getName()) + ")");
            }
        }
        return statements.build();
    }

    /**
     * The table statement followed by its index statements, each terminated by a semicolon.
     *
     * @param table the compiled table
     * @return the statements
     */
    @Nonnull
    public static List<String> createAll(@Nonnull TableDefinition table) {
        final ImmutableList.Builder<String> statements = ImmutableList.builder();
        statements.add(createTable(table) + ";");
        for (String index : createIndexes(table)) {
            statements.add(index + ";");
        }
        return statements.build();
    }

    @Nonnull
    static String sqlType(@Nonnull ColumnType type) {
        switch (type.getCode()) {
            case NUMERIC:
                return "NUMERIC";
            case INTEGER:
                return "INTEGER";
            case FLOAT:
                return "FLOAT";
            case STRING:
                return "VARCHAR";
            case BOOLEAN:
                return "BOOLEAN";
            case GEOMETRY:
                return "geometry(" + type.getGeometryTag() + ")";
            default:
                throw new IllegalArgumentException("unknown column type " + type);
        }
    }

    @Nonnull
    static String quote(@Nonnull String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
