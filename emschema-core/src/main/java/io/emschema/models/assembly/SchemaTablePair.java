/*
 * SchemaTablePair.java
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

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A table to assemble: the registered schema describing its rows and its name within the dataset.
 */
@API(API.Status.UNSTABLE)
public final class SchemaTablePair {
    @Nonnull
    private final String schemaName;
    @Nonnull
    private final String tableName;

    private SchemaTablePair(@Nonnull String schemaName, @Nonnull String tableName) {
        Preconditions.checkArgument(!schemaName.isEmpty(), "schema name must not be empty");
        Preconditions.checkArgument(!tableName.isEmpty(), "table name must not be empty");
        this.schemaName = schemaName;
        this.tableName = tableName;
    }

    @Nonnull
    public static SchemaTablePair of(@Nonnull String schemaName, @Nonnull String tableName) {
        return new SchemaTablePair(schemaName, tableName);
    }

    @Nonnull
    public String getSchemaName() {
        return schemaName;
    }

    @Nonnull
    public String getTableName() {
        return tableName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SchemaTablePair that = (SchemaTablePair)o;
        return schemaName.equals(that.schemaName) && tableName.equals(that.tableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaName, tableName);
    }

    @Override
    public String toString() {
        return "(" + schemaName + ", " + tableName + ")";
    }
}
