/*
 * ColumnSpec.java
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
import io.emschema.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One column of a compiled table.
 *
 * <p>
 * A foreign key is stored as its {@code "table.column"} target, the form the storage engine declares it in.
 * Only the primary key column sets {@link #isPrimaryKey()}; its values are assigned by the caller, so it is never
 * auto-incrementing. Instances are immutable.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class ColumnSpec {
    @Nonnull
    private final String name;
    @Nonnull
    private final ColumnType type;
    private final boolean indexed;
    @Nullable
    private final String foreignKey;
    private final boolean primaryKey;

    private ColumnSpec(@Nonnull String name, @Nonnull ColumnType type, boolean indexed,
                       @Nullable String foreignKey, boolean primaryKey) {
        this.name = name;
        this.type = type;
        this.indexed = indexed;
        this.foreignKey = foreignKey;
        this.primaryKey = primaryKey;
    }

    @Nonnull
    public static ColumnSpec of(@Nonnull String name, @Nonnull ColumnType type, boolean indexed) {
        return new ColumnSpec(name, type, indexed, null, false);
    }

    @Nonnull
    public static ColumnSpec primaryKey(@Nonnull String name, @Nonnull ColumnType type) {
        return new ColumnSpec(name, type, false, null, true);
    }

    /**
     * A copy of this column referencing another table's column.
     *
     * @param target the referenced column as {@code "table.column"}
     * @return the new column
     */
    @Nonnull
    public ColumnSpec withForeignKey(@Nonnull String target) {
        final int dot = target.lastIndexOf('.');
        Preconditions.checkArgument(dot > 0 && dot < target.length() - 1,
                "foreign key target must be table.column: %s", target);
        return new ColumnSpec(name, type, indexed, target, primaryKey);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public ColumnType getType() {
        return type;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public boolean isPrimaryKey() {
        return primaryKey;
    }

    public boolean isAutoIncrement() {
        return false;
    }

    @Nullable
    public String getForeignKey() {
        return foreignKey;
    }

    public boolean hasForeignKey() {
        return foreignKey != null;
    }

    @Nullable
    public String getForeignKeyTable() {
        return foreignKey == null ? null : foreignKey.substring(0, foreignKey.lastIndexOf('.'));
    }

    @Nullable
    public String getForeignKeyColumn() {
        return foreignKey == null ? null : foreignKey.substring(foreignKey.lastIndexOf('.') + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnSpec that = (ColumnSpec)o;
        return indexed == that.indexed
               && primaryKey == that.primaryKey
               && name.equals(that.name)
               && type.equals(that.type)
               && Objects.equals(foreignKey, that.foreignKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, indexed, foreignKey, primaryKey);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(' ').append(type);
        if (primaryKey) {
            sb.append(" PRIMARY KEY");
        }
        if (indexed) {
            sb.append(" INDEXED");
        }
        if (foreignKey != null) {
            sb.append(" -> ").append(foreignKey);
        }
        return sb.toString();
    }
}
