/*
 * TypeMappings.java
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

import com.google.common.collect.ImmutableMap;
import io.emschema.annotation.API;
import io.emschema.models.logging.LogMessageKeys;
import io.emschema.models.schema.FieldKind;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * The column type each scalar {@link FieldKind} is stored as.
 * Kinds missing from the mapping are either flattened by the compiler ({@link FieldKind#NESTED}) or rejected.
 */
@API(API.Status.UNSTABLE)
public final class TypeMappings {
    private static final Map<FieldKind, ColumnType> COLUMN_TYPES = ImmutableMap.<FieldKind, ColumnType>builder()
            .put(FieldKind.NUMERIC, ColumnType.NUMERIC)
            .put(FieldKind.INTEGER, ColumnType.INTEGER)
            .put(FieldKind.REFERENCE, ColumnType.INTEGER)
            .put(FieldKind.FLOAT, ColumnType.FLOAT)
            .put(FieldKind.STRING, ColumnType.STRING)
            .put(FieldKind.BOOLEAN, ColumnType.BOOLEAN)
            .build();

    private TypeMappings() {
    }

    public static boolean isMapped(@Nonnull FieldKind kind) {
        return COLUMN_TYPES.containsKey(kind);
    }

    /**
     * The column type of a scalar kind.
     *
     * @param kind the field kind
     * @return the column type
     * @throws UnsupportedFieldTypeException if {@code kind} has no column type
     */
    @Nonnull
    public static ColumnType columnTypeFor(@Nonnull FieldKind kind) {
        final ColumnType type = COLUMN_TYPES.get(kind);
        if (type == null) {
            throw new UnsupportedFieldTypeException(kind, LogMessageKeys.FIELD_KIND, kind);
        }
        return type;
    }
}
