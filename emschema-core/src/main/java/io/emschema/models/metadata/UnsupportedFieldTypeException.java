/*
 * UnsupportedFieldTypeException.java
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

import io.emschema.annotation.API;
import io.emschema.models.schema.FieldKind;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when a field's kind has no column type and is not a record that can be flattened.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class UnsupportedFieldTypeException extends InvalidSchemaFieldException {
    @Nonnull
    private final FieldKind kind;

    public UnsupportedFieldTypeException(@Nonnull FieldKind kind, @Nullable Object... keyValues) {
        super("field type " + kind + " not supported", keyValues);
        this.kind = kind;
    }

    @Nonnull
    public FieldKind getKind() {
        return kind;
    }
}
