/*
 * InvalidSchemaFieldException.java
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
import io.emschema.models.SchemaModelException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when a schema field has a shape that cannot be stored as a fixed set of columns, such as a record nested
 * inside a nested record or a nested field holding many records.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class InvalidSchemaFieldException extends SchemaModelException {
    public InvalidSchemaFieldException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }
}
