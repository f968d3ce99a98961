/*
 * SchemaRegistry.java
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

package io.emschema.models.schema;

import io.emschema.annotation.API;
import io.emschema.models.UnknownSchemaException;

import javax.annotation.Nonnull;
import java.util.Set;

/**
 * Source of the annotation schemas that can be compiled into tables.
 */
@API(API.Status.MAINTAINED)
public interface SchemaRegistry {
    /**
     * Look up a schema by name.
     *
     * @param schemaName the registered name of the schema
     * @return the schema
     * @throws UnknownSchemaException if no schema is registered under {@code schemaName}
     */
    @Nonnull
    AnnotationSchema lookup(@Nonnull String schemaName);

    /**
     * The names of every registered schema.
     * @return the valid schema names
     */
    @Nonnull
    Set<String> validNames();

    default boolean contains(@Nonnull String schemaName) {
        return validNames().contains(schemaName);
    }
}
