/*
 * InMemorySchemaRegistry.java
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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.emschema.annotation.API;
import io.emschema.models.UnknownSchemaException;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A {@link SchemaRegistry} over a fixed map of schemas.
 */
@API(API.Status.UNSTABLE)
public class InMemorySchemaRegistry implements SchemaRegistry {
    @Nonnull
    private final ImmutableMap<String, AnnotationSchema> schemas;

    private InMemorySchemaRegistry(@Nonnull Map<String, AnnotationSchema> schemas) {
        this.schemas = ImmutableMap.copyOf(schemas);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    @Override
    public AnnotationSchema lookup(@Nonnull String schemaName) {
        final AnnotationSchema schema = schemas.get(schemaName);
        if (schema == null) {
            throw new UnknownSchemaException(Collections.singletonList(schemaName));
        }
        return schema;
    }

    @Nonnull
    @Override
    public Set<String> validNames() {
        return schemas.keySet();
    }

    @Override
    public String toString() {
        return "InMemorySchemaRegistry" + schemas.keySet();
    }

    /**
     * A builder for {@link InMemorySchemaRegistry}.
     */
    public static class Builder {
        @Nonnull
        private final Map<String, AnnotationSchema> schemas = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a schema under its own name.
         * @param schema the schema to register
         * @return this builder
         */
        @Nonnull
        public Builder register(@Nonnull AnnotationSchema schema) {
            return register(schema.getName(), schema);
        }

        @Nonnull
        public Builder register(@Nonnull String schemaName, @Nonnull AnnotationSchema schema) {
            Preconditions.checkArgument(!schemas.containsKey(schemaName), "schema %s already registered", schemaName);
            schemas.put(schemaName, schema);
            return this;
        }

        @Nonnull
        public InMemorySchemaRegistry build() {
            return new InMemorySchemaRegistry(schemas);
        }
    }
}
