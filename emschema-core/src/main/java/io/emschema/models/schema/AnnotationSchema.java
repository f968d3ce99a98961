/*
 * AnnotationSchema.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named, ordered set of {@link FieldDescriptor}s describing one kind of annotation, or one nested record
 * used inside annotations.
 *
 * <p>
 * A <em>reference</em> schema describes annotations that point at rows of another entity type. It declares
 * a {@value #TARGET_ID} field whose reference type names that entity type.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class AnnotationSchema {
    /**
     * Name of the field through which a reference schema points at its target.
     */
    public static final String TARGET_ID = "target_id";

    @Nonnull
    private final String name;
    @Nonnull
    private final ImmutableMap<String, FieldDescriptor> fields;
    private final boolean reference;

    private AnnotationSchema(@Nonnull String name, @Nonnull Map<String, FieldDescriptor> fields, boolean reference) {
        this.name = name;
        this.fields = ImmutableMap.copyOf(fields);
        this.reference = reference;
    }

    @Nonnull
    public static Builder newBuilder(@Nonnull String name) {
        return new Builder(name);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * The fields of this schema in declaration order.
     * @return the fields keyed by name
     */
    @Nonnull
    public Map<String, FieldDescriptor> getFields() {
        return fields;
    }

    @Nullable
    public FieldDescriptor getField(@Nonnull String fieldName) {
        return fields.get(fieldName);
    }

    public boolean isReference() {
        return reference;
    }

    /**
     * Start a new schema that inherits every field of this one, in order, ahead of the fields added to the
     * builder. The new schema is a reference schema if this one is.
     *
     * @param newName the name of the derived schema
     * @return a builder pre-populated with this schema's fields
     */
    @Nonnull
    public Builder extend(@Nonnull String newName) {
        return newBuilder(newName).addFields(fields).setReference(reference);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AnnotationSchema that = (AnnotationSchema)o;
        return reference == that.reference && name.equals(that.name) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fields, reference);
    }

    @Override
    public String toString() {
        return (reference ? "ReferenceSchema(" : "Schema(") + name + ", " + fields.keySet() + ")";
    }

    /**
     * A builder for {@link AnnotationSchema}.
     */
    public static class Builder {
        @Nonnull
        private final String name;
        @Nonnull
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        private boolean reference;

        private Builder(@Nonnull String name) {
            this.name = name;
        }

        @Nonnull
        public Builder addField(@Nonnull String fieldName, @Nonnull FieldDescriptor field) {
            Preconditions.checkArgument(!fields.containsKey(fieldName), "schema %s already has a field %s", name, fieldName);
            fields.put(fieldName, field);
            return this;
        }

        @Nonnull
        public Builder addField(@Nonnull String fieldName, @Nonnull FieldKind kind) {
            return addField(fieldName, FieldDescriptor.of(kind));
        }

        @Nonnull
        public Builder addFields(@Nonnull Map<String, FieldDescriptor> newFields) {
            newFields.forEach(this::addField);
            return this;
        }

        @Nonnull
        public Builder setReference(boolean reference) {
            this.reference = reference;
            return this;
        }

        @Nonnull
        public AnnotationSchema build() {
            return new AnnotationSchema(name, fields, reference);
        }
    }
}
