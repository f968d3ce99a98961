/*
 * FieldDescriptor.java
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
 * One field of an annotation schema: its {@link FieldKind} and the metadata that decides how it is stored.
 *
 * <ul>
 * <li>{@code indexed}: the column gets a secondary index.</li>
 * <li>{@code dropColumn}: the field is part of the schema but is not stored.</li>
 * <li>{@code postgisGeometry}: the geometry tag (for example {@code POINTZ}) of a spatial sub-field.</li>
 * <li>{@code referenceType}: the entity type a reference field points at.</li>
 * <li>{@code many}: a nested field holds a collection of records rather than exactly one.</li>
 * </ul>
 *
 * <p>
 * Nested fields keep their sub-fields in declaration order. Instances are immutable.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class FieldDescriptor {
    @Nonnull
    private final FieldKind kind;
    private final boolean indexed;
    private final boolean dropColumn;
    @Nullable
    private final String postgisGeometry;
    @Nullable
    private final String referenceType;
    private final boolean many;
    @Nonnull
    private final ImmutableMap<String, FieldDescriptor> nestedFields;
    @Nullable
    private final String description;

    private FieldDescriptor(@Nonnull Builder builder) {
        this.kind = builder.kind;
        this.indexed = builder.indexed;
        this.dropColumn = builder.dropColumn;
        this.postgisGeometry = builder.postgisGeometry;
        this.referenceType = builder.referenceType;
        this.many = builder.many;
        this.nestedFields = ImmutableMap.copyOf(builder.nestedFields);
        this.description = builder.description;
    }

    @Nonnull
    public static FieldDescriptor of(@Nonnull FieldKind kind) {
        return newBuilder(kind).build();
    }

    @Nonnull
    public static Builder newBuilder(@Nonnull FieldKind kind) {
        return new Builder(kind);
    }

    /**
     * Start a nested field whose sub-fields are the fields of the given record schema.
     *
     * @param record the schema describing the nested record
     * @return a builder for a {@link FieldKind#NESTED} field
     */
    @Nonnull
    public static Builder nested(@Nonnull AnnotationSchema record) {
        return newBuilder(FieldKind.NESTED).setNestedFields(record.getFields());
    }

    @Nonnull
    public FieldKind getKind() {
        return kind;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public boolean isDropColumn() {
        return dropColumn;
    }

    @Nullable
    public String getPostgisGeometry() {
        return postgisGeometry;
    }

    @Nullable
    public String getReferenceType() {
        return referenceType;
    }

    public boolean isMany() {
        return many;
    }

    @Nonnull
    public Map<String, FieldDescriptor> getNestedFields() {
        return nestedFields;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldDescriptor that = (FieldDescriptor)o;
        return kind == that.kind
               && indexed == that.indexed
               && dropColumn == that.dropColumn
               && many == that.many
               && Objects.equals(postgisGeometry, that.postgisGeometry)
               && Objects.equals(referenceType, that.referenceType)
               && nestedFields.equals(that.nestedFields)
               && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, indexed, dropColumn, postgisGeometry, referenceType, many, nestedFields, description);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (indexed) {
            sb.append(" indexed");
        }
        if (dropColumn) {
            sb.append(" dropped");
        }
        if (postgisGeometry != null) {
            sb.append(" geometry=").append(postgisGeometry);
        }
        if (referenceType != null) {
            sb.append(" references=").append(referenceType);
        }
        if (many) {
            sb.append(" many");
        }
        if (!nestedFields.isEmpty()) {
            sb.append(' ').append(nestedFields);
        }
        return sb.toString();
    }

    /**
     * A builder for {@link FieldDescriptor}.
     */
    public static class Builder {
        @Nonnull
        private final FieldKind kind;
        private boolean indexed;
        private boolean dropColumn;
        @Nullable
        private String postgisGeometry;
        @Nullable
        private String referenceType;
        private boolean many;
        @Nonnull
        private final Map<String, FieldDescriptor> nestedFields = new LinkedHashMap<>();
        @Nullable
        private String description;

        private Builder(@Nonnull FieldKind kind) {
            this.kind = kind;
        }

        @Nonnull
        public Builder setIndexed(boolean indexed) {
            this.indexed = indexed;
            return this;
        }

        @Nonnull
        public Builder setDropColumn(boolean dropColumn) {
            this.dropColumn = dropColumn;
            return this;
        }

        @Nonnull
        public Builder setPostgisGeometry(@Nullable String postgisGeometry) {
            this.postgisGeometry = postgisGeometry;
            return this;
        }

        @Nonnull
        public Builder setReferenceType(@Nullable String referenceType) {
            this.referenceType = referenceType;
            return this;
        }

        @Nonnull
        public Builder setMany(boolean many) {
            this.many = many;
            return this;
        }

        @Nonnull
        public Builder setDescription(@Nullable String description) {
            this.description = description;
            return this;
        }

        @Nonnull
        public Builder setNestedFields(@Nonnull Map<String, FieldDescriptor> fields) {
            nestedFields.clear();
            fields.forEach(this::addNestedField);
            return this;
        }

        @Nonnull
        public Builder addNestedField(@Nonnull String name, @Nonnull FieldDescriptor field) {
            Preconditions.checkArgument(!nestedFields.containsKey(name), "duplicate nested field %s", name);
            nestedFields.put(name, field);
            return this;
        }

        @Nonnull
        public FieldDescriptor build() {
            Preconditions.checkState(kind == FieldKind.NESTED || nestedFields.isEmpty(),
                    "only nested fields can have sub-fields, not %s", kind);
            return new FieldDescriptor(this);
        }
    }
}
