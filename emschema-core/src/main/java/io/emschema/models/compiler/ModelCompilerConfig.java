/*
 * ModelCompilerConfig.java
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

package io.emschema.models.compiler;

import com.google.common.base.Preconditions;
import io.emschema.annotation.API;

import javax.annotation.Nonnull;

/**
 * Settings of the {@link ModelCompiler} that are the same for every dataset it compiles.
 */
@API(API.Status.EXPERIMENTAL)
public final class ModelCompilerConfig {
    public static final String DEFAULT_ROOT_TABLE_NAME = "cellsegment";
    public static final String DEFAULT_CONTACT_TABLE_NAME = "contact";
    public static final int DEFAULT_GEOMETRY_DIMENSION = 3;

    private static final ModelCompilerConfig DEFAULT = new ModelCompilerConfigBuilder().build();

    @Nonnull
    private final String rootTableName;
    @Nonnull
    private final String contactTableName;
    private final int geometryDimension;
    @Nonnull
    private final DuplicateColumnPolicy duplicateColumnPolicy;

    private ModelCompilerConfig(@Nonnull ModelCompilerConfigBuilder builder) {
        this.rootTableName = builder.rootTableName;
        this.contactTableName = builder.contactTableName;
        this.geometryDimension = builder.geometryDimension;
        this.duplicateColumnPolicy = builder.duplicateColumnPolicy;
    }

    /**
     * Logical name of the per-dataset table every bound point's {@code root_id} references.
     * @return the root table name
     */
    @Nonnull
    public String getRootTableName() {
        return rootTableName;
    }

    @Nonnull
    public String getContactTableName() {
        return contactTableName;
    }

    public int getGeometryDimension() {
        return geometryDimension;
    }

    @Nonnull
    public DuplicateColumnPolicy getDuplicateColumnPolicy() {
        return duplicateColumnPolicy;
    }

    @Nonnull
    public ModelCompilerConfigBuilder toBuilder() {
        return new ModelCompilerConfigBuilder()
                .setRootTableName(rootTableName)
                .setContactTableName(contactTableName)
                .setGeometryDimension(geometryDimension)
                .setDuplicateColumnPolicy(duplicateColumnPolicy);
    }

    @Nonnull
    public static ModelCompilerConfig getDefault() {
        return DEFAULT;
    }

    @Nonnull
    public static ModelCompilerConfigBuilder newBuilder() {
        return new ModelCompilerConfigBuilder();
    }

    @Override
    public String toString() {
        return "ModelCompilerConfig{root=" + rootTableName + ", contact=" + contactTableName
               + ", geometryDimension=" + geometryDimension + ", duplicates=" + duplicateColumnPolicy + "}";
    }

    /**
     * Builder for {@link ModelCompilerConfig}. Starts from the defaults.
     */
    public static class ModelCompilerConfigBuilder {
        @Nonnull
        private String rootTableName = DEFAULT_ROOT_TABLE_NAME;
        @Nonnull
        private String contactTableName = DEFAULT_CONTACT_TABLE_NAME;
        private int geometryDimension = DEFAULT_GEOMETRY_DIMENSION;
        @Nonnull
        private DuplicateColumnPolicy duplicateColumnPolicy = DuplicateColumnPolicy.REPLACE;

        private ModelCompilerConfigBuilder() {
        }

        @Nonnull
        public ModelCompilerConfigBuilder setRootTableName(@Nonnull String rootTableName) {
            Preconditions.checkArgument(!rootTableName.isEmpty(), "root table name must not be empty");
            this.rootTableName = rootTableName;
            return this;
        }

        @Nonnull
        public ModelCompilerConfigBuilder setContactTableName(@Nonnull String contactTableName) {
            Preconditions.checkArgument(!contactTableName.isEmpty(), "contact table name must not be empty");
            this.contactTableName = contactTableName;
            return this;
        }

        @Nonnull
        public ModelCompilerConfigBuilder setGeometryDimension(int geometryDimension) {
            Preconditions.checkArgument(geometryDimension >= 2 && geometryDimension <= 4,
                    "geometry dimension must be between 2 and 4: %s", geometryDimension);
            this.geometryDimension = geometryDimension;
            return this;
        }

        @Nonnull
        public ModelCompilerConfigBuilder setDuplicateColumnPolicy(@Nonnull DuplicateColumnPolicy duplicateColumnPolicy) {
            this.duplicateColumnPolicy = duplicateColumnPolicy;
            return this;
        }

        @Nonnull
        public ModelCompilerConfig build() {
            return new ModelCompilerConfig(this);
        }
    }
}
