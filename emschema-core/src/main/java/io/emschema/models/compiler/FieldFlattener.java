/*
 * FieldFlattener.java
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

import com.google.common.collect.ImmutableList;
import io.emschema.annotation.API;
import io.emschema.models.logging.LogMessageKeys;
import io.emschema.models.metadata.ColumnSpec;
import io.emschema.models.metadata.ColumnType;
import io.emschema.models.metadata.InvalidSchemaFieldException;
import io.emschema.models.metadata.TypeMappings;
import io.emschema.models.metadata.UnsupportedFieldTypeException;
import io.emschema.models.naming.TableNames;
import io.emschema.models.schema.FieldDescriptor;
import io.emschema.models.schema.FieldKind;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * Turns one schema field into the columns that store it.
 *
 * <p>
 * A scalar field becomes a single column of the same name. A nested field becomes one column per sub-field,
 * named {@code field_subfield}. Only one level of nesting is supported. Sub-fields carrying a geometry tag become
 * indexed geometry columns whatever their declared kind, and a sub-field named {@value #ROOT_ID} references the id
 * of the dataset's root table.
 * </p>
 */
@API(API.Status.INTERNAL)
public class FieldFlattener {
    public static final String ROOT_ID = "root_id";
    private static final String PATH_SEPARATOR = "_";

    @Nonnull
    private final ModelCompilerConfig config;

    public FieldFlattener(@Nonnull ModelCompilerConfig config) {
        this.config = config;
    }

    /**
     * Flatten one field.
     *
     * @param fieldName name of the field in its schema
     * @param field the field descriptor
     * @param dataset the dataset the table is compiled for
     * @param version the table version
     * @return the columns in sub-field order, empty for a dropped field
     * @throws InvalidSchemaFieldException if the field nests records more than one level deep or holds many records
     * @throws UnsupportedFieldTypeException if the field, or one of its sub-fields, has no column type
     */
    @Nonnull
    public List<ColumnSpec> flatten(@Nonnull String fieldName, @Nonnull FieldDescriptor field,
                                    @Nonnull String dataset, int version) {
        if (field.isDropColumn()) {
            return ImmutableList.of();
        }
        switch (field.getKind()) {
            case NUMERIC:
            case INTEGER:
            case REFERENCE:
            case FLOAT:
            case STRING:
            case BOOLEAN:
                return ImmutableList.of(ColumnSpec.of(fieldName, TypeMappings.columnTypeFor(field.getKind()), field.isIndexed()));
            case NESTED:
                return flattenNested(fieldName, field, dataset, version);
            default:
                throw new UnsupportedFieldTypeException(field.getKind(),
                        LogMessageKeys.FIELD_NAME, fieldName,
                        LogMessageKeys.FIELD_KIND, field.getKind(),
                        LogMessageKeys.DATASET, dataset);
        }
    }

    @Nonnull
    private List<ColumnSpec> flattenNested(@Nonnull String fieldName, @Nonnull FieldDescriptor field,
                                           @Nonnull String dataset, int version) {
        if (field.isMany()) {
            throw new InvalidSchemaFieldException("nested field with many records cannot be stored as columns",
                    LogMessageKeys.FIELD_NAME, fieldName,
                    LogMessageKeys.DATASET, dataset);
        }
        final ImmutableList.Builder<ColumnSpec> columns = ImmutableList.builder();
        for (Map.Entry<String, FieldDescriptor> entry : field.getNestedFields().entrySet()) {
            final String subFieldName = entry.getKey();
            final FieldDescriptor subField = entry.getValue();
            if (subField.isDropColumn()) {
                continue;
            }
            if (subField.getKind() == FieldKind.NESTED) {
                throw new InvalidSchemaFieldException("nesting depth > 1 not supported",
                        LogMessageKeys.FIELD_NAME, fieldName,
                        LogMessageKeys.SUB_FIELD_NAME, subFieldName,
                        LogMessageKeys.DATASET, dataset);
            }
            final String columnName = fieldName + PATH_SEPARATOR + subFieldName;
            ColumnSpec column;
            if (subField.getPostgisGeometry() != null) {
                column = ColumnSpec.of(columnName,
                        ColumnType.geometry(subField.getPostgisGeometry(), config.getGeometryDimension()), true);
            } else {
                column = ColumnSpec.of(columnName, subFieldType(fieldName, subFieldName, subField), subField.isIndexed());
            }
            if (ROOT_ID.equals(subFieldName)) {
                column = column.withForeignKey(TableNames.encode(dataset, config.getRootTableName(), version) + ".id");
            }
            columns.add(column);
        }
        return columns.build();
    }

    @Nonnull
    private static ColumnType subFieldType(@Nonnull String fieldName, @Nonnull String subFieldName,
                                           @Nonnull FieldDescriptor subField) {
        if (!TypeMappings.isMapped(subField.getKind())) {
            throw new UnsupportedFieldTypeException(subField.getKind(),
                    LogMessageKeys.FIELD_NAME, fieldName,
                    LogMessageKeys.SUB_FIELD_NAME, subFieldName,
                    LogMessageKeys.FIELD_KIND, subField.getKind());
        }
        return TypeMappings.columnTypeFor(subField.getKind());
    }
}
