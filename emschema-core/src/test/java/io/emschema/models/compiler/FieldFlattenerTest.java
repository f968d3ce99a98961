/*
 * FieldFlattenerTest.java
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

import io.emschema.models.metadata.ColumnSpec;
import io.emschema.models.metadata.ColumnType;
import io.emschema.models.metadata.InvalidSchemaFieldException;
import io.emschema.models.metadata.UnsupportedFieldTypeException;
import io.emschema.models.schema.BuiltInSchemas;
import io.emschema.models.schema.FieldDescriptor;
import io.emschema.models.schema.FieldKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FieldFlattener}.
 */
public class FieldFlattenerTest {
    private final FieldFlattener flattener = new FieldFlattener(ModelCompilerConfig.getDefault());

    private static List<String> names(List<ColumnSpec> columns) {
        return columns.stream().map(ColumnSpec::getName).collect(Collectors.toList());
    }

    @Test
    public void droppedField() {
        FieldDescriptor field = FieldDescriptor.newBuilder(FieldKind.STRING).setDropColumn(true).build();
        assertThat(flattener.flatten("type", field, "pinky", 1), empty());
    }

    @Test
    public void droppedFieldOfUnsupportedKind() {
        FieldDescriptor field = FieldDescriptor.newBuilder(FieldKind.DICT).setDropColumn(true).build();
        assertThat(flattener.flatten("metadata", field, "pinky", 1), empty());
    }

    @Test
    public void scalarField() {
        FieldDescriptor field = FieldDescriptor.newBuilder(FieldKind.STRING).setIndexed(true).build();
        assertThat(flattener.flatten("cell_type", field, "pinky", 1),
                contains(ColumnSpec.of("cell_type", ColumnType.STRING, true)));
        assertThat(flattener.flatten("size", FieldDescriptor.of(FieldKind.FLOAT), "pinky", 1),
                contains(ColumnSpec.of("size", ColumnType.FLOAT, false)));
    }

    @Test
    public void referenceField() {
        FieldDescriptor field = FieldDescriptor.newBuilder(FieldKind.REFERENCE).setReferenceType("synapse").build();
        List<ColumnSpec> columns = flattener.flatten("target_id", field, "pinky", 1);
        assertThat(columns, contains(ColumnSpec.of("target_id", ColumnType.INTEGER, false)));
    }

    @Test
    public void boundSpatialPoint() {
        FieldDescriptor field = FieldDescriptor.nested(BuiltInSchemas.BOUND_SPATIAL_POINT).build();
        List<ColumnSpec> columns = flattener.flatten("pre_pt", field, "pinky", 1);
        assertThat(names(columns), contains("pre_pt_position", "pre_pt_supervoxel_id", "pre_pt_root_id"));

        ColumnSpec position = columns.get(0);
        assertEquals(ColumnType.geometry("POINTZ", 3), position.getType());
        assertTrue(position.isIndexed());
        assertFalse(position.hasForeignKey());

        ColumnSpec supervoxel = columns.get(1);
        assertEquals(ColumnType.NUMERIC, supervoxel.getType());
        assertNull(supervoxel.getForeignKey());

        ColumnSpec rootId = columns.get(2);
        assertEquals(ColumnType.NUMERIC, rootId.getType());
        assertTrue(rootId.isIndexed());
        assertEquals("pinky_cellsegment_v1.id", rootId.getForeignKey());
    }

    @Test
    public void rootIdFollowsConfiguredRootTable() {
        FieldFlattener custom = new FieldFlattener(ModelCompilerConfig.newBuilder()
                .setRootTableName("segment")
                .setGeometryDimension(2)
                .build());
        List<ColumnSpec> columns = custom.flatten("pt", FieldDescriptor.nested(BuiltInSchemas.BOUND_SPATIAL_POINT).build(), "basil", 4);
        assertEquals(ColumnType.geometry("POINTZ", 2), columns.get(0).getType());
        assertEquals("basil_segment_v4.id", columns.get(2).getForeignKey());
    }

    @Test
    public void geometryWinsOverKind() {
        FieldDescriptor field = FieldDescriptor.newBuilder(FieldKind.NESTED)
                .addNestedField("location", FieldDescriptor.newBuilder(FieldKind.STRING).setPostgisGeometry("POINT").build())
                .build();
        List<ColumnSpec> columns = flattener.flatten("pt", field, "pinky", 0);
        assertThat(columns, contains(ColumnSpec.of("pt_location", ColumnType.geometry("POINT", 3), true)));
    }

    @Test
    public void droppedSubField() {
        FieldDescriptor field = FieldDescriptor.newBuilder(FieldKind.NESTED)
                .addNestedField("kept", FieldDescriptor.of(FieldKind.INTEGER))
                .addNestedField("dropped", FieldDescriptor.newBuilder(FieldKind.INTEGER).setDropColumn(true).build())
                .build();
        assertThat(names(flattener.flatten("pt", field, "pinky", 0)), contains("pt_kept"));
    }

    @Test
    public void nestedTwoLevels() {
        FieldDescriptor inner = FieldDescriptor.nested(BuiltInSchemas.SPATIAL_POINT).build();
        FieldDescriptor outer = FieldDescriptor.newBuilder(FieldKind.NESTED)
                .addNestedField("size", FieldDescriptor.of(FieldKind.FLOAT))
                .addNestedField("inner", inner)
                .build();
        InvalidSchemaFieldException e = assertThrows(InvalidSchemaFieldException.class,
                () -> flattener.flatten("outer", outer, "pinky", 1));
        assertEquals("outer", e.getLogInfo().get("field_name"));
        assertEquals("inner", e.getLogInfo().get("sub_field_name"));
    }

    @Test
    public void nestedMany() {
        FieldDescriptor field = FieldDescriptor.nested(BuiltInSchemas.SPATIAL_POINT).setMany(true).build();
        assertThrows(InvalidSchemaFieldException.class, () -> flattener.flatten("pts", field, "pinky", 1));
    }

    @ParameterizedTest(name = "unsupportedTopLevel[{0}]")
    @EnumSource(value = FieldKind.class, names = {"LIST", "DATETIME", "DICT"})
    public void unsupportedTopLevel(FieldKind kind) {
        UnsupportedFieldTypeException e = assertThrows(UnsupportedFieldTypeException.class,
                () -> flattener.flatten("field", FieldDescriptor.of(kind), "pinky", 1));
        assertEquals(kind, e.getKind());
        assertEquals("field", e.getLogInfo().get("field_name"));
    }

    @Test
    public void unsupportedSubField() {
        FieldDescriptor field = FieldDescriptor.newBuilder(FieldKind.NESTED)
                .addNestedField("when", FieldDescriptor.of(FieldKind.DATETIME))
                .build();
        UnsupportedFieldTypeException e = assertThrows(UnsupportedFieldTypeException.class,
                () -> flattener.flatten("pt", field, "pinky", 1));
        assertEquals("when", e.getLogInfo().get("sub_field_name"));
    }

    @Test
    public void unsupportedKindIsLogged() {
        UnsupportedFieldTypeException top = assertThrows(UnsupportedFieldTypeException.class,
                () -> flattener.flatten("metadata", FieldDescriptor.of(FieldKind.DICT), "pinky", 1));
        assertEquals(FieldKind.DICT, top.getLogInfo().get("field_kind"));

        FieldDescriptor field = FieldDescriptor.newBuilder(FieldKind.NESTED)
                .addNestedField("tags", FieldDescriptor.of(FieldKind.LIST))
                .build();
        UnsupportedFieldTypeException sub = assertThrows(UnsupportedFieldTypeException.class,
                () -> flattener.flatten("pt", field, "pinky", 1));
        assertEquals(FieldKind.LIST, sub.getLogInfo().get("field_kind"));
    }
}
