/*
 * TableDefinitionTest.java
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

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TableDefinition} and its columns.
 */
public class TableDefinitionTest {
    private static TableDefinition.Builder builder() {
        return TableDefinition.newBuilder("pinky_synapse_v1", "PinkySynapse", ColumnSpec.primaryKey("id", ColumnType.NUMERIC));
    }

    @Test
    public void columnsKeepOrder() {
        TableDefinition table = builder()
                .addColumn(ColumnSpec.of("valid", ColumnType.BOOLEAN, false))
                .addColumn(ColumnSpec.of("size", ColumnType.FLOAT, true))
                .build();
        assertThat(table.getColumnNames(), contains("id", "valid", "size"));
        assertEquals("id", table.getPrimaryKey().getName());
        assertFalse(table.getPrimaryKey().isAutoIncrement());
        assertThat(table.getIndexedColumns(), contains(ColumnSpec.of("size", ColumnType.FLOAT, true)));
        assertNull(table.getColumn("missing"));
        assertFalse(table.isConcrete());
        assertNull(table.getPolymorphicIdentity());
    }

    @Test
    public void duplicateColumn() {
        TableDefinition.Builder builder = builder().addColumn(ColumnSpec.of("valid", ColumnType.BOOLEAN, false));
        assertThrows(IllegalArgumentException.class, () -> builder.addColumn(ColumnSpec.of("valid", ColumnType.STRING, false)));
    }

    @Test
    public void replaceKeepsPosition() {
        ColumnSpec fk = ColumnSpec.of("target_id", ColumnType.INTEGER, false).withForeignKey("pinky_synapse.id");
        TableDefinition table = builder()
                .addColumn(ColumnSpec.of("target_id", ColumnType.INTEGER, false))
                .addColumn(ColumnSpec.of("valid", ColumnType.BOOLEAN, false))
                .replaceColumn(fk)
                .build();
        assertThat(table.getColumnNames(), contains("id", "target_id", "valid"));
        assertThat(table.getForeignKeyColumns(), contains(fk));
        assertEquals("pinky_synapse", fk.getForeignKeyTable());
        assertEquals("id", fk.getForeignKeyColumn());
    }

    @Test
    public void primaryKeyCannotBeReplaced() {
        assertThrows(IllegalArgumentException.class,
                () -> builder().replaceColumn(ColumnSpec.of("id", ColumnType.INTEGER, false)));
    }

    @Test
    public void foreignKeyTargetNeedsColumn() {
        ColumnSpec column = ColumnSpec.of("root_id", ColumnType.NUMERIC, true);
        assertThrows(IllegalArgumentException.class, () -> column.withForeignKey("pinky_cellsegment_v1"));
        assertThrows(IllegalArgumentException.class, () -> column.withForeignKey("pinky_cellsegment_v1."));
    }

    @Test
    public void valueEquality() {
        TableDefinition first = builder().addColumn(ColumnSpec.of("valid", ColumnType.BOOLEAN, false)).setConcrete("pinky").build();
        TableDefinition second = builder().addColumn(ColumnSpec.of("valid", ColumnType.BOOLEAN, false)).setConcrete("pinky").build();
        TableDefinition other = builder().addColumn(ColumnSpec.of("valid", ColumnType.BOOLEAN, true)).setConcrete("pinky").build();
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, other);
        assertTrue(first.isConcrete());
        assertEquals("pinky", first.getPolymorphicIdentity());
    }

    @Test
    public void geometryType() {
        ColumnType point = ColumnType.geometry("POINTZ", 3);
        assertTrue(point.isGeometry());
        assertEquals("GEOMETRY(POINTZ, 3)", point.toString());
        assertEquals(point, ColumnType.geometry("POINTZ", 3));
        assertNotEquals(point, ColumnType.geometry("POINTZ", 2));
        assertThrows(IllegalArgumentException.class, () -> ColumnType.geometry("POINTZ", 5));
    }
}
