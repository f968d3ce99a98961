/*
 * DdlGeneratorTest.java
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

package io.emschema.models.ddl;

import io.emschema.models.compiler.ModelCompiler;
import io.emschema.models.metadata.ColumnType;
import io.emschema.models.metadata.TableDefinition;
import io.emschema.models.schema.BuiltInSchemas;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link DdlGenerator}.
 */
public class DdlGeneratorTest {
    private final ModelCompiler compiler = new ModelCompiler();

    @Test
    public void root() {
        TableDefinition root = compiler.compileRoot("pinky", 1);
        assertEquals("CREATE TABLE \"pinky_cellsegment_v1\" (\n"
                     + "    \"id\" NUMERIC NOT NULL,\n"
                     + "    PRIMARY KEY (\"id\")\n"
                     + ")", DdlGenerator.createTable(root));
        assertThat(DdlGenerator.createIndexes(root), hasSize(0));
    }

    @Test
    public void referenceTable() {
        TableDefinition table = compiler.compile("pinky", "boutons", BuiltInSchemas.PRESYNAPTIC_BOUTON_TYPE, 1);
        assertEquals("CREATE TABLE \"pinky_boutons_v1\" (\n"
                     + "    \"id\" NUMERIC NOT NULL,\n"
                     + "    \"valid\" BOOLEAN,\n"
                     + "    \"target_id\" INTEGER,\n"
                     + "    \"bouton_type\" VARCHAR,\n"
                     + "    PRIMARY KEY (\"id\"),\n"
                     + "    FOREIGN KEY (\"target_id\") REFERENCES \"pinky_synapse\" (\"id\")\n"
                     + ")", DdlGenerator.createTable(table));
    }

    @Test
    public void synapse() {
        TableDefinition table = compiler.compile("pinky", "synapse", BuiltInSchemas.SYNAPSE, 1);
        String ddl = DdlGenerator.createTable(table);
        assertThat(ddl, containsString("\"pre_pt_position\" geometry(POINTZ),"));
        assertThat(ddl, containsString("\"size\" FLOAT,\n"));
        assertThat(ddl, containsString("FOREIGN KEY (\"post_pt_root_id\") REFERENCES \"pinky_cellsegment_v1\" (\"id\")"));

        List<String> indexes = DdlGenerator.createIndexes(table);
        assertThat(indexes, hasSize(7));
        assertEquals("CREATE INDEX \"idx_pinky_synapse_v1_pre_pt_position\" ON \"pinky_synapse_v1\" USING GIST (\"pre_pt_position\")",
                indexes.get(0));
        assertEquals("CREATE INDEX \"ix_pinky_synapse_v1_pre_pt_supervoxel_id\" ON \"pinky_synapse_v1\" (\"pre_pt_supervoxel_id\")",
                indexes.get(1));
    }

    @Test
    public void createAll() {
        TableDefinition table = compiler.compile("pinky", "cells", BuiltInSchemas.CELL_TYPE_LOCAL, 0);
        List<String> statements = DdlGenerator.createAll(table);
        assertThat(statements, hasSize(5));
        assertThat(statements.get(0), containsString("CREATE TABLE \"pinky_cells_v0\""));
        for (String statement : statements) {
            assertThat(statement.charAt(statement.length() - 1), is(';'));
        }
    }

    @Test
    public void types() {
        assertThat(List.of(
                DdlGenerator.sqlType(ColumnType.NUMERIC),
                DdlGenerator.sqlType(ColumnType.INTEGER),
                DdlGenerator.sqlType(ColumnType.FLOAT),
                DdlGenerator.sqlType(ColumnType.STRING),
                DdlGenerator.sqlType(ColumnType.BOOLEAN),
                DdlGenerator.sqlType(ColumnType.geometry("POINT", 2))),
                contains("NUMERIC", "INTEGER", "FLOAT", "VARCHAR", "BOOLEAN", "geometry(POINT)"));
    }

    @Test
    public void quoting() {
        assertEquals("\"a\"\"b\"", DdlGenerator.quote("a\"b"));
    }
}
