/*
 * TableNamesTest.java
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

package io.emschema.models.naming;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TableNames}.
 */
public class TableNamesTest {
    @Test
    public void encode() {
        assertEquals("pinky_synapse_table_v1", TableNames.encode("pinky", "synapse_table", 1));
        assertEquals("pinky_cellsegment_v0", TableNames.encode("pinky", "cellsegment", 0));
    }

    @Test
    public void encodeNegativeVersion() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.encode("pinky", "synapse", -1));
    }

    @ParameterizedTest(name = "decodeEncoded[version={0}]")
    @ValueSource(ints = {0, 1, 9, 10, 123, Integer.MAX_VALUE})
    public void decodeEncoded(int version) {
        assertEquals(version, TableNames.decodeVersion(TableNames.encode("test_dataset", "cell_type_local", version)));
    }

    @Test
    public void decodeUsesLastSegment() {
        assertEquals(7, TableNames.decodeVersion("a_v2_b_v7"));
    }

    @ParameterizedTest(name = "decodeMalformed[{0}]")
    @ValueSource(strings = {"pinky_synapse", "pinky_synapse_v", "pinky_synapse_vx", "pinky_synapse_1", "pinky_synapse_v1_", "", "v-1"})
    public void decodeMalformed(String name) {
        MalformedNameException e = assertThrows(MalformedNameException.class, () -> TableNames.decodeVersion(name));
        assertEquals(name, e.getLogInfo().get("canonical_name"));
    }

    @Test
    public void decodeOutOfRange() {
        MalformedNameException e = assertThrows(MalformedNameException.class,
                () -> TableNames.decodeVersion("pinky_synapse_v99999999999"));
        assertThat(e.getMessage(), containsString("out of range"));
        assertEquals(NumberFormatException.class, e.getCause().getClass());
    }

    @Test
    public void nextVersionWithoutTables() {
        assertEquals(0, TableNames.nextVersion(Collections.emptyList(), "pinky"));
    }

    @Test
    public void nextVersionIgnoresOtherDatasets() {
        List<String> names = Arrays.asList("pinky_synapse_v1", "pinky_cellsegment_v3", "basil_synapse_v8");
        assertEquals(4, TableNames.nextVersion(names, "pinky"));
        assertEquals(9, TableNames.nextVersion(names, "basil"));
        assertEquals(0, TableNames.nextVersion(names, "other"));
    }

    @Test
    public void nextVersionFromSource() {
        TableNameSource source = () -> Arrays.asList("pinky_synapse_v2", "pinky_contact_v2");
        assertEquals(3, TableNames.nextVersion(source, "pinky"));
    }

    @Test
    public void nextVersionMalformedName() {
        List<String> names = Arrays.asList("pinky_synapse_v1", "pinky_spatial_ref_sys");
        assertThrows(MalformedNameException.class, () -> TableNames.nextVersion(names, "pinky"));
    }

    @Test
    public void nextVersionAfterLargestVersion() {
        List<String> names = Arrays.asList("pinky_synapse_v3", TableNames.encode("pinky", "cells", Integer.MAX_VALUE));
        MalformedNameException e = assertThrows(MalformedNameException.class, () -> TableNames.nextVersion(names, "pinky"));
        assertEquals(ArithmeticException.class, e.getCause().getClass());
        assertEquals("pinky", e.getLogInfo().get("dataset"));
        assertEquals(Integer.MAX_VALUE, e.getLogInfo().get("version"));
        assertEquals(Integer.MAX_VALUE, TableNames.nextVersion(
                Collections.singletonList(TableNames.encode("pinky", "cells", Integer.MAX_VALUE - 1)), "pinky"));
    }
}
