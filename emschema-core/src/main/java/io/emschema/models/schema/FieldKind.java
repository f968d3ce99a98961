/*
 * FieldKind.java
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

/**
 * The closed set of field kinds a schema field can have.
 *
 * <p>
 * Only some of them can be stored: the scalar kinds have a column type (see
 * {@link io.emschema.models.metadata.TypeMappings}) and {@link #NESTED} records are flattened into one column per
 * sub-field. {@link #LIST}, {@link #DATETIME} and {@link #DICT} are accepted by the schema layer but have no
 * storage mapping, so a schema using them at a stored position cannot be compiled. A {@code LIST} sub-field
 * carrying a geometry tag is the exception, since the tag decides its column type.
 * </p>
 */
@API(API.Status.UNSTABLE)
public enum FieldKind {
    /** Exact numeric value, such as a 64-bit segment id. */
    NUMERIC,
    INTEGER,
    FLOAT,
    STRING,
    BOOLEAN,
    /** Integer id of a row of another entity type, named by the field's reference type. */
    REFERENCE,
    /** A record of sub-fields. */
    NESTED,
    LIST,
    DATETIME,
    DICT
}
