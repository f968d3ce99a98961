/*
 * DuplicateColumnPolicy.java
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

import io.emschema.annotation.API;

/**
 * What the {@link ModelCompiler} does when two columns of a table end up with the same name.
 */
@API(API.Status.UNSTABLE)
public enum DuplicateColumnPolicy {
    /**
     * The later column replaces the earlier one, keeping the earlier one's position. This is how the foreign key
     * of a reference schema supersedes the plain {@code target_id} column flattened from its fields.
     */
    REPLACE,
    /**
     * Fail with an {@link io.emschema.models.metadata.InvalidSchemaFieldException}.
     */
    REJECT
}
