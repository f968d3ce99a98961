/*
 * package-info.java
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

/**
 * Compiles annotation schemas into relational table definitions.
 *
 * <p>
 * The entry point is {@link io.emschema.models.assembly.DatasetAssembler}, which validates the requested schema
 * names against a {@link io.emschema.models.schema.SchemaRegistry}, compiles each schema with a
 * {@link io.emschema.models.compiler.ModelCompiler} and keeps the results in a
 * {@link io.emschema.models.cache.ModelCache}, so that a table is compiled once per dataset, table name and
 * version. All failures are reported as subclasses of {@link io.emschema.models.SchemaModelException}.
 * </p>
 */
package io.emschema.models;
