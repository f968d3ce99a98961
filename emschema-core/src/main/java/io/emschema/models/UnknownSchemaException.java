/*
 * UnknownSchemaException.java
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

package io.emschema.models;

import com.google.common.collect.ImmutableList;
import io.emschema.annotation.API;
import io.emschema.models.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.List;

/**
 * Thrown when one or more requested schema names are not known to the schema registry.
 * The exception lists every unknown name of the request, not just the first one found.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class UnknownSchemaException extends SchemaModelException {
    @Nonnull
    private final List<String> unknownSchemaNames;

    public UnknownSchemaException(@Nonnull Collection<String> unknownSchemaNames) {
        super(unknownSchemaNames + " are invalid types", LogMessageKeys.UNKNOWN_SCHEMAS, unknownSchemaNames);
        this.unknownSchemaNames = ImmutableList.copyOf(unknownSchemaNames);
    }

    /**
     * The names that were requested but are not registered, in request order.
     * @return the unknown schema names
     */
    @Nonnull
    public List<String> getUnknownSchemaNames() {
        return unknownSchemaNames;
    }
}
