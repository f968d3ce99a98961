/*
 * SchemaModelException.java
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

import io.emschema.annotation.API;
import io.emschema.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base of every exception thrown while turning annotation schemas into table definitions.
 * Callers that do not care which step failed can catch this one type.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class SchemaModelException extends LoggableException {
    public SchemaModelException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public SchemaModelException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    @Nonnull
    @Override
    public SchemaModelException addLogInfo(@Nonnull String description, @Nullable Object value) {
        super.addLogInfo(description, value);
        return this;
    }

    @Nonnull
    @Override
    public SchemaModelException addLogInfo(@Nonnull Object... keyValues) {
        super.addLogInfo(keyValues);
        return this;
    }
}
