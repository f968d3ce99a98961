/*
 * LogMessageKeys.java
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

package io.emschema.models.logging;

import io.emschema.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Keys used in {@link KeyValueLogMessage}s and in the log info of exceptions thrown by the schema model compiler.
 * Keeping them in one place makes it easy to spot collisions and keeps spelling consistent across call sites.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // naming
    DATASET,
    TABLE_NAME,
    VERSION,
    CANONICAL_NAME,
    // schemas and fields
    SCHEMA_NAME,
    UNKNOWN_SCHEMAS,
    FIELD_NAME,
    SUB_FIELD_NAME,
    FIELD_KIND,
    REFERENCE_TYPE,
    COLUMN_NAME,
    COLUMN_COUNT,
    // assembly and caching
    DATASET_COUNT,
    TABLE_COUNT,
    CACHE_SIZE,
    COMPILATION_COUNT;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
