/*
 * TableNames.java
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

import com.google.common.base.Preconditions;
import io.emschema.annotation.API;
import io.emschema.models.logging.LogMessageKeys;
import io.emschema.util.StringUtils;

import javax.annotation.Nonnull;

/**
 * Canonical table names.
 *
 * <p>
 * A table is identified by its dataset, its table name within the dataset and a version, and is stored under
 * {@code "{dataset}_{table}_v{version}"}. The version is always the last {@code _}-separated segment, so
 * {@link #decodeVersion(String)} inverts {@link #encode(String, String, int)} as long as the dataset and table
 * names do not themselves end in something that looks like a version. That is left to the caller.
 * </p>
 */
@API(API.Status.MAINTAINED)
public final class TableNames {
    private static final char SEPARATOR = '_';
    private static final char VERSION_PREFIX = 'v';

    private TableNames() {
    }

    /**
     * Build the canonical name of a table.
     *
     * @param dataset the dataset the table belongs to
     * @param tableName the name of the table within the dataset
     * @param version the table version
     * @return {@code "{dataset}_{tableName}_v{version}"}
     * @throws IllegalArgumentException if {@code version} is negative
     */
    @Nonnull
    public static String encode(@Nonnull String dataset, @Nonnull String tableName, int version) {
        Preconditions.checkArgument(version >= 0, "table version must not be negative: %s", version);
        return dataset + SEPARATOR + tableName + SEPARATOR + VERSION_PREFIX + version;
    }

    /**
     * Extract the version from a canonical table name.
     *
     * @param canonicalName a name produced by {@link #encode(String, String, int)}
     * @return the version encoded in the name
     * @throws MalformedNameException if the last segment of the name is not {@code v} followed by digits
     */
    public static int decodeVersion(@Nonnull String canonicalName) {
        final int start = canonicalName.lastIndexOf(SEPARATOR) + 1;
        if (start >= canonicalName.length()
                || canonicalName.charAt(start) != VERSION_PREFIX
                || !StringUtils.isNumeric(canonicalName, start + 1, canonicalName.length())) {
            throw new MalformedNameException("table name does not end in a version",
                    LogMessageKeys.CANONICAL_NAME, canonicalName);
        }
        try {
            return Integer.parseInt(canonicalName.substring(start + 1));
        } catch (NumberFormatException e) {
            throw new MalformedNameException("table version out of range", e)
                    .addLogInfo(LogMessageKeys.CANONICAL_NAME.toString(), canonicalName);
        }
    }

    /**
     * Pick the version for a new generation of a dataset's tables: one more than the highest version among the
     * existing tables whose names contain the dataset name, or {@code 0} if there are none.
     *
     * @param existingNames names of the tables that already exist
     * @param dataset the dataset to pick a version for
     * @return the next free version
     * @throws MalformedNameException if a table name containing the dataset has no decodable version, or if the
     * highest existing version is already the largest representable one
     */
    public static int nextVersion(@Nonnull Iterable<String> existingNames, @Nonnull String dataset) {
        int maxVersion = -1;
        for (String name : existingNames) {
            if (name.contains(dataset)) {
                maxVersion = Math.max(maxVersion, decodeVersion(name));
            }
        }
        try {
            return Math.addExact(maxVersion, 1);
        } catch (ArithmeticException e) {
            throw new MalformedNameException("no table version left after existing version", e)
                    .addLogInfo(LogMessageKeys.DATASET.toString(), dataset)
                    .addLogInfo(LogMessageKeys.VERSION.toString(), maxVersion);
        }
    }

    /**
     * Pick the next version for a dataset from the tables listed by a storage target.
     *
     * @param source lists the existing tables
     * @param dataset the dataset to pick a version for
     * @return the next free version
     * @see #nextVersion(Iterable, String)
     */
    public static int nextVersion(@Nonnull TableNameSource source, @Nonnull String dataset) {
        return nextVersion(source.listTableNames(), dataset);
    }
}
