/*
 * LoggableException.java
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

package io.emschema.util;

import io.emschema.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unchecked exception that carries structured context as key/value pairs alongside its message.
 *
 * <p>
 * The message stays a short, static description of what went wrong ("nested field not supported"),
 * while the details that differ between occurrences (the dataset, the table, the field) travel as
 * log info. Loggers can then render the pairs as {@code key="value"} so that all occurrences of one
 * failure are easy to find and aggregate. Pairs are kept in the order they were added; adding a key
 * a second time replaces its value.
 * </p>
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException {
    private static final Object[] NO_LOG_INFO = new Object[0];

    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with a message and an initial flattened list of key/value pairs.
     *
     * @param msg static description of the failure
     * @param keyValues alternating keys and values
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     * @see #addLogInfo(Object...)
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nonnull Throwable cause) {
        super(cause);
    }

    /**
     * The log info attached to this exception.
     *
     * @return an unmodifiable view of the key/value pairs, in insertion order
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Attach one key/value pair.
     *
     * @param description the key
     * @param value the value, which may be {@code null}
     * @return this exception
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull String description, @Nullable Object value) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, value);
        return this;
    }

    /**
     * Attach a flattened list of pairs: even positions are keys (converted with {@link String#valueOf(Object)}),
     * odd positions are the values of the key before them. This is the format produced by {@link #exportLogInfo()}.
     *
     * @param keyValues alternating keys and values
     * @return this exception
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            addLogInfo(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return this;
    }

    /**
     * Flatten the log info into alternating keys and values, suitable for passing back to
     * {@link #addLogInfo(Object...)} or to a key/value log message builder.
     *
     * @return the flattened pairs
     */
    @Nonnull
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return NO_LOG_INFO;
        }
        final Object[] exported = new Object[logInfo.size() * 2];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exported[i++] = entry.getKey();
            exported[i++] = entry.getValue();
        }
        return exported;
    }
}
