/*
 * StringUtils.java
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

import com.google.common.base.Preconditions;
import io.emschema.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Utility methods for the identifiers that make up table and model names.
 */
@API(API.Status.UNSTABLE)
public class StringUtils {
    private StringUtils() {
    }

    /**
     * Whether the string is non-empty and made only of ASCII digits.
     *
     * @param s string to test
     * @return whether {@code s} is a non-empty run of digits
     */
    public static boolean isNumeric(@Nonnull String s) {
        return isNumeric(s, 0, s.length());
    }

    /**
     * Whether the substring from {@code beginIndex} (inclusive) to {@code endIndex} (exclusive) is non-empty
     * and made only of ASCII digits. Equivalent to {@code isNumeric(s.substring(beginIndex, endIndex))}
     * without the copy.
     *
     * @param s string to test
     * @param beginIndex first index to test
     * @param endIndex index after the last one to test
     * @return whether the range is a non-empty run of digits
     * @throws IllegalArgumentException if the range is outside of {@code s}
     */
    public static boolean isNumeric(@Nonnull String s, int beginIndex, int endIndex) {
        Preconditions.checkArgument(beginIndex >= 0 && beginIndex <= s.length(),
                "beginIndex should be within bounds");
        Preconditions.checkArgument(endIndex >= beginIndex && endIndex <= s.length(),
                "endIndex should be within bounds");
        if (beginIndex == endIndex) {
            return false;
        }
        for (int i = beginIndex; i < endIndex; i++) {
            final char c = s.charAt(i);
            // Character.isDigit also accepts non-ASCII digits, which Integer.parseInt would then accept too
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * Upper-case the first character and lower-case the rest, so {@code "pinky"} and {@code "PINKY"} both
     * become {@code "Pinky"}.
     *
     * @param s string to capitalize
     * @return the capitalized string, or {@code s} itself if it is empty
     */
    @Nonnull
    public static String capitalize(@Nonnull String s) {
        if (s.isEmpty()) {
            return s;
        }
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}
