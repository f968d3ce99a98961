/*
 * API.java
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

package io.emschema.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, constructor, field or method of the schema model compiler is for code
 * outside of this repository.
 *
 * <p>
 * A member inherits the status of its enclosing type unless it carries its own {@code API} annotation.
 * Callers that build storage layers on top of the compiled table definitions should prefer elements marked
 * {@link Status#MAINTAINED} or {@link Status#STABLE}.
 * </p>
 *
 * <p>
 * A status may move towards {@link Status#STABLE} at any time. Moving an element towards
 * {@link Status#INTERNAL} requires at least a minor release.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Public only so that another package of this project can reach it. May change without notice.
         */
        INTERNAL,

        /**
         * Scheduled for removal. Will not be removed before the next minor release.
         */
        DEPRECATED,

        /**
         * Under active development. May change or disappear without notice.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release, but not before it.
         */
        UNSTABLE,

        /**
         * Kept source compatible within a minor release line.
         */
        MAINTAINED,

        /**
         * Kept backwards compatible until the next major release.
         */
        STABLE
    }
}
