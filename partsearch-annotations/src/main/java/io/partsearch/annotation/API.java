/*
 * API.java
 *
 * This source file is part of the Partitioned Search open source project
 *
 * Copyright 2026 the Partitioned Search project authors
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

package io.partsearch.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, method, constructor or field is for callers outside this project.
 *
 * <p>
 * Annotating a type gives every member of that type the same status unless a member carries its own
 * {@code API} annotation. A status may only move towards {@link Status#STABLE} within a minor release.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the API element.
     * @return the stability status of the annotated element
     */
    Status value();

    /**
     * Stability statuses, ordered from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other modules of this project can reach it. May change in any release.
         */
        INTERNAL,

        /**
         * Scheduled for removal. May be removed in the next minor release.
         */
        DEPRECATED,

        /**
         * New functionality whose shape is still being worked out. May change or disappear without notice.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release, but not before.
         */
        UNSTABLE,

        /**
         * Will not change incompatibly before the next major release.
         */
        STABLE
    }
}
