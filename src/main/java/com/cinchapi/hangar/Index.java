/*
 * Copyright (c) 2013-2026 Cinchapi Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.cinchapi.hangar;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares an index on a {@link Document} or {@link EmbeddedDocument} type.
 * <p>
 * Each field is a dotted path of logical field names that may be prefixed
 * with {@code -} for a descending key, {@code +} for an ascending key (the
 * default) or {@code *} for a geospatial key. {@code pk} and {@code id} refer
 * to the primary key.
 * </p>
 * <ul>
 * <li>{@code @Index("tags")} indexes a single field.</li>
 * <li>{@code @Index({"date", "desc"})} indexes a single field in an explicit
 * direction, because the second element is a direction token ({@code 1},
 * {@code -1}, {@code 2d}, {@code asc} or {@code desc}).</li>
 * <li>{@code @Index({"category", "-date"})} declares a compound index.</li>
 * <li>{@code @Index(fields = {"email"}, unique = true)} declares an index with
 * options. Options require at least one field.</li>
 * </ul>
 * <p>
 * Indexes are inherited by subclasses.
 * </p>
 */
@Documented
@Repeatable(Indexes.class)
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Index {

    /**
     * The indexed fields.
     *
     * @return the fields
     */
    String[] value() default {};

    /**
     * The indexed fields of an index that has options. If empty,
     * {@link #value()} is used.
     *
     * @return the fields
     */
    String[] fields() default {};

    /**
     * Whether the indexed values must be unique.
     *
     * @return {@code true} if the index is unique
     */
    boolean unique() default false;

    /**
     * Whether documents that lack the indexed field are left out of the
     * index. A sparse index can only have one field.
     *
     * @return {@code true} if the index is sparse
     */
    boolean sparse() default false;

    /**
     * The number of seconds after which documents expire, or a negative
     * number if they never do.
     *
     * @return the time to live in seconds
     */
    long expireAfterSeconds() default -1;

    /**
     * Whether the index is built in the background.
     *
     * @return {@code true} if the index is built in the background
     */
    boolean background() default false;

    /**
     * Whether the index is prefixed with the {@code _cls} discriminator when
     * the type allows inheritance.
     *
     * @return {@code false} to never prefix this index
     */
    boolean cls() default true;

}
