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
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A marker to indicate that the value for a field should be unique within its
 * collection. A unique index is created for every field with this annotation.
 * <p>
 * By default a {@link Unique} constraint applies to a single field. Use
 * {@link #with()} to make the field unique in combination with other fields,
 * in which case one compound unique index is created that starts with this
 * field. In an {@link EmbeddedDocument}, the constraint applies to the
 * embedding documents under the path of the embedding field.
 * </p>
 */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Unique {

    /**
     * The paths of the sibling fields that, together with this one, must be
     * unique.
     *
     * @return the partner paths
     */
    String[] with() default {};

}
