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
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Configures how a {@link Document} type is stored.
 * <p>
 * A {@link Meta} annotation is inherited by subclasses that don't declare their
 * own, except for {@link #allowInheritance()} and {@link #collection()}, which
 * are only read from the class that declares them.
 * </p>
 */
@Documented
@Inherited
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Meta {

    /**
     * The name of the collection. By default, a root type uses its simple
     * name in {@code lower_underscore} case and a subclass shares the
     * collection of its parent.
     *
     * @return the collection name
     */
    String collection() default "";

    /**
     * Whether the type may be subclassed, in which case each stored document
     * carries a {@code _cls} discriminator and every index is prefixed with
     * it.
     *
     * @return {@code true} if subclasses are allowed
     */
    boolean allowInheritance() default true;

    /**
     * Whether the declared indexes are created when the indexes of the type
     * are ensured.
     *
     * @return {@code true} if indexes are created automatically
     */
    boolean autoCreateIndex() default true;

    /**
     * Whether a standalone {@code _cls} index is created when no other index
     * starts with the discriminator.
     *
     * @return {@code true} if the discriminator is indexed on its own
     */
    boolean indexCls() default true;

    /**
     * Whether indexes are built in the background.
     *
     * @return {@code true} if indexes are built in the background
     */
    boolean indexBackground() default false;

}
