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

/**
 * The base class for every type whose instances are stored as top-level
 * documents in a collection.
 * <p>
 * Each concrete subclass is described by a {@link com.cinchapi.hangar.schema.Schema
 * Schema} whose fields are the non-static, non-transient fields declared by the
 * class and its ancestors. Abstract subclasses are abstract schemas: their
 * fields and indexes are inherited, but they have no collection of their own.
 * Use {@link Meta} and {@link Indexes} to configure how a type is stored.
 * </p>
 */
public abstract class Document {

    /**
     * The primary key, which is always stored under {@code _id}.
     */
    @PrimaryKey
    protected Object id;

}
