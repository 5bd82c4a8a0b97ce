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
package com.cinchapi.hangar.store;

import java.util.List;

import com.cinchapi.hangar.index.IndexSpec;

/**
 * The interface to the index catalog of a document database.
 * <p>
 * Implementations must make {@link #createIndex(String, IndexSpec)}
 * idempotent, since concurrent reconcilers may race to create the same index.
 * </p>
 */
public interface IndexStore {

    /**
     * Return the indexes that currently exist in {@code collection}. A
     * collection that doesn't exist has no indexes.
     *
     * @param collection
     * @return the catalog
     * @throws StoreException if the catalog cannot be read
     */
    public List<CatalogEntry> catalog(String collection);

    /**
     * Create an index for {@code spec} in {@code collection} under the
     * {@link IndexSpec#name() default name}. Creating an index that already
     * exists with the same options does nothing.
     *
     * @param collection
     * @param spec
     * @throws IndexConflictException if an index with the same name or keys
     *             but different options already exists
     * @throws StoreException if the index cannot be created
     */
    public void createIndex(String collection, IndexSpec spec);

}
