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

import javax.annotation.Nullable;

import com.cinchapi.hangar.index.IndexSpec;

/**
 * A {@link ReconciliationException} is thrown when the indexes that a schema
 * requires cannot be created in its collection.
 */
@SuppressWarnings("serial")
public class ReconciliationException extends RuntimeException {

    /**
     * The index that could not be created, or {@code null} if the failure
     * happened before any index was attempted.
     */
    @Nullable
    private final IndexSpec spec;

    /**
     * The collection in which the index should have been created.
     */
    private final String collection;

    /**
     * Construct a new instance.
     *
     * @param collection
     * @param spec
     * @param message
     */
    public ReconciliationException(String collection,
            @Nullable IndexSpec spec, String message) {
        super(message);
        this.collection = collection;
        this.spec = spec;
    }

    /**
     * Construct a new instance.
     *
     * @param collection
     * @param spec
     * @param message
     * @param cause
     */
    public ReconciliationException(String collection,
            @Nullable IndexSpec spec, String message, Throwable cause) {
        super(message, cause);
        this.collection = collection;
        this.spec = spec;
    }

    /**
     * Return the collection in which the index should have been created.
     *
     * @return the collection name
     */
    public String collection() {
        return collection;
    }

    /**
     * Return the index that could not be created.
     *
     * @return the {@link IndexSpec}, or {@code null} if the existing indexes
     *         could not be read
     */
    @Nullable
    public IndexSpec spec() {
        return spec;
    }

}
