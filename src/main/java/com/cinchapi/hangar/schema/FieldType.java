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
package com.cinchapi.hangar.schema;

/**
 * The kinds of values a {@link FieldDescriptor} can hold, as far as index
 * compilation is concerned.
 */
public enum FieldType {

    STRING, INT, LONG, DOUBLE, BOOLEAN, DATETIME, OBJECT,

    /**
     * A list of scalar values.
     */
    LIST,

    /**
     * A free-form map whose keys are not described by any schema.
     */
    DICT,

    /**
     * A single document that is stored inline.
     */
    EMBEDDED,

    /**
     * A list of documents that are stored inline.
     */
    EMBEDDED_LIST,

    /**
     * A link to a document that is stored in another collection.
     */
    REFERENCE,

    /**
     * A coordinate pair that is indexed geospatially.
     */
    GEO_POINT;

    /**
     * Return {@code true} if a field of this type holds one or more inline
     * documents that are described by a nested schema.
     *
     * @return {@code true} if the type is embedded
     */
    public boolean isEmbedded() {
        return this == EMBEDDED || this == EMBEDDED_LIST;
    }

    /**
     * Return {@code true} if a field of this type holds values whose nested
     * keys are not described by a schema, so a path may continue through it
     * without being resolved.
     *
     * @return {@code true} if paths pass through the type unresolved
     */
    public boolean isOpaque() {
        return this == DICT || this == LIST || this == OBJECT
                || this == GEO_POINT;
    }

}
