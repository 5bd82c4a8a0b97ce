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
package com.cinchapi.hangar.index;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * The canonical form of one index: an ordered sequence of {@link IndexKey
 * keys} and the {@link IndexOptions} the index is built with.
 * <p>
 * Two {@link IndexSpec IndexSpecs} are equal if their keys and options are
 * equal. This equality, rather than the way an index was declared, is what
 * de-duplicates index declarations.
 * </p>
 */
@Immutable
public final class IndexSpec {

    /**
     * Return an {@link IndexSpec} over {@code keys} with the default
     * {@link IndexOptions}.
     *
     * @param keys
     * @return the {@link IndexSpec}
     */
    public static IndexSpec of(IndexKey... keys) {
        return of(ImmutableList.copyOf(keys), IndexOptions.defaults());
    }

    /**
     * Return an {@link IndexSpec} over {@code keys} with the specified
     * {@code options}.
     *
     * @param keys
     * @param options
     * @return the {@link IndexSpec}
     */
    public static IndexSpec of(List<IndexKey> keys, IndexOptions options) {
        return new IndexSpec(keys, options);
    }

    /**
     * Return a unique {@link IndexSpec} over {@code keys}.
     *
     * @param keys
     * @return the {@link IndexSpec}
     */
    public static IndexSpec unique(IndexKey... keys) {
        return of(ImmutableList.copyOf(keys),
                IndexOptions.builder().unique(true).build());
    }

    /**
     * Return the name that the backing store assigns to an index over
     * {@code keys} when no name is given (e.g. {@code _cls_1_name_1}).
     *
     * @param keys
     * @return the default index name
     */
    public static String defaultName(List<IndexKey> keys) {
        return keys.stream().map(key -> key.key() + "_" + key.direction())
                .collect(Collectors.joining("_"));
    }

    private static final Gson GSON = new Gson();

    private final ImmutableList<IndexKey> keys;
    private final IndexOptions options;

    private IndexSpec(List<IndexKey> keys, IndexOptions options) {
        Preconditions.checkArgument(!keys.isEmpty(),
                "An index must have at least one key");
        this.keys = ImmutableList.copyOf(keys);
        this.options = Preconditions.checkNotNull(options);
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof IndexSpec) {
            IndexSpec other = (IndexSpec) obj;
            return keys.equals(other.keys) && options.equals(other.options);
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, options);
    }

    /**
     * Return {@code true} if this index is geospatial, meaning its first key
     * carries a geospatial {@link Direction}.
     *
     * @return {@code true} if the index is geospatial
     */
    public boolean isGeospatial() {
        return keys.get(0).direction().isGeospatial();
    }

    /**
     * Return the ordered keys.
     *
     * @return the keys
     */
    public List<IndexKey> keys() {
        return keys;
    }

    /**
     * Return the {@link #defaultName(List) default name} of this index.
     *
     * @return the name
     */
    public String name() {
        return defaultName(keys);
    }

    /**
     * Return the options.
     *
     * @return the options
     */
    public IndexOptions options() {
        return options;
    }

    /**
     * Return {@code true} if the first key of this index is stored under
     * {@code key}.
     *
     * @param key
     * @return {@code true} if this index starts with {@code key}
     */
    public boolean startsWith(String key) {
        return keys.get(0).key().equals(key);
    }

    @Override
    public String toString() {
        JsonObject json = new JsonObject();
        JsonArray fields = new JsonArray();
        for (IndexKey key : keys) {
            JsonArray pair = new JsonArray();
            pair.add(key.key());
            Object value = key.direction().value();
            if(value instanceof Number) {
                pair.add((Number) value);
            }
            else {
                pair.add(value.toString());
            }
            fields.add(pair);
        }
        json.add("fields", fields);
        if(options.unique()) {
            json.addProperty("unique", true);
        }
        if(options.sparse()) {
            json.addProperty("sparse", true);
        }
        if(options.expireAfterSeconds() != null) {
            json.addProperty("expireAfterSeconds",
                    options.expireAfterSeconds());
        }
        if(options.background()) {
            json.addProperty("background", true);
        }
        return GSON.toJson(json);
    }

    /**
     * Return an {@link IndexSpec} with the same options and {@code key} in
     * front of the existing keys.
     *
     * @param key
     * @return the prefixed {@link IndexSpec}
     */
    public IndexSpec withPrefix(IndexKey key) {
        return of(ImmutableList.<IndexKey> builder().add(key).addAll(keys)
                .build(), options);
    }

    /**
     * Return an {@link IndexSpec} with the same keys and {@code options}.
     *
     * @param options
     * @return the {@link IndexSpec}
     */
    public IndexSpec withOptions(IndexOptions options) {
        return of(keys, options);
    }

}
