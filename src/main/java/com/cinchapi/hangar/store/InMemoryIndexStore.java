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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.ThreadSafe;

import org.bson.types.ObjectId;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.hangar.index.IndexKey;
import com.cinchapi.hangar.index.IndexOptions;
import com.cinchapi.hangar.index.IndexSpec;
import com.cinchapi.hangar.schema.Schema;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * An {@link IndexStore} that keeps its collections in memory.
 * <p>
 * Every collection is created with the primary key index {@code _id_}, the
 * first time an index or a document is added to it. Documents that are
 * {@link #insert(String, Map) inserted} are checked against every unique
 * index of their collection, following the semantics of a document database:
 * values inside lists are indexed individually, a document that lacks the
 * field of a sparse index is not indexed and a missing field is otherwise
 * indexed as {@code null}.
 * </p>
 */
@ThreadSafe
public class InMemoryIndexStore implements IndexStore {

    /**
     * The name of the index that every collection has on its primary key.
     */
    public static final String PRIMARY_KEY_INDEX = Schema.PRIMARY_KEY + "_";

    /**
     * Stands in for a {@code null} or missing value, since key tuples cannot
     * contain {@code null}.
     */
    private static final Object MISSING = new Object() {

        @Override
        public String toString() {
            return "null";
        }

    };

    private static final Splitter PATH_SPLITTER = Splitter.on('.');

    /**
     * The collections, by name.
     */
    private final Map<String, StoredCollection> collections = Maps
            .newHashMap();

    @Override
    public synchronized List<CatalogEntry> catalog(String collection) {
        StoredCollection stored = collections.get(collection);
        return stored == null ? ImmutableList.of()
                : ImmutableList.copyOf(stored.indexes.values());
    }

    /**
     * Return the names of the collections that exist.
     *
     * @return the collection names
     */
    public synchronized Set<String> collections() {
        return ImmutableSet.copyOf(collections.keySet());
    }

    @Override
    public synchronized void createIndex(String collection, IndexSpec spec) {
        StoredCollection stored = collection(collection);
        CatalogEntry existing = stored.indexes.get(spec.name());
        if(existing != null) {
            if(existing.matches(spec)) {
                return;
            }
            else {
                throw new IndexConflictException(AnyStrings.format(
                        "Index with name: {} already exists with different options: {}",
                        spec.name(), existing));
            }
        }
        for (CatalogEntry entry : stored.indexes.values()) {
            if(entry.hasKeys(spec)) {
                if(entry.matches(spec)) {
                    return;
                }
                else {
                    throw new IndexConflictException(AnyStrings.format(
                            "An index with the same keys as {} already exists with different options: {}",
                            spec, entry));
                }
            }
        }
        if(spec.options().unique()) {
            Set<List<Object>> seen = Sets.newHashSet();
            for (Map<String, Object> document : stored.documents) {
                for (List<Object> tuple : tuples(document, spec)) {
                    if(!seen.add(tuple)) {
                        throw new StoreException(AnyStrings.format(
                                "Cannot build unique index {} in {} because of duplicate key {}",
                                spec.name(), collection, tuple));
                    }
                }
            }
        }
        stored.indexes.put(spec.name(), CatalogEntry.of(spec));
    }

    /**
     * Return the number of documents in {@code collection}.
     *
     * @param collection
     * @return the document count
     */
    public synchronized int count(String collection) {
        StoredCollection stored = collections.get(collection);
        return stored == null ? 0 : stored.documents.size();
    }

    /**
     * Drop {@code collection} along with its documents and indexes.
     *
     * @param collection
     * @return {@code true} if the collection existed
     */
    public synchronized boolean dropCollection(String collection) {
        return collections.remove(collection) != null;
    }

    /**
     * Insert {@code document} into {@code collection}, assigning a primary
     * key if it doesn't have one.
     *
     * @param collection
     * @param document
     * @return the primary key of the inserted document
     * @throws DuplicateKeyException if the document violates a unique index
     */
    public synchronized Object insert(String collection,
            Map<String, ?> document) {
        StoredCollection stored = collection(collection);
        Map<String, Object> copy = Maps.newLinkedHashMap(document);
        copy.putIfAbsent(Schema.PRIMARY_KEY, new ObjectId());
        for (CatalogEntry entry : stored.indexes.values()) {
            boolean unique = entry.options().unique()
                    || entry.name().equals(PRIMARY_KEY_INDEX);
            if(unique) {
                IndexSpec spec = IndexSpec.of(entry.keys(), entry.options());
                Set<List<Object>> tuples = tuples(copy, spec);
                for (Map<String, Object> other : stored.documents) {
                    Set<List<Object>> duplicates = Sets.intersection(tuples,
                            tuples(other, spec));
                    if(!duplicates.isEmpty()) {
                        throw new DuplicateKeyException(AnyStrings.format(
                                "E11000 duplicate key error collection: {} index: {} dup key: {}",
                                collection, entry.name(),
                                duplicates.iterator().next()));
                    }
                }
            }
        }
        stored.documents.add(copy);
        return copy.get(Schema.PRIMARY_KEY);
    }

    /**
     * Return the collection called {@code name}, creating it if necessary.
     *
     * @param name
     * @return the collection
     */
    private StoredCollection collection(String name) {
        return collections.computeIfAbsent(name,
                ignore -> new StoredCollection());
    }

    /**
     * Return the key tuples under which {@code document} is indexed by
     * {@code spec}. A document that isn't indexed has no tuples.
     *
     * @param document
     * @param spec
     * @return the key tuples
     */
    private static Set<List<Object>> tuples(Map<String, Object> document,
            IndexSpec spec) {
        List<Set<Object>> values = Lists.newArrayList();
        boolean present = false;
        for (IndexKey key : spec.keys()) {
            Set<Object> collected = Sets.newLinkedHashSet();
            collect(document, PATH_SPLITTER.splitToList(key.key()), 0,
                    collected);
            present |= !collected.isEmpty();
            if(collected.isEmpty()) {
                collected.add(MISSING);
            }
            values.add(collected);
        }
        if(spec.options().sparse() && !present) {
            return ImmutableSet.of();
        }
        else {
            return Sets.cartesianProduct(values);
        }
    }

    /**
     * Collect the values that are stored under {@code path} (starting at
     * {@code index}) in {@code value}. Lists are expanded so that each of
     * their items is collected on its own.
     *
     * @param value
     * @param path
     * @param index
     * @param collected
     */
    private static void collect(Object value, List<String> path, int index,
            Set<Object> collected) {
        if(value instanceof Collection && !((Collection<?>) value).isEmpty()) {
            for (Object item : (Collection<?>) value) {
                collect(item, path, index, collected);
            }
        }
        else if(index == path.size()) {
            collected.add(value == null ? MISSING : value);
        }
        else if(value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            String segment = path.get(index);
            if(map.containsKey(segment)) {
                collect(map.get(segment), path, index + 1, collected);
            }
        }
    }

    /**
     * The indexes and documents of a collection.
     */
    private static final class StoredCollection {

        private final Map<String, CatalogEntry> indexes = Maps
                .newLinkedHashMap();
        private final List<Map<String, Object>> documents = Lists
                .newArrayList();

        StoredCollection() {
            indexes.put(PRIMARY_KEY_INDEX, CatalogEntry.of(PRIMARY_KEY_INDEX,
                    ImmutableList.of(IndexKey.ascending(Schema.PRIMARY_KEY)),
                    IndexOptions.defaults()));
        }
    }

}
