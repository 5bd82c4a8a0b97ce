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

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cinchapi.hangar.index.IndexCompiler;
import com.cinchapi.hangar.index.IndexReconciler;
import com.cinchapi.hangar.index.IndexSpec;
import com.cinchapi.hangar.schema.Schema;
import com.cinchapi.hangar.schema.SchemaAnalyzer;
import com.cinchapi.hangar.schema.SchemaRegistry;
import com.cinchapi.hangar.store.InMemoryIndexStore;
import com.cinchapi.hangar.store.IndexStore;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * {@link Hangar} is the controller that maps {@link Document} types onto the
 * collections and indexes of an {@link IndexStore}.
 * <p>
 * Types are {@link #register(Class) registered} before use. The canonical
 * indexes of a type are compiled when it is registered and can be created in
 * the store with {@link #ensureIndexes(Class)}.
 * </p>
 */
public final class Hangar implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Hangar.class);

    /**
     * Return a builder that can be used to precisely configure a
     * {@link Hangar} instance.
     *
     * @return a {@link Hangar} builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The store whose indexes are managed.
     */
    private final IndexStore store;

    /**
     * The connection-wide switch for automatic index creation.
     */
    private final boolean autoCreateIndex;

    /**
     * The registry of all the schemas known to this instance.
     */
    private final SchemaRegistry registry;

    /**
     * Builds and registers the schemas of {@link Document} types.
     */
    private final SchemaAnalyzer analyzer;

    /**
     * A flag that indicates whether this instance has been closed.
     */
    private volatile boolean closed = false;

    /**
     * Construct a new instance.
     *
     * @param store
     * @param autoCreateIndex
     */
    private Hangar(IndexStore store, boolean autoCreateIndex) {
        this.store = store;
        this.autoCreateIndex = autoCreateIndex;
        this.registry = new SchemaRegistry();
        this.analyzer = new SchemaAnalyzer(registry);
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * Create the indexes of every registered, concrete {@link Document} type
     * that are missing from the store.
     *
     * @return a mapping from the name of each schema to the specs of the
     *         indexes that were created for it
     * @throws ReconciliationException if an index cannot be created
     */
    public Map<String, List<IndexSpec>> ensureAllIndexes() {
        checkOpen();
        Map<String, List<IndexSpec>> created = Maps.newLinkedHashMap();
        for (Schema schema : registry.all()) {
            if(schema.collection() == null) {
                continue;
            }
            created.put(schema.name(), IndexReconciler.ensureIndexes(schema,
                    store, autoCreateIndex));
        }
        return created;
    }

    /**
     * Create the indexes of {@code clazz} that are missing from its
     * collection.
     *
     * @param clazz
     * @return the specs of the indexes that were created
     * @throws ReconciliationException if an index cannot be created
     */
    public List<IndexSpec> ensureIndexes(Class<? extends Document> clazz) {
        checkOpen();
        return IndexReconciler.ensureIndexes(schema(clazz), store,
                autoCreateIndex);
    }

    /**
     * Return the canonical geospatial indexes of {@code clazz}.
     *
     * @param clazz
     * @return the geospatial specs
     */
    public List<IndexSpec> geoIndexes(Class<?> clazz) {
        return IndexCompiler.geoIndexes(schema(clazz));
    }

    /**
     * Return the canonical index specs of {@code clazz}.
     *
     * @param clazz
     * @return the index specs
     * @throws ConfigurationException if the declared indexes are invalid
     */
    public List<IndexSpec> indexSpecs(Class<?> clazz) {
        return IndexCompiler.compile(schema(clazz));
    }

    /**
     * Register {@code clazz}, along with its ancestors and the types of its
     * embedded and reference fields.
     *
     * @param clazz a subclass of {@link Document} or {@link EmbeddedDocument}
     * @return the {@link Schema} of {@code clazz}
     * @throws ConfigurationException if {@code clazz} cannot be described by a
     *             valid schema or declares invalid indexes
     */
    public Schema register(Class<?> clazz) {
        checkOpen();
        Schema schema = analyzer.register(clazz);
        log.debug("Registered {} as {}", clazz.getName(), schema);
        return schema;
    }

    /**
     * Register every {@link Document} and {@link EmbeddedDocument} type in
     * {@code packageName} and its subpackages.
     *
     * @param packageName
     * @return the registered schemas
     */
    public List<Schema> registerAll(String packageName) {
        ImmutableList.Builder<Schema> schemas = ImmutableList.builder();
        for (Class<?> clazz : SchemaAnalyzer.scan(packageName)) {
            schemas.add(register(clazz));
        }
        return schemas.build();
    }

    /**
     * Return the {@link Schema} of {@code clazz}, {@link #register(Class)
     * registering} it first if necessary.
     *
     * @param clazz
     * @return the schema
     */
    public Schema schema(Class<?> clazz) {
        Schema schema = analyzer.get(clazz);
        return schema != null ? schema : register(clazz);
    }

    /**
     * Return the {@link IndexStore} that this instance manages.
     *
     * @return the store
     */
    public IndexStore store() {
        return store;
    }

    private void checkOpen() {
        Preconditions.checkState(!closed, "This Hangar has been closed");
    }

    /**
     * Builder for {@link Hangar} instances. This is returned from
     * {@link #builder()}.
     */
    public static class Builder {

        private IndexStore store = null;
        private boolean autoCreateIndex = true;

        /**
         * Set whether indexes are created automatically. If {@code false},
         * {@link Hangar#ensureIndexes(Class)} does nothing.
         *
         * @param autoCreateIndex
         * @return this builder
         */
        public Builder autoCreateIndex(boolean autoCreateIndex) {
            this.autoCreateIndex = autoCreateIndex;
            return this;
        }

        /**
         * Build the configured {@link Hangar} and return the instance.
         *
         * @return a {@link Hangar} instance
         */
        public Hangar build() {
            IndexStore store = this.store != null ? this.store
                    : new InMemoryIndexStore();
            return new Hangar(store, autoCreateIndex);
        }

        /**
         * Set the {@link IndexStore}. By default, an
         * {@link InMemoryIndexStore} is used.
         *
         * @param store
         * @return this builder
         */
        public Builder store(IndexStore store) {
            this.store = Preconditions.checkNotNull(store);
            return this;
        }
    }

}
