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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.hangar.ReconciliationException;
import com.cinchapi.hangar.schema.Schema;
import com.cinchapi.hangar.store.CatalogEntry;
import com.cinchapi.hangar.store.IndexStore;
import com.cinchapi.hangar.store.OperationException;
import com.cinchapi.hangar.store.StoreException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Makes sure that every {@link IndexCompiler#compile(Schema) canonical index}
 * of a {@link Schema} exists in its collection.
 * <p>
 * The reconciler only ever creates indexes. It reads the catalog of the
 * collection once per call and creates the indexes that are missing from it,
 * so calling it again is harmless. Indexes that exist but are no longer
 * declared are left alone.
 * </p>
 */
public final class IndexReconciler {

    private static final Logger log = LoggerFactory
            .getLogger(IndexReconciler.class);

    /**
     * The standalone index on the discriminator.
     */
    private static final IndexSpec DISCRIMINATOR_INDEX = IndexSpec
            .of(IndexKey.ascending(Schema.DISCRIMINATOR_KEY));

    /**
     * The keys of the index that the backing store always maintains on the
     * primary key.
     */
    private static final List<IndexKey> PRIMARY_KEY_INDEX_KEYS = ImmutableList
            .of(IndexKey.ascending(Schema.PRIMARY_KEY));

    /**
     * Create the indexes of {@code schema} that are missing from its
     * collection in {@code store}.
     * <p>
     * Nothing happens if {@code autoCreateIndex} is {@code false}, if the
     * schema has disabled automatic index creation or if the schema is
     * abstract or embedded.
     * </p>
     *
     * @param schema
     * @param store
     * @param autoCreateIndex the connection-wide switch for automatic index
     *            creation
     * @return the specs of the indexes that were created
     * @throws ReconciliationException if an index is declared with options
     *             that conflict with an existing index or the store fails to
     *             list or create the indexes
     */
    public static List<IndexSpec> ensureIndexes(Schema schema,
            IndexStore store, boolean autoCreateIndex) {
        if(schema.isAbstract() || schema.isEmbedded()) {
            return ImmutableList.of();
        }
        else if(!autoCreateIndex || !schema.isAutoCreateIndex()) {
            if(!schema.indexes().isEmpty()) {
                log.warn("Not creating the indexes of {} because automatic "
                        + "index creation is disabled", schema.name());
            }
            return ImmutableList.of();
        }
        String collection = schema.collection();
        List<IndexSpec> required = requiredIndexes(schema);
        List<CatalogEntry> catalog;
        try {
            catalog = store.catalog(collection);
        }
        catch (StoreException | OperationException e) {
            throw new ReconciliationException(collection, null,
                    AnyStrings.format("Unable to read the indexes of {} in {}",
                            schema.name(), collection),
                    e);
        }
        List<IndexSpec> created = Lists.newArrayList();
        for (IndexSpec spec : required) {
            if(spec.keys().equals(PRIMARY_KEY_INDEX_KEYS)) {
                log.debug("Skipping {} in {} because the primary key is "
                        + "always indexed", spec, collection);
                continue;
            }
            CatalogEntry existing = find(catalog, spec);
            if(existing != null && existing.matches(spec)) {
                log.debug("The index {} already exists in {}", spec,
                        collection);
            }
            else if(existing != null) {
                throw new ReconciliationException(collection, spec,
                        AnyStrings.format(
                                "The index {} of {} conflicts with the existing index {} in {}",
                                spec, schema.name(), existing, collection));
            }
            else {
                IndexSpec create = spec;
                if(schema.indexBackground()) {
                    create = spec.withOptions(spec.options().toBuilder()
                            .background(true).build());
                }
                try {
                    store.createIndex(collection, create);
                }
                catch (StoreException | OperationException e) {
                    throw new ReconciliationException(collection, create,
                            AnyStrings.format(
                                    "Unable to create the index {} of {} in {}",
                                    create, schema.name(), collection),
                            e);
                }
                log.info("Created the index {} in {}", create.name(),
                        collection);
                created.add(create);
            }
        }
        return created;
    }

    /**
     * Return the canonical specs of {@code schema} followed, if needed, by the
     * standalone discriminator index.
     *
     * @param schema
     * @return the specs that must exist
     */
    private static List<IndexSpec> requiredIndexes(Schema schema) {
        List<IndexSpec> specs = IndexCompiler.compile(schema);
        if(schema.isPolymorphic() && schema.indexCls()) {
            for (IndexSpec spec : specs) {
                if(spec.startsWith(Schema.DISCRIMINATOR_KEY)) {
                    return specs;
                }
            }
            return ImmutableList.<IndexSpec> builder().addAll(specs)
                    .add(DISCRIMINATOR_INDEX).build();
        }
        else {
            return specs;
        }
    }

    /**
     * Return the entry in {@code catalog} that has the same name or the same
     * keys as {@code spec}, or {@code null}.
     *
     * @param catalog
     * @param spec
     * @return the matching entry or {@code null}
     */
    private static CatalogEntry find(List<CatalogEntry> catalog,
            IndexSpec spec) {
        for (CatalogEntry entry : catalog) {
            if(entry.hasKeys(spec) || entry.name().equals(spec.name())) {
                return entry;
            }
        }
        return null;
    }

    private IndexReconciler() {/* no-init */}

}
