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
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.hangar.index.Direction;
import com.cinchapi.hangar.index.IndexKey;
import com.cinchapi.hangar.index.IndexOptions;
import com.cinchapi.hangar.index.IndexSpec;
import com.cinchapi.hangar.schema.Schema;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;

/**
 * An {@link IndexStore} that manages the indexes of a MongoDB database
 * through the synchronous driver.
 * <p>
 * Driver failures are translated: an index options or key specs conflict
 * becomes an {@link IndexConflictException}, a duplicate key error becomes a
 * {@link DuplicateKeyException} and anything else becomes a
 * {@link StoreException}.
 * </p>
 */
public class MongoIndexStore implements IndexStore {

    /**
     * The error code for an index that exists under the same name with
     * different options.
     */
    static final int INDEX_OPTIONS_CONFLICT = 85;

    /**
     * The error code for an index that exists with the same name but
     * different keys.
     */
    static final int INDEX_KEY_SPECS_CONFLICT = 86;

    /**
     * The error code for a write that violates a unique index.
     */
    static final int DUPLICATE_KEY = 11000;

    private static final Logger log = LoggerFactory
            .getLogger(MongoIndexStore.class);

    /**
     * Return the exception that describes the driver {@code exception}.
     *
     * @param exception
     * @param message
     * @return the translated exception
     */
    static RuntimeException translate(MongoException exception,
            String message) {
        switch (exception.getCode()) {
        case INDEX_OPTIONS_CONFLICT:
        case INDEX_KEY_SPECS_CONFLICT:
            return new IndexConflictException(message, exception);
        case DUPLICATE_KEY:
            return new DuplicateKeyException(message, exception);
        default:
            return new StoreException(message, exception);
        }
    }

    /**
     * Return the {@link CatalogEntry} that describes the {@code index}
     * document returned by the driver, or {@code null} if the index has a key
     * type that can't be represented (e.g. a text or hashed index).
     *
     * @param index
     * @return the {@link CatalogEntry} or {@code null}
     */
    static CatalogEntry toCatalogEntry(Document index) {
        Document key = index.get("key", Document.class);
        List<IndexKey> keys = Lists.newArrayList();
        for (Map.Entry<String, Object> entry : key.entrySet()) {
            Direction direction = Direction.fromValue(entry.getValue());
            if(direction == null) {
                return null;
            }
            keys.add(IndexKey.of(entry.getKey(), direction));
        }
        Number expireAfterSeconds = index.get("expireAfterSeconds",
                Number.class);
        IndexOptions options = IndexOptions.builder()
                .unique(index.getBoolean("unique", false))
                .sparse(index.getBoolean("sparse", false))
                .expireAfterSeconds(expireAfterSeconds == null ? null
                        : expireAfterSeconds.longValue())
                .background(index.getBoolean("background", false)).build();
        return CatalogEntry.of(index.getString("name"), keys, options);
    }

    /**
     * Return the key document that the driver expects for {@code spec}.
     *
     * @param spec
     * @return the key document
     */
    static Document toKeys(IndexSpec spec) {
        Document keys = new Document();
        for (IndexKey key : spec.keys()) {
            keys.append(key.key(), key.direction().value());
        }
        return keys;
    }

    /**
     * Return the driver options for {@code spec}.
     *
     * @param spec
     * @return the driver options
     */
    static com.mongodb.client.model.IndexOptions toOptions(IndexSpec spec) {
        IndexOptions options = spec.options();
        com.mongodb.client.model.IndexOptions driver = new com.mongodb.client.model.IndexOptions()
                .name(spec.name()).unique(options.unique())
                .sparse(options.sparse()).background(options.background());
        if(options.expireAfterSeconds() != null) {
            driver.expireAfter(options.expireAfterSeconds(), TimeUnit.SECONDS);
        }
        return driver;
    }

    /**
     * The database whose collections are managed.
     */
    private final MongoDatabase database;

    /**
     * Construct a new instance.
     *
     * @param database
     */
    public MongoIndexStore(MongoDatabase database) {
        this.database = Preconditions.checkNotNull(database);
    }

    @Override
    public List<CatalogEntry> catalog(String collection) {
        try {
            ImmutableList.Builder<CatalogEntry> catalog = ImmutableList
                    .builder();
            for (Document index : database.getCollection(collection)
                    .listIndexes()) {
                CatalogEntry entry = toCatalogEntry(index);
                if(entry != null) {
                    catalog.add(entry);
                }
                else {
                    log.debug("Ignoring index {} in {} because its keys "
                            + "cannot be compared", index, collection);
                }
            }
            return catalog.build();
        }
        catch (MongoException e) {
            throw translate(e, AnyStrings.format(
                    "Unable to list the indexes of {}", collection));
        }
    }

    @Override
    public void createIndex(String collection, IndexSpec spec) {
        try {
            database.getCollection(collection).createIndex(toKeys(spec),
                    toOptions(spec));
        }
        catch (MongoException e) {
            throw translate(e, AnyStrings.format(
                    "Unable to create the index {} in {}", spec, collection));
        }
    }

    /**
     * Insert {@code document} into {@code collection}.
     *
     * @param collection
     * @param document
     * @return the primary key of the inserted document
     * @throws DuplicateKeyException if the document violates a unique index
     * @throws StoreException if the document cannot be inserted
     */
    public Object insert(String collection, Map<String, ?> document) {
        MongoCollection<Document> documents = database
                .getCollection(collection);
        Document copy = new Document();
        copy.putAll(document);
        try {
            documents.insertOne(copy);
        }
        catch (MongoException e) {
            throw translate(e, AnyStrings
                    .format("Unable to insert {} into {}", document, collection));
        }
        return copy.get(Schema.PRIMARY_KEY);
    }

}
