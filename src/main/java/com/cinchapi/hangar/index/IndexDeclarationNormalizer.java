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

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.hangar.ConfigurationException;
import com.cinchapi.hangar.index.IndexDeclaration.Compound;
import com.cinchapi.hangar.index.IndexDeclaration.DirectedFieldRef;
import com.cinchapi.hangar.index.IndexDeclaration.FieldRef;
import com.cinchapi.hangar.index.IndexDeclaration.OptionsRecord;
import com.cinchapi.hangar.schema.FieldPaths;
import com.cinchapi.hangar.schema.Schema;
import com.google.common.collect.ImmutableList;

/**
 * Converts one {@link IndexDeclaration} into its canonical {@link IndexSpec}.
 * <p>
 * A field path without a prefix (or with a {@code +} prefix) is indexed in
 * ascending order, a {@code -} prefix means descending and a {@code *} prefix
 * means a geospatial index. Every path is resolved to its storage key
 * {@link FieldPaths#resolve(Schema, String) against the schema}.
 * </p>
 */
public final class IndexDeclarationNormalizer {

    /**
     * The prefix that marks an explicitly ascending key.
     */
    static final char ASCENDING_PREFIX = '+';

    /**
     * The prefix that marks a descending key.
     */
    static final char DESCENDING_PREFIX = '-';

    /**
     * The prefix that marks a geospatial key.
     */
    static final char GEO2D_PREFIX = '*';

    /**
     * Return the canonical {@link IndexSpec} for {@code declaration} within
     * {@code schema}. The spec never carries a discriminator prefix.
     *
     * @param schema
     * @param declaration
     * @return the canonical spec
     * @throws ConfigurationException if the declaration is malformed
     */
    public static IndexSpec normalize(Schema schema,
            IndexDeclaration declaration) {
        return normalizeForMerge(schema, declaration).spec();
    }

    /**
     * Perform {@link #normalize(Schema, IndexDeclaration)} and remember if the
     * declaration permits a discriminator prefix.
     *
     * @param schema
     * @param declaration
     * @return the {@link NormalizedIndex}
     */
    static NormalizedIndex normalizeForMerge(Schema schema,
            IndexDeclaration declaration) {
        List<IndexKey> keys;
        IndexOptions options = IndexOptions.defaults();
        boolean discriminable = true;
        switch (declaration.kind()) {
        case FIELD_REF:
        case DIRECTED_FIELD_REF:
            keys = ImmutableList.of(key(schema, declaration));
            break;
        case COMPOUND:
            keys = keys(schema, ((Compound) declaration).elements());
            break;
        case OPTIONS_RECORD:
            OptionsRecord record = (OptionsRecord) declaration;
            if(record.fields() == null || record.fields().isEmpty()) {
                throw new ConfigurationException(AnyStrings.format(
                        "The index {} in {} does not declare any fields",
                        record, schema.name()));
            }
            keys = keys(schema, record.fields());
            options = IndexOptions.builder().unique(record.unique())
                    .sparse(record.sparse())
                    .expireAfterSeconds(record.expireAfterSeconds())
                    .background(record.background()).build();
            if(options.sparse() && keys.size() > 1) {
                throw new ConfigurationException(AnyStrings.format(
                        "The sparse index {} in {} can only have one field",
                        record, schema.name()));
            }
            discriminable = record.cls();
            break;
        default:
            throw new IllegalStateException(
                    "Unsupported declaration kind " + declaration.kind());
        }
        if(keys.size() > 1) {
            for (IndexKey key : keys) {
                if(key.direction().isGeospatial()) {
                    throw new ConfigurationException(AnyStrings.format(
                            "The geospatial key {} in {} cannot be part of a compound index {}",
                            key.key(), schema.name(), declaration));
                }
            }
        }
        return new NormalizedIndex(IndexSpec.of(keys, options), discriminable);
    }

    /**
     * Return the {@link IndexKey} for a single field ref.
     *
     * @param schema
     * @param ref a {@link FieldRef} or {@link DirectedFieldRef}
     * @return the {@link IndexKey}
     */
    private static IndexKey key(Schema schema, IndexDeclaration ref) {
        if(ref instanceof DirectedFieldRef) {
            DirectedFieldRef directed = (DirectedFieldRef) ref;
            String path = directed.path();
            if(isPrefix(path.charAt(0))) {
                throw new ConfigurationException(AnyStrings.format(
                        "The field {} in {} has both a prefix and an explicit direction",
                        path, schema.name()));
            }
            return IndexKey.of(FieldPaths.resolve(schema, path),
                    directed.direction());
        }
        else {
            String path = ((FieldRef) ref).path();
            Direction direction = Direction.ASCENDING;
            char prefix = path.charAt(0);
            if(isPrefix(prefix)) {
                path = path.substring(1);
                if(path.isEmpty() || isPrefix(path.charAt(0))) {
                    throw new ConfigurationException(AnyStrings.format(
                            "Invalid index field {} in {}", ref,
                            schema.name()));
                }
                if(prefix == DESCENDING_PREFIX) {
                    direction = Direction.DESCENDING;
                }
                else if(prefix == GEO2D_PREFIX) {
                    direction = Direction.GEO2D;
                }
            }
            return IndexKey.of(FieldPaths.resolve(schema, path), direction);
        }
    }

    /**
     * Return the {@link IndexKey keys} for a list of field refs.
     *
     * @param schema
     * @param refs
     * @return the keys
     */
    private static List<IndexKey> keys(Schema schema,
            List<IndexDeclaration> refs) {
        ImmutableList.Builder<IndexKey> keys = ImmutableList.builder();
        for (IndexDeclaration ref : refs) {
            keys.add(key(schema, ref));
        }
        return keys.build();
    }

    private static boolean isPrefix(char c) {
        return c == ASCENDING_PREFIX || c == DESCENDING_PREFIX
                || c == GEO2D_PREFIX;
    }

    private IndexDeclarationNormalizer() {/* no-init */}

}
