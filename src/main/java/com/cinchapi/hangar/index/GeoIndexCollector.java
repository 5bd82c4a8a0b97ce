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
import java.util.Set;

import com.cinchapi.hangar.schema.FieldDescriptor;
import com.cinchapi.hangar.schema.FieldType;
import com.cinchapi.hangar.schema.Schema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Collects the geospatial indexes that are implied by the
 * {@link FieldType#GEO_POINT geo point} fields of a {@link Schema}.
 * <p>
 * Embedded documents and lists of embedded documents are searched too, but a
 * schema is never entered again while it is being searched, so a document
 * that embeds itself is only searched once on each path. Reference fields are
 * links to other collections and are never followed.
 * </p>
 */
public final class GeoIndexCollector {

    /**
     * Return a geospatial spec for every geo point field that is stored in
     * documents of {@code schema}.
     *
     * @param schema
     * @return the geospatial specs
     */
    public static List<IndexSpec> collect(Schema schema) {
        List<IndexSpec> specs = Lists.newArrayList();
        Set<Schema> visiting = Sets.newIdentityHashSet();
        collect(schema, "", visiting, specs);
        return ImmutableList.copyOf(specs);
    }

    private static void collect(Schema schema, String namespace,
            Set<Schema> visiting, List<IndexSpec> specs) {
        visiting.add(schema);
        for (FieldDescriptor field : schema.fields()) {
            if(field.type() == FieldType.GEO_POINT) {
                specs.add(IndexSpec
                        .of(IndexKey.geo2d(namespace + field.storageKey())));
            }
            else if(field.type().isEmbedded()) {
                Schema nested = schema.nested(field);
                if(!visiting.contains(nested)) {
                    collect(nested, namespace + field.storageKey() + ".",
                            visiting, specs);
                }
            }
        }
        visiting.remove(schema);
    }

    private GeoIndexCollector() {/* no-init */}

}
