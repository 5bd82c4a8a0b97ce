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
import java.util.Map;
import java.util.Set;

import com.cinchapi.hangar.schema.Schema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * Merges the index declarations of a {@link Schema} with those of all of its
 * ancestors.
 * <p>
 * Ancestors are visited oldest first, abstract ones included, followed by the
 * schema itself. A normalized spec is kept the first time it is seen and
 * skipped after that. Once merged, the discriminator key is put in front of
 * every spec of a polymorphic schema unless the spec is geospatial, sparse,
 * declared with {@code cls=false} or already starts with the discriminator.
 * </p>
 */
public final class InheritanceMerger {

    /**
     * The key that is prefixed to the indexes of polymorphic schemas.
     */
    private static final IndexKey DISCRIMINATOR = IndexKey
            .ascending(Schema.DISCRIMINATOR_KEY);

    /**
     * Return the merged specs for {@code schema}.
     *
     * @param schema
     * @return the merged specs, in order of first appearance
     */
    public static List<IndexSpec> merge(Schema schema) {
        Map<IndexSpec, NormalizedIndex> merged = Maps.newLinkedHashMap();
        for (Schema ancestor : schema.ancestors()) {
            collect(ancestor, merged);
        }
        collect(schema, merged);
        Set<IndexSpec> specs = Sets.newLinkedHashSet();
        boolean polymorphic = schema.isPolymorphic();
        for (NormalizedIndex index : merged.values()) {
            IndexSpec spec = index.spec();
            if(polymorphic && index.isDiscriminable()
                    && !spec.startsWith(Schema.DISCRIMINATOR_KEY)) {
                spec = spec.withPrefix(DISCRIMINATOR);
            }
            specs.add(spec);
        }
        return ImmutableList.copyOf(specs);
    }

    /**
     * Normalize the declarations that {@code schema} itself makes and add the
     * ones that haven't been seen to {@code merged}.
     *
     * @param schema
     * @param merged
     */
    private static void collect(Schema schema,
            Map<IndexSpec, NormalizedIndex> merged) {
        for (IndexDeclaration declaration : schema.indexes()) {
            NormalizedIndex index = IndexDeclarationNormalizer
                    .normalizeForMerge(schema, declaration);
            merged.putIfAbsent(index.spec(), index);
        }
    }

    private InheritanceMerger() {/* no-init */}

}
