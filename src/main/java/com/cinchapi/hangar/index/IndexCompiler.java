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

import com.cinchapi.hangar.ConfigurationException;
import com.cinchapi.hangar.schema.Schema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Compiles the canonical {@link IndexSpec index specs} of a {@link Schema}.
 * <p>
 * The canonical list starts with the {@link InheritanceMerger merged}
 * declarations of the schema and its ancestors, followed by the
 * {@link ImplicitUniqueDeriver implied unique indexes} and the
 * {@link GeoIndexCollector geospatial indexes} of geo point fields. An implied
 * spec whose keys match a spec that is already in the list upgrades the
 * options of that spec instead of being added again.
 * </p>
 * <p>
 * The result of a successful compilation is cached on the {@link Schema}.
 * </p>
 */
public final class IndexCompiler {

    private static final Logger log = LoggerFactory
            .getLogger(IndexCompiler.class);

    /**
     * Return the canonical index specs for {@code schema}.
     * <p>
     * The specs are compiled the first time they are requested and cached
     * after that.
     * </p>
     *
     * @param schema
     * @return the canonical index specs
     * @throws ConfigurationException if any declaration is invalid
     */
    public static List<IndexSpec> compile(Schema schema) {
        return schema.indexSpecs();
    }

    /**
     * Return the {@link #compile(Schema) canonical index specs} of
     * {@code schema} that are geospatial.
     *
     * @param schema
     * @return the geospatial specs
     */
    public static List<IndexSpec> geoIndexes(Schema schema) {
        ImmutableList.Builder<IndexSpec> geo = ImmutableList.builder();
        for (IndexSpec spec : compile(schema)) {
            if(spec.isGeospatial()) {
                geo.add(spec);
            }
        }
        return geo.build();
    }

    /**
     * Compile the canonical index specs of {@code schema} without consulting
     * the cache.
     * <p>
     * <strong>NOTE:</strong> This is called from {@link Schema#indexSpecs()}.
     * Use {@link #compile(Schema)} everywhere else.
     * </p>
     *
     * @param schema
     * @return the canonical index specs
     */
    public static List<IndexSpec> build(Schema schema) {
        List<IndexSpec> specs = Lists
                .newArrayList(InheritanceMerger.merge(schema));
        fold(specs, ImplicitUniqueDeriver.derive(schema));
        fold(specs, GeoIndexCollector.collect(schema));
        if(log.isDebugEnabled()) {
            log.debug("Compiled the index specs of {}: {}", schema.name(),
                    specs);
        }
        return ImmutableList.copyOf(specs);
    }

    /**
     * Add each of the {@code additions} to {@code specs} unless a spec with
     * the same keys is already there, in which case that spec takes on the
     * options of the addition as well.
     *
     * @param specs
     * @param additions
     */
    private static void fold(List<IndexSpec> specs,
            List<IndexSpec> additions) {
        outer: for (IndexSpec addition : additions) {
            for (int i = 0; i < specs.size(); ++i) {
                IndexSpec existing = specs.get(i);
                if(existing.keys().equals(addition.keys())) {
                    specs.set(i, existing.withOptions(
                            existing.options().union(addition.options())));
                    continue outer;
                }
            }
            specs.add(addition);
        }
    }

    private IndexCompiler() {/* no-init */}

}
