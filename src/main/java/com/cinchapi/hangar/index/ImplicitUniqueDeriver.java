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
import com.cinchapi.hangar.schema.FieldPaths;
import com.cinchapi.hangar.schema.FieldType;
import com.cinchapi.hangar.schema.Schema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

/**
 * Derives the unique indexes that are implied by the {@code unique} and
 * {@code uniqueWith} declarations of individual fields.
 * <p>
 * A unique field yields an ascending unique index on its own key. If it is
 * unique in combination with other fields, the index is compound and starts
 * with the field's own key, followed by the key of each partner in declared
 * order. Partners are resolved relative to the document that declares the
 * field. Embedded documents are visited depth first and their keys are
 * prefixed with the path of the embedding field. These indexes never receive
 * a discriminator prefix.
 * </p>
 */
public final class ImplicitUniqueDeriver {

    /**
     * Return the unique indexes implied by the fields of {@code schema} and
     * its embedded documents.
     *
     * @param schema
     * @return the implied unique specs
     */
    public static List<IndexSpec> derive(Schema schema) {
        List<IndexSpec> specs = Lists.newArrayList();
        Set<Schema> path = Sets.newIdentityHashSet();
        derive(schema, "", path, specs);
        return ImmutableList.copyOf(specs);
    }

    private static void derive(Schema schema, String namespace,
            Set<Schema> path, List<IndexSpec> specs) {
        path.add(schema);
        for (FieldDescriptor field : schema.fields()) {
            if(field.isUnique()) {
                List<IndexKey> keys = Lists.newArrayList();
                keys.add(IndexKey.ascending(namespace + field.storageKey()));
                for (String partner : field.uniqueWith()) {
                    keys.add(IndexKey.ascending(
                            namespace + FieldPaths.resolve(schema, partner)));
                }
                specs.add(IndexSpec.unique(keys.toArray(new IndexKey[0])));
            }
            if(field.type() == FieldType.EMBEDDED) {
                Schema nested = schema.nested(field);
                if(!path.contains(nested)) {
                    derive(nested, namespace + field.storageKey() + ".", path,
                            specs);
                }
            }
        }
        path.remove(schema);
    }

    private ImplicitUniqueDeriver() {/* no-init */}

}
