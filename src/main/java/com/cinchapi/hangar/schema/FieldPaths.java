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
package com.cinchapi.hangar.schema;

import java.util.List;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.hangar.ConfigurationException;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * Resolves dotted field paths (e.g. {@code rank.title} or {@code tags.name})
 * against a {@link Schema} and translates each logical field name into the key
 * under which it is physically stored.
 */
public final class FieldPaths {

    /**
     * The names that always refer to the primary key of a top-level document.
     */
    private static final ImmutableSet<String> PRIMARY_KEY_ALIASES = ImmutableSet
            .of("pk", "id", Schema.PRIMARY_KEY);

    private static final Splitter SPLITTER = Splitter.on('.');
    private static final Joiner JOINER = Joiner.on('.');

    /**
     * Return the storage path for the logical {@code path} in {@code schema}.
     * <p>
     * Each component is looked up in the schema that describes the value of
     * the previous one: embedded documents and lists of embedded documents are
     * entered, while free-form values (maps, scalar lists and the like) let
     * the rest of the path through unresolved. {@code pk}, {@code id} and
     * {@code _id} at the start of a path refer to the primary key.
     * </p>
     *
     * @param schema
     * @param path
     * @return the storage path
     * @throws ConfigurationException if any component of {@code path} cannot
     *             be resolved
     */
    public static String resolve(Schema schema, String path) {
        List<String> parts = SPLITTER.splitToList(path);
        List<String> resolved = Lists.newArrayListWithCapacity(parts.size());
        Schema current = schema;
        for (int i = 0; i < parts.size(); ++i) {
            String part = parts.get(i);
            if(part.isEmpty()) {
                throw new ConfigurationException(AnyStrings
                        .format("Invalid field path \"{}\" in {}", path,
                                schema.name()));
            }
            else if(current == null) {
                // Inside a value whose keys are not described by a schema
                resolved.add(part);
                continue;
            }
            FieldDescriptor field = current.field(part);
            if(field == null && i == 0 && !current.isEmbedded()
                    && PRIMARY_KEY_ALIASES.contains(part)) {
                resolved.add(Schema.PRIMARY_KEY);
                current = null;
            }
            else if(field == null) {
                throw new ConfigurationException(AnyStrings.format(
                        "Cannot resolve field \"{}\" of \"{}\" in {}", part,
                        path, current.name()));
            }
            else {
                resolved.add(field.storageKey());
                boolean last = i == parts.size() - 1;
                if(field.type().isEmbedded()) {
                    current = current.nested(field);
                }
                else if(field.type().isOpaque()) {
                    current = null;
                }
                else if(!last && field.type() == FieldType.REFERENCE) {
                    throw new ConfigurationException(AnyStrings.format(
                            "Cannot traverse reference field \"{}\" of \"{}\" in {}",
                            part, path, current.name()));
                }
                else if(!last) {
                    throw new ConfigurationException(AnyStrings.format(
                            "Field \"{}\" of \"{}\" in {} has no nested fields",
                            part, path, current.name()));
                }
            }
        }
        return JOINER.join(resolved);
    }

    private FieldPaths() {/* no-init */}

}
