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

import java.util.Collection;
import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.hangar.ConfigurationException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * The arena that owns a set of {@link Schema Schemas} and resolves the names
 * they use to refer to one another.
 * <p>
 * A parent must be registered before its children. Embedded and reference
 * targets may be registered in any order, since they are only resolved when a
 * schema's indexes are compiled.
 * </p>
 */
@ThreadSafe
public final class SchemaRegistry {

    /**
     * A mapping from each schema name to the registered {@link Schema}, in
     * registration order.
     */
    private final Map<String, Schema> schemas = Maps.newLinkedHashMap();

    /**
     * Return all the registered schemas in the order they were registered.
     *
     * @return the schemas
     */
    public synchronized Collection<Schema> all() {
        return ImmutableList.copyOf(schemas.values());
    }

    /**
     * Return {@code true} if a schema called {@code name} is registered.
     *
     * @param name
     * @return boolean
     */
    public synchronized boolean contains(String name) {
        return schemas.containsKey(name);
    }

    /**
     * Return the schema called {@code name}, or {@code null}.
     *
     * @param name
     * @return the schema
     */
    @Nullable
    public synchronized Schema get(String name) {
        return schemas.get(name);
    }

    /**
     * Register {@code schema}.
     *
     * @param schema
     * @return {@code schema}
     * @throws ConfigurationException if the parent of {@code schema} isn't
     *             registered or is a concrete schema that doesn't allow
     *             inheritance, if {@code schema} turns off inheritance while
     *             sharing the collection of a polymorphic ancestor, or if
     *             another schema with the same name is registered
     */
    public synchronized Schema register(Schema schema) {
        String parentName = schema.parentName();
        if(parentName != null) {
            Schema parent = get(parentName);
            if(parent == null) {
                throw new ConfigurationException(AnyStrings.format(
                        "The parent {} of {} is not registered", parentName,
                        schema.name()));
            }
            else if(!parent.allowsInheritance() && !parent.isAbstract()) {
                throw new ConfigurationException(AnyStrings.format(
                        "{} may not be subclassed because it does not allow inheritance",
                        parentName));
            }
            else if(parent.isEmbedded() != schema.isEmbedded()) {
                throw new ConfigurationException(AnyStrings.format(
                        "{} and its parent {} must both be embedded or both be top-level",
                        schema.name(), parentName));
            }
            else if(Boolean.FALSE.equals(schema.declaredAllowInheritance())) {
                Schema stored = storedAncestor(parent);
                if(stored != null && stored.isPolymorphic()) {
                    throw new ConfigurationException(AnyStrings.format(
                            "{} cannot turn off inheritance because it shares the polymorphic collection of {}",
                            schema.name(), stored.name()));
                }
            }
        }
        Schema existing = schemas.putIfAbsent(schema.name(), schema);
        if(existing != null && existing != schema) {
            throw new ConfigurationException(AnyStrings.format(
                    "A different schema named {} is already registered",
                    schema.name()));
        }
        schema.attach(this);
        return schema;
    }

    /**
     * Return the schema called {@code name}.
     *
     * @param name
     * @return the schema
     * @throws ConfigurationException if no such schema is registered
     */
    public synchronized Schema schema(String name) {
        Schema schema = schemas.get(name);
        if(schema == null) {
            throw new ConfigurationException(
                    AnyStrings.format("Unknown schema {}", name));
        }
        return schema;
    }

    /**
     * Remove {@code schema} if it is the one registered under its name.
     *
     * @param schema
     * @return {@code true} if {@code schema} was removed
     */
    public synchronized boolean unregister(Schema schema) {
        return schemas.remove(schema.name(), schema);
    }

    /**
     * Return the nearest concrete schema among {@code schema} and its
     * ancestors, or {@code null} if all of them are abstract.
     *
     * @param schema
     * @return the nearest concrete schema
     */
    @Nullable
    private static Schema storedAncestor(Schema schema) {
        Schema current = schema;
        while (current != null && current.isAbstract()) {
            current = current.parent();
        }
        return current;
    }

}
