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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Describes one declared field of a {@link Schema}.
 */
@Immutable
public final class FieldDescriptor {

    /**
     * Return a builder for a field called {@code name}.
     *
     * @param name
     * @return a builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Return a descriptor for a field called {@code name} of the specified
     * {@code type} that is stored under its own name.
     *
     * @param name
     * @param type
     * @return the descriptor
     */
    public static FieldDescriptor of(String name, FieldType type) {
        return builder(name).type(type).build();
    }

    private final String name;
    private final String storageKey;
    private final FieldType type;
    @Nullable
    private final String target;
    private final boolean unique;
    private final List<String> uniqueWith;
    private final boolean primaryKey;

    private FieldDescriptor(String name, String storageKey, FieldType type,
            @Nullable String target, boolean unique, List<String> uniqueWith,
            boolean primaryKey) {
        this.name = name;
        this.storageKey = storageKey;
        this.type = type;
        this.target = target;
        this.unique = unique;
        this.uniqueWith = ImmutableList.copyOf(uniqueWith);
        this.primaryKey = primaryKey;
    }

    /**
     * Return {@code true} if this field is the primary key of its schema.
     *
     * @return boolean
     */
    public boolean isPrimaryKey() {
        return primaryKey;
    }

    /**
     * Return {@code true} if the values of this field must be unique within
     * the collection. A field with {@link #uniqueWith() partners} is always
     * unique.
     *
     * @return boolean
     */
    public boolean isUnique() {
        return unique || !uniqueWith.isEmpty();
    }

    /**
     * Return the logical name of the field.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Return the key under which the field is physically stored.
     *
     * @return the storage key
     */
    public String storageKey() {
        return storageKey;
    }

    /**
     * Return the name of the schema that describes the documents held by an
     * {@link FieldType#isEmbedded() embedded} or
     * {@link FieldType#REFERENCE reference} field.
     *
     * @return the target schema name, or {@code null}
     */
    @Nullable
    public String target() {
        return target;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("name", name).add("storageKey", storageKey)
                .add("type", type).add("target", target).toString();
    }

    /**
     * Return the {@link FieldType}.
     *
     * @return the type
     */
    public FieldType type() {
        return type;
    }

    /**
     * Return the paths of the sibling fields that must be unique in
     * combination with this one.
     *
     * @return the partner paths
     */
    public List<String> uniqueWith() {
        return uniqueWith;
    }

    /**
     * Returned from {@link FieldDescriptor#builder(String)}.
     */
    public static class Builder {

        private final String name;
        private String storageKey = null;
        private FieldType type = FieldType.OBJECT;
        private String target = null;
        private boolean unique = false;
        private List<String> uniqueWith = ImmutableList.of();
        private boolean primaryKey = false;

        private Builder(String name) {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(name),
                    "A field must have a name");
            Preconditions.checkArgument(!name.contains("."),
                    "A field name cannot contain a period");
            this.name = name;
        }

        /**
         * Build the {@link FieldDescriptor}.
         *
         * @return the descriptor
         */
        public FieldDescriptor build() {
            Preconditions.checkState(
                    target != null || !(type.isEmbedded()
                            || type == FieldType.REFERENCE),
                    "Field %s of type %s must have a target schema", name,
                    type);
            String key = primaryKey ? Schema.PRIMARY_KEY
                    : MoreObjects.firstNonNull(storageKey, name);
            return new FieldDescriptor(name, key, type, target, unique,
                    uniqueWith, primaryKey);
        }

        /**
         * Mark the field as embedding one document described by the schema
         * called {@code target}.
         *
         * @param target
         * @return this
         */
        public Builder embedded(String target) {
            this.type = FieldType.EMBEDDED;
            this.target = target;
            return this;
        }

        /**
         * Mark the field as embedding a list of documents described by the
         * schema called {@code target}.
         *
         * @param target
         * @return this
         */
        public Builder embeddedList(String target) {
            this.type = FieldType.EMBEDDED_LIST;
            this.target = target;
            return this;
        }

        /**
         * Mark the field as the primary key, which is always stored under
         * {@link Schema#PRIMARY_KEY}.
         *
         * @return this
         */
        public Builder primaryKey() {
            this.primaryKey = true;
            return this;
        }

        /**
         * Mark the field as a link to a document described by the schema
         * called {@code target}.
         *
         * @param target
         * @return this
         */
        public Builder reference(String target) {
            this.type = FieldType.REFERENCE;
            this.target = target;
            return this;
        }

        /**
         * Set the key under which the field is physically stored.
         *
         * @param storageKey
         * @return this
         */
        public Builder storageKey(String storageKey) {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(storageKey),
                    "A storage key cannot be empty");
            this.storageKey = storageKey;
            return this;
        }

        /**
         * Set the {@link FieldType}.
         *
         * @param type
         * @return this
         */
        public Builder type(FieldType type) {
            this.type = Preconditions.checkNotNull(type);
            return this;
        }

        /**
         * Mark the values of the field as unique within the collection.
         *
         * @return this
         */
        public Builder unique() {
            this.unique = true;
            return this;
        }

        /**
         * Mark the values of the field as unique in combination with the
         * sibling fields at {@code paths}.
         *
         * @param paths
         * @return this
         */
        public Builder uniqueWith(String... paths) {
            this.uniqueWith = ImmutableList.copyOf(paths);
            return this;
        }
    }

}
