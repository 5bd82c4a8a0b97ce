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

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.hangar.ConfigurationException;
import com.cinchapi.hangar.index.IndexCompiler;
import com.cinchapi.hangar.index.IndexDeclaration;
import com.cinchapi.hangar.index.IndexSpec;
import com.google.common.base.CaseFormat;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * A {@link Schema} describes one document or embedded document type: its
 * declared fields, its raw index declarations and the options that govern how
 * it is stored.
 * <p>
 * A {@link Schema} refers to its parent and to the schemas of its embedded and
 * reference fields by name. Those names are resolved through the
 * {@link SchemaRegistry} that the {@link Schema} is
 * {@link SchemaRegistry#register(Schema) registered} with, which allows a
 * schema to embed itself.
 * </p>
 * <p>
 * A {@link Schema} is immutable, except that it caches its
 * {@link #indexSpecs() canonical index specs} the first time they are
 * compiled.
 * </p>
 */
public final class Schema {

    /**
     * The key under which the discriminator of a polymorphic document is
     * stored.
     */
    public static final String DISCRIMINATOR_KEY = "_cls";

    /**
     * The key under which the primary key of every document is stored.
     */
    public static final String PRIMARY_KEY = "_id";

    /**
     * Return a builder for a top-level document schema called {@code name}.
     *
     * @param name
     * @return a builder
     */
    public static Builder builder(String name) {
        return new Builder(name, false);
    }

    /**
     * Return a builder for an embedded document schema called {@code name}.
     *
     * @param name
     * @return a builder
     */
    public static Builder embedded(String name) {
        return new Builder(name, true);
    }

    private final String name;
    @Nullable
    private final String parent;
    private final Map<String, FieldDescriptor> fields;
    private final List<IndexDeclaration> indexes;
    @Nullable
    private final Boolean allowInheritance;
    private final boolean isAbstract;
    private final boolean embedded;
    @Nullable
    private final String collection;
    private final boolean autoCreateIndex;
    private final boolean indexCls;
    private final boolean indexBackground;

    /**
     * The {@link SchemaRegistry} that resolves names on behalf of this
     * {@link Schema}.
     */
    private volatile SchemaRegistry registry = null;

    /**
     * The canonical index specs, computed on demand.
     */
    private volatile List<IndexSpec> indexSpecs = null;

    private Schema(Builder builder) {
        this.name = builder.name;
        this.parent = builder.parent;
        this.fields = ImmutableMap.copyOf(builder.fields);
        this.indexes = ImmutableList.copyOf(builder.indexes);
        this.allowInheritance = builder.allowInheritance;
        this.isAbstract = builder.isAbstract;
        this.embedded = builder.embedded;
        this.collection = builder.collection;
        this.autoCreateIndex = builder.autoCreateIndex;
        this.indexCls = builder.indexCls;
        this.indexBackground = builder.indexBackground;
    }

    /**
     * Return every ancestor of this schema, oldest first.
     *
     * @return the ancestors
     */
    public List<Schema> ancestors() {
        List<Schema> ancestors = Lists.newArrayList();
        Schema current = parent();
        while (current != null) {
            ancestors.add(0, current);
            current = current.parent();
        }
        return ancestors;
    }

    /**
     * Return {@code true} if documents of this schema may be subclassed and
     * share a collection with the documents of their subclasses, in which case
     * each stored document carries a {@link #DISCRIMINATOR_KEY discriminator}.
     * Unless declared, the setting is inherited from the parent and is
     * {@code true} for a root schema.
     *
     * @return boolean
     */
    public boolean allowsInheritance() {
        if(allowInheritance != null) {
            return allowInheritance;
        }
        else {
            Schema parent = parent();
            return parent != null ? parent.allowsInheritance() : true;
        }
    }

    /**
     * Return the name of the collection that stores documents of this schema
     * or {@code null} if the schema is {@link #isAbstract() abstract} or
     * {@link #isEmbedded() embedded}.
     * <p>
     * A schema shares the collection of its nearest concrete ancestor. A root
     * (or a child of only abstract ancestors) uses its declared collection
     * name, or its own name converted to {@code lower_underscore} case.
     * </p>
     *
     * @return the collection name
     */
    @Nullable
    public String collection() {
        if(isAbstract || embedded) {
            return null;
        }
        else if(collection != null) {
            return collection;
        }
        else {
            for (Schema ancestor : Lists.reverse(ancestors())) {
                if(!ancestor.isAbstract()) {
                    return ancestor.collection();
                }
            }
            return CaseFormat.UPPER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE,
                    name);
        }
    }

    /**
     * Return the descriptor for the field called {@code name}, including
     * inherited fields, or {@code null} if there is no such field.
     *
     * @param name
     * @return the field descriptor
     */
    @Nullable
    public FieldDescriptor field(String name) {
        FieldDescriptor field = fields.get(name);
        if(field == null) {
            Schema parent = parent();
            return parent != null ? parent.field(name) : null;
        }
        else {
            return field;
        }
    }

    /**
     * Return all the fields of this schema, inherited fields first, in
     * declaration order.
     *
     * @return the fields
     */
    public Collection<FieldDescriptor> fields() {
        Map<String, FieldDescriptor> all = new LinkedHashMap<>();
        for (Schema ancestor : ancestors()) {
            all.putAll(ancestor.fields);
        }
        all.putAll(fields);
        return all.values();
    }

    /**
     * Return {@code true} if the standalone discriminator index should be
     * created when no other index starts with the discriminator.
     *
     * @return boolean
     */
    public boolean indexCls() {
        return indexCls;
    }

    /**
     * Return the index declarations made by this schema itself (not by its
     * ancestors), exactly as they were declared.
     *
     * @return the declarations
     */
    public List<IndexDeclaration> indexes() {
        return indexes;
    }

    /**
     * Return the canonical {@link IndexSpec index specs} for this schema,
     * compiling them on first use.
     *
     * @return the index specs
     * @throws ConfigurationException if the declarations are invalid
     */
    public List<IndexSpec> indexSpecs() {
        List<IndexSpec> specs = indexSpecs;
        if(specs == null) {
            specs = IndexCompiler.build(this);
            indexSpecs = specs;
        }
        return specs;
    }

    /**
     * Return {@code true} if this schema's indexes should be built in the
     * background.
     *
     * @return boolean
     */
    public boolean indexBackground() {
        return indexBackground;
    }

    /**
     * Return {@code true} if this schema only exists to be inherited from and
     * is never stored in a collection of its own.
     *
     * @return boolean
     */
    public boolean isAbstract() {
        return isAbstract;
    }

    /**
     * Return {@code true} if indexes should be created for this schema
     * automatically.
     *
     * @return boolean
     */
    public boolean isAutoCreateIndex() {
        return autoCreateIndex;
    }

    /**
     * Return {@code true} if this schema describes documents that are only
     * ever stored inline inside other documents.
     *
     * @return boolean
     */
    public boolean isEmbedded() {
        return embedded;
    }

    /**
     * Return {@code true} if documents of this schema are stored in a
     * collection that is shared across a class hierarchy and distinguished by
     * the {@link #DISCRIMINATOR_KEY discriminator}.
     *
     * @return boolean
     */
    public boolean isPolymorphic() {
        return !embedded && allowsInheritance();
    }

    /**
     * Return the name of this schema.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Return the schema that is described by the {@link FieldDescriptor#target()
     * target} of {@code field}.
     *
     * @param field
     * @return the target schema
     * @throws ConfigurationException if the target isn't registered
     */
    public Schema nested(FieldDescriptor field) {
        Preconditions.checkArgument(field.target() != null,
                "Field %s does not refer to another schema", field.name());
        return registry().schema(field.target());
    }

    /**
     * Return the parent of this schema, or {@code null} if this is a root.
     *
     * @return the parent
     */
    @Nullable
    public Schema parent() {
        return parent != null ? registry().schema(parent) : null;
    }

    /**
     * Return the {@link SchemaRegistry} this schema is registered with.
     *
     * @return the registry
     * @throws IllegalStateException if the schema hasn't been registered
     */
    public SchemaRegistry registry() {
        SchemaRegistry registry = this.registry;
        Preconditions.checkState(registry != null,
                "Schema %s has not been registered", name);
        return registry;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("name", name).add("parent", parent)
                .add("fields", fields.keySet()).add("indexes", indexes)
                .toString();
    }

    /**
     * Attach this schema to {@code registry}.
     *
     * @param registry
     */
    /* package */ void attach(SchemaRegistry registry) {
        Preconditions.checkState(
                this.registry == null || this.registry == registry,
                "Schema %s is registered with another registry", name);
        this.registry = registry;
    }

    /**
     * Return the inheritance setting that this schema declares itself, or
     * {@code null} if it inherits the setting.
     *
     * @return the declared setting
     */
    @Nullable
    /* package */ Boolean declaredAllowInheritance() {
        return allowInheritance;
    }

    /**
     * Return the name of the parent schema, or {@code null}.
     *
     * @return the parent name
     */
    @Nullable
    /* package */ String parentName() {
        return parent;
    }

    /**
     * Returned from {@link Schema#builder(String)} and
     * {@link Schema#embedded(String)}.
     */
    public static class Builder {

        private final String name;
        private final boolean embedded;
        private String parent = null;
        private final Map<String, FieldDescriptor> fields = Maps
                .newLinkedHashMap();
        private final List<IndexDeclaration> indexes = Lists.newArrayList();
        private Boolean allowInheritance = null;
        private boolean isAbstract = false;
        private String collection = null;
        private boolean autoCreateIndex = true;
        private boolean indexCls = true;
        private boolean indexBackground = false;

        private Builder(String name, boolean embedded) {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(name),
                    "A schema must have a name");
            this.name = name;
            this.embedded = embedded;
        }

        /**
         * Mark the schema as abstract.
         *
         * @return this
         */
        public Builder abstractSchema() {
            this.isAbstract = true;
            return this;
        }

        /**
         * Declare whether the schema may be subclassed.
         *
         * @param allowInheritance
         * @return this
         */
        public Builder allowInheritance(boolean allowInheritance) {
            this.allowInheritance = allowInheritance;
            return this;
        }

        /**
         * Declare whether indexes are created automatically.
         *
         * @param autoCreateIndex
         * @return this
         */
        public Builder autoCreateIndex(boolean autoCreateIndex) {
            this.autoCreateIndex = autoCreateIndex;
            return this;
        }

        /**
         * Build the {@link Schema}.
         *
         * @return the schema
         */
        public Schema build() {
            return new Schema(this);
        }

        /**
         * Set the name of the collection.
         *
         * @param collection
         * @return this
         */
        public Builder collection(String collection) {
            this.collection = Strings.emptyToNull(collection);
            return this;
        }

        /**
         * Add a field.
         *
         * @param field
         * @return this
         */
        public Builder field(FieldDescriptor field) {
            if(fields.put(field.name(), field) != null) {
                throw new ConfigurationException(AnyStrings.format(
                        "Field {} is declared twice in {}", field.name(),
                        name));
            }
            return this;
        }

        /**
         * Add a field called {@code name} of the specified {@code type}.
         *
         * @param name
         * @param type
         * @return this
         */
        public Builder field(String name, FieldType type) {
            return field(FieldDescriptor.of(name, type));
        }

        /**
         * Add index declarations. Each of the {@code declarations} is either
         * an {@link IndexDeclaration} or a value that
         * {@link IndexDeclaration#parse(Object)} accepts.
         *
         * @param declarations
         * @return this
         */
        public Builder indexes(Object... declarations) {
            Arrays.stream(declarations).map(IndexDeclaration::parse)
                    .forEach(indexes::add);
            return this;
        }

        /**
         * Build the indexes in the background.
         *
         * @param indexBackground
         * @return this
         */
        public Builder indexBackground(boolean indexBackground) {
            this.indexBackground = indexBackground;
            return this;
        }

        /**
         * Declare whether a standalone discriminator index is created.
         *
         * @param indexCls
         * @return this
         */
        public Builder indexCls(boolean indexCls) {
            this.indexCls = indexCls;
            return this;
        }

        /**
         * Set the name of the parent schema.
         *
         * @param parent
         * @return this
         */
        public Builder parent(String parent) {
            this.parent = Strings.emptyToNull(parent);
            return this;
        }
    }

}
