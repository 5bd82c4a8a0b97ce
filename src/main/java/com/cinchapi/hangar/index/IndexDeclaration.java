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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.hangar.ConfigurationException;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * An index exactly as it was declared for a schema, before it is
 * {@link IndexDeclarationNormalizer normalized} into an {@link IndexSpec}.
 * <p>
 * A declaration takes one of four shapes, identified by {@link #kind()}:
 * <ul>
 * <li>a {@link FieldRef}: a single field path that may carry a direction
 * prefix ({@code -date}, {@code +date}, {@code *location})</li>
 * <li>a {@link DirectedFieldRef}: a field path paired with an explicit
 * {@link Direction}</li>
 * <li>a {@link Compound}: an ordered list of field refs</li>
 * <li>an {@link OptionsRecord}: a list of field refs plus index options</li>
 * </ul>
 * </p>
 */
public abstract class IndexDeclaration {

    /**
     * Return a {@link DirectedFieldRef} for {@code path} in the specified
     * {@code direction}.
     *
     * @param path
     * @param direction
     * @return the declaration
     */
    public static DirectedFieldRef field(String path, Direction direction) {
        return new DirectedFieldRef(path, direction);
    }

    /**
     * Return a {@link FieldRef} for {@code path}, which may be prefixed with
     * {@code -}, {@code +} or {@code *}.
     *
     * @param path
     * @return the declaration
     */
    public static FieldRef field(String path) {
        return new FieldRef(path);
    }

    /**
     * Return a builder for an {@link OptionsRecord}.
     *
     * @return a builder
     */
    public static OptionsRecord.Builder options() {
        return new OptionsRecord.Builder();
    }

    /**
     * Convert a loosely typed declaration into an {@link IndexDeclaration}.
     * <p>
     * A {@link String} is a {@link FieldRef}, a {@link Collection} or array is
     * a {@link #sequence(Object...) sequence} and a {@link Map} is an
     * {@link OptionsRecord} whose recognized keys are {@code fields},
     * {@code unique}, {@code sparse}, {@code expireAfterSeconds},
     * {@code background} and {@code cls}.
     * </p>
     *
     * @param raw
     * @return the declaration
     * @throws ConfigurationException if {@code raw} has an unsupported shape
     */
    public static IndexDeclaration parse(Object raw) {
        if(raw instanceof IndexDeclaration) {
            return (IndexDeclaration) raw;
        }
        else if(raw instanceof String) {
            return field((String) raw);
        }
        else if(raw instanceof Collection) {
            return sequence(((Collection<?>) raw).toArray());
        }
        else if(raw instanceof Object[]) {
            return sequence((Object[]) raw);
        }
        else if(raw instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) raw;
            Set<Object> unknown = Sets.newHashSet(map.keySet());
            unknown.removeAll(OPTION_NAMES);
            if(!unknown.isEmpty()) {
                throw new ConfigurationException(AnyStrings.format(
                        "Unknown index options {} in {}", unknown, raw));
            }
            OptionsRecord.Builder builder = options();
            Object fields = map.get("fields");
            if(fields instanceof String) {
                builder.fields(fields);
            }
            else if(fields instanceof Collection) {
                builder.fields(((Collection<?>) fields).toArray());
            }
            else if(fields instanceof Object[]) {
                builder.fields((Object[]) fields);
            }
            else if(fields != null) {
                throw new ConfigurationException(AnyStrings
                        .format("Invalid index fields {} in {}", fields, raw));
            }
            builder.unique(isTrue(map.get("unique")));
            builder.sparse(isTrue(map.get("sparse")));
            builder.background(isTrue(map.get("background")));
            Object expiry = map.get("expireAfterSeconds");
            if(expiry instanceof Number) {
                builder.expireAfterSeconds(((Number) expiry).longValue());
            }
            else if(expiry != null) {
                throw new ConfigurationException(AnyStrings.format(
                        "Invalid expireAfterSeconds {} in {}", expiry, raw));
            }
            if(map.containsKey("cls")) {
                builder.cls(isTrue(map.get("cls")));
            }
            return builder.build();
        }
        else {
            throw new ConfigurationException(AnyStrings
                    .format("Unsupported index declaration: {}", raw));
        }
    }

    /**
     * Return the declaration for an ordered sequence of {@code elements}, each
     * of which is a field path {@link String}, an {@link IndexDeclaration}
     * field ref or a nested two element sequence.
     * <p>
     * A two element sequence whose second element is a direction token (see
     * {@link Direction#parse(String)}) or a {@link Direction} is an explicit
     * (path, direction) pair, not a compound of two fields.
     * </p>
     *
     * @param elements
     * @return the declaration
     */
    public static IndexDeclaration sequence(Object... elements) {
        if(elements.length == 2 && elements[0] instanceof String) {
            Direction direction = asDirection(elements[1]);
            if(direction != null) {
                return field((String) elements[0], direction);
            }
        }
        return new Compound(Arrays.asList(elements));
    }

    /**
     * Return the {@link Direction} that {@code token} denotes, if any.
     *
     * @param token
     * @return the direction or {@code null}
     */
    @Nullable
    private static Direction asDirection(Object token) {
        if(token instanceof Direction) {
            return (Direction) token;
        }
        else if(token instanceof Number || token instanceof String) {
            return Direction.fromValue(token);
        }
        else {
            return null;
        }
    }

    /**
     * Return a single field ref for the element of a {@link Compound} or an
     * {@link OptionsRecord}.
     *
     * @param element
     * @return the field ref
     */
    private static IndexDeclaration element(Object element) {
        if(element instanceof FieldRef || element instanceof DirectedFieldRef) {
            return (IndexDeclaration) element;
        }
        else if(element instanceof String) {
            return field((String) element);
        }
        else if(element instanceof Collection || element instanceof Object[]) {
            Object[] pair = element instanceof Collection
                    ? ((Collection<?>) element).toArray()
                    : (Object[]) element;
            IndexDeclaration declaration = sequence(pair);
            if(declaration instanceof DirectedFieldRef) {
                return declaration;
            }
        }
        throw new ConfigurationException(AnyStrings
                .format("{} is not a valid index field reference", element));
    }

    private static boolean isTrue(@Nullable Object value) {
        return Boolean.TRUE.equals(value);
    }

    /**
     * The keys that may appear in a {@link Map} that is {@link #parse(Object)
     * parsed} as an {@link OptionsRecord}.
     */
    private static final Set<String> OPTION_NAMES = ImmutableSet.of("fields",
            "unique", "sparse", "expireAfterSeconds", "background", "cls");

    private IndexDeclaration() {/* no-subclass */}

    /**
     * Return the shape of this declaration.
     *
     * @return the {@link Kind}
     */
    public abstract Kind kind();

    /**
     * The shapes an {@link IndexDeclaration} can take.
     */
    public enum Kind {
        FIELD_REF, DIRECTED_FIELD_REF, COMPOUND, OPTIONS_RECORD
    }

    /**
     * A single field path, optionally prefixed with a direction marker.
     */
    @Immutable
    public static final class FieldRef extends IndexDeclaration {

        private final String path;

        private FieldRef(String path) {
            Preconditions.checkArgument(path != null && !path.isEmpty(),
                    "A field path cannot be empty");
            this.path = path;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof FieldRef && path.equals(((FieldRef) obj).path);
        }

        @Override
        public int hashCode() {
            return path.hashCode();
        }

        @Override
        public Kind kind() {
            return Kind.FIELD_REF;
        }

        /**
         * Return the path as declared, including any prefix.
         *
         * @return the path
         */
        public String path() {
            return path;
        }

        @Override
        public String toString() {
            return path;
        }
    }

    /**
     * A field path with an explicit {@link Direction}.
     */
    @Immutable
    public static final class DirectedFieldRef extends IndexDeclaration {

        private final String path;
        private final Direction direction;

        private DirectedFieldRef(String path, Direction direction) {
            Preconditions.checkArgument(path != null && !path.isEmpty(),
                    "A field path cannot be empty");
            this.path = path;
            this.direction = Preconditions.checkNotNull(direction);
        }

        /**
         * Return the declared {@link Direction}.
         *
         * @return the direction
         */
        public Direction direction() {
            return direction;
        }

        @Override
        public boolean equals(Object obj) {
            if(obj instanceof DirectedFieldRef) {
                DirectedFieldRef other = (DirectedFieldRef) obj;
                return path.equals(other.path) && direction == other.direction;
            }
            else {
                return false;
            }
        }

        @Override
        public int hashCode() {
            return Objects.hash(path, direction);
        }

        @Override
        public Kind kind() {
            return Kind.DIRECTED_FIELD_REF;
        }

        /**
         * Return the path.
         *
         * @return the path
         */
        public String path() {
            return path;
        }

        @Override
        public String toString() {
            return "(" + path + ", " + direction + ")";
        }
    }

    /**
     * An ordered list of field refs that are indexed together.
     */
    @Immutable
    public static final class Compound extends IndexDeclaration {

        private final List<IndexDeclaration> elements;

        private Compound(List<Object> elements) {
            ImmutableList.Builder<IndexDeclaration> builder = ImmutableList
                    .builder();
            elements.forEach(element -> builder.add(element(element)));
            this.elements = builder.build();
        }

        /**
         * Return the field refs, each of which is either a {@link FieldRef}
         * or a {@link DirectedFieldRef}.
         *
         * @return the elements
         */
        public List<IndexDeclaration> elements() {
            return elements;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Compound
                    && elements.equals(((Compound) obj).elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public Kind kind() {
            return Kind.COMPOUND;
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }

    /**
     * A list of field refs along with the options the index is built with.
     */
    @Immutable
    public static final class OptionsRecord extends IndexDeclaration {

        @Nullable
        private final List<IndexDeclaration> fields;
        private final boolean unique;
        private final boolean sparse;
        @Nullable
        private final Long expireAfterSeconds;
        private final boolean background;
        private final boolean cls;

        private OptionsRecord(@Nullable List<IndexDeclaration> fields,
                boolean unique, boolean sparse,
                @Nullable Long expireAfterSeconds, boolean background,
                boolean cls) {
            this.fields = fields;
            this.unique = unique;
            this.sparse = sparse;
            this.expireAfterSeconds = expireAfterSeconds;
            this.background = background;
            this.cls = cls;
        }

        /**
         * Return if the index should be built in the background.
         *
         * @return boolean
         */
        public boolean background() {
            return background;
        }

        /**
         * Return if the discriminator key may be prefixed to this index when
         * the schema uses polymorphic storage.
         *
         * @return boolean
         */
        public boolean cls() {
            return cls;
        }

        @Override
        public boolean equals(Object obj) {
            if(obj instanceof OptionsRecord) {
                OptionsRecord other = (OptionsRecord) obj;
                return Objects.equals(fields, other.fields)
                        && unique == other.unique && sparse == other.sparse
                        && Objects.equals(expireAfterSeconds,
                                other.expireAfterSeconds)
                        && background == other.background && cls == other.cls;
            }
            else {
                return false;
            }
        }

        /**
         * Return the expiry, if any.
         *
         * @return the expiry
         */
        @Nullable
        public Long expireAfterSeconds() {
            return expireAfterSeconds;
        }

        /**
         * Return the declared field refs or {@code null} if none were
         * declared.
         *
         * @return the fields
         */
        @Nullable
        public List<IndexDeclaration> fields() {
            return fields;
        }

        @Override
        public int hashCode() {
            return Objects.hash(fields, unique, sparse, expireAfterSeconds,
                    background, cls);
        }

        @Override
        public Kind kind() {
            return Kind.OPTIONS_RECORD;
        }

        /**
         * Return if the index is sparse.
         *
         * @return boolean
         */
        public boolean sparse() {
            return sparse;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper("Index").omitNullValues()
                    .add("fields", fields).add("unique", unique)
                    .add("sparse", sparse)
                    .add("expireAfterSeconds", expireAfterSeconds)
                    .add("background", background).add("cls", cls)
                    .toString();
        }

        /**
         * Return if the index is unique.
         *
         * @return boolean
         */
        public boolean unique() {
            return unique;
        }

        /**
         * Returned from {@link IndexDeclaration#options()}.
         */
        public static class Builder {

            private List<IndexDeclaration> fields = null;
            private boolean unique = false;
            private boolean sparse = false;
            private Long expireAfterSeconds = null;
            private boolean background = false;
            private boolean cls = true;

            private Builder() {}

            /**
             * Configure the option to build the index in the background.
             *
             * @param background
             * @return this
             */
            public Builder background(boolean background) {
                this.background = background;
                return this;
            }

            /**
             * Build the {@link OptionsRecord}.
             *
             * @return the {@link OptionsRecord}
             */
            public OptionsRecord build() {
                return new OptionsRecord(fields, unique, sparse,
                        expireAfterSeconds, background, cls);
            }

            /**
             * Configure whether the discriminator key may be prefixed to the
             * index.
             *
             * @param cls
             * @return this
             */
            public Builder cls(boolean cls) {
                this.cls = cls;
                return this;
            }

            /**
             * Configure the number of seconds after which indexed documents
             * expire.
             *
             * @param expireAfterSeconds
             * @return this
             */
            public Builder expireAfterSeconds(long expireAfterSeconds) {
                this.expireAfterSeconds = expireAfterSeconds;
                return this;
            }

            /**
             * Set the field refs, each of which is a path {@link String}, a
             * field ref {@link IndexDeclaration} or a (path, direction) pair.
             *
             * @param fields
             * @return this
             */
            public Builder fields(Object... fields) {
                ImmutableList.Builder<IndexDeclaration> builder = ImmutableList
                        .builder();
                Arrays.stream(fields)
                        .forEach(field -> builder.add(element(field)));
                this.fields = builder.build();
                return this;
            }

            /**
             * Configure the option to skip documents without the key.
             *
             * @param sparse
             * @return this
             */
            public Builder sparse(boolean sparse) {
                this.sparse = sparse;
                return this;
            }

            /**
             * Configure the option to reject duplicate values.
             *
             * @param unique
             * @return this
             */
            public Builder unique(boolean unique) {
                this.unique = unique;
                return this;
            }
        }
    }

}
