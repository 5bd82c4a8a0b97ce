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

import java.util.Objects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A parameter object that encapsulates the options of an {@link IndexSpec}.
 */
@Immutable
public final class IndexOptions {

    /**
     * Return a builder to construct the preferred {@link IndexOptions}.
     *
     * @return a builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return the default {@link IndexOptions}.
     *
     * @return default {@link IndexOptions}
     */
    public static IndexOptions defaults() {
        return DEFAULTS;
    }

    private static final IndexOptions DEFAULTS = builder().build();

    /**
     * A boolean that indicates if the index rejects duplicate values.
     */
    private final boolean unique;

    /**
     * A boolean that indicates if the index skips documents that don't have
     * the indexed key.
     */
    private final boolean sparse;

    /**
     * The number of seconds after which indexed documents expire, if any.
     */
    @Nullable
    private final Long expireAfterSeconds;

    /**
     * A boolean that indicates if the index should be built in the background.
     */
    private final boolean background;

    private IndexOptions(boolean unique, boolean sparse,
            @Nullable Long expireAfterSeconds, boolean background) {
        this.unique = unique;
        this.sparse = sparse;
        this.expireAfterSeconds = expireAfterSeconds;
        this.background = background;
    }

    /**
     * Return if the index should be built in the background.
     *
     * @return boolean
     */
    public boolean background() {
        return background;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof IndexOptions) {
            IndexOptions other = (IndexOptions) obj;
            return background == other.background && sameConstraints(other);
        }
        else {
            return false;
        }
    }

    /**
     * Return the number of seconds after which indexed documents expire, or
     * {@code null} if documents never expire.
     *
     * @return the expiry
     */
    @Nullable
    public Long expireAfterSeconds() {
        return expireAfterSeconds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(unique, sparse, expireAfterSeconds, background);
    }

    /**
     * Return {@code true} if {@code other} enforces the same constraints as
     * these options. Build-time hints (e.g. {@link #background()}) are not
     * part of what a built index remembers, so they are ignored.
     *
     * @param other
     * @return {@code true} if the options describe the same built index
     */
    public boolean sameConstraints(IndexOptions other) {
        return unique == other.unique && sparse == other.sparse
                && Objects.equals(expireAfterSeconds, other.expireAfterSeconds);
    }

    /**
     * Return if documents without the indexed key are skipped.
     *
     * @return boolean
     */
    public boolean sparse() {
        return sparse;
    }

    /**
     * Return a builder that starts with these options.
     *
     * @return a builder
     */
    public Builder toBuilder() {
        return builder().unique(unique).sparse(sparse)
                .expireAfterSeconds(expireAfterSeconds).background(background);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("unique", unique).add("sparse", sparse)
                .add("expireAfterSeconds", expireAfterSeconds)
                .add("background", background).toString();
    }

    /**
     * Return if duplicate values are rejected.
     *
     * @return boolean
     */
    public boolean unique() {
        return unique;
    }

    /**
     * Return the options that result from layering {@code other} on top of
     * these: each flag that is set in either is set in the result and an
     * expiry in {@code other} wins.
     *
     * @param other
     * @return the merged options
     */
    public IndexOptions union(IndexOptions other) {
        Long expiry = other.expireAfterSeconds != null
                ? other.expireAfterSeconds
                : expireAfterSeconds;
        return builder().unique(unique || other.unique)
                .sparse(sparse || other.sparse).expireAfterSeconds(expiry)
                .background(background || other.background).build();
    }

    /**
     * Returned from {@link #builder()}.
     */
    public static class Builder {

        private boolean unique = false;
        private boolean sparse = false;
        private Long expireAfterSeconds = null;
        private boolean background = false;

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
         * Build the {@link IndexOptions} with the parameters that were
         * provided to this builder.
         *
         * @return the {@link IndexOptions}
         */
        public IndexOptions build() {
            return new IndexOptions(unique, sparse, expireAfterSeconds,
                    background);
        }

        /**
         * Configure the number of seconds after which indexed documents
         * expire. A {@code null} or negative value means never.
         *
         * @param expireAfterSeconds
         * @return this
         */
        public Builder expireAfterSeconds(@Nullable Long expireAfterSeconds) {
            this.expireAfterSeconds = expireAfterSeconds == null
                    || expireAfterSeconds < 0 ? null : expireAfterSeconds;
            return this;
        }

        /**
         * Configure the option to skip documents that don't have the indexed
         * key.
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

        /**
         * Configure the number of seconds after which indexed documents
         * expire.
         *
         * @param expireAfterSeconds
         * @return this
         */
        public Builder expireAfterSeconds(long expireAfterSeconds) {
            Preconditions.checkArgument(expireAfterSeconds >= 0,
                    "The expiry cannot be negative");
            return expireAfterSeconds(Long.valueOf(expireAfterSeconds));
        }
    }

}
