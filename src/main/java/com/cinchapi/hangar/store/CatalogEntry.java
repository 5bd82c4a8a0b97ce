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
package com.cinchapi.hangar.store;

import java.util.List;
import java.util.Objects;

import javax.annotation.concurrent.Immutable;

import com.cinchapi.hangar.index.IndexKey;
import com.cinchapi.hangar.index.IndexOptions;
import com.cinchapi.hangar.index.IndexSpec;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A snapshot of one index that physically exists in a collection.
 */
@Immutable
public final class CatalogEntry {

    /**
     * Return a {@link CatalogEntry} that describes the index that would be
     * created for {@code spec} under its {@link IndexSpec#name() default
     * name}.
     *
     * @param spec
     * @return the {@link CatalogEntry}
     */
    public static CatalogEntry of(IndexSpec spec) {
        return new CatalogEntry(spec.name(), spec);
    }

    /**
     * Return a {@link CatalogEntry}.
     *
     * @param name
     * @param keys
     * @param options
     * @return the {@link CatalogEntry}
     */
    public static CatalogEntry of(String name, List<IndexKey> keys,
            IndexOptions options) {
        return new CatalogEntry(name, IndexSpec.of(keys, options));
    }

    private final String name;
    private final IndexSpec spec;

    private CatalogEntry(String name, IndexSpec spec) {
        this.name = Preconditions.checkNotNull(name);
        this.spec = spec;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof CatalogEntry) {
            CatalogEntry other = (CatalogEntry) obj;
            return name.equals(other.name) && spec.equals(other.spec);
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, spec);
    }

    /**
     * Return {@code true} if this index has the same keys as {@code spec}.
     *
     * @param spec
     * @return boolean
     */
    public boolean hasKeys(IndexSpec spec) {
        return this.spec.keys().equals(spec.keys());
    }

    /**
     * Return {@code true} if this index has the same keys as {@code spec} and
     * enforces the same constraints. The {@link IndexOptions#background()
     * background} option only affects how an index is built, so it is
     * ignored.
     *
     * @param spec
     * @return boolean
     */
    public boolean matches(IndexSpec spec) {
        return hasKeys(spec)
                && this.spec.options().sameConstraints(spec.options());
    }

    /**
     * Return the keys.
     *
     * @return the keys
     */
    public List<IndexKey> keys() {
        return spec.keys();
    }

    /**
     * Return the name of the index.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Return the options.
     *
     * @return the options
     */
    public IndexOptions options() {
        return spec.options();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", name)
                .add("spec", spec).toString();
    }

}
