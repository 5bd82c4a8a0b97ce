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

import javax.annotation.concurrent.Immutable;

/**
 * An {@link IndexSpec} that was normalized from an {@link IndexDeclaration},
 * along with whether the declaration lets the discriminator key be prefixed to
 * it.
 */
@Immutable
final class NormalizedIndex {

    private final IndexSpec spec;
    private final boolean discriminable;

    NormalizedIndex(IndexSpec spec, boolean discriminable) {
        this.spec = spec;
        this.discriminable = discriminable;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof NormalizedIndex) {
            NormalizedIndex other = (NormalizedIndex) obj;
            return spec.equals(other.spec)
                    && discriminable == other.discriminable;
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(spec, discriminable);
    }

    /**
     * Return {@code true} if the discriminator key may be prefixed to the
     * {@link #spec()} when the owning schema uses polymorphic storage.
     *
     * @return boolean
     */
    boolean isDiscriminable() {
        return discriminable && !spec.isGeospatial()
                && !spec.options().sparse();
    }

    /**
     * Return the normalized spec, without any discriminator prefix.
     *
     * @return the spec
     */
    IndexSpec spec() {
        return spec;
    }

    @Override
    public String toString() {
        return spec.toString();
    }

}
