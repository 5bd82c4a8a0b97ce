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

import com.google.common.base.Preconditions;

/**
 * One component of an {@link IndexSpec}: a physical storage key and the
 * {@link Direction} in which it is indexed.
 */
@Immutable
public final class IndexKey {

    /**
     * Return an {@link IndexKey} for {@code key} in ascending order.
     *
     * @param key
     * @return the {@link IndexKey}
     */
    public static IndexKey ascending(String key) {
        return of(key, Direction.ASCENDING);
    }

    /**
     * Return an {@link IndexKey} for {@code key} in descending order.
     *
     * @param key
     * @return the {@link IndexKey}
     */
    public static IndexKey descending(String key) {
        return of(key, Direction.DESCENDING);
    }

    /**
     * Return a geospatial {@link IndexKey} for {@code key}.
     *
     * @param key
     * @return the {@link IndexKey}
     */
    public static IndexKey geo2d(String key) {
        return of(key, Direction.GEO2D);
    }

    /**
     * Return an {@link IndexKey} for {@code key} in the specified
     * {@code direction}.
     *
     * @param key
     * @param direction
     * @return the {@link IndexKey}
     */
    public static IndexKey of(String key, Direction direction) {
        return new IndexKey(key, direction);
    }

    private final String key;
    private final Direction direction;

    private IndexKey(String key, Direction direction) {
        Preconditions.checkArgument(key != null && !key.isEmpty(),
                "An index key cannot be empty");
        this.key = key;
        this.direction = Preconditions.checkNotNull(direction);
    }

    /**
     * Return the {@link Direction}.
     *
     * @return the direction
     */
    public Direction direction() {
        return direction;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof IndexKey) {
            IndexKey other = (IndexKey) obj;
            return key.equals(other.key) && direction == other.direction;
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, direction);
    }

    /**
     * Return the physical storage key.
     *
     * @return the key
     */
    public String key() {
        return key;
    }

    @Override
    public String toString() {
        return "(" + key + ", " + direction + ")";
    }

}
