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

import javax.annotation.Nullable;

/**
 * The ordering (or special marker) that an {@link IndexKey} applies to the
 * values stored under its key.
 */
public enum Direction {

    ASCENDING(1), DESCENDING(-1), GEO2D("2d");

    /**
     * Return the {@link Direction} whose {@link #value() stored value} is
     * {@code value}, or {@code null} if there is no match.
     *
     * @param value
     * @return the matching {@link Direction} or {@code null}
     */
    @Nullable
    public static Direction fromValue(Object value) {
        if(value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if(number > 0) {
                return ASCENDING;
            }
            else if(number < 0) {
                return DESCENDING;
            }
            else {
                return null;
            }
        }
        else if(value instanceof String) {
            return parse((String) value);
        }
        else {
            return null;
        }
    }

    /**
     * Return the {@link Direction} that is described by {@code token}, or
     * {@code null} if {@code token} isn't a direction token.
     * <p>
     * Recognized tokens are {@code 1}, {@code -1}, {@code 2d}, {@code asc} and
     * {@code desc}.
     * </p>
     *
     * @param token
     * @return the matching {@link Direction} or {@code null}
     */
    @Nullable
    public static Direction parse(String token) {
        switch (token.trim().toLowerCase()) {
        case "1":
        case "asc":
        case "ascending":
            return ASCENDING;
        case "-1":
        case "desc":
        case "descending":
            return DESCENDING;
        case "2d":
            return GEO2D;
        default:
            return null;
        }
    }

    /**
     * The value that the backing store uses for this {@link Direction}.
     */
    private final Object value;

    Direction(Object value) {
        this.value = value;
    }

    /**
     * Return {@code true} if this is a geospatial marker instead of a sort
     * order.
     *
     * @return {@code true} if this {@link Direction} is geospatial
     */
    public boolean isGeospatial() {
        return this == GEO2D;
    }

    /**
     * Return the value that the backing store uses for this {@link Direction}
     * (e.g. {@code 1}, {@code -1} or {@code "2d"}).
     *
     * @return the stored value
     */
    public Object value() {
        return value;
    }

    @Override
    public String toString() {
        return value.toString();
    }

}
