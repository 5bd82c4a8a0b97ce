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
package com.cinchapi.hangar;

/**
 * A {@link ConfigurationException} is thrown when a schema cannot be
 * registered because its declarations are invalid (e.g. an index declaration
 * is malformed or refers to a field that doesn't exist).
 */
@SuppressWarnings("serial")
public class ConfigurationException extends RuntimeException {

    /**
     * Construct a new instance.
     *
     * @param message
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Construct a new instance.
     *
     * @param message
     * @param cause
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

}
