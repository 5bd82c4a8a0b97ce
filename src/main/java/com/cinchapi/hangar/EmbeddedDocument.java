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
 * The base class for every type whose instances are only ever stored inline
 * within other documents.
 * <p>
 * An embedded document has no collection or primary key. Its indexes and
 * unique fields apply to the documents that embed it, under the path of the
 * embedding field.
 * </p>
 */
public abstract class EmbeddedDocument {}
