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

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.cinchapi.hangar.schema.FieldDescriptor;
import com.cinchapi.hangar.schema.FieldType;
import com.cinchapi.hangar.schema.Schema;
import com.cinchapi.hangar.schema.SchemaRegistry;
import com.google.common.collect.ImmutableList;

/**
 * Unit tests for {@link GeoIndexCollector}.
 */
public class GeoIndexCollectorTest {

    private SchemaRegistry registry;

    @Before
    public void setUp() {
        registry = new SchemaRegistry();
    }

    @Test
    public void testGeoPointField() {
        Schema place = registry.register(Schema.builder("Place")
                .field("location", FieldType.GEO_POINT).build());
        Assert.assertEquals(
                ImmutableList.of(IndexSpec.of(IndexKey.geo2d("location"))),
                GeoIndexCollector.collect(place));
    }

    @Test
    public void testGeoPointsInEmbeddedDocumentsAndLists() {
        registry.register(Schema.embedded("Address")
                .field(FieldDescriptor.builder("point").storageKey("p")
                        .type(FieldType.GEO_POINT).build())
                .build());
        Schema venue = registry.register(Schema.builder("Venue")
                .field(FieldDescriptor.builder("address").embedded("Address")
                        .build())
                .field(FieldDescriptor.builder("branches")
                        .embeddedList("Address").build())
                .build());
        Assert.assertEquals(
                ImmutableList.of(IndexSpec.of(IndexKey.geo2d("address.p")),
                        IndexSpec.of(IndexKey.geo2d("branches.p"))),
                GeoIndexCollector.collect(venue));
    }

    @Test
    public void testReferencesAreNotFollowed() {
        Schema location = registry.register(Schema.builder("Location")
                .field("location", FieldType.GEO_POINT).build());
        Schema parent = registry.register(Schema.builder("Parent")
                .field("name", FieldType.STRING)
                .field(FieldDescriptor.builder("location")
                        .reference("Location").build())
                .build());
        Assert.assertTrue(GeoIndexCollector.collect(parent).isEmpty());
        Assert.assertEquals(1, GeoIndexCollector.collect(location).size());
    }

    @Test
    public void testRecursiveEmbeddingTerminates() {
        registry.register(Schema.embedded("RecursiveObject")
                .field(FieldDescriptor.builder("obj")
                        .embedded("RecursiveObject").build())
                .field(FieldDescriptor.builder("children")
                        .embeddedList("RecursiveObject").build())
                .build());
        Schema recursive = registry.register(Schema.builder("RecursiveDocument")
                .field(FieldDescriptor.builder("recursive_obj")
                        .embedded("RecursiveObject").build())
                .build());
        Assert.assertTrue(GeoIndexCollector.collect(recursive).isEmpty());
    }

}
