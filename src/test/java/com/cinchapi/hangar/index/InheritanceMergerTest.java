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

import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.cinchapi.hangar.schema.FieldDescriptor;
import com.cinchapi.hangar.schema.FieldType;
import com.cinchapi.hangar.schema.Schema;
import com.cinchapi.hangar.schema.SchemaRegistry;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Unit tests for {@link InheritanceMerger}.
 */
public class InheritanceMergerTest {

    private SchemaRegistry registry;

    @Before
    public void setUp() {
        registry = new SchemaRegistry();
    }

    @Test
    public void testPolymorphicSpecsArePrefixedWithDiscriminator() {
        Schema post = registry.register(Schema.builder("BlogPost")
                .field(FieldDescriptor.builder("date").storageKey("addDate")
                        .type(FieldType.DATETIME).build())
                .field("tags", FieldType.LIST)
                .field("category", FieldType.STRING)
                .indexes("-date", "tags", ImmutableList.of("category", "-date"))
                .build());
        Assert.assertEquals(ImmutableList.of(
                IndexSpec.of(IndexKey.ascending("_cls"),
                        IndexKey.descending("addDate")),
                IndexSpec.of(IndexKey.ascending("_cls"),
                        IndexKey.ascending("tags")),
                IndexSpec.of(IndexKey.ascending("_cls"),
                        IndexKey.ascending("category"),
                        IndexKey.descending("addDate"))),
                InheritanceMerger.merge(post));
    }

    @Test
    public void testNonPolymorphicSpecsAreNotPrefixed() {
        Schema post = registry.register(Schema.builder("BlogPost")
                .field("keywords", FieldType.LIST).allowInheritance(false)
                .indexes("keywords").build());
        Assert.assertEquals(
                ImmutableList.of(IndexSpec.of(IndexKey.ascending("keywords"))),
                InheritanceMerger.merge(post));
    }

    @Test
    public void testGeospatialSparseAndClsFalseSpecsAreNotPrefixed() {
        Schema place = registry.register(Schema.builder("Place")
                .field("location", FieldType.DICT)
                .field("email", FieldType.STRING)
                .field("name", FieldType.STRING)
                .indexes("*location.point",
                        ImmutableMap.of("fields", ImmutableList.of("email"),
                                "sparse", true),
                        ImmutableMap.of("fields", ImmutableList.of("name"),
                                "cls", false))
                .build());
        List<IndexSpec> merged = InheritanceMerger.merge(place);
        Assert.assertEquals(IndexSpec.of(IndexKey.geo2d("location.point")),
                merged.get(0));
        Assert.assertEquals(ImmutableList.of(IndexKey.ascending("email")),
                merged.get(1).keys());
        Assert.assertTrue(merged.get(1).options().sparse());
        Assert.assertEquals(IndexSpec.of(IndexKey.ascending("name")),
                merged.get(2));
    }

    @Test
    public void testAbstractAncestorDeclarationsComeFirst() {
        registry.register(Schema.builder("UserBase")
                .field("user_guid", FieldType.STRING).abstractSchema()
                .indexes("user_guid").build());
        Schema person = registry.register(Schema.builder("Person")
                .parent("UserBase").field("name", FieldType.STRING)
                .indexes("name").build());
        Assert.assertEquals(ImmutableList.of(
                IndexSpec.of(IndexKey.ascending("_cls"),
                        IndexKey.ascending("user_guid")),
                IndexSpec.of(IndexKey.ascending("_cls"),
                        IndexKey.ascending("name"))),
                InheritanceMerger.merge(person));
    }

    @Test
    public void testChildWithoutDeclarationsMatchesParent() {
        Schema parent = registry.register(Schema.builder("Animal")
                .field("name", FieldType.STRING).indexes("name", "-pk")
                .build());
        Schema child = registry.register(
                Schema.builder("Dog").parent("Animal").build());
        Assert.assertEquals(InheritanceMerger.merge(parent),
                InheritanceMerger.merge(child));
    }

    @Test
    public void testChildIsSupersetOfParentWithoutDuplicates() {
        Schema parent = registry.register(Schema.builder("Animal")
                .field("name", FieldType.STRING).indexes("name").build());
        Schema child = registry.register(Schema.builder("Dog")
                .parent("Animal").field("breed", FieldType.STRING)
                .indexes("name", "breed").build());
        List<IndexSpec> merged = InheritanceMerger.merge(child);
        Assert.assertEquals(2, merged.size());
        Assert.assertTrue(merged.containsAll(InheritanceMerger.merge(parent)));
        Assert.assertEquals(InheritanceMerger.merge(parent).get(0),
                merged.get(0));
    }

    @Test
    public void testSpecOnPrimaryKeyAndEmbeddedList() {
        registry.register(Schema.embedded("Comment")
                .field("comment_id", FieldType.INT).build());
        Schema post = registry.register(Schema.builder("BlogPost")
                .field(FieldDescriptor.builder("comments")
                        .embeddedList("Comment").build())
                .indexes(ImmutableMap.of("fields",
                        ImmutableList.of("pk", "comments.comment_id"),
                        "unique", true))
                .build());
        List<IndexSpec> merged = InheritanceMerger.merge(post);
        Assert.assertEquals(1, merged.size());
        Assert.assertEquals(ImmutableList.of(IndexKey.ascending("_cls"),
                IndexKey.ascending("_id"),
                IndexKey.ascending("comments.comment_id")),
                merged.get(0).keys());
        Assert.assertTrue(merged.get(0).options().unique());
    }

}
