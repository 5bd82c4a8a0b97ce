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
package com.cinchapi.hangar.schema;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.cinchapi.hangar.ConfigurationException;
import com.cinchapi.hangar.index.IndexCompiler;
import com.cinchapi.hangar.index.IndexKey;
import com.cinchapi.hangar.index.IndexSpec;
import com.google.common.collect.ImmutableList;

/**
 * Unit tests for {@link SchemaRegistry} and the relationships between the
 * {@link Schema Schemas} it owns.
 */
public class SchemaRegistryTest {

    private SchemaRegistry registry;

    @Before
    public void setUp() {
        registry = new SchemaRegistry();
    }

    @Test
    public void testLookup() {
        Schema user = registry.register(Schema.builder("User").build());
        Assert.assertTrue(registry.contains("User"));
        Assert.assertSame(user, registry.get("User"));
        Assert.assertSame(user, registry.schema("User"));
        Assert.assertNull(registry.get("Other"));
    }

    @Test(expected = ConfigurationException.class)
    public void testUnknownSchema() {
        registry.schema("Other");
    }

    @Test(expected = ConfigurationException.class)
    public void testParentMustBeRegistered() {
        registry.register(Schema.builder("Dog").parent("Animal").build());
    }

    @Test(expected = ConfigurationException.class)
    public void testParentMustAllowInheritance() {
        registry.register(
                Schema.builder("Animal").allowInheritance(false).build());
        registry.register(Schema.builder("Dog").parent("Animal").build());
    }

    @Test(expected = ConfigurationException.class)
    public void testEmbeddedParentOfDocument() {
        registry.register(Schema.embedded("Animal").build());
        registry.register(Schema.builder("Dog").parent("Animal").build());
    }

    @Test(expected = ConfigurationException.class)
    public void testDuplicateName() {
        registry.register(Schema.builder("User").build());
        registry.register(Schema.builder("User").build());
    }

    @Test(expected = ConfigurationException.class)
    public void testDuplicateField() {
        Schema.builder("User").field("name", FieldType.STRING)
                .field("name", FieldType.INT);
    }

    @Test
    public void testCollectionNames() {
        Schema base = registry.register(
                Schema.builder("UserBase").abstractSchema().build());
        Schema post = registry.register(Schema.builder("BlogPost").build());
        Schema custom = registry
                .register(Schema.builder("Log").collection("logs").build());
        Schema child = registry
                .register(Schema.builder("Entry").parent("Log").build());
        Schema person = registry
                .register(Schema.builder("Person").parent("UserBase").build());
        Schema comment = registry
                .register(Schema.embedded("Comment").build());
        Assert.assertNull(base.collection());
        Assert.assertEquals("blog_post", post.collection());
        Assert.assertEquals("logs", custom.collection());
        Assert.assertEquals("logs", child.collection());
        Assert.assertEquals("person", person.collection());
        Assert.assertNull(comment.collection());
    }

    @Test
    public void testInheritance() {
        Schema animal = registry.register(Schema.builder("Animal")
                .field("name", FieldType.STRING).build());
        Schema dog = registry.register(Schema.builder("Dog").parent("Animal")
                .field("breed", FieldType.STRING).build());
        Schema puppy = registry.register(
                Schema.builder("Puppy").parent("Dog").build());
        Assert.assertEquals(ImmutableList.of(animal, dog), puppy.ancestors());
        Assert.assertNotNull(puppy.field("name"));
        Assert.assertEquals(ImmutableList.of("name", "breed"),
                ImmutableList.copyOf(dog.fields()).stream()
                        .map(FieldDescriptor::name)
                        .collect(ImmutableList.toImmutableList()));
        Assert.assertTrue(dog.isPolymorphic());
        Assert.assertTrue(puppy.isPolymorphic());
    }

    @Test(expected = ConfigurationException.class)
    public void testChildCannotTurnOffInheritanceInSharedCollection() {
        registry.register(Schema.builder("Post")
                .field("title", FieldType.STRING).indexes("title").build());
        registry.register(Schema.builder("Draft").parent("Post")
                .allowInheritance(false).build());
    }

    @Test(expected = ConfigurationException.class)
    public void testChildCannotTurnOffInheritanceBelowAbstractSchema() {
        registry.register(Schema.builder("Post").build());
        registry.register(
                Schema.builder("Note").parent("Post").abstractSchema().build());
        registry.register(Schema.builder("Draft").parent("Note")
                .allowInheritance(false).build());
    }

    @Test
    public void testRejectedChildIsNotRegistered() {
        registry.register(Schema.builder("Post").build());
        try {
            registry.register(Schema.builder("Draft").parent("Post")
                    .allowInheritance(false).build());
            Assert.fail();
        }
        catch (ConfigurationException e) {
            Assert.assertTrue(e.getMessage().contains("Post"));
        }
        Assert.assertFalse(registry.contains("Draft"));
    }

    @Test
    public void testChildOfAbstractSchemaMayTurnOffInheritance() {
        registry.register(Schema.builder("UserBase").abstractSchema()
                .field("user_guid", FieldType.STRING).indexes("user_guid")
                .build());
        Schema person = registry.register(Schema.builder("Person")
                .parent("UserBase").allowInheritance(false)
                .field("name", FieldType.STRING).indexes("name").build());
        Assert.assertFalse(person.isPolymorphic());
        Assert.assertEquals(
                ImmutableList.of(IndexSpec.of(IndexKey.ascending("user_guid")),
                        IndexSpec.of(IndexKey.ascending("name"))),
                IndexCompiler.compile(person));
    }

    @Test
    public void testAbstractSchemaWithoutInheritanceCanBeSubclassed() {
        registry.register(Schema.builder("UserBase").abstractSchema()
                .allowInheritance(false).field("user_guid", FieldType.STRING)
                .indexes("user_guid").build());
        Schema person = registry.register(Schema.builder("Person")
                .parent("UserBase").field("name", FieldType.STRING)
                .indexes("name").build());
        Assert.assertFalse(person.isPolymorphic());
        Assert.assertEquals("person", person.collection());
        Assert.assertEquals(
                ImmutableList.of(IndexSpec.of(IndexKey.ascending("user_guid")),
                        IndexSpec.of(IndexKey.ascending("name"))),
                IndexCompiler.compile(person));
    }

    @Test(expected = ConfigurationException.class)
    public void testConcreteChildOfAbstractSchemaWithoutInheritanceIsFinal() {
        registry.register(Schema.builder("UserBase").abstractSchema()
                .allowInheritance(false).build());
        registry.register(
                Schema.builder("Person").parent("UserBase").build());
        registry.register(
                Schema.builder("Employee").parent("Person").build());
    }

    @Test
    public void testAllFollowsRegistrationOrder() {
        for (String name : ImmutableList.of("Zebra", "Apple", "Mango")) {
            registry.register(Schema.builder(name).build());
        }
        Assert.assertEquals(ImmutableList.of("Zebra", "Apple", "Mango"),
                registry.all().stream().map(Schema::name)
                        .collect(ImmutableList.toImmutableList()));
    }

    @Test
    public void testEmbeddedSchemasAreNeverPolymorphic() {
        Schema comment = registry
                .register(Schema.embedded("Comment").build());
        Assert.assertTrue(comment.allowsInheritance());
        Assert.assertFalse(comment.isPolymorphic());
    }

    @Test
    public void testSelfEmbeddingIsRepresentable() {
        Schema node = registry.register(Schema.embedded("Node")
                .field(FieldDescriptor.builder("child").embedded("Node")
                        .build())
                .build());
        Assert.assertSame(node, node.nested(node.field("child")));
    }

}
