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

import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.cinchapi.hangar.ConfigurationException;
import com.cinchapi.hangar.DbField;
import com.cinchapi.hangar.Document;
import com.cinchapi.hangar.EmbeddedDocument;
import com.cinchapi.hangar.GeoPoint;
import com.cinchapi.hangar.Index;
import com.cinchapi.hangar.Meta;
import com.cinchapi.hangar.Unique;
import com.cinchapi.hangar.index.Direction;
import com.cinchapi.hangar.index.IndexDeclaration;
import com.google.common.collect.ImmutableList;

/**
 * Unit tests for {@link SchemaAnalyzer}.
 */
public class SchemaAnalyzerTest {

    private SchemaRegistry registry;
    private SchemaAnalyzer analyzer;

    @Before
    public void setUp() {
        registry = new SchemaRegistry();
        analyzer = new SchemaAnalyzer(registry);
    }

    @Test
    public void testFieldTypes() {
        Schema schema = analyzer.register(Sample.class);
        Assert.assertEquals(FieldType.STRING, schema.field("name").type());
        Assert.assertEquals(FieldType.INT, schema.field("count").type());
        Assert.assertEquals(FieldType.LONG, schema.field("total").type());
        Assert.assertEquals(FieldType.DOUBLE, schema.field("score").type());
        Assert.assertEquals(FieldType.BOOLEAN, schema.field("active").type());
        Assert.assertEquals(FieldType.DATETIME, schema.field("created").type());
        Assert.assertEquals(FieldType.LIST, schema.field("tags").type());
        Assert.assertEquals(FieldType.DICT, schema.field("extra").type());
        Assert.assertEquals(FieldType.GEO_POINT,
                schema.field("location").type());
        Assert.assertEquals(FieldType.EMBEDDED, schema.field("address").type());
        Assert.assertEquals("Address", schema.field("address").target());
        Assert.assertEquals(FieldType.EMBEDDED_LIST,
                schema.field("history").type());
        Assert.assertEquals("Address", schema.field("history").target());
        Assert.assertEquals(FieldType.REFERENCE, schema.field("owner").type());
        Assert.assertEquals("Owner", schema.field("owner").target());
        Assert.assertNull(schema.field("cache"));
        Assert.assertNull(schema.field("VERSION"));
    }

    @Test
    public void testPrimaryKeyIsInherited() {
        Schema schema = analyzer.register(Sample.class);
        FieldDescriptor id = schema.field("id");
        Assert.assertTrue(id.isPrimaryKey());
        Assert.assertEquals("_id", id.storageKey());
    }

    @Test
    public void testFieldAnnotations() {
        Schema schema = analyzer.register(Sample.class);
        Assert.assertEquals("n", schema.field("name").storageKey());
        Assert.assertTrue(schema.field("name").isUnique());
        Assert.assertEquals(ImmutableList.of("created"),
                schema.field("name").uniqueWith());
    }

    @Test
    public void testTargetsAreRegistered() {
        analyzer.register(Sample.class);
        Assert.assertTrue(registry.contains("Address"));
        Assert.assertTrue(registry.contains("Owner"));
        Assert.assertTrue(registry.schema("Address").isEmbedded());
    }

    @Test
    public void testIndexAnnotations() {
        Schema schema = analyzer.register(Sample.class);
        Assert.assertEquals(ImmutableList.of(
                IndexDeclaration.field("-created"),
                IndexDeclaration.field("created", Direction.DESCENDING),
                IndexDeclaration.sequence("name", "-created"),
                IndexDeclaration.options().fields("tags").sparse(true)
                        .cls(false).build(),
                IndexDeclaration.options().fields("extra.key")
                        .expireAfterSeconds(60).build()),
                schema.indexes());
    }

    @Test
    public void testMetaAndHierarchy() {
        Schema child = analyzer.register(Child.class);
        Schema base = registry.schema("Base");
        Assert.assertTrue(base.isAbstract());
        Assert.assertSame(base, child.parent());
        Assert.assertEquals("child", child.collection());
        Assert.assertFalse(child.isAutoCreateIndex());
        Assert.assertTrue(child.indexBackground());
        Assert.assertTrue(child.allowsInheritance());
        Assert.assertNotNull(child.field("code"));
    }

    @Test
    public void testRegisteringTwiceReturnsSameSchema() {
        Assert.assertSame(analyzer.register(Sample.class),
                analyzer.register(Sample.class));
        Assert.assertSame(analyzer.get(Sample.class),
                registry.schema("Sample"));
    }

    @Test(expected = ConfigurationException.class)
    public void testSubclassOfFinalType() {
        analyzer.register(Rebel.class);
    }

    @Test
    public void testFailedRegistrationRollsBackDependencies() {
        try {
            analyzer.register(Rebel.class);
            Assert.fail();
        }
        catch (ConfigurationException e) {
            Assert.assertTrue(e.getMessage().contains("Loner"));
        }
        Assert.assertNull(analyzer.get(Loner.class));
        Assert.assertFalse(registry.contains("Loner"));
        Assert.assertFalse(registry.contains("Rebel"));
        Assert.assertSame(analyzer.register(Loner.class),
                registry.schema("Loner"));
    }

    @Test
    public void testInvalidIndexRollsBackEmbeddedTargets() {
        try {
            analyzer.register(Misfiled.class);
            Assert.fail();
        }
        catch (ConfigurationException e) {
            Assert.assertTrue(e.getMessage().contains("address.zip"));
        }
        Assert.assertNull(analyzer.get(Misfiled.class));
        Assert.assertNull(analyzer.get(Address.class));
        Assert.assertTrue(registry.all().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNotADocument() {
        analyzer.register(String.class);
    }

    @Test
    public void testScan() {
        Set<Class<?>> classes = SchemaAnalyzer
                .scan("com.cinchapi.hangar.scan");
        Assert.assertFalse(classes.isEmpty());
        for (Class<?> clazz : classes) {
            Assert.assertTrue(clazz.getName()
                    .startsWith("com.cinchapi.hangar.scan."));
        }
    }

    @Index("-created")
    @Index({ "created", "desc" })
    @Index({ "name", "-created" })
    @Index(fields = "tags", sparse = true, cls = false)
    @Index(value = "extra.key", expireAfterSeconds = 60)
    static class Sample extends Document {

        static final int VERSION = 1;

        @DbField("n")
        @Unique(with = "created")
        String name;
        int count;
        Long total;
        double score;
        boolean active;
        Date created;
        List<String> tags;
        Map<String, Object> extra;
        @GeoPoint
        double[] location;
        Address address;
        List<Address> history;
        Owner owner;
        transient String cache;
    }

    static class Address extends EmbeddedDocument {
        String street;
    }

    static class Owner extends Document {
        String name;
    }

    @Meta(autoCreateIndex = false, indexBackground = true)
    abstract static class Base extends Document {
        String code;
    }

    static class Child extends Base {
        String label;
    }

    @Meta(allowInheritance = false)
    static class Loner extends Document {}

    static class Rebel extends Loner {}

    @Index("address.zip")
    static class Misfiled extends Document {
        Address address;
    }

}
