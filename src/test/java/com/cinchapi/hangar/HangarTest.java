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

import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.cinchapi.hangar.index.IndexKey;
import com.cinchapi.hangar.index.IndexSpec;
import com.cinchapi.hangar.schema.Schema;
import com.cinchapi.hangar.store.CatalogEntry;
import com.cinchapi.hangar.store.DuplicateKeyException;
import com.cinchapi.hangar.store.InMemoryIndexStore;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Unit tests for {@link Hangar}.
 */
public class HangarTest {

    private InMemoryIndexStore store;
    private Hangar hangar;

    @Before
    public void setUp() {
        store = new InMemoryIndexStore();
        hangar = Hangar.builder().store(store).build();
    }

    @After
    public void tearDown() {
        hangar.close();
    }

    @Test
    public void testIndexesWithInheritance() {
        Assert.assertEquals(ImmutableList.of(
                IndexSpec.of(IndexKey.ascending("_cls"),
                        IndexKey.descending("addDate")),
                IndexSpec.of(IndexKey.ascending("_cls"),
                        IndexKey.ascending("tags")),
                IndexSpec.of(IndexKey.ascending("_cls"),
                        IndexKey.ascending("category"),
                        IndexKey.descending("addDate"))),
                hangar.indexSpecs(BlogPost.class));
        hangar.ensureIndexes(BlogPost.class);
        Assert.assertEquals(4, store.catalog("blog_post").size());
    }

    @Test
    public void testSubclassWithoutIndexesSharesParentIndexes() {
        Assert.assertEquals(hangar.indexSpecs(BlogPost.class),
                hangar.indexSpecs(ExtendedBlogPost.class));
        Assert.assertEquals("blog_post",
                hangar.schema(ExtendedBlogPost.class).collection());
    }

    @Test
    public void testExplicitGeoIndex() {
        Assert.assertEquals(
                ImmutableList.of(IndexSpec.of(IndexKey.geo2d("location.point"))),
                hangar.indexSpecs(Place.class));
        Assert.assertEquals(hangar.indexSpecs(Place.class),
                hangar.geoIndexes(Place.class));
    }

    @Test
    public void testIndexesWithoutInheritance() {
        Assert.assertEquals(
                ImmutableList.of(IndexSpec.of(IndexKey.ascending("keywords"))),
                hangar.indexSpecs(KeywordPost.class));
        hangar.ensureIndexes(KeywordPost.class);
        Set<String> names = names("keyword_post");
        hangar.ensureIndexes(KeywordPost.class);
        Assert.assertEquals(ImmutableSet.of("_id_", "keywords_1"), names);
        Assert.assertEquals(names, names("keyword_post"));
    }

    @Test
    public void testAbstractIndexInheritance() {
        hangar.ensureIndexes(Person.class);
        Assert.assertEquals(ImmutableSet.of("_cls_1_name_1",
                "_cls_1_user_guid_1", "_id_"), names("person"));
    }

    @Test
    public void testGeoIndexesDoNotFollowReferences() {
        Assert.assertTrue(hangar.geoIndexes(Parent.class).isEmpty());
        Assert.assertEquals(
                ImmutableList.of(IndexSpec.of(IndexKey.geo2d("location"))),
                hangar.geoIndexes(Location.class));
    }

    @Test
    public void testIndexOnEmbeddedDocumentField() {
        hangar.ensureIndexes(DatedPost.class);
        Assert.assertTrue(names("dated_post").contains("_cls_1_date.yr_-1"));
    }

    @Test
    public void testIndexOnEmbeddedListField() {
        hangar.ensureIndexes(TaggedPost.class);
        Assert.assertTrue(names("tagged_post").contains("_cls_1_tags.tag_1"));
    }

    @Test
    public void testRecursiveEmbeddedDocument() {
        hangar.ensureIndexes(RecursiveDocument.class);
        Assert.assertEquals(ImmutableSet.of("_id_", "_cls_1"),
                names("recursive_document"));
    }

    @Test
    public void testIndexOnPrimaryKey() {
        hangar.ensureIndexes(CategorizedPost.class);
        Assert.assertEquals(ImmutableSet.of("_id_", "categories_1__id_1"),
                names("categorized_post"));
    }

    @Test
    public void testUniqueIndexOnPrimaryKeyAndEmbeddedList() {
        List<IndexSpec> specs = hangar.indexSpecs(CommentedPost.class);
        Assert.assertEquals(1, specs.size());
        Assert.assertEquals(ImmutableList.of(IndexKey.ascending("_cls"),
                IndexKey.ascending("_id"),
                IndexKey.ascending("comments.comment_id")),
                specs.get(0).keys());
        Assert.assertTrue(specs.get(0).options().unique());
    }

    @Test
    public void testTtlIndex() {
        hangar.ensureIndexes(LogEntry.class);
        CatalogEntry entry = store.catalog("log_entry").stream()
                .filter(e -> e.name().equals("created_1")).findFirst().get();
        Assert.assertEquals(Long.valueOf(3600),
                entry.options().expireAfterSeconds());
    }

    @Test
    public void testAutoCreateIndexDisabled() {
        Hangar disabled = Hangar.builder().store(store).autoCreateIndex(false)
                .build();
        Assert.assertTrue(disabled.ensureIndexes(BlogPost.class).isEmpty());
        store.insert("blog_post", ImmutableMap.of("title", "Hello"));
        Assert.assertEquals(ImmutableSet.of("_id_"), names("blog_post"));
        disabled.close();
    }

    @Test
    public void testUniqueFieldRejectsDuplicates() {
        Assert.assertEquals(
                ImmutableList.of(IndexSpec.unique(IndexKey.ascending("slug"))),
                hangar.indexSpecs(SluggedPost.class));
        hangar.ensureIndexes(SluggedPost.class);
        store.insert("slugged_post", ImmutableMap.of("slug", "test"));
        try {
            store.insert("slugged_post", ImmutableMap.of("slug", "test"));
            Assert.fail();
        }
        catch (DuplicateKeyException e) {
            Assert.assertEquals(1, store.count("slugged_post"));
        }
    }

    @Test
    public void testUniqueWith() {
        Assert.assertEquals(
                ImmutableList.of(IndexSpec.unique(IndexKey.ascending("slug"),
                        IndexKey.ascending("date.yr"))),
                hangar.indexSpecs(YearlyPost.class));
        hangar.ensureIndexes(YearlyPost.class);
        Map<String, Object> first = ImmutableMap.of("slug", "test", "date",
                ImmutableMap.of("yr", 2009));
        store.insert("yearly_post", first);
        store.insert("yearly_post", ImmutableMap.of("slug", "test", "date",
                ImmutableMap.of("yr", 2010)));
        try {
            store.insert("yearly_post", first);
            Assert.fail();
        }
        catch (DuplicateKeyException e) {
            Assert.assertEquals(2, store.count("yearly_post"));
        }
    }

    @Test
    public void testRegisterAllAndEnsureAllIndexes() {
        List<Schema> schemas = hangar.registerAll("com.cinchapi.hangar.scan");
        Assert.assertEquals(
                ImmutableSet.of("Content", "Article", "Remark"),
                schemas.stream().map(Schema::name)
                        .collect(Collectors.toSet()));
        Map<String, List<IndexSpec>> created = hangar.ensureAllIndexes();
        Assert.assertEquals(ImmutableSet.of("Article"), created.keySet());
        Assert.assertEquals(ImmutableSet.of("_id_", "_cls_1_published_1",
                "_cls_1_title_1", "slug_1"), names("article"));
    }

    @Test(expected = ConfigurationException.class)
    public void testInvalidDeclarationIsReportedAtRegistration() {
        hangar.register(BrokenPost.class);
    }

    @Test
    public void testInvalidDeclarationIsNotRegistered() {
        try {
            hangar.register(BrokenPost.class);
            Assert.fail();
        }
        catch (ConfigurationException e) {
            Assert.assertTrue(e.getMessage().contains("BrokenPost"));
        }
        hangar.register(BlogPost.class);
        Map<String, List<IndexSpec>> created = hangar.ensureAllIndexes();
        Assert.assertEquals(ImmutableSet.of("BlogPost"), created.keySet());
        Assert.assertEquals(4, store.catalog("blog_post").size());
        try {
            hangar.schema(BrokenPost.class);
            Assert.fail();
        }
        catch (ConfigurationException e) {
            Assert.assertTrue(e.getMessage().contains("BrokenPost"));
        }
    }

    @Test
    public void testEnsureAllIndexesFollowsRegistrationOrder() {
        hangar.register(LogEntry.class);
        hangar.register(Parent.class);
        hangar.register(KeywordPost.class);
        Assert.assertEquals(
                ImmutableList.of("LogEntry", "Parent", "Location",
                        "KeywordPost"),
                ImmutableList.copyOf(hangar.ensureAllIndexes().keySet()));
    }

    @Test(expected = IllegalStateException.class)
    public void testClosedInstanceRejectsRegistration() {
        hangar.close();
        hangar.register(BlogPost.class);
    }

    private Set<String> names(String collection) {
        return store.catalog(collection).stream().map(CatalogEntry::name)
                .collect(Collectors.toSet());
    }

    @Index("-date")
    @Index("tags")
    @Index({ "category", "-date" })
    static class BlogPost extends Document {
        String title;
        @DbField("addDate")
        Date date;
        List<String> tags;
        String category;
    }

    static class ExtendedBlogPost extends BlogPost {
        String subtitle;
    }

    @Index("*location.point")
    static class Place extends Document {
        Map<String, Object> location;
    }

    @Meta(allowInheritance = false)
    @Index("keywords")
    static class KeywordPost extends Document {
        List<String> keywords;
    }

    @Index("user_guid")
    abstract static class UserBase extends Document {
        String user_guid;
    }

    @Index("name")
    static class Person extends UserBase {
        String name;
    }

    static class Location extends Document {
        @GeoPoint
        double[] location;
    }

    static class Parent extends Document {
        String name;
        Location location;
    }

    static class DateParts extends EmbeddedDocument {
        @DbField("yr")
        int year;
    }

    @Index("-date.year")
    static class DatedPost extends Document {
        DateParts date;
    }

    static class Tag extends EmbeddedDocument {
        @DbField("tag")
        String name;
    }

    @Index("tags.name")
    static class TaggedPost extends Document {
        List<Tag> tags;
    }

    static class RecursiveObject extends EmbeddedDocument {
        RecursiveObject obj;
    }

    static class RecursiveDocument extends Document {
        RecursiveObject recursive_obj;
    }

    @Meta(allowInheritance = false)
    @Index({ "categories", "id" })
    static class CategorizedPost extends Document {
        List<String> categories;
    }

    static class Comment extends EmbeddedDocument {
        int comment_id;
    }

    @Index(fields = { "pk", "comments.comment_id" }, unique = true)
    static class CommentedPost extends Document {
        List<Comment> comments;
    }

    @Meta(allowInheritance = false)
    @Index(fields = "created", expireAfterSeconds = 3600)
    static class LogEntry extends Document {
        Date created;
    }

    @Meta(allowInheritance = false)
    static class SluggedPost extends Document {
        @Unique
        String slug;
    }

    @Meta(allowInheritance = false)
    static class YearlyPost extends Document {
        DateParts date;
        @Unique(with = "date.year")
        String slug;
    }

    @Index({ "title", "*location" })
    static class BrokenPost extends Document {
        String title;
        @GeoPoint
        double[] location;
    }

}
