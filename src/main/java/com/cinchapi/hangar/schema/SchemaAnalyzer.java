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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.time.temporal.Temporal;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import javax.annotation.Nullable;

import org.reflections.Reflections;
import org.reflections.scanners.SubTypesScanner;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.common.reflect.Reflection;
import com.cinchapi.hangar.ConfigurationException;
import com.cinchapi.hangar.DbField;
import com.cinchapi.hangar.Document;
import com.cinchapi.hangar.EmbeddedDocument;
import com.cinchapi.hangar.GeoPoint;
import com.cinchapi.hangar.Index;
import com.cinchapi.hangar.Meta;
import com.cinchapi.hangar.PrimaryKey;
import com.cinchapi.hangar.Unique;
import com.cinchapi.hangar.index.IndexCompiler;
import com.cinchapi.hangar.index.IndexDeclaration;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.primitives.Primitives;

/**
 * Builds the {@link Schema} of a {@link Document} or {@link EmbeddedDocument}
 * class from its declared fields and annotations, and registers it with a
 * {@link SchemaRegistry}.
 * <p>
 * Registering a class also registers its ancestors and the classes of its
 * embedded and reference fields, so that every name the schema refers to can
 * be resolved.
 * </p>
 */
public final class SchemaAnalyzer {

    static {
        Reflections.log = null; // turn off reflection logging
    }

    /**
     * Return the {@link Document} and {@link EmbeddedDocument} classes that
     * are defined in {@code packageName} or any of its subpackages.
     *
     * @param packageName
     * @return the classes
     */
    public static Set<Class<?>> scan(String packageName) {
        Reflections reflection = new Reflections(packageName,
                new SubTypesScanner());
        return ImmutableSet.<Class<?>> builder()
                .addAll(reflection.getSubTypesOf(Document.class))
                .addAll(reflection.getSubTypesOf(EmbeddedDocument.class))
                .build();
    }

    /**
     * Return the name of the {@link Schema} that describes {@code clazz}.
     *
     * @param clazz
     * @return the schema name
     */
    public static String schemaName(Class<?> clazz) {
        return clazz.getSimpleName();
    }

    /**
     * Return {@code true} if {@code clazz} is a {@link Document} or an
     * {@link EmbeddedDocument}, but not one of the base classes.
     *
     * @param clazz
     * @return boolean
     */
    private static boolean isDocumentClass(Class<?> clazz) {
        return (Document.class.isAssignableFrom(clazz)
                && clazz != Document.class)
                || (EmbeddedDocument.class.isAssignableFrom(clazz)
                        && clazz != EmbeddedDocument.class);
    }

    /**
     * The registry with which all schemas are registered.
     */
    private final SchemaRegistry registry;

    /**
     * A mapping from each analyzed class to its {@link Schema}.
     */
    private final Map<Class<?>, Schema> schemas = new ConcurrentHashMap<>();

    /**
     * Construct a new instance.
     *
     * @param registry
     */
    public SchemaAnalyzer(SchemaRegistry registry) {
        this.registry = registry;
    }

    /**
     * Return the {@link Schema} of {@code clazz} if it has been
     * {@link #register(Class) registered}.
     *
     * @param clazz
     * @return the schema or {@code null}
     */
    @Nullable
    public Schema get(Class<?> clazz) {
        return schemas.get(clazz);
    }

    /**
     * Return the {@link Schema} of {@code clazz}, registering it first if
     * necessary.
     * <p>
     * Registration is all or nothing: the indexes of every schema that the
     * call registers are compiled, and if any of them (or the analysis itself)
     * fails, none of the schemas stay registered.
     * </p>
     *
     * @param clazz a subclass of {@link Document} or {@link EmbeddedDocument}
     * @return the schema
     * @throws ConfigurationException if the class cannot be described by a
     *             valid schema or declares invalid indexes
     */
    public synchronized Schema register(Class<?> clazz) {
        if(!isDocumentClass(clazz)) {
            throw new IllegalArgumentException(AnyStrings.format(
                    "{} is not a Document or EmbeddedDocument", clazz));
        }
        Schema schema = schemas.get(clazz);
        if(schema == null) {
            List<Class<?>> added = Lists.newArrayList();
            try {
                schema = register(clazz, added);
                for (Class<?> registered : added) {
                    IndexCompiler.compile(schemas.get(registered));
                }
            }
            catch (RuntimeException e) {
                for (Class<?> registered : Lists.reverse(added)) {
                    registry.unregister(schemas.remove(registered));
                }
                throw e;
            }
        }
        return schema;
    }

    /**
     * Register {@code clazz} and everything it depends on, recording each
     * newly registered class in {@code added}.
     *
     * @param clazz
     * @param added
     * @return the schema
     */
    private Schema register(Class<?> clazz, List<Class<?>> added) {
        Schema schema = schemas.get(clazz);
        if(schema == null) {
            Class<?> parent = clazz.getSuperclass();
            if(isDocumentClass(parent)) {
                register(parent, added);
            }
            schema = analyze(clazz);
            registry.register(schema);
            schemas.put(clazz, schema);
            added.add(clazz);
            for (Class<?> target : targets(clazz)) {
                register(target, added);
            }
        }
        return schema;
    }

    /**
     * Build the {@link Schema} that describes {@code clazz}.
     *
     * @param clazz
     * @return the schema
     */
    private Schema analyze(Class<?> clazz) {
        boolean embedded = EmbeddedDocument.class.isAssignableFrom(clazz);
        String name = schemaName(clazz);
        Schema.Builder builder = embedded ? Schema.embedded(name)
                : Schema.builder(name);
        Class<?> parent = clazz.getSuperclass();
        if(isDocumentClass(parent)) {
            builder.parent(schemaName(parent));
        }
        if(Modifier.isAbstract(clazz.getModifiers())) {
            builder.abstractSchema();
        }
        Meta declared = clazz.getDeclaredAnnotation(Meta.class);
        if(declared != null) {
            builder.allowInheritance(declared.allowInheritance());
            builder.collection(declared.collection());
        }
        Meta meta = clazz.getAnnotation(Meta.class);
        if(meta != null) {
            builder.autoCreateIndex(meta.autoCreateIndex())
                    .indexCls(meta.indexCls())
                    .indexBackground(meta.indexBackground());
        }
        for (Field field : fields(clazz)) {
            builder.field(describe(field));
        }
        for (Index index : clazz.getDeclaredAnnotationsByType(Index.class)) {
            builder.indexes(declaration(index));
        }
        return builder.build();
    }

    /**
     * Return the {@link IndexDeclaration} that an {@link Index} annotation
     * makes.
     *
     * @param index
     * @return the declaration
     */
    private static IndexDeclaration declaration(Index index) {
        boolean hasOptions = index.fields().length > 0 || index.unique()
                || index.sparse() || index.expireAfterSeconds() >= 0
                || index.background() || !index.cls();
        if(hasOptions) {
            IndexDeclaration.OptionsRecord.Builder options = IndexDeclaration
                    .options()
                    .fields((Object[]) (index.fields().length > 0
                            ? index.fields()
                            : index.value()))
                    .unique(index.unique()).sparse(index.sparse())
                    .background(index.background()).cls(index.cls());
            if(index.expireAfterSeconds() >= 0) {
                options.expireAfterSeconds(index.expireAfterSeconds());
            }
            return options.build();
        }
        else if(index.value().length == 1) {
            return IndexDeclaration.field(index.value()[0]);
        }
        else {
            return IndexDeclaration.sequence((Object[]) index.value());
        }
    }

    /**
     * Return the {@link FieldDescriptor} for {@code field}.
     *
     * @param field
     * @return the descriptor
     */
    private static FieldDescriptor describe(Field field) {
        FieldDescriptor.Builder builder = FieldDescriptor
                .builder(field.getName());
        DbField dbField = field.getAnnotation(DbField.class);
        if(dbField != null) {
            builder.storageKey(dbField.value());
        }
        if(field.isAnnotationPresent(PrimaryKey.class)) {
            builder.primaryKey();
        }
        Unique unique = field.getAnnotation(Unique.class);
        if(unique != null) {
            builder.unique().uniqueWith(unique.with());
        }
        Class<?> type = field.getType();
        Class<?> element = elementType(field);
        if(field.isAnnotationPresent(GeoPoint.class)) {
            builder.type(FieldType.GEO_POINT);
        }
        else if(isDocumentClass(type)
                && EmbeddedDocument.class.isAssignableFrom(type)) {
            builder.embedded(schemaName(type));
        }
        else if(isDocumentClass(type)) {
            builder.reference(schemaName(type));
        }
        else if(element != null && isDocumentClass(element)
                && EmbeddedDocument.class.isAssignableFrom(element)) {
            builder.embeddedList(schemaName(element));
        }
        else {
            builder.type(scalarType(type));
        }
        return builder.build();
    }

    /**
     * Return the element type of a collection or array {@code field}, or
     * {@code null} if it isn't one or the element type is unknown.
     *
     * @param field
     * @return the element type
     */
    @Nullable
    private static Class<?> elementType(Field field) {
        Class<?> type = field.getType();
        if(type.isArray()) {
            return type.getComponentType();
        }
        else if(Collection.class.isAssignableFrom(type)) {
            return Iterables.getFirst(Reflection.getTypeArguments(field),
                    null);
        }
        else {
            return null;
        }
    }

    /**
     * Return the declared fields of {@code clazz} that are stored. The fields
     * of {@link Document} itself are included for a root class.
     *
     * @param clazz
     * @return the stored fields
     */
    private static List<Field> fields(Class<?> clazz) {
        List<Field> fields = Lists.newArrayList();
        if(clazz.getSuperclass() == Document.class) {
            addStoredFields(Document.class, fields);
        }
        addStoredFields(clazz, fields);
        return fields;
    }

    private static void addStoredFields(Class<?> clazz, List<Field> fields) {
        for (Field field : clazz.getDeclaredFields()) {
            int modifiers = field.getModifiers();
            if(!Modifier.isStatic(modifiers) && !Modifier.isTransient(modifiers)
                    && !field.isSynthetic()) {
                fields.add(field);
            }
        }
    }

    /**
     * Return the {@link FieldType} of a field whose value is neither a
     * document nor a list of embedded documents.
     *
     * @param type
     * @return the field type
     */
    private static FieldType scalarType(Class<?> type) {
        Class<?> wrapped = Primitives.wrap(type);
        if(wrapped == String.class || wrapped == Character.class
                || type.isEnum()) {
            return FieldType.STRING;
        }
        else if(wrapped == Integer.class || wrapped == Short.class
                || wrapped == Byte.class) {
            return FieldType.INT;
        }
        else if(wrapped == Long.class) {
            return FieldType.LONG;
        }
        else if(wrapped == Double.class || wrapped == Float.class
                || wrapped == BigDecimal.class) {
            return FieldType.DOUBLE;
        }
        else if(wrapped == Boolean.class) {
            return FieldType.BOOLEAN;
        }
        else if(Date.class.isAssignableFrom(type)
                || Temporal.class.isAssignableFrom(type)) {
            return FieldType.DATETIME;
        }
        else if(Map.class.isAssignableFrom(type)) {
            return FieldType.DICT;
        }
        else if(type.isArray() || Collection.class.isAssignableFrom(type)) {
            return FieldType.LIST;
        }
        else {
            return FieldType.OBJECT;
        }
    }

    /**
     * Return the classes described by the embedded and reference fields that
     * {@code clazz} declares.
     *
     * @param clazz
     * @return the target classes
     */
    private static Set<Class<?>> targets(Class<?> clazz) {
        ImmutableSet.Builder<Class<?>> targets = ImmutableSet.builder();
        for (Field field : fields(clazz)) {
            if(field.isAnnotationPresent(GeoPoint.class)) {
                continue;
            }
            Class<?> type = field.getType();
            Class<?> element = elementType(field);
            if(isDocumentClass(type)) {
                targets.add(type);
            }
            else if(element != null && isDocumentClass(element)
                    && EmbeddedDocument.class.isAssignableFrom(element)) {
                targets.add(element);
            }
        }
        return targets.build();
    }

}
