/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoretree;

import net.scoreworks.scoretree.annotations.AbstractClass;
import net.scoreworks.scoretree.exceptions.IllegalDataModelException;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.ClassUtils;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;


/**
 * Class to cache tree relevant information about a {@link ScoreObject} class' fields, so they don't have to
 * be obtained for each object each time with reflections. The cache is shared by all trees and may be used by
 * several imports at the same time.
 */
public class ClassMetadata {

    /** Store {@link ClassMetadata} of analyzed classes for quick access */
    private static final Map<Class<?>, ClassMetadata> metadata = new ConcurrentHashMap<>();

    /**
     * Class-type whose content is described
     */
    final Class<?> clazz;

    /**
     * All fields that contain collections of {@link ScoreObject}s (arrays, collections and maps) of the described
     * class and superclass(es). The objects in these collections are owned by the described class
     */
    final Field[] collections;

    /**
     * All fields that reference a single {@link Child}. Such a field holds a child only if the referenced object
     * names the described object as its owner, otherwise it is a cross-reference
     */
    final Field[] childFields;

    /**
     * All other "plain" fields of the described class and superclass(es)
     */
    final Field[] fields;

    private ClassMetadata(Class<?> clazz) {
        this.clazz = clazz;
        checkClosedHierarchy(clazz);

        List<Field> collectionList = new ArrayList<>();
        List<Field> childFieldList = new ArrayList<>();
        List<Field> fieldList = new ArrayList<>();
        for (Field field : getAllFieldsOfDataModel(clazz)) {
            //ignore static fields since they don't belong to an object, and transient fields since they are bookkeeping
            if (Modifier.isStatic(field.getModifiers()) || Modifier.isTransient(field.getModifiers()))
                continue;
            field.setAccessible(true);
            Class<?> type = field.getType();
            if (type.isArray() && ScoreObject.class.isAssignableFrom(type.getComponentType()))
                collectionList.add(field);
            else if ((Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type)) && storesScoreObjects(field))
                collectionList.add(field);
            else if (Child.class.isAssignableFrom(type))
                childFieldList.add(field);
            else
                fieldList.add(field);
        }
        collections = collectionList.toArray(new Field[0]);
        childFields = childFieldList.toArray(new Field[0]);
        fields = fieldList.toArray(new Field[0]);
    }

    static ClassMetadata of(Class<?> clazz) {
        return metadata.computeIfAbsent(clazz, ClassMetadata::new);
    }

    /**
     * Make sure the class is a legal member of the score tree. Called once per created object, the analysis itself is
     * only done once per class
     */
    static void checkDataModel(Class<?> clazz) {
        of(clazz);
    }

    /**
     * Get a list of all children stored in all {@link ClassMetadata#collections} and {@link ClassMetadata#childFields}
     * of a given {@link ScoreObject}, in declaration order of the fields
     * @param so object to get children from
     */
    @SuppressWarnings("unchecked")
    public static List<Child<?>> getChildren(ScoreObject so) {
        ClassMetadata info = of(so.getClass());

        //collect all children into an ArrayList
        List<Child<?>> children = new ArrayList<>();
        try {
            for (Field field : info.collections) {
                Object value = field.get(so);
                if (value == null)
                    continue;
                //field is an array
                if (field.getType().isArray())
                    children.addAll(Arrays.asList((Child<?>[]) value));
                //field is a collection
                else if (value instanceof Collection)
                    children.addAll((Collection<Child<?>>) value);
                //field is a map
                else
                    children.addAll(((Map<?, Child<?>>) value).values());
            }
            for (Field field : info.childFields) {
                Child<?> value = (Child<?>) field.get(so);
                if (value != null && value.getOwner() == so)
                    children.add(value);
            }
        } catch (IllegalAccessException e) {
            throw new IllegalDataModelException(so.getClass(), "has inaccessible child fields: " + e.getMessage());
        }
        return children;
    }

    /**
     * Returns true if the specified type is not a primitive, primitive wrapper, String, Enum or Void
     */
    static boolean isComplexObject(Class<?> type) {
        return (!ClassUtils.isPrimitiveOrWrapper(type)
                && !String.class.isAssignableFrom(type)
                && !Void.class.isAssignableFrom(type)
                && !type.isEnum());
    }

    static Field[] getAllFieldsOfDataModel(Class<?> iterator) {
        Field[] relevantFields = new Field[0];
        Package corePackage = ScoreObject.class.getPackage();
        while (iterator.getSuperclass() != null) {
            //stop when reaching the core package, meaning owners and ids won't be considered
            if (iterator.getPackage() == corePackage)
                break;
            relevantFields = ArrayUtils.addAll(iterator.getDeclaredFields(), relevantFields);
            iterator = iterator.getSuperclass();
        }
        return relevantFields;
    }


    //==========PRIVATE METHODS====================================================

    private static boolean storesScoreObjects(Field field) {
        Type genericType = field.getGenericType();
        if (!(genericType instanceof ParameterizedType))
            throw new IllegalDataModelException(field.getDeclaringClass(), "contains a raw collection \"" + field.getName() + "\"!");
        //the stored type is the last generic type, for maps this is the value
        Type[] types = ((ParameterizedType) genericType).getActualTypeArguments();
        Type storedType = types[types.length - 1];
        if (storedType instanceof ParameterizedType)
            storedType = ((ParameterizedType) storedType).getRawType();
        if (!(storedType instanceof Class))
            return false;
        Class<?> stored = (Class<?>) storedType;
        if (ScoreObject.class.isAssignableFrom(stored))
            return true;
        //collections of values are plain fields, but they must not hide mutable objects of another kind
        if (isComplexObject(stored))
            throw new IllegalDataModelException(field.getDeclaringClass(), "contains objects of unsupported type " + stored.getSimpleName()
                    + " in collection \"" + field.getName() + "\"!");
        return false;
    }

    /**
     * A class extending an {@link AbstractClass} must be one of its declared subclasses. This keeps the variants of
     * e.g. layer elements a closed set
     */
    private static void checkClosedHierarchy(Class<?> clazz) {
        if (Modifier.isAbstract(clazz.getModifiers()))
            return;
        Class<?> iterator = clazz.getSuperclass();
        while (iterator != null) {
            AbstractClass abstractClass = iterator.getAnnotation(AbstractClass.class);
            if (abstractClass != null && !ArrayUtils.contains(abstractClass.subclasses(), clazz))
                throw new IllegalDataModelException(clazz, "is not a declared subclass of " + iterator.getSimpleName() + "!");
            iterator = iterator.getSuperclass();
        }
    }

    @Override
    public String toString() {
        StringBuilder strb = new StringBuilder();
        strb.append(">Info of ").append(clazz.getSimpleName()).append(":");
        if (fields.length > 0) {
            strb.append("\ncontentFields: ");
            for (Field field : fields) {
                strb.append(field.getName()).append(" ");
            }
        }
        if (collections.length > 0 || childFields.length > 0) {
            strb.append("\nchildFields: ");
            for (Field field : ArrayUtils.addAll(collections, childFields)) {
                strb.append(field.getName()).append(" ");
            }
        }
        return strb.append("\n").toString();
    }
}
