package com.example.csvencoding;

import com.example.csvencoding.exception.UnsupportedTypeException;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Creates fresh instances of decode targets.
 */
final class Instantiation {

    private Instantiation() {}

    static Object newInstance(Class<?> type) throws UnsupportedTypeException {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new UnsupportedTypeException("cannot instantiate abstract type " + type.getName());
        }
        if (type.isMemberClass() && !Modifier.isStatic(type.getModifiers())) {
            throw new UnsupportedTypeException("cannot instantiate inner class " + type.getName() + "; declare it static");
        }
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new UnsupportedTypeException("cannot instantiate " + type.getName() + " without a no-argument constructor", e);
        } catch (InvocationTargetException e) {
            throw new UnsupportedTypeException("constructor of " + type.getName() + " failed: " + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new UnsupportedTypeException("cannot instantiate " + type.getName() + ": " + e, e);
        }
    }

    /**
     * Collection of {@code type} holding {@code elements}. Interfaces and abstract types
     * get a default implementation; concrete types need a public copy constructor taking
     * a {@code Collection}.
     */
    static Collection<?> newCollection(Class<?> type, List<?> elements) throws UnsupportedTypeException {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            if (type.isAssignableFrom(ArrayList.class)) {
                return new ArrayList<>(elements);
            } else if (type.isAssignableFrom(LinkedHashSet.class)) {
                return new LinkedHashSet<>(elements);
            } else if (type.isAssignableFrom(TreeSet.class)) {
                return new TreeSet<>(elements);
            } else if (type.isAssignableFrom(ArrayDeque.class)) {
                return new ArrayDeque<>(elements);
            }
            throw new UnsupportedTypeException("no default implementation for " + type.getName());
        }
        try {
            return (Collection<?>) type.getConstructor(Collection.class).newInstance(elements);
        } catch (NoSuchMethodException e) {
            throw new UnsupportedTypeException("cannot create " + type.getName() + " without a public Collection constructor", e);
        } catch (InvocationTargetException e) {
            throw new UnsupportedTypeException("constructor of " + type.getName() + " failed: " + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new UnsupportedTypeException("cannot create " + type.getName() + ": " + e, e);
        }
    }

    static Map<?, ?> newMap(Class<?> type) throws UnsupportedTypeException {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            if (type.isAssignableFrom(LinkedHashMap.class)) {
                return new LinkedHashMap<>();
            } else if (type.isAssignableFrom(TreeMap.class)) {
                return new TreeMap<>();
            }
            throw new UnsupportedTypeException("no default implementation for " + type.getName());
        }
        return (Map<?, ?>) newInstance(type);
    }

    static Object newArray(Class<?> arrayType, int length) {
        return Array.newInstance(arrayType.getComponentType(), length);
    }
}
