package com.example.csvencoding;

import com.example.csvencoding.exception.UnsupportedTypeException;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps reflective types onto {@link ValueType}s and computes the type-level properties
 * shared by the encoder and the decoder: the cell width of an absent value and the
 * dotted header of a record. Everything is computed once per type and cached.
 */
@Slf4j
public final class TypeResolver {

    private static final TypeResolver DEFAULT = new TypeResolver(HookRegistry.defaults(), new FieldResolver());

    private final HookRegistry hookRegistry;
    private final FieldResolver fieldResolver;
    private final Map<Type, ValueType> resolved = new ConcurrentHashMap<>();
    private final Map<Type, Integer> widths = new ConcurrentHashMap<>();

    public TypeResolver(HookRegistry hookRegistry, FieldResolver fieldResolver) {
        this.hookRegistry = hookRegistry;
        this.fieldResolver = fieldResolver;
    }

    public static TypeResolver defaults() {
        return DEFAULT;
    }

    public ValueType resolve(Type type) {
        ValueType result = resolved.get(type);
        if (result == null) {
            result = create(type);
            ValueType previous = resolved.putIfAbsent(type, result);
            if (previous != null) {
                result = previous;
            }
        }
        return result;
    }

    private ValueType create(Type type) {
        Class<?> raw = rawClass(type);
        ValueKind kind = kindOf(raw);
        Type element = null;
        Type key = null;
        Type value = null;
        List<FieldDescriptor> fields = Collections.emptyList();
        switch (kind) {
            case OPTIONAL:
                element = typeArgument(type, 0, 1);
                break;
            case SEQUENCE:
                if (type instanceof GenericArrayType) {
                    element = ((GenericArrayType) type).getGenericComponentType();
                } else if (raw.isArray()) {
                    element = raw.getComponentType();
                } else {
                    element = typeArgument(type, 0, 1);
                }
                break;
            case MAP:
                key = typeArgument(type, 0, 2);
                value = typeArgument(type, 1, 2);
                break;
            case RECORD:
                fields = fieldResolver.resolve(raw);
                break;
            default:
                break;
        }
        ValueType result = new ValueType(type, raw, kind, hookRegistry.detectHooks(raw), element, key, value, fields);
        log.debug("Resolved {}", result);
        return result;
    }

    /**
     * Number of cells an absent value of {@code type} occupies: the summed width of a
     * record's columns, the element's width for an optional, one cell otherwise.
     */
    public int width(ValueType type) throws UnsupportedTypeException {
        return width(type, new HashSet<>());
    }

    private int width(ValueType type, Set<Type> visiting) throws UnsupportedTypeException {
        Integer cached = widths.get(type.getType());
        if (cached != null) {
            return cached;
        }
        int width;
        if (type.getKind() == ValueKind.OPTIONAL) {
            width = width(resolve(type.getElementType()), visiting);
        } else if (type.getKind() == ValueKind.RECORD && !type.hasEncodeHook()) {
            enter(type, visiting);
            width = 0;
            for (FieldDescriptor field : type.getFields()) {
                if (!field.isSkip()) {
                    width += width(resolve(field.getGenericType()), visiting);
                }
            }
            visiting.remove(type.getType());
        } else {
            width = 1;
        }
        widths.put(type.getType(), width);
        return width;
    }

    /**
     * Dotted column paths of a record, in the order {@code encode} writes its cells.
     */
    public List<String> header(ValueType type) throws UnsupportedTypeException {
        if (type.getKind() != ValueKind.RECORD) {
            throw new UnsupportedTypeException("a header needs a record type, not " + type);
        }
        List<String> header = new ArrayList<>();
        appendHeader(type, "", header, new HashSet<>());
        return header;
    }

    private void appendHeader(ValueType type, String prefix, List<String> header, Set<Type> visiting) throws UnsupportedTypeException {
        enter(type, visiting);
        for (FieldDescriptor field : type.getFields()) {
            if (field.isSkip()) {
                continue;
            }
            ValueType target = unwrapOptional(resolve(field.getGenericType()));
            if (field.isEmbedded()) {
                appendHeader(embeddedRecord(field, target), prefix, header, visiting);
            } else if (target.getKind() == ValueKind.RECORD && !target.hasEncodeHook()) {
                appendHeader(target, prefix + field.getEffectiveName() + PathTree.SEPARATOR, header, visiting);
            } else {
                header.add(prefix + field.getEffectiveName());
            }
        }
        visiting.remove(type.getType());
    }

    ValueType unwrapOptional(ValueType type) {
        return type.getKind() == ValueKind.OPTIONAL ? resolve(type.getElementType()) : type;
    }

    static ValueType embeddedRecord(FieldDescriptor field, ValueType type) throws UnsupportedTypeException {
        if (type.getKind() != ValueKind.RECORD) {
            throw new UnsupportedTypeException("embedded field " + field.getDeclaredName() + " must be a record, not " + type);
        }
        return type;
    }

    private static void enter(ValueType type, Set<Type> visiting) throws UnsupportedTypeException {
        if (!visiting.add(type.getType())) {
            throw new UnsupportedTypeException("record type " + type.getType().getTypeName() + " contains itself and has no fixed set of columns");
        }
    }

    static ValueKind kindOf(Class<?> raw) {
        if (raw == boolean.class || raw == Boolean.class) {
            return ValueKind.BOOLEAN;
        } else if (raw == byte.class || raw == Byte.class
                || raw == short.class || raw == Short.class
                || raw == int.class || raw == Integer.class
                || raw == long.class || raw == Long.class) {
            return ValueKind.INTEGER;
        } else if (raw == float.class || raw == Float.class || raw == double.class || raw == Double.class) {
            return ValueKind.FLOAT;
        } else if (raw == String.class) {
            return ValueKind.STRING;
        } else if (Enum.class.isAssignableFrom(raw) && raw != Enum.class) {
            return ValueKind.ENUM;
        } else if (raw == Optional.class) {
            return ValueKind.OPTIONAL;
        } else if (raw.isArray() || Collection.class.isAssignableFrom(raw)) {
            return ValueKind.SEQUENCE;
        } else if (Map.class.isAssignableFrom(raw)) {
            return ValueKind.MAP;
        } else if (raw.isPrimitive()) {
            return ValueKind.UNSUPPORTED;
        } else if (raw == Object.class || raw.isInterface() || Modifier.isAbstract(raw.getModifiers())) {
            return ValueKind.DYNAMIC;
        }
        String name = raw.getName();
        if (name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.") || name.startsWith("sun.")) {
            return ValueKind.UNSUPPORTED;
        }
        return ValueKind.RECORD;
    }

    static Class<?> rawClass(Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        } else if (type instanceof ParameterizedType) {
            return rawClass(((ParameterizedType) type).getRawType());
        } else if (type instanceof GenericArrayType) {
            Class<?> component = rawClass(((GenericArrayType) type).getGenericComponentType());
            return Array.newInstance(component, 0).getClass();
        } else if (type instanceof TypeVariable) {
            Type[] bounds = ((TypeVariable<?>) type).getBounds();
            return bounds.length == 0 ? Object.class : rawClass(bounds[0]);
        } else if (type instanceof WildcardType) {
            Type[] bounds = ((WildcardType) type).getUpperBounds();
            return bounds.length == 0 ? Object.class : rawClass(bounds[0]);
        }
        return Object.class;
    }

    private static Type typeArgument(Type type, int index, int arity) {
        if (type instanceof ParameterizedType) {
            Type[] arguments = ((ParameterizedType) type).getActualTypeArguments();
            if (arguments.length == arity) {
                return arguments[index];
            }
        }
        return Object.class;
    }
}
