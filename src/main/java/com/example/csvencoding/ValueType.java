package com.example.csvencoding;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.lang.reflect.Type;
import java.util.List;

/**
 * Resolved view of a declared type: its kind, its hooks and, depending on the kind,
 * its fields or its element types. Obtained from {@link TypeResolver}; child types are
 * kept as reflective {@link Type}s and resolved on demand.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public final class ValueType {

    private final Type type;
    private final Class<?> rawClass;
    private final ValueKind kind;
    private final HookRegistry.Hooks hooks;
    /** Element of a sequence or optional; null for other kinds. */
    private final Type elementType;
    private final Type keyType;
    private final Type mapValueType;
    /** Declared fields of a record; empty for other kinds. */
    private final List<FieldDescriptor> fields;

    public boolean hasEncodeHook() {
        return hooks.getEncodeHook() != null;
    }

    public boolean hasDecodeHook() {
        return hooks.getDecodeHook() != null;
    }

    public boolean isPrimitive() {
        return rawClass.isPrimitive();
    }

    @Override
    public String toString() {
        return type.getTypeName() + " (" + kind + ")";
    }
}
