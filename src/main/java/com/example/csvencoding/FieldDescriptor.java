package com.example.csvencoding;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.lang.reflect.Field;
import java.lang.reflect.Type;

/**
 * How one declared field takes part in a row. Derived once per record class by
 * {@link FieldResolver}.
 */
@Value
@Builder
public class FieldDescriptor {

    @NonNull
    Field field;
    @NonNull
    String declaredName;
    @NonNull
    String effectiveName;
    boolean omitEmpty;
    boolean skip;
    boolean embedded;

    public Type getGenericType() {
        return field.getGenericType();
    }

    public Object get(Object owner) {
        try {
            return field.get(owner);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Field " + field + " is not accessible", e);
        }
    }

    public void set(Object owner, Object value) {
        try {
            field.set(owner, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Field " + field + " is not accessible", e);
        }
    }

    @Override
    public String toString() {
        return field.getDeclaringClass().getSimpleName() + "." + declaredName
                + (skip ? " (skipped)" : " -> " + effectiveName)
                + (omitEmpty ? ",omitEmpty" : "")
                + (embedded ? ",embedded" : "");
    }
}
