package com.example.csvencoding;

import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Lists the fields of a record class in declaration order, superclass fields first.
 * <p>
 * Rules per field:
 * <ul>
 *   <li>{@code static} and synthetic fields are not part of the record;</li>
 *   <li>{@code @CsvField("-")} and {@code transient} fields are skipped;</li>
 *   <li>{@code private} fields are skipped unless they are embedded or carry an explicit
 *   {@link CsvField}; the component fields of a {@code record} always count;</li>
 *   <li>the effective name is the annotation value, or the lower-cased field name.</li>
 * </ul>
 * Results are cached per class.
 */
@Slf4j
public class FieldResolver {

    private final ClassValue<List<FieldDescriptor>> cache = new ClassValue<List<FieldDescriptor>>() {
        @Override
        protected List<FieldDescriptor> computeValue(Class<?> type) {
            return Collections.unmodifiableList(scan(type));
        }
    };

    public List<FieldDescriptor> resolve(Class<?> type) {
        return cache.get(type);
    }

    private static List<FieldDescriptor> scan(Class<?> type) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }
        List<FieldDescriptor> result = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                    continue;
                }
                result.add(describe(field));
            }
        }
        log.debug("Resolved {} fields for {}: {}", result.size(), type.getName(), result);
        return result;
    }

    static FieldDescriptor describe(Field field) {
        CsvField tag = field.getAnnotation(CsvField.class);
        String name = tag == null ? "" : tag.value();
        boolean embedded = tag != null && tag.embedded();
        int modifiers = field.getModifiers();

        boolean skip = CsvField.SKIP.equals(name)
                || Modifier.isTransient(modifiers)
                || (Modifier.isPrivate(modifiers) && !embedded && tag == null && !field.getDeclaringClass().isRecord());
        if (!skip) {
            field.setAccessible(true);
        }
        return FieldDescriptor.builder()
                .field(field)
                .declaredName(field.getName())
                .effectiveName(name.isEmpty() || skip ? field.getName().toLowerCase(Locale.ROOT) : name)
                .omitEmpty(tag != null && tag.omitEmpty())
                .skip(skip)
                .embedded(embedded)
                .build();
    }
}
