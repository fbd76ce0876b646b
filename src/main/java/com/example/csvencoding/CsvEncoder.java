package com.example.csvencoding;

import com.example.csvencoding.exception.CsvException;
import com.example.csvencoding.exception.CsvIOException;
import com.example.csvencoding.exception.HookException;
import com.example.csvencoding.exception.UnsupportedTypeException;
import com.example.csvencoding.io.RowWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes objects as CSV rows, one row per {@link #encode(Object)} call.
 * <p>
 * A record expands into the cells of its fields in declaration order, nested records
 * included. Sequences and maps collapse into a single comma-joined cell so that every
 * row of a type has the same width. Absent values are written as the nil sentinel,
 * one per column the value would have occupied.
 */
@Slf4j
public class CsvEncoder extends CsvSession {

    static final String JOINER = ",";
    static final String KEY_VALUE_SEPARATOR = ":";

    private final RowWriter writer;

    public CsvEncoder(RowWriter writer) {
        this(writer, TypeResolver.defaults());
    }

    public CsvEncoder(RowWriter writer, TypeResolver types) {
        super(types);
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * Encodes {@code record} and writes it as one row, then flushes the writer.
     */
    public void encode(Object record) throws CsvException {
        Objects.requireNonNull(record, "record");
        write(toCells(record));
    }

    /**
     * Writes the dotted header matching the rows {@link #encode(Object)} produces for
     * {@code type}.
     */
    public void encodeHeader(Class<?> type) throws CsvException {
        ensureUsable();
        List<String> header;
        try {
            header = types.header(types.resolve(type));
        } catch (CsvException e) {
            throw fail(e);
        }
        log.debug("Header for {}: {}", type.getName(), header);
        write(header);
    }

    /**
     * The cells {@link #encode(Object)} would write for {@code value}.
     */
    public List<String> toCells(Object value) throws CsvException {
        Objects.requireNonNull(value, "value");
        ensureUsable();
        try {
            return marshal(value, types.resolve(value.getClass()), false);
        } catch (CsvException e) {
            throw fail(e);
        }
    }

    private void write(List<String> row) throws CsvException {
        ensureUsable();
        try {
            writer.writeRow(row);
            writer.flush();
        } catch (IOException e) {
            throw fail(new CsvIOException("unable to write row", e));
        }
    }

    private List<String> marshal(Object value, ValueType declared, boolean omitEmpty) throws CsvException {
        ValueType type = declared;
        if (value != null) {
            type = actualType(value, declared);
            if (type.hasEncodeHook()) {
                return runHook(value, type);
            }
        }

        if (type.getKind() == ValueKind.OPTIONAL) {
            ValueType element = types.resolve(type.getElementType());
            Optional<?> optional = (Optional<?>) value;
            if (optional == null || optional.isEmpty()) {
                return nil(element);
            }
            return marshal(optional.get(), element, omitEmpty);
        }
        if (value == null) {
            return nil(type);
        }
        if (omitEmpty && isZero(value, type)) {
            return Collections.singletonList(getEmptyValue());
        }

        switch (type.getKind()) {
            case BOOLEAN:
            case INTEGER:
            case FLOAT:
            case STRING:
            case ENUM:
                return Collections.singletonList(Scalars.format(value, type.getKind()));
            case SEQUENCE:
                return Collections.singletonList(marshalSequence(value, type));
            case MAP:
                return Collections.singletonList(marshalMap((Map<?, ?>) value, type));
            case RECORD:
                return marshalRecord(value, type);
            default:
                throw new UnsupportedTypeException("cannot encode " + type);
        }
    }

    private List<String> runHook(Object value, ValueType type) throws CsvException {
        List<String> cells;
        try {
            cells = type.getHooks().getEncodeHook().encode(value);
        } catch (CsvException e) {
            throw e;
        } catch (Exception e) {
            throw new HookException("encoding " + type.getRawClass().getSimpleName(), e);
        }
        if (cells == null) {
            throw new HookException("encoding " + type.getRawClass().getSimpleName(),
                    new IllegalStateException("no cells returned"));
        }
        return cells;
    }

    private List<String> nil(ValueType type) throws UnsupportedTypeException {
        return Collections.nCopies(types.width(type), getNilValue());
    }

    private String marshalSequence(Object sequence, ValueType type) throws CsvException {
        ValueType elementType = types.resolve(type.getElementType());
        List<String> parts = new ArrayList<>();
        int index = 0;
        for (Object element : elements(sequence)) {
            try {
                parts.add(String.join(JOINER, marshal(element, elementType, false)));
            } catch (CsvException e) {
                throw e.at("element " + index + "=" + describe(element));
            }
            index++;
        }
        return String.join(JOINER, parts);
    }

    private String marshalMap(Map<?, ?> map, ValueType type) throws CsvException {
        ValueType keyType = types.resolve(type.getKeyType());
        ValueType valueType = types.resolve(type.getMapValueType());
        List<String> entries = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key;
            String value;
            try {
                key = String.join(JOINER, marshal(entry.getKey(), keyType, false));
            } catch (CsvException e) {
                throw e.at("map key " + describe(entry.getKey()));
            }
            try {
                value = String.join(JOINER, marshal(entry.getValue(), valueType, false));
            } catch (CsvException e) {
                throw e.at("map value " + describe(entry.getValue()));
            }
            entries.add(key + KEY_VALUE_SEPARATOR + value);
        }
        return String.join(JOINER, entries);
    }

    private List<String> marshalRecord(Object record, ValueType type) throws CsvException {
        List<String> cells = new ArrayList<>();
        for (FieldDescriptor field : type.getFields()) {
            if (field.isSkip()) {
                continue;
            }
            Object fieldValue = field.get(record);
            try {
                ValueType fieldType = types.resolve(field.getGenericType());
                if (field.isEmbedded()) {
                    TypeResolver.embeddedRecord(field, types.unwrapOptional(fieldType));
                }
                cells.addAll(marshal(fieldValue, fieldType, field.isOmitEmpty()));
            } catch (CsvException e) {
                throw e.at("field " + field.getDeclaredName() + "=" + describe(fieldValue));
            }
        }
        return cells;
    }

    /**
     * The runtime class decides, except that a declared container type keeps the
     * element types its generic signature carries.
     */
    private ValueType actualType(Object value, ValueType declared) {
        Class<?> runtime = value.getClass();
        if (runtime == declared.getRawClass()) {
            return declared;
        }
        ValueType actual = types.resolve(runtime);
        if (actual.hasEncodeHook()) {
            return actual;
        }
        switch (declared.getKind()) {
            case OPTIONAL:
            case SEQUENCE:
            case MAP:
                return declared;
            default:
                return actual;
        }
    }

    private boolean isZero(Object value, ValueType type) {
        switch (type.getKind()) {
            case OPTIONAL:
                return ((Optional<?>) value).isEmpty();
            case SEQUENCE:
                return value.getClass().isArray() ? Array.getLength(value) == 0 : ((Collection<?>) value).isEmpty();
            case MAP:
                return ((Map<?, ?>) value).isEmpty();
            case RECORD:
                for (FieldDescriptor field : type.getFields()) {
                    if (field.isSkip()) {
                        continue;
                    }
                    Object fieldValue = field.get(value);
                    if (fieldValue != null && !isZero(fieldValue, actualType(fieldValue, types.resolve(field.getGenericType())))) {
                        return false;
                    }
                }
                return true;
            default:
                return Scalars.isZero(value, type.getKind());
        }
    }

    static List<Object> elements(Object sequence) {
        if (sequence.getClass().isArray()) {
            int length = Array.getLength(sequence);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(sequence, i));
            }
            return elements;
        }
        return new ArrayList<>((Collection<?>) sequence);
    }
}
