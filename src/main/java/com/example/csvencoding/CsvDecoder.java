package com.example.csvencoding;

import com.example.csvencoding.exception.CsvException;
import com.example.csvencoding.exception.CsvIOException;
import com.example.csvencoding.exception.HookException;
import com.example.csvencoding.exception.UnexpectedShapeException;
import com.example.csvencoding.exception.UnsupportedTypeException;
import com.example.csvencoding.io.RowReader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads CSV rows into objects, one row per {@link #decode(Object)} call.
 * <p>
 * The first row of the input is the header. Each header entry is a dotted path
 * ({@code person.address.city}) naming the field the column belongs to, so columns
 * may come in any order and unknown columns are ignored. Fields without a column
 * keep whatever value they had.
 */
@Slf4j
public class CsvDecoder extends CsvSession {

    private final RowReader reader;
    private final List<String> header;
    private boolean exhausted;
    private long rowNumber;

    public CsvDecoder(RowReader reader) {
        this(reader, TypeResolver.defaults());
    }

    /**
     * Reads the header row right away. A read failure poisons the decoder; an empty
     * input leaves it at end of input.
     */
    public CsvDecoder(RowReader reader, TypeResolver types) {
        super(types);
        this.reader = Objects.requireNonNull(reader, "reader");
        List<String> firstRow = null;
        try {
            firstRow = reader.readRow();
        } catch (IOException e) {
            fail(new CsvIOException("unable to read header", e));
        }
        if (firstRow == null) {
            exhausted = true;
            header = Collections.emptyList();
        } else {
            header = Collections.unmodifiableList(new ArrayList<>(firstRow));
            log.debug("Captured header {}", header);
        }
    }

    public List<String> getHeader() {
        return header;
    }

    /**
     * Reads the next row into {@code target}, which must be a record.
     *
     * @return {@code false} once the input is exhausted; every later call returns
     * {@code false} as well
     */
    public boolean decode(Object target) throws CsvException {
        Objects.requireNonNull(target, "target");
        ensureUsable();
        if (exhausted) {
            return false;
        }
        List<String> row;
        try {
            row = reader.readRow();
        } catch (IOException e) {
            throw fail(new CsvIOException("unable to read row " + (rowNumber + 1), e));
        }
        if (row == null) {
            exhausted = true;
            log.debug("End of input after {} rows", rowNumber);
            return false;
        }
        rowNumber++;
        try {
            ValueType type = types.resolve(target.getClass());
            if (type.getKind() != ValueKind.RECORD) {
                throw new UnsupportedTypeException("only records can be decoded from a row, not " + type);
            }
            readRecord(target, type, PathTree.of(header, row));
            return true;
        } catch (CsvException e) {
            throw fail(e.at("row " + rowNumber));
        }
    }

    private void readRecord(Object record, ValueType type, PathTree node) throws CsvException {
        writable(type);
        for (FieldDescriptor field : type.getFields()) {
            if (field.isSkip()) {
                continue;
            }
            Object cell = field.isEmbedded() ? node : node.get(field.getEffectiveName());
            if (cell == null) {
                continue;
            }
            try {
                ValueType fieldType = types.resolve(field.getGenericType());
                if (field.isEmbedded()) {
                    readEmbedded(record, field, fieldType, node);
                } else if (cell instanceof PathTree) {
                    readNested(record, field, fieldType, (PathTree) cell);
                } else {
                    readCell(record, field, fieldType, (String) cell);
                }
            } catch (CsvException e) {
                throw e.at("field " + field.getDeclaredName() + (cell instanceof String ? "=" + describe(cell) : ""));
            }
        }
    }

    private void readEmbedded(Object record, FieldDescriptor field, ValueType fieldType, PathTree node) throws CsvException {
        ValueType target = writable(TypeResolver.embeddedRecord(field, types.unwrapOptional(fieldType)));
        Object current = field.get(record);
        if (current instanceof Optional) {
            current = ((Optional<?>) current).orElse(null);
        }
        Object embedded = current != null ? current : Instantiation.newInstance(target.getRawClass());
        readRecord(embedded, target, node);
        field.set(record, fieldType.getKind() == ValueKind.OPTIONAL ? Optional.of(embedded) : embedded);
    }

    private void readNested(Object record, FieldDescriptor field, ValueType fieldType, PathTree subtree) throws CsvException {
        ValueType target = types.unwrapOptional(fieldType);
        if (target.getKind() != ValueKind.RECORD) {
            throw new UnexpectedShapeException("expected a single column for " + target + " but found nested columns " + subtree.segments());
        }
        if (subtree.allCellsEqual(getNilValue())) {
            return;
        }
        writable(target);
        Object nested = Instantiation.newInstance(target.getRawClass());
        readRecord(nested, target, subtree);
        field.set(record, fieldType.getKind() == ValueKind.OPTIONAL ? Optional.of(nested) : nested);
    }

    /**
     * Java records have final component fields and no no-arg constructor, so they are
     * encode-only.
     */
    private static ValueType writable(ValueType type) throws UnsupportedTypeException {
        if (type.getRawClass().isRecord()) {
            throw new UnsupportedTypeException("record class " + type.getRawClass().getName() + " is read-only and cannot be decoded into");
        }
        return type;
    }

    private void readCell(Object record, FieldDescriptor field, ValueType fieldType, String cell) throws CsvException {
        if (cell.equals(getNilValue())) {
            return;
        }
        if (fieldType.isPrimitive() && cell.equals(getEmptyValue())) {
            return;
        }
        field.set(record, convert(cell, fieldType));
    }

    /**
     * Value of a non-nil cell for a target of {@code type}. Reference targets always get
     * a fresh value: the zero value for the empty sentinel, a parsed one otherwise.
     */
    private Object convert(String cell, ValueType type) throws CsvException {
        if (type.getKind() == ValueKind.OPTIONAL) {
            return Optional.ofNullable(convert(cell, types.resolve(type.getElementType())));
        }
        if (cell.equals(getEmptyValue())) {
            return zeroValue(type);
        }
        if (type.hasDecodeHook()) {
            return runHook(cell, type);
        }
        switch (type.getKind()) {
            case BOOLEAN:
            case INTEGER:
            case FLOAT:
            case STRING:
            case ENUM:
                return Scalars.parse(cell, type.getRawClass(), type.getKind());
            case SEQUENCE:
                return convertSequence(cell, type);
            case RECORD:
                throw new UnexpectedShapeException("expected nested columns for " + type + " but found a single cell");
            default:
                throw new UnsupportedTypeException("cannot decode " + type);
        }
    }

    private Object runHook(String cell, ValueType type) throws CsvException {
        try {
            return type.getHooks().getDecodeHook().decode(type.getRawClass(), cell);
        } catch (CsvException e) {
            throw e;
        } catch (Exception e) {
            throw new HookException("decoding " + type.getRawClass().getSimpleName(), e);
        }
    }

    /**
     * Splits the cell on commas. The result is only handed back once every element
     * converted.
     */
    private Object convertSequence(String cell, ValueType type) throws CsvException {
        String[] parts = cell.split(CsvEncoder.JOINER, -1);
        ValueType elementType = types.resolve(type.getElementType());
        List<Object> elements = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            try {
                if (part.equals(getNilValue()) || (elementType.isPrimitive() && part.equals(getEmptyValue()))) {
                    elements.add(elementType.isPrimitive() ? Scalars.zero(elementType.getRawClass(), elementType.getKind()) : null);
                } else {
                    elements.add(convert(part, elementType));
                }
            } catch (CsvException e) {
                throw e.at("element " + i + "=" + describe(part));
            }
        }

        Class<?> raw = type.getRawClass();
        if (raw.isArray()) {
            Object array = Instantiation.newArray(raw, elements.size());
            for (int i = 0; i < elements.size(); i++) {
                Array.set(array, i, elements.get(i));
            }
            return array;
        }
        return Instantiation.newCollection(raw, elements);
    }

    private Object zeroValue(ValueType type) throws UnsupportedTypeException {
        switch (type.getKind()) {
            case BOOLEAN:
            case INTEGER:
            case FLOAT:
            case STRING:
                return Scalars.zero(type.getRawClass(), type.getKind());
            case OPTIONAL:
                return Optional.empty();
            case SEQUENCE:
                return type.getRawClass().isArray()
                        ? Instantiation.newArray(type.getRawClass(), 0)
                        : Instantiation.newCollection(type.getRawClass(), Collections.emptyList());
            case MAP:
                return Instantiation.newMap(type.getRawClass());
            case RECORD:
                return Instantiation.newInstance(type.getRawClass());
            default:
                return null;
        }
    }
}
