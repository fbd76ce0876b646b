package com.example.csvencoding;

import com.example.csvencoding.exception.CsvException;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Array;
import java.util.Optional;

/**
 * State shared by {@link CsvEncoder} and {@link CsvDecoder}: the two sentinel cells and
 * the first failure.
 * <p>
 * A session is poisoned by its first failure. Every later call rethrows that same
 * exception without doing any work; a fresh instance is needed to carry on.
 */
@Slf4j
public abstract class CsvSession {

    public static final String DEFAULT_EMPTY_VALUE = "";
    public static final String DEFAULT_NIL_VALUE = "NULL";

    private static final int MAX_DESCRIBED_LENGTH = 64;

    /** Cell standing for the zero value of a type. */
    @Getter
    @Setter
    @NonNull
    private String emptyValue = DEFAULT_EMPTY_VALUE;

    /** Cell standing for an absent value. */
    @Getter
    @Setter
    @NonNull
    private String nilValue = DEFAULT_NIL_VALUE;

    protected final TypeResolver types;

    private CsvException failure;

    protected CsvSession(TypeResolver types) {
        this.types = types;
    }

    public Optional<CsvException> getFailure() {
        return Optional.ofNullable(failure);
    }

    protected final void ensureUsable() throws CsvException {
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Records {@code e} as this session's failure and returns it for throwing.
     */
    protected final CsvException fail(CsvException e) {
        if (failure == null) {
            failure = e;
            log.debug("{} is no longer usable: {}", getClass().getSimpleName(), e.getMessage());
        }
        return failure;
    }

    /**
     * Short printable form of a value for error breadcrumbs.
     */
    static String describe(Object value) {
        String text;
        if (value != null && value.getClass().isArray()) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < Array.getLength(value); i++) {
                if (i > 0) sb.append(", ");
                sb.append(Array.get(value, i));
            }
            text = sb.append(']').toString();
        } else {
            text = String.valueOf(value);
        }
        if (text.length() > MAX_DESCRIBED_LENGTH) {
            text = text.substring(0, MAX_DESCRIBED_LENGTH) + "...";
        }
        return "`" + text + "`";
    }
}
