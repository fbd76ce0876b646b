package com.example.csvencoding;

/**
 * Closed set of shapes the encoder and decoder know how to handle.
 */
public enum ValueKind {
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING,
    ENUM,
    /** {@code java.util.Optional}; an empty optional is treated like {@code null}. */
    OPTIONAL,
    /** Arrays and collections, flattened into one cell. */
    SEQUENCE,
    /** Maps, flattened into one cell. */
    MAP,
    /** Any other concrete class, expanded field by field. */
    RECORD,
    /** {@code Object}, interfaces and abstract classes: the runtime class decides. */
    DYNAMIC,
    UNSUPPORTED;

    public boolean isScalar() {
        return this == BOOLEAN || this == INTEGER || this == FLOAT || this == STRING || this == ENUM;
    }
}
