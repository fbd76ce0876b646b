package com.example.csvencoding.exception;

/**
 * No encode or decode path exists for a type.
 */
public class UnsupportedTypeException extends CsvException {

    private static final long serialVersionUID = 1L;

    public UnsupportedTypeException(String message) {
        super(message);
    }

    public UnsupportedTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
