package com.example.csvencoding.exception;

import java.io.IOException;

/**
 * The underlying row reader or writer failed.
 */
public class CsvIOException extends CsvException {

    private static final long serialVersionUID = 1L;

    public CsvIOException(String message, IOException cause) {
        super(message + ": " + cause.getMessage(), cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
