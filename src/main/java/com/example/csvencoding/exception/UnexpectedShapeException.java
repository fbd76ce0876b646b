package com.example.csvencoding.exception;

/**
 * The columns of a row do not line up with the shape of the target: a single cell
 * where nested columns were expected, nested columns for a scalar, or a row whose
 * width differs from the header.
 */
public class UnexpectedShapeException extends CsvException {

    private static final long serialVersionUID = 1L;

    public UnexpectedShapeException(String message) {
        super(message);
    }
}
