package com.example.csvencoding;

/**
 * Implemented by types with a single-cell text form.
 */
public interface TextMarshaler {

    String toText() throws Exception;
}
