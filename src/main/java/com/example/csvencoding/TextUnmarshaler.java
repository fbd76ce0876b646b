package com.example.csvencoding;

/**
 * Counterpart of {@link TextMarshaler}: receives the raw cell of a freshly created
 * instance.
 */
public interface TextUnmarshaler {

    void fromText(String text) throws Exception;
}
