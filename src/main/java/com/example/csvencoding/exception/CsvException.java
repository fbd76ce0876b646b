package com.example.csvencoding.exception;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Base class of every failure raised while encoding or decoding a row.
 * <p>
 * Each recursive step that lets a failure pass through prepends a frame naming
 * the field, element or row it was working on, so the final message reads as a
 * breadcrumb trail from the row down to the offending value.
 */
public class CsvException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Deque<String> trail = new ArrayDeque<>();

    public CsvException(String message) {
        super(message);
    }

    public CsvException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Prepends a context frame and returns this exception, so callers can write
     * {@code throw e.at("field `name`")}.
     */
    public CsvException at(String frame) {
        trail.addFirst(frame);
        return this;
    }

    public String getDetail() {
        return super.getMessage();
    }

    public String getTrail() {
        return String.join(": ", trail);
    }

    @Override
    public String getMessage() {
        if (trail.isEmpty()) {
            return super.getMessage();
        }
        return getTrail() + ": " + super.getMessage();
    }
}
