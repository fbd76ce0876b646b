package com.example.csvencoding.exception;

import lombok.Getter;

/**
 * A cell could not be parsed into the scalar type of its target.
 */
@Getter
public class ConversionException extends CsvException {

    private static final long serialVersionUID = 1L;

    private final String value;
    private final Class<?> targetType;

    public ConversionException(String value, Class<?> targetType, Throwable cause) {
        super("cannot convert `" + value + "` to " + targetType.getSimpleName(), cause);
        this.value = value;
        this.targetType = targetType;
    }

    public ConversionException(String value, Class<?> targetType) {
        this(value, targetType, null);
    }
}
