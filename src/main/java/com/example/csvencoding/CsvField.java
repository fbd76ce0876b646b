package com.example.csvencoding;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Column declaration for a record field.
 * <p>
 * {@code @CsvField("handle")} renames the column, {@code @CsvField("-")} leaves the
 * field out of every row, {@code omitEmpty} writes the empty sentinel instead of a
 * zero value, and {@code embedded} splices the field's own columns into the
 * enclosing record without a path segment of their own.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface CsvField {

    /** Name used to skip a field entirely. */
    String SKIP = "-";

    /**
     * Column name. Empty means the lower-cased field name.
     */
    String value() default "";

    boolean omitEmpty() default false;

    boolean embedded() default false;
}
