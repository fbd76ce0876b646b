package com.example.csvencoding;

import com.example.csvencoding.exception.ConversionException;

import java.math.BigDecimal;

/**
 * Text forms of the scalar kinds.
 */
final class Scalars {

    private static final String NEGATIVE_ZERO = "-0";

    private Scalars() {}

    static String format(Object value, ValueKind kind) {
        switch (kind) {
            case BOOLEAN:
                return Boolean.toString((Boolean) value);
            case INTEGER:
                return Long.toString(((Number) value).longValue());
            case FLOAT:
                return value instanceof Float ? formatFloat((Float) value) : formatDouble(((Number) value).doubleValue());
            case ENUM:
                return ((Enum<?>) value).name();
            default:
                return value.toString();
        }
    }

    /**
     * Shortest decimal that reads back to the same double, never in exponent form.
     */
    static String formatDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0 && 1 / value < 0) {
            return NEGATIVE_ZERO;
        }
        return plain(Double.toString(value));
    }

    static String formatFloat(float value) {
        if (Float.isNaN(value) || Float.isInfinite(value)) {
            return Float.toString(value);
        }
        if (value == 0 && 1 / value < 0) {
            return NEGATIVE_ZERO;
        }
        return plain(Float.toString(value));
    }

    private static String plain(String javaForm) {
        return new BigDecimal(javaForm).stripTrailingZeros().toPlainString();
    }

    static Object parse(String text, Class<?> type, ValueKind kind) throws ConversionException {
        try {
            switch (kind) {
                case BOOLEAN:
                    Boolean bool = parseBoolean(text);
                    if (bool == null) {
                        throw new ConversionException(text, type);
                    }
                    return bool;
                case INTEGER:
                    return parseInteger(text, type);
                case FLOAT:
                    if (type == float.class || type == Float.class) {
                        return Float.parseFloat(text);
                    }
                    return Double.parseDouble(text);
                case STRING:
                    return text;
                case ENUM:
                    return parseEnum(text, type);
                default:
                    throw new IllegalArgumentException(kind + " is not a scalar kind");
            }
        } catch (NumberFormatException e) {
            throw new ConversionException(text, type, e);
        }
    }

    private static Object parseEnum(String text, Class<?> type) throws ConversionException {
        for (Object constant : type.getEnumConstants()) {
            if (((Enum<?>) constant).name().equals(text)) {
                return constant;
            }
        }
        throw new ConversionException(text, type);
    }

    private static Object parseInteger(String text, Class<?> type) {
        if (type == byte.class || type == Byte.class) {
            return Byte.decode(text);
        } else if (type == short.class || type == Short.class) {
            return Short.decode(text);
        } else if (type == int.class || type == Integer.class) {
            return Integer.decode(text);
        }
        return Long.decode(text);
    }

    private static Boolean parseBoolean(String text) {
        switch (text) {
            case "1": case "t": case "T": case "TRUE": case "true": case "True":
                return Boolean.TRUE;
            case "0": case "f": case "F": case "FALSE": case "false": case "False":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    static Object zero(Class<?> type, ValueKind kind) {
        switch (kind) {
            case BOOLEAN:
                return Boolean.FALSE;
            case INTEGER:
                if (type == byte.class || type == Byte.class) {
                    return (byte) 0;
                } else if (type == short.class || type == Short.class) {
                    return (short) 0;
                } else if (type == int.class || type == Integer.class) {
                    return 0;
                }
                return 0L;
            case FLOAT:
                return type == float.class || type == Float.class ? (Object) 0f : (Object) 0d;
            case STRING:
                return "";
            default:
                return null;
        }
    }

    static boolean isZero(Object value, ValueKind kind) {
        switch (kind) {
            case BOOLEAN:
                return !((Boolean) value);
            case INTEGER:
                return ((Number) value).longValue() == 0;
            case FLOAT:
                return ((Number) value).doubleValue() == 0;
            case STRING:
                return ((String) value).isEmpty();
            default:
                return false;
        }
    }
}
