package com.example.csvencoding.exception;

/**
 * A custom cell or text conversion method failed. The original failure is the cause.
 */
public class HookException extends CsvException {

    private static final long serialVersionUID = 1L;

    public HookException(String hook, Throwable cause) {
        super(hook + " failed: " + cause.getMessage(), cause);
    }
}
