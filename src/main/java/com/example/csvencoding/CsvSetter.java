package com.example.csvencoding;

import java.util.List;

/**
 * Implemented by types that populate themselves from cells. The decoder creates a
 * fresh instance through the no-argument constructor, calls {@link #setCells(List)}
 * and binds the instance to the field.
 */
public interface CsvSetter {

    void setCells(List<String> cells) throws Exception;
}
