package com.example.csvencoding;

import java.util.List;

/**
 * Implemented by types that produce their own cells. Takes precedence over every
 * other way of encoding the type, including collection and map handling.
 */
public interface CsvGetter {

    List<String> getCells() throws Exception;
}
