package com.example.csvencoding.io;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Source of parsed CSV rows. Tokenizing, unquoting and unescaping are the
 * implementation's business.
 */
public interface RowReader extends Closeable {

    /**
     * @return the cells of the next row, or {@code null} at end of input
     */
    List<String> readRow() throws IOException;
}
