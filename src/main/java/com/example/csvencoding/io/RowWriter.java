package com.example.csvencoding.io;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.util.List;

/**
 * Sink for CSV rows. Implementations quote any cell that contains the delimiter, the
 * quote character or a line break.
 */
public interface RowWriter extends Closeable, Flushable {

    void writeRow(List<String> row) throws IOException;
}
