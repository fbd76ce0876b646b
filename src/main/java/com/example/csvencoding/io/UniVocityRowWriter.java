package com.example.csvencoding.io;

import com.univocity.parsers.common.TextWritingException;
import com.univocity.parsers.csv.CsvWriter;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * uniVocity implementation of {@link RowWriter}.
 * <p>
 * A row of one empty cell is written as a quoted empty token: uniVocity would
 * otherwise emit a blank line, which readers skip.
 */
public class UniVocityRowWriter implements RowWriter {

    private final Writer output;
    private final CsvWriter writer;
    private final String quotedEmptyRow;

    public UniVocityRowWriter(Writer output, UniVocityConfig cfg) {
        this.output = output;
        this.writer = new CsvWriter(output, cfg.toWriterSettings());
        this.quotedEmptyRow = "" + cfg.getQuoteChar() + cfg.getQuoteChar() + cfg.getLineSeparator();
    }

    @Override
    public void writeRow(List<String> row) throws IOException {
        if (row.size() == 1 && row.get(0).isEmpty()) {
            writer.flush();
            output.write(quotedEmptyRow);
            return;
        }
        try {
            writer.writeRow(row.toArray(new String[0]));
        } catch (TextWritingException e) {
            throw new IOException("uniVocity failed to write record " + e.getRecordCount() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void flush() {
        writer.flush();
    }

    @Override
    public void close() {
        writer.close();
    }
}
