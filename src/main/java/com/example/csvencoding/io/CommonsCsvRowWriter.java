package com.example.csvencoding.io;

import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Apache Commons CSV implementation of {@link RowWriter}.
 */
public class CommonsCsvRowWriter implements RowWriter {

    private final CSVPrinter printer;

    public CommonsCsvRowWriter(Writer output, CommonsCsvConfig cfg) throws IOException {
        this.printer = new CSVPrinter(output, cfg.toFormat());
    }

    @Override
    public void writeRow(List<String> row) throws IOException {
        printer.printRecord(row);
    }

    @Override
    public void flush() throws IOException {
        printer.flush();
    }

    @Override
    public void close() throws IOException {
        printer.close(true);
    }
}
