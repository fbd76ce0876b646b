package com.example.csvencoding.io;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Apache Commons CSV implementation of {@link RowReader}.
 */
@Slf4j
public class CommonsCsvRowReader implements RowReader {

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;

    public CommonsCsvRowReader(Reader input, CommonsCsvConfig cfg) throws IOException {
        this.parser = cfg.toFormat().parse(input);
        this.records = parser.iterator();
    }

    @Override
    public List<String> readRow() throws IOException {
        try {
            if (!records.hasNext()) {
                return null;
            }
            CSVRecord record = records.next();
            List<String> row = new ArrayList<>(record.size());
            for (String cell : record) {
                row.add(cell);
            }
            if (log.isTraceEnabled()) {
                log.trace("commons-csv read record {}: {}", record.getRecordNumber(), row);
            }
            return row;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (IllegalStateException e) {
            throw new IOException("commons-csv failed at line " + parser.getCurrentLineNumber() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
