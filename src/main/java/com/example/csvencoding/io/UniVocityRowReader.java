package com.example.csvencoding.io;

import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.List;

/**
 * uniVocity implementation of {@link RowReader}.
 */
@Slf4j
public class UniVocityRowReader implements RowReader {

    private final CsvParser parser;

    public UniVocityRowReader(Reader input, UniVocityConfig cfg) {
        this.parser = new CsvParser(cfg.toParserSettings());
        parser.beginParsing(input);
    }

    @Override
    public List<String> readRow() throws IOException {
        String[] row;
        try {
            row = parser.parseNext();
        } catch (TextParsingException e) {
            log.error("uniVocity parser threw exception: {}", e.getMessage());
            throw new IOException("uniVocity failed at line " + e.getLineIndex() + ": " + e.getMessage(), e);
        }
        return row == null ? null : Arrays.asList(row);
    }

    @Override
    public void close() {
        parser.stopParsing();
    }
}
