package com.example.csvencoding.io;

import lombok.Data;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * Picks the CSV backend for a pair of character streams.
 */
public final class CsvIo {

    public static final String UNIVOCITY = "univocity";
    public static final String COMMONS = "commons";

    private CsvIo() {}

    @Data
    public static class Options {
        private String parser = UNIVOCITY; // or "commons"
        private char delimiter = ',';
        private char quoteChar = '"';
    }

    public static RowReader reader(Reader input, Options options) throws IOException {
        if (COMMONS.equalsIgnoreCase(options.getParser())) {
            return new CommonsCsvRowReader(input, commonsConfig(options));
        }
        return new UniVocityRowReader(input, uniVocityConfig(options));
    }

    public static RowWriter writer(Writer output, Options options) throws IOException {
        if (COMMONS.equalsIgnoreCase(options.getParser())) {
            return new CommonsCsvRowWriter(output, commonsConfig(options));
        }
        return new UniVocityRowWriter(output, uniVocityConfig(options));
    }

    private static CommonsCsvConfig commonsConfig(Options options) {
        CommonsCsvConfig ccfg = new CommonsCsvConfig();
        ccfg.setDelimiter(options.getDelimiter());
        ccfg.setQuoteChar(options.getQuoteChar());
        return ccfg;
    }

    private static UniVocityConfig uniVocityConfig(Options options) {
        UniVocityConfig ucfg = new UniVocityConfig();
        ucfg.setDelimiter(options.getDelimiter());
        ucfg.setQuoteChar(options.getQuoteChar());
        return ucfg;
    }
}
