package com.example.csvencoding.io;

import lombok.Data;
import org.apache.commons.csv.CSVFormat;

/**
 * Apache Commons CSV settings shared by {@link CommonsCsvRowReader} and
 * {@link CommonsCsvRowWriter}.
 */
@Data
public class CommonsCsvConfig {
    private char delimiter = ',';
    private char quoteChar = '"';
    private String recordSeparator = "\n";
    private boolean ignoreSurroundingSpaces = false;
    private boolean ignoreEmptyLines = true;

    CSVFormat toFormat() {
        return CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setQuote(quoteChar)
                .setRecordSeparator(recordSeparator)
                .setIgnoreSurroundingSpaces(ignoreSurroundingSpaces)
                .setIgnoreEmptyLines(ignoreEmptyLines)
                .build();
    }
}
