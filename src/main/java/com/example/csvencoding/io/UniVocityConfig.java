package com.example.csvencoding.io;

import com.univocity.parsers.csv.CsvParserSettings;
import com.univocity.parsers.csv.CsvWriterSettings;
import lombok.Data;

/**
 * uniVocity settings shared by {@link UniVocityRowReader} and {@link UniVocityRowWriter}.
 */
@Data
public class UniVocityConfig {
    private char delimiter = ',';
    private char quoteChar = '"';
    private String lineSeparator = "\n";
    private boolean skipEmptyLines = true;
    private boolean trimWhitespace = false;
    private int maxCharsPerColumn = 10_000_000;

    CsvParserSettings toParserSettings() {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setDelimiter(delimiter);
        settings.getFormat().setQuote(quoteChar);
        settings.getFormat().setQuoteEscape(quoteChar);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setIgnoreLeadingWhitespaces(trimWhitespace);
        settings.setIgnoreTrailingWhitespaces(trimWhitespace);
        settings.setSkipEmptyLines(skipEmptyLines);
        // empty cells come back as "" whether or not they were quoted
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.setMaxCharsPerColumn(maxCharsPerColumn);
        settings.setMaxColumns(100_000);
        return settings;
    }

    CsvWriterSettings toWriterSettings() {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.getFormat().setDelimiter(delimiter);
        settings.getFormat().setQuote(quoteChar);
        settings.getFormat().setQuoteEscape(quoteChar);
        settings.getFormat().setLineSeparator(lineSeparator);
        settings.setIgnoreLeadingWhitespaces(trimWhitespace);
        settings.setIgnoreTrailingWhitespaces(trimWhitespace);
        settings.setQuoteEscapingEnabled(true);
        settings.setSkipEmptyLines(false);
        settings.setNullValue("");
        return settings;
    }
}
