package com.example.csvencoding;

import com.example.csvencoding.exception.CsvException;
import com.example.csvencoding.io.Charsets;
import com.example.csvencoding.io.CsvIo;
import com.example.csvencoding.io.RowReader;
import com.example.csvencoding.io.RowWriter;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Rewrites a CSV file through a record class: every row is decoded into a fresh
 * instance and encoded again, under the header derived from the class.
 *
 * Example usage:
 * java -cp csv-encoding.jar:model.jar com.example.csvencoding.CsvTranscoderMain in.csv auto out.csv UTF-8 com.acme.Order
 */
@Slf4j
public class CsvTranscoderMain {

    @Data
    public static class Options {
        private Path inputFile;
        private String inputCharset = Charsets.AUTO;
        private Path outputFile;
        private String outputCharset = "UTF-8";
        private String recordClass;
        private String parser = CsvIo.UNIVOCITY; // or "commons"
        private char delimiter = ',';
        private char quoteChar = '"';
        private String emptyValue = CsvSession.DEFAULT_EMPTY_VALUE;
        private String nilValue = CsvSession.DEFAULT_NIL_VALUE;
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 5) {
            System.out.println("Usage: CsvTranscoderMain <inputFile> <inputCharset|auto> <outputFile> <outputCharset> <recordClass> [parser=univocity|commons] [delimiter] [quoteChar]");
            System.out.println("Example: CsvTranscoderMain orders.csv IBM1388 orders-utf8.csv UTF-8 com.acme.Order commons ; \"");
            return;
        }
        Options options = new Options();
        options.setInputFile(Paths.get(args[0]));
        options.setInputCharset(args[1]);
        options.setOutputFile(Paths.get(args[2]));
        options.setOutputCharset(args[3]);
        options.setRecordClass(args[4]);
        if (args.length > 5) options.setParser(args[5]);
        if (args.length > 6) options.setDelimiter(args[6].charAt(0));
        if (args.length > 7) options.setQuoteChar(args[7].charAt(0));

        log.info("Options: {}", options);
        try {
            long records = run(options);
            System.out.println(records);
        } catch (Throwable t) {
            log.error("Transcoding failed: {}", t.getMessage(), t);
            throw t;
        }
    }

    /**
     * @return the number of records written, header excluded
     */
    public static long run(Options options) throws IOException, CsvException {
        Class<?> type = loadRecordClass(options.getRecordClass());
        Charset inCharset = Charsets.forFile(options.getInputFile(), options.getInputCharset());
        Charset outCharset = Charsets.resolve(options.getOutputCharset());

        CsvIo.Options io = new CsvIo.Options();
        io.setParser(options.getParser());
        io.setDelimiter(options.getDelimiter());
        io.setQuoteChar(options.getQuoteChar());

        try (Reader reader = Files.newBufferedReader(options.getInputFile(), inCharset);
             RowReader rows = CsvIo.reader(reader, io);
             Writer writer = Files.newBufferedWriter(options.getOutputFile(), outCharset);
             RowWriter sink = CsvIo.writer(writer, io)) {

            CsvDecoder decoder = new CsvDecoder(rows);
            decoder.setEmptyValue(options.getEmptyValue());
            decoder.setNilValue(options.getNilValue());
            CsvEncoder encoder = new CsvEncoder(sink);
            encoder.setEmptyValue(options.getEmptyValue());
            encoder.setNilValue(options.getNilValue());

            encoder.encodeHeader(type);
            long start = System.currentTimeMillis();
            long count = 0;
            while (true) {
                Object record = Instantiation.newInstance(type);
                if (!decoder.decode(record)) {
                    break;
                }
                encoder.encode(record);
                count++;
                if ((count % 100_000) == 0) {
                    log.info("Transcoded {} rows", count);
                }
            }
            long end = System.currentTimeMillis();
            log.info("Completed. Records: {}, Time(s): {}", count, (end - start) / 1000.0);
            return count;
        }
    }

    private static Class<?> loadRecordClass(String name) {
        try {
            return Class.forName(name);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Record class not found on the classpath: " + name, e);
        }
    }
}
