package com.property.distress.ingest;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a headed CSV extract into {@link SourceRow}s. Line numbers count the header as line 1.
 */
public class CsvRecordReader {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private static final int BYTE_ORDER_MARK = '\uFEFF';

    public List<SourceRow> read(Path path) {
        try (Reader reader = open(path)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public List<SourceRow> read(Reader reader) throws IOException {
        List<SourceRow> rows = new ArrayList<>();
        try (CSVParser parser = FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            for (CSVRecord record : parser) {
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < headers.size() && i < record.size(); i++) {
                    if (!headers.get(i).isEmpty()) {
                        values.put(headers.get(i), record.get(i));
                    }
                }
                rows.add(SourceRow.of(record.getRecordNumber() + 1, values));
            }
        }
        return rows;
    }

    /**
     * Opens a UTF-8 file, dropping a leading byte-order mark so it does not end up in the
     * first header name.
     */
    public static Reader open(Path path) throws IOException {
        PushbackReader reader = new PushbackReader(Files.newBufferedReader(path, StandardCharsets.UTF_8), 1);
        int first = reader.read();
        if (first != -1 && first != BYTE_ORDER_MARK) {
            reader.unread(first);
        }
        return reader;
    }
}
