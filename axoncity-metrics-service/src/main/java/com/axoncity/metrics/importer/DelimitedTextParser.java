package com.axoncity.metrics.importer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses CSV, semicolon-separated and tab-separated text. The delimiter is taken from the
 * header line: tab if present, otherwise semicolon if there is no comma, otherwise comma.
 */
public class DelimitedTextParser {

    public ParsedTable parse(String text) {
        if (text == null || text.isBlank()) {
            throw new EmptyFileException();
        }
        String content = text.strip();
        char delimiter = detectDelimiter(firstLine(content));

        List<List<String>> records = readRecords(content, delimiter);
        if (records.size() < 2) {
            throw new EmptyFileException();
        }

        List<String> headers = records.get(0);
        List<Map<String, String>> rows = new ArrayList<>();
        int dropped = 0;
        for (List<String> fields : records.subList(1, records.size())) {
            if (fields.size() != headers.size()) {
                dropped++;
                continue;
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                row.put(headers.get(i), fields.get(i));
            }
            rows.add(row);
        }
        return new ParsedTable(delimiter, headers, rows, dropped);
    }

    static char detectDelimiter(String headerLine) {
        if (headerLine.indexOf('\t') >= 0) {
            return '\t';
        }
        if (headerLine.indexOf(';') >= 0 && headerLine.indexOf(',') < 0) {
            return ';';
        }
        return ',';
    }

    static CSVFormat format(char delimiter) {
        return CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreSurroundingSpaces(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
    }

    /**
     * Non-blank records in file order. A whitespace-only line comes back from the parser as a
     * single empty field and is skipped like an empty one.
     */
    private static List<List<String>> readRecords(String content, char delimiter) {
        List<List<String>> records = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(content), format(delimiter))) {
            for (CSVRecord record : parser) {
                if (record.size() == 1 && record.get(0).isEmpty()) {
                    continue;
                }
                records.add(record.toList());
            }
        } catch (IOException | UncheckedIOException e) {
            throw new MalformedFileException(e);
        }
        return records;
    }

    private static String firstLine(String content) {
        int end = content.indexOf('\n');
        return end < 0 ? content : content.substring(0, end);
    }
}
