package com.axoncity.metrics.importer;

import java.util.List;
import java.util.Map;

/**
 * Delimited text after parsing: header names and the rows whose field count matched them.
 */
public record ParsedTable(
        char delimiter,
        List<String> headers,
        List<Map<String, String>> rows,
        int droppedRows
) {

    public ParsedTable {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }

    public boolean hasColumn(String column) {
        return column != null && headers.contains(column);
    }
}
