package com.axoncity.metrics.importer;

import com.axoncity.metrics.model.ExternalIndex;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a parsed table into an {@link ExternalIndex}. Rows with a non-numeric value or an
 * unusable key are skipped; the import fails only when no row survives.
 */
public class ExternalIndexImporter {

    private final DelimitedTextParser parser;
    private final Clock clock;

    public ExternalIndexImporter(DelimitedTextParser parser, Clock clock) {
        this.parser = parser;
        this.clock = clock;
    }

    public ExternalIndex importIndex(String text, ImportConfig config) {
        return importIndex(parser.parse(text), config);
    }

    public ExternalIndex importIndex(ParsedTable table, ImportConfig config) {
        if (!table.hasColumn(config.valueColumn())) {
            throw new MissingColumnException(config.valueColumn());
        }

        Map<String, Double> values = new LinkedHashMap<>();
        for (Map<String, String> row : table.rows()) {
            Double value = parseFinite(row.get(config.valueColumn()));
            if (value == null) {
                continue;
            }
            String key = keyFor(row, config, values.size());
            if (key == null) {
                continue;
            }
            values.put(key, value);
        }

        if (values.isEmpty()) {
            throw new NoValidRowsException(config.valueColumn());
        }

        return new ExternalIndex(
                "index-" + UUID.randomUUID(),
                isBlank(config.name()) ? config.valueColumn() : config.name(),
                "Imported from " + (isBlank(config.sourceName()) ? "upload" : config.sourceName()),
                config.description() == null ? "" : config.description(),
                values,
                Collections.min(values.values()),
                Collections.max(values.values()),
                config.unit() == null ? "" : config.unit(),
                Instant.now(clock)
        );
    }

    /**
     * Area column value, else a {@code "lat,lon"} key at six decimals, else {@code row-N}.
     * Null when coordinate columns are configured but a coordinate does not parse.
     */
    static String keyFor(Map<String, String> row, ImportConfig config, int keptSoFar) {
        if (!isBlank(config.areaColumn())) {
            String area = row.get(config.areaColumn());
            if (!isBlank(area)) {
                return area;
            }
        }
        if (!isBlank(config.latColumn()) && !isBlank(config.lonColumn())) {
            Double lat = parseFinite(row.get(config.latColumn()));
            Double lon = parseFinite(row.get(config.lonColumn()));
            if (lat == null || lon == null) {
                return null;
            }
            return String.format(Locale.ROOT, "%.6f,%.6f", lat, lon);
        }
        return "row-" + keptSoFar;
    }

    static Double parseFinite(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            // not numeric: the row is skipped
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
