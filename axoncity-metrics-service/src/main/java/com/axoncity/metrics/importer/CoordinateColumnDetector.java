package com.axoncity.metrics.importer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Guesses which headers hold latitude and longitude from their names.
 */
public class CoordinateColumnDetector {

    private static final List<Pattern> LAT_PATTERNS = List.of(
            Pattern.compile("^lat$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^latitude$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^lat_", Pattern.CASE_INSENSITIVE),
            Pattern.compile("_lat$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^y$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^lat\\d*$", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> LON_PATTERNS = List.of(
            Pattern.compile("^lon$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^lng$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^longitude$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^long$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^lon_", Pattern.CASE_INSENSITIVE),
            Pattern.compile("_lon$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^x$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^lng\\d*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^lon\\d*$", Pattern.CASE_INSENSITIVE)
    );

    public record DetectedColumns(String latColumn, String lonColumn) {
    }

    /**
     * First header matching each pattern set, or null where nothing matches.
     */
    public DetectedColumns detect(List<String> headers) {
        String lat = null;
        String lon = null;
        for (String header : headers) {
            String trimmed = header.trim();
            if (lat == null && matchesAny(LAT_PATTERNS, trimmed)) {
                lat = trimmed;
            }
            if (lon == null && matchesAny(LON_PATTERNS, trimmed)) {
                lon = trimmed;
            }
            if (lat != null && lon != null) {
                break;
            }
        }
        return new DetectedColumns(lat, lon);
    }

    private static boolean matchesAny(List<Pattern> patterns, String header) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(header).find()) {
                return true;
            }
        }
        return false;
    }
}
