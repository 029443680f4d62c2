package com.axoncity.metrics.importer;

/**
 * Column choices for turning a {@link ParsedTable} into an index. Only {@code valueColumn} is
 * required; the key falls back from {@code areaColumn} to {@code latColumn}/{@code lonColumn}
 * to the row position.
 */
public record ImportConfig(
        String name,
        String description,
        String unit,
        String sourceName,
        String valueColumn,
        String areaColumn,
        String latColumn,
        String lonColumn
) {
}
