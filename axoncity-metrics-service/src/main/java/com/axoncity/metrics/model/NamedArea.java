package com.axoncity.metrics.model;

public record NamedArea(String name, PoiMetrics metrics) {
}
