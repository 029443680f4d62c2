package com.axoncity.metrics.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalIndexTest {

    private static final Instant IMPORTED_AT = Instant.parse("2026-01-15T10:00:00Z");

    @Test
    void valuesInsideRange_areKeptInOrderAndUnmodifiable() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("Pankow", 2.0);
        values.put("Mitte", 5.0);

        ExternalIndex index = index(values, 2.0, 5.0);

        assertThat(index.values().keySet()).containsExactly("Pankow", "Mitte");
        assertThatThrownBy(() -> index.values().put("Wedding", 3.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void valueOutsideRange_isRejected() {
        assertThatThrownBy(() -> index(Map.of("A", 7.0), 0.0, 5.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outside");
        assertThatThrownBy(() -> index(Map.of("A", -1.0), 0.0, 5.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullOrNonFiniteValues_areRejected() {
        Map<String, Double> nullValue = new HashMap<>();
        nullValue.put("A", null);
        Map<String, Double> nullKey = new HashMap<>();
        nullKey.put(null, 1.0);

        assertThatThrownBy(() -> index(nullValue, 0.0, 5.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> index(nullKey, 0.0, 5.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> index(Map.of("A", Double.NaN), 0.0, 5.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invertedOrEmptyRange_isRejected() {
        assertThatThrownBy(() -> index(Map.of("A", 1.0), 5.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("range");
        assertThatThrownBy(() -> index(Map.of(), 0.0, 5.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ExternalIndex index(Map<String, Double> values, double min, double max) {
        return new ExternalIndex("index-1", "score", "Imported from upload", "", values, min, max, "", IMPORTED_AT);
    }
}
