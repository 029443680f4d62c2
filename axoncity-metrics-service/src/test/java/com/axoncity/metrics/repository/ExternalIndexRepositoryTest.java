package com.axoncity.metrics.repository;

import com.axoncity.metrics.model.ExternalIndex;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExternalIndexRepositoryTest {

    private final ExternalIndexRepository repo = new ExternalIndexRepository();

    @Test
    void findAll_returnsOldestFirst() {
        repo.save(index("index-b", "2026-01-15T12:00:00Z"));
        repo.save(index("index-a", "2026-01-15T09:00:00Z"));

        assertThat(repo.findAll()).extracting(ExternalIndex::id).containsExactly("index-a", "index-b");
    }

    @Test
    void deleteById_removesOnlyOnce() {
        repo.save(index("index-a", "2026-01-15T09:00:00Z"));

        assertThat(repo.deleteById("index-a")).isTrue();
        assertThat(repo.deleteById("index-a")).isFalse();
        assertThat(repo.findById("index-a")).isEmpty();
    }

    private static ExternalIndex index(String id, String importedAt) {
        return new ExternalIndex(id, id, "Imported from upload", "", Map.of("A", 1.0), 1.0, 1.0, "",
                Instant.parse(importedAt));
    }
}
