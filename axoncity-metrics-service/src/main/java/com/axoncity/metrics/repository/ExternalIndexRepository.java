package com.axoncity.metrics.repository;

import com.axoncity.metrics.model.ExternalIndex;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of imported indices. Contents live as long as the process.
 */
@Component
public class ExternalIndexRepository {

    private final Map<String, ExternalIndex> indexMap = new ConcurrentHashMap<>();

    public ExternalIndex save(ExternalIndex index) {
        indexMap.put(index.id(), index);
        return index;
    }

    /**
     * Oldest import first.
     */
    public List<ExternalIndex> findAll() {
        return indexMap.values().stream()
                .sorted(Comparator.comparing(ExternalIndex::importedAt).thenComparing(ExternalIndex::id))
                .toList();
    }

    public Optional<ExternalIndex> findById(String id) {
        return Optional.ofNullable(indexMap.get(id));
    }

    public boolean deleteById(String id) {
        return indexMap.remove(id) != null;
    }
}
