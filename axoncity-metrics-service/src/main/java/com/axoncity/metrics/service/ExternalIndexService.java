package com.axoncity.metrics.service;

import com.axoncity.metrics.dto.MetricsDto.ExternalIndexSummary;
import com.axoncity.metrics.dto.MetricsDto.ImportPreview;
import com.axoncity.metrics.dto.MetricsDto.ImportRequest;
import com.axoncity.metrics.exception.InvalidRequestException;
import com.axoncity.metrics.importer.CoordinateColumnDetector;
import com.axoncity.metrics.importer.CoordinateColumnDetector.DetectedColumns;
import com.axoncity.metrics.importer.DelimitedTextParser;
import com.axoncity.metrics.importer.ExternalIndexImportException;
import com.axoncity.metrics.importer.ExternalIndexImporter;
import com.axoncity.metrics.importer.ImportConfig;
import com.axoncity.metrics.importer.ParsedTable;
import com.axoncity.metrics.model.ExternalIndex;
import com.axoncity.metrics.repository.ExternalIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class ExternalIndexService {

    private static final Logger log = LoggerFactory.getLogger(ExternalIndexService.class);

    private final DelimitedTextParser parser;
    private final CoordinateColumnDetector detector;
    private final ExternalIndexImporter importer;
    private final ExternalIndexRepository repo;
    private final int previewRows;

    public ExternalIndexService(DelimitedTextParser parser,
                                CoordinateColumnDetector detector,
                                ExternalIndexImporter importer,
                                ExternalIndexRepository repo,
                                @Value("${axoncity.import.preview-rows:10}") int previewRows) {
        this.parser = parser;
        this.detector = detector;
        this.importer = importer;
        this.repo = repo;
        this.previewRows = previewRows;
    }

    /**
     * Parses uploaded text so the caller can pick the value and key columns.
     */
    public ImportPreview preview(String content) {
        ParsedTable table = parser.parse(content);
        DetectedColumns detected = detector.detect(table.headers());
        List<Map<String, String>> sample = table.rows().subList(0, Math.min(previewRows, table.rows().size()));

        return new ImportPreview(
                String.valueOf(table.delimiter()),
                table.headers(),
                sample,
                table.rows().size(),
                table.droppedRows(),
                detected.latColumn(),
                detected.lonColumn()
        );
    }

    public ExternalIndex importIndex(ImportRequest request) {
        if (request == null || request.valueColumn() == null || request.valueColumn().isBlank()) {
            throw new InvalidRequestException("valueColumn is required");
        }
        ImportConfig config = new ImportConfig(
                request.name(),
                request.description(),
                request.unit(),
                request.fileName(),
                request.valueColumn(),
                request.areaColumn(),
                request.latColumn(),
                request.lonColumn()
        );

        ExternalIndex index;
        try {
            ParsedTable table = parser.parse(request.content());
            index = importer.importIndex(table, config);
            log.debug("Kept {} of {} rows from {}", index.values().size(), table.rows().size(), request.fileName());
        } catch (ExternalIndexImportException e) {
            log.warn("Import of {} failed: {}", request.fileName(), e.getMessage());
            throw e;
        }

        repo.save(index);
        log.info("Imported index {} '{}' with {} values [{}, {}]",
                index.id(), index.name(), index.values().size(), index.min(), index.max());
        return index;
    }

    public List<ExternalIndexSummary> listIndices() {
        return repo.findAll().stream()
                .map(ExternalIndexService::toSummary)
                .toList();
    }

    public ExternalIndex getIndex(String id) {
        return repo.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown external index: " + id));
    }

    public void deleteIndex(String id) {
        if (!repo.deleteById(id)) {
            throw new IllegalArgumentException("Unknown external index: " + id);
        }
        log.info("Removed index {}", id);
    }

    private static ExternalIndexSummary toSummary(ExternalIndex index) {
        return new ExternalIndexSummary(
                index.id(),
                index.name(),
                index.source(),
                index.values().size(),
                index.min(),
                index.max(),
                index.unit(),
                index.importedAt()
        );
    }
}
