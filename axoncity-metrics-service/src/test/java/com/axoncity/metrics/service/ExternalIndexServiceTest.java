package com.axoncity.metrics.service;

import com.axoncity.metrics.dto.MetricsDto.ExternalIndexSummary;
import com.axoncity.metrics.dto.MetricsDto.ImportPreview;
import com.axoncity.metrics.dto.MetricsDto.ImportRequest;
import com.axoncity.metrics.exception.InvalidRequestException;
import com.axoncity.metrics.importer.CoordinateColumnDetector;
import com.axoncity.metrics.importer.DelimitedTextParser;
import com.axoncity.metrics.importer.ExternalIndexImporter;
import com.axoncity.metrics.importer.MissingColumnException;
import com.axoncity.metrics.model.ExternalIndex;
import com.axoncity.metrics.repository.ExternalIndexRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ExternalIndexServiceTest {

    private static final String STATIONS = """
            station;latitude;longitude;pm25
            Alexanderplatz;52.5219;13.4132;14.2
            Tempelhof;52.4730;13.4039;9.8
            Wedding;52.5427;13.3665;n/a
            """;

    private ExternalIndexRepository repo;
    private ExternalIndexService service;

    @BeforeEach
    void setUp() {
        DelimitedTextParser parser = new DelimitedTextParser();
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        repo = new ExternalIndexRepository();
        service = new ExternalIndexService(parser, new CoordinateColumnDetector(),
                new ExternalIndexImporter(parser, clock), repo, 2);
    }

    @Test
    void preview_detectsDelimiterAndCoordinateColumns() {
        ImportPreview preview = service.preview(STATIONS);

        assertThat(preview.delimiter()).isEqualTo(";");
        assertThat(preview.headers()).containsExactly("station", "latitude", "longitude", "pm25");
        assertThat(preview.rowCount()).isEqualTo(3);
        assertThat(preview.sampleRows()).hasSize(2);
        assertThat(preview.detectedLatColumn()).isEqualTo("latitude");
        assertThat(preview.detectedLonColumn()).isEqualTo("longitude");
    }

    @Test
    void importIndex_storesIndexKeyedByCoordinates() {
        ExternalIndex index = service.importIndex(request(STATIONS, "pm25", null, "latitude", "longitude"));

        assertThat(index.values()).containsOnlyKeys("52.521900,13.413200", "52.473000,13.403900");
        assertThat(index.source()).isEqualTo("Imported from stations.csv");
        assertThat(repo.findById(index.id())).contains(index);
    }

    @Test
    void importIndex_blankValueColumn_isRejected() {
        assertThatThrownBy(() -> service.importIndex(request(STATIONS, " ", null, null, null)))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void importIndex_failedImportStoresNothing() {
        assertThatThrownBy(() -> service.importIndex(request(STATIONS, "no2", "station", null, null)))
                .isInstanceOf(MissingColumnException.class);

        assertThat(repo.findAll()).isEmpty();
    }

    @Test
    void listAndDelete() {
        ExternalIndex index = service.importIndex(request(STATIONS, "pm25", "station", null, null));

        assertThat(service.listIndices())
                .extracting(ExternalIndexSummary::id, ExternalIndexSummary::valueCount)
                .containsExactly(tuple(index.id(), 2));

        service.deleteIndex(index.id());

        assertThat(service.listIndices()).isEmpty();
        assertThatThrownBy(() -> service.getIndex(index.id()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(index.id());
        assertThatThrownBy(() -> service.deleteIndex(index.id()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ImportRequest request(String content, String valueColumn, String areaColumn,
                                         String latColumn, String lonColumn) {
        return new ImportRequest(content, "stations.csv", "PM2.5", "Annual mean", "µg/m³",
                valueColumn, areaColumn, latColumn, lonColumn);
    }
}
