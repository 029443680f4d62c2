package com.axoncity.metrics.service;

import com.axoncity.metrics.dto.MetricsDto.MetricDefinitionDetail;
import com.axoncity.metrics.dto.MetricsDto.MetricInterpretation;
import com.axoncity.metrics.model.DerivedMetricId;
import com.axoncity.metrics.rdf.RdfService;
import com.axoncity.metrics.repository.MetricDefinitionsRepository;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricCatalogServiceTest {

    private static MetricCatalogService service;

    @BeforeAll
    static void setUp() {
        RdfService rdf = new RdfService(new ClassPathResource("rdf/metric-definitions.ttl"));
        rdf.loadRdfOnStartup();
        MetricDefinitionsRepository repo = new MetricDefinitionsRepository(rdf);
        repo.init();
        service = new MetricCatalogService(repo);
    }

    @Test
    void listDefinitions_derivedFirstThenPoi() {
        List<MetricDefinitionDetail> definitions = service.listDefinitions();

        assertThat(definitions).hasSize(15);
        assertThat(definitions.subList(0, 9)).allMatch(d -> d.kind().equals("derived"));
        assertThat(definitions.subList(9, 15)).allMatch(d -> d.kind().equals("poi"));
        assertThat(definitions.get(0).id()).isEqualTo("diversity_index");
    }

    @Test
    void getDefinition_derivedHasThresholdsButNoRanges() {
        MetricDefinitionDetail detail = service.getDefinition("walkability_proxy");

        assertThat(detail.kind()).isEqualTo("derived");
        assertThat(detail.thresholds().low()).isEqualTo(50.0);
        assertThat(detail.ranges()).isNull();
        assertThat(detail.requiredLayers()).isNotEmpty();
    }

    @Test
    void getDefinition_poiHasRanges() {
        MetricDefinitionDetail detail = service.getDefinition("coverageScore");

        assertThat(detail.kind()).isEqualTo("poi");
        assertThat(detail.shortName()).isEqualTo("Coverage");
        assertThat(detail.ranges()).hasSize(4);
        assertThat(detail.thresholds()).isNull();
    }

    @Test
    void getDefinition_unknownId_throws() {
        assertThatThrownBy(() -> service.getDefinition("happiness"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown metric: happiness");
    }

    @Test
    void interpret_derivedUsesLowInclusiveHighThresholds() {
        MetricInterpretation low = service.interpret("green_ratio", 9.99);
        MetricInterpretation medium = service.interpret("green_ratio", 10);
        MetricInterpretation high = service.interpret("green_ratio", 20);

        assertThat(low.level()).isEqualTo("low");
        assertThat(medium.level()).isEqualTo("medium");
        assertThat(medium.description()).isEqualTo("10-20%: Adequate green coverage");
        assertThat(high.level()).isEqualTo("high");
    }

    @Test
    void interpret_poiUsesMatchingRange() {
        assertThat(service.interpret("diversityIndex", 1.2).level()).isEqualTo("Moderate");
        assertThat(service.interpret("coverageScore", 100).level()).isEqualTo("Excellent");
        assertThat(service.interpret("coverageScore", 12.5).description())
                .isEqualTo("Significant data gaps likely; interpret with caution");
    }

    @Test
    void levelOf_derived() {
        assertThat(service.levelOf(DerivedMetricId.STREET_CONNECTIVITY, 100)).isEqualTo("high");
        assertThat(service.levelOf(DerivedMetricId.FIFTEEN_MIN_SCORE, 40)).isEqualTo("low");
    }
}
