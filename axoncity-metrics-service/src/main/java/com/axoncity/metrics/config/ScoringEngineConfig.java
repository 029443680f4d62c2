package com.axoncity.metrics.config;

import com.axoncity.metrics.calculator.DerivedIndexCalculator;
import com.axoncity.metrics.calculator.InsightGenerator;
import com.axoncity.metrics.calculator.MetricComparator;
import com.axoncity.metrics.calculator.PoiMetricsCalculator;
import com.axoncity.metrics.importer.CoordinateColumnDetector;
import com.axoncity.metrics.importer.DelimitedTextParser;
import com.axoncity.metrics.importer.ExternalIndexImporter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * The calculators and the importer carry no Spring annotations; they are registered here.
 */
@Configuration
public class ScoringEngineConfig {

    @Bean
    public PoiMetricsCalculator poiMetricsCalculator(Clock clock) {
        return new PoiMetricsCalculator(clock);
    }

    @Bean
    public DerivedIndexCalculator derivedIndexCalculator() {
        return new DerivedIndexCalculator();
    }

    @Bean
    public MetricComparator metricComparator() {
        return new MetricComparator();
    }

    @Bean
    public InsightGenerator insightGenerator() {
        return new InsightGenerator();
    }

    @Bean
    public DelimitedTextParser delimitedTextParser() {
        return new DelimitedTextParser();
    }

    @Bean
    public CoordinateColumnDetector coordinateColumnDetector() {
        return new CoordinateColumnDetector();
    }

    @Bean
    public ExternalIndexImporter externalIndexImporter(DelimitedTextParser parser, Clock clock) {
        return new ExternalIndexImporter(parser, clock);
    }
}
