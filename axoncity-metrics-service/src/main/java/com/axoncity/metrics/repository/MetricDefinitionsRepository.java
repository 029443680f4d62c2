package com.axoncity.metrics.repository;

import com.axoncity.metrics.model.DerivedMetricDefinition;
import com.axoncity.metrics.model.DerivedMetricDefinition.Interpretation;
import com.axoncity.metrics.model.DerivedMetricDefinition.Thresholds;
import com.axoncity.metrics.model.DerivedMetricId;
import com.axoncity.metrics.model.PoiMetricDefinition;
import com.axoncity.metrics.model.PoiMetricDefinition.InterpretationRange;
import com.axoncity.metrics.rdf.RdfService;
import jakarta.annotation.PostConstruct;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Literal;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads derived and POI metric definitions from the RDF catalog at startup. {@link #refresh()}
 * rebuilds each lookup map off to the side and swaps it in whole, so readers never see a partial catalog.
 */
@Component
public class MetricDefinitionsRepository {

    private static final Logger log = LoggerFactory.getLogger(MetricDefinitionsRepository.class);

    private static final String PREFIXES = """
            PREFIX schema: <https://schema.org/>
            PREFIX axc: <https://axoncity.example/ns#>
            """;

    private final RdfService rdf;
    private volatile Map<String, PoiMetricDefinition> poiMap = Map.of();
    private volatile Map<DerivedMetricId, DerivedMetricDefinition> derivedMap = Map.of();
    private volatile List<PoiMetricDefinition> cachedPoi = List.of();

    public MetricDefinitionsRepository(RdfService rdf) {
        this.rdf = rdf;
    }

    @PostConstruct
    public void init() {
        refresh();
    }

    public void refresh() {
        Map<DerivedMetricId, DerivedMetricDefinition> derived = new EnumMap<>(DerivedMetricId.class);
        for (DerivedMetricDefinition definition : fetchDerivedFromRdf()) {
            derived.put(definition.id(), definition);
        }
        derivedMap = Collections.unmodifiableMap(derived);

        List<PoiMetricDefinition> poi = fetchPoiFromRdf();
        Map<String, PoiMetricDefinition> poiById = new LinkedHashMap<>();
        for (PoiMetricDefinition definition : poi) {
            poiById.put(definition.id(), definition);
        }
        poiMap = Collections.unmodifiableMap(poiById);
        cachedPoi = List.copyOf(poi);

        if (derived.size() < DerivedMetricId.values().length) {
            log.warn("Catalog defines {} of {} derived metrics", derived.size(), DerivedMetricId.values().length);
        }
        log.info("Loaded {} derived and {} POI metric definitions", derived.size(), poi.size());
    }

    /**
     * Derived definitions in reporting order.
     */
    public List<DerivedMetricDefinition> findAllDerived() {
        return List.copyOf(derivedMap.values());
    }

    public Map<DerivedMetricId, DerivedMetricDefinition> derivedById() {
        return derivedMap;
    }

    public Optional<DerivedMetricDefinition> findDerived(DerivedMetricId id) {
        return Optional.ofNullable(derivedMap.get(id));
    }

    public List<PoiMetricDefinition> findAllPoi() {
        return cachedPoi;
    }

    public Optional<PoiMetricDefinition> findPoi(String id) {
        return Optional.ofNullable(poiMap.get(id));
    }

    private List<DerivedMetricDefinition> fetchDerivedFromRdf() {
        String sparqlQuery = PREFIXES + """
                SELECT ?identifier ?name ?description ?formula ?unit
                       ?low ?high ?textLow ?textMedium ?textHigh WHERE {
                  ?metric a schema:Dataset ;
                          axc:metricKind axc:DerivedMetric ;
                          schema:identifier ?identifier ;
                          schema:name ?name ;
                          axc:lowThreshold ?low ;
                          axc:highThreshold ?high .
                  OPTIONAL { ?metric schema:description ?description . }
                  OPTIONAL { ?metric schema:measurementTechnique ?formula . }
                  OPTIONAL { ?metric schema:unitText ?unit . }
                  OPTIONAL { ?metric axc:interpretationLow ?textLow . }
                  OPTIONAL { ?metric axc:interpretationMedium ?textMedium . }
                  OPTIONAL { ?metric axc:interpretationHigh ?textHigh . }
                }
                ORDER BY ?identifier
                """;

        return Txn.calculateRead(rdf.getDataset(), () -> {
            List<DerivedMetricDefinition> definitions = new ArrayList<>();
            try (QueryExecution queryExecution = QueryExecutionFactory.create(sparqlQuery, rdf.getDataset())) {
                ResultSet resultSet = queryExecution.execSelect();
                while (resultSet.hasNext()) {
                    QuerySolution row = resultSet.next();
                    String identifier = row.getLiteral("identifier").getString();
                    if (!DerivedMetricId.isDerived(identifier)) {
                        log.warn("Ignoring catalog entry for unknown derived metric {}", identifier);
                        continue;
                    }
                    DerivedMetricId id = DerivedMetricId.fromId(identifier);
                    definitions.add(new DerivedMetricDefinition(
                            id,
                            row.getLiteral("name").getString(),
                            readNodeValue(row.get("description")),
                            readNodeValue(row.get("formula")),
                            orEmpty(readNodeValue(row.get("unit"))),
                            id.requiredLayers(),
                            new Interpretation(
                                    readNodeValue(row.get("textLow")),
                                    readNodeValue(row.get("textMedium")),
                                    readNodeValue(row.get("textHigh"))),
                            new Thresholds(
                                    row.getLiteral("low").getDouble(),
                                    row.getLiteral("high").getDouble())
                    ));
                }
            }
            return definitions;
        });
    }

    private List<PoiMetricDefinition> fetchPoiFromRdf() {
        String sparqlQuery = PREFIXES + """
                SELECT ?identifier ?name ?shortName ?description ?formula ?unit ?higherMeans ?citation
                       ?rangeMin ?rangeMax ?rangeName ?rangeDescription WHERE {
                  ?metric a schema:Dataset ;
                          axc:metricKind axc:PoiMetric ;
                          schema:identifier ?identifier ;
                          schema:name ?name .
                  OPTIONAL { ?metric schema:alternateName ?shortName . }
                  OPTIONAL { ?metric schema:description ?description . }
                  OPTIONAL { ?metric schema:measurementTechnique ?formula . }
                  OPTIONAL { ?metric schema:unitText ?unit . }
                  OPTIONAL { ?metric axc:higherMeans ?higherMeans . }
                  OPTIONAL { ?metric schema:citation ?citation . }
                  OPTIONAL {
                    ?metric axc:interpretationRange ?range .
                    ?range axc:rangeMin ?rangeMin ;
                           schema:name ?rangeName .
                    OPTIONAL { ?range axc:rangeMax ?rangeMax . }
                    OPTIONAL { ?range schema:description ?rangeDescription . }
                  }
                }
                ORDER BY ?identifier ?rangeMin
                """;

        return Txn.calculateRead(rdf.getDataset(), () -> {
            Map<String, PoiDefinitionBuilder> builders = new LinkedHashMap<>();

            try (QueryExecution queryExecution = QueryExecutionFactory.create(sparqlQuery, rdf.getDataset())) {
                ResultSet resultSet = queryExecution.execSelect();
                while (resultSet.hasNext()) {
                    QuerySolution row = resultSet.next();
                    String id = row.getLiteral("identifier").getString();
                    String name = row.getLiteral("name").getString();

                    PoiDefinitionBuilder builder = builders.computeIfAbsent(id, key -> new PoiDefinitionBuilder(id, name))
                            .setShortName(readNodeValue(row.get("shortName")))
                            .setDescription(readNodeValue(row.get("description")))
                            .setFormula(readNodeValue(row.get("formula")))
                            .setUnit(readNodeValue(row.get("unit")))
                            .setHigherMeans(readNodeValue(row.get("higherMeans")))
                            .setCitation(readNodeValue(row.get("citation")));

                    Literal rangeMin = row.getLiteral("rangeMin");
                    if (rangeMin != null) {
                        Literal rangeMax = row.getLiteral("rangeMax");
                        builder.addRange(new InterpretationRange(
                                rangeMin.getDouble(),
                                rangeMax != null ? rangeMax.getDouble() : null,
                                readNodeValue(row.get("rangeName")),
                                readNodeValue(row.get("rangeDescription"))));
                    }
                }
            }

            return builders.values().stream()
                    .map(PoiDefinitionBuilder::build)
                    .toList();
        });
    }

    private static String readNodeValue(RDFNode node) {
        if (node == null) return null;
        if (node.isLiteral()) return node.asLiteral().getString();
        if (node.isResource()) return node.asResource().getURI();
        return node.toString();
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static class PoiDefinitionBuilder {
        private final String id;
        private final String name;
        private String shortName;
        private String description;
        private String formula;
        private String unit;
        private String higherMeans;
        private String citation;
        private final List<InterpretationRange> ranges = new ArrayList<>();

        PoiDefinitionBuilder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        PoiDefinitionBuilder setShortName(String value) {
            if (shortName == null) shortName = value;
            return this;
        }

        PoiDefinitionBuilder setDescription(String value) {
            if (description == null) description = value;
            return this;
        }

        PoiDefinitionBuilder setFormula(String value) {
            if (formula == null) formula = value;
            return this;
        }

        PoiDefinitionBuilder setUnit(String value) {
            if (unit == null) unit = value;
            return this;
        }

        PoiDefinitionBuilder setHigherMeans(String value) {
            if (higherMeans == null) higherMeans = value;
            return this;
        }

        PoiDefinitionBuilder setCitation(String value) {
            if (citation == null) citation = value;
            return this;
        }

        PoiDefinitionBuilder addRange(InterpretationRange range) {
            if (!ranges.contains(range)) {
                ranges.add(range);
            }
            return this;
        }

        PoiMetricDefinition build() {
            return new PoiMetricDefinition(
                    id,
                    name,
                    shortName != null ? shortName : name,
                    formula,
                    description,
                    orEmpty(unit),
                    higherMeans,
                    ranges,
                    citation
            );
        }
    }
}
