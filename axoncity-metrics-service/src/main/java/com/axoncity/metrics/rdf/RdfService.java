package com.axoncity.metrics.rdf;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Holds the metric definition catalog as an in-memory RDF dataset.
 */
@Service
public class RdfService {

    private static final Logger log = LoggerFactory.getLogger(RdfService.class);

    private final Resource rdfFile;

    // Dataset rather than a plain Model so readers go through transactions.
    @Getter
    private final Dataset dataset = DatasetFactory.createTxnMem();

    public RdfService(@Value("${axoncity.rdf.data-file}") Resource rdfFile) {
        this.rdfFile = rdfFile;
    }

    @PostConstruct
    public void loadRdfOnStartup() {
        try (InputStream in = rdfFile.getInputStream()) {
            Txn.executeWrite(dataset, () -> RDFDataMgr.read(dataset.getDefaultModel(), in, Lang.TURTLE));
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Failed to load RDF file: " + rdfFile, e);
        }
        long triples = Txn.calculateRead(dataset, () -> dataset.getDefaultModel().size());
        log.info("Loaded {} triples from {}", triples, rdfFile.getDescription());
    }
}
