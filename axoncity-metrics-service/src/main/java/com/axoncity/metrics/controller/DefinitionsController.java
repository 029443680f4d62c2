package com.axoncity.metrics.controller;

import com.axoncity.metrics.dto.MetricsDto.MetricDefinitionDetail;
import com.axoncity.metrics.dto.MetricsDto.MetricInterpretation;
import com.axoncity.metrics.service.MetricCatalogService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class DefinitionsController {

    private final MetricCatalogService service;

    public DefinitionsController(MetricCatalogService service) {
        this.service = service;
    }

    @GetMapping("/definitions")
    public List<MetricDefinitionDetail> list() {
        return service.listDefinitions();
    }

    @GetMapping("/definitions/{id}")
    public MetricDefinitionDetail get(@PathVariable String id) {
        return service.getDefinition(id);
    }

    @GetMapping("/definitions/{id}/interpretation")
    public MetricInterpretation interpret(@PathVariable String id, @RequestParam double value) {
        return service.interpret(id, value);
    }
}
