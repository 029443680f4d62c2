package com.axoncity.metrics.controller;

import com.axoncity.metrics.dto.MetricsDto.ExternalIndexSummary;
import com.axoncity.metrics.dto.MetricsDto.ImportPreview;
import com.axoncity.metrics.dto.MetricsDto.ImportRequest;
import com.axoncity.metrics.model.ExternalIndex;
import com.axoncity.metrics.service.ExternalIndexService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class ExternalIndicesController {

    private final ExternalIndexService service;

    public ExternalIndicesController(ExternalIndexService service) {
        this.service = service;
    }

    @PostMapping(value = "/external-indices/preview", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ImportPreview preview(@RequestBody String content) {
        return service.preview(content);
    }

    @PostMapping("/external-indices")
    @ResponseStatus(HttpStatus.CREATED)
    public ExternalIndex importIndex(@RequestBody ImportRequest request) {
        return service.importIndex(request);
    }

    @GetMapping("/external-indices")
    public List<ExternalIndexSummary> list() {
        return service.listIndices();
    }

    @GetMapping("/external-indices/{id}")
    public ExternalIndex get(@PathVariable String id) {
        return service.getIndex(id);
    }

    @DeleteMapping("/external-indices/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        service.deleteIndex(id);
    }
}
