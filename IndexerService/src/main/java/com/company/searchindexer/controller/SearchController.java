package com.company.searchindexer.controller;

import com.company.searchindexer.service.JobReaper;
import com.company.searchindexer.service.ReaperReport;
import com.company.searchindexer.service.SearchService;
import common.indexer.dto.SearchRequest;
import common.indexer.dto.SearchResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Search", description = "Búsqueda de publicaciones y mantenimiento del índice")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SearchController {

    private final SearchService searchService;
    private final JobReaper jobReaper;

    @Operation(summary = "Busca publicaciones en Elasticsearch con los filtros del buscador")
    @PostMapping("/search")
    public SearchResponse search(@RequestBody SearchRequest request) {
        return searchService.search(request);
    }

    @Operation(summary = "Lanza a mano la limpieza de procesos antiguos")
    @PostMapping("/maintenance/cleanup")
    public ReaperReport cleanup() {
        return jobReaper.sweep();
    }
}
