package com.company.searchindexer.service;

import com.company.searchindexer.client.SearchHits;
import com.company.searchindexer.client.SearchIndexClient;
import com.company.searchindexer.model.CompiledQuery;
import common.indexer.dto.SearchRequest;
import common.indexer.dto.SearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchService {

    static final List<Map<String, Object>> DEFAULT_SORT = List.of(
            Map.of("editado", Map.of("order", "desc")),
            Map.of("id", Map.of("order", "desc")));

    private final PublicationQueryCompiler queryCompiler;
    private final SearchIndexClient searchIndexClient;

    /**
     * Busca publicaciones y devuelve la respuesta con el formato de la consulta MySQL original.
     */
    public SearchResponse search(SearchRequest params) {
        CompiledQuery query = queryCompiler.compile(params);

        int page = params.getPage() == null || params.getPage() < 1 ? 1 : params.getPage();
        int pageSize = params.getPageSize() == null || params.getPageSize() < 1 ? 15 : params.getPageSize();
        int from = (page - 1) * pageSize;

        log.debug("Searching publications page {} size {}: {}", page, pageSize, query);
        SearchHits hits = searchIndexClient.search(query, from, pageSize, DEFAULT_SORT);

        long total = hits.getTotal();
        int pages = total > 0 ? (int) ((total + pageSize - 1) / pageSize) : 1;
        return new SearchResponse(hits.getSources(), total, page, pages);
    }
}
