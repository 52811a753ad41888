package com.company.searchindexer.client;

import com.company.searchindexer.config.IndexerProperties;
import com.company.searchindexer.exception.SourceUnavailableException;
import com.company.searchindexer.model.CompiledQuery;
import com.company.searchindexer.model.IndexDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cliente de Elasticsearch sobre la API REST.
 */
@Slf4j
@Component
public class ElasticsearchRestClient implements SearchIndexClient {

    private static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RetryTemplate bulkRetryTemplate;
    private final CircuitBreaker searchCircuitBreaker;
    private final String indexName;

    public ElasticsearchRestClient(@Qualifier("elasticsearchRestTemplate") RestTemplate restTemplate,
                                   ObjectMapper objectMapper,
                                   @Qualifier("bulkRetryTemplate") RetryTemplate bulkRetryTemplate,
                                   @Qualifier("searchCircuitBreaker") CircuitBreaker searchCircuitBreaker,
                                   IndexerProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.bulkRetryTemplate = bulkRetryTemplate;
        this.searchCircuitBreaker = searchCircuitBreaker;
        this.indexName = properties.getIndexName();
    }

    @Override
    public boolean ping() {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity("/", String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.warn("Elasticsearch ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean ensureIndex(Map<String, Object> definition) {
        try {
            restTemplate.headForHeaders("/{index}", indexName);
            log.info("Index {} already exists", indexName);
            return false;
        } catch (HttpClientErrorException.NotFound e) {
            restTemplate.put("/{index}", definition, indexName);
            log.info("✅ Índice {} creado", indexName);
            return true;
        }
    }

    @Override
    public void upsert(Object id, IndexDocument document) {
        restTemplate.put("/{index}/_doc/{id}", document.asMap(), indexName, id);
    }

    @Override
    public BulkResult bulkUpsert(List<IndexDocument> documents) {
        if (documents.isEmpty()) {
            return new BulkResult(0, 0, List.of());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(NDJSON);
        HttpEntity<String> request = new HttpEntity<>(toNdjson(documents), headers);

        String body = bulkRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying bulk write of {} documents (attempt {})", documents.size(), context.getRetryCount() + 1);
            }
            return restTemplate.postForObject("/_bulk", request, String.class);
        });
        return parseBulkResponse(body, documents.size());
    }

    @Override
    public SearchHits search(CompiledQuery query, int from, int size, List<Map<String, Object>> sort) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query.toDsl());
        body.put("from", from);
        body.put("size", size);
        body.put("sort", sort);
        body.put("track_total_hits", true);

        try {
            JsonNode response = searchCircuitBreaker.executeSupplier(() -> restTemplate.exchange(
                    "/{index}/_search", HttpMethod.POST, new HttpEntity<>(body), JsonNode.class, indexName).getBody());
            return parseSearchResponse(response);
        } catch (CallNotPermittedException e) {
            throw new SourceUnavailableException("Elasticsearch circuit is open, search rejected", e);
        } catch (RestClientException e) {
            throw new SourceUnavailableException("Elasticsearch search failed: " + e.getMessage(), e);
        }
    }

    String toNdjson(List<IndexDocument> documents) {
        StringBuilder ndjson = new StringBuilder();
        try {
            for (IndexDocument document : documents) {
                Map<String, Object> target = new LinkedHashMap<>();
                target.put("_index", indexName);
                target.put("_id", String.valueOf(document.getId()));
                Map<String, Object> action = Map.of("index", target);
                ndjson.append(objectMapper.writeValueAsString(action)).append('\n');
                ndjson.append(objectMapper.writeValueAsString(document.asMap())).append('\n');
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bulk request", e);
        }
        return ndjson.toString();
    }

    BulkResult parseBulkResponse(String body, int expected) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            log.error("Unreadable bulk response: {}", e.getMessage());
            return BulkResult.allFailed(expected, "Unreadable bulk response");
        }
        JsonNode items = root == null ? null : root.path("items");
        if (items == null || !items.isArray()) {
            return BulkResult.allFailed(expected, "Bulk response without items");
        }

        int succeeded = 0;
        List<BulkResult.ItemFailure> failures = new ArrayList<>();
        for (JsonNode item : items) {
            JsonNode result = item.elements().hasNext() ? item.elements().next() : item;
            int status = result.path("status").asInt(500);
            if (status >= 200 && status < 300 && !result.has("error")) {
                succeeded++;
            } else {
                failures.add(new BulkResult.ItemFailure(result.path("_id").asText(null), describeError(result.path("error"))));
            }
        }
        return new BulkResult(succeeded, failures.size(), failures);
    }

    @SuppressWarnings("unchecked")
    private SearchHits parseSearchResponse(JsonNode response) {
        if (response == null) {
            return new SearchHits(0, List.of());
        }
        JsonNode hits = response.path("hits");
        JsonNode total = hits.path("total");
        // ES 7+ devuelve {value, relation}; versiones anteriores un número
        long totalValue = total.isObject() ? total.path("value").asLong(0) : total.asLong(0);

        List<Map<String, Object>> sources = new ArrayList<>();
        for (JsonNode hit : hits.path("hits")) {
            sources.add(objectMapper.convertValue(hit.path("_source"), LinkedHashMap.class));
        }
        return new SearchHits(totalValue, sources);
    }

    private String describeError(JsonNode error) {
        if (error.isMissingNode() || error.isNull()) {
            return "unknown";
        }
        if (error.isTextual()) {
            return error.asText();
        }
        return error.path("type").asText("error") + ": " + error.path("reason").asText("");
    }
}
