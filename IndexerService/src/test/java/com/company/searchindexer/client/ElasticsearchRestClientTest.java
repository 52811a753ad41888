package com.company.searchindexer.client;

import com.company.searchindexer.config.IndexerProperties;
import com.company.searchindexer.exception.SourceUnavailableException;
import com.company.searchindexer.model.CompiledQuery;
import com.company.searchindexer.model.IndexDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ElasticsearchRestClientTest {

    private static final String ES = "http://es.local:9200";

    private MockRestServiceServer server;
    private ElasticsearchRestClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(ES).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        RetryTemplate retry = RetryTemplate.builder()
                .maxAttempts(2)
                .retryOn(ResourceAccessException.class)
                .noBackoff()
                .build();
        client = new ElasticsearchRestClient(restTemplate, new ObjectMapper(), retry,
                CircuitBreaker.ofDefaults("test-search"), new IndexerProperties());
    }

    @Test
    void pingReportsAvailability() {
        server.expect(requestTo(ES + "/")).andRespond(withSuccess("{\"tagline\":\"You Know, for Search\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(ES + "/")).andRespond(withServerError());

        assertThat(client.ping()).isTrue();
        assertThat(client.ping()).isFalse();
        server.verify();
    }

    @Test
    void ensureIndexLeavesExistingIndexAlone() {
        server.expect(requestTo(ES + "/growin_licitaciones"))
                .andExpect(method(HttpMethod.HEAD))
                .andRespond(withSuccess());

        assertThat(client.ensureIndex(Map.of("mappings", Map.of()))).isFalse();
        server.verify();
    }

    @Test
    void ensureIndexCreatesMissingIndexWithDefinition() {
        Map<String, Object> definition = Map.of("mappings", Map.of("properties",
                Map.of("pais_nombre", Map.of("type", "keyword"))));
        server.expect(requestTo(ES + "/growin_licitaciones"))
                .andExpect(method(HttpMethod.HEAD))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(ES + "/growin_licitaciones"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.mappings.properties.pais_nombre.type").value("keyword"))
                .andRespond(withSuccess("{\"acknowledged\":true}", MediaType.APPLICATION_JSON));

        assertThat(client.ensureIndex(definition)).isTrue();
        server.verify();
    }

    @Test
    void upsertPutsDocumentById() {
        server.expect(requestTo(ES + "/growin_licitaciones/_doc/42"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.objeto").value("Puente"))
                .andRespond(withSuccess("{\"result\":\"created\"}", MediaType.APPLICATION_JSON));

        client.upsert(42L, IndexDocument.builder().put("id", 42L).put("objeto", "Puente").build());

        server.verify();
    }

    @Test
    void bulkReportsPerDocumentOutcome() {
        String response = "{\"errors\":true,\"items\":["
                + "{\"index\":{\"_id\":\"1\",\"status\":201}},"
                + "{\"index\":{\"_id\":\"2\",\"status\":400,\"error\":{\"type\":\"mapper_parsing_exception\",\"reason\":\"bad monto\"}}}"
                + "]}";
        server.expect(requestTo(ES + "/_bulk"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith("application/x-ndjson"))
                .andRespond(withSuccess(response, MediaType.APPLICATION_JSON));

        BulkResult result = client.bulkUpsert(List.of(
                IndexDocument.builder().put("id", 1L).build(),
                IndexDocument.builder().put("id", 2L).build()));

        assertThat(result.getSucceeded()).isEqualTo(1);
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getFailures().get(0).getId()).isEqualTo("2");
        assertThat(result.getFailures().get(0).getReason()).isEqualTo("mapper_parsing_exception: bad monto");
        server.verify();
    }

    @Test
    void ndjsonHasActionAndSourcePerDocument() {
        String ndjson = client.toNdjson(List.of(IndexDocument.builder().put("id", 7L).put("pais_id", 3).build()));

        assertThat(ndjson.split("\n")).containsExactly(
                "{\"index\":{\"_index\":\"growin_licitaciones\",\"_id\":\"7\"}}",
                "{\"id\":7,\"pais_id\":3}");
        assertThat(ndjson).endsWith("\n");
    }

    @Test
    void unreadableBulkResponseFailsEveryDocument() {
        BulkResult result = client.parseBulkResponse("<html>gateway timeout</html>", 3);

        assertThat(result.getSucceeded()).isZero();
        assertThat(result.getFailed()).isEqualTo(3);
    }

    @Test
    void searchSendsVisibilityFilterAndReadsHits() {
        String response = "{\"hits\":{\"total\":{\"value\":2,\"relation\":\"eq\"},\"hits\":["
                + "{\"_id\":\"9\",\"_source\":{\"id\":9,\"objeto\":\"A\"}},"
                + "{\"_id\":\"8\",\"_source\":{\"id\":8,\"objeto\":\"B\"}}]}}";
        server.expect(requestTo(ES + "/growin_licitaciones/_search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.query.bool.filter[0].term.visible").value(true))
                .andExpect(jsonPath("$.from").value(15))
                .andExpect(jsonPath("$.size").value(15))
                .andExpect(jsonPath("$.sort[0].editado.order").value("desc"))
                .andExpect(jsonPath("$.track_total_hits").value(true))
                .andRespond(withSuccess(response, MediaType.APPLICATION_JSON));

        SearchHits hits = client.search(CompiledQuery.builder().build(), 15, 15,
                List.of(Map.of("editado", Map.of("order", "desc"))));

        assertThat(hits.getTotal()).isEqualTo(2);
        assertThat(hits.getSources()).extracting(source -> source.get("objeto")).containsExactly("A", "B");
        server.verify();
    }

    @Test
    void searchErrorIsUnavailable() {
        server.expect(requestTo(ES + "/growin_licitaciones/_search")).andRespond(withServerError());

        assertThatThrownBy(() -> client.search(CompiledQuery.builder().build(), 0, 15, List.of()))
                .isInstanceOf(SourceUnavailableException.class);
    }
}
