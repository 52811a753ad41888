package com.company.searchindexer.config;

import com.company.searchindexer.client.SearchIndexClient;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Crea el índice de publicaciones al arrancar si no existe. Un fallo se registra
 * pero no impide el arranque: el servicio sigue atendiendo y los procesos fallarán
 * con su propio error mientras Elasticsearch no esté disponible.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchIndexInitializer {

    private final SearchIndexClient searchIndexClient;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final ElasticsearchConfig.ElasticsearchProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void createIndexIfMissing() {
        try {
            searchIndexClient.ensureIndex(loadIndexDefinition());
        } catch (IOException e) {
            log.error("❌ No se pudo leer la definición del índice {}: {}", properties.getIndexDefinition(), e.getMessage());
        } catch (RestClientException e) {
            log.error("❌ No se pudo crear el índice en Elasticsearch: {}", e.getMessage());
        }
    }

    Map<String, Object> loadIndexDefinition() throws IOException {
        Resource resource = resourceLoader.getResource(properties.getIndexDefinition());
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<Map<String, Object>>() {
            });
        }
    }
}
