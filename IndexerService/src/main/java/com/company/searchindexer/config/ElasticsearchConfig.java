package com.company.searchindexer.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties({IndexerProperties.class, ElasticsearchConfig.ElasticsearchProperties.class})
public class ElasticsearchConfig {

    @Bean
    public RestTemplate elasticsearchRestTemplate(RestTemplateBuilder builder, ElasticsearchProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getReadTimeout().toMillis());

        RestTemplateBuilder configured = builder
                .rootUri(properties.getUrl())
                .requestFactory(() -> factory);

        if (StringUtils.hasText(properties.getApiKey())) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + properties.getApiKey());
        } else if (StringUtils.hasText(properties.getUsername())) {
            configured = configured.basicAuthentication(properties.getUsername(), properties.getPassword());
        }
        return configured.build();
    }

    @Bean
    public CircuitBreaker searchCircuitBreaker(CircuitBreakerRegistry circuitBreakerRegistry) {
        return circuitBreakerRegistry.circuitBreaker("elasticsearch-search");
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(10))
                .slidingWindowSize(5)
                .permittedNumberOfCallsInHalfOpenState(3)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Conexión a Elasticsearch ({@code app.elasticsearch.*}).
     * Si hay api-key se usa en lugar de usuario y contraseña.
     */
    @Data
    @ConfigurationProperties(prefix = "app.elasticsearch")
    public static class ElasticsearchProperties {
        private String url = "http://localhost:9200";
        private String username;
        private String password;
        // formato "id:api_key" codificado en base64
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        // settings y mappings con los que se crea el índice si no existe
        private String indexDefinition = "classpath:elasticsearch/publication-index.json";
    }
}
