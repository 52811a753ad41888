package com.company.searchindexer;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "Search Indexer API",
                version = "1.0",
                description = "API para indexar publicaciones en Elasticsearch y buscar sobre el índice"
        )
)
public class IndexerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IndexerServiceApplication.class, args);
        System.out.println("\n=========================================");
        System.out.println("🚀 Search Indexer Service INICIADO");
        System.out.println("=========================================");
        System.out.println("🔗 API Docs: http://localhost:8080/swagger-ui.html");
        System.out.println("🏥 Health: http://localhost:8080/api/v1/health");
        System.out.println("=========================================\n");
    }
}
