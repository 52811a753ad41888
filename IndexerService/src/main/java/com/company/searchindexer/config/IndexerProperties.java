package com.company.searchindexer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuración del indexador ({@code app.indexer.*}).
 */
@Data
@ConfigurationProperties(prefix = "app.indexer")
public class IndexerProperties {

    private String indexName = "growin_licitaciones";

    // Procesos que se ejecutan en paralelo; dentro de un proceso todo es secuencial
    private int workerPoolSize = 10;

    private int workerQueueCapacity = 100;

    private int logBufferCapacity = 1000;

    private int retentionDays = 30;

    private Batch batch = new Batch();

    private Reaper reaper = new Reaper();

    @Data
    public static class Batch {
        private int scraperLimit = 1000;
        private int syncSinceLimit = 5000;
        private int bulkPageSize = 1000;
        private int scraperProgressEvery = 10;
        private int syncSinceProgressEvery = 50;
    }

    @Data
    public static class Reaper {
        private boolean enabled = true;
        private String cron = "0 2 * * *";
    }
}
