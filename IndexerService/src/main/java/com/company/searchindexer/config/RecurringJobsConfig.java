package com.company.searchindexer.config;

import com.company.searchindexer.service.JobReaper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jobrunr.scheduling.JobScheduler;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/**
 * Registra en JobRunr los jobs recurrentes de mantenimiento al arrancar la aplicación.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class RecurringJobsConfig {

    static final String REAPER_JOB_ID = "indexer-job-reaper";

    private final JobScheduler jobScheduler;
    private final JobReaper jobReaper;
    private final IndexerProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void scheduleReaper() {
        if (!properties.getReaper().isEnabled()) {
            jobScheduler.deleteRecurringJob(REAPER_JOB_ID);
            log.info("Limpieza automática de procesos desactivada");
            return;
        }
        jobScheduler.scheduleRecurrently(REAPER_JOB_ID, properties.getReaper().getCron(), () -> jobReaper.purgeExpired());
        log.info("✅ Limpieza de procesos programada con cron: {}", properties.getReaper().getCron());
    }
}
