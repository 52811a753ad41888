package com.company.searchindexer.service;

import com.company.searchindexer.config.IndexerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jobrunr.jobs.annotations.Job;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * Limpieza periódica: borra procesos terminados fuera del periodo de retención y
 * libera los buffers de log que ya no tienen proceso.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobReaper {

    private final JobStore jobStore;
    private final JobLogAggregator logAggregator;
    private final IndexerProperties properties;
    private final Clock clock;

    @Job(name = "Limpieza de procesos de indexación antiguos")
    public void purgeExpired() {
        sweep();
    }

    public ReaperReport sweep() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(properties.getRetentionDays());
        log.info("🧹 Limpiando procesos terminados antes de {}", cutoff);

        int deleted = jobStore.deleteTerminalBefore(cutoff);

        // Los buffers se leen antes que los ids: un proceso creado entre ambas lecturas conserva su buffer
        Set<Long> buffered = logAggregator.bufferedJobIds();
        Set<Long> existing = jobStore.findAllIds();
        int removed = 0;
        for (Long jobId : buffered) {
            if (!existing.contains(jobId) && logAggregator.remove(jobId)) {
                removed++;
            }
        }

        log.info("✅ Limpieza terminada: {} procesos borrados, {} buffers de log liberados", deleted, removed);
        return new ReaperReport(cutoff, deleted, removed);
    }
}
