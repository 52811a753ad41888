package com.company.searchindexer.service;

import com.company.searchindexer.model.IndexerJob;
import common.indexer.dto.JobStatusEnum;
import common.indexer.dto.JobType;
import common.indexer.dto.ProgressSnapshot;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Almacén persistente de procesos de indexación.
 */
public interface JobStore {

    IndexerJob create(JobType type, Map<String, Object> params, Long ownerId);

    Optional<IndexerJob> find(Long jobId);

    /**
     * Pasa el proceso a un estado terminal solo si sigue en RUNNING.
     *
     * @return true si esta llamada hizo la transición
     */
    boolean finishIfRunning(Long jobId, JobStatusEnum status, String errorMessage);

    void updateProgress(Long jobId, ProgressSnapshot progress);

    List<IndexerJob> list(JobStatusEnum status, JobType type, Long ownerId, int limit, int offset);

    /**
     * Borra los procesos terminales finalizados antes de {@code cutoff}.
     * Los que no tienen fecha de fin se comparan por su fecha de inicio.
     */
    int deleteTerminalBefore(LocalDateTime cutoff);

    Set<Long> findAllIds();

    Map<String, Object> parametersOf(IndexerJob job);
}
