package com.company.searchindexer.service;

import com.company.searchindexer.exception.InvalidJobParametersException;
import com.company.searchindexer.exception.JobNotFoundException;
import com.company.searchindexer.job.IndexJobSpec;
import com.company.searchindexer.job.IndexingExecutor;
import com.company.searchindexer.model.IndexerJob;
import common.indexer.dto.IndexerJobView;
import common.indexer.dto.JobLogsResponse;
import common.indexer.dto.JobStatusEnum;
import common.indexer.dto.JobType;
import common.indexer.dto.LogRecord;
import common.indexer.dto.StartIndexerRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fachada de los procesos de indexación para la capa REST.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexerJobService {

    private static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS");
    static final int MAX_PAGE_SIZE = 200;

    private final JobRegistry jobRegistry;
    private final IndexingExecutor indexingExecutor;
    private final JobLogAggregator logAggregator;
    private final JobStore jobStore;

    /**
     * Valida los parámetros, registra el proceso y lo envía al pool. Vuelve en cuanto el proceso está en cola.
     */
    public IndexerJobView start(StartIndexerRequest request, Long ownerId) {
        if (request == null || request.getType() == null || request.getType().isBlank()) {
            throw new InvalidJobParametersException("Missing indexer type. Must be one of: " + JobType.validTags());
        }
        JobType type = parseType(request.getType());
        IndexJobSpec spec = IndexJobSpec.from(type, request.getParams());

        IndexerJob job = jobRegistry.create(spec, ownerId);
        Long jobId = job.getId();
        jobRegistry.submit(jobId, token -> indexingExecutor.execute(jobId, spec, token));
        log.info("🚀 Proceso {} ({}) enviado al pool", jobId, type.getTag());
        return toView(job);
    }

    public StopOutcome stop(Long jobId) {
        StopOutcome outcome = jobRegistry.stop(jobId);
        if (outcome == StopOutcome.NOT_FOUND) {
            throw new JobNotFoundException(jobId);
        }
        return outcome;
    }

    public IndexerJobView get(Long jobId) {
        return jobRegistry.find(jobId)
                .map(this::toView)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<IndexerJobView> list(String status, String type, Long ownerId, int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidJobParametersException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new InvalidJobParametersException("offset must not be negative");
        }
        JobStatusEnum statusFilter = parseStatus(status);
        JobType typeFilter = type == null || type.isBlank() ? null : parseType(type);
        return jobRegistry.list(statusFilter, typeFilter, ownerId, limit, offset).stream()
                .map(this::toView)
                .collect(Collectors.toList());
    }

    public JobLogsResponse logs(Long jobId, String since) {
        if (jobRegistry.find(jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        List<LogRecord> records = logAggregator.query(jobId, since);
        String lastTimestamp = records.isEmpty()
                ? since
                : records.get(records.size() - 1).getTimestamp().format(LOG_TIMESTAMP);
        return new JobLogsResponse(records, lastTimestamp, false);
    }

    IndexerJobView toView(IndexerJob job) {
        return IndexerJobView.builder()
                .id(job.getId())
                .type(job.getType())
                .status(job.getStatus())
                .params(jobStore.parametersOf(job))
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .progress(job.getProgress() == null ? null : job.getProgress().toSnapshot())
                .errorMessage(job.getErrorMessage())
                .ownerId(job.getOwnerId())
                .build();
    }

    private static JobType parseType(String type) {
        try {
            return JobType.fromTag(type);
        } catch (IllegalArgumentException e) {
            throw new InvalidJobParametersException(e.getMessage(), e);
        }
    }

    private static JobStatusEnum parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return JobStatusEnum.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidJobParametersException("Invalid status '" + status + "'", e);
        }
    }
}
