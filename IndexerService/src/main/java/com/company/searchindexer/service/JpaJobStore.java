package com.company.searchindexer.service;

import com.company.searchindexer.model.IndexerJob;
import com.company.searchindexer.model.JobProgress;
import com.company.searchindexer.repository.IndexerJobRepository;
import com.company.searchindexer.repository.OffsetLimitRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import common.indexer.dto.JobStatusEnum;
import common.indexer.dto.JobType;
import common.indexer.dto.ProgressSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private static final Set<JobStatusEnum> TERMINAL = EnumSet.of(
            JobStatusEnum.COMPLETED, JobStatusEnum.FAILED, JobStatusEnum.STOPPED);

    private final IndexerJobRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public IndexerJob create(JobType type, Map<String, Object> params, Long ownerId) {
        IndexerJob job = IndexerJob.builder()
                .type(type)
                .status(JobStatusEnum.RUNNING)
                .parametersJson(writeParameters(params))
                .ownerId(ownerId)
                .startedAt(LocalDateTime.now(clock))
                .build();
        return repository.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<IndexerJob> find(Long jobId) {
        return repository.findById(jobId);
    }

    @Override
    @Transactional
    public boolean finishIfRunning(Long jobId, JobStatusEnum status, String errorMessage) {
        if (!JobStatusEnum.RUNNING.canTransitionTo(status)) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        return repository.finishIfRunning(jobId, status, LocalDateTime.now(clock), errorMessage) > 0;
    }

    @Override
    @Transactional
    public void updateProgress(Long jobId, ProgressSnapshot progress) {
        JobProgress p = JobProgress.from(progress);
        repository.updateProgress(jobId, p.getCurrent(), p.getTotal(), p.getIndexed(), p.getFailed(), p.getMessage());
    }

    @Override
    @Transactional(readOnly = true)
    public List<IndexerJob> list(JobStatusEnum status, JobType type, Long ownerId, int limit, int offset) {
        return repository.search(status, type, ownerId, OffsetLimitRequest.of(offset, limit));
    }

    @Override
    @Transactional
    public int deleteTerminalBefore(LocalDateTime cutoff) {
        return repository.deleteFinishedBefore(TERMINAL, cutoff);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<Long> findAllIds() {
        return new LinkedHashSet<>(repository.findAllIds());
    }

    @Override
    public Map<String, Object> parametersOf(IndexerJob job) {
        if (job.getParametersJson() == null || job.getParametersJson().isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(job.getParametersJson(), new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Parámetros ilegibles en el proceso {}: {}", job.getId(), e.getMessage());
            return Map.of();
        }
    }

    private String writeParameters(Map<String, Object> params) {
        try {
            return objectMapper.writeValueAsString(params == null ? Map.of() : params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Params are not serializable: " + e.getMessage(), e);
        }
    }
}
