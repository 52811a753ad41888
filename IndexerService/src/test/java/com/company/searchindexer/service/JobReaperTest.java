package com.company.searchindexer.service;

import com.company.searchindexer.config.IndexerProperties;
import com.company.searchindexer.model.IndexerJob;
import common.indexer.dto.JobStatusEnum;
import common.indexer.dto.JobType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class JobReaperTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 2, 0);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T02:00:00Z"));
    private final InMemoryJobStore store = new InMemoryJobStore(clock);
    private final JobLogAggregator logs = new JobLogAggregator(100, clock);
    private final JobReaper reaper = new JobReaper(store, logs, new IndexerProperties(), clock);

    @Test
    void deletesExpiredJobsAndTheirBuffers() {
        Long expired = save(JobStatusEnum.COMPLETED, NOW.minusDays(40), NOW.minusDays(31));
        Long recent = save(JobStatusEnum.FAILED, NOW.minusDays(3), NOW.minusDays(2));
        Long running = save(JobStatusEnum.RUNNING, NOW.minusDays(60), null);
        logs.append(expired, "INFO", "old");
        logs.append(recent, "INFO", "new");
        logs.append(running, "INFO", "still going");

        ReaperReport report = reaper.sweep();

        assertThat(report.getDeletedJobs()).isEqualTo(1);
        assertThat(report.getRemovedLogBuffers()).isEqualTo(1);
        assertThat(report.getCutoff()).isEqualTo(NOW.minusDays(30));
        assertThat(store.find(expired)).isEmpty();
        assertThat(store.findAllIds()).containsExactly(recent, running);
        assertThat(logs.bufferedJobIds()).containsExactly(recent, running);
    }

    @Test
    void terminalJobWithoutCompletionUsesStartDate() {
        Long stale = save(JobStatusEnum.STOPPED, NOW.minusDays(45), null);

        reaper.sweep();

        assertThat(store.find(stale)).isEmpty();
    }

    @Test
    void orphanBufferIsReleased() {
        logs.append(777L, "INFO", "left behind");

        assertThat(reaper.sweep().getRemovedLogBuffers()).isEqualTo(1);
        assertThat(logs.bufferedJobIds()).isEmpty();
    }

    @Test
    void bufferOfJobCreatedDuringSweepIsKept() {
        AtomicReference<Long> created = new AtomicReference<>();
        InMemoryJobStore racingStore = new InMemoryJobStore(clock) {
            @Override
            public synchronized Set<Long> findAllIds() {
                Set<Long> ids = super.findAllIds();
                // un proceso nuevo arranca y escribe su primer log justo después de la lectura
                Long jobId = create(JobType.INDEX_BULK, Map.of(), null).getId();
                logs.append(jobId, "INFO", "starting");
                created.set(jobId);
                return ids;
            }
        };
        JobReaper racingReaper = new JobReaper(racingStore, logs, new IndexerProperties(), clock);

        ReaperReport report = racingReaper.sweep();

        assertThat(report.getRemovedLogBuffers()).isZero();
        assertThat(logs.bufferedJobIds()).containsExactly(created.get());
    }

    private Long save(JobStatusEnum status, LocalDateTime startedAt, LocalDateTime completedAt) {
        return store.save(IndexerJob.builder()
                .type(JobType.INDEX_BULK)
                .status(status)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build()).getId();
    }
}
