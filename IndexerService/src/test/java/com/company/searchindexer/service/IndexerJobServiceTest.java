package com.company.searchindexer.service;

import com.company.searchindexer.exception.InvalidJobParametersException;
import com.company.searchindexer.exception.JobNotFoundException;
import com.company.searchindexer.job.CancellationToken;
import com.company.searchindexer.job.IndexJobSpec;
import com.company.searchindexer.job.IndexingExecutor;
import common.indexer.dto.IndexerJobView;
import common.indexer.dto.JobLogsResponse;
import common.indexer.dto.JobStatusEnum;
import common.indexer.dto.JobType;
import common.indexer.dto.StartIndexerRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class IndexerJobServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T10:00:00Z"));
    private final InMemoryJobStore store = new InMemoryJobStore(clock);
    private final ExecutorService pool = Executors.newSingleThreadExecutor();
    private final JobRegistry registry = new JobRegistry(store, pool);
    private final JobLogAggregator logs = new JobLogAggregator(100, clock);
    private final IndexingExecutor executor = Mockito.mock(IndexingExecutor.class);
    private final IndexerJobService service = new IndexerJobService(registry, executor, logs, store);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void startRegistersAndRunsRecipe() throws Exception {
        IndexerJobView view = service.start(
                new StartIndexerRequest("index-licitacion", Map.of("publicacion_id", 42)), 8L);
        pool.shutdown();
        pool.awaitTermination(5, TimeUnit.SECONDS);

        assertThat(view.getStatus()).isEqualTo(JobStatusEnum.RUNNING);
        assertThat(view.getType()).isEqualTo(JobType.INDEX_PUBLICATION);
        assertThat(view.getOwnerId()).isEqualTo(8L);
        assertThat(view.getParams()).containsEntry("publicacion_id", 42L);
        verify(executor).execute(eq(view.getId()), eq(new IndexJobSpec.SinglePublication(42L)), any(CancellationToken.class));
    }

    @Test
    void invalidRequestCreatesNothing() {
        assertThatThrownBy(() -> service.start(new StartIndexerRequest("reindex-everything", Map.of()), null))
                .isInstanceOf(InvalidJobParametersException.class);
        assertThatThrownBy(() -> service.start(new StartIndexerRequest("sync-since", Map.of()), null))
                .isInstanceOf(InvalidJobParametersException.class);

        assertThat(store.findAllIds()).isEmpty();
        verify(executor, never()).execute(any(), any(), any());
    }

    @Test
    void unknownJobIsNotFound() {
        assertThatThrownBy(() -> service.get(5L)).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> service.stop(5L)).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> service.logs(5L, null)).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void listFiltersByStatusAndType() {
        Long done = registry.create(new IndexJobSpec.FullReindex(), null).getId();
        registry.complete(done);
        clock.advance(java.time.Duration.ofMinutes(1));
        Long running = registry.create(new IndexJobSpec.SyncSince("2024-05-01 00:00:00"), null).getId();

        assertThat(service.list(null, null, null, 50, 0)).extracting(IndexerJobView::getId).containsExactly(running, done);
        assertThat(service.list("completed", null, null, 50, 0)).extracting(IndexerJobView::getId).containsExactly(done);
        assertThat(service.list(null, "sync-since", null, 50, 0)).extracting(IndexerJobView::getId).containsExactly(running);
        assertThatThrownBy(() -> service.list("paused", null, null, 50, 0)).isInstanceOf(InvalidJobParametersException.class);
    }

    @Test
    void logsCarryLastTimestamp() {
        Long jobId = registry.create(new IndexJobSpec.FullReindex(), null).getId();
        logs.append(jobId, "INFO", "started");

        JobLogsResponse response = service.logs(jobId, null);

        assertThat(response.getLogs()).hasSize(1);
        assertThat(response.getLastTimestamp()).isEqualTo("2024-06-01T10:00:00.000000");
        assertThat(response.isHasMore()).isFalse();
    }
}
