package com.company.searchindexer.service;

import com.company.searchindexer.job.IndexJobSpec;
import com.company.searchindexer.model.IndexerJob;
import common.indexer.dto.JobStatusEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobRegistryTest {

    private final InMemoryJobStore store = new InMemoryJobStore(new MutableClock(Instant.parse("2024-06-01T10:00:00Z")));
    private ExecutorService executor = Executors.newSingleThreadExecutor();
    private JobRegistry registry = new JobRegistry(store, executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void stopBeforeStartNeverRunsUnit() throws Exception {
        CountDownLatch blocker = new CountDownLatch(1);
        executor.submit(() -> {
            blocker.await();
            return null;
        });
        IndexerJob job = registry.create(new IndexJobSpec.FullReindex(), null);
        AtomicBoolean ran = new AtomicBoolean(false);
        registry.submit(job.getId(), token -> ran.set(true));

        StopOutcome outcome = registry.stop(job.getId());
        blocker.countDown();
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(StopOutcome.CANCELLED_BEFORE_START);
        assertThat(ran).isFalse();
        IndexerJob stopped = store.find(job.getId()).orElseThrow();
        assertThat(stopped.getStatus()).isEqualTo(JobStatusEnum.STOPPED);
        assertThat(stopped.getProgress().getIndexed()).isZero();
        assertThat(registry.isActive(job.getId())).isFalse();
    }

    @Test
    void stopWhileRunningIsCooperative() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        AtomicInteger processed = new AtomicInteger();
        IndexerJob job = registry.create(new IndexJobSpec.SyncSince("2024-01-01 00:00:00"), 5L);

        registry.submit(job.getId(), token -> {
            started.countDown();
            while (!token.isCancellationRequested()) {
                processed.incrementAndGet();
                Thread.onSpinWait();
            }
            registry.markStopped(job.getId());
            done.countDown();
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        StopOutcome outcome = registry.stop(job.getId());

        assertThat(outcome).isEqualTo(StopOutcome.STOP_REQUESTED);
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(store.find(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatusEnum.STOPPED);
    }

    @Test
    void terminalStatusNeverChanges() {
        IndexerJob job = registry.create(new IndexJobSpec.SinglePublication(42L), null);

        assertThat(registry.complete(job.getId())).isTrue();
        assertThat(registry.fail(job.getId(), "late failure")).isFalse();
        assertThat(registry.markStopped(job.getId())).isFalse();
        assertThat(registry.stop(job.getId())).isEqualTo(StopOutcome.NOT_RUNNING);

        IndexerJob stored = store.find(job.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(JobStatusEnum.COMPLETED);
        assertThat(stored.getErrorMessage()).isNull();
        assertThat(store.transitions()).containsExactly(job.getId() + ":RUNNING->COMPLETED");
    }

    @Test
    void orphanRunningRecordIsForceStopped() {
        IndexerJob job = registry.create(new IndexJobSpec.FullReindex(), null);

        assertThat(registry.stop(job.getId())).isEqualTo(StopOutcome.FORCE_STOPPED);
        assertThat(store.find(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatusEnum.STOPPED);
    }

    @Test
    void unknownJob() {
        assertThat(registry.stop(999L)).isEqualTo(StopOutcome.NOT_FOUND);
    }

    @Test
    void uncaughtErrorFailsJob() throws Exception {
        IndexerJob job = registry.create(new IndexJobSpec.FullReindex(), null);

        registry.submit(job.getId(), token -> {
            throw new IllegalStateException("kaboom");
        });
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);

        IndexerJob failed = store.find(job.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(JobStatusEnum.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("kaboom");
        assertThat(registry.isActive(job.getId())).isFalse();
    }

    @Test
    void fatalErrorFailsJob() throws Exception {
        IndexerJob job = registry.create(new IndexJobSpec.FullReindex(), null);

        registry.submit(job.getId(), token -> {
            throw new StackOverflowError("recursion");
        });
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);

        IndexerJob failed = store.find(job.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(JobStatusEnum.FAILED);
        assertThat(failed.getErrorMessage()).contains("StackOverflowError").contains("recursion");
        assertThat(registry.isActive(job.getId())).isFalse();
    }

    @Test
    void unitReturningWithoutFinalStatusFailsJob() throws Exception {
        IndexerJob job = registry.create(new IndexJobSpec.SinglePublication(7L), null);

        registry.submit(job.getId(), token -> { });
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);

        IndexerJob failed = store.find(job.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(JobStatusEnum.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("Process ended without a final status");
    }

    @Test
    void saturatedPoolFailsJob() throws Exception {
        executor.shutdownNow();
        CountDownLatch blocker = new CountDownLatch(1);
        executor = new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(1),
                new ThreadPoolExecutor.AbortPolicy());
        registry = new JobRegistry(store, executor);
        IndexerJob first = registry.create(new IndexJobSpec.FullReindex(), null);
        IndexerJob second = registry.create(new IndexJobSpec.FullReindex(), null);
        IndexerJob third = registry.create(new IndexJobSpec.FullReindex(), null);

        registry.submit(first.getId(), token -> {
            try {
                blocker.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        registry.submit(second.getId(), token -> { });

        assertThatThrownBy(() -> registry.submit(third.getId(), token -> { }))
                .isInstanceOf(RejectedExecutionException.class);
        blocker.countDown();

        assertThat(store.find(third.getId()).orElseThrow().getStatus()).isEqualTo(JobStatusEnum.FAILED);
        assertThat(registry.isActive(third.getId())).isFalse();
    }
}
