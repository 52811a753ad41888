package com.company.searchindexer.service;

import com.company.searchindexer.job.CancellationToken;
import com.company.searchindexer.job.IndexJobSpec;
import com.company.searchindexer.model.IndexerJob;
import common.indexer.dto.JobStatusEnum;
import common.indexer.dto.JobType;
import common.indexer.dto.ProgressSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Registro de procesos: alta en el almacén, envío al pool de workers, parada cooperativa
 * y transiciones de estado. Un proceso terminal no cambia nunca de estado; la primera
 * transición terminal que llega al almacén es la que queda.
 */
@Slf4j
@Component
public class JobRegistry {

    private final JobStore jobStore;
    private final ExecutorService executor;

    private final Map<Long, JobHandle> handles = new HashMap<>();

    public JobRegistry(JobStore jobStore, @Qualifier("indexerJobExecutor") ExecutorService executor) {
        this.jobStore = jobStore;
        this.executor = executor;
    }

    /**
     * Da de alta el proceso en RUNNING antes de enviarlo al pool.
     */
    public IndexerJob create(IndexJobSpec spec, Long ownerId) {
        IndexerJob job = jobStore.create(spec.getType(), spec.toParameters(), ownerId);
        log.info("🆕 Proceso {} creado: {} {}", job.getId(), spec.getType().getTag(), spec.toParameters());
        return job;
    }

    /**
     * Envía la unidad de trabajo al pool. Si el pool está saturado el proceso queda FAILED
     * y se relanza el rechazo.
     */
    public void submit(Long jobId, Consumer<CancellationToken> unit) {
        JobHandle handle = new JobHandle(jobId);
        synchronized (handles) {
            handles.put(jobId, handle);
        }
        try {
            Future<?> future = executor.submit(() -> run(handle, unit));
            handle.attach(future);
        } catch (RejectedExecutionException e) {
            unregister(handle);
            log.error("❌ Pool de workers saturado, proceso {} rechazado", jobId);
            fail(jobId, "Worker pool saturated: " + e.getMessage());
            throw e;
        }
    }

    private void run(JobHandle handle, Consumer<CancellationToken> unit) {
        Long jobId = handle.getJobId();
        if (!handle.tryStart()) {
            log.debug("Proceso {} cancelado antes de arrancar", jobId);
            return;
        }
        Error fatal = null;
        try {
            unit.accept(handle.getToken());
            if (handle.getToken().isCancellationRequested()) {
                markStopped(jobId);
            }
        } catch (RuntimeException e) {
            log.error("❌ Error no controlado en el proceso {}", jobId, e);
            fail(jobId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } catch (Error e) {
            fatal = e;
            log.error("❌ Error fatal en el proceso {}", jobId, e);
            throw e;
        } finally {
            unregister(handle);
            failIfStillRunning(jobId, fatal);
        }
    }

    /**
     * Ningún proceso queda RUNNING una vez que su unidad de trabajo ha terminado.
     */
    private void failIfStillRunning(Long jobId, Error fatal) {
        boolean running = jobStore.find(jobId)
                .map(job -> job.getStatus() == JobStatusEnum.RUNNING)
                .orElse(false);
        if (running) {
            fail(jobId, fatal != null ? fatal.toString() : "Process ended without a final status");
        }
    }

    public StopOutcome stop(Long jobId) {
        Optional<IndexerJob> job = jobStore.find(jobId);
        if (job.isEmpty()) {
            return StopOutcome.NOT_FOUND;
        }
        if (job.get().getStatus().isTerminal()) {
            return StopOutcome.NOT_RUNNING;
        }

        JobHandle handle;
        synchronized (handles) {
            handle = handles.get(jobId);
        }
        if (handle == null) {
            if (jobStore.finishIfRunning(jobId, JobStatusEnum.STOPPED, null)) {
                log.warn("⚠️ Proceso {} sin ejecución activa, marcado como STOPPED", jobId);
                return StopOutcome.FORCE_STOPPED;
            }
            return StopOutcome.NOT_RUNNING;
        }
        if (handle.cancelBeforeStart()) {
            unregister(handle);
            jobStore.updateProgress(jobId, ProgressSnapshot.of("Stopped before start", 0, 0, 0, 0));
            markStopped(jobId);
            log.info("🛑 Proceso {} cancelado en cola", jobId);
            return StopOutcome.CANCELLED_BEFORE_START;
        }
        handle.getToken().cancel();
        log.info("🛑 Parada solicitada para el proceso {}", jobId);
        return StopOutcome.STOP_REQUESTED;
    }

    public void updateProgress(Long jobId, ProgressSnapshot progress) {
        jobStore.updateProgress(jobId, progress);
    }

    public boolean complete(Long jobId) {
        return finish(jobId, JobStatusEnum.COMPLETED, null);
    }

    public boolean fail(Long jobId, String errorMessage) {
        return finish(jobId, JobStatusEnum.FAILED, errorMessage);
    }

    public boolean markStopped(Long jobId) {
        return finish(jobId, JobStatusEnum.STOPPED, null);
    }

    private boolean finish(Long jobId, JobStatusEnum status, String errorMessage) {
        boolean changed = jobStore.finishIfRunning(jobId, status, errorMessage);
        if (changed) {
            log.info("✅ Proceso {} -> {}", jobId, status);
        } else {
            log.debug("Proceso {} ya estaba terminado, se ignora {}", jobId, status);
        }
        return changed;
    }

    public Optional<IndexerJob> find(Long jobId) {
        return jobStore.find(jobId);
    }

    public List<IndexerJob> list(JobStatusEnum status, JobType type, Long ownerId, int limit, int offset) {
        return jobStore.list(status, type, ownerId, limit, offset);
    }

    public boolean isActive(Long jobId) {
        synchronized (handles) {
            return handles.containsKey(jobId);
        }
    }

    private void unregister(JobHandle handle) {
        synchronized (handles) {
            handles.remove(handle.getJobId(), handle);
        }
    }
}
