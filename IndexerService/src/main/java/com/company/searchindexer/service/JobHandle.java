package com.company.searchindexer.service;

import com.company.searchindexer.job.CancellationToken;
import lombok.Getter;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ejecución viva de un proceso. La fase decide, de forma atómica, quién gana entre
 * el arranque del worker y una parada que llega con el proceso aún en cola.
 */
class JobHandle {

    enum Phase { PENDING, STARTED, CANCELLED }

    @Getter
    private final Long jobId;

    @Getter
    private final CancellationToken token = new CancellationToken();

    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.PENDING);

    private volatile Future<?> future;

    JobHandle(Long jobId) {
        this.jobId = jobId;
    }

    boolean tryStart() {
        return phase.compareAndSet(Phase.PENDING, Phase.STARTED);
    }

    boolean cancelBeforeStart() {
        if (!phase.compareAndSet(Phase.PENDING, Phase.CANCELLED)) {
            return false;
        }
        Future<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
        return true;
    }

    void attach(Future<?> future) {
        this.future = future;
        if (phase.get() == Phase.CANCELLED) {
            future.cancel(false);
        }
    }
}
