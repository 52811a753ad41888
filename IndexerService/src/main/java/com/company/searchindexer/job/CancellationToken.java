package com.company.searchindexer.job;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Señal de parada cooperativa. El proceso la consulta entre elemento y elemento y termina por sí mismo.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
