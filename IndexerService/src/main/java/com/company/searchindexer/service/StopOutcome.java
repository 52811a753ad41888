package com.company.searchindexer.service;

/**
 * Resultado de una petición de parada.
 */
public enum StopOutcome {
    /** El proceso seguía en cola: no llega a ejecutarse y queda STOPPED. */
    CANCELLED_BEFORE_START,
    /** El proceso está en marcha; parará en el siguiente punto de control. */
    STOP_REQUESTED,
    /** Constaba como RUNNING sin ejecución viva en este nodo; se marca STOPPED directamente. */
    FORCE_STOPPED,
    NOT_RUNNING,
    NOT_FOUND
}
