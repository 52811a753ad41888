package common.indexer.dto;

/**
 * Estados de un proceso de indexación.
 * RUNNING es el único estado no terminal: una vez terminal, el proceso no vuelve a RUNNING.
 */
public enum JobStatusEnum {
    RUNNING,
    COMPLETED,
    FAILED,
    STOPPED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public boolean canTransitionTo(JobStatusEnum target) {
        return this == RUNNING && target != null && target.isTerminal();
    }
}
