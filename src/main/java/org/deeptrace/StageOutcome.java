package org.deeptrace;

/**
 * Registro de proveniência de um estágio executado (ou pulado) pelo pipeline.
 */
public record StageOutcome(AnalysisStage stage, Status status, String detail, long durationMs) {

    public enum Status {
        COMPLETED,
        UNAVAILABLE,
        SKIPPED,
        FAILED,
        TIMED_OUT
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
