package ai.longdoc.translator.pipeline;

import java.util.Objects;

/**
 * Raised when a run stops on a fatal error. Carries the stage reached and the session counters.
 */
public class PipelineFailureException extends RuntimeException {

    private final ErrorKind kind;
    private final PipelineStage stage;
    private final SessionSnapshot snapshot;

    public PipelineFailureException(ErrorKind kind, PipelineStage stage, SessionSnapshot snapshot, Throwable cause) {
        super("Session %s failed during %s (%s) after %d of %d chunks translated: %s".formatted(
                snapshot.sessionId(), stage, kind, snapshot.translationsCompleted(), snapshot.promptsBuilt(),
                cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.stage = Objects.requireNonNull(stage, "stage");
        this.snapshot = snapshot;
    }

    public ErrorKind kind() {
        return kind;
    }

    public PipelineStage stage() {
        return stage;
    }

    public SessionSnapshot snapshot() {
        return snapshot;
    }
}
