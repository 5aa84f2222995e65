package ai.longdoc.translator.pipeline;

import java.util.List;
import java.util.Optional;

/**
 * Immutable view of a {@link SessionState} at one point in time.
 */
public record SessionSnapshot(
        String sessionId,
        PipelineStage stage,
        Optional<PipelineStage> failedAt,
        int chunksCreated,
        int promptsBuilt,
        int translationsCompleted,
        int validationsCompleted,
        int validationsFailed,
        int finalChunksWritten,
        int chunksReused,
        Optional<SessionError> lastError,
        List<String> warnings,
        List<Integer> fallbackChunks,
        Optional<Boolean> reencodeSucceeded
) {

    public SessionSnapshot {
        failedAt = failedAt == null ? Optional.empty() : failedAt;
        lastError = lastError == null ? Optional.empty() : lastError;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        fallbackChunks = fallbackChunks == null ? List.of() : List.copyOf(fallbackChunks);
        reencodeSucceeded = reencodeSucceeded == null ? Optional.empty() : reencodeSucceeded;
    }

    /**
     * The run finished but some chunk fell back to its raw translation or structural re-encoding failed.
     */
    public boolean isDegraded() {
        return !fallbackChunks.isEmpty() || reencodeSucceeded.filter(succeeded -> !succeeded).isPresent();
    }
}
