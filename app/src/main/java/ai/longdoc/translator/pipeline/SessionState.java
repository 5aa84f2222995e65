package ai.longdoc.translator.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress record of one pipeline run, safe to read from other threads while the run is active.
 *
 * <p>Counters are only incremented after the corresponding artifact has been written.
 */
public class SessionState {

    private final String sessionId;
    private final AtomicInteger chunksCreated = new AtomicInteger();
    private final AtomicInteger promptsBuilt = new AtomicInteger();
    private final AtomicInteger translationsCompleted = new AtomicInteger();
    private final AtomicInteger validationsCompleted = new AtomicInteger();
    private final AtomicInteger validationsFailed = new AtomicInteger();
    private final AtomicInteger finalChunksWritten = new AtomicInteger();
    private final AtomicInteger chunksReused = new AtomicInteger();
    private final Queue<String> warnings = new ConcurrentLinkedQueue<>();
    private final Set<Integer> fallbackChunks = new ConcurrentSkipListSet<>();

    private PipelineStage stage = PipelineStage.INITIALIZING;
    private PipelineStage failedAt;
    private SessionError lastError;
    private Boolean reencodeSucceeded;

    public SessionState(String sessionId) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    }

    public String sessionId() {
        return sessionId;
    }

    public synchronized PipelineStage stage() {
        return stage;
    }

    public synchronized void advanceTo(PipelineStage next) {
        Objects.requireNonNull(next, "next");
        if (!stage.canAdvanceTo(next)) {
            throw new IllegalStateException("Cannot move session " + sessionId + " from " + stage + " to " + next);
        }
        if (next == PipelineStage.FAILED) {
            failedAt = stage;
        }
        stage = next;
    }

    /**
     * Moves the session to {@link PipelineStage#FAILED} and returns the stage it failed in.
     */
    public synchronized PipelineStage markFailed(ErrorKind kind, String message) {
        lastError = new SessionError(kind, message);
        if (stage != PipelineStage.FAILED) {
            failedAt = stage;
            stage = PipelineStage.FAILED;
        }
        return failedAt;
    }

    public synchronized void recordError(ErrorKind kind, String message) {
        lastError = new SessionError(kind, message);
    }

    public synchronized void recordReencode(boolean succeeded) {
        reencodeSucceeded = succeeded;
    }

    public void recordWarning(String warning) {
        warnings.add(warning);
    }

    public void chunkCreated() {
        chunksCreated.incrementAndGet();
    }

    public void promptBuilt() {
        promptsBuilt.incrementAndGet();
    }

    public void translationCompleted() {
        translationsCompleted.incrementAndGet();
    }

    public void chunkReused() {
        chunksReused.incrementAndGet();
    }

    public void validationCompleted() {
        validationsCompleted.incrementAndGet();
    }

    public void validationFailed(int chunkIndex, String message) {
        validationsFailed.incrementAndGet();
        fallbackChunks.add(chunkIndex);
        recordError(ErrorKind.VALIDATION, "chunk " + chunkIndex + ": " + message);
    }

    public void finalChunkWritten() {
        finalChunksWritten.incrementAndGet();
    }

    public int translationsCompleted() {
        return translationsCompleted.get();
    }

    public synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(
                sessionId,
                stage,
                Optional.ofNullable(failedAt),
                chunksCreated.get(),
                promptsBuilt.get(),
                translationsCompleted.get(),
                validationsCompleted.get(),
                validationsFailed.get(),
                finalChunksWritten.get(),
                chunksReused.get(),
                Optional.ofNullable(lastError),
                List.copyOf(warnings),
                new ArrayList<>(fallbackChunks),
                Optional.ofNullable(reencodeSucceeded));
    }
}
