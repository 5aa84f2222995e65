package ai.longdoc.translator.pipeline;

/**
 * Stages of a pipeline run in the order they are entered. {@link #FAILED} is reachable from any stage.
 */
public enum PipelineStage {
    INITIALIZING,
    METADATA_READY,
    CHUNKED,
    PROMPTS_BUILT,
    TRANSLATING,
    VALIDATING,
    REASSEMBLING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canAdvanceTo(PipelineStage next) {
        if (isTerminal()) {
            return false;
        }
        return next == FAILED || next.ordinal() > ordinal();
    }
}
