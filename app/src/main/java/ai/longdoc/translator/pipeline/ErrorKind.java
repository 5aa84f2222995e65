package ai.longdoc.translator.pipeline;

/**
 * Classification of pipeline errors. Only {@link #VALIDATION} and {@link #REASSEMBLY_ENCODE} are recoverable.
 */
public enum ErrorKind {
    CONFIGURATION,
    DECODE,
    CHUNKING,
    GENERATION,
    VALIDATION,
    REASSEMBLY_ENCODE,
    STORAGE,
    INTERNAL;

    public boolean isFatal() {
        return this != VALIDATION && this != REASSEMBLY_ENCODE;
    }
}
