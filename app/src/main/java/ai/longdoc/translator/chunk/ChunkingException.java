package ai.longdoc.translator.chunk;

/**
 * Raised when the chunker is configured with an unusable size limit.
 */
public class ChunkingException extends RuntimeException {

    public ChunkingException(String message) {
        super(message);
    }
}
