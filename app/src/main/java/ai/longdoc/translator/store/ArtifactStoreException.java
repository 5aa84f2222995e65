package ai.longdoc.translator.store;

/**
 * Raised when an artifact cannot be written, read or listed.
 */
public class ArtifactStoreException extends RuntimeException {

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
