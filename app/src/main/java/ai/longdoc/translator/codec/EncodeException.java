package ai.longdoc.translator.codec;

/**
 * Raised when translated text cannot be re-encoded into the original document format.
 */
public class EncodeException extends RuntimeException {

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
