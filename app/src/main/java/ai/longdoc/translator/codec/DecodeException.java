package ai.longdoc.translator.codec;

/**
 * Raised when a source document cannot be decoded into normalized text.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
