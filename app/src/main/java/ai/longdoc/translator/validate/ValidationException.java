package ai.longdoc.translator.validate;

/**
 * Raised when a translated chunk could not be validated.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
