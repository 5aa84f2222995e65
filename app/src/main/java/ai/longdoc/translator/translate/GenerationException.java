package ai.longdoc.translator.translate;

/**
 * Runtime exception used to propagate failures of the text generation service.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
