package ai.longdoc.translator.pipeline;

import java.util.Objects;

/**
 * The most recent error recorded for a session.
 */
public record SessionError(ErrorKind kind, String message) {

    public SessionError {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }
}
