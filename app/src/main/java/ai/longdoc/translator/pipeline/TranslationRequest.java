package ai.longdoc.translator.pipeline;

import java.util.Objects;

/**
 * The composed prompt for one chunk.
 */
public record TranslationRequest(int index, int total, String prompt) {

    public TranslationRequest {
        if (index < 1 || index > total) {
            throw new IllegalArgumentException("index must be between 1 and " + total);
        }
        Objects.requireNonNull(prompt, "prompt");
    }
}
