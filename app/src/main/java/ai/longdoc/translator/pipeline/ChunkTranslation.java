package ai.longdoc.translator.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Raw generated text of a chunk and, once reviewed, its validated text.
 */
public record ChunkTranslation(int index, String rawText, Optional<String> validatedText) {

    public ChunkTranslation {
        Objects.requireNonNull(rawText, "rawText");
        validatedText = validatedText == null ? Optional.empty() : validatedText;
    }

    public static ChunkTranslation raw(int index, String rawText) {
        return new ChunkTranslation(index, rawText, Optional.empty());
    }

    public ChunkTranslation withValidatedText(String text) {
        return new ChunkTranslation(index, rawText, Optional.of(text));
    }

    /**
     * The text used for reassembly: validated text when present, the raw translation otherwise.
     */
    public String finalText() {
        return validatedText.orElse(rawText);
    }
}
