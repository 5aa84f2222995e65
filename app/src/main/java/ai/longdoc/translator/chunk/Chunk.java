package ai.longdoc.translator.chunk;

import java.util.Objects;

/**
 * A contiguous span of the source text together with its 1-based position and storage key.
 */
public record Chunk(int index, String text, String key) {

    public Chunk {
        if (index < 1) {
            throw new IllegalArgumentException("index must be at least 1");
        }
        Objects.requireNonNull(text, "text");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }

    public int length() {
        return text.length();
    }
}
