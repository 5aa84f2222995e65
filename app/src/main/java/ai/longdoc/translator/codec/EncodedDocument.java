package ai.longdoc.translator.codec;

import java.util.Objects;

/**
 * Bytes produced by a structural re-encode together with the artifact name they are stored under.
 */
public record EncodedDocument(String name, byte[] bytes) {

    public EncodedDocument {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(bytes, "bytes");
    }
}
