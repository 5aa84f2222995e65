package ai.longdoc.translator.codec;

import java.util.Objects;
import java.util.Optional;

/**
 * Normalized text of a decoded document plus the format specific metadata needed to encode it again.
 */
public record DocumentContent(String text, DocumentFormat format, String sourceName, Optional<DocumentMetadata> metadata) {

    public DocumentContent {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(format, "format");
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("sourceName must not be blank");
        }
        metadata = metadata == null ? Optional.empty() : metadata;
    }

    public <T extends DocumentMetadata> Optional<T> metadataAs(Class<T> type) {
        return metadata.filter(type::isInstance).map(type::cast);
    }

    /**
     * File name of the source without any directory part.
     */
    public String baseName() {
        String normalized = sourceName.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }

    public String stem() {
        String baseName = baseName();
        int dot = baseName.lastIndexOf('.');
        return dot <= 0 ? baseName : baseName.substring(0, dot);
    }
}
