package ai.longdoc.translator.pipeline;

import ai.longdoc.translator.codec.DocumentFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable parameters of one pipeline run for a single document and target language.
 *
 * <p>{@code maxNumberOfChunks} of zero means unlimited. Caller supplied entity and style text,
 * when present, replaces extraction for that part of the metadata.
 */
public record Session(
        String id,
        String source,
        String targetLanguage,
        int maxChunkSize,
        int maxNumberOfChunks,
        int metadataPreviewSize,
        String modelName,
        double temperature,
        boolean validationEnabled,
        int concurrency,
        Optional<DocumentFormat> declaredFormat,
        Optional<String> suppliedEntities,
        Optional<String> suppliedStyle,
        boolean resume
) {

    public static final int DEFAULT_MAX_CHUNK_SIZE = 30000;
    public static final int DEFAULT_METADATA_PREVIEW_SIZE = 30000;
    public static final double DEFAULT_TEMPERATURE = 1.0;
    public static final int DEFAULT_CONCURRENCY = 4;

    public Session {
        if (id == null || id.isBlank() || id.contains("/")) {
            throw new IllegalArgumentException("id must be a non-blank single path segment");
        }
        source = source == null ? "" : source.strip();
        targetLanguage = targetLanguage == null ? "" : targetLanguage.strip();
        modelName = modelName == null ? "" : modelName.strip();
        if (maxNumberOfChunks < 0) {
            throw new IllegalArgumentException("maxNumberOfChunks must be zero or greater");
        }
        if (metadataPreviewSize <= 0) {
            throw new IllegalArgumentException("metadataPreviewSize must be greater than zero");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        declaredFormat = declaredFormat == null ? Optional.empty() : declaredFormat;
        suppliedEntities = suppliedEntities == null ? Optional.empty() : suppliedEntities;
        suppliedStyle = suppliedStyle == null ? Optional.empty() : suppliedStyle;
    }

    /**
     * A fresh session id: the prefix followed by a random UUID without dashes.
     */
    public static String newId(String prefix) {
        String safePrefix = prefix == null ? "" : prefix.strip().replace('/', '_');
        return safePrefix + UUID.randomUUID().toString().replace("-", "");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String source;
        private String targetLanguage;
        private int maxChunkSize = DEFAULT_MAX_CHUNK_SIZE;
        private int maxNumberOfChunks;
        private int metadataPreviewSize = DEFAULT_METADATA_PREVIEW_SIZE;
        private String modelName;
        private double temperature = DEFAULT_TEMPERATURE;
        private boolean validationEnabled = true;
        private int concurrency = DEFAULT_CONCURRENCY;
        private DocumentFormat declaredFormat;
        private String suppliedEntities;
        private String suppliedStyle;
        private boolean resume;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder targetLanguage(String targetLanguage) {
            this.targetLanguage = targetLanguage;
            return this;
        }

        public Builder maxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
            return this;
        }

        public Builder maxNumberOfChunks(int maxNumberOfChunks) {
            this.maxNumberOfChunks = maxNumberOfChunks;
            return this;
        }

        public Builder metadataPreviewSize(int metadataPreviewSize) {
            this.metadataPreviewSize = metadataPreviewSize;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder validationEnabled(boolean validationEnabled) {
            this.validationEnabled = validationEnabled;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder declaredFormat(DocumentFormat declaredFormat) {
            this.declaredFormat = declaredFormat;
            return this;
        }

        public Builder suppliedEntities(String suppliedEntities) {
            this.suppliedEntities = suppliedEntities;
            return this;
        }

        public Builder suppliedStyle(String suppliedStyle) {
            this.suppliedStyle = suppliedStyle;
            return this;
        }

        public Builder resume(boolean resume) {
            this.resume = resume;
            return this;
        }

        public Session build() {
            return new Session(Objects.requireNonNullElseGet(id, () -> newId("")), source, targetLanguage,
                    maxChunkSize, maxNumberOfChunks, metadataPreviewSize, modelName, temperature, validationEnabled,
                    concurrency, Optional.ofNullable(declaredFormat), Optional.ofNullable(suppliedEntities),
                    Optional.ofNullable(suppliedStyle), resume);
        }
    }
}
