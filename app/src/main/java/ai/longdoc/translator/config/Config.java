package ai.longdoc.translator.config;

import ai.longdoc.translator.codec.DocumentFormat;
import ai.longdoc.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        String sourceFile,
        String targetLanguage,
        Optional<DocumentFormat> documentFormat,
        Path artifactRoot,
        String sessionId,
        int maxChunkSize,
        int maxNumberOfChunks,
        int metadataPreviewSize,
        double temperature,
        boolean validationEnabled,
        int concurrency,
        boolean resume,
        TranslationMode translationMode,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        Optional<Path> entitiesFile,
        Optional<Path> styleFile,
        int llmMaxRetryAttempts,
        int llmInitialBackoffSeconds,
        int llmMaxBackoffSeconds,
        double llmRetryJitterFactor
) {

    public Config {
        sourceFile = requireNonBlank(sourceFile, "source file");
        targetLanguage = requireNonBlank(targetLanguage, "target language");
        documentFormat = documentFormat == null ? Optional.empty() : documentFormat;
        Objects.requireNonNull(artifactRoot, "artifactRoot");
        sessionId = requireNonBlank(sessionId, "session id");
        if (sessionId.contains("/") || sessionId.contains("\\") || sessionId.equals(".") || sessionId.equals("..")) {
            throw new ConfigurationException("session id must be a single path segment: " + sessionId);
        }
        if (maxNumberOfChunks < 0) {
            throw new ConfigurationException("max number of chunks must be zero or greater");
        }
        if (metadataPreviewSize <= 0) {
            throw new ConfigurationException("metadata preview size must be greater than zero");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new ConfigurationException("temperature must be between 0.0 and 2.0 but was " + temperature);
        }
        if (concurrency < 1) {
            throw new ConfigurationException("concurrency must be at least 1");
        }
        Objects.requireNonNull(translationMode, "translationMode");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = secrets == null ? new Secrets(Optional.empty()) : secrets;
        entitiesFile = entitiesFile == null ? Optional.empty() : entitiesFile;
        styleFile = styleFile == null ? Optional.empty() : styleFile;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(fieldName + " must be provided");
        }
        return value.strip();
    }
}
