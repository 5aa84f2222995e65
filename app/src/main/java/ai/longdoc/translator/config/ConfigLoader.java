package ai.longdoc.translator.config;

import ai.longdoc.translator.cli.CliArguments;
import ai.longdoc.translator.codec.DocumentFormat;
import ai.longdoc.translator.pipeline.Session;
import ai.longdoc.translator.translate.TranslationMode;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values.
 */
public class ConfigLoader {

    static final String ENV_SOURCE_FILE = "SOURCE_FILE";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_DOCUMENT_FORMAT = "DOCUMENT_FORMAT";
    static final String ENV_ARTIFACT_ROOT = "ARTIFACT_ROOT";
    static final String ENV_SESSION_FOLDER_PREFIX = "SESSION_FOLDER_PREFIX";
    static final String ENV_SESSION_ID = "SESSION_ID";
    static final String ENV_MAX_CHUNK_SIZE = "MAX_CHUNK_SIZE";
    static final String ENV_MAX_NUMBER_OF_CHUNKS = "MAX_NUMBER_OF_CHUNKS";
    static final String ENV_METADATA_PREVIEW_SIZE = "METADATA_PREVIEW_SIZE";
    static final String ENV_TEMPERATURE = "TEMPERATURE";
    static final String ENV_AGENT_VALIDATION = "AGENT_VALIDATION";
    static final String ENV_PIPELINE_CONCURRENCY = "PIPELINE_CONCURRENCY";
    static final String ENV_RESUME = "RESUME";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_VALIDATION_MODEL = "VALIDATION_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_ENTITIES_FILE = "ENTITIES_FILE";
    static final String ENV_STYLE_FILE = "STYLE_FILE";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";

    static final String DEFAULT_ARTIFACT_ROOT = "./translations";
    static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 6;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 60;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        String sourceFile = firstNonBlank(arguments.sourceFile(), ENV_SOURCE_FILE, null);
        String targetLanguage = firstNonBlank(arguments.targetLanguage(), ENV_TARGET_LANGUAGE, null);
        Optional<DocumentFormat> documentFormat = resolveDocumentFormat(arguments);
        Path artifactRoot = arguments.artifactRoot() != null
                ? arguments.artifactRoot()
                : toPath(firstNonBlank(null, ENV_ARTIFACT_ROOT, DEFAULT_ARTIFACT_ROOT), ENV_ARTIFACT_ROOT);

        boolean resume = arguments.resume() || readBoolean(ENV_RESUME).orElse(false);
        String sessionId = resolveSessionId(arguments, resume);

        int maxChunkSize = resolveInteger(arguments.maxChunkSize(), ENV_MAX_CHUNK_SIZE, Session.DEFAULT_MAX_CHUNK_SIZE);
        int maxNumberOfChunks = resolveInteger(arguments.maxNumberOfChunks(), ENV_MAX_NUMBER_OF_CHUNKS, 0);
        int metadataPreviewSize = resolveInteger(arguments.metadataPreviewSize(), ENV_METADATA_PREVIEW_SIZE,
                Session.DEFAULT_METADATA_PREVIEW_SIZE);
        int concurrency = resolveInteger(arguments.concurrency(), ENV_PIPELINE_CONCURRENCY, Session.DEFAULT_CONCURRENCY);
        double temperature = arguments.temperature() != null
                ? arguments.temperature()
                : environmentReader.find(ENV_TEMPERATURE)
                .map(raw -> parseDouble(raw, ENV_TEMPERATURE))
                .orElse(Session.DEFAULT_TEMPERATURE);
        boolean validationEnabled = !arguments.noValidation() && readBoolean(ENV_AGENT_VALIDATION).orElse(true);

        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        LlmProvider provider = Optional.ofNullable(arguments.provider())
                .or(() -> environmentReader.find(ENV_LLM_PROVIDER)
                        .map(LlmProvider::from))
                .orElse(LlmProvider.OLLAMA);
        String modelName = firstNonBlank(arguments.modelName(), ENV_LLM_MODEL, provider.defaultModel());
        String validationModelName = firstNonBlank(arguments.validationModelName(), ENV_VALIDATION_MODEL, modelName);
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(firstNonBlank(null, ENV_OLLAMA_BASE_URL, DEFAULT_OLLAMA_BASE_URL));
        }
        Secrets secrets = new Secrets(environmentReader.find(ENV_GEMINI_API_KEY));
        if (provider == LlmProvider.GEMINI && translationMode == TranslationMode.PRODUCTION
                && secrets.geminiApiKey().isEmpty()) {
            throw new ConfigurationException(ENV_GEMINI_API_KEY + " must be provided when " + ENV_LLM_PROVIDER + "=gemini");
        }

        Optional<Path> entitiesFile = resolvePath(arguments.entitiesFile(), ENV_ENTITIES_FILE);
        Optional<Path> styleFile = resolvePath(arguments.styleFile(), ENV_STYLE_FILE);

        int llmMaxRetryAttempts = resolveInteger(null, ENV_LLM_MAX_RETRY_ATTEMPTS, DEFAULT_LLM_MAX_RETRY_ATTEMPTS);
        int llmInitialBackoffSeconds = resolveInteger(null, ENV_LLM_INITIAL_BACKOFF_SECONDS,
                DEFAULT_LLM_INITIAL_BACKOFF_SECONDS);
        int llmMaxBackoffSeconds = resolveInteger(null, ENV_LLM_MAX_BACKOFF_SECONDS, DEFAULT_LLM_MAX_BACKOFF_SECONDS);
        double llmRetryJitterFactor = environmentReader.find(ENV_LLM_RETRY_JITTER_FACTOR)
                .map(raw -> parseDouble(raw, ENV_LLM_RETRY_JITTER_FACTOR))
                .orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR);

        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, validationModelName, baseUrl);
        return new Config(sourceFile, targetLanguage, documentFormat, artifactRoot, sessionId, maxChunkSize,
                maxNumberOfChunks, metadataPreviewSize, temperature, validationEnabled, concurrency, resume,
                translationMode, logFormat, translatorConfig, secrets, entitiesFile, styleFile,
                llmMaxRetryAttempts, llmInitialBackoffSeconds, llmMaxBackoffSeconds, llmRetryJitterFactor);
    }

    private String resolveSessionId(CliArguments arguments, boolean resume) {
        String explicit = firstNonBlank(arguments.sessionId(), ENV_SESSION_ID, null);
        if (explicit != null) {
            return explicit.trim();
        }
        if (resume) {
            throw new ConfigurationException("Resuming requires a session id (--session-id or " + ENV_SESSION_ID + ")");
        }
        return Session.newId(firstNonBlank(arguments.sessionPrefix(), ENV_SESSION_FOLDER_PREFIX, ""));
    }

    private Optional<DocumentFormat> resolveDocumentFormat(CliArguments arguments) {
        if (arguments.documentFormat() != null) {
            return Optional.of(arguments.documentFormat());
        }
        return environmentReader.find(ENV_DOCUMENT_FORMAT)
                .map(raw -> {
                    try {
                        return DocumentFormat.from(raw);
                    } catch (IllegalArgumentException ex) {
                        throw new ConfigurationException(ENV_DOCUMENT_FORMAT + " is not supported: " + raw, ex);
                    }
                });
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.find(ENV_TRANSLATION_MODE)
                .map(raw -> {
                    try {
                        return TranslationMode.from(raw);
                    } catch (IllegalArgumentException ex) {
                        throw new ConfigurationException(ENV_TRANSLATION_MODE + " is not supported: " + raw, ex);
                    }
                })
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.find(ENV_LOG_FORMAT)
                .map(raw -> {
                    try {
                        return LogFormat.from(raw);
                    } catch (IllegalArgumentException ex) {
                        throw new ConfigurationException(ENV_LOG_FORMAT + " is not supported: " + raw, ex);
                    }
                })
                .orElse(LogFormat.TEXT);
    }

    private int resolveInteger(Integer cliValue, String envKey, int defaultValue) {
        if (cliValue != null) {
            if (cliValue < 0) {
                throw new ConfigurationException(envKey + " must be zero or greater");
            }
            return cliValue;
        }
        return environmentReader.find(envKey)
                .map(raw -> parsePositiveInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.find(envKey)
                .map(raw -> toPath(raw, envKey));
    }

    private Optional<Boolean> readBoolean(String envKey) {
        return environmentReader.find(envKey)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .map(value -> value.equals("true") || value.equals("1") || value.equals("yes"));
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.find(envKey).orElse(defaultValue);
    }

    private static Path toPath(String raw, String envKey) {
        try {
            return Path.of(raw);
        } catch (InvalidPathException ex) {
            throw new ConfigurationException(envKey + " is not a valid path: " + raw, ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parsePositiveInteger(String raw, String envKey) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new ConfigurationException(envKey + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new ConfigurationException(envKey + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw, String envKey) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new ConfigurationException(envKey + " must be a number: " + raw, ex);
        }
    }
}
