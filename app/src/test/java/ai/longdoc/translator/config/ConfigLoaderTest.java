package ai.longdoc.translator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.longdoc.translator.cli.CliArguments;
import ai.longdoc.translator.codec.DocumentFormat;
import ai.longdoc.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "-s", "books/road.epub",
                "-t", "Japanese",
                "--format", "ebook",
                "--store-root", "out",
                "--session-id", "road-ja",
                "--max-chunk-size", "1000",
                "--max-number-of-chunks", "3",
                "--metadata-preview-size", "500",
                "--temperature", "0.5",
                "--no-validation",
                "--concurrency", "2",
                "--provider", "gemini",
                "--model", "gemini-2.5-pro",
                "--validation-model", "gemini-2.5-flash",
                "--translation-mode", "dry-run",
                "--log-format", "json",
                "--style-file", "style.md");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.sourceFile()).isEqualTo("books/road.epub");
        assertThat(config.targetLanguage()).isEqualTo("Japanese");
        assertThat(config.documentFormat()).contains(DocumentFormat.EBOOK);
        assertThat(config.artifactRoot()).isEqualTo(Path.of("out"));
        assertThat(config.sessionId()).isEqualTo("road-ja");
        assertThat(config.maxChunkSize()).isEqualTo(1000);
        assertThat(config.maxNumberOfChunks()).isEqualTo(3);
        assertThat(config.metadataPreviewSize()).isEqualTo(500);
        assertThat(config.temperature()).isEqualTo(0.5);
        assertThat(config.validationEnabled()).isFalse();
        assertThat(config.concurrency()).isEqualTo(2);
        assertThat(config.resume()).isFalse();
        assertThat(config.translationMode()).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(config.translatorConfig().modelName()).isEqualTo("gemini-2.5-pro");
        assertThat(config.translatorConfig().validationModelName()).isEqualTo("gemini-2.5-flash");
        assertThat(config.translatorConfig().usesSeparateValidationModel()).isTrue();
        assertThat(config.translatorConfig().baseUrl()).isEmpty();
        assertThat(config.entitiesFile()).isEmpty();
        assertThat(config.styleFile()).contains(Path.of("style.md"));
    }

    @Test
    void fallsBackToEnvironmentValuesAndDefaults() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_SOURCE_FILE, "docs/guide.txt");
        envValues.put(ConfigLoader.ENV_TARGET_LANGUAGE, "French");
        envValues.put(ConfigLoader.ENV_SESSION_FOLDER_PREFIX, "guide_");
        envValues.put(ConfigLoader.ENV_LLM_MODEL, "custom-gguf");
        envValues.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        envValues.put(ConfigLoader.ENV_AGENT_VALIDATION, "false");
        envValues.put(ConfigLoader.ENV_PIPELINE_CONCURRENCY, "8");
        envValues.put(ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS, "3");
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);

        Config config = new ConfigLoader(environmentReader).load(CommandLine.populateCommand(new CliArguments()));

        assertThat(config.sourceFile()).isEqualTo("docs/guide.txt");
        assertThat(config.targetLanguage()).isEqualTo("French");
        assertThat(config.sessionId()).startsWith("guide_").hasSize("guide_".length() + 32);
        assertThat(config.artifactRoot()).isEqualTo(Path.of(ConfigLoader.DEFAULT_ARTIFACT_ROOT));
        assertThat(config.maxChunkSize()).isEqualTo(30000);
        assertThat(config.maxNumberOfChunks()).isZero();
        assertThat(config.temperature()).isEqualTo(1.0);
        assertThat(config.validationEnabled()).isFalse();
        assertThat(config.concurrency()).isEqualTo(8);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(config.translatorConfig().modelName()).isEqualTo("custom-gguf");
        assertThat(config.translatorConfig().validationModelName()).isEqualTo("custom-gguf");
        assertThat(config.translatorConfig().baseUrl()).contains("http://ollama:11434");
        assertThat(config.llmMaxRetryAttempts()).isEqualTo(3);
        assertThat(config.llmInitialBackoffSeconds()).isEqualTo(2);
        assertThat(config.llmMaxBackoffSeconds()).isEqualTo(60);
        assertThat(config.llmRetryJitterFactor()).isEqualTo(0.3);
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_GEMINI_API_KEY);
    }

    @Test
    void cliValuesWinOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_SOURCE_FILE, "env.txt",
                ConfigLoader.ENV_TARGET_LANGUAGE, "French",
                ConfigLoader.ENV_MAX_CHUNK_SIZE, "100",
                ConfigLoader.ENV_LLM_PROVIDER, "gemini",
                ConfigLoader.ENV_GEMINI_API_KEY, "secret-key"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "-t", "German", "--max-chunk-size", "200");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.sourceFile()).isEqualTo("env.txt");
        assertThat(config.targetLanguage()).isEqualTo("German");
        assertThat(config.maxChunkSize()).isEqualTo(200);
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(config.translatorConfig().modelName()).isEqualTo(LlmProvider.GEMINI.defaultModel());
        assertThat(config.secrets().geminiApiKey()).contains("secret-key");
        assertThat(config.secrets().toString()).doesNotContain("secret-key");
    }

    @Test
    void resumeWithoutSessionIdIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "-s", "a.txt", "-t", "German", "--resume");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("session id");
    }

    @Test
    void resumeFromEnvironmentKeepsExplicitSessionId() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_RESUME, "yes",
                ConfigLoader.ENV_SESSION_ID, "previous-run"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-s", "a.txt", "-t", "German");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.resume()).isTrue();
        assertThat(config.sessionId()).isEqualTo("previous-run");
    }

    @Test
    void missingGeminiKeyInProductionThrows() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_LLM_PROVIDER, "gemini"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-s", "a.txt", "-t", "German");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("GEMINI_API_KEY");
    }

    @Test
    void missingSourceIsRejected() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "-t", "German")));

        assertThat(thrown)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("source file");
    }

    @Test
    void malformedEnvironmentValuesAreRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-s", "a.txt", "-t", "German");

        Throwable badInteger = catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_MAX_CHUNK_SIZE, "large"))).load(cliArguments));
        Throwable badTemperature = catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_TEMPERATURE, "3.5"))).load(cliArguments));
        Throwable badMode = catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_TRANSLATION_MODE, "turbo"))).load(cliArguments));

        assertThat(badInteger).isInstanceOf(ConfigurationException.class).hasMessageContaining("MAX_CHUNK_SIZE");
        assertThat(badTemperature).isInstanceOf(ConfigurationException.class).hasMessageContaining("temperature");
        assertThat(badMode).isInstanceOf(ConfigurationException.class).hasMessageContaining("TRANSLATION_MODE");
    }

    @Test
    void sessionIdMustBeSinglePathSegment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "-s", "a.txt", "-t", "German", "--session-id", "../escape");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(ConfigurationException.class);
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
