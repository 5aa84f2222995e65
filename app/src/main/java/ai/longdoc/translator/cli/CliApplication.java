package ai.longdoc.translator.cli;

import ai.longdoc.translator.chunk.BoundaryChunker;
import ai.longdoc.translator.codec.CodecRegistry;
import ai.longdoc.translator.config.Config;
import ai.longdoc.translator.config.ConfigLoader;
import ai.longdoc.translator.config.ConfigurationException;
import ai.longdoc.translator.config.Secrets;
import ai.longdoc.translator.config.EnvironmentReader;
import ai.longdoc.translator.config.TranslatorConfig;
import ai.longdoc.translator.logging.LoggingConfigurator;
import ai.longdoc.translator.metadata.GlossaryParser;
import ai.longdoc.translator.metadata.MetadataExtractor;
import ai.longdoc.translator.pipeline.PipelineFailureException;
import ai.longdoc.translator.pipeline.PipelineOrchestrator;
import ai.longdoc.translator.pipeline.PipelineReport;
import ai.longdoc.translator.pipeline.Session;
import ai.longdoc.translator.pipeline.SessionSnapshot;
import ai.longdoc.translator.pipeline.SourceDocumentLoader;
import ai.longdoc.translator.pipeline.TranslationPromptComposer;
import ai.longdoc.translator.store.ArtifactStore;
import ai.longdoc.translator.store.FileSystemArtifactStore;
import ai.longdoc.translator.translate.ChatModelGenerationService;
import ai.longdoc.translator.translate.GenerationService;
import ai.longdoc.translator.translate.GenerationServiceFactory;
import ai.longdoc.translator.translate.MockGenerationService;
import ai.longdoc.translator.translate.RetryingGenerationService;
import ai.longdoc.translator.translate.SourceEchoGenerationService;
import ai.longdoc.translator.translate.TranslationMode;
import ai.longdoc.translator.validate.ChatModelValidationService;
import ai.longdoc.translator.validate.PassThroughValidationService;
import ai.longdoc.translator.validate.ValidationService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    /**
     * Creates the chat model for a provider and model name.
     */
    @FunctionalInterface
    interface ChatModelFactory {
        ChatModel create(TranslatorConfig translatorConfig, Secrets secrets, String modelName);
    }

    private final ConfigLoader configLoader;
    private final ChatModelFactory chatModelFactory;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), CliApplication::createChatModel);
    }

    CliApplication(ConfigLoader configLoader, ChatModelFactory chatModelFactory) {
        this.configLoader = configLoader;
        this.chatModelFactory = chatModelFactory;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (ConfigurationException ex) {
            commandLine.getErr().println("Configuration error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Translating {} into {} (session {}, mode {}, provider {}, model {})", config.sourceFile(),
                config.targetLanguage(), config.sessionId(), config.translationMode(),
                config.translatorConfig().provider(), config.translatorConfig().modelName());

        try {
            Session session = toSession(config);
            ArtifactStore store = new FileSystemArtifactStore(config.artifactRoot());
            PipelineReport report = createOrchestrator(config, store).run(session);
            logReport(report);
            return EXIT_SUCCESS;
        } catch (PipelineFailureException ex) {
            SessionSnapshot snapshot = ex.snapshot();
            LOGGER.error("{}. Artifacts kept under {}/{}; rerun with --resume --session-id {} to continue",
                    ex.getMessage(), config.artifactRoot(), snapshot.sessionId(), snapshot.sessionId());
            return EXIT_FAILURE;
        } catch (ConfigurationException | IllegalStateException ex) {
            LOGGER.error("Unable to start the translation: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private Session toSession(Config config) {
        return Session.builder()
                .id(config.sessionId())
                .source(config.sourceFile())
                .targetLanguage(config.targetLanguage())
                .maxChunkSize(config.maxChunkSize())
                .maxNumberOfChunks(config.maxNumberOfChunks())
                .metadataPreviewSize(config.metadataPreviewSize())
                .modelName(config.translatorConfig().modelName())
                .temperature(config.temperature())
                .validationEnabled(config.validationEnabled())
                .concurrency(config.concurrency())
                .declaredFormat(config.documentFormat().orElse(null))
                .suppliedEntities(readOptional(config.entitiesFile()).orElse(null))
                .suppliedStyle(readOptional(config.styleFile()).orElse(null))
                .resume(config.resume())
                .build();
    }

    PipelineOrchestrator createOrchestrator(Config config, ArtifactStore store) {
        GenerationService generationService = createGenerationService(config, config.translatorConfig().modelName());
        ValidationService validationService = createValidationService(config, store);
        return new PipelineOrchestrator(store, CodecRegistry.defaults(), new BoundaryChunker(),
                new MetadataExtractor(generationService, new GlossaryParser()), new TranslationPromptComposer(),
                generationService, validationService, new SourceDocumentLoader());
    }

    private GenerationService createGenerationService(Config config, String modelName) {
        TranslationMode mode = config.translationMode();
        GenerationService production = mode == TranslationMode.PRODUCTION
                ? createProductionService(config, modelName)
                : (prompt, temperature) -> {
                    throw new IllegalStateException("Production generation is not available in " + mode + " mode");
                };
        GenerationServiceFactory factory = new GenerationServiceFactory(production, new SourceEchoGenerationService(),
                new MockGenerationService());
        return factory.select(mode);
    }

    private GenerationService createProductionService(Config config, String modelName) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChatModel chatModel = chatModelFactory.create(translatorConfig, config.secrets(), modelName);
        GenerationService chatService = new ChatModelGenerationService(chatModel, translatorConfig.provider().name(), modelName);
        return new RetryingGenerationService(chatService,
                config.llmMaxRetryAttempts(),
                config.llmInitialBackoffSeconds(),
                config.llmMaxBackoffSeconds(),
                config.llmRetryJitterFactor());
    }

    private ValidationService createValidationService(Config config, ArtifactStore store) {
        if (!config.validationEnabled() || config.translationMode() != TranslationMode.PRODUCTION) {
            return new PassThroughValidationService(store);
        }
        String validationModel = config.translatorConfig().validationModelName();
        LOGGER.info("Validating translated chunks with model '{}'", validationModel);
        return new ChatModelValidationService(store, createGenerationService(config, validationModel), config.temperature());
    }

    private static Optional<String> readOptional(Optional<Path> file) {
        if (file.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file.get(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read " + file.get(), ex);
        }
    }

    private static void logReport(PipelineReport report) {
        SessionSnapshot snapshot = report.snapshot();
        LOGGER.info("Final translation written to {}", report.finalDocument().uri());
        report.encodedDocument().ifPresent(encoded -> LOGGER.info("Re-encoded document written to {}", encoded.uri()));
        if (snapshot.chunksReused() > 0) {
            LOGGER.info("Reused {} previously translated chunks", snapshot.chunksReused());
        }
        if (snapshot.isDegraded()) {
            LOGGER.warn("Completed with degradations: validation fallback for chunks {}, re-encode {}",
                    snapshot.fallbackChunks(),
                    snapshot.reencodeSucceeded().map(ok -> ok ? "succeeded" : "failed").orElse("not required"));
        }
        snapshot.warnings().forEach(warning -> LOGGER.warn("Warning: {}", warning));
    }

    private static ChatModel createChatModel(TranslatorConfig translatorConfig, Secrets secrets, String modelName) {
        return switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig, modelName);
            case GEMINI -> createGeminiChatModel(secrets, modelName);
        };
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig translatorConfig, String modelName) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", modelName, baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(modelName)
                    .timeout(Duration.ofMinutes(10))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(Secrets secrets, String modelName) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", modelName);
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(modelName)
                    .timeout(Duration.ofMinutes(10))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
