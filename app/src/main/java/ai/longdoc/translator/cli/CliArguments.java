package ai.longdoc.translator.cli;

import ai.longdoc.translator.codec.DocumentFormat;
import ai.longdoc.translator.config.LlmProvider;
import ai.longdoc.translator.config.LogFormat;
import ai.longdoc.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "longdoc-translator", mixinStandardHelpOptions = true,
        description = "Translates long documents chunk by chunk with a language model")
public class CliArguments {

    @CommandLine.Option(names = {"-s", "--source-file"}, description = "Document to translate: a path or file: URI", paramLabel = "SOURCE")
    private String sourceFile;

    @CommandLine.Option(names = {"-t", "--target-language"}, description = "Language to translate into", paramLabel = "LANGUAGE")
    private String targetLanguage;

    @CommandLine.Option(names = "--format", converter = OptionConverters.DocumentFormatConverter.class,
            description = "Document format: plain, catalog or ebook (default: from the file extension)")
    private DocumentFormat documentFormat;

    @CommandLine.Option(names = "--store-root", description = "Directory holding session artifacts", paramLabel = "DIR")
    private Path artifactRoot;

    @CommandLine.Option(names = "--session-id", description = "Session id; required with --resume", paramLabel = "ID")
    private String sessionId;

    @CommandLine.Option(names = "--session-prefix", description = "Prefix for generated session ids", paramLabel = "PREFIX")
    private String sessionPrefix;

    @CommandLine.Option(names = "--max-chunk-size", description = "Maximum characters per chunk", paramLabel = "CHARS")
    private Integer maxChunkSize;

    @CommandLine.Option(names = "--max-number-of-chunks", description = "Translate only the first N chunks (0 = all)", paramLabel = "COUNT")
    private Integer maxNumberOfChunks;

    @CommandLine.Option(names = "--metadata-preview-size", description = "Characters read when extracting the glossary", paramLabel = "CHARS")
    private Integer metadataPreviewSize;

    @CommandLine.Option(names = "--temperature", description = "Sampling temperature between 0.0 and 2.0")
    private Double temperature;

    @CommandLine.Option(names = "--no-validation", description = "Skip the entity and style review of translated chunks")
    private boolean noValidation;

    @CommandLine.Option(names = "--concurrency", description = "Chunks processed in parallel", paramLabel = "COUNT")
    private Integer concurrency;

    @CommandLine.Option(names = "--entities-file", description = "Entity glossary to use instead of extraction", paramLabel = "FILE")
    private Path entitiesFile;

    @CommandLine.Option(names = "--style-file", description = "Style guide to use instead of extraction", paramLabel = "FILE")
    private Path styleFile;

    @CommandLine.Option(names = "--provider", converter = OptionConverters.LlmProviderConverter.class, description = "Model provider: ollama or gemini")
    private LlmProvider provider;

    @CommandLine.Option(names = "--model", description = "Translation model name", paramLabel = "MODEL")
    private String modelName;

    @CommandLine.Option(names = "--validation-model", description = "Model used by the reviewers (default: the translation model)", paramLabel = "MODEL")
    private String validationModelName;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = OptionConverters.TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = OptionConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--resume", description = "Reuse artifacts already stored for the session")
    private boolean resume;

    public String sourceFile() {
        return sourceFile;
    }

    public String targetLanguage() {
        return targetLanguage;
    }

    public DocumentFormat documentFormat() {
        return documentFormat;
    }

    public Path artifactRoot() {
        return artifactRoot;
    }

    public String sessionId() {
        return sessionId;
    }

    public String sessionPrefix() {
        return sessionPrefix;
    }

    public Integer maxChunkSize() {
        return maxChunkSize;
    }

    public Integer maxNumberOfChunks() {
        return maxNumberOfChunks;
    }

    public Integer metadataPreviewSize() {
        return metadataPreviewSize;
    }

    public Double temperature() {
        return temperature;
    }

    public boolean noValidation() {
        return noValidation;
    }

    public Integer concurrency() {
        return concurrency;
    }

    public Path entitiesFile() {
        return entitiesFile;
    }

    public Path styleFile() {
        return styleFile;
    }

    public LlmProvider provider() {
        return provider;
    }

    public String modelName() {
        return modelName;
    }

    public String validationModelName() {
        return validationModelName;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean resume() {
        return resume;
    }
}
