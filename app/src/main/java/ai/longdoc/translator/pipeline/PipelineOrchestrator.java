package ai.longdoc.translator.pipeline;

import ai.longdoc.translator.chunk.BoundaryChunker;
import ai.longdoc.translator.chunk.Chunk;
import ai.longdoc.translator.chunk.ChunkingException;
import ai.longdoc.translator.codec.CodecRegistry;
import ai.longdoc.translator.codec.DecodeException;
import ai.longdoc.translator.codec.DocumentCodec;
import ai.longdoc.translator.codec.DocumentContent;
import ai.longdoc.translator.codec.EncodedDocument;
import ai.longdoc.translator.config.ConfigurationException;
import ai.longdoc.translator.metadata.GlossaryMetadata;
import ai.longdoc.translator.metadata.MetadataExtractor;
import ai.longdoc.translator.metadata.MetadataOrigin;
import ai.longdoc.translator.store.ArtifactKeys;
import ai.longdoc.translator.store.ArtifactLocator;
import ai.longdoc.translator.store.ArtifactStore;
import ai.longdoc.translator.store.ArtifactStoreException;
import ai.longdoc.translator.translate.GenerationException;
import ai.longdoc.translator.translate.GenerationService;
import ai.longdoc.translator.validate.ValidationService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives one session through metadata, chunking, prompt building, translation, validation and
 * reassembly, persisting every intermediate artifact before moving on.
 *
 * <p>Generation failures abort the run; validation failures fall back to the raw translation of the
 * affected chunk; a failed structural re-encode leaves the concatenated document in place.
 */
public class PipelineOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
    static final String MDC_SESSION = "session";
    static final String MDC_STAGE = "stage";
    static final String MDC_CHUNK = "chunk";
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ArtifactStore store;
    private final CodecRegistry codecs;
    private final BoundaryChunker chunker;
    private final MetadataExtractor metadataExtractor;
    private final TranslationPromptComposer promptComposer;
    private final GenerationService generationService;
    private final ValidationService validationService;
    private final SourceDocumentLoader sourceLoader;

    public PipelineOrchestrator(ArtifactStore store,
                                CodecRegistry codecs,
                                BoundaryChunker chunker,
                                MetadataExtractor metadataExtractor,
                                TranslationPromptComposer promptComposer,
                                GenerationService generationService,
                                ValidationService validationService,
                                SourceDocumentLoader sourceLoader) {
        this.store = Objects.requireNonNull(store, "store");
        this.codecs = Objects.requireNonNull(codecs, "codecs");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.metadataExtractor = Objects.requireNonNull(metadataExtractor, "metadataExtractor");
        this.promptComposer = Objects.requireNonNull(promptComposer, "promptComposer");
        this.generationService = Objects.requireNonNull(generationService, "generationService");
        this.validationService = Objects.requireNonNull(validationService, "validationService");
        this.sourceLoader = Objects.requireNonNull(sourceLoader, "sourceLoader");
    }

    public PipelineReport run(Session session) {
        return run(session, new SessionState(session.id()));
    }

    /**
     * Runs the session, publishing progress into {@code state} so other threads can poll it.
     *
     * @throws PipelineFailureException on any fatal error, with the partial state attached
     */
    public PipelineReport run(Session session, SessionState state) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(state, "state");
        ArtifactKeys keys = new ArtifactKeys(session.id());
        MDC.put(MDC_SESSION, session.id());
        MDC.put(MDC_STAGE, state.stage().name());
        try {
            verifyConfiguration(session);
            DocumentContent document = loadDocument(session);
            GlossaryMetadata metadata = prepareMetadata(session, document, keys);
            enter(state, PipelineStage.METADATA_READY);

            List<Chunk> chunks = createChunks(session, document, keys, state);
            enter(state, PipelineStage.CHUNKED);

            List<ChunkArtifacts> artifacts = buildPrompts(session, document, metadata, chunks, keys, state);
            enter(state, PipelineStage.PROMPTS_BUILT);

            enter(state, PipelineStage.TRANSLATING);
            translate(session, keys, artifacts, state);

            if (session.validationEnabled()) {
                enter(state, PipelineStage.VALIDATING);
            }
            finalizeChunks(session, keys, artifacts, state);

            enter(state, PipelineStage.REASSEMBLING);
            PipelineReport report = reassemble(document, keys, artifacts, state);
            enter(state, PipelineStage.DONE);
            SessionSnapshot snapshot = state.snapshot();
            LOGGER.info("Session {} done: {} chunks, {} validation fallbacks, re-encode {}", session.id(),
                    snapshot.finalChunksWritten(), snapshot.fallbackChunks().size(),
                    snapshot.reencodeSucceeded().map(ok -> ok ? "succeeded" : "failed").orElse("not required"));
            return new PipelineReport(report.sessionId(), report.finalDocument(), report.encodedDocument(), snapshot);
        } catch (PipelineFailureException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw fail(state, ex);
        } finally {
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_SESSION);
        }
    }

    private void verifyConfiguration(Session session) {
        List<String> missing = new ArrayList<>();
        if (session.source().isEmpty()) {
            missing.add("source");
        }
        if (session.targetLanguage().isEmpty()) {
            missing.add("target language");
        }
        if (session.modelName().isEmpty()) {
            missing.add("model name");
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required session parameters: " + String.join(", ", missing));
        }
        if (session.temperature() < 0.0 || session.temperature() > 2.0) {
            throw new ConfigurationException("temperature must be between 0.0 and 2.0 but was " + session.temperature());
        }
    }

    private DocumentContent loadDocument(Session session) {
        SourceDocumentLoader.SourceDocument source = sourceLoader.load(session.source());
        DocumentContent document = codecs.decode(source.bytes(), source.name(), session.declaredFormat());
        LOGGER.info("Decoded {} as {} ({} characters)", source.name(), document.format(), document.text().length());
        return document;
    }

    private GlossaryMetadata prepareMetadata(Session session, DocumentContent document, ArtifactKeys keys) {
        if (session.resume() && session.suppliedEntities().isEmpty() && session.suppliedStyle().isEmpty()
                && store.exists(keys.entityExtraction()) && store.exists(keys.styleInstructions())) {
            LOGGER.info("Reusing stored glossary and style guide");
            GlossaryMetadata stored = metadataExtractor.supplied(
                    store.getText(store.locate(keys.entityExtraction())),
                    store.getText(store.locate(keys.styleInstructions())));
            return new GlossaryMetadata(stored.entityText(), stored.styleGuide(), stored.terms(), MetadataOrigin.STORED);
        }

        GlossaryMetadata metadata = metadataExtractor.prepare(document.text(), session.targetLanguage(),
                session.metadataPreviewSize(), session.temperature(), session.suppliedEntities(), session.suppliedStyle());
        store.put(keys.entityExtraction(), metadata.entityText());
        store.put(keys.styleInstructions(), metadata.styleGuide());
        LOGGER.info("Glossary ready ({} terms, origin {})", metadata.terms().size(), metadata.origin());
        return metadata;
    }

    private List<Chunk> createChunks(Session session, DocumentContent document, ArtifactKeys keys, SessionState state) {
        List<String> texts = chunker.chunk(document.text(), session.maxChunkSize());
        if (session.maxNumberOfChunks() > 0 && texts.size() > session.maxNumberOfChunks()) {
            String warning = "Document produced %d chunks; only the first %d are translated"
                    .formatted(texts.size(), session.maxNumberOfChunks());
            LOGGER.warn(warning);
            state.recordWarning(warning);
            texts = texts.subList(0, session.maxNumberOfChunks());
        }
        List<Chunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            Chunk chunk = new Chunk(i + 1, texts.get(i), keys.originalChunk(i + 1));
            store.put(chunk.key(), chunk.text());
            state.chunkCreated();
            chunks.add(chunk);
        }
        LOGGER.info("Split document into {} chunks of at most {} characters", chunks.size(), session.maxChunkSize());
        return chunks;
    }

    private List<ChunkArtifacts> buildPrompts(Session session, DocumentContent document, GlossaryMetadata metadata,
                                              List<Chunk> chunks, ArtifactKeys keys, SessionState state) {
        List<ChunkArtifacts> artifacts = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            TranslationRequest request = promptComposer.compose(chunk, chunks.size(), session.targetLanguage(),
                    document.format(), metadata);
            ArtifactLocator prompt = store.put(keys.prompt(chunk.index()), request.prompt());
            state.promptBuilt();
            artifacts.add(new ChunkArtifacts(chunk.index(), prompt));
        }
        return artifacts;
    }

    private void translate(Session session, ArtifactKeys keys, List<ChunkArtifacts> artifacts, SessionState state) {
        List<ArtifactLocator> prompts = listExpected(keys.promptsPrefix(),
                artifacts.stream().map(artifact -> artifact.prompt().key()).collect(Collectors.toList()));
        Map<String, Integer> indexByPrompt = artifacts.stream()
                .collect(Collectors.toMap(artifact -> artifact.prompt().key(), ChunkArtifacts::index));
        AtomicBoolean aborted = new AtomicBoolean();
        List<Callable<Void>> tasks = new ArrayList<>(prompts.size());
        for (ArtifactLocator prompt : prompts) {
            int index = indexByPrompt.get(prompt.key());
            tasks.add(() -> {
                MDC.put(MDC_CHUNK, Integer.toString(index));
                String translatedKey = keys.translatedKeyFor(prompt.key());
                if (session.resume() && store.exists(translatedKey)) {
                    LOGGER.info("Reusing stored translation {}", translatedKey);
                    state.chunkReused();
                    state.translationCompleted();
                    return null;
                }
                if (aborted.get()) {
                    return null;
                }
                String translated = generationService.generate(store.getText(prompt), session.temperature());
                store.put(translatedKey, translated);
                state.translationCompleted();
                LOGGER.info("Translated {} ({} characters)", translatedKey, translated.length());
                return null;
            });
        }
        runChunkTasks(tasks, session.concurrency(), aborted);
    }

    private void finalizeChunks(Session session, ArtifactKeys keys, List<ChunkArtifacts> artifacts, SessionState state) {
        Map<String, ChunkArtifacts> byTranslatedKey = artifacts.stream()
                .collect(Collectors.toMap(artifact -> keys.translatedChunk(artifact.index()), artifact -> artifact));
        List<ArtifactLocator> translated = listExpected(keys.translatedPrefix(), artifacts.stream()
                .map(artifact -> keys.translatedChunk(artifact.index()))
                .collect(Collectors.toList()));
        AtomicBoolean aborted = new AtomicBoolean();
        List<Callable<Void>> tasks = new ArrayList<>(translated.size());
        for (ArtifactLocator translatedLocator : translated) {
            ChunkArtifacts artifact = byTranslatedKey.get(translatedLocator.key());
            tasks.add(() -> {
                MDC.put(MDC_CHUNK, Integer.toString(artifact.index()));
                String finalKey = keys.finalKeyFor(translatedLocator.key());
                if (session.resume() && store.exists(finalKey)) {
                    LOGGER.info("Reusing stored final chunk {}", finalKey);
                    state.finalChunkWritten();
                    return null;
                }
                if (aborted.get()) {
                    return null;
                }
                finalizeChunk(session, artifact, translatedLocator, finalKey, state);
                return null;
            });
        }
        runChunkTasks(tasks, session.concurrency(), aborted);
    }

    private void finalizeChunk(Session session, ChunkArtifacts artifact, ArtifactLocator translatedLocator,
                               String finalKey, SessionState state) {
        ChunkTranslation translation = ChunkTranslation.raw(artifact.index(), store.getText(translatedLocator));
        String failure = null;
        if (session.validationEnabled()) {
            try {
                String validated = validationService.validate(artifact.prompt(), translatedLocator);
                if (validated == null || validated.isBlank()) {
                    failure = "validation returned no text";
                } else {
                    translation = translation.withValidatedText(validated);
                }
            } catch (RuntimeException ex) {
                failure = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                LOGGER.warn("Validation failed for chunk {}; keeping the raw translation", artifact.index(), ex);
            }
        }
        store.put(finalKey, translation.finalText());
        state.finalChunkWritten();
        if (!session.validationEnabled()) {
            return;
        }
        if (failure == null) {
            state.validationCompleted();
        } else {
            state.validationFailed(artifact.index(), failure);
        }
    }

    private PipelineReport reassemble(DocumentContent document, ArtifactKeys keys, List<ChunkArtifacts> artifacts,
                                      SessionState state) {
        List<String> expected = artifacts.stream()
                .map(artifact -> keys.finalChunk(artifact.index()))
                .collect(Collectors.toList());
        StringBuilder assembled = new StringBuilder();
        for (ArtifactLocator finalChunk : listExpected(keys.finalPrefix(), expected)) {
            assembled.append(store.getText(finalChunk));
        }
        String text = assembled.toString();
        ArtifactLocator finalDocument = store.put(keys.finalDocument(document.baseName()), text);
        LOGGER.info("Wrote {} ({} characters)", finalDocument.key(), text.length());

        Optional<ArtifactLocator> encodedDocument = Optional.empty();
        DocumentCodec codec = codecs.codecFor(document.format());
        if (codec.requiresStructuralReassembly()) {
            Optional<EncodedDocument> encoded = encode(codec, text, document, state);
            if (encoded.isPresent()) {
                encodedDocument = Optional.of(store.put(keys.singleton(encoded.get().name()), encoded.get().bytes()));
                state.recordReencode(true);
                LOGGER.info("Wrote re-encoded {} document {}", document.format(), encodedDocument.get().key());
            }
        }
        return new PipelineReport(keys.session(), finalDocument, encodedDocument, state.snapshot());
    }

    private Optional<EncodedDocument> encode(DocumentCodec codec, String text, DocumentContent document, SessionState state) {
        try {
            return Optional.of(codec.encode(text, document));
        } catch (RuntimeException ex) {
            LOGGER.warn("Structural re-encoding of {} failed; the concatenated translation is still available",
                    document.sourceName(), ex);
            state.recordReencode(false);
            state.recordError(ErrorKind.REASSEMBLY_ENCODE, ex.getMessage());
            state.recordWarning("Structural re-encoding unavailable: " + ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Resolves the artifacts this run produced under {@code prefix}, in the order of
     * {@code expectedKeys}. Listing order is lexicographic, which stops matching sequence order
     * once an index outgrows the zero padding, so it is only used to check presence.
     */
    private List<ArtifactLocator> listExpected(String prefix, List<String> expectedKeys) {
        Map<String, ArtifactLocator> listed = store.listByPrefix(prefix).stream()
                .collect(Collectors.toMap(ArtifactLocator::key, locator -> locator, (first, second) -> first));
        Set<String> expected = new HashSet<>(expectedKeys);
        long stale = listed.keySet().stream().filter(key -> !expected.contains(key)).count();
        if (stale > 0) {
            LOGGER.warn("Ignoring {} stale artifacts under {}", stale, prefix);
        }
        List<ArtifactLocator> ordered = new ArrayList<>(expectedKeys.size());
        for (String key : expectedKeys) {
            ArtifactLocator locator = listed.get(key);
            if (locator == null) {
                throw new ArtifactStoreException("Expected %d artifacts under %s but %s is missing"
                        .formatted(expectedKeys.size(), prefix, key), null);
            }
            ordered.add(locator);
        }
        return ordered;
    }

    /**
     * Runs chunk tasks on a bounded pool. The first failure sets {@code aborted}, cancels the rest
     * and is rethrown.
     */
    private void runChunkTasks(List<Callable<Void>> tasks, int concurrency, AtomicBoolean aborted) {
        if (tasks.isEmpty()) {
            return;
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(concurrency, tasks.size()));
        CompletionService<Void> completion = new ExecutorCompletionService<>(executor);
        List<Future<Void>> futures = new ArrayList<>(tasks.size());
        try {
            for (Callable<Void> task : tasks) {
                futures.add(completion.submit(withMdc(mdc, abortOnFailure(aborted, task))));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    completion.take().get();
                } catch (ExecutionException ex) {
                    aborted.set(true);
                    futures.forEach(future -> future.cancel(true));
                    throw unwrap(ex.getCause());
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            aborted.set(true);
            futures.forEach(future -> future.cancel(true));
            throw new GenerationException("Interrupted while waiting for chunk work", ex);
        } finally {
            executor.shutdownNow();
            awaitShutdown(executor);
        }
    }

    private static Callable<Void> abortOnFailure(AtomicBoolean aborted, Callable<Void> task) {
        return () -> {
            try {
                return task.call();
            } catch (Exception ex) {
                aborted.set(true);
                throw ex;
            }
        };
    }

    private static Callable<Void> withMdc(Map<String, String> mdc, Callable<Void> task) {
        return () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static void awaitShutdown(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Chunk workers did not stop within {} seconds", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while stopping chunk workers");
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Chunk task failed", cause);
    }

    private void enter(SessionState state, PipelineStage stage) {
        state.advanceTo(stage);
        MDC.put(MDC_STAGE, stage.name());
        LOGGER.debug("Entered stage {}", stage);
    }

    private PipelineFailureException fail(SessionState state, RuntimeException ex) {
        ErrorKind kind = classify(ex);
        PipelineStage stage = state.markFailed(kind, ex.getMessage());
        SessionSnapshot snapshot = state.snapshot();
        LOGGER.error("Session {} failed during {} ({}): {} of {} chunks translated", snapshot.sessionId(), stage, kind,
                snapshot.translationsCompleted(), snapshot.promptsBuilt(), ex);
        return new PipelineFailureException(kind, stage, snapshot, ex);
    }

    static ErrorKind classify(RuntimeException ex) {
        if (ex instanceof ConfigurationException) {
            return ErrorKind.CONFIGURATION;
        }
        if (ex instanceof DecodeException) {
            return ErrorKind.DECODE;
        }
        if (ex instanceof ChunkingException) {
            return ErrorKind.CHUNKING;
        }
        if (ex instanceof GenerationException) {
            return ErrorKind.GENERATION;
        }
        if (ex instanceof ArtifactStoreException) {
            return ErrorKind.STORAGE;
        }
        return ErrorKind.INTERNAL;
    }

    private record ChunkArtifacts(int index, ArtifactLocator prompt) {
    }
}
