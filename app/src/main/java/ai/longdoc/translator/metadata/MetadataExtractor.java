package ai.longdoc.translator.metadata;

import ai.longdoc.translator.translate.GenerationService;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the glossary and style guide from a bounded preview of the document.
 */
public class MetadataExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataExtractor.class);

    static final String ENTITY_PROMPT_TEMPLATE = """
            Read the document below and list every entity whose translation into {target_language} must stay consistent.

            Include:
            * named entities: people, places and organizations;
            * terminology: technical terms and domain vocabulary;
            * product names, brand names and trademarks;
            * acronyms and initialisms.

            Respond with a JSON object and nothing else.
            Each key is the source term exactly as written in the document.
            Each value is an object with:
              "context": a short note on how the term is used,
              "suggested_translation": the translation to use, written only in {target_language}.

            Document:
            {text}
            """;

    static final String STYLE_PROMPT_TEMPLATE = """
            Read the document below and write a style guide for translating it into {target_language}.

            Cover:
            * tone and voice, including the level of formality;
            * the intended audience and what they are expected to know;
            * formatting conventions, capitalization and structural rules of this kind of document;
            * idioms, cultural references and sensitivities that need adapting for {target_language} readers.

            Document:
            {text}

            Write concrete instructions a translator can apply directly.
            """;

    private final GenerationService generationService;
    private final GlossaryParser glossaryParser;

    public MetadataExtractor(GenerationService generationService, GlossaryParser glossaryParser) {
        this.generationService = Objects.requireNonNull(generationService, "generationService");
        this.glossaryParser = Objects.requireNonNull(glossaryParser, "glossaryParser");
    }

    public GlossaryMetadata extract(String text, String targetLanguage, int previewSize, double temperature) {
        return prepare(text, targetLanguage, previewSize, temperature, Optional.empty(), Optional.empty());
    }

    /**
     * Uses supplied entity and style text as is and generates only the parts that are missing.
     */
    public GlossaryMetadata prepare(String text, String targetLanguage, int previewSize, double temperature,
                                    Optional<String> suppliedEntities, Optional<String> suppliedStyle) {
        if (suppliedEntities.isPresent() && suppliedStyle.isPresent()) {
            return supplied(suppliedEntities.get(), suppliedStyle.get());
        }
        String preview = preview(text, previewSize);
        LOGGER.info("Extracting {} from a {} character preview",
                suppliedEntities.isPresent() ? "style guide" : suppliedStyle.isPresent() ? "glossary" : "glossary and style guide",
                preview.length());
        String entities = suppliedEntities.orElseGet(() -> extractEntities(preview, targetLanguage, temperature));
        String style = suppliedStyle.orElseGet(() -> extractStyle(preview, targetLanguage, temperature));
        MetadataOrigin origin = suppliedEntities.isEmpty() && suppliedStyle.isEmpty()
                ? MetadataOrigin.EXTRACTED
                : MetadataOrigin.MIXED;
        return new GlossaryMetadata(entities, style, glossaryParser.parse(entities), origin);
    }

    public String extractEntities(String preview, String targetLanguage, double temperature) {
        return generationService.generate(fill(ENTITY_PROMPT_TEMPLATE, targetLanguage, preview), temperature);
    }

    public String extractStyle(String preview, String targetLanguage, double temperature) {
        return generationService.generate(fill(STYLE_PROMPT_TEMPLATE, targetLanguage, preview), temperature);
    }

    public GlossaryMetadata supplied(String entityText, String styleGuide) {
        return new GlossaryMetadata(entityText, styleGuide, glossaryParser.parse(entityText), MetadataOrigin.SUPPLIED);
    }

    private static String preview(String text, int previewSize) {
        Objects.requireNonNull(text, "text");
        if (previewSize <= 0) {
            throw new IllegalArgumentException("previewSize must be greater than zero");
        }
        return text.length() <= previewSize ? text : text.substring(0, previewSize);
    }

    private static String fill(String template, String targetLanguage, String preview) {
        return template.replace("{target_language}", targetLanguage).replace("{text}", preview);
    }
}
