package ai.longdoc.translator.validate;

import ai.longdoc.translator.store.ArtifactLocator;
import ai.longdoc.translator.store.ArtifactStore;
import ai.longdoc.translator.translate.GenerationService;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Model backed review: an entity check and a style check each propose edits, and an editor pass
 * applies them. A translation without proposed edits is returned unchanged.
 */
public class ChatModelValidationService implements ValidationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelValidationService.class);
    private static final String NO_EDITS = "[]";

    static final String ENTITY_REVIEW_TEMPLATE = """
            You check translated text for terminology consistency.

            The translation request below contains an entity dictionary with the approved translation of each term.
            Compare the translated text with that dictionary and look for:
            * misspelled named entities;
            * terms translated that should have stayed in the source language, or the reverse;
            * the same term rendered in more than one way.

            Reply with a JSON array of concrete edits, each naming the text to replace and its replacement.
            Reply with [] when there is nothing to change.

            <translation_request>
            {prompt}
            </translation_request>

            <translated_text>
            {translation}
            </translated_text>
            """;

    static final String STYLE_REVIEW_TEMPLATE = """
            You check translated text against a style guide.

            The translation request below contains the style guide for this document.
            Find passages of the translated text whose tone, formality or register departs from it.

            Reply with a JSON array of concrete edits, each naming the text to replace and its replacement.
            Reply with [] when there is nothing to change.

            <translation_request>
            {prompt}
            </translation_request>

            <translated_text>
            {translation}
            </translated_text>
            """;

    static final String EDITOR_TEMPLATE = """
            You finalize a translated text by applying reviewed edits.

            Apply every entity edit and every style edit to the translated text.
            Keep the rest of the text, its markup and its line structure exactly as they are.
            Return only the corrected text, without commentary.

            Entity edits:
            {entity_edits}

            Style edits:
            {style_edits}

            <translated_text>
            {translation}
            </translated_text>
            """;

    private final ArtifactStore store;
    private final GenerationService generationService;
    private final double temperature;

    public ChatModelValidationService(ArtifactStore store, GenerationService generationService, double temperature) {
        this.store = Objects.requireNonNull(store, "store");
        this.generationService = Objects.requireNonNull(generationService, "generationService");
        this.temperature = temperature;
    }

    @Override
    public String validate(ArtifactLocator promptLocator, ArtifactLocator translatedLocator) {
        try {
            String prompt = store.getText(promptLocator);
            String translation = store.getText(translatedLocator);

            String entityEdits = review(ENTITY_REVIEW_TEMPLATE, prompt, translation);
            String styleEdits = review(STYLE_REVIEW_TEMPLATE, prompt, translation);
            if (isEmptyEditList(entityEdits) && isEmptyEditList(styleEdits)) {
                LOGGER.debug("No edits proposed for {}", translatedLocator.key());
                return translation;
            }

            LOGGER.info("Applying review edits to {}", translatedLocator.key());
            String edited = generationService.generate(EDITOR_TEMPLATE
                    .replace("{entity_edits}", entityEdits.strip())
                    .replace("{style_edits}", styleEdits.strip())
                    .replace("{translation}", translation), temperature);
            if (edited == null || edited.isBlank()) {
                throw new ValidationException("Editor returned no text for " + translatedLocator.key(), null);
            }
            return edited;
        } catch (ValidationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ValidationException("Validation failed for " + translatedLocator.key(), ex);
        }
    }

    private String review(String template, String prompt, String translation) {
        String response = generationService.generate(template
                .replace("{prompt}", prompt)
                .replace("{translation}", translation), temperature);
        return response == null ? NO_EDITS : response;
    }

    static boolean isEmptyEditList(String response) {
        String trimmed = response.strip();
        if (trimmed.startsWith("```")) {
            int firstLineEnd = trimmed.indexOf('\n');
            int closingFence = trimmed.lastIndexOf("```");
            if (firstLineEnd > 0 && closingFence > firstLineEnd) {
                trimmed = trimmed.substring(firstLineEnd + 1, closingFence).strip();
            }
        }
        return trimmed.isEmpty() || trimmed.replaceAll("\\s+", "").equals(NO_EDITS);
    }
}
