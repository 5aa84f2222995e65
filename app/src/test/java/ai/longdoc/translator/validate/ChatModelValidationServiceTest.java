package ai.longdoc.translator.validate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.longdoc.translator.store.ArtifactLocator;
import ai.longdoc.translator.store.InMemoryArtifactStore;
import ai.longdoc.translator.translate.GenerationException;
import ai.longdoc.translator.translate.GenerationService;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChatModelValidationServiceTest {

    private final InMemoryArtifactStore store = new InMemoryArtifactStore();
    private final ArtifactLocator prompt = store.put("s/prompts_for_translation/translation_prompt_chunk_0001.txt", "Translate: Hello Acme");
    private final ArtifactLocator translated = store.put("s/translated_chunks/translated_chunk_0001.txt", "Bonjour Acmé");

    @Test
    void returnsTranslationUnchangedWhenNoEditsProposed() {
        ScriptedGenerationService generation = new ScriptedGenerationService("[]", "```json\n[ ]\n```");
        ChatModelValidationService service = new ChatModelValidationService(store, generation, 0.2);

        assertThat(service.validate(prompt, translated)).isEqualTo("Bonjour Acmé");
        assertThat(generation.calls).isEqualTo(2);
    }

    @Test
    void appliesEditsThroughEditorPass() {
        ScriptedGenerationService generation = new ScriptedGenerationService(
                "[{\"replace\": \"Acmé\", \"with\": \"Acme\"}]", "[]", "Bonjour Acme");
        ChatModelValidationService service = new ChatModelValidationService(store, generation, 0.2);

        assertThat(service.validate(prompt, translated)).isEqualTo("Bonjour Acme");
        assertThat(generation.calls).isEqualTo(3);
        assertThat(generation.lastPrompt).contains("Acmé").contains("\"with\": \"Acme\"");
    }

    @Test
    void blankEditorOutputIsAValidationFailure() {
        ChatModelValidationService service = new ChatModelValidationService(store,
                new ScriptedGenerationService("[{\"x\": 1}]", "[]", "  "), 0.2);

        assertThatThrownBy(() -> service.validate(prompt, translated)).isInstanceOf(ValidationException.class);
    }

    @Test
    void wrapsGenerationFailures() {
        GenerationService failing = (p, t) -> {
            throw new GenerationException("reviewer offline", null);
        };
        ChatModelValidationService service = new ChatModelValidationService(store, failing, 0.2);

        assertThatThrownBy(() -> service.validate(prompt, translated))
                .isInstanceOf(ValidationException.class)
                .hasCauseInstanceOf(GenerationException.class);
    }

    @Test
    void passThroughReturnsStoredTranslation() {
        assertThat(new PassThroughValidationService(store).validate(prompt, translated)).isEqualTo("Bonjour Acmé");
    }

    @Test
    void recognisesEmptyEditLists() {
        assertThat(ChatModelValidationService.isEmptyEditList("")).isTrue();
        assertThat(ChatModelValidationService.isEmptyEditList(" [ ] ")).isTrue();
        assertThat(ChatModelValidationService.isEmptyEditList("```\n[]\n```")).isTrue();
        assertThat(ChatModelValidationService.isEmptyEditList("[{\"a\":1}]")).isFalse();
    }

    private static final class ScriptedGenerationService implements GenerationService {
        private final Deque<String> responses;
        private int calls;
        private String lastPrompt;

        ScriptedGenerationService(String... responses) {
            this.responses = new ArrayDeque<>(List.of(responses));
        }

        @Override
        public String generate(String prompt, double temperature) {
            calls++;
            lastPrompt = prompt;
            return responses.removeFirst();
        }
    }
}
