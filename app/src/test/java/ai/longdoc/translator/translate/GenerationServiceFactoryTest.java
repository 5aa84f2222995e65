package ai.longdoc.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class GenerationServiceFactoryTest {

    private static final String PROMPT = "# Translation Task\n\n## 4. Source Content\n---\nHello world.\n---\n\n**Output:** done\n";

    @Test
    void selectsServicePerMode() {
        GenerationService production = (prompt, temperature) -> "production";
        GenerationServiceFactory factory = new GenerationServiceFactory(production, new SourceEchoGenerationService(),
                new MockGenerationService());

        assertThat(factory.select(TranslationMode.PRODUCTION).generate(PROMPT, 1.0)).isEqualTo("production");
        assertThat(factory.select(TranslationMode.DRY_RUN).generate(PROMPT, 1.0)).isEqualTo("Hello world.");
        assertThat(factory.select(TranslationMode.MOCK).generate(PROMPT, 1.0)).isEqualTo("[MOCK] Hello world.");
    }

    @Test
    void echoReturnsWholePromptWithoutSourceSection() {
        assertThat(new SourceEchoGenerationService().generate("no sections here", 1.0)).isEqualTo("no sections here");
    }

    @Test
    void parsesModeNames() {
        assertThat(TranslationMode.from("dry-run")).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(TranslationMode.from(" mock ")).isEqualTo(TranslationMode.MOCK);
        assertThat(TranslationMode.from("")).isEqualTo(TranslationMode.PRODUCTION);
        assertThatThrownBy(() -> TranslationMode.from("offline")).isInstanceOf(IllegalArgumentException.class);
    }
}
