package ai.longdoc.translator.metadata;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class GlossaryParserTest {

    private final GlossaryParser parser = new GlossaryParser();

    @Test
    void parsesStructuredEntries() {
        Map<String, GlossaryTerm> terms = parser.parse("""
                {
                  "Acme Cloud": {"context": "product name", "suggested_translation": "Acme Cloud"},
                  "bucket": {"context": "storage container", "suggested_translation": "compartiment"},
                  "GPU": "processeur graphique"
                }
                """);

        assertThat(terms).containsOnlyKeys("Acme Cloud", "bucket", "GPU");
        assertThat(terms.get("bucket")).isEqualTo(new GlossaryTerm("storage container", "compartiment"));
        assertThat(terms.get("GPU").suggestedTranslation()).isEqualTo("processeur graphique");
        assertThat(terms.keySet()).containsExactly("Acme Cloud", "bucket", "GPU");
    }

    @Test
    void stripsMarkdownCodeFence() {
        Map<String, GlossaryTerm> terms = parser.parse("```json\n{\"API\": {\"context\": \"acronym\", \"suggested_translation\": \"API\"}}\n```");

        assertThat(terms).containsOnlyKeys("API");
    }

    @Test
    void returnsEmptyForFreeText() {
        assertThat(parser.parse("Acme Cloud -> Acme Cloud\nbucket -> compartiment")).isEmpty();
        assertThat(parser.parse("[\"not\", \"an object\"]")).isEmpty();
        assertThat(parser.parse("  ")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }
}
