package ai.longdoc.translator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ArtifactKeysTest {

    private final ArtifactKeys keys = new ArtifactKeys("s1");

    @Test
    void buildsZeroPaddedChunkKeys() {
        assertThat(keys.originalChunk(7)).isEqualTo("s1/original_chunks/original_chunk_0007.txt");
        assertThat(keys.prompt(12)).isEqualTo("s1/prompts_for_translation/translation_prompt_chunk_0012.txt");
        assertThat(keys.translatedChunk(12)).isEqualTo("s1/translated_chunks/translated_chunk_0012.txt");
        assertThat(keys.finalChunk(12)).isEqualTo("s1/translated_chunks/final_translated_chunk_0012.txt");
        assertThat(keys.finalDocument("book.txt")).isEqualTo("s1/FINAL_book.txt");
        assertThat(keys.entityExtraction()).isEqualTo("s1/entity_extraction.txt");
        assertThat(keys.styleInstructions()).isEqualTo("s1/style_instructions.txt");
    }

    @Test
    void derivesDownstreamKeysFromUpstreamKeys() {
        assertThat(keys.translatedKeyFor(keys.prompt(3))).isEqualTo(keys.translatedChunk(3));
        assertThat(keys.finalKeyFor(keys.translatedChunk(3))).isEqualTo(keys.finalChunk(3));
        assertThatThrownBy(() -> keys.translatedKeyFor("s1/original_chunks/original_chunk_0003.txt"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void translatedPrefixDoesNotMatchFinalChunks() {
        assertThat(keys.translatedChunk(1)).startsWith(keys.translatedPrefix());
        assertThat(keys.finalChunk(1)).doesNotStartWith(keys.translatedPrefix());
        assertThat(keys.finalChunk(1)).startsWith(keys.finalPrefix());
        assertThat(keys.prompt(1)).startsWith(keys.promptsPrefix());
    }

    @Test
    void sequenceOrdersLexicographically() {
        assertThat(keys.prompt(9).compareTo(keys.prompt(10))).isNegative();
        assertThat(ArtifactKeys.sequence(10000)).isEqualTo("10000");
        assertThatThrownBy(() -> ArtifactKeys.sequence(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsUnsafeKeys() {
        assertThatThrownBy(() -> new ArtifactKeys("a/b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ArtifactKeys("..")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ArtifactKeys.requireValidKey("/abs")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ArtifactKeys.requireValidKey("s/../x")).isInstanceOf(IllegalArgumentException.class);
        ArtifactKeys.requireValidKey("s/name..with..dots.txt");
    }
}
