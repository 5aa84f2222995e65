package ai.longdoc.translator.chunk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BoundaryChunkerTest {

    private final BoundaryChunker chunker = new BoundaryChunker();

    @Test
    void returnsShortTextAsSingleChunk() {
        assertThat(chunker.chunk("short text", 100)).containsExactly("short text");
        assertThat(chunker.chunk("", 100)).containsExactly("");
        assertThat(chunker.chunk("x".repeat(100), 100)).hasSize(1);
    }

    @Test
    void rejectsNonPositiveMaxSize() {
        assertThatThrownBy(() -> chunker.chunk("text", 0)).isInstanceOf(ChunkingException.class);
        assertThatThrownBy(() -> chunker.chunk("text", -5)).isInstanceOf(ChunkingException.class);
    }

    @Test
    void prefersParagraphBreakPastTheFloor() {
        String text = "a".repeat(80) + "\n\n" + "b".repeat(50);

        List<String> chunks = chunker.chunk(text, 100);

        assertThat(chunks).containsExactly("a".repeat(80) + "\n\n", "b".repeat(50));
    }

    @Test
    void cutsHardWhenBoundaryIsBelowTheFloor() {
        String text = "a".repeat(50) + "\n\n" + "b".repeat(100);

        List<String> chunks = chunker.chunk(text, 100);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0)).hasSize(100);
        assertThat(String.join("", chunks)).isEqualTo(text);
    }

    @Test
    void fallsBackToSentenceThenSpace() {
        String sentence = "a".repeat(75) + ". " + "b".repeat(50);
        String spaced = "a".repeat(90) + " " + "b".repeat(30);

        assertThat(chunker.chunk(sentence, 100).get(0)).isEqualTo("a".repeat(75) + ". ");
        assertThat(chunker.chunk(spaced, 100).get(0)).isEqualTo("a".repeat(90) + " ");
    }

    @Test
    void lineBreakBeatsLaterSentenceTerminator() {
        String text = "a".repeat(72) + "\n" + "b".repeat(10) + ". " + "c".repeat(40);

        assertThat(chunker.chunk(text, 100).get(0)).isEqualTo("a".repeat(72) + "\n");
    }

    @Test
    @DisplayName("Concatenating chunks reproduces the input and every chunk respects the size bound")
    void splitIsLosslessAndBounded() {
        Random random = new Random(42);
        String alphabet = "abcdefghij   ..!?\n";
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 20_000; i++) {
            builder.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        String text = builder.toString();

        for (int maxSize : new int[] {1, 7, 100, 999, 5000}) {
            List<String> chunks = chunker.chunk(text, maxSize);
            assertThat(String.join("", chunks)).isEqualTo(text);
            assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isBetween(1, maxSize));
        }
    }

    @Test
    @DisplayName("100,000 characters of 2,000 character paragraphs split into 30,000/30,000/30,000/10,000")
    void splitsHundredThousandCharacterDocument() {
        String paragraph = ("word ".repeat(400)).substring(0, 1998) + "\n\n";
        String text = paragraph.repeat(50);
        assertThat(text).hasSize(100_000);

        List<String> chunks = chunker.chunk(text, 30_000);

        assertThat(chunks).extracting(String::length).containsExactly(30_000, 30_000, 30_000, 10_000);
        assertThat(chunks.subList(0, 3)).allSatisfy(chunk -> assertThat(chunk).endsWith("\n\n"));
        assertThat(String.join("", chunks)).isEqualTo(text);
    }
}
