package ai.longdoc.translator.codec;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class PlainTextCodecTest {

    private final PlainTextCodec codec = new PlainTextCodec();

    @Test
    void decodesUtf8Text() {
        DocumentContent content = codec.decode("Grüße\nzweite Zeile".getBytes(StandardCharsets.UTF_8), "greeting.txt");

        assertThat(content.text()).isEqualTo("Grüße\nzweite Zeile");
        assertThat(content.metadata()).isEmpty();
        assertThat(codec.requiresStructuralReassembly()).isFalse();
    }

    @Test
    void fallsBackToLatin1ForInvalidUtf8() {
        byte[] latin1 = "café".getBytes(StandardCharsets.ISO_8859_1);

        assertThat(codec.decode(latin1, "menu.txt").text()).isEqualTo("café");
    }

    @Test
    void encodesUnderSourceName() {
        DocumentContent original = codec.decode("x".getBytes(StandardCharsets.UTF_8), "docs/readme.txt");

        EncodedDocument encoded = codec.encode("übersetzt", original);

        assertThat(encoded.name()).isEqualTo("readme.txt");
        assertThat(new String(encoded.bytes(), StandardCharsets.UTF_8)).isEqualTo("übersetzt");
    }
}
