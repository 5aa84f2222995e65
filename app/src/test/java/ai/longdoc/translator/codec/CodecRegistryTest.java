package ai.longdoc.translator.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CodecRegistryTest {

    private final CodecRegistry registry = CodecRegistry.defaults();

    @Test
    void detectsFormatFromFileExtension() {
        assertThat(registry.resolveFormat(Optional.empty(), "notes.txt")).isEqualTo(DocumentFormat.PLAIN);
        assertThat(registry.resolveFormat(Optional.empty(), "dir/messages.PO")).isEqualTo(DocumentFormat.CATALOG);
        assertThat(registry.resolveFormat(Optional.empty(), "book.epub")).isEqualTo(DocumentFormat.EBOOK);
    }

    @Test
    void declaredFormatWinsOverExtension() {
        assertThat(registry.resolveFormat(Optional.of(DocumentFormat.PLAIN), "messages.po")).isEqualTo(DocumentFormat.PLAIN);
    }

    @Test
    void rejectsUnknownExtension() {
        assertThatThrownBy(() -> registry.decode(new byte[0], "slides.pptx", Optional.empty()))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("slides.pptx");
    }

    @Test
    void rejectsDuplicateRegistration() {
        assertThatThrownBy(() -> new CodecRegistry(List.of(new PlainTextCodec(), new PlainTextCodec())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reportsMissingCodec() {
        CodecRegistry plainOnly = new CodecRegistry(List.of(new PlainTextCodec()));

        assertThatThrownBy(() -> plainOnly.codecFor(DocumentFormat.EBOOK)).isInstanceOf(DecodeException.class);
    }

    @Test
    void decodesThroughResolvedCodec() {
        DocumentContent content = registry.decode("hello".getBytes(StandardCharsets.UTF_8), "a/b/hello.txt", Optional.empty());

        assertThat(content.format()).isEqualTo(DocumentFormat.PLAIN);
        assertThat(content.text()).isEqualTo("hello");
        assertThat(content.baseName()).isEqualTo("hello.txt");
        assertThat(content.stem()).isEqualTo("hello");
    }

    @Test
    void parsesFormatNames() {
        assertThat(DocumentFormat.from("po")).isEqualTo(DocumentFormat.CATALOG);
        assertThat(DocumentFormat.from(" EPUB ")).isEqualTo(DocumentFormat.EBOOK);
        assertThat(DocumentFormat.from("text")).isEqualTo(DocumentFormat.PLAIN);
        assertThatThrownBy(() -> DocumentFormat.from("docx")).isInstanceOf(IllegalArgumentException.class);
    }
}
