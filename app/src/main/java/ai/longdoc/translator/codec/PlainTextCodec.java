package ai.longdoc.translator.codec;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Plain text documents. The concatenated translation is already the final document.
 */
public class PlainTextCodec implements DocumentCodec {

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PLAIN;
    }

    @Override
    public DocumentContent decode(byte[] bytes, String sourceName) {
        return new DocumentContent(TextDecoding.decode(bytes, sourceName), DocumentFormat.PLAIN, sourceName, Optional.empty());
    }

    @Override
    public EncodedDocument encode(String translatedText, DocumentContent original) {
        return new EncodedDocument(original.baseName(), translatedText.getBytes(StandardCharsets.UTF_8));
    }
}
