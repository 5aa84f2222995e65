package ai.longdoc.translator.codec;

import ai.longdoc.translator.codec.catalog.CatalogCodec;
import ai.longdoc.translator.codec.ebook.EbookCodec;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the codec responsible for a document format.
 */
public class CodecRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(CodecRegistry.class);

    private final Map<DocumentFormat, DocumentCodec> codecs;

    public CodecRegistry(List<DocumentCodec> codecs) {
        Objects.requireNonNull(codecs, "codecs");
        Map<DocumentFormat, DocumentCodec> registered = new EnumMap<>(DocumentFormat.class);
        for (DocumentCodec codec : codecs) {
            DocumentCodec previous = registered.put(codec.format(), codec);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate codec registered for " + codec.format());
            }
        }
        this.codecs = Collections.unmodifiableMap(registered);
    }

    public static CodecRegistry defaults() {
        return new CodecRegistry(List.of(new PlainTextCodec(), new CatalogCodec(), new EbookCodec()));
    }

    public DocumentCodec codecFor(DocumentFormat format) {
        DocumentCodec codec = codecs.get(Objects.requireNonNull(format, "format"));
        if (codec == null) {
            throw new DecodeException("No codec registered for format " + format);
        }
        return codec;
    }

    public DocumentFormat resolveFormat(Optional<DocumentFormat> declared, String sourceName) {
        return declared.orElseGet(() -> DocumentFormat.fromFileName(sourceName));
    }

    public DocumentContent decode(byte[] bytes, String sourceName, Optional<DocumentFormat> declared) {
        Objects.requireNonNull(bytes, "bytes");
        DocumentFormat format = resolveFormat(declared == null ? Optional.empty() : declared, sourceName);
        LOGGER.info("Decoding {} ({} bytes) as {}", sourceName, bytes.length, format);
        return codecFor(format).decode(bytes, sourceName);
    }
}
