package ai.longdoc.translator.codec.catalog;

import ai.longdoc.translator.codec.DocumentCodec;
import ai.longdoc.translator.codec.DocumentContent;
import ai.longdoc.translator.codec.DocumentFormat;
import ai.longdoc.translator.codec.EncodeException;
import ai.longdoc.translator.codec.EncodedDocument;
import ai.longdoc.translator.codec.TextDecoding;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gettext catalogs. Decoding renders the entries into a text projection and keeps the parsed
 * catalog so the translated projection can be written back entry by entry.
 */
public class CatalogCodec implements DocumentCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogCodec.class);
    static final String ASSEMBLED_PREFIX = "assembled_";

    private final CatalogRenderOptions renderOptions;
    private final CatalogParser parser = new CatalogParser();
    private final CatalogRenderer renderer = new CatalogRenderer();
    private final CatalogReassembler reassembler = new CatalogReassembler();
    private final CatalogWriter writer = new CatalogWriter();

    public CatalogCodec() {
        this(CatalogRenderOptions.defaults());
    }

    public CatalogCodec(CatalogRenderOptions renderOptions) {
        this.renderOptions = Objects.requireNonNull(renderOptions, "renderOptions");
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.CATALOG;
    }

    @Override
    public DocumentContent decode(byte[] bytes, String sourceName) {
        CatalogDocument catalog = parser.parse(TextDecoding.decode(bytes, sourceName));
        LOGGER.info("Parsed catalog {} with {} entries", sourceName, catalog.entries().size());
        String projection = renderer.render(catalog, renderOptions);
        return new DocumentContent(projection, DocumentFormat.CATALOG, sourceName, Optional.of(catalog));
    }

    @Override
    public boolean requiresStructuralReassembly() {
        return true;
    }

    @Override
    public EncodedDocument encode(String translatedText, DocumentContent original) {
        CatalogDocument catalog = original.metadataAs(CatalogDocument.class)
                .orElseThrow(() -> new EncodeException("No parsed catalog retained for " + original.sourceName(), null));
        try {
            CatalogDocument translated = reassembler.reassemble(catalog, translatedText);
            byte[] bytes = writer.write(translated).getBytes(StandardCharsets.UTF_8);
            return new EncodedDocument(ASSEMBLED_PREFIX + original.baseName(), bytes);
        } catch (RuntimeException ex) {
            throw new EncodeException("Failed to reassemble catalog " + original.sourceName(), ex);
        }
    }
}
