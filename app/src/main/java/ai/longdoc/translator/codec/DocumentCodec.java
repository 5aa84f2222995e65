package ai.longdoc.translator.codec;

/**
 * Converts between a document's stored bytes and the normalized text the pipeline chunks.
 */
public interface DocumentCodec {

    DocumentFormat format();

    DocumentContent decode(byte[] bytes, String sourceName);

    /**
     * Whether the concatenated translation must be passed through {@link #encode} to rebuild the original structure.
     */
    default boolean requiresStructuralReassembly() {
        return false;
    }

    EncodedDocument encode(String translatedText, DocumentContent original);
}
