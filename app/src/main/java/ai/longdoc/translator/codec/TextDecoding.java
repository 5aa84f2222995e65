package ai.longdoc.translator.codec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared byte-to-text decoding for text based formats.
 */
public final class TextDecoding {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextDecoding.class);

    private TextDecoding() {
    }

    /**
     * Decodes strict UTF-8, falling back to ISO-8859-1 which maps every byte.
     */
    public static String decode(byte[] bytes, String sourceName) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            LOGGER.warn("{} is not valid UTF-8 ({}); decoding as ISO-8859-1", sourceName, ex.toString());
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
