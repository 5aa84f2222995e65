package ai.longdoc.translator.store;

import java.util.Locale;

/**
 * Deterministic key layout for the artifacts of one session.
 *
 * <pre>
 * {session}/entity_extraction.txt
 * {session}/style_instructions.txt
 * {session}/original_chunks/original_chunk_0001.txt
 * {session}/prompts_for_translation/translation_prompt_chunk_0001.txt
 * {session}/translated_chunks/translated_chunk_0001.txt
 * {session}/translated_chunks/final_translated_chunk_0001.txt
 * {session}/FINAL_{basename}
 * </pre>
 *
 * <p>Sequences are padded to four digits and widen past 9999, so key order only matches chunk
 * order up to that point.
 */
public final class ArtifactKeys {

    public static final String ENTITY_EXTRACTION = "entity_extraction.txt";
    public static final String STYLE_INSTRUCTIONS = "style_instructions.txt";
    public static final String ORIGINAL_CHUNKS_DIR = "original_chunks";
    public static final String PROMPTS_DIR = "prompts_for_translation";
    public static final String TRANSLATED_CHUNKS_DIR = "translated_chunks";

    static final String PROMPT_PREFIX = "translation_prompt_";
    static final String TRANSLATED_PREFIX = "translated_";
    static final String FINAL_PREFIX = "final_";
    static final String FINAL_DOCUMENT_PREFIX = "FINAL_";

    private final String session;

    public ArtifactKeys(String session) {
        requireValidKey(session);
        if (session.contains("/")) {
            throw new IllegalArgumentException("session must be a single path segment: " + session);
        }
        this.session = session;
    }

    public String session() {
        return session;
    }

    public String sessionPrefix() {
        return session + "/";
    }

    public String entityExtraction() {
        return session + "/" + ENTITY_EXTRACTION;
    }

    public String styleInstructions() {
        return session + "/" + STYLE_INSTRUCTIONS;
    }

    public String originalChunk(int index) {
        return session + "/" + ORIGINAL_CHUNKS_DIR + "/original_chunk_" + sequence(index) + ".txt";
    }

    public String prompt(int index) {
        return session + "/" + PROMPTS_DIR + "/" + PROMPT_PREFIX + "chunk_" + sequence(index) + ".txt";
    }

    public String promptsPrefix() {
        return session + "/" + PROMPTS_DIR + "/" + PROMPT_PREFIX;
    }

    public String translatedChunk(int index) {
        return translatedKeyFor(prompt(index));
    }

    public String translatedPrefix() {
        return session + "/" + TRANSLATED_CHUNKS_DIR + "/" + TRANSLATED_PREFIX;
    }

    public String finalChunk(int index) {
        return finalKeyFor(translatedChunk(index));
    }

    public String finalPrefix() {
        return session + "/" + TRANSLATED_CHUNKS_DIR + "/" + FINAL_PREFIX + TRANSLATED_PREFIX;
    }

    public String finalDocument(String baseName) {
        requireValidKey(baseName);
        return session + "/" + FINAL_DOCUMENT_PREFIX + baseName;
    }

    public String singleton(String name) {
        requireValidKey(name);
        return session + "/" + name;
    }

    /**
     * Derives the translated chunk key from a prompt key by swapping the directory and the
     * {@code translation_prompt_} prefix for {@code translated_}.
     */
    public String translatedKeyFor(String promptKey) {
        String name = fileName(promptKey);
        if (!name.startsWith(PROMPT_PREFIX)) {
            throw new IllegalArgumentException("Not a translation prompt key: " + promptKey);
        }
        return session + "/" + TRANSLATED_CHUNKS_DIR + "/" + TRANSLATED_PREFIX + name.substring(PROMPT_PREFIX.length());
    }

    public String finalKeyFor(String translatedKey) {
        String name = fileName(translatedKey);
        if (!name.startsWith(TRANSLATED_PREFIX)) {
            throw new IllegalArgumentException("Not a translated chunk key: " + translatedKey);
        }
        return session + "/" + TRANSLATED_CHUNKS_DIR + "/" + FINAL_PREFIX + name;
    }

    static String sequence(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("sequence index must be at least 1");
        }
        return String.format(Locale.ROOT, "%04d", index);
    }

    static String fileName(String key) {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }

    static void requireValidKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if (key.startsWith("/") || key.contains("\\")) {
            throw new IllegalArgumentException("key must be a relative path: " + key);
        }
        for (String segment : key.split("/")) {
            if (segment.equals("..") || segment.equals(".")) {
                throw new IllegalArgumentException("key must not contain relative segments: " + key);
            }
        }
    }
}
