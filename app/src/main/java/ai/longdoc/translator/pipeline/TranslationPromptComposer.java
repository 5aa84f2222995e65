package ai.longdoc.translator.pipeline;

import ai.longdoc.translator.chunk.Chunk;
import ai.longdoc.translator.codec.DocumentFormat;
import ai.longdoc.translator.metadata.GlossaryMetadata;
import ai.longdoc.translator.metadata.GlossaryTerm;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the translation prompt of a chunk from the shared glossary and style guide.
 */
public class TranslationPromptComposer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    static final String TEMPLATE = """
            # Translation Task

            **Objective:** Translate the source content below into {target_language}, keeping its original format.
            **Constraints:** Follow the Entity Dictionary and the Style Guide strictly.

            ## 1. Context & Guidelines
            {format_instructions}
            This is part {index} of {total} of a longer document. Translate only this part; do not add or drop text at its edges.

            ## 2. Style Guide
            {style}

            ## 3. Entity Dictionary (Strict Adherence Required)
            *Use these exact translations for the following terms:*
            {entities}

            ## 4. Source Content
            ---
            {chunk}
            ---

            **Output:** Return ONLY the translated text. Preserve the original format exactly. Do not include a preamble or explanations.
            """;

    private static final Map<DocumentFormat, String> FORMAT_INSTRUCTIONS = new EnumMap<>(Map.of(
            DocumentFormat.PLAIN,
            "Plain text document. Keep the paragraph structure and line breaks.",
            DocumentFormat.CATALOG,
            "Rendered gettext (.po) catalog. Keep every separator line, every [Entry n] header and the Context:, "
                    + "Original: and Plural: sections unchanged, including their text. Translate only the text under "
                    + "Translation:, replacing (not translated) with a translation of the original.",
            DocumentFormat.EBOOK,
            "EPUB book content in HTML. Preserve ALL HTML tags, attributes and structure. Do not escape HTML entities. "
                    + "Keep formatting tags such as <p>, <h1>, <div>, <em> and <strong>."));

    public TranslationRequest compose(Chunk chunk, int total, String targetLanguage, DocumentFormat format,
                                      GlossaryMetadata metadata) {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(metadata, "metadata");
        Map<String, String> values = Map.of(
                "target_language", targetLanguage,
                "format_instructions", FORMAT_INSTRUCTIONS.get(format),
                "index", Integer.toString(chunk.index()),
                "total", Integer.toString(total),
                "style", metadata.styleGuide().strip(),
                "entities", renderEntities(metadata),
                "chunk", chunk.text());
        return new TranslationRequest(chunk.index(), total, fill(TEMPLATE, values));
    }

    static String renderEntities(GlossaryMetadata metadata) {
        if (metadata.terms().isEmpty()) {
            return metadata.entityText().strip();
        }
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<String, GlossaryTerm> entry : metadata.terms().entrySet()) {
            GlossaryTerm term = entry.getValue();
            builder.append("- ").append(entry.getKey()).append(" => ").append(term.suggestedTranslation());
            if (!term.context().isEmpty()) {
                builder.append(" (").append(term.context()).append(')');
            }
            builder.append('\n');
        }
        return builder.toString().stripTrailing();
    }

    /**
     * Single pass substitution, so placeholder-like text inside values is left alone.
     */
    static String fill(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 1024);
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
