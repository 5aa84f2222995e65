package ai.longdoc.translator.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Shared context applied to every chunk: the entity glossary and the style guide.
 *
 * <p>{@code entityText} is kept exactly as supplied or generated; {@code terms} is the structured
 * view of it when it could be parsed, and empty otherwise.
 */
public record GlossaryMetadata(String entityText, String styleGuide, Map<String, GlossaryTerm> terms, MetadataOrigin origin) {

    public GlossaryMetadata {
        entityText = entityText == null ? "" : entityText;
        styleGuide = styleGuide == null ? "" : styleGuide;
        terms = terms == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(terms));
        Objects.requireNonNull(origin, "origin");
    }
}
