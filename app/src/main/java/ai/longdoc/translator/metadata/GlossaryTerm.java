package ai.longdoc.translator.metadata;

/**
 * How a source term is used and the translation it should receive.
 */
public record GlossaryTerm(String context, String suggestedTranslation) {

    public GlossaryTerm {
        context = context == null ? "" : context.strip();
        suggestedTranslation = suggestedTranslation == null ? "" : suggestedTranslation.strip();
    }
}
