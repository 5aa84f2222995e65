package ai.longdoc.translator.codec.catalog;

/**
 * Filters applied when a catalog is rendered into its plain-text projection.
 */
public record CatalogRenderOptions(
        boolean includeUntranslated,
        boolean includeFuzzy,
        boolean includeObsolete,
        boolean includeMetadata,
        boolean includeComments
) {

    public static CatalogRenderOptions defaults() {
        return new CatalogRenderOptions(true, true, false, true, false);
    }

    public CatalogRenderOptions withIncludeFuzzy(boolean value) {
        return new CatalogRenderOptions(includeUntranslated, value, includeObsolete, includeMetadata, includeComments);
    }

    public CatalogRenderOptions withIncludeObsolete(boolean value) {
        return new CatalogRenderOptions(includeUntranslated, includeFuzzy, value, includeMetadata, includeComments);
    }

    public CatalogRenderOptions withIncludeComments(boolean value) {
        return new CatalogRenderOptions(includeUntranslated, includeFuzzy, includeObsolete, includeMetadata, value);
    }
}
