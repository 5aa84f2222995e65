package ai.longdoc.translator.codec.catalog;

import java.util.List;

/**
 * Entry counts over the regular (non-header) entries of a catalog.
 */
public record CatalogStatistics(int total, int translated, int fuzzy, int untranslated, int obsolete) {

    public static CatalogStatistics of(List<CatalogEntry> entries) {
        int translated = 0;
        int fuzzy = 0;
        int untranslated = 0;
        int obsolete = 0;
        for (CatalogEntry entry : entries) {
            if (entry.hasTranslation() && !entry.isFuzzy()) {
                translated++;
            }
            if (entry.isFuzzy()) {
                fuzzy++;
            }
            if (!entry.hasTranslation()) {
                untranslated++;
            }
            if (entry.obsolete()) {
                obsolete++;
            }
        }
        return new CatalogStatistics(entries.size(), translated, fuzzy, untranslated, obsolete);
    }

    /**
     * Percentage of translated entries, zero for an empty catalog.
     */
    public double completion() {
        return total == 0 ? 0.0 : translated * 100.0 / total;
    }
}
