package ai.longdoc.translator.codec.catalog;

/**
 * Display status of a catalog entry, in the precedence used when several apply.
 */
public enum CatalogEntryStatus {
    OBSOLETE,
    FUZZY,
    TRANSLATED,
    UNTRANSLATED
}
