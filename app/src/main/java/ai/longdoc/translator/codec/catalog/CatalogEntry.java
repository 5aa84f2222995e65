package ai.longdoc.translator.codec.catalog;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One gettext message with its comments, flags and translations.
 */
public record CatalogEntry(
        Optional<String> context,
        String id,
        Optional<String> idPlural,
        String translation,
        SortedMap<Integer, String> pluralTranslations,
        List<String> flags,
        List<String> translatorComments,
        List<String> extractedComments,
        List<String> references,
        Optional<String> previousId,
        boolean obsolete
) {

    private static final String FUZZY_FLAG = "fuzzy";

    public CatalogEntry {
        context = context == null ? Optional.empty() : context;
        Objects.requireNonNull(id, "id");
        idPlural = idPlural == null ? Optional.empty() : idPlural;
        translation = translation == null ? "" : translation;
        pluralTranslations = pluralTranslations == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(pluralTranslations));
        flags = flags == null ? List.of() : List.copyOf(flags);
        translatorComments = translatorComments == null ? List.of() : List.copyOf(translatorComments);
        extractedComments = extractedComments == null ? List.of() : List.copyOf(extractedComments);
        references = references == null ? List.of() : List.copyOf(references);
        previousId = previousId == null ? Optional.empty() : previousId;
    }

    public static CatalogEntry simple(String id, String translation) {
        return new CatalogEntry(Optional.empty(), id, Optional.empty(), translation, null, null, null, null, null, Optional.empty(), false);
    }

    public CatalogKey key() {
        return new CatalogKey(context, id);
    }

    public boolean isHeader() {
        return id.isEmpty() && !obsolete;
    }

    public boolean isFuzzy() {
        return flags.contains(FUZZY_FLAG);
    }

    public boolean isPlural() {
        return idPlural.isPresent();
    }

    public boolean hasTranslation() {
        if (!pluralTranslations.isEmpty()) {
            return pluralTranslations.values().stream().anyMatch(value -> !value.isBlank());
        }
        return !translation.isBlank();
    }

    public CatalogEntryStatus status() {
        if (obsolete) {
            return CatalogEntryStatus.OBSOLETE;
        }
        if (isFuzzy()) {
            return CatalogEntryStatus.FUZZY;
        }
        return hasTranslation() ? CatalogEntryStatus.TRANSLATED : CatalogEntryStatus.UNTRANSLATED;
    }

    public CatalogEntry withTranslation(String value) {
        return new CatalogEntry(context, id, idPlural, value, pluralTranslations, flags, translatorComments,
                extractedComments, references, previousId, obsolete);
    }

    public CatalogEntry withPluralTranslations(Map<Integer, String> values) {
        return new CatalogEntry(context, id, idPlural, translation, new TreeMap<>(values), flags, translatorComments,
                extractedComments, references, previousId, obsolete);
    }
}
