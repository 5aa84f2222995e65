package ai.longdoc.translator.codec.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a catalog into the plain-text projection that is chunked and translated.
 *
 * <p>Every rendered entry starts with {@link #ENTRY_SEPARATOR}; {@link CatalogReassembler}
 * relies on the same separator and section labels to read a translated projection back.
 */
public class CatalogRenderer {

    public static final String ENTRY_SEPARATOR = "-".repeat(80);
    static final String SECTION_RULE = "=".repeat(80);
    static final String CONTEXT_LABEL = "Context:";
    static final String ORIGINAL_LABEL = "Original:";
    static final String PLURAL_LABEL = "Plural:";
    static final String TRANSLATION_LABEL = "Translation:";
    static final String FLAGS_LABEL = "Flags:";
    static final String PREVIOUS_ID_LABEL = "Previous msgid:";
    static final String NOT_TRANSLATED = "(not translated)";

    public String render(CatalogDocument document, CatalogRenderOptions options) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(options, "options");
        List<String> lines = new ArrayList<>();

        if (options.includeMetadata() && document.header().isPresent()) {
            appendSectionTitle(lines, "METADATA");
            for (String headerLine : document.header().get().translation().split("\n")) {
                if (!headerLine.isBlank()) {
                    lines.add(headerLine);
                }
            }
            lines.add("");
        }

        CatalogStatistics statistics = document.statistics();
        appendSectionTitle(lines, "STATISTICS");
        lines.add("Total Entries: " + statistics.total());
        lines.add("Translated: " + statistics.translated());
        lines.add("Fuzzy: " + statistics.fuzzy());
        lines.add("Untranslated: " + statistics.untranslated());
        if (statistics.obsolete() > 0) {
            lines.add("Obsolete: " + statistics.obsolete());
        }
        if (statistics.total() > 0) {
            lines.add(String.format(Locale.ROOT, "Completion: %.1f%%", statistics.completion()));
        }
        lines.add("");
        appendSectionTitle(lines, "ENTRIES");
        lines.add("");

        List<CatalogEntry> entries = document.entries();
        for (int i = 0; i < entries.size(); i++) {
            CatalogEntry entry = entries.get(i);
            if (isIncluded(entry, options)) {
                appendEntry(lines, i + 1, entry, options);
            }
        }
        return String.join("\n", lines);
    }

    private boolean isIncluded(CatalogEntry entry, CatalogRenderOptions options) {
        if (entry.obsolete() && !options.includeObsolete()) {
            return false;
        }
        if (entry.isFuzzy() && !options.includeFuzzy()) {
            return false;
        }
        return entry.hasTranslation() || options.includeUntranslated();
    }

    private void appendEntry(List<String> lines, int number, CatalogEntry entry, CatalogRenderOptions options) {
        lines.add(ENTRY_SEPARATOR);
        lines.add("[Entry " + number + "] [" + entry.status().name() + "]");
        lines.add("");

        if (options.includeComments() && !entry.flags().isEmpty()) {
            lines.add(FLAGS_LABEL + " " + String.join(", ", entry.flags()));
            lines.add("");
        }
        entry.context().filter(value -> !value.isEmpty()).ifPresent(value -> {
            lines.add(CONTEXT_LABEL + " " + value);
            lines.add("");
        });
        if (options.includeComments()) {
            entry.translatorComments().forEach(comment -> lines.add("# " + comment));
            entry.extractedComments().forEach(comment -> lines.add("#. " + comment));
            entry.references().forEach(reference -> lines.add("#: " + reference));
            if (!entry.translatorComments().isEmpty() || !entry.extractedComments().isEmpty() || !entry.references().isEmpty()) {
                lines.add("");
            }
        }

        lines.add(ORIGINAL_LABEL);
        lines.add(entry.id());
        lines.add("");
        entry.idPlural().filter(value -> !value.isEmpty()).ifPresent(value -> {
            lines.add(PLURAL_LABEL);
            lines.add(value);
            lines.add("");
        });

        lines.add(TRANSLATION_LABEL);
        if (!entry.pluralTranslations().isEmpty()) {
            for (Map.Entry<Integer, String> form : entry.pluralTranslations().entrySet()) {
                lines.add("  [Plural form " + form.getKey() + "]: " + displayValue(form.getValue()));
            }
        } else {
            lines.add(displayValue(entry.translation()));
        }
        lines.add("");

        if (options.includeComments() && entry.previousId().isPresent()) {
            lines.add(PREVIOUS_ID_LABEL + " " + entry.previousId().get());
            lines.add("");
        }
    }

    private void appendSectionTitle(List<String> lines, String title) {
        lines.add(SECTION_RULE);
        lines.add(title);
        lines.add(SECTION_RULE);
    }

    private static String displayValue(String value) {
        return value.isBlank() ? NOT_TRANSLATED : value;
    }
}
