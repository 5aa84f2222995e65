package ai.longdoc.translator.codec.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the translations found in a translated projection back onto the original catalog entries.
 */
public class CatalogReassembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogReassembler.class);
    private static final Pattern PLURAL_FORM_PATTERN = Pattern.compile("^\\s*\\[Plural form (\\d+)]:\\s*(.*)$");

    public CatalogDocument reassemble(CatalogDocument original, String translatedProjection) {
        List<CatalogEntry> entries = new ArrayList<>(original.entries());
        Map<CatalogKey, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            positions.put(entries.get(i).key(), i);
        }

        int matched = 0;
        List<TranslatedBlock> blocks = readBlocks(translatedProjection);
        for (TranslatedBlock block : blocks) {
            Integer position = positions.get(block.key());
            if (position == null) {
                LOGGER.debug("No catalog entry matches translated block {}", block.key());
                continue;
            }
            CatalogEntry entry = entries.get(position);
            if (entry.isPlural() && !block.pluralTranslations().isEmpty()) {
                entries.set(position, entry.withPluralTranslations(block.pluralTranslations()));
            } else if (!entry.isPlural()) {
                entries.set(position, entry.withTranslation(block.translation()));
            } else {
                continue;
            }
            matched++;
        }
        LOGGER.info("Applied {} of {} translated blocks to {} catalog entries", matched, blocks.size(), entries.size());
        return new CatalogDocument(original.header(), entries);
    }

    /**
     * Parses every separator-delimited block of a projection; the text before the first separator is ignored.
     */
    List<TranslatedBlock> readBlocks(String projection) {
        String[] parts = projection.split(Pattern.quote(CatalogRenderer.ENTRY_SEPARATOR), -1);
        List<TranslatedBlock> blocks = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            if (!parts[i].isBlank()) {
                blocks.add(readBlock(parts[i].strip()));
            }
        }
        return blocks;
    }

    private TranslatedBlock readBlock(String block) {
        String context = null;
        StringBuilder id = new StringBuilder();
        StringBuilder translation = new StringBuilder();
        Map<Integer, String> plural = new TreeMap<>();
        Section section = Section.NONE;

        for (String line : block.split("\n")) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                continue;
            }
            if (stripped.startsWith("[Entry")) {
                section = Section.NONE;
            } else if (stripped.startsWith(CatalogRenderer.CONTEXT_LABEL)) {
                context = stripped.substring(CatalogRenderer.CONTEXT_LABEL.length()).strip();
                section = Section.NONE;
            } else if (stripped.equals(CatalogRenderer.ORIGINAL_LABEL)) {
                section = Section.ID;
            } else if (stripped.equals(CatalogRenderer.PLURAL_LABEL)) {
                section = Section.ID_PLURAL;
            } else if (stripped.equals(CatalogRenderer.TRANSLATION_LABEL)) {
                section = Section.TRANSLATION;
            } else if (stripped.startsWith(CatalogRenderer.PREVIOUS_ID_LABEL)) {
                section = Section.NONE;
            } else if (section == Section.ID) {
                id.append(line).append('\n');
            } else if (section == Section.TRANSLATION) {
                Matcher form = PLURAL_FORM_PATTERN.matcher(line);
                if (form.matches()) {
                    plural.put(Integer.parseInt(form.group(1)), notTranslatedAsEmpty(form.group(2)));
                } else {
                    translation.append(line).append('\n');
                }
            }
        }
        return new TranslatedBlock(new CatalogKey(Optional.ofNullable(context), id.toString().strip()),
                notTranslatedAsEmpty(translation.toString().strip()), plural);
    }

    private static String notTranslatedAsEmpty(String value) {
        return CatalogRenderer.NOT_TRANSLATED.equals(value) ? "" : value;
    }

    private enum Section {
        NONE,
        ID,
        ID_PLURAL,
        TRANSLATION
    }

    record TranslatedBlock(CatalogKey key, String translation, Map<Integer, String> pluralTranslations) {
    }
}
