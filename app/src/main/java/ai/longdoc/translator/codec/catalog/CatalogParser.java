package ai.longdoc.translator.codec.catalog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line oriented parser for gettext {@code .po} catalogs.
 */
public class CatalogParser {

    private static final Pattern KEYWORD_PATTERN = Pattern.compile("^(msgctxt|msgid_plural|msgid|msgstr)\\s+\"(.*)\"\\s*$");
    private static final Pattern PLURAL_STRING_PATTERN = Pattern.compile("^msgstr\\[(\\d+)]\\s+\"(.*)\"\\s*$");
    private static final Pattern CONTINUATION_PATTERN = Pattern.compile("^\"(.*)\"\\s*$");
    private static final Pattern PREVIOUS_ID_PATTERN = Pattern.compile("^#\\|\\s+msgid\\s+\"(.*)\"\\s*$");

    public CatalogDocument parse(String content) {
        List<CatalogEntry> parsed = new ArrayList<>();
        EntryBuilder current = new EntryBuilder();
        for (String rawLine : content.split("\\r?\\n", -1)) {
            String line = rawLine;
            if (line.isBlank()) {
                if (current.hasField()) {
                    parsed.add(current.build());
                    current = new EntryBuilder();
                }
                continue;
            }
            if (line.startsWith("#.")) {
                current.extractedComments.add(line.substring(2).strip());
                continue;
            }
            if (line.startsWith("#:")) {
                current.references.add(line.substring(2).strip());
                continue;
            }
            if (line.startsWith("#,")) {
                Arrays.stream(line.substring(2).split(","))
                        .map(String::strip)
                        .filter(flag -> !flag.isEmpty())
                        .forEach(current.flags::add);
                continue;
            }
            if (line.startsWith("#|")) {
                Matcher previous = PREVIOUS_ID_PATTERN.matcher(line);
                if (previous.matches()) {
                    current.previousId = unescape(previous.group(1));
                }
                continue;
            }
            if (line.startsWith("#~")) {
                current.obsolete = true;
                line = line.substring(2).strip();
            } else if (line.startsWith("#")) {
                if (line.startsWith("# ")) {
                    current.translatorComments.add(line.substring(2).strip());
                }
                continue;
            }
            applyValueLine(current, line.strip());
        }
        if (current.hasField()) {
            parsed.add(current.build());
        }
        return split(parsed);
    }

    private void applyValueLine(EntryBuilder entry, String line) {
        Matcher plural = PLURAL_STRING_PATTERN.matcher(line);
        if (plural.matches()) {
            int index = Integer.parseInt(plural.group(1));
            entry.pluralTranslations.put(index, unescape(plural.group(2)));
            entry.field = Field.PLURAL_TRANSLATION;
            entry.pluralIndex = index;
            return;
        }
        Matcher keyword = KEYWORD_PATTERN.matcher(line);
        if (keyword.matches()) {
            String value = unescape(keyword.group(2));
            switch (keyword.group(1)) {
                case "msgctxt" -> {
                    entry.context = value;
                    entry.field = Field.CONTEXT;
                }
                case "msgid" -> {
                    entry.id = value;
                    entry.field = Field.ID;
                }
                case "msgid_plural" -> {
                    entry.idPlural = value;
                    entry.field = Field.ID_PLURAL;
                }
                default -> {
                    entry.translation = value;
                    entry.field = Field.TRANSLATION;
                }
            }
            return;
        }
        Matcher continuation = CONTINUATION_PATTERN.matcher(line);
        if (continuation.matches() && entry.field != null) {
            entry.append(unescape(continuation.group(1)));
        }
    }

    private CatalogDocument split(List<CatalogEntry> parsed) {
        CatalogEntry header = null;
        List<CatalogEntry> regular = new ArrayList<>();
        for (CatalogEntry entry : parsed) {
            if (header == null && entry.isHeader()) {
                header = entry;
            } else {
                regular.add(entry);
            }
        }
        return new CatalogDocument(Optional.ofNullable(header), regular);
    }

    static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder builder = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch != '\\' || i + 1 == value.length()) {
                builder.append(ch);
                continue;
            }
            char next = value.charAt(++i);
            switch (next) {
                case 'n' -> builder.append('\n');
                case 't' -> builder.append('\t');
                case 'r' -> builder.append('\r');
                case '"' -> builder.append('"');
                case '\\' -> builder.append('\\');
                default -> builder.append('\\').append(next);
            }
        }
        return builder.toString();
    }

    private enum Field {
        CONTEXT,
        ID,
        ID_PLURAL,
        TRANSLATION,
        PLURAL_TRANSLATION
    }

    private static final class EntryBuilder {
        private String context;
        private String id;
        private String idPlural;
        private String translation = "";
        private final TreeMap<Integer, String> pluralTranslations = new TreeMap<>();
        private final List<String> flags = new ArrayList<>();
        private final List<String> translatorComments = new ArrayList<>();
        private final List<String> extractedComments = new ArrayList<>();
        private final List<String> references = new ArrayList<>();
        private String previousId;
        private boolean obsolete;
        private Field field;
        private int pluralIndex;

        private boolean hasField() {
            return field != null;
        }

        private void append(String value) {
            switch (field) {
                case CONTEXT -> context += value;
                case ID -> id += value;
                case ID_PLURAL -> idPlural += value;
                case TRANSLATION -> translation += value;
                case PLURAL_TRANSLATION -> pluralTranslations.merge(pluralIndex, value, String::concat);
            }
        }

        private CatalogEntry build() {
            return new CatalogEntry(Optional.ofNullable(context), id == null ? "" : id, Optional.ofNullable(idPlural),
                    translation, pluralTranslations, flags, translatorComments, extractedComments, references,
                    Optional.ofNullable(previousId), obsolete);
        }
    }
}
