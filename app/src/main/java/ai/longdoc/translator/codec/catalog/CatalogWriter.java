package ai.longdoc.translator.codec.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serializes a catalog back into gettext {@code .po} syntax.
 */
public class CatalogWriter {

    private static final String OBSOLETE_PREFIX = "#~ ";

    public String write(CatalogDocument document) {
        List<String> blocks = new ArrayList<>();
        document.header().ifPresent(header -> blocks.add(writeEntry(header)));
        for (CatalogEntry entry : document.entries()) {
            blocks.add(writeEntry(entry));
        }
        return String.join("\n", blocks);
    }

    private String writeEntry(CatalogEntry entry) {
        StringBuilder out = new StringBuilder();
        entry.translatorComments().forEach(comment -> out.append("# ").append(comment).append('\n'));
        entry.extractedComments().forEach(comment -> out.append("#. ").append(comment).append('\n'));
        entry.references().forEach(reference -> out.append("#: ").append(reference).append('\n'));
        if (!entry.flags().isEmpty()) {
            out.append("#, ").append(String.join(", ", entry.flags())).append('\n');
        }
        entry.previousId().ifPresent(previous -> out.append("#| msgid \"").append(escape(previous)).append("\"\n"));

        String prefix = entry.obsolete() ? OBSOLETE_PREFIX : "";
        entry.context().ifPresent(context -> appendString(out, prefix, "msgctxt", context));
        appendString(out, prefix, "msgid", entry.id());
        entry.idPlural().ifPresent(plural -> appendString(out, prefix, "msgid_plural", plural));
        if (entry.isPlural() || !entry.pluralTranslations().isEmpty()) {
            for (Map.Entry<Integer, String> form : entry.pluralTranslations().entrySet()) {
                appendString(out, prefix, "msgstr[" + form.getKey() + "]", form.getValue());
            }
            if (entry.pluralTranslations().isEmpty()) {
                appendString(out, prefix, "msgstr[0]", "");
            }
        } else {
            appendString(out, prefix, "msgstr", entry.translation());
        }
        return out.toString();
    }

    private void appendString(StringBuilder out, String prefix, String keyword, String value) {
        List<String> segments = splitAfterNewlines(value);
        if (segments.size() <= 1) {
            out.append(prefix).append(keyword).append(" \"").append(escape(value)).append("\"\n");
            return;
        }
        out.append(prefix).append(keyword).append(" \"\"\n");
        for (String segment : segments) {
            out.append(prefix).append('"').append(escape(segment)).append("\"\n");
        }
    }

    private static List<String> splitAfterNewlines(String value) {
        List<String> segments = new ArrayList<>();
        int start = 0;
        int newline;
        while ((newline = value.indexOf('\n', start)) >= 0) {
            segments.add(value.substring(start, newline + 1));
            start = newline + 1;
        }
        if (start < value.length()) {
            segments.add(value.substring(start));
        }
        return segments;
    }

    static String escape(String value) {
        StringBuilder builder = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> builder.append("\\\\");
                case '"' -> builder.append("\\\"");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> builder.append(ch);
            }
        }
        return builder.toString();
    }
}
