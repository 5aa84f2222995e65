package ai.longdoc.translator.codec.ebook;

import ai.longdoc.translator.codec.DocumentMetadata;
import java.util.List;

/**
 * Descriptive data and reading order of a decoded EPUB.
 */
public record EbookMetadata(String title, String author, List<String> contentPaths, List<String> skippedPaths)
        implements DocumentMetadata {

    static final String UNKNOWN = "Unknown";

    public EbookMetadata {
        title = title == null || title.isBlank() ? UNKNOWN : title.strip();
        author = author == null || author.isBlank() ? UNKNOWN : author.strip();
        contentPaths = contentPaths == null ? List.of() : List.copyOf(contentPaths);
        skippedPaths = skippedPaths == null ? List.of() : List.copyOf(skippedPaths);
    }
}
