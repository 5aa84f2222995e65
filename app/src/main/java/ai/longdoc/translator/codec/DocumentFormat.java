package ai.longdoc.translator.codec;

import java.util.Locale;

/**
 * Closed set of document formats understood by the pipeline.
 */
public enum DocumentFormat {
    PLAIN("txt"),
    CATALOG("po"),
    EBOOK("epub");

    private final String extension;

    DocumentFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static DocumentFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Document format must be provided");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "plain", "txt", "text" -> PLAIN;
            case "catalog", "po", "pot", "gettext" -> CATALOG;
            case "ebook", "epub" -> EBOOK;
            default -> throw new IllegalArgumentException("Unsupported document format: " + raw);
        };
    }

    public static DocumentFormat fromFileName(String fileName) {
        if (fileName == null) {
            throw new DecodeException("Cannot detect the format of a document without a name");
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        String extension = dot < 0 ? "" : lower.substring(dot + 1);
        return switch (extension) {
            case "txt", "text" -> PLAIN;
            case "po", "pot" -> CATALOG;
            case "epub" -> EBOOK;
            default -> throw new DecodeException("Unsupported document format for " + fileName);
        };
    }
}
