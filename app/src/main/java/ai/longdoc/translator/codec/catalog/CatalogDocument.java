package ai.longdoc.translator.codec.catalog;

import ai.longdoc.translator.codec.DocumentMetadata;
import java.util.List;
import java.util.Optional;

/**
 * Parsed gettext catalog: the optional header entry and the regular entries in file order.
 */
public record CatalogDocument(Optional<CatalogEntry> header, List<CatalogEntry> entries) implements DocumentMetadata {

    public CatalogDocument {
        header = header == null ? Optional.empty() : header;
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public CatalogStatistics statistics() {
        return CatalogStatistics.of(entries);
    }
}
