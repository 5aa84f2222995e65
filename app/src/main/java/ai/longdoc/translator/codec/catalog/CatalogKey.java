package ai.longdoc.translator.codec.catalog;

import java.util.Objects;
import java.util.Optional;

/**
 * Lookup key of a catalog entry: optional message context plus message id.
 */
public record CatalogKey(Optional<String> context, String id) {

    public CatalogKey {
        context = context == null ? Optional.empty() : context;
        Objects.requireNonNull(id, "id");
    }
}
