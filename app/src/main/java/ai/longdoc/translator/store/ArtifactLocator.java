package ai.longdoc.translator.store;

import java.net.URI;
import java.util.Objects;

/**
 * Points at a stored artifact: its store key and a backend specific URI.
 */
public record ArtifactLocator(String key, URI uri) {

    public ArtifactLocator {
        ArtifactKeys.requireValidKey(key);
        Objects.requireNonNull(uri, "uri");
    }

    /**
     * Last path segment of the key.
     */
    public String name() {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }
}
