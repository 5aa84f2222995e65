package ai.longdoc.translator.store;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Durable key to bytes storage for pipeline artifacts.
 *
 * <p>Writes overwrite any previous value under the same key. Listing returns locators sorted
 * lexicographically by key.
 */
public interface ArtifactStore {

    ArtifactLocator put(String key, byte[] bytes);

    default ArtifactLocator put(String key, String text) {
        return put(key, text.getBytes(StandardCharsets.UTF_8));
    }

    byte[] get(ArtifactLocator locator);

    default String getText(ArtifactLocator locator) {
        return new String(get(locator), StandardCharsets.UTF_8);
    }

    List<ArtifactLocator> listByPrefix(String prefix);

    boolean exists(String key);

    /**
     * Locator for a key whether or not the artifact has been written yet.
     */
    ArtifactLocator locate(String key);
}
