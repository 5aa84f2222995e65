package ai.longdoc.translator.store;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * Artifact store kept in memory, used for tests and dry runs.
 */
public class InMemoryArtifactStore implements ArtifactStore {

    private static final String SCHEME = "memory";

    private final NavigableMap<String, byte[]> artifacts = new ConcurrentSkipListMap<>();

    @Override
    public ArtifactLocator put(String key, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        ArtifactLocator locator = locate(key);
        artifacts.put(key, bytes.clone());
        return locator;
    }

    @Override
    public byte[] get(ArtifactLocator locator) {
        byte[] bytes = artifacts.get(locator.key());
        if (bytes == null) {
            throw new ArtifactStoreException("Artifact not found: " + locator.key(), null);
        }
        return bytes.clone();
    }

    @Override
    public List<ArtifactLocator> listByPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return artifacts.tailMap(prefix, true).keySet().stream()
                .takeWhile(key -> key.startsWith(prefix))
                .map(this::locate)
                .collect(Collectors.toList());
    }

    @Override
    public boolean exists(String key) {
        return artifacts.containsKey(key);
    }

    @Override
    public ArtifactLocator locate(String key) {
        ArtifactKeys.requireValidKey(key);
        try {
            return new ArtifactLocator(key, new URI(SCHEME, "/" + key, null));
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("key cannot be expressed as a URI: " + key, ex);
        }
    }

    public int size() {
        return artifacts.size();
    }
}
