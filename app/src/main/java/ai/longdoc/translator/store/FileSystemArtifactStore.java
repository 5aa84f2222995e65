package ai.longdoc.translator.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Artifact store rooted at a local directory; keys map to relative file paths.
 */
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemArtifactStore.class);
    private static final String TEMP_SUFFIX = ".partial";

    private final Path root;

    public FileSystemArtifactStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public ArtifactLocator put(String key, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        Path target = resolve(key);
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            Files.createDirectories(target.getParent());
            Files.write(temp, bytes);
            moveIntoPlace(temp, target);
        } catch (IOException ex) {
            throw new ArtifactStoreException("Failed to write artifact " + key, ex);
        }
        LOGGER.debug("Stored {} ({} bytes)", key, bytes.length);
        return locate(key);
    }

    @Override
    public byte[] get(ArtifactLocator locator) {
        Path path = resolve(locator.key());
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new ArtifactStoreException("Failed to read artifact " + locator.key(), ex);
        }
    }

    @Override
    public List<ArtifactLocator> listByPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(this::keyOf)
                    .filter(key -> key.startsWith(prefix) && !key.endsWith(TEMP_SUFFIX))
                    .sorted()
                    .map(this::locate)
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new ArtifactStoreException("Failed to list artifacts under " + prefix, ex);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public ArtifactLocator locate(String key) {
        return new ArtifactLocator(key, resolve(key).toUri());
    }

    private Path resolve(String key) {
        ArtifactKeys.requireValidKey(key);
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("key escapes the store root: " + key);
        }
        return resolved;
    }

    private String keyOf(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.debug("Atomic move unsupported for {}; falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
