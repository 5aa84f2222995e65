package ai.longdoc.translator.pipeline;

import ai.longdoc.translator.codec.DecodeException;
import ai.longdoc.translator.config.ConfigurationException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads the source document named by a session: a local path or a {@code file:} URI.
 */
public class SourceDocumentLoader {

    public record SourceDocument(String name, byte[] bytes) {

        public SourceDocument {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(bytes, "bytes");
        }
    }

    public SourceDocument load(String source) {
        if (source == null || source.isBlank()) {
            throw new ConfigurationException("A source document must be provided");
        }
        Path path = toPath(source.strip());
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Source document not found: " + path);
        }
        try {
            return new SourceDocument(path.getFileName().toString(), Files.readAllBytes(path));
        } catch (IOException ex) {
            throw new DecodeException("Failed to read source document " + path, ex);
        }
    }

    private Path toPath(String source) {
        try {
            int colon = source.indexOf(':');
            if (colon > 1) {
                String scheme = source.substring(0, colon).toLowerCase(Locale.ROOT);
                if (scheme.equals("file")) {
                    return Path.of(URI.create(source));
                }
                if (scheme.matches("[a-z][a-z0-9+.-]*") && source.startsWith("//", colon + 1)) {
                    throw new ConfigurationException("Unsupported source scheme '" + scheme + "' in " + source);
                }
            }
            return Path.of(source);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Invalid source reference: " + source, ex);
        }
    }
}
