package ai.longdoc.translator.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.longdoc.translator.config.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceDocumentLoaderTest {

    @TempDir
    Path directory;

    private final SourceDocumentLoader loader = new SourceDocumentLoader();

    @Test
    void loadsPathsAndFileUris() throws IOException {
        Path file = Files.writeString(directory.resolve("story.txt"), "once upon a time");

        assertThat(loader.load(file.toString()).name()).isEqualTo("story.txt");
        assertThat(loader.load(file.toUri().toString()).bytes()).isEqualTo("once upon a time".getBytes());
    }

    @Test
    void rejectsMissingBlankAndRemoteSources() {
        assertThatThrownBy(() -> loader.load(" ")).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> loader.load(directory.resolve("absent.txt").toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> loader.load("gs://bucket/book.epub"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("gs");
    }

    @Test
    void rejectsMalformedFileUris() {
        assertThatThrownBy(() -> loader.load("file:///books/a story.txt"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid source reference");
        assertThatThrownBy(() -> loader.load("file:relative/story.txt"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid source reference");
    }
}
