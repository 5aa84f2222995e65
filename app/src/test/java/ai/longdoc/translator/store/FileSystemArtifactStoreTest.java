package ai.longdoc.translator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemArtifactStoreTest {

    @TempDir
    Path root;

    @Test
    void writesUnderRootAndReadsBack() throws IOException {
        FileSystemArtifactStore store = new FileSystemArtifactStore(root);

        ArtifactLocator locator = store.put("s/original_chunks/original_chunk_0001.txt", "héllo");

        Path file = root.resolve("s/original_chunks/original_chunk_0001.txt");
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("héllo");
        assertThat(locator.uri()).isEqualTo(file.toUri());
        assertThat(store.getText(locator)).isEqualTo("héllo");
        assertThat(store.exists("s/original_chunks/original_chunk_0001.txt")).isTrue();
        assertThat(Files.list(file.getParent())).hasSize(1);
    }

    @Test
    void listsMatchingKeysSortedAndSkipsPartialFiles() throws IOException {
        FileSystemArtifactStore store = new FileSystemArtifactStore(root);
        store.put("s/translated_chunks/translated_chunk_0010.txt", "10");
        store.put("s/translated_chunks/translated_chunk_0002.txt", "2");
        store.put("s/translated_chunks/final_translated_chunk_0002.txt", "f");
        Files.writeString(root.resolve("s/translated_chunks/translated_chunk_0003.txt.partial"), "half");

        assertThat(store.listByPrefix("s/translated_chunks/translated_"))
                .extracting(ArtifactLocator::key)
                .containsExactly("s/translated_chunks/translated_chunk_0002.txt", "s/translated_chunks/translated_chunk_0010.txt");
    }

    @Test
    void listingMissingRootIsEmpty() {
        FileSystemArtifactStore store = new FileSystemArtifactStore(root.resolve("absent"));

        assertThat(store.listByPrefix("s/")).isEmpty();
    }

    @Test
    void readingMissingArtifactFails() {
        FileSystemArtifactStore store = new FileSystemArtifactStore(root);

        assertThatThrownBy(() -> store.get(store.locate("s/none.txt"))).isInstanceOf(ArtifactStoreException.class);
    }

    @Test
    void rejectsKeysEscapingTheRoot() {
        FileSystemArtifactStore store = new FileSystemArtifactStore(root);

        assertThatThrownBy(() -> store.put("../outside.txt", "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
