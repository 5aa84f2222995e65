package ai.longdoc.translator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class InMemoryArtifactStoreTest {

    private final InMemoryArtifactStore store = new InMemoryArtifactStore();

    @Test
    void storesAndListsByPrefixInKeyOrder() {
        store.put("s/translated_chunks/translated_chunk_0002.txt", "two");
        store.put("s/translated_chunks/final_translated_chunk_0001.txt", "final");
        store.put("s/translated_chunks/translated_chunk_0001.txt", "one");
        store.put("t/translated_chunks/translated_chunk_0001.txt", "other session");

        assertThat(store.listByPrefix("s/translated_chunks/translated_"))
                .extracting(ArtifactLocator::name)
                .containsExactly("translated_chunk_0001.txt", "translated_chunk_0002.txt");
        assertThat(store.getText(store.locate("s/translated_chunks/translated_chunk_0002.txt"))).isEqualTo("two");
    }

    @Test
    void overwritesExistingKey() {
        store.put("s/a.txt", "first");
        store.put("s/a.txt", "second");

        assertThat(store.getText(store.locate("s/a.txt"))).isEqualTo("second");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void missingArtifactRaisesStoreError() {
        assertThat(store.exists("s/missing.txt")).isFalse();
        assertThatThrownBy(() -> store.get(store.locate("s/missing.txt"))).isInstanceOf(ArtifactStoreException.class);
    }

    @Test
    void locatorUriHandlesSpaces() {
        ArtifactLocator locator = store.put("s/FINAL_my book.txt", "x");

        assertThat(locator.uri().getScheme()).isEqualTo("memory");
        assertThat(locator.name()).isEqualTo("FINAL_my book.txt");
    }
}
