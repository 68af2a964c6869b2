package io.indexkit.collections.test.extendiblehash;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.indexkit.collections.extendiblehash.DirectoryBlobStore;
import io.indexkit.collections.extendiblehash.ExtendibleHash;
import io.indexkit.collections.extendiblehash.Serdes;
import io.indexkit.collections.extendiblehash.SipKeyHasher;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DirectoryBlobStoreTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testPutGet() throws Exception {
        final Path dir = folder.getRoot().toPath().resolve("store");
        final DirectoryBlobStore store = new DirectoryBlobStore(dir);
        assertThat(store.get("bucket-0")).isNull();
        store.put("bucket-0", new byte[] {1, 2, 3});
        assertThat(store.get("bucket-0")).containsExactly(1, 2, 3);
        store.put("bucket-0", new byte[] {4});
        assertThat(store.get("bucket-0")).containsExactly(4);
        assertThat(Files.exists(dir.resolve("bucket-0.msgpack"))).isTrue();
    }

    @Test
    public void testRejectsPathLikeNames() {
        final DirectoryBlobStore store = new DirectoryBlobStore(folder.getRoot().toPath());
        assertThatThrownBy(() -> store.put("../escape", new byte[0])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.get("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testTableSurvivesReopenFromDisk() throws Exception {
        final Path dir = folder.newFolder("table").toPath();
        final ExtendibleHash<Long, Long> eh = ExtendibleHash.open(
                new DirectoryBlobStore(dir), Serdes.LONG, Serdes.LONG, new SipKeyHasher<>(Serdes.LONG), 2, 1);
        for (long k = 1; k <= 200; k++) {
            assertThat(eh.insert(k, k * 10)).isTrue();
        }

        final ExtendibleHash<Long, Long> reopened = ExtendibleHash.open(
                new DirectoryBlobStore(dir), Serdes.LONG, Serdes.LONG, new SipKeyHasher<>(Serdes.LONG), 2, 1);
        reopened.checkInvariants();
        assertThat(reopened.size()).isEqualTo(200);
        assertThat(reopened.bucketCount()).isEqualTo(eh.bucketCount());
        for (long k = 1; k <= 200; k++) {
            assertThat(reopened.search(k)).isEqualTo(k * 10);
        }
    }
}
