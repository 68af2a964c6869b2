package io.indexkit.collections.extendiblehash;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ExtendibleHashSplitTest {
    private static ExtendibleHash<Long, Long> identityTable(int capacity, int globalDepth) {
        return ExtendibleHash.createEmpty(new MemoryBlobStore(), Serdes.LONG, Serdes.LONG, k -> k, capacity, globalDepth);
    }

    @Test
    public void testGrowDirectoryMirrorsSlots() {
        final ExtendibleHash<Long, Long> eh = identityTable(2, 1);
        for (long k = 0; k < 12; k++) {
            eh.insert(k * 3, k);
        }
        final int oldSize = eh.directorySize();
        final int oldDepth = eh.globalDepth();
        final int[] before = new int[oldSize];
        for (int i = 0; i < oldSize; i++) {
            before[i] = eh.bucketId(i);
        }

        eh.growDirectory();

        assertThat(eh.directorySize()).isEqualTo(2 * oldSize);
        assertThat(eh.globalDepth()).isEqualTo(oldDepth + 1);
        for (int i = 0; i < oldSize; i++) {
            assertThat(eh.bucketId(i)).isEqualTo(before[i]);
            assertThat(eh.bucketId(i + oldSize)).isEqualTo(before[i]);
        }
        eh.checkInvariants();
    }

    @Test
    public void testBucketsSplitOnlyWhenFull() {
        final ExtendibleHash<Long, Long> eh = identityTable(3, 1);
        eh.insert(0L, 0L);
        eh.insert(2L, 2L);
        eh.insert(4L, 4L);
        assertThat(eh.bucketCount()).isEqualTo(1);
        assertThat(eh.globalDepth()).isEqualTo(1);

        eh.insert(6L, 6L);
        assertThat(eh.bucketCount()).isGreaterThan(1);
        eh.checkInvariants();
    }

    @Test
    public void testSplitRepointsSlotsWithTheNewBit() {
        final ExtendibleHash<Long, Long> eh = identityTable(2, 2);
        eh.insert(1L, 1L);
        eh.insert(3L, 3L);
        // one bucket at local depth 0 behind all four slots
        assertThat(eh.localDepth(0)).isEqualTo(0);

        assertThat(eh.splitBucket(1)).isTrue();
        assertThat(eh.globalDepth()).isEqualTo(2);
        assertThat(eh.bucketId(0)).isEqualTo(eh.bucketId(2));
        assertThat(eh.bucketId(1)).isEqualTo(eh.bucketId(3));
        assertThat(eh.bucketId(0)).isNotEqualTo(eh.bucketId(1));
        assertThat(eh.bucketContents(1)).containsOnlyKeys(1L, 3L);
        assertThat(eh.bucketContents(0)).isEmpty();
        eh.checkInvariants();
    }

    @Test
    public void testSplitPersistsBothBucketsAndMetadata() throws Exception {
        final MemoryBlobStore store = new MemoryBlobStore();
        final ExtendibleHash<Long, Long> eh =
                ExtendibleHash.createEmpty(store, Serdes.LONG, Serdes.LONG, k -> k, 2, 1);
        assertThat(store.names()).containsExactlyInAnyOrder("metadata", "bucket-0");
        eh.insert(0L, 0L);
        eh.insert(2L, 2L);
        eh.insert(4L, 4L);
        assertThat(store.names()).containsExactlyInAnyOrder("metadata", "bucket-0", "bucket-1", "bucket-2");
        final Metadata meta = new Metadata(store.get("metadata"));
        assertThat(meta.globalDepth).isEqualTo(2);
        assertThat(meta.nextBucketId).isEqualTo(3);
        final Bucket<Long, Long> b2 = Bucket.unpack(2, 2, store.get("bucket-2"), Serdes.LONG, Serdes.LONG);
        assertThat(b2.items).containsOnlyKeys(2L);
        assertThat(b2.localDepth).isEqualTo(2);
        assertThat(b2.pattern).isEqualTo(2);
    }
}
