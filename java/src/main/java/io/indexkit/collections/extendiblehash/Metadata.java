package io.indexkit.collections.extendiblehash;

final class Metadata {
    static final String BlobName = "metadata";
    static final int MaxGlobalDepth = 30;

    final int fieldCount = 3;
    int globalDepth;
    int nextBucketId;
    int bucketCapacity;

    Metadata(int globalDepth, int bucketCapacity) {
        this.globalDepth = globalDepth;
        this.nextBucketId = 0;
        this.bucketCapacity = bucketCapacity;
    }

    Metadata(byte[] data) {
        boolean seenDepth = false, seenNext = false, seenCapacity = false;
        try (final MsgUnpacker unpacker = new MsgUnpacker(data)) {
            int pairs = unpacker.unpackMapHeader();
            if (pairs != fieldCount) {
                throw new IllegalArgumentException("Expected " + fieldCount + " pairs in metadata map. Found " + pairs);
            }
            for (; pairs > 0; pairs--) {
                final String key = unpacker.unpackString();
                switch (key) {
                    case "GlobalDepth":
                        globalDepth = unpacker.unpackInt();
                        seenDepth = true;
                        break;
                    case "NextBucketId":
                        nextBucketId = unpacker.unpackInt();
                        seenNext = true;
                        break;
                    case "BucketCapacity":
                        bucketCapacity = unpacker.unpackInt();
                        seenCapacity = true;
                        break;
                    default:
                        throw new IllegalArgumentException("Unexpected key in metadata: " + key);
                }
            }
            if (unpacker.hasNext()) {
                throw new IllegalArgumentException("trailing garbage after metadata");
            }
        }
        if (!(seenDepth && seenNext && seenCapacity)) {
            throw new IllegalArgumentException("metadata is missing a field");
        }
        if (globalDepth < 0 || globalDepth > MaxGlobalDepth || nextBucketId < 1 || bucketCapacity < 1) {
            throw new IllegalArgumentException(
                    String.format(
                            "metadata out of range: global depth %d, next bucket id %d, bucket capacity %d",
                            globalDepth, nextBucketId, bucketCapacity));
        }
    }

    byte[] pack() {
        final MsgPacker packer = new MsgPacker();
        packer.packMapHeader(fieldCount);
        packer.packString("GlobalDepth");
        packer.packInt(globalDepth);
        packer.packString("NextBucketId");
        packer.packInt(nextBucketId);
        packer.packString("BucketCapacity");
        packer.packInt(bucketCapacity);
        return packer.toByteArray();
    }

    int directorySize() {
        return 1 << globalDepth;
    }

    long mask() {
        return (1L << globalDepth) - 1;
    }
}
