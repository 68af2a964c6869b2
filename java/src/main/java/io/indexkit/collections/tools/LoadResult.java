package io.indexkit.collections.tools;

/** Counts from one bulk load. */
public final class LoadResult {
    private final int inserted;
    private final int refused;
    private final int skipped;

    LoadResult(int inserted, int refused, int skipped) {
        this.inserted = inserted;
        this.refused = refused;
        this.skipped = skipped;
    }

    public int getInserted() {
        return inserted;
    }

    /** Well-formed keys the index refused: duplicates, or keys a hash table could not make room for. */
    public int getRefused() {
        return refused;
    }

    /** Lines that were not integers. */
    public int getSkipped() {
        return skipped;
    }

    @Override
    public String toString() {
        return "LoadResult{inserted=" + inserted + ", refused=" + refused + ", skipped=" + skipped + "}";
    }
}
