package com.raditha.pafcluster.clustering;

/**
 * Hands out external cluster identifiers in sequence.
 */
public class ClusterIdAllocator {

    private long next;

    public ClusterIdAllocator(long firstId) {
        if (firstId < 1) {
            throw new IllegalArgumentException("firstId must be >= 1, got: " + firstId);
        }
        this.next = firstId;
    }

    public long allocate() {
        return next++;
    }

    /**
     * The identifier the next call to {@link #allocate()} will return.
     */
    public long peek() {
        return next;
    }
}
