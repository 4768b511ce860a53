package com.raditha.pafcluster.source;

import com.raditha.pafcluster.model.HitPair;
import com.raditha.pafcluster.model.SelfHit;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Supplies the hits a clustering run consumes.
 * <p>
 * Every method returns a lazy, finite stream that the caller closes when done.
 * Implementations may fail up front with an {@link IOException} or while the
 * stream is consumed with an {@link java.io.UncheckedIOException}.
 */
public interface EdgeSource {

    /**
     * Self hits of all members belonging to the given groups, in no particular
     * order.
     */
    Stream<SelfHit> selfHits(Collection<Integer> groups) throws IOException;

    /**
     * Reciprocal best hits from {@code group1} to {@code group2}: hits of rank
     * 1 whose reverse hit is also of rank 1. Empty when both groups are the
     * same.
     */
    Stream<HitPair> reciprocalBestHits(int group1, int group2) throws IOException;

    /**
     * Hits between members of the given groups, self hits excluded. With more
     * than one group only hits crossing two different groups are returned.
     */
    Stream<HitPair> thresholdHits(List<Integer> groups) throws IOException;
}
