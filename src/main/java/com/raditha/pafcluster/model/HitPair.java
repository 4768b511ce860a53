package com.raditha.pafcluster.model;

/**
 * A pairwise hit between two members, as read from the peptide align features.
 * Used during clustering as a candidate edge between the two members.
 *
 * @param queryMember Member the search was run for
 * @param hitMember   Member that was found
 * @param score       Raw alignment score of the hit
 * @param rank        1-based position of the hit among the query's hits by
 *                    descending score (1 means best hit)
 */
public record HitPair(
        long queryMember,
        long hitMember,
        double score,
        int rank) {

    /**
     * Check whether both ends of this hit are the same member.
     */
    public boolean isSelfPair() {
        return queryMember == hitMember;
    }

    /**
     * Check whether the hit is the query's top ranked hit.
     */
    public boolean isBestHit() {
        return rank == 1;
    }
}
