package com.raditha.pafcluster.analyzer;

import com.raditha.pafcluster.filter.AdmissionTally;

import java.util.List;

/**
 * Counts for one pass over the hits of a group pair.
 *
 * @param phase           {@code RBH_PASS} or {@code THRESHOLD_PASS}
 * @param groups          Source groups the pass covered
 * @param processed       Hits read from the source
 * @param admitted        Hits that linked their members
 * @param bestRank        Hits admitted as best hits
 * @param scoreRatio      Hits admitted on blast score ratio
 * @param missingSelfHits Members found without a self score during ratio checks
 * @param clustersAfter   Live clusters once the pass completed
 * @param membersAfter    Members seen once the pass completed
 * @param elapsedMillis   Wall time spent in the pass
 */
public record PassStatistics(
        ClusteringException.Phase phase,
        List<Integer> groups,
        long processed,
        long admitted,
        long bestRank,
        long scoreRatio,
        long missingSelfHits,
        int clustersAfter,
        int membersAfter,
        long elapsedMillis) {

    public PassStatistics {
        groups = List.copyOf(groups);
    }

    static PassStatistics of(ClusteringException.Phase phase, List<Integer> groups, AdmissionTally tally,
            int clustersAfter, int membersAfter, long elapsedMillis) {
        return new PassStatistics(
                phase,
                groups,
                tally.processed(),
                tally.admitted(),
                tally.bestRank(),
                tally.scoreRatio(),
                tally.missingSelfHits(),
                clustersAfter,
                membersAfter,
                elapsedMillis);
    }

    /**
     * Format pass summary for display.
     */
    public String formatSummary() {
        if (phase == ClusteringException.Phase.RBH_PASS) {
            return String.format("BRH %s: %d hits processed in %.3f secs, %d clusters, %d members",
                    groups, processed, elapsedMillis / 1000.0, clustersAfter, membersAfter);
        }
        return String.format("threshold %s: %d hits => %d picked (%d best + %d threshold) in %.3f secs, "
                        + "%d clusters, %d members",
                groups, processed, admitted, bestRank, admitted - bestRank, elapsedMillis / 1000.0,
                clustersAfter, membersAfter);
    }
}
