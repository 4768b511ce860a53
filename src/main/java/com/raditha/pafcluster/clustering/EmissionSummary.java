package com.raditha.pafcluster.clustering;

/**
 * Result of emitting a partition.
 *
 * @param clustersEmitted   Clusters stored and dispatched
 * @param membersEmitted    Members across the emitted clusters
 * @param singletonsSkipped Clusters left out for having a single member
 * @param firstClusterId    Identifier of the first emitted cluster
 * @param lastClusterId     Identifier of the last emitted cluster, or
 *                          {@code firstClusterId - 1} when nothing was emitted
 */
public record EmissionSummary(
        int clustersEmitted,
        long membersEmitted,
        int singletonsSkipped,
        long firstClusterId,
        long lastClusterId) {

    public double getAverageClusterSize() {
        if (clustersEmitted == 0) {
            return 0.0;
        }
        return (double) membersEmitted / clustersEmitted;
    }
}
