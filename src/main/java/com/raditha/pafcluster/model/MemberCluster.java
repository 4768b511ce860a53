package com.raditha.pafcluster.model;

import java.util.List;

/**
 * A cluster of members ready to be stored.
 * Members are listed in the order they joined the cluster.
 *
 * @param clusterId External identifier allocated for this cluster
 * @param members   Member identifiers of the cluster
 */
public record MemberCluster(
        long clusterId,
        List<Long> members) {

    public MemberCluster {
        members = List.copyOf(members);
    }

    /**
     * Get number of members in the cluster.
     */
    public int size() {
        return members.size();
    }

    /**
     * Format cluster summary for display.
     */
    public String formatSummary() {
        return String.format("cluster %d: %d members", clusterId, members.size());
    }
}
