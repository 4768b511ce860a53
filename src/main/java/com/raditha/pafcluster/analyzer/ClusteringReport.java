package com.raditha.pafcluster.analyzer;

import com.raditha.pafcluster.config.PafClusterConfig;

import java.util.List;

/**
 * Diagnostics of one clustering run.
 * Returned by the driver instead of being accumulated globally, so two runs
 * in the same process never share counts.
 */
public record ClusteringReport(
        PafClusterConfig config,
        int selfHitsLoaded,
        List<PassStatistics> passes,
        int clusterCount,
        int memberCount,
        long elapsedMillis) {

    public ClusteringReport {
        passes = List.copyOf(passes);
    }

    public long getProcessedCount() {
        return passes.stream().mapToLong(PassStatistics::processed).sum();
    }

    public long getAdmittedCount() {
        return passes.stream().mapToLong(PassStatistics::admitted).sum();
    }

    public long getMissingSelfHitCount() {
        return passes.stream().mapToLong(PassStatistics::missingSelfHits).sum();
    }

    /**
     * Passes of the given kind, in the order they ran.
     */
    public List<PassStatistics> getPasses(ClusteringException.Phase phase) {
        return passes.stream()
                .filter(p -> p.phase() == phase)
                .toList();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "%d hits processed, %d admitted, %d clusters over %d members (%d self hits loaded, %d missing)",
                getProcessedCount(),
                getAdmittedCount(),
                clusterCount,
                memberCount,
                selfHitsLoaded,
                getMissingSelfHitCount());
    }
}
