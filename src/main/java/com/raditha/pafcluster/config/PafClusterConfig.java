package com.raditha.pafcluster.config;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration for a clustering run.
 * Defines which source groups are clustered and how candidate hits are
 * admitted.
 *
 * @param groups         Source group (genome) identifiers to cluster, in
 *                       processing order
 * @param includeBrh     Grow clusters from reciprocal best hits
 * @param allHits        Admit every candidate hit (no filters)
 * @param allBests       Admit every best hit (rank 1) before the score ratio
 *                       check
 * @param bsrThreshold   Blast score ratio a hit must exceed (0.0-1.0)
 * @param firstClusterId First external identifier handed out to clusters
 */
public record PafClusterConfig(
        List<Integer> groups,
        boolean includeBrh,
        boolean allHits,
        boolean allBests,
        double bsrThreshold,
        long firstClusterId) {

    public static final double DEFAULT_BSR_THRESHOLD = 0.25;

    /**
     * Validate configuration.
     */
    public PafClusterConfig {
        if (groups == null || groups.isEmpty()) {
            throw new IllegalArgumentException("groups must name at least one source group");
        }
        Set<Integer> seen = new HashSet<>();
        for (Integer group : groups) {
            if (group == null) {
                throw new IllegalArgumentException("groups cannot contain null");
            }
            if (!seen.add(group)) {
                throw new IllegalArgumentException("group " + group + " is listed more than once");
            }
        }
        groups = List.copyOf(groups);
        if (Double.isNaN(bsrThreshold) || bsrThreshold < 0.0 || bsrThreshold > 1.0) {
            throw new IllegalArgumentException("bsrThreshold must be between 0.0 and 1.0");
        }
        if (firstClusterId < 1) {
            throw new IllegalArgumentException("firstClusterId must be >= 1");
        }
    }

    /**
     * Standard preset: reciprocal best hits plus hits above 25% blast score
     * ratio.
     */
    public static PafClusterConfig standard(List<Integer> groups) {
        return new PafClusterConfig(
                groups,
                true, // includeBrh
                false, // allHits
                false, // allBests
                DEFAULT_BSR_THRESHOLD,
                1);
    }

    /**
     * All-hits preset: every hit between the groups links its members.
     */
    public static PafClusterConfig allHits(List<Integer> groups) {
        return new PafClusterConfig(groups, true, true, false, DEFAULT_BSR_THRESHOLD, 1);
    }

    /**
     * All-bests preset: every best hit links its members, other hits still
     * go through the score ratio check.
     */
    public static PafClusterConfig allBests(List<Integer> groups) {
        return new PafClusterConfig(groups, true, false, true, DEFAULT_BSR_THRESHOLD, 1);
    }

    public PafClusterConfig withBsrThreshold(double threshold) {
        return new PafClusterConfig(groups, includeBrh, allHits, allBests, threshold, firstClusterId);
    }

    public PafClusterConfig withIncludeBrh(boolean include) {
        return new PafClusterConfig(groups, include, allHits, allBests, bsrThreshold, firstClusterId);
    }

    /**
     * One line description used in logs and reports.
     */
    public String describe() {
        return String.format("groups=%s, brh=%b, all_hits=%b, all_bests=%b, bsr_threshold=%.3f",
                groups, includeBrh, allHits, allBests, bsrThreshold);
    }
}
