package com.raditha.pafcluster.analyzer;

import com.raditha.pafcluster.clustering.ClusterRegistry;

/**
 * Outcome of a successful clustering run: the grown registry and the run
 * diagnostics.
 */
public record ClusteringResult(ClusterRegistry registry, ClusteringReport report) {
}
