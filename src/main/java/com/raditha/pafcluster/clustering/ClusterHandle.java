package com.raditha.pafcluster.clustering;

/**
 * Handle of a cluster inside a {@link ClusterRegistry}.
 * Handles are only meaningful for the registry that issued them, and a handle
 * stops representing any members once its cluster is merged away.
 *
 * @param index Slot of the cluster in the registry
 */
public record ClusterHandle(int index) {
}
