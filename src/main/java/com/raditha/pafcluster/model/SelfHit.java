package com.raditha.pafcluster.model;

/**
 * Score of a member aligned against itself.
 *
 * @param member Member identifier
 * @param score  Self alignment score, used as the reference for score ratios
 */
public record SelfHit(long member, double score) {
}
