package com.raditha.pafcluster.filter;

/**
 * Outcome of running a candidate hit through the {@link AdmissionFilter}.
 */
public enum AdmissionDecision {
    /** Admitted because every hit is taken (all-hits mode). */
    UNCONDITIONAL,
    /** Admitted because it is the query's best hit (all-bests mode). */
    BEST_RANK,
    /** Admitted because its blast score ratio is above the threshold. */
    SCORE_RATIO,
    /** Not admitted. */
    REJECTED,
    /** Both ends are the same member; never admitted. */
    SELF_PAIR;

    public boolean isAdmitted() {
        return this == UNCONDITIONAL || this == BEST_RANK || this == SCORE_RATIO;
    }
}
