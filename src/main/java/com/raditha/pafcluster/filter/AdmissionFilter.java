package com.raditha.pafcluster.filter;

import com.raditha.pafcluster.config.PafClusterConfig;
import com.raditha.pafcluster.model.HitPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Decides whether a candidate hit becomes a clustering edge.
 * <p>
 * Policies are tried in order:
 * <ol>
 * <li>all hits: every pair of distinct members is admitted</li>
 * <li>all bests: a rank 1 hit is admitted</li>
 * <li>blast score ratio: the hit score divided by the larger self score of
 * the two members must exceed the threshold</li>
 * </ol>
 * The filter keeps no state of its own; counters go to the
 * {@link AdmissionTally} supplied by the caller. Reciprocal best hits never
 * pass through here.
 */
public class AdmissionFilter {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionFilter.class);

    private final boolean allHits;
    private final boolean allBests;
    private final double bsrThreshold;
    private final SelfScoreTable selfScores;

    public AdmissionFilter(PafClusterConfig config, SelfScoreTable selfScores) {
        this(config.allHits(), config.allBests(), config.bsrThreshold(), selfScores);
    }

    public AdmissionFilter(boolean allHits, boolean allBests, double bsrThreshold, SelfScoreTable selfScores) {
        this.allHits = allHits;
        this.allBests = allBests;
        this.bsrThreshold = bsrThreshold;
        this.selfScores = selfScores;
    }

    /**
     * Evaluate a candidate hit.
     *
     * @param hit   the candidate
     * @param tally receives one missing-self-hit count per member without a
     *              self score whenever the score ratio is consulted
     * @return the decision; the caller records it
     */
    public AdmissionDecision evaluate(HitPair hit, AdmissionTally tally) {
        if (hit.isSelfPair()) {
            return AdmissionDecision.SELF_PAIR;
        }
        if (allHits) {
            return AdmissionDecision.UNCONDITIONAL;
        }
        if (allBests && hit.isBestHit()) {
            return AdmissionDecision.BEST_RANK;
        }
        return passesScoreRatio(hit, tally) ? AdmissionDecision.SCORE_RATIO : AdmissionDecision.REJECTED;
    }

    private boolean passesScoreRatio(HitPair hit, AdmissionTally tally) {
        checkSelfHit(hit.queryMember(), tally);
        checkSelfHit(hit.hitMember(), tally);

        OptionalDouble reference = selfScores.referenceScore(hit.queryMember(), hit.hitMember());
        if (reference.isEmpty() || reference.getAsDouble() <= 0.0) {
            return false;
        }
        return hit.score() / reference.getAsDouble() > bsrThreshold;
    }

    private void checkSelfHit(long member, AdmissionTally tally) {
        if (!selfScores.contains(member)) {
            tally.missingSelfHit();
            logger.debug("member {} missing self hit", member);
        }
    }

    public double bsrThreshold() {
        return bsrThreshold;
    }
}
