package com.raditha.pafcluster.filter;

/**
 * Counters for the admission decisions taken during one pass.
 * A fresh tally is created for every pass, so counts never carry over from
 * one run to the next.
 */
public class AdmissionTally {

    private long processed;
    private long unconditional;
    private long bestRank;
    private long scoreRatio;
    private long rejected;
    private long selfPairs;
    private long missingSelfHits;

    public void record(AdmissionDecision decision) {
        processed++;
        switch (decision) {
            case UNCONDITIONAL -> unconditional++;
            case BEST_RANK -> bestRank++;
            case SCORE_RATIO -> scoreRatio++;
            case REJECTED -> rejected++;
            case SELF_PAIR -> selfPairs++;
        }
    }

    void missingSelfHit() {
        missingSelfHits++;
    }

    public long processed() {
        return processed;
    }

    public long admitted() {
        return unconditional + bestRank + scoreRatio;
    }

    public long unconditional() {
        return unconditional;
    }

    public long bestRank() {
        return bestRank;
    }

    public long scoreRatio() {
        return scoreRatio;
    }

    public long rejected() {
        return rejected;
    }

    public long selfPairs() {
        return selfPairs;
    }

    public long missingSelfHits() {
        return missingSelfHits;
    }
}
