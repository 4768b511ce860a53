package com.raditha.pafcluster.filter;

import com.raditha.pafcluster.model.SelfHit;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Stream;

/**
 * Self alignment scores for the members of a clustering run.
 * Filled once before clustering starts and read-only afterwards, so a single
 * table can be shared by every admission check of the run.
 */
public final class SelfScoreTable {

    private final Map<Long, Double> scores;

    private SelfScoreTable(Map<Long, Double> scores) {
        this.scores = scores;
    }

    /**
     * Build a table from a stream of self hits.
     * When a member is reported more than once the last score wins.
     */
    public static SelfScoreTable load(Stream<SelfHit> selfHits) {
        Map<Long, Double> scores = new HashMap<>();
        Iterator<SelfHit> it = selfHits.iterator();
        while (it.hasNext()) {
            SelfHit hit = it.next();
            scores.put(hit.member(), hit.score());
        }
        return new SelfScoreTable(scores);
    }

    public static SelfScoreTable of(Map<Long, Double> scores) {
        return new SelfScoreTable(new HashMap<>(scores));
    }

    public static SelfScoreTable empty() {
        return new SelfScoreTable(Map.of());
    }

    public OptionalDouble score(long member) {
        Double score = scores.get(member);
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    public boolean contains(long member) {
        return scores.containsKey(member);
    }

    /**
     * Reference score for a pair: the larger of the two self scores.
     * A member without a self score is ignored rather than counted as zero.
     */
    public OptionalDouble referenceScore(long memberA, long memberB) {
        Double a = scores.get(memberA);
        Double b = scores.get(memberB);
        if (a == null && b == null) {
            return OptionalDouble.empty();
        }
        if (a == null) {
            return OptionalDouble.of(b);
        }
        if (b == null) {
            return OptionalDouble.of(a);
        }
        return OptionalDouble.of(Math.max(a, b));
    }

    public int size() {
        return scores.size();
    }
}
