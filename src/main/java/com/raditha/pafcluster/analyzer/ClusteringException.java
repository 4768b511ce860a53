package com.raditha.pafcluster.analyzer;

import java.util.List;

/**
 * Fatal failure of a clustering run.
 * Carries the phase that failed and the source groups being processed, so a
 * narrower batch can be re-run. A run that ends with this exception has no
 * usable partition.
 */
public class ClusteringException extends Exception {

    /**
     * Phases of a clustering run.
     */
    public enum Phase {
        SCORE_LOADING("self hit score loading"),
        RBH_PASS("reciprocal best hit pass"),
        THRESHOLD_PASS("threshold pass"),
        PERSISTENCE("cluster persistence"),
        FAN_OUT("cluster fan-out");

        private final String label;

        Phase(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Phase phase;
    private final List<Integer> groups;

    public ClusteringException(Phase phase, List<Integer> groups, Throwable cause) {
        super(String.format("%s failed for groups %s: %s",
                phase.label(), groups, cause.getMessage()), cause);
        this.phase = phase;
        this.groups = List.copyOf(groups);
    }

    public Phase getPhase() {
        return phase;
    }

    public List<Integer> getGroups() {
        return groups;
    }
}
