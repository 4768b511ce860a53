package com.raditha.pafcluster.analyzer;

import com.raditha.pafcluster.analyzer.ClusteringException.Phase;
import com.raditha.pafcluster.clustering.ClusterRegistry;
import com.raditha.pafcluster.config.PafClusterConfig;
import com.raditha.pafcluster.filter.AdmissionDecision;
import com.raditha.pafcluster.filter.AdmissionFilter;
import com.raditha.pafcluster.filter.AdmissionTally;
import com.raditha.pafcluster.filter.SelfScoreTable;
import com.raditha.pafcluster.model.HitPair;
import com.raditha.pafcluster.model.SelfHit;
import com.raditha.pafcluster.source.EdgeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Main orchestrator for single-linkage clustering.
 * <p>
 * Loads the self hit scores, then walks the configured groups: for each group
 * its paralogue hits first, then for every later group the reciprocal best
 * hits and the cross-group hits. Admitted hits are unioned into a fresh
 * {@link ClusterRegistry}. The walk order only serves throughput; the final
 * partition does not depend on it.
 */
public class ClusteringDriver {

    private static final Logger logger = LoggerFactory.getLogger(ClusteringDriver.class);

    private final EdgeSource source;
    private final PafClusterConfig config;

    public ClusteringDriver(EdgeSource source, PafClusterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("No clustering configuration provided");
        }
        if (source == null) {
            throw new IllegalArgumentException("No edge source provided");
        }
        this.source = source;
        this.config = config;
    }

    /**
     * Run the clustering.
     *
     * @return the grown registry and run diagnostics
     * @throws ClusteringException if the edge source fails; nothing of the
     *                             partial partition is returned
     */
    public ClusteringResult cluster() throws ClusteringException {
        long start = System.currentTimeMillis();
        logger.info("Clustering with {}", config.describe());

        ClusterRegistry registry = new ClusterRegistry();
        SelfScoreTable selfScores = loadSelfScores();
        AdmissionFilter filter = new AdmissionFilter(config, selfScores);

        List<PassStatistics> passes = new ArrayList<>();
        Deque<Integer> pending = new ArrayDeque<>(config.groups());
        while (!pending.isEmpty()) {
            int group1 = pending.removeFirst();
            // paralogues first
            passes.add(thresholdPass(List.of(group1), registry, filter));

            for (int group2 : pending) {
                if (config.includeBrh()) {
                    passes.add(rbhPass(group1, group2, registry));
                }
                passes.add(thresholdPass(List.of(group1, group2), registry, filter));
            }
        }

        ClusteringReport report = new ClusteringReport(
                config,
                selfScores.size(),
                passes,
                registry.clusterCount(),
                registry.memberCount(),
                System.currentTimeMillis() - start);
        logger.info(report.getSummary());
        return new ClusteringResult(registry, report);
    }

    private SelfScoreTable loadSelfScores() throws ClusteringException {
        long start = System.currentTimeMillis();
        try (Stream<SelfHit> selfHits = source.selfHits(config.groups())) {
            SelfScoreTable table = SelfScoreTable.load(selfHits);
            logger.info("Loaded {} self hit scores in {} secs", table.size(), seconds(start));
            return table;
        } catch (IOException e) {
            throw new ClusteringException(Phase.SCORE_LOADING, config.groups(), e);
        } catch (UncheckedIOException e) {
            throw new ClusteringException(Phase.SCORE_LOADING, config.groups(), e.getCause());
        }
    }

    private PassStatistics rbhPass(int group1, int group2, ClusterRegistry registry) throws ClusteringException {
        long start = System.currentTimeMillis();
        List<Integer> groups = List.of(group1, group2);
        AdmissionTally tally = new AdmissionTally();

        try (Stream<HitPair> hits = source.reciprocalBestHits(group1, group2)) {
            Iterator<HitPair> it = hits.iterator();
            while (it.hasNext()) {
                HitPair hit = it.next();
                if (hit.isSelfPair()) {
                    tally.record(AdmissionDecision.SELF_PAIR);
                    continue;
                }
                tally.record(AdmissionDecision.UNCONDITIONAL);
                registry.union(hit.queryMember(), hit.hitMember());
            }
        } catch (IOException e) {
            throw new ClusteringException(Phase.RBH_PASS, groups, e);
        } catch (UncheckedIOException e) {
            throw new ClusteringException(Phase.RBH_PASS, groups, e.getCause());
        }

        PassStatistics stats = PassStatistics.of(Phase.RBH_PASS, groups, tally,
                registry.clusterCount(), registry.memberCount(), System.currentTimeMillis() - start);
        logger.info(stats.formatSummary());
        return stats;
    }

    private PassStatistics thresholdPass(List<Integer> groups, ClusterRegistry registry, AdmissionFilter filter)
            throws ClusteringException {
        long start = System.currentTimeMillis();
        AdmissionTally tally = new AdmissionTally();

        try (Stream<HitPair> hits = source.thresholdHits(groups)) {
            Iterator<HitPair> it = hits.iterator();
            while (it.hasNext()) {
                HitPair hit = it.next();
                AdmissionDecision decision = filter.evaluate(hit, tally);
                tally.record(decision);
                if (decision.isAdmitted()) {
                    registry.union(hit.queryMember(), hit.hitMember());
                }
            }
        } catch (IOException e) {
            throw new ClusteringException(Phase.THRESHOLD_PASS, groups, e);
        } catch (UncheckedIOException e) {
            throw new ClusteringException(Phase.THRESHOLD_PASS, groups, e.getCause());
        }

        if (tally.missingSelfHits() > 0) {
            logger.warn("{} member lookups without a self hit in groups {}", tally.missingSelfHits(), groups);
        }
        PassStatistics stats = PassStatistics.of(Phase.THRESHOLD_PASS, groups, tally,
                registry.clusterCount(), registry.memberCount(), System.currentTimeMillis() - start);
        logger.info(stats.formatSummary());
        return stats;
    }

    private static String seconds(long start) {
        return String.format("%.3f", (System.currentTimeMillis() - start) / 1000.0);
    }
}
