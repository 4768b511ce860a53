package com.raditha.pafcluster.clustering;

import com.raditha.pafcluster.analyzer.ClusteringException;
import com.raditha.pafcluster.analyzer.ClusteringException.Phase;
import com.raditha.pafcluster.model.MemberCluster;
import com.raditha.pafcluster.sink.ClusterSink;
import com.raditha.pafcluster.sink.FanOutSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Emits the final partition of a {@link ClusterRegistry}.
 * <p>
 * Clusters with fewer than two members are dropped. Every other cluster gets
 * a new external identifier and is stored; once the sink has committed, the
 * identifiers are dispatched in the same order. A storage failure aborts the
 * cluster sink and nothing is dispatched; a dispatch failure aborts the
 * fan-out sink.
 */
public class PartitionEmitter {

    private static final Logger logger = LoggerFactory.getLogger(PartitionEmitter.class);
    private static final int PROGRESS_INTERVAL = 200;

    private final ClusterSink clusterSink;
    private final FanOutSink fanOutSink;
    private final List<Integer> groups;

    /**
     * @param clusterSink receives the clusters
     * @param fanOutSink  receives the identifiers of stored clusters
     * @param groups      source groups of the run, used in error reports
     */
    public PartitionEmitter(ClusterSink clusterSink, FanOutSink fanOutSink, List<Integer> groups) {
        this.clusterSink = clusterSink;
        this.fanOutSink = fanOutSink;
        this.groups = List.copyOf(groups);
    }

    /**
     * Clusters of the registry that qualify for emission, with identifiers
     * taken from the allocator. Member order is the order members joined the
     * cluster.
     */
    public static List<MemberCluster> collect(ClusterRegistry registry, ClusterIdAllocator allocator) {
        List<MemberCluster> result = new ArrayList<>();
        for (ClusterRegistry.Cluster cluster : registry.clusters()) {
            if (cluster.size() >= 2) {
                result.add(new MemberCluster(allocator.allocate(), cluster.members()));
            }
        }
        return result;
    }

    /**
     * Store and dispatch the clusters of the registry.
     *
     * @throws ClusteringException in phase {@code PERSISTENCE} or
     *                             {@code FAN_OUT} when a sink fails
     */
    public EmissionSummary emit(ClusterRegistry registry, ClusterIdAllocator allocator) throws ClusteringException {
        long start = System.currentTimeMillis();
        long firstId = allocator.peek();
        int live = registry.clusterCount();

        List<MemberCluster> clusters = collect(registry, allocator);
        logger.info("Storing {} clusters ({} live, {} singletons left out)",
                clusters.size(), live, live - clusters.size());

        long members = 0;
        try {
            int counter = 0;
            for (MemberCluster cluster : clusters) {
                clusterSink.store(cluster);
                members += cluster.size();
                if (++counter % PROGRESS_INTERVAL == 0) {
                    logger.info("{} clusters stored", counter);
                }
            }
            clusterSink.commit();
        } catch (IOException e) {
            clusterSink.abort();
            throw new ClusteringException(Phase.PERSISTENCE, groups, e);
        }
        logger.info("{} secs to store clusters", String.format("%.3f", (System.currentTimeMillis() - start) / 1000.0));

        try {
            for (MemberCluster cluster : clusters) {
                fanOutSink.dispatch(cluster.clusterId());
            }
            fanOutSink.finish();
        } catch (IOException e) {
            fanOutSink.abort();
            throw new ClusteringException(Phase.FAN_OUT, groups, e);
        }

        return new EmissionSummary(
                clusters.size(),
                members,
                live - clusters.size(),
                firstId,
                firstId + clusters.size() - 1);
    }
}
