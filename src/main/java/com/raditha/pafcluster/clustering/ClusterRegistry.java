package com.raditha.pafcluster.clustering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Disjoint-set partition of members into single-linkage clusters.
 * <p>
 * Clusters live in an arena indexed by {@link ClusterHandle}; a member map
 * points every seen member at the slot of its cluster. Merging moves the
 * members of the smaller cluster onto the larger one and drops the emptied
 * slot from the set of live clusters. Slots are never reused, so handles are
 * allocated in creation order.
 * <p>
 * Not thread safe. A registry is owned by a single clustering run.
 */
public class ClusterRegistry {

    private final List<List<Long>> arena = new ArrayList<>();
    private final Map<Long, Integer> memberToCluster = new HashMap<>();
    private final Set<Integer> liveClusters = new LinkedHashSet<>();

    /**
     * A cluster as seen through {@link #clusters()}.
     *
     * @param handle  Representative of the cluster
     * @param members Members in the order they joined the cluster
     */
    public record Cluster(ClusterHandle handle, List<Long> members) {

        public int size() {
            return members.size();
        }
    }

    /**
     * Find the cluster a member belongs to.
     * An unseen member gets a new singleton cluster.
     *
     * @param member Member identifier
     * @return handle of the member's cluster
     */
    public ClusterHandle find(long member) {
        Integer slot = memberToCluster.get(member);
        if (slot == null) {
            slot = createCluster(member);
        }
        return new ClusterHandle(slot);
    }

    /**
     * Put two members in the same cluster, merging their clusters if needed.
     *
     * @return handle of the cluster now holding both members
     */
    public ClusterHandle union(long memberA, long memberB) {
        int slotA = find(memberA).index();
        int slotB = find(memberB).index();
        if (slotA == slotB) {
            return new ClusterHandle(slotA);
        }

        List<Long> membersA = arena.get(slotA);
        List<Long> membersB = arena.get(slotB);

        // Larger cluster survives; ties keep A's cluster
        int survivor = membersA.size() >= membersB.size() ? slotA : slotB;
        int absorbed = survivor == slotA ? slotB : slotA;

        List<Long> target = arena.get(survivor);
        List<Long> moved = arena.get(absorbed);
        for (Long member : moved) {
            memberToCluster.put(member, survivor);
        }
        target.addAll(moved);

        arena.set(absorbed, List.of());
        liveClusters.remove(absorbed);
        return new ClusterHandle(survivor);
    }

    /**
     * Check whether two members are currently in the same cluster.
     * Unlike {@link #find(long)} this never creates clusters.
     */
    public boolean connected(long memberA, long memberB) {
        Integer slotA = memberToCluster.get(memberA);
        return slotA != null && slotA.equals(memberToCluster.get(memberB));
    }

    /**
     * Check whether the member has been seen by this registry.
     */
    public boolean contains(long member) {
        return memberToCluster.containsKey(member);
    }

    /**
     * Members of the given cluster, in joining order.
     * A merged-away cluster has no members.
     */
    public List<Long> members(ClusterHandle handle) {
        return Collections.unmodifiableList(arena.get(handle.index()));
    }

    /**
     * Snapshot of the current partition, one entry per live cluster, in
     * cluster creation order.
     */
    public List<Cluster> clusters() {
        List<Cluster> snapshot = new ArrayList<>(liveClusters.size());
        for (Integer slot : liveClusters) {
            List<Long> members = arena.get(slot);
            if (!members.isEmpty()) {
                snapshot.add(new Cluster(new ClusterHandle(slot), List.copyOf(members)));
            }
        }
        return snapshot;
    }

    /**
     * Number of live clusters, singletons included.
     */
    public int clusterCount() {
        return liveClusters.size();
    }

    /**
     * Number of distinct members seen.
     */
    public int memberCount() {
        return memberToCluster.size();
    }

    private int createCluster(long member) {
        int slot = arena.size();
        List<Long> members = new ArrayList<>(2);
        members.add(member);
        arena.add(members);
        memberToCluster.put(member, slot);
        liveClusters.add(slot);
        return slot;
    }
}
