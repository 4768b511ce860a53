package com.raditha.pafcluster.clustering;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ClusterRegistry.
 */
class ClusterRegistryTest {

    private ClusterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ClusterRegistry();
    }

    @Test
    void testFindCreatesSingleton() {
        assertFalse(registry.contains(7));

        ClusterHandle handle = registry.find(7);

        assertTrue(registry.contains(7));
        assertEquals(List.of(7L), registry.members(handle));
        assertEquals(1, registry.clusterCount());
        assertEquals(1, registry.memberCount());
    }

    @Test
    void testFindIsStable() {
        ClusterHandle first = registry.find(7);
        ClusterHandle second = registry.find(7);

        assertEquals(first, second);
        assertEquals(1, registry.clusterCount());
    }

    @Test
    void testUnionOfUnseenMembers() {
        ClusterHandle handle = registry.union(1, 2);

        assertEquals(handle, registry.find(1));
        assertEquals(handle, registry.find(2));
        assertEquals(1, registry.clusterCount());
        assertEquals(List.of(1L, 2L), registry.members(handle));
    }

    @Test
    void testUnionIsIdempotent() {
        registry.union(1, 2);
        Set<Set<Long>> once = partition(registry);

        ClusterHandle again = registry.union(1, 2);
        ClusterHandle reversed = registry.union(2, 1);

        assertEquals(once, partition(registry));
        assertEquals(again, reversed);
        assertEquals(1, registry.clusterCount());
        assertEquals(2, registry.members(again).size());
    }

    @Test
    void testUnionMergesClusters() {
        registry.union(1, 2);
        registry.union(3, 4);
        assertEquals(2, registry.clusterCount());

        ClusterHandle merged = registry.union(2, 3);

        assertEquals(1, registry.clusterCount());
        assertEquals(Set.of(1L, 2L, 3L, 4L), new HashSet<>(registry.members(merged)));
        for (long member = 1; member <= 4; member++) {
            assertEquals(merged, registry.find(member));
        }
    }

    @Test
    void testSmallerClusterIsAbsorbed() {
        ClusterHandle large = registry.union(1, 2);
        registry.union(1, 3);
        ClusterHandle small = registry.union(10, 11);

        ClusterHandle merged = registry.union(10, 1);

        assertEquals(large, merged);
        assertTrue(registry.members(small).isEmpty(), "absorbed cluster keeps no members");
        assertEquals(List.of(1L, 2L, 3L, 10L, 11L), registry.members(merged));
    }

    @Test
    void testTransitivityWithInterleavedEdges() {
        registry.union(1, 2);
        registry.union(50, 51);
        registry.union(60, 61);
        registry.union(2, 3);

        assertTrue(registry.connected(1, 3));
        assertFalse(registry.connected(1, 50));
        assertFalse(registry.connected(50, 60));
        assertEquals(3, registry.clusterCount());
    }

    @Test
    void testTransitivityInReverseOrder() {
        registry.union(2, 3);
        registry.union(1, 2);

        assertTrue(registry.connected(1, 3));
    }

    @Test
    void testConnectedDoesNotCreateMembers() {
        assertFalse(registry.connected(1, 2));
        assertEquals(0, registry.memberCount());
    }

    @Test
    void testSelfUnionLeavesSingleton() {
        ClusterHandle handle = registry.union(5, 5);

        assertEquals(List.of(5L), registry.members(handle));
        assertEquals(1, registry.clusterCount());
    }

    @Test
    void testClustersSnapshotInCreationOrder() {
        registry.union(30, 31);
        registry.union(10, 11);
        registry.find(99);

        List<ClusterRegistry.Cluster> clusters = registry.clusters();

        assertEquals(3, clusters.size());
        assertEquals(List.of(30L, 31L), clusters.get(0).members());
        assertEquals(List.of(10L, 11L), clusters.get(1).members());
        assertEquals(List.of(99L), clusters.get(2).members());
    }

    @Test
    void testSnapshotIsNotAffectedByLaterUnions() {
        registry.union(1, 2);
        List<ClusterRegistry.Cluster> before = registry.clusters();

        registry.union(2, 3);

        assertEquals(List.of(1L, 2L), before.get(0).members());
    }

    @Test
    void testDisjointAtEveryStep() {
        Random random = new Random(42);
        Set<Long> seen = new HashSet<>();

        for (int i = 0; i < 500; i++) {
            long a = random.nextInt(200);
            long b = random.nextInt(200);
            registry.union(a, b);
            seen.add(a);
            seen.add(b);

            List<Long> reported = registry.clusters().stream()
                    .flatMap(c -> c.members().stream())
                    .toList();
            assertEquals(reported.size(), new HashSet<>(reported).size(), "member reported twice");
            assertEquals(seen, new HashSet<>(reported));
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 7, 13, 2024, 99999})
    void testPartitionIndependentOfEdgeOrder(long seed) {
        List<long[]> edges = new ArrayList<>();
        Random random = new Random(3);
        for (int i = 0; i < 300; i++) {
            edges.add(new long[] {random.nextInt(400), random.nextInt(400)});
        }

        ClusterRegistry reference = new ClusterRegistry();
        edges.forEach(e -> reference.union(e[0], e[1]));

        List<long[]> shuffled = new ArrayList<>(edges);
        Collections.shuffle(shuffled, new Random(seed));
        ClusterRegistry permuted = new ClusterRegistry();
        shuffled.forEach(e -> permuted.union(e[1], e[0]));

        assertEquals(partition(reference), partition(permuted));
    }

    private static Set<Set<Long>> partition(ClusterRegistry registry) {
        return registry.clusters().stream()
                .map(c -> Set.copyOf(c.members()))
                .collect(Collectors.toSet());
    }
}
