package com.raditha.pafcluster.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PafClusterConfigTest {

    @Test
    void testStandardPreset() {
        PafClusterConfig config = PafClusterConfig.standard(List.of(3, 1));

        assertEquals(List.of(3, 1), config.groups());
        assertTrue(config.includeBrh());
        assertFalse(config.allHits());
        assertFalse(config.allBests());
        assertEquals(0.25, config.bsrThreshold(), 0.0001);
        assertEquals(1, config.firstClusterId());
    }

    @Test
    void testPresetsDifferOnlyInAdmission() {
        PafClusterConfig allHits = PafClusterConfig.allHits(List.of(1));
        PafClusterConfig allBests = PafClusterConfig.allBests(List.of(1));

        assertTrue(allHits.allHits());
        assertFalse(allHits.allBests());
        assertTrue(allBests.allBests());
        assertFalse(allBests.allHits());
    }

    @Test
    void testGroupsAreCopied() {
        List<Integer> groups = new ArrayList<>(List.of(1, 2));
        PafClusterConfig config = PafClusterConfig.standard(groups);

        groups.add(3);

        assertEquals(List.of(1, 2), config.groups());
        assertThrows(UnsupportedOperationException.class, () -> config.groups().add(4));
    }

    @Test
    void testInvalidGroupsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PafClusterConfig.standard(List.of()));
        assertThrows(IllegalArgumentException.class, () -> PafClusterConfig.standard(null));
        assertThrows(IllegalArgumentException.class, () -> PafClusterConfig.standard(List.of(1, 2, 1)));
        assertThrows(IllegalArgumentException.class, () -> PafClusterConfig.standard(Arrays.asList(1, null)));
    }

    @Test
    void testInvalidThresholdRejected() {
        PafClusterConfig config = PafClusterConfig.standard(List.of(1));

        assertThrows(IllegalArgumentException.class, () -> config.withBsrThreshold(-0.1));
        assertThrows(IllegalArgumentException.class, () -> config.withBsrThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> config.withBsrThreshold(Double.NaN));
        assertEquals(1.0, config.withBsrThreshold(1.0).bsrThreshold());
    }

    @Test
    void testInvalidFirstClusterIdRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new PafClusterConfig(List.of(1), true, false, false, 0.25, 0));
    }

    @Test
    void testWithIncludeBrhKeepsOtherValues() {
        PafClusterConfig config = new PafClusterConfig(List.of(1, 2), true, false, true, 0.4, 50)
                .withIncludeBrh(false);

        assertFalse(config.includeBrh());
        assertTrue(config.allBests());
        assertEquals(0.4, config.bsrThreshold(), 0.0001);
        assertEquals(50, config.firstClusterId());
    }

    @Test
    void testDescribe() {
        String text = PafClusterConfig.standard(List.of(1, 2)).describe();

        assertTrue(text.contains("groups=[1, 2]"), text);
        assertTrue(text.contains("brh=true"), text);
    }
}
