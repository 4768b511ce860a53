package com.raditha.pafcluster.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link PafClusterConfig} from a YAML file and command line values.
 * <p>
 * Priority: CLI arguments &gt; YAML &gt; defaults. All keys live under a
 * top-level {@code paf_cluster} map:
 *
 * <pre>
 * paf_cluster:
 *   groups: [1, 2, 3]
 *   preset: standard        # standard, all_hits or all_bests
 *   brh: true
 *   all_hits: false
 *   all_bests: false
 *   bsr_threshold: 0.25
 *   first_cluster_id: 1
 *   hits: data/paf.tsv
 *   output: out
 * </pre>
 */
public class PafClusterSettings {

    public static final String CONFIG_KEY = "paf_cluster";
    public static final String DEFAULT_CONFIG_FILE = "pafcluster.yml";

    private final Map<String, Object> config;

    private PafClusterSettings(Map<String, Object> config) {
        this.config = config;
    }

    /**
     * Settings without a YAML file: CLI values and defaults only.
     */
    public static PafClusterSettings empty() {
        return new PafClusterSettings(Map.of());
    }

    /**
     * Read settings from a YAML file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the {@code paf_cluster} entry is not
     *                                  a map
     */
    public static PafClusterSettings load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Object document = new Yaml().load(reader);
            return fromDocument(document);
        }
    }

    /**
     * Read settings from {@code pafcluster.yml} in the working directory if
     * present.
     */
    public static PafClusterSettings loadDefault() throws IOException {
        Path file = Path.of(DEFAULT_CONFIG_FILE);
        return Files.isRegularFile(file) ? load(file) : empty();
    }

    static PafClusterSettings fromDocument(Object document) {
        if (!(document instanceof Map)) {
            return empty();
        }
        Object section = ((Map<?, ?>) document).get(CONFIG_KEY);
        if (section == null) {
            return empty();
        }
        if (!(section instanceof Map)) {
            throw new IllegalArgumentException("'" + CONFIG_KEY + "' must be a map");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) section;
        return new PafClusterSettings(map);
    }

    /**
     * Build the run configuration.
     *
     * @param groupsCLI         groups given on the command line, empty if none
     * @param bsrThresholdCLI   threshold given on the command line, null if
     *                          none
     * @param allHitsCLI        {@code --all-hits} given
     * @param allBestsCLI       {@code --all-bests} given
     * @param noBrhCLI          {@code --no-brh} given
     * @param firstClusterIdCLI first cluster id given on the command line, null
     *                          if none
     * @throws IllegalArgumentException if the result is not a valid
     *                                  configuration
     */
    public PafClusterConfig loadConfig(List<Integer> groupsCLI, Double bsrThresholdCLI, boolean allHitsCLI,
            boolean allBestsCLI, boolean noBrhCLI, Long firstClusterIdCLI) {

        List<Integer> groups = !groupsCLI.isEmpty() ? groupsCLI : getGroups();
        if (groups.isEmpty()) {
            throw new IllegalArgumentException("No source groups given (use --groups or 'groups' in "
                    + DEFAULT_CONFIG_FILE + ")");
        }

        PafClusterConfig base = preset(getString("preset", "standard"), groups);

        boolean includeBrh = !noBrhCLI && getBoolean("brh", base.includeBrh());
        boolean allHits = allHitsCLI || getBoolean("all_hits", base.allHits());
        boolean allBests = allBestsCLI || getBoolean("all_bests", base.allBests());
        double threshold = bsrThresholdCLI != null ? bsrThresholdCLI : getDouble("bsr_threshold", base.bsrThreshold());
        long firstClusterId = firstClusterIdCLI != null ? firstClusterIdCLI : getLong("first_cluster_id",
                base.firstClusterId());

        return new PafClusterConfig(groups, includeBrh, allHits, allBests, threshold, firstClusterId);
    }

    /**
     * Hit table path from YAML, or null if not specified.
     */
    public String getHitsPath() {
        return getString("hits", null);
    }

    /**
     * Output directory from YAML, or null if not specified.
     */
    public String getOutputPath() {
        return getString("output", null);
    }

    private static PafClusterConfig preset(String name, List<Integer> groups) {
        return switch (name) {
            case "all_hits" -> PafClusterConfig.allHits(groups);
            case "all_bests" -> PafClusterConfig.allBests(groups);
            case "standard" -> PafClusterConfig.standard(groups);
            default -> throw new IllegalArgumentException(
                    "Unknown preset: " + name + ". Must be: standard, all_hits or all_bests");
        };
    }

    List<Integer> getGroups() {
        Object value = config.get("groups");
        List<Integer> groups = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                groups.add(parseGroup(item));
            }
        } else if (value != null) {
            groups.addAll(parseGroups(value.toString()));
        }
        return groups;
    }

    /**
     * Parse a comma separated list of group identifiers such as
     * {@code "1,2, 14"}.
     */
    public static List<Integer> parseGroups(String text) {
        List<Integer> groups = new ArrayList<>();
        for (String part : text.split(",")) {
            if (!part.isBlank()) {
                groups.add(parseGroup(part.trim()));
            }
        }
        return groups;
    }

    private static int parseGroup(Object item) {
        if (item instanceof Number number) {
            double value = number.doubleValue();
            if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Invalid group id: " + item);
            }
            return (int) value;
        }
        try {
            return Integer.parseInt(String.valueOf(item).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid group id: " + item);
        }
    }

    private double getDouble(String key, double defaultValue) {
        Object value = config.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private long getLong(String key, long defaultValue) {
        Object value = config.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private String getString(String key, String defaultValue) {
        Object value = config.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
