package com.raditha.pafcluster.cli;

import com.raditha.pafcluster.analyzer.ClusteringDriver;
import com.raditha.pafcluster.analyzer.ClusteringException;
import com.raditha.pafcluster.analyzer.ClusteringReport;
import com.raditha.pafcluster.analyzer.ClusteringResult;
import com.raditha.pafcluster.analyzer.PassStatistics;
import com.raditha.pafcluster.clustering.ClusterIdAllocator;
import com.raditha.pafcluster.clustering.EmissionSummary;
import com.raditha.pafcluster.clustering.PartitionEmitter;
import com.raditha.pafcluster.config.PafClusterConfig;
import com.raditha.pafcluster.config.PafClusterSettings;
import com.raditha.pafcluster.metrics.MetricsExporter;
import com.raditha.pafcluster.sink.JobListWriter;
import com.raditha.pafcluster.sink.TsvClusterWriter;
import com.raditha.pafcluster.source.HitTableSource;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command-line interface for PAF clustering.
 * <p>
 * Usage:
 * java -jar paf-cluster.jar --hits paf.tsv --groups 1,2,3 [options]
 * <p>
 * Configuration priority: CLI arguments > pafcluster.yml > defaults
 */
@Command(name = "pafcluster", mixinStandardHelpOptions = true, version = "pafcluster v1.0.0",
        description = "Single-linkage clustering of peptide align features into protein clusters")
@SuppressWarnings("java:S106")
public class PafClusterCLI implements Callable<Integer> {

    private static final String VERSION = "1.0.0";
    static final String CLUSTERS_FILE = "clusters.tsv";
    static final String JOBS_FILE = "jobs.txt";

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--hits", description = "Hit table to cluster (tab separated)", paramLabel = "<path>")
    private String hitsPath;

    @Option(names = "--groups", split = ",", description = "Source group ids to cluster, e.g. 1,2,3",
            paramLabel = "<id>")
    private List<Integer> groups = new ArrayList<>();

    @Option(names = "--output", description = "Output directory (default: current directory)", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--bsr-threshold", description = "Blast score ratio threshold 0-1 (default: 0.25)",
            paramLabel = "<ratio>")
    private Double bsrThreshold; // null = use YAML/default

    @Option(names = "--all-hits", description = "Link members of every hit, no filtering")
    private boolean allHits = false;

    @Option(names = "--all-bests", description = "Link members of every best hit (rank 1)")
    private boolean allBests = false;

    @Option(names = "--no-brh", description = "Skip the reciprocal best hit passes")
    private boolean noBrh = false;

    @Option(names = "--first-cluster-id", description = "First cluster id to hand out (default: 1)",
            paramLabel = "<n>")
    private Long firstClusterId; // null = use YAML/default

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        PafClusterSettings settings = configFile != null
                ? PafClusterSettings.load(Paths.get(configFile))
                : PafClusterSettings.loadDefault();

        PafClusterConfig config = settings.loadConfig(groups, bsrThreshold, allHits, allBests, noBrh,
                firstClusterId);

        String hits = hitsPath != null ? hitsPath : settings.getHitsPath();
        if (hits == null) {
            throw new IllegalArgumentException("No hit table given (use --hits or 'hits' in "
                    + PafClusterSettings.DEFAULT_CONFIG_FILE + ")");
        }
        Path hitTable = Paths.get(hits);
        if (!Files.isRegularFile(hitTable)) {
            throw new IllegalArgumentException("Hit table not found: " + hits);
        }

        String output = outputPath != null ? outputPath : settings.getOutputPath();
        Path outputDir = output != null ? Paths.get(output) : Paths.get(".");
        Files.createDirectories(outputDir);

        ClusteringResult result = new ClusteringDriver(new HitTableSource(hitTable), config).cluster();

        PartitionEmitter emitter = new PartitionEmitter(
                new TsvClusterWriter(outputDir.resolve(CLUSTERS_FILE), config.groups()),
                new JobListWriter(outputDir.resolve(JOBS_FILE)),
                config.groups());
        EmissionSummary emission = emitter.emit(result.registry(), new ClusterIdAllocator(config.firstClusterId()));

        if (jsonOutput) {
            printJsonReport(result.report(), emission);
        } else {
            printTextReport(result.report(), emission, outputDir);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(result.report(), emission, hitTable, outputDir);
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit code mapping used by {@link #main(String[])}.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new PafClusterCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof ClusteringException ce) {
                commandLine.getErr().printf("Clustering failed during %s for groups %s%n",
                        ce.getPhase().label(), ce.getGroups());
                commandLine.getErr().println("Cause: " + ce.getCause().getMessage());
                return 3;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Validate CLI values before execution.
     *
     * @throws IllegalArgumentException if a value is invalid
     */
    private void validateConfiguration() {
        if (bsrThreshold != null && (bsrThreshold.isNaN() || bsrThreshold < 0.0 || bsrThreshold > 1.0)) {
            throw new IllegalArgumentException("BSR threshold must be between 0 and 1, got: " + bsrThreshold);
        }

        if (firstClusterId != null && firstClusterId < 1) {
            throw new IllegalArgumentException("First cluster id must be positive, got: " + firstClusterId);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase();
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    private static void printTextReport(ClusteringReport report, EmissionSummary emission, Path outputDir) {
        PafClusterConfig config = report.config();

        System.out.println("=".repeat(80));
        System.out.println("PAF CLUSTERING REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.printf("Groups: %s%n", config.groups().stream().map(String::valueOf)
                .collect(Collectors.joining(",")));
        System.out.printf("Configuration: brh=%s, all_hits=%s, all_bests=%s, bsr_threshold=%.3f%n",
                config.includeBrh(), config.allHits(), config.allBests(), config.bsrThreshold());
        System.out.printf("Self hits loaded: %d%n", report.selfHitsLoaded());
        System.out.println();

        System.out.println("-".repeat(80));
        System.out.println("PASSES");
        System.out.println("-".repeat(80));
        for (PassStatistics pass : report.passes()) {
            System.out.println("  " + pass.formatSummary());
        }
        System.out.println();

        System.out.println("=".repeat(80));
        System.out.println("SUMMARY");
        System.out.println("=".repeat(80));
        System.out.printf("Hits processed: %d%n", report.getProcessedCount());
        System.out.printf("Hits admitted: %d%n", report.getAdmittedCount());
        System.out.printf("Missing self hits: %d%n", report.getMissingSelfHitCount());
        System.out.printf("Clusters stored: %d (%d members, avg %.1f per cluster)%n",
                emission.clustersEmitted(), emission.membersEmitted(), emission.getAverageClusterSize());
        if (emission.clustersEmitted() > 0) {
            System.out.printf("Cluster ids: %d-%d%n", emission.firstClusterId(), emission.lastClusterId());
        }
        System.out.printf("Clusters file: %s%n", outputDir.resolve(CLUSTERS_FILE));
        System.out.printf("Job list: %s%n", outputDir.resolve(JOBS_FILE));
        System.out.println();
    }

    private static void printJsonReport(ClusteringReport report, EmissionSummary emission) {
        System.out.println("{");
        System.out.printf("  \"version\": \"%s\",%n", VERSION);
        System.out.printf("  \"groups\": [%s],%n", report.config().groups().stream().map(String::valueOf)
                .collect(Collectors.joining(", ")));
        System.out.printf("  \"hitsProcessed\": %d,%n", report.getProcessedCount());
        System.out.printf("  \"hitsAdmitted\": %d,%n", report.getAdmittedCount());
        System.out.printf("  \"missingSelfHits\": %d,%n", report.getMissingSelfHitCount());
        System.out.printf("  \"clusters\": %d,%n", emission.clustersEmitted());
        System.out.printf("  \"members\": %d%n", emission.membersEmitted());
        System.out.println("}");
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(ClusteringReport report, EmissionSummary emission, Path hitTable, Path outputDir)
            throws IOException {
        MetricsExporter exporter = new MetricsExporter();
        String runName = hitTable.getFileName().toString();

        MetricsExporter.RunMetrics metrics = exporter.buildMetrics(report, emission, runName);
        String format = exportFormat.toLowerCase();

        if ("csv".equals(format) || "both".equals(format)) {
            Path csvPath = outputDir.resolve("clustering-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            System.out.println("Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if ("json".equals(format) || "both".equals(format)) {
            Path jsonPath = outputDir.resolve("clustering-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            System.out.println("Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }
}
