package com.raditha.pafcluster.metrics;

import com.raditha.pafcluster.analyzer.ClusteringReport;
import com.raditha.pafcluster.analyzer.PassStatistics;
import com.raditha.pafcluster.clustering.EmissionSummary;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Exports clustering run metrics to CSV and JSON formats for dashboards and
 * comparison between runs.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    /**
     * Run-level metrics.
     */
    public record RunMetrics(
            String runName,
            LocalDateTime timestamp,
            List<Integer> groups,
            double bsrThreshold,
            int selfHitsLoaded,
            long hitsProcessed,
            long hitsAdmitted,
            long missingSelfHits,
            int clustersEmitted,
            long membersClustered,
            int singletonsSkipped,
            double averageClusterSize,
            long elapsedMillis,
            List<PassMetrics> passes) {
    }

    /**
     * Per-pass metrics.
     */
    public record PassMetrics(
            String pass,
            String groups,
            long processed,
            long admitted,
            long bestRank,
            long scoreRatio,
            long missingSelfHits,
            long elapsedMillis) {
    }

    /**
     * Build metrics from a run report and its emission summary.
     */
    public RunMetrics buildMetrics(ClusteringReport report, EmissionSummary emission, String runName) {
        List<PassMetrics> passes = report.passes().stream()
                .map(this::buildPassMetrics)
                .toList();

        return new RunMetrics(
                runName,
                LocalDateTime.now(),
                report.config().groups(),
                report.config().bsrThreshold(),
                report.selfHitsLoaded(),
                report.getProcessedCount(),
                report.getAdmittedCount(),
                report.getMissingSelfHitCount(),
                emission.clustersEmitted(),
                emission.membersEmitted(),
                emission.singletonsSkipped(),
                emission.getAverageClusterSize(),
                report.elapsedMillis(),
                passes);
    }

    private PassMetrics buildPassMetrics(PassStatistics stats) {
        return new PassMetrics(
                stats.phase().name(),
                stats.groups().stream().map(String::valueOf).collect(Collectors.joining("-")),
                stats.processed(),
                stats.admitted(),
                stats.bestRank(),
                stats.scoreRatio(),
                stats.missingSelfHits(),
                stats.elapsedMillis());
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(RunMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Run Summary\n");
        csv.append("timestamp,run,groups,bsr_threshold,self_hits,hits_processed,hits_admitted,"
                + "missing_self_hits,clusters,members,singletons_skipped,avg_cluster_size,elapsed_ms\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%s,%.3f,%d,%d,%d,%d,%d,%d,%d,%.2f,%d\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.runName(),
                metrics.groups().stream().map(String::valueOf).collect(Collectors.joining(";")),
                metrics.bsrThreshold(),
                metrics.selfHitsLoaded(),
                metrics.hitsProcessed(),
                metrics.hitsAdmitted(),
                metrics.missingSelfHits(),
                metrics.clustersEmitted(),
                metrics.membersClustered(),
                metrics.singletonsSkipped(),
                metrics.averageClusterSize(),
                metrics.elapsedMillis()));

        csv.append("\n");

        csv.append("# Per-Pass Metrics\n");
        csv.append("pass,groups,processed,admitted,best_rank,score_ratio,missing_self_hits,elapsed_ms\n");

        for (PassMetrics pass : metrics.passes()) {
            csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%d,%d,%d,%d\n",
                    pass.pass(),
                    pass.groups(),
                    pass.processed(),
                    pass.admitted(),
                    pass.bestRank(),
                    pass.scoreRatio(),
                    pass.missingSelfHits(),
                    pass.elapsedMillis()));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(RunMetrics metrics, Path outputPath) throws IOException {
        StringBuilder json = new StringBuilder();

        json.append("{\n");
        json.append(String.format("  \"timestamp\": \"%s\",\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT)));
        json.append(String.format("  \"run\": \"%s\",\n", metrics.runName()));
        json.append(String.format("  \"groups\": [%s],\n",
                metrics.groups().stream().map(String::valueOf).collect(Collectors.joining(", "))));

        json.append("  \"summary\": {\n");
        json.append(String.format(Locale.ROOT, "    \"bsrThreshold\": %.3f,\n", metrics.bsrThreshold()));
        json.append(String.format("    \"selfHitsLoaded\": %d,\n", metrics.selfHitsLoaded()));
        json.append(String.format("    \"hitsProcessed\": %d,\n", metrics.hitsProcessed()));
        json.append(String.format("    \"hitsAdmitted\": %d,\n", metrics.hitsAdmitted()));
        json.append(String.format("    \"missingSelfHits\": %d,\n", metrics.missingSelfHits()));
        json.append(String.format("    \"clusters\": %d,\n", metrics.clustersEmitted()));
        json.append(String.format("    \"membersClustered\": %d,\n", metrics.membersClustered()));
        json.append(String.format("    \"singletonsSkipped\": %d,\n", metrics.singletonsSkipped()));
        json.append(String.format(Locale.ROOT, "    \"averageClusterSize\": %.2f,\n",
                metrics.averageClusterSize()));
        json.append(String.format("    \"elapsedMillis\": %d\n", metrics.elapsedMillis()));
        json.append("  },\n");

        json.append("  \"passes\": [\n");

        for (int i = 0; i < metrics.passes().size(); i++) {
            PassMetrics pass = metrics.passes().get(i);
            json.append("    {\n");
            json.append(String.format("      \"pass\": \"%s\",\n", pass.pass()));
            json.append(String.format("      \"groups\": \"%s\",\n", pass.groups()));
            json.append(String.format("      \"processed\": %d,\n", pass.processed()));
            json.append(String.format("      \"admitted\": %d,\n", pass.admitted()));
            json.append(String.format("      \"bestRank\": %d,\n", pass.bestRank()));
            json.append(String.format("      \"scoreRatio\": %d,\n", pass.scoreRatio()));
            json.append(String.format("      \"missingSelfHits\": %d,\n", pass.missingSelfHits()));
            json.append(String.format("      \"elapsedMillis\": %d\n", pass.elapsedMillis()));
            json.append(i < metrics.passes().size() - 1 ? "    },\n" : "    }\n");
        }

        json.append("  ]\n");
        json.append("}\n");

        Files.writeString(outputPath, json.toString());
    }
}
