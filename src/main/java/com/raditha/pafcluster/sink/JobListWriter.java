package com.raditha.pafcluster.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes one job input id per stored cluster, for the scheduler that runs the
 * per-cluster analyses.
 *
 * <pre>
 * {"protein_tree_id": 1}
 * {"protein_tree_id": 2}
 * </pre>
 */
public class JobListWriter implements FanOutSink {

    private static final Logger logger = LoggerFactory.getLogger(JobListWriter.class);

    private final Path target;
    private BufferedWriter writer;
    private int dispatched;

    public JobListWriter(Path target) {
        this.target = target;
    }

    @Override
    public void dispatch(long clusterId) throws IOException {
        if (writer == null) {
            open();
        }
        writer.write(String.format("{\"protein_tree_id\": %d}%n", clusterId));
        dispatched++;
    }

    @Override
    public void finish() throws IOException {
        if (writer == null) {
            // no clusters, still leave an empty job list behind
            open();
        }
        writer.close();
        writer = null;
    }

    /**
     * Close the job list, keeping the ids dispatched so far.
     */
    @Override
    public void abort() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            logger.warn("Could not close job list {}: {}", target, e.getMessage());
        }
        writer = null;
    }

    private void open() throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
    }

    public int dispatched() {
        return dispatched;
    }
}
