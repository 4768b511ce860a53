package com.raditha.pafcluster.sink;

import com.raditha.pafcluster.model.MemberCluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes clusters to a tab separated file.
 * <p>
 * Rows go to {@code <file>.partial} and the file is moved into place on
 * {@link #commit()}, so a reader never sees the clusters of a failed run.
 *
 * <pre>
 * # clusterset ORTHO_CLUSTERS groups=1,2,3
 * cluster_id  member_count  members
 * 1           3             101,205,317
 * </pre>
 */
public class TsvClusterWriter implements ClusterSink {

    public static final String CLUSTER_SET_NAME = "ORTHO_CLUSTERS";

    private static final Logger logger = LoggerFactory.getLogger(TsvClusterWriter.class);

    private final Path target;
    private final Path partial;
    private final List<Integer> groups;
    private BufferedWriter writer;
    private int written;

    public TsvClusterWriter(Path target, List<Integer> groups) {
        this.target = target;
        this.partial = target.resolveSibling(target.getFileName() + ".partial");
        this.groups = List.copyOf(groups);
    }

    @Override
    public void store(MemberCluster cluster) throws IOException {
        if (writer == null) {
            open();
        }
        writer.write(String.format("%d\t%d\t%s%n",
                cluster.clusterId(),
                cluster.size(),
                cluster.members().stream().map(String::valueOf).collect(Collectors.joining(","))));
        written++;
    }

    @Override
    public void commit() throws IOException {
        if (writer == null) {
            open();
        }
        writer.close();
        writer = null;
        Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Wrote {} clusters to {}", written, target);
    }

    @Override
    public void abort() {
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                logger.warn("Could not close partial cluster file {}: {}", partial, e.getMessage());
            }
            writer = null;
        }
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            logger.warn("Could not remove partial cluster file {}: {}", partial, e.getMessage());
        }
    }

    private void open() throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8);
        writer.write(String.format("# clusterset %s groups=%s%n", CLUSTER_SET_NAME,
                groups.stream().map(String::valueOf).collect(Collectors.joining(","))));
        writer.write(String.format("cluster_id\tmember_count\tmembers%n"));
    }

    public Path target() {
        return target;
    }

    public int written() {
        return written;
    }
}
