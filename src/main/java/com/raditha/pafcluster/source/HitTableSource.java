package com.raditha.pafcluster.source;

import com.raditha.pafcluster.model.HitPair;
import com.raditha.pafcluster.model.SelfHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Edge source backed by a tab separated hit table.
 * <p>
 * Each non-comment line holds one hit:
 *
 * <pre>
 * qmember_id  hmember_id  qgroup_id  hgroup_id  score  hit_rank
 * </pre>
 *
 * Lines starting with {@code #} and blank lines are skipped. The file is
 * re-read for every stream, so only the rows of the current pass are ever in
 * memory.
 */
public class HitTableSource implements EdgeSource {

    private static final Logger logger = LoggerFactory.getLogger(HitTableSource.class);
    private static final int COLUMNS = 6;

    private final Path table;

    public HitTableSource(Path table) {
        this.table = table;
    }

    /**
     * One parsed line of the hit table.
     */
    record HitRow(long queryMember, long hitMember, int queryGroup, int hitGroup, double score, int rank) {

        boolean isSelfHit() {
            return queryMember == hitMember;
        }

        HitPair toPair() {
            return new HitPair(queryMember, hitMember, score, rank);
        }
    }

    private record MemberPair(long query, long hit) {
    }

    @Override
    public Stream<SelfHit> selfHits(Collection<Integer> groups) throws IOException {
        Set<Integer> wanted = Set.copyOf(groups);
        return rows()
                .filter(HitRow::isSelfHit)
                .filter(row -> wanted.contains(row.queryGroup()))
                .map(row -> new SelfHit(row.queryMember(), row.score()));
    }

    @Override
    public Stream<HitPair> reciprocalBestHits(int group1, int group2) throws IOException {
        if (group1 == group2) {
            return Stream.empty();
        }

        // Reverse direction best hits, group2 -> group1
        Set<MemberPair> reverseBest = new HashSet<>();
        try (Stream<HitRow> rows = rows()) {
            rows.filter(row -> row.rank() == 1
                            && row.queryGroup() == group2
                            && row.hitGroup() == group1
                            && !row.isSelfHit())
                    .forEach(row -> reverseBest.add(new MemberPair(row.queryMember(), row.hitMember())));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        logger.debug("{} best hits from group {} to group {}", reverseBest.size(), group2, group1);

        return rows()
                .filter(row -> row.rank() == 1
                        && row.queryGroup() == group1
                        && row.hitGroup() == group2
                        && !row.isSelfHit())
                .filter(row -> reverseBest.contains(new MemberPair(row.hitMember(), row.queryMember())))
                .map(HitRow::toPair);
    }

    @Override
    public Stream<HitPair> thresholdHits(List<Integer> groups) throws IOException {
        Set<Integer> wanted = Set.copyOf(groups);
        boolean crossGroupOnly = wanted.size() > 1;
        return rows()
                .filter(row -> !row.isSelfHit())
                .filter(row -> wanted.contains(row.queryGroup()) && wanted.contains(row.hitGroup()))
                .filter(row -> !crossGroupOnly || row.queryGroup() != row.hitGroup())
                .map(HitRow::toPair);
    }

    /**
     * Stream the parsed rows of the table. Malformed lines fail the stream
     * with an {@link UncheckedIOException} naming the line.
     */
    Stream<HitRow> rows() throws IOException {
        AtomicLong lineNumber = new AtomicLong();
        return Files.lines(table, StandardCharsets.UTF_8)
                .map(line -> parse(line, lineNumber.incrementAndGet()))
                .filter(Objects::nonNull);
    }

    private HitRow parse(String line, long lineNumber) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return null;
        }
        String[] fields = trimmed.split("\\s+");
        if (fields.length < COLUMNS) {
            throw malformed(lineNumber, "expected " + COLUMNS + " columns, got " + fields.length);
        }
        try {
            return new HitRow(
                    Long.parseLong(fields[0]),
                    Long.parseLong(fields[1]),
                    Integer.parseInt(fields[2]),
                    Integer.parseInt(fields[3]),
                    Double.parseDouble(fields[4]),
                    Integer.parseInt(fields[5]));
        } catch (NumberFormatException e) {
            throw malformed(lineNumber, e.getMessage());
        }
    }

    private UncheckedIOException malformed(long lineNumber, String detail) {
        return new UncheckedIOException(new IOException(
                String.format("%s line %d: malformed hit row (%s)", table.getFileName(), lineNumber, detail)));
    }

    public Path table() {
        return table;
    }
}
