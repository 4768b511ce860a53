package com.raditha.pafcluster.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for error handling, exit codes and help generation.
 */
class ErrorHandlingTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private PrintStream originalOut;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        System.setOut(new PrintStream(new ByteArrayOutputStream()));
        out = new StringWriter();
        err = new StringWriter();
        cmd = PafClusterCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void testHelp() {
        int exitCode = cmd.execute("--help");

        assertEquals(0, exitCode);
        String help = out.toString();
        assertTrue(help.contains("pafcluster"));
        assertTrue(help.contains("--groups"));
        assertTrue(help.contains("--bsr-threshold"));
        assertTrue(help.contains("--no-brh"));
    }

    @Test
    void testVersion() {
        int exitCode = cmd.execute("--version");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("pafcluster v1.0.0"));
    }

    @Test
    void testInvalidOption() {
        int exitCode = cmd.execute("--invalid-option");

        assertEquals(2, exitCode);
        String errorOutput = err.toString();
        assertTrue(errorOutput.contains("Unknown option") || errorOutput.contains("Unmatched argument"),
                "Error message should indicate unknown option");
    }

    @Test
    void testInvalidType() {
        int exitCode = cmd.execute("--bsr-threshold", "high");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("high"));
    }

    @Test
    void testThresholdOutOfRange() {
        int exitCode = cmd.execute("--bsr-threshold", "1.5", "--groups", "1");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("BSR threshold must be between 0 and 1"));
    }

    @Test
    void testNegativeThreshold() throws URISyntaxException {
        int exitCode = cmd.execute("--hits", sampleHits(), "--groups", "1", "--output", tempDir.toString(),
                "--bsr-threshold", "-0.5");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("BSR threshold must be between 0 and 1, got: -0.5"));
        assertFalse(Files.exists(tempDir.resolve(PafClusterCLI.CLUSTERS_FILE)));
    }

    @Test
    void testNaNThreshold() throws URISyntaxException {
        int exitCode = cmd.execute("--hits", sampleHits(), "--groups", "1", "--output", tempDir.toString(),
                "--bsr-threshold", "NaN");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("BSR threshold must be between 0 and 1, got: NaN"));
    }

    @Test
    void testZeroFirstClusterId() throws URISyntaxException {
        int exitCode = cmd.execute("--hits", sampleHits(), "--groups", "1", "--output", tempDir.toString(),
                "--first-cluster-id", "0");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("First cluster id must be positive, got: 0"));
    }

    @Test
    void testZeroThresholdAccepted() throws URISyntaxException {
        int exitCode = cmd.execute("--hits", sampleHits(), "--groups", "1", "--output", tempDir.toString(),
                "--bsr-threshold", "0");

        assertEquals(0, exitCode);
    }

    @Test
    void testInvalidExportFormat() {
        int exitCode = cmd.execute("--export", "xml", "--groups", "1");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Export format"));
    }

    @Test
    void testMissingConfigFile() {
        int exitCode = cmd.execute("--config-file", tempDir.resolve("absent.yml").toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Config file not found"));
    }

    @Test
    void testMissingGroups() throws URISyntaxException {
        int exitCode = cmd.execute("--hits", sampleHits(), "--output", tempDir.toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("No source groups given"));
    }

    @Test
    void testMissingHitTable() {
        int exitCode = cmd.execute("--groups", "1", "--hits", tempDir.resolve("absent.tsv").toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Hit table not found"));
    }

    @Test
    void testOutputPathIsFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("taken"), "x");

        int exitCode = cmd.execute("--groups", "1", "--output", file.toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("not a directory"));
    }

    @Test
    void testMalformedTableReportsPhase() throws IOException {
        Path table = Files.writeString(tempDir.resolve("broken.tsv"), "1\t1\t1\t1\tnot-a-score\t1\n");

        int exitCode = cmd.execute("--groups", "1", "--hits", table.toString(),
                "--output", tempDir.resolve("out").toString());

        assertEquals(3, exitCode);
        String errorOutput = err.toString();
        assertTrue(errorOutput.contains("Clustering failed during self hit score loading for groups [1]"),
                errorOutput);
        assertTrue(errorOutput.contains("broken.tsv line 1"), errorOutput);
        assertFalse(Files.exists(tempDir.resolve("out").resolve(PafClusterCLI.CLUSTERS_FILE)));
    }

    private String sampleHits() throws URISyntaxException {
        return Path.of(getClass().getResource("/hits/sample.tsv").toURI()).toString();
    }
}
