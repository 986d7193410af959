package com.modelauditor.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DiffCommand}.
 */
class DiffCommandTest {

    private static final String BASELINE = """
        {"formatVersion": 1, "issues": [
          {"id": "aaaa", "kind": "CIRCULAR_REFERENCE", "severity": "HIGH", "cell": "Model!A1"},
          {"id": "bbbb", "kind": "ORPHANED_REGION", "severity": "LOW", "cell": "Model!H9"}
        ]}
        """;

    private static final String CURRENT = """
        {"formatVersion": 1, "issues": [
          {"id": "aaaa", "kind": "CIRCULAR_REFERENCE", "severity": "HIGH", "cell": "Model!A1"},
          {"id": "cccc", "kind": "HARD_CODED_PLUG", "severity": "HIGH", "cell": "Model!F2"}
        ]}
        """;

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void readIssues_returnsSummariesInReportOrder() throws IOException {
        Map<String, String> issues = new DiffCommand().readIssues(write("current.json", CURRENT));

        assertThat(issues).containsExactly(
            entry("aaaa", "HIGH CIRCULAR_REFERENCE Model!A1"),
            entry("cccc", "HIGH HARD_CODED_PLUG Model!F2"));
    }

    @Test
    void readIssues_nonReport_throws() throws IOException {
        Path file = write("other.json", "{\"name\": \"x\"}");

        assertThatThrownBy(() -> new DiffCommand().readIssues(file))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Not an audit report (no issues array)");
    }

    @Test
    void diff_withNewIssues_succeedsByDefault() throws IOException {
        int exitCode = new CommandLine(new DiffCommand()).execute(
            "-b", write("baseline.json", BASELINE).toString(),
            "--current", write("current.json", CURRENT).toString());

        assertThat(exitCode).isZero();
    }

    @Test
    void diff_withNewIssuesAndFailOnNew_returnsTwo() throws IOException {
        int exitCode = new CommandLine(new DiffCommand()).execute(
            "-b", write("baseline.json", BASELINE).toString(),
            "--current", write("current.json", CURRENT).toString(),
            "--fail-on-new");

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void diff_withOnlyResolvedIssues_passesFailOnNew() throws IOException {
        int exitCode = new CommandLine(new DiffCommand()).execute(
            "-b", write("baseline.json", BASELINE).toString(),
            "--current", write("current.json", BASELINE.replace("bbbb", "aaaa")).toString(),
            "--fail-on-new");

        assertThat(exitCode).isZero();
    }

    @Test
    void diff_unreadableReport_returnsOne() throws IOException {
        int exitCode = new CommandLine(new DiffCommand()).execute(
            "-b", write("baseline.json", BASELINE).toString(),
            "--current", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
