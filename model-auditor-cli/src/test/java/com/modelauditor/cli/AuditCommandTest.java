package com.modelauditor.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AuditCommand}.
 */
class AuditCommandTest {

    @TempDir
    Path tempDir;

    private int run(String... args) {
        return new CommandLine(new AuditCommand()).execute(args);
    }

    private String noConfig() {
        return tempDir.resolve("absent.yaml").toString();
    }

    @Test
    void audit_writesRequestedFormats() throws IOException {
        Path workbook = Workbooks.circular(tempDir);
        Path out = tempDir.resolve("reports");

        int exitCode = run(workbook.toString(), "-c", noConfig(), "-o", out.toString(), "-f", "markdown,json,csv");

        assertThat(exitCode).isZero();
        assertThat(out.resolve("audit-report.md")).exists();
        assertThat(out.resolve("audit-report.json")).exists();
        assertThat(out.resolve("audit-datatape.csv")).exists();
        assertThat(Files.readString(out.resolve("audit-report.md"))).contains("Circular Reference");
    }

    @Test
    void audit_xlsxFormat_writesExcelDatatape() throws IOException {
        Path workbook = Workbooks.circular(tempDir);
        Path out = tempDir.resolve("reports");

        int exitCode = run(workbook.toString(), "-c", noConfig(), "-o", out.toString(), "-f", "xlsx");

        assertThat(exitCode).isZero();
        byte[] bytes = Files.readAllBytes(out.resolve("audit-datatape.xlsx"));
        assertThat(bytes).startsWith((byte) 'P', (byte) 'K');
    }

    @Test
    void audit_jsonReportListsCircularReference() throws IOException {
        Path workbook = Workbooks.circular(tempDir);
        Path out = tempDir.resolve("reports");

        run(workbook.toString(), "-c", noConfig(), "-o", out.toString(), "-f", "json");

        JsonNode root = new ObjectMapper().readTree(out.resolve("audit-report.json").toFile());
        assertThat(root.get("workbook").asText()).isEqualTo("loop.xlsx");
        assertThat(root.get("issues")).anySatisfy(issue ->
            assertThat(issue.get("kind").asText()).isEqualTo("CIRCULAR_REFERENCE"));
    }

    @Test
    void audit_failOnReached_returnsTwo() throws IOException {
        Path workbook = Workbooks.circular(tempDir);

        int exitCode = run(workbook.toString(), "-c", noConfig(), "-o", tempDir.resolve("r").toString(),
            "--fail-on", "HIGH");

        assertThat(exitCode).isEqualTo(AuditCommand.EXIT_THRESHOLD_REACHED);
    }

    @Test
    void audit_failOnAboveFindings_returnsZero() throws IOException {
        Path workbook = Workbooks.circular(tempDir);

        int exitCode = run(workbook.toString(), "-c", noConfig(), "-o", tempDir.resolve("r").toString(),
            "--fail-on", "CRITICAL");

        assertThat(exitCode).isZero();
    }

    @Test
    void audit_missingWorkbook_returnsOne() {
        int exitCode = run(tempDir.resolve("missing.xlsx").toString(), "-c", noConfig(),
            "-o", tempDir.resolve("r").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void audit_csvInput_auditsValues() throws IOException {
        Path csv = Workbooks.values(tempDir);
        Path out = tempDir.resolve("reports");

        int exitCode = run(csv.toString(), "-c", noConfig(), "-o", out.toString(), "-f", "markdown");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(out.resolve("audit-report.md"))).contains("Formula-based checks were skipped");
    }

    @Test
    void audit_csvWithRequireFormulas_returnsOne() throws IOException {
        Path csv = Workbooks.values(tempDir);

        int exitCode = run(csv.toString(), "-c", noConfig(), "-o", tempDir.resolve("r").toString(),
            "--require-formulas");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void audit_unknownFormat_isSkipped() throws IOException {
        Path workbook = Workbooks.circular(tempDir);
        Path out = tempDir.resolve("reports");

        int exitCode = run(workbook.toString(), "-c", noConfig(), "-o", out.toString(), "-f", "pdf,json");

        assertThat(exitCode).isZero();
        try (var files = Files.list(out)) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("audit-report.json");
        }
    }

    @Test
    void audit_usesOutputSettingsFromConfig() throws IOException {
        Path workbook = Workbooks.circular(tempDir);
        Path out = tempDir.resolve("configured");
        Path config = tempDir.resolve("modelauditor.yaml");
        Files.writeString(config, "output:\n  directory: " + out.toString().replace('\\', '/') + "\n  formats: [csv]\n");

        int exitCode = run(workbook.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.resolve("audit-datatape.csv")).exists();
    }

    @Test
    void audit_withHistory_appendsOneRowPerRun() throws IOException {
        Path workbook = Workbooks.circular(tempDir);
        Path history = tempDir.resolve("audit_history.csv");
        String out = tempDir.resolve("reports").toString();

        run(workbook.toString(), "-c", noConfig(), "-o", out, "--history", history.toString());
        run(workbook.toString(), "-c", noConfig(), "-o", out, "--history", history.toString());

        List<String> lines = Files.readAllLines(history);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("timestamp,workbook,complexity_score,critical_issues,total_issues");
        assertThat(lines.subList(1, 3)).allSatisfy(line -> assertThat(line).contains(",loop.xlsx,"));
    }

    @Test
    void audit_withoutHistory_writesNoLog() throws IOException {
        Path workbook = Workbooks.circular(tempDir);

        run(workbook.toString(), "-c", noConfig(), "-o", tempDir.resolve("reports").toString());

        assertThat(tempDir.resolve("audit_history.csv")).doesNotExist();
    }
}
