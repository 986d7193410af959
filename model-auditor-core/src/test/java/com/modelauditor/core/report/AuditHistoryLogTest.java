package com.modelauditor.core.report;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AuditHistoryLog}.
 */
class AuditHistoryLogTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T09:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void append_newFile_writesHeaderAndRow() throws IOException {
        Path file = tempDir.resolve("audit_history.csv");

        new AuditHistoryLog(file, CLOCK).append(ReportFixtures.report());

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).isEqualTo("timestamp,workbook,complexity_score,critical_issues,total_issues");
        assertThat(lines.get(1)).contains("2024-03-01 09:30:00").endsWith(",model.xlsx,3,1,2");
    }

    @Test
    void append_existingFile_addsRowWithoutHeader() throws IOException {
        Path file = tempDir.resolve("audit_history.csv");
        AuditHistoryLog history = new AuditHistoryLog(file, CLOCK);

        history.append(ReportFixtures.report());
        history.append(ReportFixtures.clean());

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).startsWith("timestamp,");
        assertThat(lines.get(2)).endsWith(",clean.xlsx,1,0,0");
    }

    @Test
    void append_missingParentDirectory_createsIt() throws IOException {
        Path file = tempDir.resolve("logs/nested/history.csv");

        new AuditHistoryLog(file, CLOCK).append(ReportFixtures.clean());

        assertThat(file).exists();
    }
}
