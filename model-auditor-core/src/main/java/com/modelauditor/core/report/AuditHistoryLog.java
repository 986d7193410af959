package com.modelauditor.core.report;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.modelauditor.core.model.AuditReport;
import com.modelauditor.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Persistent CSV log with one summary row per audit run.
 *
 * <p>The header is written only when the file does not exist yet; later runs append.
 */
public class AuditHistoryLog {

    private static final Logger log = LoggerFactory.getLogger(AuditHistoryLog.class);

    static final List<String> COLUMNS = List.of(
        "timestamp", "workbook", "complexity_score", "critical_issues", "total_issues");

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CsvMapper mapper = new CsvMapper();
    private final Path file;
    private final Clock clock;

    public AuditHistoryLog(Path file) {
        this(file, Clock.systemDefaultZone());
    }

    public AuditHistoryLog(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    /**
     * Appends the summary of one audit.
     *
     * @param report audit result
     * @throws IOException if the log cannot be written
     */
    public void append(AuditReport report) throws IOException {
        boolean isNew = !Files.exists(file);
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(isNew);
        COLUMNS.forEach(schema::addColumn);

        List<String> row = List.of(
            LocalDateTime.now(clock).format(TIMESTAMP),
            report.workbookName(),
            String.valueOf(report.score().value()),
            String.valueOf(report.countBySeverity().get(Severity.CRITICAL)),
            String.valueOf(report.issues().size()));

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            mapper.writer(schema.build()).writeValue(writer, List.of(row));
        }
        log.debug("Appended audit of {} to history {}", report.workbookName(), file);
    }

    public Path getFile() {
        return file;
    }
}
