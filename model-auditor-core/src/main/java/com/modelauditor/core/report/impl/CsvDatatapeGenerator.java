package com.modelauditor.core.report.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.modelauditor.core.model.AuditReport;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.report.GeneratedReport;
import com.modelauditor.core.report.ReportGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Flat "datatape" of findings, one row per issue, for spreadsheets and BI tools.
 */
public class CsvDatatapeGenerator implements ReportGenerator {

    static final List<String> COLUMNS = List.of(
        "id", "kind", "severity", "confidence", "sheet", "cell", "message", "evidence_cells", "fix");

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public String getId() {
        return "csv";
    }

    @Override
    public String getDisplayName() {
        return "CSV Datatape";
    }

    @Override
    public String getFileExtension() {
        return "csv";
    }

    @Override
    public GeneratedReport generate(AuditReport report) {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        COLUMNS.forEach(schema::addColumn);

        List<List<String>> rows = new ArrayList<>();
        for (Issue issue : report.issues()) {
            rows.add(List.of(
                issue.id(),
                issue.kind().name(),
                issue.severity().name(),
                issue.confidence().name(),
                issue.primaryCell().sheet(),
                issue.primaryCell().address(),
                issue.message(),
                issue.evidence().stream().map(Evidence::cell).map(Object::toString).collect(Collectors.joining(" ")),
                issue.explanation().fix()));
        }
        try {
            String content = mapper.writer(schema.build()).writeValueAsString(rows);
            return new GeneratedReport("audit-datatape", content, getFileExtension(), "text/csv");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write CSV datatape", e);
        }
    }
}
