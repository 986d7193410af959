package com.modelauditor.core.report.impl;

import com.modelauditor.core.model.AuditReport;
import com.modelauditor.core.model.Issue;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.Severity;
import com.modelauditor.core.report.GeneratedReport;
import com.modelauditor.core.report.ReportGenerator;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Excel workbook with an "Executive Summary" sheet and a "Findings" sheet.
 *
 * <p>Findings are grouped by issue kind: each kind gets a bold heading row followed by
 * a collapsed outline group holding its issues.
 */
public class XlsxDatatapeGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(XlsxDatatapeGenerator.class);

    public static final String SUMMARY_SHEET = "Executive Summary";
    public static final String FINDINGS_SHEET = "Findings";
    public static final String CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    static final List<String> COLUMNS = List.of(
        "id", "kind", "severity", "confidence", "cell", "message", "fix");

    private static final int[] COLUMN_WIDTHS = {18, 26, 10, 12, 22, 70, 50};

    @Override
    public String getId() {
        return "xlsx";
    }

    @Override
    public String getDisplayName() {
        return "Excel Datatape";
    }

    @Override
    public String getFileExtension() {
        return "xlsx";
    }

    @Override
    public GeneratedReport generate(AuditReport report) {
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle bold = boldStyle(workbook);
            writeSummary(workbook.createSheet(SUMMARY_SHEET), report, bold);
            writeFindings(workbook.createSheet(FINDINGS_SHEET), report, bold);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            log.debug("Excel datatape for {}: {} issue(s), {} bytes",
                report.workbookName(), report.issues().size(), out.size());
            return GeneratedReport.binary("audit-datatape", out.toByteArray(), getFileExtension(), CONTENT_TYPE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write Excel datatape", e);
        }
    }

    private void writeSummary(Sheet sheet, AuditReport report, CellStyle bold) {
        int r = 0;
        Row title = sheet.createRow(r++);
        title.createCell(0).setCellValue("Model Audit");
        title.getCell(0).setCellStyle(bold);
        r++;

        r = labelled(sheet, r, "Workbook", report.workbookName());
        Row score = sheet.createRow(r++);
        score.createCell(0).setCellValue("Complexity score");
        score.createCell(1).setCellValue(report.score().value());
        Row total = sheet.createRow(r++);
        total.createCell(0).setCellValue("Total issues");
        total.createCell(1).setCellValue(report.issues().size());

        Map<Severity, Long> counts = report.countBySeverity();
        Severity[] order = {Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW};
        for (Severity severity : order) {
            Row row = sheet.createRow(r++);
            row.createCell(0).setCellValue(capitalize(severity.name()));
            row.createCell(1).setCellValue(counts.get(severity));
        }
        r++;
        labelled(sheet, r, "Verdict", report.summaryLine());

        sheet.setColumnWidth(0, 20 * 256);
        sheet.setColumnWidth(1, 60 * 256);
    }

    private int labelled(Sheet sheet, int r, String label, String value) {
        Row row = sheet.createRow(r);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
        return r + 1;
    }

    private void writeFindings(Sheet sheet, AuditReport report, CellStyle bold) {
        Row header = sheet.createRow(0);
        for (int c = 0; c < COLUMNS.size(); c++) {
            header.createCell(c).setCellValue(COLUMNS.get(c));
            header.getCell(c).setCellStyle(bold);
            sheet.setColumnWidth(c, COLUMN_WIDTHS[c] * 256);
        }
        sheet.createFreezePane(0, 1);

        Map<IssueKind, List<Issue>> byKind = new LinkedHashMap<>();
        for (Issue issue : report.issues()) {
            byKind.computeIfAbsent(issue.kind(), k -> new ArrayList<>()).add(issue);
        }

        // summary rows sit above their detail rows
        sheet.setRowSumsBelow(false);
        int r = 1;
        for (Map.Entry<IssueKind, List<Issue>> group : byKind.entrySet()) {
            Row heading = sheet.createRow(r++);
            heading.createCell(0).setCellValue(group.getKey().name() + " (" + group.getValue().size() + ")");
            heading.getCell(0).setCellStyle(bold);

            int first = r;
            for (Issue issue : group.getValue()) {
                Row row = sheet.createRow(r++);
                row.createCell(0).setCellValue(issue.id());
                row.createCell(1).setCellValue(issue.kind().name());
                row.createCell(2).setCellValue(issue.severity().name());
                row.createCell(3).setCellValue(issue.confidence().name());
                row.createCell(4).setCellValue(issue.primaryCell().toString());
                row.createCell(5).setCellValue(issue.message());
                row.createCell(6).setCellValue(issue.explanation().fix());
            }
            sheet.groupRow(first, r - 1);
            sheet.setRowGroupCollapsed(first, true);
        }
    }

    private static CellStyle boldStyle(Workbook workbook) {
        Font font = workbook.createFont();
        font.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(font);
        return style;
    }

    private static String capitalize(String name) {
        return name.charAt(0) + name.substring(1).toLowerCase();
    }
}
