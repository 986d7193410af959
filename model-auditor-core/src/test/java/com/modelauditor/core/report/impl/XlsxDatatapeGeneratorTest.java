package com.modelauditor.core.report.impl;

import com.modelauditor.core.report.GeneratedReport;
import com.modelauditor.core.report.ReportFixtures;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link XlsxDatatapeGenerator}.
 */
class XlsxDatatapeGeneratorTest {

    private final XlsxDatatapeGenerator generator = new XlsxDatatapeGenerator();

    private static Workbook open(GeneratedReport output) throws IOException {
        return new XSSFWorkbook(new ByteArrayInputStream(output.bytes()));
    }

    @Test
    void generate_isBinaryWorkbookWithTwoSheets() throws IOException {
        GeneratedReport output = generator.generate(ReportFixtures.report());

        assertThat(output.isBinary()).isTrue();
        assertThat(output.fileName()).isEqualTo("audit-datatape.xlsx");
        assertThat(output.contentType()).isEqualTo(XlsxDatatapeGenerator.CONTENT_TYPE);
        try (Workbook workbook = open(output)) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(2);
            assertThat(workbook.getSheetName(0)).isEqualTo("Executive Summary");
            assertThat(workbook.getSheetName(1)).isEqualTo("Findings");
        }
    }

    @Test
    void generate_summaryListsScoreAndSeverityCounts() throws IOException {
        try (Workbook workbook = open(generator.generate(ReportFixtures.report()))) {
            Sheet summary = workbook.getSheet("Executive Summary");

            assertThat(summary.getRow(2).getCell(1).getStringCellValue()).isEqualTo("model.xlsx");
            assertThat(summary.getRow(3).getCell(1).getNumericCellValue()).isEqualTo(3.0);
            assertThat(summary.getRow(4).getCell(1).getNumericCellValue()).isEqualTo(2.0);
            assertThat(summary.getRow(5).getCell(0).getStringCellValue()).isEqualTo("Critical");
            assertThat(summary.getRow(5).getCell(1).getNumericCellValue()).isEqualTo(1.0);
            assertThat(summary.getRow(6).getCell(0).getStringCellValue()).isEqualTo("High");
            assertThat(summary.getRow(6).getCell(1).getNumericCellValue()).isEqualTo(1.0);
            assertThat(summary.getRow(7).getCell(1).getNumericCellValue()).isZero();
        }
    }

    @Test
    void generate_findingsAreGroupedByKindAndCollapsed() throws IOException {
        try (Workbook workbook = open(generator.generate(ReportFixtures.report()))) {
            Sheet findings = workbook.getSheet("Findings");

            assertThat(findings.getRow(0).getCell(0).getStringCellValue()).isEqualTo("id");
            assertThat(findings.getRow(0).getCell(6).getStringCellValue()).isEqualTo("fix");

            assertThat(findings.getRow(1).getCell(0).getStringCellValue()).isEqualTo("BALANCE_SHEET_IMBALANCE (1)");
            assertThat(findings.getRow(1).getOutlineLevel()).isZero();
            assertThat(findings.getRow(2).getCell(0).getStringCellValue()).isEqualTo(ReportFixtures.IMBALANCE_ID);
            assertThat(findings.getRow(2).getOutlineLevel()).isEqualTo(1);
            assertThat(findings.getRow(2).getZeroHeight()).isTrue();

            assertThat(findings.getRow(3).getCell(0).getStringCellValue()).isEqualTo("HARD_CODED_PLUG (1)");
            assertThat(findings.getRow(4).getCell(0).getStringCellValue()).isEqualTo(ReportFixtures.PLUG_ID);
            assertThat(findings.getRow(4).getCell(2).getStringCellValue()).isEqualTo("HIGH");
            assertThat(findings.getRow(4).getCell(6).getStringCellValue()).isEqualTo("Restore the row formula.");
            assertThat(findings.getRow(4).getOutlineLevel()).isEqualTo(1);
        }
    }

    @Test
    void generate_cleanReport_hasHeaderOnlyFindings() throws IOException {
        try (Workbook workbook = open(generator.generate(ReportFixtures.clean()))) {
            Sheet findings = workbook.getSheet("Findings");

            assertThat(findings.getLastRowNum()).isZero();
            assertThat(workbook.getSheet("Executive Summary").getRow(10).getCell(1).getStringCellValue())
                .isEqualTo("No structural issues found");
        }
    }
}
