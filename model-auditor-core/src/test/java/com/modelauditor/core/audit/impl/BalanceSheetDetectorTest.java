package com.modelauditor.core.audit.impl;

import com.modelauditor.core.audit.AuditContexts;
import com.modelauditor.core.audit.DetectorResult;
import com.modelauditor.core.config.AuditConfig;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ConfidenceLevel;
import com.modelauditor.core.model.DiagnosticLevel;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.Severity;
import com.modelauditor.core.workbook.WorkbookSnapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BalanceSheetDetector}.
 */
class BalanceSheetDetectorTest {

    private final BalanceSheetDetector detector = new BalanceSheetDetector();

    private static WorkbookSnapshot balanceSheet(double equity2024) {
        return WorkbookSnapshot.builder("model.xlsx")
            .value("Balance Sheet", "B1", "FY2023")
            .value("Balance Sheet", "C1", "FY2024")
            .value("Balance Sheet", "A2", "Cash")
            .value("Balance Sheet", "B2", 50)
            .value("Balance Sheet", "C2", 60)
            .value("Balance Sheet", "A5", "Total assets")
            .value("Balance Sheet", "B5", 100)
            .value("Balance Sheet", "C5", 120)
            .value("Balance Sheet", "A8", "Total liabilities")
            .value("Balance Sheet", "B8", 60)
            .value("Balance Sheet", "C8", 70)
            .value("Balance Sheet", "A10", "Total equity")
            .value("Balance Sheet", "B10", 40)
            .value("Balance Sheet", "C10", equity2024)
            .build();
    }

    @Test
    void detect_imbalanceAtTolerance_isAccepted() {
        DetectorResult result = detector.detect(AuditContexts.of(balanceSheet(49)));

        assertThat(result.issues()).isEmpty();
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void detect_imbalanceAboveTolerance_isCritical() {
        // When
        DetectorResult result = detector.detect(AuditContexts.of(balanceSheet(48.99)));

        // Then
        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.BALANCE_SHEET_IMBALANCE);
            assertThat(issue.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(issue.confidence()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(issue.message()).isEqualTo(
                "Balance sheet does not balance in column C (FY2024): assets minus liabilities and equity is 1.01");
            assertThat(issue.evidence()).extracting(Evidence::cell).containsExactly(
                CellRef.of("Balance Sheet", "C5"),
                CellRef.of("Balance Sheet", "C8"),
                CellRef.of("Balance Sheet", "C10"));
        });
    }

    @Test
    void detect_combinedFundingRow_isUsed() {
        WorkbookSnapshot workbook = WorkbookSnapshot.builder("model.xlsx")
            .value("BS", "A3", "Total Assets")
            .value("BS", "B3", 500)
            .value("BS", "A9", "Total Liabilities & Equity")
            .value("BS", "B9", 450)
            .build();

        DetectorResult result = detector.detect(AuditContexts.of(workbook));

        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.message()).endsWith("is 50.00");
            assertThat(issue.evidence()).extracting(Evidence::cell)
                .containsExactly(CellRef.of("BS", "B3"), CellRef.of("BS", "B9"));
        });
    }

    @Test
    void detect_configuredSheetName_overridesSynonyms() {
        WorkbookSnapshot workbook = WorkbookSnapshot.builder("model.xlsx")
            .value("Position", "A1", "Total assets")
            .value("Position", "B1", 10)
            .value("Position", "A2", "Total liabilities and equity")
            .value("Position", "B2", 20)
            .build();
        AuditConfig config = new AuditConfig(null, null, null, null,
            new AuditConfig.BalanceSheetConfig("position", null, null, null, null, null, null, null), null);

        DetectorResult result = detector.detect(AuditContexts.of(workbook, config));

        assertThat(result.issues()).hasSize(1);
    }

    @Test
    void detect_noBalanceSheet_reportsInfoDiagnostic() {
        WorkbookSnapshot workbook = WorkbookSnapshot.builder("model.xlsx")
            .value("P&L", "A1", "Revenue")
            .value("Jobs", "A1", "Headcount")
            .build();

        DetectorResult result = detector.detect(AuditContexts.of(workbook));

        assertThat(result.issues()).isEmpty();
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.level()).isEqualTo(DiagnosticLevel.INFO);
            assertThat(d.message()).startsWith("Balance sheet not found");
        });
    }

    @Test
    void detect_sheetWithoutTotals_reportsInfoDiagnostic() {
        WorkbookSnapshot workbook = WorkbookSnapshot.builder("model.xlsx")
            .value("Balance Sheet", "A1", "Cash")
            .value("Balance Sheet", "B1", 10)
            .build();

        DetectorResult result = detector.detect(AuditContexts.of(workbook));

        assertThat(result.issues()).isEmpty();
        assertThat(result.diagnostics()).singleElement()
            .satisfies(d -> assertThat(d.message()).contains("'Balance Sheet' has no total assets"));
    }

    @Test
    void detect_valueOnlyInput_isStillChecked() {
        WorkbookSnapshot workbook = WorkbookSnapshot.builder("balance.csv")
            .formulasAvailable(false)
            .value("balance", "A1", "Total assets")
            .value("balance", "B1", 100)
            .value("balance", "A2", "Total liabilities and equity")
            .value("balance", "B2", 90)
            .build();

        assertThat(detector.appliesTo(AuditContexts.of(workbook))).isTrue();
        assertThat(detector.detect(AuditContexts.of(workbook)).issues()).hasSize(1);
    }
}
