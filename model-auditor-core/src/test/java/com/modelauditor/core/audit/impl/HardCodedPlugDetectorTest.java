package com.modelauditor.core.audit.impl;

import com.modelauditor.core.audit.AuditContexts;
import com.modelauditor.core.audit.DetectorResult;
import com.modelauditor.core.audit.ProjectionRegion;
import com.modelauditor.core.model.CellRecord;
import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.ConfidenceLevel;
import com.modelauditor.core.model.Evidence;
import com.modelauditor.core.model.IssueKind;
import com.modelauditor.core.model.Severity;
import com.modelauditor.core.model.TypedValue;
import com.modelauditor.core.workbook.WorkbookSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link HardCodedPlugDetector}.
 */
class HardCodedPlugDetectorTest {

    private final HardCodedPlugDetector detector = new HardCodedPlugDetector();

    /**
     * Revenue row D2:H2 computes units times price; F2 holds the given literal instead.
     */
    private static WorkbookSnapshot projection(double literalAtF2) {
        WorkbookSnapshot.Builder builder = WorkbookSnapshot.builder("model.xlsx")
            .value("Model", "A1", "USD m")
            .value("Model", "B1", "2022A")
            .value("Model", "C1", "2023A")
            .value("Model", "D1", "2024E")
            .value("Model", "E1", "2025E")
            .value("Model", "F1", "2026E")
            .value("Model", "G1", "2027E")
            .value("Model", "H1", "2028E")
            .value("Model", "A2", "Revenue")
            .value("Model", "B2", 900)
            .value("Model", "C2", 950)
            .value("Model", "A3", "Units");
        double[] units = {100, 110, 121, 133.1, 146.41};
        String[] columns = {"D", "E", "F", "G", "H"};
        for (int i = 0; i < columns.length; i++) {
            builder.value("Model", columns[i] + "3", units[i]);
            if (!"F".equals(columns[i])) {
                builder.formula("Model", columns[i] + "2", columns[i] + "3*10", units[i] * 10);
            }
        }
        return builder.value("Model", "F2", literalAtF2).build();
    }

    @Test
    void detect_literalBreakingTheTrend_isFlaggedOnce() {
        // When
        DetectorResult result = detector.detect(AuditContexts.of(projection(5000)));

        // Then
        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.HARD_CODED_PLUG);
            assertThat(issue.severity()).isEqualTo(Severity.HIGH);
            assertThat(issue.confidence()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(issue.primaryCell()).isEqualTo(CellRef.of("Model", "F2"));
            assertThat(issue.message()).isEqualTo("Hard-coded value 5000 at Model!F2 in a row of 4 projection formulas");
            assertThat(issue.evidence()).extracting(Evidence::cell).containsExactly(
                CellRef.of("Model", "F2"),
                CellRef.of("Model", "D2"), CellRef.of("Model", "E2"),
                CellRef.of("Model", "G2"), CellRef.of("Model", "H2"));
        });
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void detect_literalContinuingTheTrend_isNotFlagged() {
        DetectorResult result = detector.detect(AuditContexts.of(projection(1210)));

        assertThat(result.issues()).isEmpty();
    }

    @Test
    void detect_allLiteralRow_isNeverFlagged() {
        WorkbookSnapshot workbook = WorkbookSnapshot.builder("model.xlsx")
            .value("Model", "B1", "2024E")
            .value("Model", "C1", "2025E")
            .value("Model", "D1", "2026E")
            .value("Model", "B2", 1)
            .value("Model", "C2", 99)
            .value("Model", "D2", -400)
            .build();

        assertThat(detector.detect(AuditContexts.of(workbook)).issues()).isEmpty();
    }

    @Test
    void detect_sheetWithoutPeriodLabels_reportsInfoDiagnostic() {
        WorkbookSnapshot workbook = WorkbookSnapshot.builder("model.xlsx")
            .value("Notes", "A1", "Revenue")
            .value("Notes", "B1", 10)
            .build();

        DetectorResult result = detector.detect(AuditContexts.of(workbook));

        assertThat(result.issues()).isEmpty();
        assertThat(result.diagnostics()).singleElement()
            .satisfies(d -> assertThat(d.message()).isEqualTo("No projection columns recognised on sheet 'Notes'"));
    }

    @Test
    void detect_excludedSheet_isSkipped() {
        WorkbookSnapshot workbook = WorkbookSnapshot.builder("model.xlsx")
            .value("Raw Data", "A1", "Revenue")
            .build();

        assertThat(detector.detect(AuditContexts.of(workbook)).diagnostics()).isEmpty();
    }

    @Test
    void detect_customPolicy_decidesTheRegion() {
        // Given
        WorkbookSnapshot workbook = WorkbookSnapshot.builder("model.xlsx")
            .value("Model", "A1", 1)
            .formula("Model", "B1", "A1*2", 2)
            .formula("Model", "C1", "B1*2", 4)
            .formula("Model", "D1", "C1*2", 8)
            .value("Model", "E1", 3)
            .build();
        HardCodedPlugDetector custom = new HardCodedPlugDetector(
            (snapshot, sheet) -> Optional.of(new ProjectionRegion(sheet, 0, List.of(2, 3, 4, 5))));

        // When
        DetectorResult result = custom.detect(AuditContexts.of(workbook));

        // Then
        assertThat(result.issues()).singleElement()
            .satisfies(issue -> assertThat(issue.primaryCell()).isEqualTo(CellRef.of("Model", "E1")));
    }

    @Test
    void appliesTo_valueOnlyInput_isFalse() {
        WorkbookSnapshot workbook = WorkbookSnapshot.builder("model.csv")
            .formulasAvailable(false)
            .value("model", "A1", 1)
            .build();

        assertThat(detector.appliesTo(AuditContexts.of(workbook))).isFalse();
    }

    @Test
    void predictions_useGrowthAndStepOfNeighbouringFormulas() {
        List<CellRecord> cells = List.of(
            formulaCell("B1", 100),
            formulaCell("C1", 110),
            new CellRecord(CellRef.of("Model", "D1"), TypedValue.number(0), Optional.empty()));

        List<Double> predictions = HardCodedPlugDetector.predictions(cells, 2);

        assertThat(predictions).hasSize(2);
        assertThat(predictions.get(0)).isCloseTo(121.0, within(1e-9));
        assertThat(predictions.get(1)).isCloseTo(120.0, within(1e-9));
    }

    @Test
    void matches_isRelativeToLargerMagnitude() {
        assertThat(HardCodedPlugDetector.matches(1000, 1004, 0.005)).isTrue();
        assertThat(HardCodedPlugDetector.matches(1000, 1010, 0.005)).isFalse();
        assertThat(HardCodedPlugDetector.matches(0, 0, 0.005)).isTrue();
    }

    private static CellRecord formulaCell(String address, double value) {
        return new CellRecord(CellRef.of("Model", address), TypedValue.number(value), Optional.of("=1"));
    }
}
