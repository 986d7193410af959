package com.modelauditor.core.report.impl;

import com.modelauditor.core.report.GeneratedReport;
import com.modelauditor.core.report.ReportFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CsvDatatapeGenerator}.
 */
class CsvDatatapeGeneratorTest {

    private final CsvDatatapeGenerator generator = new CsvDatatapeGenerator();

    @Test
    void generate_writesHeaderAndOneRowPerIssue() {
        GeneratedReport output = generator.generate(ReportFixtures.report());
        String[] lines = output.content().split("\n");

        assertThat(output.fileName()).isEqualTo("audit-datatape.csv");
        assertThat(lines[0]).isEqualTo("id,kind,severity,confidence,sheet,cell,message,evidence_cells,fix");
        assertThat(lines).hasSize(3);
        assertThat(lines[1]).startsWith(ReportFixtures.IMBALANCE_ID + ",BALANCE_SHEET_IMBALANCE,CRITICAL,MEDIUM,"
            + "Balance Sheet,C5,");
    }

    @Test
    void generate_joinsEvidenceCells() {
        String content = generator.generate(ReportFixtures.report()).content();

        assertThat(content).contains(ReportFixtures.PLUG_ID + ",HARD_CODED_PLUG,HIGH,HIGH,Model,F2,");
        assertThat(content).contains("Model!F2 Model!E2");
        assertThat(content).contains("Restore the row formula.");
    }

    @Test
    void generate_cleanReport_writesHeaderOnly() {
        String content = generator.generate(ReportFixtures.clean()).content();

        assertThat(content.trim()).isEqualTo("id,kind,severity,confidence,sheet,cell,message,evidence_cells,fix");
    }
}
