package com.modelauditor.core.workbook;

import com.modelauditor.core.model.CellRef;
import com.modelauditor.core.model.SpreadsheetError;
import com.modelauditor.core.model.TypedValue;
import com.modelauditor.core.model.ValueType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CsvWorkbookLoader}.
 */
class CsvWorkbookLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_csvTable_returnsValueOnlySnapshot() throws IOException {
        // Given
        Path file = tempDir.resolve("financials.csv");
        Files.writeString(file, """
            Item,2023,2024
            Revenue,"1,200",1500
            Margin,12%,TRUE
            Check,#DIV/0!,
            """);

        // When
        WorkbookSnapshot snapshot = new CsvWorkbookLoader().load(file);

        // Then
        assertThat(snapshot.workbookName()).isEqualTo("financials.csv");
        assertThat(snapshot.sheetNames()).containsExactly("financials");
        assertThat(snapshot.formulasAvailable()).isFalse();
        assertThat(snapshot.formulaCells()).isEmpty();
        assertThat(snapshot.valueAt(CellRef.of("financials", "A1"))).isEqualTo(TypedValue.text("Item"));
        assertThat(snapshot.valueAt(CellRef.of("financials", "B1")).asNumber()).hasValue(2023.0);
        assertThat(snapshot.valueAt(CellRef.of("financials", "B2")).asNumber()).hasValue(1200.0);
        assertThat(snapshot.valueAt(CellRef.of("financials", "B3")).asNumber().getAsDouble()).isCloseTo(0.12, within(1e-12));
        assertThat(snapshot.valueAt(CellRef.of("financials", "C3"))).isEqualTo(TypedValue.bool(true));
        assertThat(snapshot.valueAt(CellRef.of("financials", "B4"))).isEqualTo(TypedValue.error(SpreadsheetError.DIV_ZERO));
        assertThat(snapshot.contains(CellRef.of("financials", "C4"))).isFalse();
    }

    @Test
    void load_tsvTable_splitsOnTabs() throws IOException {
        Path file = tempDir.resolve("plan.tsv");
        Files.writeString(file, "Cash\t250\n");

        WorkbookSnapshot snapshot = new CsvWorkbookLoader().load(file);

        assertThat(snapshot.valueAt(CellRef.of("plan", "B1")).asNumber()).hasValue(250.0);
    }

    @Test
    void load_formulaAnalysisRequested_throwsUnsupportedFormat() throws IOException {
        Path file = tempDir.resolve("financials.csv");
        Files.writeString(file, "a,b\n");

        assertThatThrownBy(() -> new CsvWorkbookLoader(true).load(file))
            .isInstanceOf(UnsupportedFormatException.class)
            .hasMessageContaining("only stores values");
    }

    @Test
    void load_missingFile_throwsUnreadable() {
        Path file = tempDir.resolve("absent.csv");

        assertThatThrownBy(() -> new CsvWorkbookLoader().load(file))
            .isInstanceOf(UnreadableWorkbookException.class)
            .satisfies(e -> assertThat(((WorkbookLoadException) e).getSource()).isEqualTo(file));
    }

    @Test
    void parse_classifiesFields() {
        assertThat(CsvWorkbookLoader.parse("  ").isEmpty()).isTrue();
        assertThat(CsvWorkbookLoader.parse("-1.5e3").asNumber()).hasValue(-1500.0);
        assertThat(CsvWorkbookLoader.parse("false")).isEqualTo(TypedValue.bool(false));
        assertThat(CsvWorkbookLoader.parse("Q1 2024").type()).isEqualTo(ValueType.TEXT);
        assertThat(CsvWorkbookLoader.parse("1,2").type()).isEqualTo(ValueType.TEXT);
        assertThat(CsvWorkbookLoader.parse("#N/A")).isEqualTo(TypedValue.error(SpreadsheetError.NA));
    }
}
